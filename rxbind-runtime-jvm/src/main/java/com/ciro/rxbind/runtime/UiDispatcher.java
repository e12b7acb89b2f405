package com.ciro.rxbind.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * El hilo de UI: un único hilo daemon donde se aplican todas las escrituras a propiedades.
 */
public final class UiDispatcher implements Executor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UiDispatcher.class);

    private final String threadName;
    private final ExecutorService executor;
    private volatile Thread uiThread;

    public UiDispatcher(String threadName) {
        if (threadName == null || threadName.isBlank()) {
            throw new IllegalArgumentException("threadName must not be blank");
        }
        this.threadName = threadName;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            uiThread = t;
            return t;
        });
    }

    public String threadName() {
        return threadName;
    }

    @Override
    public void execute(Runnable command) {
        executor.execute(command);
    }

    public boolean isUiThread() {
        return Thread.currentThread() == uiThread;
    }

    public <T> T invokeAndWait(Callable<T> task) {
        if (isUiThread()) {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException("UI task failed", e);
            }
        }
        try {
            return executor.submit(task).get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw new IllegalStateException("UI task failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the UI thread", e);
        }
    }

    public void invokeAndWait(Runnable task) {
        invokeAndWait(() -> {
            task.run();
            return null;
        });
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("UI thread {} did not stop in time, forcing shutdown", threadName);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
