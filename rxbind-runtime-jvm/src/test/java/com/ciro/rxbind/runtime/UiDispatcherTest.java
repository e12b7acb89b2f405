package com.ciro.rxbind.runtime;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UiDispatcherTest {

    private final UiDispatcher ui = new UiDispatcher("test-ui");

    @AfterEach
    void close() {
        ui.close();
    }

    @Test
    void tasksRunOnTheNamedThread() throws Exception {
        AtomicReference<String> name = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        ui.execute(() -> {
            name.set(Thread.currentThread().getName());
            done.countDown();
        });

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(name.get()).isEqualTo("test-ui");
        assertThat(ui.threadName()).isEqualTo("test-ui");
    }

    @Test
    void invokeAndWaitReturnsTheResult() {
        assertThat(ui.invokeAndWait(() -> ui.isUiThread())).isTrue();
        assertThat(ui.isUiThread()).isFalse();
    }

    @Test
    void invokeAndWaitIsReentrantOnTheUiThread() {
        int value = ui.invokeAndWait(() -> ui.invokeAndWait(() -> 42));

        assertThat(value).isEqualTo(42);
    }

    @Test
    void runtimeFailuresAreRethrownAsIs() {
        assertThatThrownBy(() -> ui.invokeAndWait((Runnable) () -> {
            throw new IllegalArgumentException("boom");
        })).isInstanceOf(IllegalArgumentException.class).hasMessage("boom");
    }

    @Test
    void blankNameIsRejected() {
        assertThatThrownBy(() -> new UiDispatcher(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
