package com.ciro.rxbind.rx;

import java.util.concurrent.atomic.AtomicBoolean;

/** Handle de una suscripción viva. {@code dispose()} es idempotente. */
@FunctionalInterface
public interface Disposable {

    Disposable EMPTY = () -> {};

    void dispose();

    /** Envuelve una acción de limpieza para que corra una sola vez. */
    static Disposable from(Runnable cleanup) {
        AtomicBoolean done = new AtomicBoolean(false);
        return () -> {
            if (done.compareAndSet(false, true)) {
                cleanup.run();
            }
        };
    }
}
