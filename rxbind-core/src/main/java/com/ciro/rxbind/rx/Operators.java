package com.ciro.rxbind.rx;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

final class Operators {

    private Operators() {}

    static final class Created<T> implements Observable<T> {
        private final ValueType<T> type;
        private final Function<Consumer<? super T>, Disposable> onSubscribe;

        Created(ValueType<T> type, Function<Consumer<? super T>, Disposable> onSubscribe) {
            this.type = Objects.requireNonNull(type, "type must not be null");
            this.onSubscribe = Objects.requireNonNull(onSubscribe, "onSubscribe must not be null");
        }

        @Override
        public ValueType<T> elementType() {
            return type;
        }

        @Override
        public Disposable subscribe(Consumer<? super T> onNext) {
            Disposable d = onSubscribe.apply(Objects.requireNonNull(onNext, "onNext must not be null"));
            return d == null ? Disposable.EMPTY : d;
        }
    }

    static <T> Observable<T> take(Observable<T> source, long count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive: " + count);
        }
        return Observable.create(source.elementType(), downstream -> {
            AtomicLong remaining = new AtomicLong(count);
            AtomicReference<Disposable> upstream = new AtomicReference<>();

            Disposable sub = source.subscribe(v -> {
                long left = remaining.getAndDecrement();
                if (left <= 0) return;
                downstream.accept(v);
                if (left == 1) {
                    Disposable u = upstream.get();
                    if (u != null) u.dispose();
                }
            });
            upstream.set(sub);

            // La fuente pudo completar el cupo durante subscribe (replay síncrono)
            if (remaining.get() <= 0) sub.dispose();
            return sub;
        });
    }

    static <T, R> Observable<R> map(Observable<T> source, ValueType<R> type, Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper must not be null");
        return Observable.create(type, downstream -> source.subscribe(v -> downstream.accept(mapper.apply(v))));
    }

    static <T> Observable<T> filter(Observable<T> source, Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        return Observable.create(source.elementType(), downstream -> source.subscribe(v -> {
            if (predicate.test(v)) downstream.accept(v);
        }));
    }

    static <T> Observable<T> observeOn(Observable<T> source, Executor executor) {
        Objects.requireNonNull(executor, "executor must not be null");
        return Observable.create(source.elementType(), downstream -> {
            SerialExecutor serial = new SerialExecutor(executor);
            AtomicBoolean disposed = new AtomicBoolean(false);

            Disposable sub = source.subscribe(v -> serial.execute(() -> {
                // Lo que quedó en cola tras el dispose no se entrega
                if (!disposed.get()) downstream.accept(v);
            }));

            return Disposable.from(() -> {
                disposed.set(true);
                sub.dispose();
            });
        });
    }
}
