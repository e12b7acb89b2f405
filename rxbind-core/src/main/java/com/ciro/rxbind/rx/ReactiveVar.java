package com.ciro.rxbind.rx;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Variable reactiva: observable (re-emite su valor actual al suscribirse) y observer
 * a la vez, así que sirve de endpoint para cualquier modo de binding.
 */
public final class ReactiveVar<T> implements Observable<T>, Observer<T> {

    private final ValueType<T> type;
    private T value;
    private final List<Consumer<? super T>> listeners = new CopyOnWriteArrayList<>();

    private final ReentrantLock lock = new ReentrantLock();

    public ReactiveVar(ValueType<T> type, T initial) {
        this.type = type;
        this.value = initial;
    }

    public static <U> ReactiveVar<U> of(ValueType<U> type, U initial) {
        return new ReactiveVar<>(type, initial);
    }

    public T get() { return value; }

    public void set(T newValue) {
        List<Consumer<? super T>> snapshot;

        lock.lock();
        try {
            this.value = newValue;
            snapshot = new ArrayList<>(listeners);
        } finally {
            lock.unlock();
        }

        // Disparamos fuera del lock
        snapshot.forEach(l -> l.accept(newValue));
    }

    public Runnable onChange(Consumer<? super T> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    @Override
    public ValueType<T> elementType() {
        return type;
    }

    @Override
    public Disposable subscribe(Consumer<? super T> onNext) {
        // el replay va bajo el lock: un set concurrente no puede adelantarlo
        lock.lock();
        try {
            listeners.add(onNext);
            onNext.accept(value);
        } finally {
            lock.unlock();
        }
        return Disposable.from(() -> listeners.remove(onNext));
    }

    @Override
    public void onNext(T next) {
        set(next);
    }

    @Override
    public String toString() {
        return "ReactiveVar[" + type + "=" + value + "]";
    }
}
