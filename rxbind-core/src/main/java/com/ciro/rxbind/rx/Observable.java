package com.ciro.rxbind.rx;

import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Capacidad "observable" de un endpoint: un stream de valores tipados.
 * Los operadores devuelven streams nuevos; nada se comparte entre suscripciones.
 */
public interface Observable<T> {

    /** Tipo de los elementos que viajan por el stream. */
    ValueType<T> elementType();

    Disposable subscribe(Consumer<? super T> onNext);

    default Disposable subscribe(Observer<? super T> observer) {
        return subscribe(observer::onNext);
    }

    /** Solo los primeros {@code count} elementos; luego suelta la fuente. */
    default Observable<T> take(long count) {
        return Operators.take(this, count);
    }

    default <R> Observable<R> map(ValueType<R> type, Function<? super T, ? extends R> mapper) {
        return Operators.map(this, type, mapper);
    }

    default Observable<T> filter(Predicate<? super T> predicate) {
        return Operators.filter(this, predicate);
    }

    /** Entrega cada elemento en {@code executor}, en orden de llegada. */
    default Observable<T> observeOn(Executor executor) {
        return Operators.observeOn(this, executor);
    }

    static <T> Observable<T> create(ValueType<T> type, Function<Consumer<? super T>, Disposable> onSubscribe) {
        return new Operators.Created<>(type, onSubscribe);
    }
}
