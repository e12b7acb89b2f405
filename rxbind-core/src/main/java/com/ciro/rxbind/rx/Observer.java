package com.ciro.rxbind.rx;

/** Capacidad "observer" de un endpoint: recibe los valores que emite la propiedad. */
public interface Observer<T> {

    /** Tipo exacto que acepta este observer. */
    ValueType<T> elementType();

    void onNext(T value);
}
