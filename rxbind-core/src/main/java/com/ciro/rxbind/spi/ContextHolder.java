package com.ciro.rxbind.spi;

import com.ciro.rxbind.rx.Disposable;

import java.util.function.Consumer;

/** Objeto que lleva un DataContext y avisa cuando lo reemplazan. */
public interface ContextHolder {

    Object getContext();

    /** El handler recibe el contexto nuevo (puede ser null). */
    Disposable onContextChanged(Consumer<Object> handler);
}
