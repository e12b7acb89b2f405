package com.ciro.rxbind.spi;

import com.ciro.rxbind.rx.Disposable;

import java.util.concurrent.Executor;

/**
 * Todo lo que el motor de bindings necesita del framework de UI que lo aloja.
 */
public interface BindingHost extends PropertyStore, ContextLocator, MetadataProvider {

    /** Contexto de ejecución donde se aplican todas las escrituras a propiedades. */
    Executor uiExecutor();

    /** Avisa una sola vez cuando su dueño libera {@code target}. */
    Disposable onReleased(Object target, Runnable callback);
}
