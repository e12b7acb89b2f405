package com.ciro.rxbind.spi;

public interface ContextLocator {

    /**
     * Devuelve el nodo más cercano (el propio nodo o un ancestro lógico) que lleva
     * DataContext, o null si no hay ninguno.
     */
    ContextHolder findContextSource(Object node);
}
