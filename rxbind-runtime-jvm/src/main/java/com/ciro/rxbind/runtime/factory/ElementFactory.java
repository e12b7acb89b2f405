package com.ciro.rxbind.runtime.factory;

import com.ciro.rxbind.runtime.UiObject;

/** Crea objetos de UI a partir del nombre de tag de la plantilla. */
public interface ElementFactory {

    UiObject create(String tag);

    default boolean supports(String tag) {
        return false;
    }
}
