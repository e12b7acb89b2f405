package com.ciro.rxbind;

/**
 * Error de configuración de un binding: directiva mal formada, sin ancestro con
 * DataContext, endpoint sin capacidad observable, tipos incompatibles...
 * No se reintenta; sube hasta quien instancia la plantilla.
 */
public class BindingException extends RuntimeException {

    public BindingException(String message) {
        super(message);
    }

    public BindingException(String message, Throwable cause) {
        super(message, cause);
    }
}
