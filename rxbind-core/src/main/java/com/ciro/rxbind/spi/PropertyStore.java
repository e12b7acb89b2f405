package com.ciro.rxbind.spi;

/**
 * Acceso del host a las propiedades de sus objetos y a su mecanismo de notificación.
 * {@code removeValueChanged} sobre un callback desconocido o un objeto ya liberado
 * no hace nada.
 */
public interface PropertyStore {

    <P> P getValue(Object target, PropertyDescriptor<P> property);

    <P> void setValue(Object target, PropertyDescriptor<P> property, P value);

    void addValueChanged(Object target, PropertyDescriptor<?> property, Runnable callback);

    void removeValueChanged(Object target, PropertyDescriptor<?> property, Runnable callback);
}
