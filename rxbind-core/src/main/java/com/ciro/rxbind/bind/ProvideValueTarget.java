package com.ciro.rxbind.bind;

import com.ciro.rxbind.spi.PropertyDescriptor;

/** Lo que el instanciador de plantillas sabe del atributo que está evaluando. */
public record ProvideValueTarget(Object targetObject, PropertyDescriptor<?> targetProperty) {}
