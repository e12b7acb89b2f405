package com.ciro.rxbind.bind;

import com.ciro.rxbind.spi.PropertyDescriptor;

import java.util.Objects;

/** La propiedad concreta (objeto, descriptor) que mantiene una directiva. */
public record TargetSlot<P>(Object target, PropertyDescriptor<P> property) {

    public TargetSlot {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(property, "property must not be null");
    }
}
