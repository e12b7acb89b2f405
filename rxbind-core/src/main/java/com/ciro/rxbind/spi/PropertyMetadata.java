package com.ciro.rxbind.spi;

/** Metadata de una propiedad resuelta para un dueño concreto. */
public record PropertyMetadata<P>(P defaultValue, boolean bindsTwoWayByDefault, Class<?> ownerType) {}
