package com.ciro.rxbind.spi;

import com.ciro.rxbind.rx.ValueType;

import java.util.Objects;

/**
 * Describe una propiedad tipada y mutable de un objeto de UI.
 * La identidad es la del descriptor: cada registro es único.
 */
public final class PropertyDescriptor<P> {

    private final String name;
    private final ValueType<P> type;
    private final Class<?> ownerType;
    private final P defaultValue;
    private final boolean bindsTwoWayByDefault;

    private PropertyDescriptor(Builder<P> b) {
        this.name = b.name;
        this.type = b.type;
        this.ownerType = b.ownerType;
        this.defaultValue = b.defaultValue;
        this.bindsTwoWayByDefault = b.bindsTwoWayByDefault;
    }

    public static <P> Builder<P> builder(String name, ValueType<P> type, Class<?> ownerType) {
        return new Builder<>(name, type, ownerType);
    }

    public String name()                  { return name; }
    public ValueType<P> type()            { return type; }
    public Class<?> ownerType()           { return ownerType; }
    public P defaultValue()               { return defaultValue; }
    public boolean bindsTwoWayByDefault() { return bindsTwoWayByDefault; }

    /** Metadata declarada por el dueño, sin overrides. */
    public PropertyMetadata<P> metadata() {
        return new PropertyMetadata<>(defaultValue, bindsTwoWayByDefault, ownerType);
    }

    @Override
    public String toString() {
        return ownerType.getSimpleName() + "." + name + ":" + type;
    }

    public static final class Builder<P> {
        private final String name;
        private final ValueType<P> type;
        private final Class<?> ownerType;
        private P defaultValue;
        private boolean bindsTwoWayByDefault;

        private Builder(String name, ValueType<P> type, Class<?> ownerType) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("property name must not be blank");
            }
            this.name = name;
            this.type = Objects.requireNonNull(type, "type must not be null");
            this.ownerType = Objects.requireNonNull(ownerType, "ownerType must not be null");
        }

        public Builder<P> defaultValue(P value) {
            this.defaultValue = value;
            return this;
        }

        public Builder<P> bindsTwoWayByDefault() {
            this.bindsTwoWayByDefault = true;
            return this;
        }

        public PropertyDescriptor<P> build() {
            return new PropertyDescriptor<>(this);
        }
    }
}
