package com.ciro.rxbind.spi;

public interface MetadataProvider {

    /** Por defecto la metadata declarada en el descriptor; el host puede sobreescribirla por dueño. */
    default <P> PropertyMetadata<P> getMetadata(PropertyDescriptor<P> property, Object owner) {
        return property.metadata();
    }
}
