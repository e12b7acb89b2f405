package com.ciro.rxbind.runtime;

import com.ciro.rxbind.spi.PropertyDescriptor;
import com.ciro.rxbind.spi.PropertyMetadata;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registro global de propiedades por clase dueña, y de overrides de metadata por subclase.
 * Las clases de UI registran sus descriptores en campos {@code static final}.
 */
public final class PropertyRegistry {

    // dueño -> (nombre en minúsculas -> descriptor)
    private static final Map<Class<?>, Map<String, PropertyDescriptor<?>>> byOwner = new ConcurrentHashMap<>();

    // descriptor -> (subclase -> metadata)
    private static final Map<PropertyDescriptor<?>, Map<Class<?>, PropertyMetadata<?>>> overrides = new ConcurrentHashMap<>();

    private PropertyRegistry() {}

    public static <P> PropertyDescriptor<P> register(PropertyDescriptor<P> property) {
        Map<String, PropertyDescriptor<?>> props = byOwner.computeIfAbsent(property.ownerType(), k -> new ConcurrentHashMap<>());
        PropertyDescriptor<?> previous = props.putIfAbsent(key(property.name()), property);
        if (previous != null) {
            throw new IllegalStateException("Property " + property.name() + " already registered on "
                    + property.ownerType().getName());
        }
        return property;
    }

    /** Busca por nombre (sin distinguir mayúsculas) subiendo por la jerarquía de {@code type}. */
    public static PropertyDescriptor<?> find(Class<?> type, String name) {
        String k = key(name);
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            initialize(c);
            Map<String, PropertyDescriptor<?>> props = byOwner.get(c);
            if (props == null) continue;
            PropertyDescriptor<?> p = props.get(k);
            if (p != null) return p;
        }
        return null;
    }

    public static <P> void overrideMetadata(PropertyDescriptor<P> property, Class<?> owner, PropertyMetadata<P> metadata) {
        if (!property.ownerType().isAssignableFrom(owner)) {
            throw new IllegalArgumentException(owner.getName() + " does not own " + property);
        }
        overrides.computeIfAbsent(property, k -> new ConcurrentHashMap<>()).put(owner, metadata);
    }

    /** Override más cercano en la jerarquía de {@code ownerClass}, o la metadata declarada. */
    @SuppressWarnings("unchecked")
    public static <P> PropertyMetadata<P> metadata(PropertyDescriptor<P> property, Class<?> ownerClass) {
        Map<Class<?>, PropertyMetadata<?>> byClass = overrides.get(property);
        if (byClass != null) {
            for (Class<?> c = ownerClass; c != null && c != Object.class; c = c.getSuperclass()) {
                PropertyMetadata<?> m = byClass.get(c);
                if (m != null) return (PropertyMetadata<P>) m;
            }
        }
        return property.metadata();
    }

    // los descriptores se registran en el inicializador estático de cada clase
    private static void initialize(Class<?> type) {
        try {
            Class.forName(type.getName(), true, type.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("Cannot initialize " + type.getName(), e);
        }
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
