package com.ciro.rxbind.rx;

import java.util.Objects;

/**
 * Etiqueta del tipo de valor que viaja por un {@link Observable} o que acepta un
 * {@link Observer} / una propiedad. Conjunto cerrado de categorías: el puente entre
 * el tipo del stream y el tipo de la propiedad se decide comparando etiquetas,
 * nunca inspeccionando genéricos en runtime.
 */
public final class ValueType<T> {

    public enum Kind { TEXT, BOOLEAN, INTEGER, LONG, DOUBLE, OBJECT }

    public static final ValueType<String>  TEXT    = new ValueType<>(Kind.TEXT, String.class);
    public static final ValueType<Boolean> BOOLEAN = new ValueType<>(Kind.BOOLEAN, Boolean.class);
    public static final ValueType<Integer> INTEGER = new ValueType<>(Kind.INTEGER, Integer.class);
    public static final ValueType<Long>    LONG    = new ValueType<>(Kind.LONG, Long.class);
    public static final ValueType<Double>  DOUBLE  = new ValueType<>(Kind.DOUBLE, Double.class);
    public static final ValueType<Object>  ANY     = new ValueType<>(Kind.OBJECT, Object.class);

    private final Kind kind;
    private final Class<T> javaType;

    private ValueType(Kind kind, Class<T> javaType) {
        this.kind = kind;
        this.javaType = javaType;
    }

    /**
     * Devuelve la etiqueta canónica para una clase. Primitivos y wrappers caen en su
     * categoría; cualquier otra clase es {@link Kind#OBJECT}.
     */
    @SuppressWarnings("unchecked")
    public static <T> ValueType<T> of(Class<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        if (type == String.class) return (ValueType<T>) TEXT;
        if (type == Boolean.class || type == boolean.class) return (ValueType<T>) BOOLEAN;
        if (type == Integer.class || type == int.class) return (ValueType<T>) INTEGER;
        if (type == Long.class || type == long.class) return (ValueType<T>) LONG;
        if (type == Double.class || type == double.class) return (ValueType<T>) DOUBLE;
        if (type == Object.class) return (ValueType<T>) ANY;
        if (type.isPrimitive()) {
            throw new IllegalArgumentException("Unsupported primitive value type: " + type);
        }
        return new ValueType<>(Kind.OBJECT, type);
    }

    public Kind kind()          { return kind; }
    public Class<T> javaType()  { return javaType; }
    public boolean isText()     { return kind == Kind.TEXT; }

    /** true si un valor de {@code other} se puede escribir tal cual en este tipo. */
    public boolean accepts(ValueType<?> other) {
        return javaType.isAssignableFrom(other.javaType);
    }

    public T cast(Object value) {
        return javaType.cast(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValueType<?> other)) return false;
        return kind == other.kind && javaType == other.javaType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, javaType);
    }

    @Override
    public String toString() {
        return kind == Kind.OBJECT ? "OBJECT<" + javaType.getSimpleName() + ">" : kind.name();
    }
}
