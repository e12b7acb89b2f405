package com.ciro.rxbind.runtime.template;

import com.ciro.rxbind.BindingException;
import com.ciro.rxbind.rx.ValueType;

/** Conversión de valores literales de atributos al tipo de la propiedad. */
final class Literals {

    private Literals() {}

    static <P> P parse(String raw, ValueType<P> type) {
        String text = raw.trim();
        try {
            Object value = switch (type.kind()) {
                case TEXT -> raw;
                case BOOLEAN -> parseBoolean(text);
                case INTEGER -> Integer.valueOf(text);
                case LONG -> Long.valueOf(text);
                case DOUBLE -> Double.valueOf(text);
                case OBJECT -> {
                    if (type.javaType() != Object.class) {
                        throw new BindingException("No literal form for " + type + ": '" + raw + "'");
                    }
                    yield raw;
                }
            };
            return type.cast(value);
        } catch (NumberFormatException e) {
            throw new BindingException("Invalid " + type + " literal: '" + raw + "'", e);
        }
    }

    private static Boolean parseBoolean(String text) {
        if ("true".equalsIgnoreCase(text)) return Boolean.TRUE;
        if ("false".equalsIgnoreCase(text)) return Boolean.FALSE;
        throw new BindingException("Invalid BOOLEAN literal: '" + text + "'");
    }
}
