package com.ciro.rxbind.bind;

import com.ciro.rxbind.BindingException;

import java.util.Locale;

public enum BindingMode {
    /** Sin fijar: se resuelve con la metadata de la propiedad en el primer setup. */
    DEFAULT,
    ONE_TIME,
    ONE_WAY,
    ONE_WAY_TO_SOURCE,
    TWO_WAY;

    /** endpoint → propiedad */
    public boolean listens() {
        return this == ONE_TIME || this == ONE_WAY || this == TWO_WAY;
    }

    /** propiedad → endpoint */
    public boolean emits() {
        return this == ONE_WAY_TO_SOURCE || this == TWO_WAY;
    }

    /** Acepta "TwoWay", "two_way", "TWO-WAY"... */
    public static BindingMode parse(String text) {
        if (text == null || text.isBlank()) {
            throw new BindingException("Binding mode must not be blank");
        }
        String key = text.trim().replace("_", "").replace("-", "").toUpperCase(Locale.ROOT);
        for (BindingMode m : values()) {
            if (m.name().replace("_", "").equals(key)) return m;
        }
        throw new BindingException("Unknown binding mode '" + text + "'");
    }
}
