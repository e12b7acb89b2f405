package com.ciro.rxbind.bind;

import java.util.List;

/** Secuencia inmutable de nombres de miembro: {@code User.Address.Street}. */
public final class PropertyPath {

    private final String text;
    private final List<String> segments;

    private PropertyPath(String text, List<String> segments) {
        this.text = text;
        this.segments = segments;
    }

    public static PropertyPath parse(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        String trimmed = path.trim();
        String[] parts = trimmed.split("\\.", -1);
        for (String p : parts) {
            if (p.isBlank()) {
                throw new IllegalArgumentException("path has an empty segment: '" + path + "'");
            }
        }
        return new PropertyPath(trimmed, List.of(parts));
    }

    public List<String> segments() {
        return segments;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PropertyPath other && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
