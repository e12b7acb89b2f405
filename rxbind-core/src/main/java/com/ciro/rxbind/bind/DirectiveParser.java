package com.ciro.rxbind.bind;

import com.ciro.rxbind.BindingException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser del formato declarativo de la directiva en un atributo de plantilla:
 * <pre>
 *   {bind Count}
 *   {bind User.Name, Mode=TwoWay}
 *   {bind Path=User.Name, Mode=OneTime}
 * </pre>
 */
public final class DirectiveParser {

    public static final String DEFAULT_KEYWORD = "bind";

    private final String keyword;
    private final Pattern directive;

    public DirectiveParser() {
        this(DEFAULT_KEYWORD);
    }

    public DirectiveParser(String keyword) {
        if (keyword == null || !keyword.matches("[A-Za-z][\\w-]*")) {
            throw new IllegalArgumentException("Invalid directive keyword: " + keyword);
        }
        this.keyword = keyword;
        this.directive = Pattern.compile("^\\{\\s*" + Pattern.quote(keyword) + "(?:\\s+(.*?))?\\s*}$",
                Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }

    public String keyword() {
        return keyword;
    }

    public boolean isDirective(String attributeValue) {
        return attributeValue != null && directive.matcher(attributeValue.trim()).matches();
    }

    public BindingDirective parse(String attributeValue) {
        if (attributeValue == null) {
            throw new BindingException("Directive text must not be null");
        }
        Matcher m = directive.matcher(attributeValue.trim());
        if (!m.matches()) {
            throw new BindingException("Not a {" + keyword + " ...} directive: " + attributeValue);
        }

        String args = m.group(1) == null ? "" : m.group(1);
        String path = null;
        BindingMode mode = BindingMode.DEFAULT;

        String[] parts = args.isBlank() ? new String[0] : args.split(",", -1);
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i].trim();
            if (part.isEmpty()) {
                throw new BindingException("Empty argument in directive: " + attributeValue);
            }
            int eq = part.indexOf('=');
            if (eq < 0) {
                // solo el primer argumento puede ser posicional
                if (i != 0) throw new BindingException("Unexpected positional argument '" + part + "' in " + attributeValue);
                path = part;
                continue;
            }
            String key = part.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            String value = part.substring(eq + 1).trim();
            switch (key) {
                case "path" -> {
                    if (path != null) throw new BindingException("Path given twice in " + attributeValue);
                    path = value;
                }
                case "mode" -> mode = BindingMode.parse(value);
                default -> throw new BindingException("Unknown directive option '" + key + "' in " + attributeValue);
            }
        }

        if (path == null || path.isBlank()) {
            throw new BindingException("Directive has no path: " + attributeValue);
        }
        try {
            return new BindingDirective(PropertyPath.parse(path), mode);
        } catch (IllegalArgumentException e) {
            throw new BindingException("Invalid path in directive " + attributeValue, e);
        }
    }
}
