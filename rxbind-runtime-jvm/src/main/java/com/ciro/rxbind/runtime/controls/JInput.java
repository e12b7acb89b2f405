package com.ciro.rxbind.runtime.controls;

import com.ciro.rxbind.runtime.PropertyRegistry;
import com.ciro.rxbind.runtime.UiElement;
import com.ciro.rxbind.rx.ValueType;
import com.ciro.rxbind.spi.PropertyDescriptor;

/** Campo de texto editable. {@code Text} se enlaza en dos sentidos por defecto. */
public class JInput extends UiElement {

    public static final PropertyDescriptor<String> TEXT = PropertyRegistry.register(
            PropertyDescriptor.builder("Text", ValueType.TEXT, JInput.class)
                    .defaultValue("")
                    .bindsTwoWayByDefault()
                    .build());

    public static final PropertyDescriptor<String> PLACEHOLDER = PropertyRegistry.register(
            PropertyDescriptor.builder("Placeholder", ValueType.TEXT, JInput.class).defaultValue("").build());

    public String getText() { return get(TEXT); }
    public void setText(String text) { set(TEXT, text); }

    public String getPlaceholder() { return get(PLACEHOLDER); }
    public void setPlaceholder(String placeholder) { set(PLACEHOLDER, placeholder); }

    /** Lo que haría el usuario al tipear. */
    public void type(String text) {
        setText(text);
    }
}
