package com.ciro.rxbind.runtime.controls;

import com.ciro.rxbind.runtime.PropertyRegistry;
import com.ciro.rxbind.runtime.UiElement;
import com.ciro.rxbind.rx.ValueType;
import com.ciro.rxbind.spi.PropertyDescriptor;

public class JText extends UiElement {

    public static final PropertyDescriptor<String> TEXT = PropertyRegistry.register(
            PropertyDescriptor.builder("Text", ValueType.TEXT, JText.class).defaultValue("").build());

    public String getText() { return get(TEXT); }
    public void setText(String text) { set(TEXT, text); }
}
