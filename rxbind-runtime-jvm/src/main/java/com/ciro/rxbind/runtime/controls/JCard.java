package com.ciro.rxbind.runtime.controls;

import com.ciro.rxbind.runtime.PropertyRegistry;
import com.ciro.rxbind.runtime.UiElement;
import com.ciro.rxbind.rx.ValueType;
import com.ciro.rxbind.spi.PropertyDescriptor;

/** Contenedor con título. */
public class JCard extends UiElement {

    public static final PropertyDescriptor<String> TITLE = PropertyRegistry.register(
            PropertyDescriptor.builder("Title", ValueType.TEXT, JCard.class).defaultValue("").build());

    public String getTitle() { return get(TITLE); }
    public void setTitle(String title) { set(TITLE, title); }
}
