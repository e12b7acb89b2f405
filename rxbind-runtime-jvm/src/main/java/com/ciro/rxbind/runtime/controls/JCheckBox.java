package com.ciro.rxbind.runtime.controls;

import com.ciro.rxbind.runtime.PropertyRegistry;
import com.ciro.rxbind.runtime.UiElement;
import com.ciro.rxbind.rx.ValueType;
import com.ciro.rxbind.spi.PropertyDescriptor;

public class JCheckBox extends UiElement {

    public static final PropertyDescriptor<Boolean> CHECKED = PropertyRegistry.register(
            PropertyDescriptor.builder("Checked", ValueType.BOOLEAN, JCheckBox.class)
                    .defaultValue(false)
                    .bindsTwoWayByDefault()
                    .build());

    public static final PropertyDescriptor<String> LABEL = PropertyRegistry.register(
            PropertyDescriptor.builder("Label", ValueType.TEXT, JCheckBox.class).defaultValue("").build());

    public boolean isChecked() { return Boolean.TRUE.equals(get(CHECKED)); }
    public void setChecked(boolean checked) { set(CHECKED, checked); }

    public String getLabel() { return get(LABEL); }
    public void setLabel(String label) { set(LABEL, label); }

    public void toggle() {
        setChecked(!isChecked());
    }
}
