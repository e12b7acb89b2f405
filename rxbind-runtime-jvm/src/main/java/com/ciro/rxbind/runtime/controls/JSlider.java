package com.ciro.rxbind.runtime.controls;

import com.ciro.rxbind.runtime.PropertyRegistry;
import com.ciro.rxbind.runtime.UiElement;
import com.ciro.rxbind.rx.ValueType;
import com.ciro.rxbind.spi.PropertyDescriptor;

public class JSlider extends UiElement {

    public static final PropertyDescriptor<Double> VALUE = PropertyRegistry.register(
            PropertyDescriptor.builder("Value", ValueType.DOUBLE, JSlider.class)
                    .defaultValue(0.0)
                    .bindsTwoWayByDefault()
                    .build());

    public static final PropertyDescriptor<Double> MINIMUM = PropertyRegistry.register(
            PropertyDescriptor.builder("Minimum", ValueType.DOUBLE, JSlider.class).defaultValue(0.0).build());

    public static final PropertyDescriptor<Double> MAXIMUM = PropertyRegistry.register(
            PropertyDescriptor.builder("Maximum", ValueType.DOUBLE, JSlider.class).defaultValue(100.0).build());

    public Double getValue() { return get(VALUE); }

    // sin clamp: el rango es informativo, como en el control nativo
    public void setValue(double value) { set(VALUE, value); }

    public Double getMinimum() { return get(MINIMUM); }
    public Double getMaximum() { return get(MAXIMUM); }
}
