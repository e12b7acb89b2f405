package com.ciro.rxbind.runtime.controls;

import com.ciro.rxbind.runtime.PropertyRegistry;
import com.ciro.rxbind.runtime.UiObject;
import com.ciro.rxbind.rx.ValueType;
import com.ciro.rxbind.spi.PropertyDescriptor;

/**
 * Transformación de rotación. No es un elemento: no tiene DataContext propio, los
 * bindings sobre {@code Angle} usan el del elemento que la contiene.
 */
public class JRotate extends UiObject {

    public static final PropertyDescriptor<Double> ANGLE = PropertyRegistry.register(
            PropertyDescriptor.builder("Angle", ValueType.DOUBLE, JRotate.class).defaultValue(0.0).build());

    public Double getAngle() { return get(ANGLE); }
    public void setAngle(double angle) { set(ANGLE, angle); }
}
