package com.ciro.rxbind.runtime.factory;

import com.ciro.rxbind.BindingException;
import com.ciro.rxbind.runtime.UiObject;
import com.ciro.rxbind.runtime.controls.JCard;
import com.ciro.rxbind.runtime.controls.JCheckBox;
import com.ciro.rxbind.runtime.controls.JInput;
import com.ciro.rxbind.runtime.controls.JRotate;
import com.ciro.rxbind.runtime.controls.JSlider;
import com.ciro.rxbind.runtime.controls.JText;

import java.lang.reflect.Constructor;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Tags conocidos por nombre corto (sin distinguir mayúsculas) y, si el tag contiene
 * un punto, nombre de clase completo con constructor sin argumentos.
 */
public class DefaultElementFactory implements ElementFactory {

    private final Map<String, Supplier<? extends UiObject>> tags = new ConcurrentHashMap<>();

    public DefaultElementFactory() {
        register("JCard", JCard::new);
        register("JText", JText::new);
        register("JInput", JInput::new);
        register("JCheckBox", JCheckBox::new);
        register("JSlider", JSlider::new);
        register("JRotate", JRotate::new);
    }

    public DefaultElementFactory register(String tag, Supplier<? extends UiObject> supplier) {
        if (tag == null || tag.isBlank()) throw new IllegalArgumentException("tag must not be blank");
        tags.put(key(tag), supplier);
        return this;
    }

    @Override
    public boolean supports(String tag) {
        return tag != null && (tags.containsKey(key(tag)) || tag.contains("."));
    }

    @Override
    public UiObject create(String tag) {
        if (tag == null) throw new IllegalArgumentException("tag cannot be null");

        Supplier<? extends UiObject> supplier = tags.get(key(tag));
        if (supplier != null) return supplier.get();

        if (tag.contains(".")) return instantiate(tag);

        throw new BindingException("Unknown element tag: " + tag);
    }

    private static UiObject instantiate(String className) {
        Class<?> type;
        try {
            type = Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new BindingException("Unknown element class: " + className, e);
        }
        if (!UiObject.class.isAssignableFrom(type)) {
            throw new BindingException(className + " is not a UiObject");
        }
        try {
            Constructor<?> ctor = type.getDeclaredConstructor();
            if (!ctor.canAccess(null)) {
                ctor.setAccessible(true);
            }
            return (UiObject) ctor.newInstance();
        } catch (NoSuchMethodException e) {
            throw new BindingException("No-arg constructor not found for element: " + className, e);
        } catch (ReflectiveOperationException e) {
            throw new BindingException("Failed to instantiate element: " + className, e);
        }
    }

    private static String key(String tag) {
        return tag.toLowerCase(Locale.ROOT);
    }
}
