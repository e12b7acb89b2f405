package com.ciro.rxbind.runtime;

import com.ciro.rxbind.BindingException;
import com.ciro.rxbind.rx.Disposable;
import com.ciro.rxbind.spi.BindingHost;
import com.ciro.rxbind.spi.ContextHolder;
import com.ciro.rxbind.spi.PropertyDescriptor;
import com.ciro.rxbind.spi.PropertyMetadata;

import java.util.Objects;
import java.util.concurrent.Executor;

/** {@link BindingHost} sobre el árbol de {@link UiObject}. */
public class UiBindingHost implements BindingHost {

    private final Executor uiExecutor;

    public UiBindingHost(Executor uiExecutor) {
        this.uiExecutor = Objects.requireNonNull(uiExecutor, "uiExecutor must not be null");
    }

    @Override
    public <P> P getValue(Object target, PropertyDescriptor<P> property) {
        return ui(target).get(property);
    }

    @Override
    public <P> void setValue(Object target, PropertyDescriptor<P> property, P value) {
        ui(target).set(property, value);
    }

    @Override
    public void addValueChanged(Object target, PropertyDescriptor<?> property, Runnable callback) {
        ui(target).addValueChanged(property, callback);
    }

    @Override
    public void removeValueChanged(Object target, PropertyDescriptor<?> property, Runnable callback) {
        if (target instanceof UiObject u) {
            u.removeValueChanged(property, callback);
        }
    }

    /** El propio nodo si es un elemento; si no, el primer ancestro lógico que lo sea. */
    @Override
    public ContextHolder findContextSource(Object node) {
        UiObject current = ui(node);
        while (current != null && !(current instanceof UiElement)) {
            current = current.getLogicalParent();
        }
        return (UiElement) current;
    }

    @Override
    public <P> PropertyMetadata<P> getMetadata(PropertyDescriptor<P> property, Object owner) {
        return PropertyRegistry.metadata(property, owner.getClass());
    }

    @Override
    public Executor uiExecutor() {
        return uiExecutor;
    }

    @Override
    public Disposable onReleased(Object target, Runnable callback) {
        return ui(target).onReleased(callback);
    }

    private static UiObject ui(Object target) {
        if (target instanceof UiObject u) return u;
        throw new BindingException("Not a UI object: " + (target == null ? "null" : target.getClass().getName()));
    }
}
