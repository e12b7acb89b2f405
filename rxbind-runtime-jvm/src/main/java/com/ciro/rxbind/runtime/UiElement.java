package com.ciro.rxbind.runtime;

import com.ciro.rxbind.rx.Disposable;
import com.ciro.rxbind.rx.ValueType;
import com.ciro.rxbind.spi.ContextHolder;
import com.ciro.rxbind.spi.PropertyDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Objeto de UI que lleva DataContext y puede tener hijos.
 * Un elemento sin DataContext local hereda el de su ancestro elemento más cercano.
 */
public abstract class UiElement extends UiObject implements ContextHolder {

    public static final PropertyDescriptor<Object> DATA_CONTEXT = PropertyRegistry.register(
            PropertyDescriptor.builder("DataContext", ValueType.ANY, UiElement.class).build());

    private final List<UiObject> children = new ArrayList<>();

    public void addChild(UiObject child) {
        child._setLogicalParent(this);
        children.add(child);
        // el hijo ahora hereda nuestro contexto
        if (child instanceof UiElement e && !e.hasLocalValue(DATA_CONTEXT) && getDataContext() != null) {
            e.raiseChanged(DATA_CONTEXT);
        }
    }

    public List<UiObject> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    protected List<UiObject> logicalChildren() {
        return children;
    }

    public Object getDataContext() {
        return get(DATA_CONTEXT);
    }

    public void setDataContext(Object context) {
        set(DATA_CONTEXT, context);
    }

    @Override
    protected <P> P unsetValue(PropertyDescriptor<P> property) {
        if (property == DATA_CONTEXT) {
            UiElement ancestor = nearestElementAncestor();
            if (ancestor != null) return property.type().cast(ancestor.getDataContext());
        }
        return super.unsetValue(property);
    }

    @Override
    protected void onPropertyChanged(PropertyDescriptor<?> property) {
        if (property != DATA_CONTEXT) return;
        for (UiObject child : new ArrayList<>(children)) {
            if (child instanceof UiElement e && !e.hasLocalValue(DATA_CONTEXT)) {
                e.raiseChanged(DATA_CONTEXT);
            }
        }
    }

    private UiElement nearestElementAncestor() {
        UiObject p = getLogicalParent();
        while (p != null && !(p instanceof UiElement)) p = p.getLogicalParent();
        return (UiElement) p;
    }

    /* --------------------------- ContextHolder --------------------------- */

    @Override
    public Object getContext() {
        return getDataContext();
    }

    @Override
    public Disposable onContextChanged(Consumer<Object> handler) {
        Runnable callback = () -> handler.accept(getDataContext());
        addValueChanged(DATA_CONTEXT, callback);
        return Disposable.from(() -> removeValueChanged(DATA_CONTEXT, callback));
    }
}
