package com.ciro.rxbind.runtime;

import com.ciro.rxbind.rx.Disposable;
import com.ciro.rxbind.spi.PropertyDescriptor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Objeto de UI con propiedades tipadas y notificación de cambios.
 * Vive en el hilo de UI: nada acá está sincronizado.
 */
public abstract class UiObject {

    enum LifecycleState { ALIVE, RELEASED }

    private final Map<PropertyDescriptor<?>, Object> values = new HashMap<>();
    private final Map<PropertyDescriptor<?>, List<Runnable>> callbacks = new HashMap<>();
    private final List<Runnable> releaseCallbacks = new ArrayList<>();
    private final AtomicReference<LifecycleState> _state = new AtomicReference<>(LifecycleState.ALIVE);

    private UiObject logicalParent;
    private String id;

    /* ------------------------------ propiedades ------------------------------ */

    public <P> P get(PropertyDescriptor<P> property) {
        if (values.containsKey(property)) {
            return property.type().cast(values.get(property));
        }
        return unsetValue(property);
    }

    /** Valor cuando no hay valor local: el default resuelto para esta clase. */
    protected <P> P unsetValue(PropertyDescriptor<P> property) {
        return PropertyRegistry.metadata(property, getClass()).defaultValue();
    }

    public <P> void set(PropertyDescriptor<P> property, P value) {
        checkOwner(property);
        P checked = property.type().cast(value);
        P old = get(property);
        values.put(property, checked);
        if (Objects.equals(old, checked)) return;
        raiseChanged(property);
    }

    public boolean hasLocalValue(PropertyDescriptor<?> property) {
        return values.containsKey(property);
    }

    public void clearValue(PropertyDescriptor<?> property) {
        if (!values.containsKey(property)) return;
        Object old = values.remove(property);
        if (!Objects.equals(old, get(property))) raiseChanged(property);
    }

    public void addValueChanged(PropertyDescriptor<?> property, Runnable callback) {
        if (_state.get() == LifecycleState.RELEASED) return;
        callbacks.computeIfAbsent(property, k -> new ArrayList<>()).add(callback);
    }

    public void removeValueChanged(PropertyDescriptor<?> property, Runnable callback) {
        List<Runnable> list = callbacks.get(property);
        if (list == null) return;
        list.remove(callback);
        if (list.isEmpty()) callbacks.remove(property);
    }

    protected int callbackCount(PropertyDescriptor<?> property) {
        List<Runnable> list = callbacks.get(property);
        return list == null ? 0 : list.size();
    }

    protected void raiseChanged(PropertyDescriptor<?> property) {
        List<Runnable> list = callbacks.get(property);
        if (list != null) {
            // snapshot: un callback puede desuscribirse mientras recorremos
            new ArrayList<>(list).forEach(Runnable::run);
        }
        onPropertyChanged(property);
    }

    /** Hook para subclases, después de notificar a los callbacks. */
    protected void onPropertyChanged(PropertyDescriptor<?> property) {
        // por defecto nada
    }

    private void checkOwner(PropertyDescriptor<?> property) {
        if (!property.ownerType().isInstance(this)) {
            throw new IllegalArgumentException(property + " does not apply to " + getClass().getSimpleName());
        }
    }

    /* ------------------------------- árbol ------------------------------- */

    public UiObject getLogicalParent() {
        return logicalParent;
    }

    void _setLogicalParent(UiObject parent) {
        if (this.logicalParent != null && parent != null) {
            throw new IllegalStateException(this + " already has a logical parent");
        }
        this.logicalParent = parent;
    }

    protected List<UiObject> logicalChildren() {
        return List.of();
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    /* ----------------------------- ciclo de vida ----------------------------- */

    public boolean isReleased() {
        return _state.get() == LifecycleState.RELEASED;
    }

    public Disposable onReleased(Runnable callback) {
        if (isReleased()) {
            callback.run();
            return Disposable.EMPTY;
        }
        releaseCallbacks.add(callback);
        return Disposable.from(() -> releaseCallbacks.remove(callback));
    }

    /** Libera en cascada: hijos primero, luego este objeto. */
    public void release() {
        for (UiObject child : new ArrayList<>(logicalChildren())) {
            child.release();
        }
        if (_state.compareAndSet(LifecycleState.ALIVE, LifecycleState.RELEASED)) {
            new ArrayList<>(releaseCallbacks).forEach(Runnable::run);
            releaseCallbacks.clear();
            callbacks.clear();
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + (id == null ? "" : "#" + id);
    }
}
