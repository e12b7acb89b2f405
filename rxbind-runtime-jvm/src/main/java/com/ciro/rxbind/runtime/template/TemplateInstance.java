package com.ciro.rxbind.runtime.template;

import com.ciro.rxbind.BindingException;
import com.ciro.rxbind.runtime.UiObject;

import java.util.Collections;
import java.util.Map;

/** Resultado de cargar una plantilla: la raíz y los objetos con id. */
public final class TemplateInstance {

    private final UiObject root;
    private final Map<String, UiObject> byId;

    TemplateInstance(UiObject root, Map<String, UiObject> byId) {
        this.root = root;
        this.byId = Collections.unmodifiableMap(byId);
    }

    public UiObject root() {
        return root;
    }

    public UiObject find(String id) {
        return byId.get(id);
    }

    public <T extends UiObject> T find(String id, Class<T> type) {
        UiObject o = byId.get(id);
        if (o == null) throw new BindingException("No element with id '" + id + "'");
        if (!type.isInstance(o)) {
            throw new BindingException("Element '" + id + "' is a " + o.getClass().getSimpleName()
                    + ", not a " + type.getSimpleName());
        }
        return type.cast(o);
    }

    /** Libera el árbol completo, y con él todos sus bindings. */
    public void release() {
        root.release();
    }
}
