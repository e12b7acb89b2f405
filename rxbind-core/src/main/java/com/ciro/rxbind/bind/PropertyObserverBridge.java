package com.ciro.rxbind.bind;

import com.ciro.rxbind.rx.Disposable;
import com.ciro.rxbind.rx.Observable;
import com.ciro.rxbind.spi.PropertyDescriptor;
import com.ciro.rxbind.spi.PropertyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Convierte la notificación de cambios del host en un {@link Observable} de la propiedad.
 * Cada suscripción registra su propio callback y lo quita al hacer dispose.
 */
public final class PropertyObserverBridge {

    private static final Logger log = LoggerFactory.getLogger(PropertyObserverBridge.class);

    private PropertyObserverBridge() {}

    public static <P> Observable<P> observe(PropertyStore store, Object target, PropertyDescriptor<P> property) {
        return Observable.create(property.type(), onNext -> {
            Runnable callback = () -> onNext.accept(store.getValue(target, property));
            store.addValueChanged(target, property, callback);

            return Disposable.from(() -> {
                try {
                    store.removeValueChanged(target, property, callback);
                } catch (RuntimeException e) {
                    // el dispose nunca debe tirar: el target pudo haber muerto
                    log.warn("Could not remove value-changed callback for {} on {}", property, target, e);
                }
            });
        });
    }
}
