package com.ciro.rxbind.bind;

import com.ciro.rxbind.BindingException;
import com.ciro.rxbind.rx.Disposable;
import com.ciro.rxbind.rx.Observable;
import com.ciro.rxbind.rx.Observer;
import com.ciro.rxbind.rx.ValueType;
import com.ciro.rxbind.spi.BindingHost;
import com.ciro.rxbind.spi.PropertyDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedList;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Executor;

/**
 * Dueño del par de suscripciones (listen, emit) de una directiva.
 * Nunca hay más de una de cada tipo viva; {@link #teardown()} suelta las dos juntas.
 */
public final class SubscriptionDirector<P> {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionDirector.class);

    private final BindingHost host;
    private final TargetSlot<P> slot;
    private final Executor uiExecutor;

    private Disposable listenSubscription;
    private Disposable emitSubscription;

    /** true mientras escribimos un valor que vino del endpoint */
    private boolean writing;

    /** valores enviados al endpoint cuyo eco todavía no volvió (admite null) */
    private final Queue<P> pendingEchoes = new LinkedList<>();

    public SubscriptionDirector(BindingHost host, TargetSlot<P> slot) {
        this.host = Objects.requireNonNull(host, "host must not be null");
        this.slot = Objects.requireNonNull(slot, "slot must not be null");
        this.uiExecutor = Objects.requireNonNull(host.uiExecutor(), "host.uiExecutor() must not be null");
    }

    public TargetSlot<P> slot() {
        return slot;
    }

    public boolean isListening() { return listenSubscription != null; }
    public boolean isEmitting()  { return emitSubscription != null; }

    /* ------------------------------ listen ------------------------------ */

    public void setupListen(Object endpoint, BindingMode mode) {
        if (listenSubscription != null) {
            throw new IllegalStateException("Listen subscription already active for " + slot.property() + "; call teardown() first");
        }
        if (!(endpoint instanceof Observable<?> source)) {
            throw new BindingException("Endpoint " + describe(endpoint) + " bound to " + slot.property()
                    + " exposes no observable capability (mode " + mode + ")");
        }
        listenSubscription = listen(source, mode);
    }

    private <T> Disposable listen(Observable<T> source, BindingMode mode) {
        Observable<T> stream = (mode == BindingMode.ONE_TIME) ? source.take(1) : source;
        return adapt(stream).observeOn(uiExecutor).subscribe(this::write);
    }

    private <T> Observable<P> adapt(Observable<T> stream) {
        ValueType<P> slotType = slot.property().type();
        ValueType<T> elementType = stream.elementType();

        // ToString automático
        if (slotType.isText() && !elementType.isText()) {
            return stream.map(slotType, v -> slotType.cast(v == null ? null : String.valueOf(v)));
        }
        if (!slotType.accepts(elementType)) {
            throw new BindingException("Cannot bind a stream of " + elementType + " to " + slot.property());
        }
        return stream.map(slotType, slotType::cast);
    }

    private void write(P value) {
        if (!pendingEchoes.isEmpty()) {
            if (Objects.equals(pendingEchoes.peek(), value)) {
                pendingEchoes.poll();
                return;
            }
            // el endpoint cambió por su cuenta: su valor manda
            pendingEchoes.clear();
        }
        if (Objects.equals(host.getValue(slot.target(), slot.property()), value)) {
            return;
        }
        writing = true;
        try {
            host.setValue(slot.target(), slot.property(), value);
        } finally {
            writing = false;
        }
    }

    /* ------------------------------- emit ------------------------------- */

    public void setupEmit(Object endpoint) {
        if (emitSubscription != null) {
            throw new IllegalStateException("Emit subscription already active for " + slot.property() + "; call teardown() first");
        }
        PropertyDescriptor<P> property = slot.property();

        if (!(endpoint instanceof Observer<?> observer)) {
            log.debug("Endpoint {} is not an observer; {} will not emit", describe(endpoint), property);
            return;
        }
        if (!observer.elementType().equals(property.type())) {
            log.debug("Observer of {} does not accept {}; emit not wired", observer.elementType(), property);
            return;
        }
        if (!property.ownerType().isInstance(slot.target())) {
            log.debug("{} is not a {}; emit not wired", slot.target(), property.ownerType().getName());
            return;
        }

        @SuppressWarnings("unchecked") // etiquetas iguales ⇒ mismo tipo de elemento
        Observer<P> typed = (Observer<P>) observer;

        emitSubscription = PropertyObserverBridge.observe(host, slot.target(), property)
                .filter(v -> !writing)
                .subscribe(v -> forward(typed, v));
    }

    private void forward(Observer<P> observer, P value) {
        // antes de onNext: con un executor directo el eco vuelve adentro de la llamada
        if (listenSubscription != null) pendingEchoes.add(value);
        observer.onNext(value);
    }

    /* ----------------------------- teardown ----------------------------- */

    public void teardown() {
        Disposable listen = listenSubscription;
        Disposable emit = emitSubscription;
        listenSubscription = null;
        emitSubscription = null;
        pendingEchoes.clear();

        if (listen != null) listen.dispose();
        if (emit != null) emit.dispose();
    }

    private static String describe(Object endpoint) {
        return endpoint == null ? "null" : endpoint.getClass().getName();
    }
}
