package com.ciro.rxbind.bind;

import com.ciro.rxbind.BindingException;
import com.ciro.rxbind.rx.Disposable;
import com.ciro.rxbind.spi.BindingHost;
import com.ciro.rxbind.spi.ContextHolder;
import com.ciro.rxbind.spi.PropertyDescriptor;
import com.ciro.rxbind.spi.PropertyMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Directiva declarativa {@code {bind Path, Mode=...}}.
 *
 * <p>Al instanciarse sobre un atributo captura la propiedad destino, busca el ancestro
 * que lleva el DataContext y, cada vez que ese contexto cambia, vuelve a resolver el
 * path y a cablear las suscripciones. Devuelve enseguida el valor por defecto de la
 * propiedad: nunca espera al primer valor del stream.
 *
 * <p>Se libera sola cuando el host libera el objeto destino.
 */
public final class BindingDirective {

    private static final Logger log = LoggerFactory.getLogger(BindingDirective.class);

    public enum State { UNATTACHED, ATTACHED_NO_ENDPOINT, ATTACHED_BOUND, RELEASED }

    private final PropertyPath path;
    private BindingMode mode;

    private State state = State.UNATTACHED;
    private BindingHost host;
    private SubscriptionDirector<?> director;
    private Disposable contextSubscription = Disposable.EMPTY;
    private Disposable releaseSubscription = Disposable.EMPTY;

    public BindingDirective(PropertyPath path) {
        this(path, BindingMode.DEFAULT);
    }

    public BindingDirective(PropertyPath path, BindingMode mode) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
    }

    public PropertyPath path()  { return path; }
    public BindingMode mode()   { return mode; }
    public State state()        { return state; }

    public Object provideValue(ProvideValueTarget target, BindingHost host) {
        if (state != State.UNATTACHED) {
            throw new IllegalStateException("Directive {" + path + "} is already attached");
        }
        Objects.requireNonNull(target, "target must not be null");
        this.host = Objects.requireNonNull(host, "host must not be null");

        TargetSlot<?> slot = slotOf(target.targetObject(), target.targetProperty());

        ContextHolder source = host.findContextSource(slot.target());
        if (source == null) {
            throw new BindingException("No data-context source found for " + slot.target()
                    + " (binding {" + path + "} on " + slot.property() + ")");
        }

        this.director = new SubscriptionDirector<>(host, slot);
        this.state = State.ATTACHED_NO_ENDPOINT;
        this.contextSubscription = source.onContextChanged(this::onContextChanged);
        this.releaseSubscription = host.onReleased(slot.target(), this::release);

        try {
            setup(source.getContext());
        } catch (RuntimeException e) {
            release();
            throw e;
        }

        return slot.property().defaultValue();
    }

    private static <P> TargetSlot<P> slotOf(Object target, PropertyDescriptor<P> property) {
        return new TargetSlot<>(target, property);
    }

    private void onContextChanged(Object newContext) {
        if (state == State.RELEASED) return;
        director.teardown();
        state = State.ATTACHED_NO_ENDPOINT;
        setup(newContext);
    }

    private void setup(Object context) {
        if (context == null) {
            log.debug("{} has no data context yet", director.slot().target());
            return;
        }

        Object endpoint = PathResolver.resolve(context, path);
        if (endpoint == null) {
            log.debug("Path {} resolved to nothing on {}", path, context.getClass().getName());
            return;
        }

        BindingMode effective = effectiveMode();
        try {
            if (effective.listens()) director.setupListen(endpoint, effective);
            if (effective.emits())   director.setupEmit(endpoint);
        } catch (RuntimeException e) {
            director.teardown();
            throw e;
        }
        state = State.ATTACHED_BOUND;
    }

    // Se resuelve una sola vez y queda fijo
    private BindingMode effectiveMode() {
        if (mode == BindingMode.DEFAULT) {
            TargetSlot<?> slot = director.slot();
            PropertyMetadata<?> metadata = host.getMetadata(slot.property(), slot.target());
            mode = (metadata != null && metadata.bindsTwoWayByDefault()) ? BindingMode.TWO_WAY : BindingMode.ONE_WAY;
        }
        return mode;
    }

    private void release() {
        if (state == State.RELEASED) return;
        state = State.RELEASED;
        if (director != null) director.teardown();
        contextSubscription.dispose();
        releaseSubscription.dispose();
    }

    @Override
    public String toString() {
        return "{bind " + path + (mode == BindingMode.DEFAULT ? "" : ", Mode=" + mode) + "}";
    }
}
