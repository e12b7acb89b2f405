package com.ciro.rxbind.runtime.template;

import com.ciro.rxbind.BindingException;
import com.ciro.rxbind.bind.BindingDirective;
import com.ciro.rxbind.bind.DirectiveParser;
import com.ciro.rxbind.bind.ProvideValueTarget;
import com.ciro.rxbind.runtime.PropertyRegistry;
import com.ciro.rxbind.runtime.UiElement;
import com.ciro.rxbind.runtime.UiObject;
import com.ciro.rxbind.runtime.factory.ElementFactory;
import com.ciro.rxbind.spi.BindingHost;
import com.ciro.rxbind.spi.PropertyDescriptor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Instancia árboles de UI a partir de markup XML:
 * <pre>
 *   &lt;JCard Title="{bind Title}"&gt;
 *     &lt;JInput id="name" Text="{bind User.Name}"/&gt;
 *     &lt;JCheckBox Checked="{bind Accepted, Mode=OneWay}"/&gt;
 *   &lt;/JCard&gt;
 * </pre>
 * Primero se arma el árbol completo y después se aplican los atributos en pre-orden,
 * así cada directiva encuentra ya a sus ancestros. Debe llamarse en el hilo de UI.
 */
public class TemplateLoader {

    private static final Logger log = LoggerFactory.getLogger(TemplateLoader.class);

    private static final String ID_ATTRIBUTE = "id";

    private final BindingHost host;
    private final ElementFactory factory;
    private final DirectiveParser parser;
    private final boolean strict;

    public TemplateLoader(BindingHost host, ElementFactory factory) {
        this(host, factory, new DirectiveParser(), true);
    }

    public TemplateLoader(BindingHost host, ElementFactory factory, DirectiveParser parser, boolean strict) {
        this.host = Objects.requireNonNull(host, "host must not be null");
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.strict = strict;
    }

    public TemplateInstance load(String markup) {
        return load(markup, null);
    }

    /** Carga la plantilla y, si {@code dataContext} no es null, lo asigna a la raíz. */
    public TemplateInstance load(String markup, Object dataContext) {
        if (markup == null || markup.isBlank()) {
            throw new BindingException("Template markup must not be empty");
        }

        Document doc = Jsoup.parse(markup, "", Parser.xmlParser());
        if (doc.children().size() != 1) {
            throw new BindingException("Template must have exactly one root element, found " + doc.children().size());
        }

        List<Pending> pending = new ArrayList<>();
        UiObject root = build(doc.child(0), pending);
        if (root == null) {
            throw new BindingException("Template root <" + doc.child(0).tagName() + "> could not be created");
        }

        try {
            if (dataContext != null) {
                if (!(root instanceof UiElement e)) {
                    throw new BindingException("Template root " + root + " cannot hold a data context");
                }
                e.setDataContext(dataContext);
            }

            Map<String, UiObject> byId = new LinkedHashMap<>();
            for (Pending p : pending) {
                applyAttributes(p.object(), p.element(), byId);
            }
            log.debug("Loaded template rooted at {} ({} objects)", root, pending.size());
            return new TemplateInstance(root, byId);
        } catch (RuntimeException e) {
            // lo ya enlazado se suelta junto con el árbol
            root.release();
            throw e;
        }
    }

    /* ------------------------------ árbol ------------------------------ */

    private UiObject build(Element el, List<Pending> pending) {
        String tag = el.tagName();
        UiObject obj;
        if (strict || factory.supports(tag)) {
            obj = factory.create(tag);
        } else {
            log.warn("Skipping unknown element <{}> and its content", tag);
            return null;
        }
        pending.add(new Pending(obj, el));

        for (Element childEl : el.children()) {
            if (!(obj instanceof UiElement parent)) {
                throw new BindingException("<" + tag + "> cannot contain child elements");
            }
            UiObject child = build(childEl, pending);
            if (child != null) parent.addChild(child);
        }
        return obj;
    }

    /* ---------------------------- atributos ---------------------------- */

    private void applyAttributes(UiObject obj, Element el, Map<String, UiObject> byId) {
        for (Attribute attr : el.attributes()) {
            String key = attr.getKey();
            String value = attr.getValue();

            if (key.startsWith("xmlns")) continue;

            if (ID_ATTRIBUTE.equalsIgnoreCase(key)) {
                if (byId.putIfAbsent(value, obj) != null) {
                    throw new BindingException("Duplicate id '" + value + "' in template");
                }
                obj.setId(value);
                continue;
            }

            PropertyDescriptor<?> property = PropertyRegistry.find(obj.getClass(), key);
            if (property == null) {
                if (strict) {
                    throw new BindingException("<" + el.tagName() + "> has no property '" + key + "'");
                }
                log.warn("Ignoring unknown attribute {} on <{}>", key, el.tagName());
                continue;
            }

            if (parser.isDirective(value)) {
                applyDirective(obj, property, value);
            } else {
                applyLiteral(obj, property, value);
            }
        }
    }

    private void applyDirective(UiObject obj, PropertyDescriptor<?> property, String text) {
        if (property == UiElement.DATA_CONTEXT) {
            throw new BindingException("DataContext cannot be the target of a binding directive on " + obj);
        }
        BindingDirective directive = parser.parse(text);
        // lo que devuelve es el default del descriptor; la propiedad queda sin valor local
        // y lee el default resuelto para su clase (overrides incluidos)
        directive.provideValue(new ProvideValueTarget(obj, property), host);
    }

    private static <P> void applyLiteral(UiObject obj, PropertyDescriptor<P> property, String raw) {
        obj.set(property, Literals.parse(raw, property.type()));
    }

    private record Pending(UiObject object, Element element) {}
}
