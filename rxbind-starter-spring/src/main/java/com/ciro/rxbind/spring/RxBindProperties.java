package com.ciro.rxbind.spring;

import com.ciro.rxbind.bind.DirectiveParser;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "rxbind")
public class RxBindProperties {
    /** Palabra clave de la directiva en las plantillas: {bind Path} */
    private String directiveKeyword = DirectiveParser.DEFAULT_KEYWORD;
    /** Nombre del hilo de UI */
    private String uiThreadName = "rxbind-ui";
    /** Tags o atributos desconocidos cortan la carga en vez de loguearse */
    private boolean strictTemplates = true;

    public String getDirectiveKeyword() { return directiveKeyword; }
    public void setDirectiveKeyword(String directiveKeyword) { this.directiveKeyword = directiveKeyword; }

    public String getUiThreadName() { return uiThreadName; }
    public void setUiThreadName(String uiThreadName) { this.uiThreadName = uiThreadName; }

    public boolean isStrictTemplates() { return strictTemplates; }
    public void setStrictTemplates(boolean strictTemplates) { this.strictTemplates = strictTemplates; }
}
