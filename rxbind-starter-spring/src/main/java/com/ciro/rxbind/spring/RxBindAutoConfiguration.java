package com.ciro.rxbind.spring;

import com.ciro.rxbind.bind.DirectiveParser;
import com.ciro.rxbind.runtime.UiBindingHost;
import com.ciro.rxbind.runtime.UiDispatcher;
import com.ciro.rxbind.runtime.factory.DefaultElementFactory;
import com.ciro.rxbind.runtime.factory.ElementFactory;
import com.ciro.rxbind.runtime.template.TemplateLoader;
import com.ciro.rxbind.spi.BindingHost;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(RxBindProperties.class)
public class RxBindAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public UiDispatcher uiDispatcher(RxBindProperties props) {
        return new UiDispatcher(props.getUiThreadName());
    }

    @Bean
    @ConditionalOnMissingBean(BindingHost.class)
    public UiBindingHost uiBindingHost(UiDispatcher dispatcher) {
        return new UiBindingHost(dispatcher);
    }

    @Bean
    @ConditionalOnMissingBean
    public ElementFactory elementFactory() {
        return new DefaultElementFactory();
    }

    @Bean
    @ConditionalOnMissingBean
    public DirectiveParser directiveParser(RxBindProperties props) {
        return new DirectiveParser(props.getDirectiveKeyword());
    }

    @Bean
    @ConditionalOnMissingBean
    public TemplateLoader templateLoader(BindingHost host, ElementFactory factory,
                                         DirectiveParser parser, RxBindProperties props) {
        return new TemplateLoader(host, factory, parser, props.isStrictTemplates());
    }
}
