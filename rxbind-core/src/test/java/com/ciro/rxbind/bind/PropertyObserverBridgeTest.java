package com.ciro.rxbind.bind;

import com.ciro.rxbind.rx.Disposable;
import com.ciro.rxbind.rx.Observable;
import com.ciro.rxbind.rx.ValueType;
import com.ciro.rxbind.spi.PropertyDescriptor;
import com.ciro.rxbind.spi.PropertyStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PropertyObserverBridgeTest {

    static final PropertyDescriptor<String> TEXT =
            PropertyDescriptor.builder("Text", ValueType.TEXT, FakeHost.Node.class).defaultValue("").build();

    @Mock
    PropertyStore store;

    @Test
    void emitsCurrentValueOnEachNotification() {
        FakeHost host = new FakeHost();
        FakeHost.Node node = new FakeHost.Node();
        List<String> seen = new ArrayList<>();

        Observable<String> changes = PropertyObserverBridge.observe(host, node, TEXT);
        changes.subscribe(seen::add);
        host.set(node, TEXT, "hola");
        host.set(node, TEXT, "chau");

        assertThat(seen).containsExactly("hola", "chau");
        assertThat(changes.elementType()).isEqualTo(ValueType.TEXT);
    }

    @Test
    void oneCallbackPerSubscriptionAndNothingBeforeSubscribe() {
        FakeHost host = new FakeHost();
        FakeHost.Node node = new FakeHost.Node();
        Observable<String> changes = PropertyObserverBridge.observe(host, node, TEXT);

        assertThat(node.callbackCount(TEXT)).isZero();

        Disposable a = changes.subscribe(v -> {});
        Disposable b = changes.subscribe(v -> {});
        assertThat(node.callbackCount(TEXT)).isEqualTo(2);

        a.dispose();
        b.dispose();
        assertThat(node.callbackCount(TEXT)).isZero();
    }

    @Test
    void disposeRemovesTheSameCallbackOnlyOnce() {
        Object target = new Object();
        Disposable d = PropertyObserverBridge.observe(store, target, TEXT).subscribe(v -> {});

        ArgumentCaptor<Runnable> added = ArgumentCaptor.forClass(Runnable.class);
        verify(store).addValueChanged(eq(target), eq(TEXT), added.capture());

        d.dispose();
        d.dispose();

        verify(store, times(1)).removeValueChanged(target, TEXT, added.getValue());
    }

    @Test
    void disposeNeverThrowsWhenTheTargetIsGone() {
        Object target = new Object();
        doThrow(new IllegalStateException("target destroyed"))
                .when(store).removeValueChanged(eq(target), eq(TEXT), any());

        Disposable d = PropertyObserverBridge.observe(store, target, TEXT).subscribe(v -> {});

        assertThatCode(d::dispose).doesNotThrowAnyException();
    }

    @Test
    void readsTheValueBackFromTheStore() {
        Object target = new Object();
        when(store.getValue(target, TEXT)).thenReturn("leído");
        List<String> seen = new ArrayList<>();

        PropertyObserverBridge.observe(store, target, TEXT).subscribe(seen::add);
        ArgumentCaptor<Runnable> added = ArgumentCaptor.forClass(Runnable.class);
        verify(store).addValueChanged(eq(target), eq(TEXT), added.capture());
        added.getValue().run();

        assertThat(seen).containsExactly("leído");
    }
}
