package com.ciro.rxbind.rx;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ReactiveVarTest {

    @Test
    void replaysCurrentValueOnSubscribe() {
        ReactiveVar<Integer> count = ReactiveVar.of(ValueType.INTEGER, 7);
        List<Integer> seen = new ArrayList<>();

        count.subscribe(seen::add);
        count.set(8);

        assertThat(seen).containsExactly(7, 8);
    }

    @Test
    void disposeStopsDeliveryAndIsIdempotent() {
        ReactiveVar<String> name = ReactiveVar.of(ValueType.TEXT, "a");
        List<String> seen = new ArrayList<>();

        Disposable d = name.subscribe(seen::add);
        d.dispose();
        d.dispose();
        name.set("b");

        assertThat(seen).containsExactly("a");
        assertThat(name.listenerCount()).isZero();
    }

    @Test
    void takeReleasesSourceAfterQuota() {
        ReactiveVar<Integer> v = ReactiveVar.of(ValueType.INTEGER, 1);
        List<Integer> seen = new ArrayList<>();

        v.take(1).subscribe(seen::add);
        v.set(2);
        v.set(3);

        assertThat(seen).containsExactly(1);
        assertThat(v.listenerCount()).isZero();
    }

    @Test
    void mapCarriesTheDeclaredType() {
        ReactiveVar<Integer> v = ReactiveVar.of(ValueType.INTEGER, 5);
        Observable<String> text = v.map(ValueType.TEXT, String::valueOf);
        List<String> seen = new ArrayList<>();

        text.subscribe(seen::add);
        v.set(6);

        assertThat(text.elementType()).isEqualTo(ValueType.TEXT);
        assertThat(seen).containsExactly("5", "6");
    }

    @Test
    void observeOnDropsQueuedValuesAfterDispose() {
        List<Runnable> queue = new ArrayList<>();
        ReactiveVar<Integer> v = ReactiveVar.of(ValueType.INTEGER, 1);
        List<Integer> seen = new ArrayList<>();

        Disposable d = v.observeOn(queue::add).subscribe(seen::add);
        v.set(2);
        d.dispose();
        queue.forEach(Runnable::run);

        assertThat(seen).isEmpty();
    }

    @Test
    void actsAsObserver() {
        ReactiveVar<Boolean> flag = ReactiveVar.of(ValueType.BOOLEAN, false);

        Observer<Boolean> observer = flag;
        observer.onNext(true);

        assertThat(flag.get()).isTrue();
        assertThat(observer.elementType()).isEqualTo(ValueType.BOOLEAN);
    }

    @Test
    void replayNeverOvertakesAConcurrentSet() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 5_000; i++) {
                ReactiveVar<Integer> count = ReactiveVar.of(ValueType.INTEGER, 1);
                AtomicReference<Integer> last = new AtomicReference<>();
                CountDownLatch start = new CountDownLatch(1);

                Future<?> subscriber = pool.submit(() -> {
                    start.await();
                    return count.subscribe(last::set);
                });
                Future<?> writer = pool.submit(() -> {
                    start.await();
                    count.set(2);
                    return null;
                });
                start.countDown();
                subscriber.get();
                writer.get();

                assertThat(last.get()).as("iteration %d", i).isEqualTo(2);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
