package com.liveroom.servicebackend.session;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class SerialExecutorTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("Should run tasks one at a time in submission order")
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testSerialOrder() throws Exception {
        SerialExecutor executor = new SerialExecutor(pool);
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(200);

        for (int i = 0; i < 200; i++) {
            int n = i;
            executor.execute(() -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                order.add(n);
                running.decrementAndGet();
                done.countDown();
            });
        }

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(maxRunning.get()).isEqualTo(1);
        for (int i = 0; i < 200; i++) {
            assertThat(order.get(i)).isEqualTo(i);
        }
    }

    @Test
    @DisplayName("Should keep running after a task throws")
    void testFailingTaskDoesNotStall() throws Exception {
        SerialExecutor executor = new SerialExecutor(pool);
        CountDownLatch after = new CountDownLatch(1);

        executor.execute(() -> {
            throw new IllegalStateException("boom");
        });
        executor.execute(after::countDown);

        assertThat(after.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Should run a task submitted from a running task after it")
    void testNestedSubmission() {
        SerialExecutor executor = new SerialExecutor(Runnable::run);
        List<String> order = new ArrayList<>();

        executor.execute(() -> {
            executor.execute(() -> order.add("inner"));
            order.add("outer");
        });

        assertThat(order).containsExactly("outer", "inner");
    }
}
