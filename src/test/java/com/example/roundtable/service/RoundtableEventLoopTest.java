package com.example.roundtable.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RoundtableEventLoopTest {

    private final RoundtableEventLoop loop = new RoundtableEventLoop();

    @AfterEach
    void tearDown() {
        loop.shutdown();
    }

    @Test
    void events_runInOrder_onOneThread() throws Exception {
        List<String> threads = new CopyOnWriteArrayList<>();
        List<Integer> order = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(3);
        for (int i = 0; i < 3; i++) {
            int n = i;
            loop.execute(() -> {
                order.add(n);
                threads.add(Thread.currentThread().getName());
                done.countDown();
            });
        }

        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertEquals(List.of(0, 1, 2), order);
        assertTrue(threads.stream().allMatch("roundtable-loop"::equals));
    }

    @Test
    void failingEvent_doesNotStopTheLoop() throws Exception {
        CountDownLatch after = new CountDownLatch(1);
        loop.execute(() -> { throw new IllegalStateException("boom"); });
        loop.execute(after::countDown);
        assertTrue(after.await(2, TimeUnit.SECONDS));
    }

    @Test
    void call_returnsValue_andRethrowsRuntimeFailures() {
        Integer answer = loop.call(() -> 42, Duration.ofSeconds(2));
        assertEquals(42, answer);
        assertThrows(IllegalArgumentException.class,
                () -> loop.call(() -> { throw new IllegalArgumentException("bad"); }, Duration.ofSeconds(2)));
    }

    @Test
    void execute_afterShutdown_isDroppedQuietly() {
        loop.shutdown();
        assertDoesNotThrow(() -> loop.execute(() -> { }));
    }
}
