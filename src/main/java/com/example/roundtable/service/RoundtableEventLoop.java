package com.example.roundtable.service;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.*;

/**
 * Single thread that owns all room state. WebSocket events, countdown ticks and topic completions
 * are all queued here and run to completion one after another.
 */
@Component
public class RoundtableEventLoop implements Executor {

    private static final Logger log = LoggerFactory.getLogger(RoundtableEventLoop.class);

    private final ScheduledExecutorService loop;

    public RoundtableEventLoop() {
        this(Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "roundtable-loop");
            t.setDaemon(true);
            return t;
        }));
    }

    RoundtableEventLoop(ScheduledExecutorService loop) {
        this.loop = loop;
    }

    /** Scheduler for per-room countdowns; its callbacks run on the loop thread. */
    public ScheduledExecutorService scheduler() {
        return loop;
    }

    /** Queues an event. A failing event is logged and does not affect the ones after it. */
    @Override
    public void execute(Runnable event) {
        try {
            loop.execute(() -> {
                try {
                    event.run();
                } catch (Throwable t) {
                    log.error("Event failed on roundtable loop", t);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Event dropped, loop is shut down: {}", e.toString());
        }
    }

    /** Runs a read on the loop thread and waits for it (HTTP threads use this). */
    public <T> T call(Callable<T> query, Duration timeout) {
        Future<T> f = loop.submit(query);
        try {
            return f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            throw new IllegalStateException("Interrupted while waiting for roundtable loop", e);
        } catch (TimeoutException e) {
            f.cancel(true);
            throw new IllegalStateException("Roundtable loop did not answer within " + timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new IllegalStateException("Roundtable loop query failed", cause);
        }
    }

    @PreDestroy
    public void shutdown() {
        loop.shutdownNow();
        log.info("Roundtable loop stopped");
    }
}
