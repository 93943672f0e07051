package com.liveroom.servicebackend.session;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools shared by all sessions of a process.
 *
 * @param workers backs each session's serial executor and blocking join steps
 * @param pumps   one long-running signaling pump per session
 * @param timers  negotiation timeouts and restart back-off
 */
public record SessionRuntime(
        ExecutorService workers,
        ExecutorService pumps,
        ScheduledExecutorService timers) {

    public static SessionRuntime create() {
        return new SessionRuntime(
                Executors.newCachedThreadPool(daemon("call-worker")),
                Executors.newCachedThreadPool(daemon("signaling-pump")),
                Executors.newScheduledThreadPool(1, daemon("call-timer")));
    }

    public void shutdown() {
        timers.shutdownNow();
        pumps.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(2, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
