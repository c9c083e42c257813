// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Renders all metrics of a registry periodically on a dedicated executor until stopped.
 * <p>
 * Each run waits for the interval, then performs a full {@link MetricRegistry#render(Renderer)}. Render failures
 * are logged and do not end the schedule. The executor is owned by the schedule and shut down by {@link #stop()}.
 */
final class RenderSchedule {

    private static final Logger logger = LogManager.getLogger(RenderSchedule.class);

    private final MetricRegistry registry;
    private final Renderer renderer;
    private final ScheduledExecutorService executor;
    private final ScheduledFuture<?> future;

    private volatile Thread worker;
    private final AtomicBoolean stopped = new AtomicBoolean();

    RenderSchedule(
            @NonNull MetricRegistry registry,
            @NonNull Renderer renderer,
            @NonNull Duration interval,
            @NonNull Supplier<ScheduledExecutorService> executorServiceFactory) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        checkInterval(interval);
        this.executor = Objects.requireNonNull(executorServiceFactory.get(), "executor service must not be null");

        final long intervalNanos = interval.toNanos();
        logger.info("Scheduling periodic rendering with interval of {} ms", interval.toMillis());
        future = executor.scheduleWithFixedDelay(this::renderOnce, intervalNanos, intervalNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param interval the render interval
     * @return the interval
     * @throws IllegalArgumentException if the interval is zero or negative
     */
    @NonNull
    static Duration checkInterval(@NonNull Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Render interval must be positive: " + interval);
        }
        return interval;
    }

    private void renderOnce() {
        worker = Thread.currentThread();
        try {
            registry.render(renderer);
        } catch (RenderException | RuntimeException e) {
            logger.error("Error while rendering metrics on schedule", e);
        }
    }

    /**
     * Cancels further renders and waits until a render in progress has finished. Calling it again has no effect.
     * Called from the schedule's own thread, it does not wait.
     */
    void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        future.cancel(false);
        executor.shutdown();

        if (Thread.currentThread() == worker) {
            return;
        }
        boolean interrupted = false;
        while (true) {
            try {
                if (executor.awaitTermination(1, TimeUnit.SECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        logger.info("Stopped periodic rendering");
    }
}
