// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tallymark.core.config.RegistryConfig;

/**
 * Creates, stores and renders the metrics of an application.
 * <p>
 * Metric names are unique within a registry, except for the empty name of anonymous metrics. Metrics of
 * lookup-able kinds can be retrieved by name and kind; derived metrics (rate and sum) are only rendered.
 * <p>
 * All registry operations serialize on one lock. Metrics are updated directly through their handles, without
 * touching the registry, so a render observes every metric at some point during the render but not a
 * consistent snapshot across metrics.
 * <p>
 * Rendering visits metrics in ascending name order and recomputes each derived metric right before rendering
 * it. A derived metric therefore sees a dependency's value of the same render only if the dependency's name
 * sorts before its own; otherwise it sees the value computed by the previous render.
 */
public final class MetricRegistry implements Closeable {

    private static final Logger logger = LogManager.getLogger(MetricRegistry.class);

    private static final int NO_INDEX = -1;

    /**
     * Entry of the name map: the metric tagged with its kind, and its index in the store of that kind or
     * {@link #NO_INDEX} if the kind is not lookup-able.
     */
    private record Entry(@NonNull Metric metric, int index) {

        MetricKind kind() {
            return metric.kind();
        }
    }

    private final TimeSource timeSource;
    private final RegistryConfig config;
    private final Supplier<ScheduledExecutorService> executorServiceFactory;

    private final Object lock = new Object();
    // guarded by lock
    private final NavigableMap<String, Entry> entries = new TreeMap<>();
    private final List<Metric> anonymousMetrics = new ArrayList<>();
    private final Map<MetricKind, List<Metric>> stores = new EnumMap<>(MetricKind.class);

    // never taken by the render thread, so a schedule can be stopped while a render waits for the lock
    private final Object scheduleLock = new Object();
    private RenderSchedule renderSchedule;

    private MetricRegistry(@NonNull Builder builder) {
        this.timeSource = builder.timeSource;
        this.config = builder.config;
        final String renderThreadName = builder.config.renderThreadName();
        this.executorServiceFactory = builder.executorServiceFactory != null
                ? builder.executorServiceFactory
                : () -> Executors.newSingleThreadScheduledExecutor(runnable -> {
                    final Thread thread = new Thread(runnable, renderThreadName);
                    thread.setDaemon(true);
                    return thread;
                });
        for (MetricKind kind : MetricKind.values()) {
            if (kind.isLookupable()) {
                stores.put(kind, new ArrayList<>());
            }
        }
    }

    /**
     * @return a new registry builder
     */
    @NonNull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the time source of this registry, passed to metrics and throttles created through it
     */
    @NonNull
    public TimeSource timeSource() {
        return timeSource;
    }

    @NonNull
    public RegistryConfig config() {
        return config;
    }

    /**
     * Builds and registers a metric. The registry's time source and default hook rate limit are applied to the
     * builder unless it sets its own.
     *
     * @param builder the metric builder, must not be {@code null}
     * @param <M>     the metric type
     * @return the registered metric
     * @throws DuplicateMetricException if the name is not empty and already registered
     */
    @NonNull
    public <M extends Metric> M register(@NonNull Metric.Builder<?, M> builder) {
        Objects.requireNonNull(builder, "metric builder must not be null");
        final String name = builder.name();

        synchronized (lock) {
            if (!name.isEmpty() && entries.containsKey(name)) {
                throw new DuplicateMetricException(name);
            }
            if (builder.getTimeSource() == null) {
                builder.withTimeSource(timeSource);
            }
            if (builder.getHookRateLimit() == null) {
                builder.withHookRateLimit(config.defaultHookRateLimit());
            }

            final M metric = builder.build();
            if (name.isEmpty()) {
                anonymousMetrics.add(metric);
                logger.info("Registered anonymous metric of kind {}", metric.kindName());
                return metric;
            }

            int index = NO_INDEX;
            if (metric.kind().isLookupable()) {
                final List<Metric> store = stores.get(metric.kind());
                index = store.size();
                store.add(metric);
            }
            entries.put(name, new Entry(metric, index));
            logger.info("Registered metric: {} of kind {}", name, metric.kindName());
            return metric;
        }
    }

    /**
     * @param name the metric name, must not be {@code null}
     * @return {@code true} if a metric with that name is registered
     */
    public boolean contains(@NonNull String name) {
        Objects.requireNonNull(name, "name must not be null");
        synchronized (lock) {
            return entries.containsKey(name);
        }
    }

    /**
     * @return names of all named metrics in ascending order
     */
    @NonNull
    public List<String> metricNames() {
        synchronized (lock) {
            return List.copyOf(entries.keySet());
        }
    }

    /**
     * Returns the metric registered under the key's name, checking its kind.
     *
     * @param key the metric key, must not be {@code null}
     * @param <M> the metric type
     * @return the metric returned when it was registered
     * @throws MetricNotFoundException       if no metric has that name
     * @throws MetricKindMismatchException   if the metric is of another kind
     * @throws MetricNotLookupableException  if the metric is of a derived kind
     */
    @NonNull
    public <M extends Metric> M lookup(@NonNull MetricKey<M> key) {
        Objects.requireNonNull(key, "metric key must not be null");
        return key.type().cast(lookup(key.kind(), key.name()));
    }

    /**
     * Untyped variant of {@link #lookup(MetricKey)}.
     *
     * @param kind the expected kind, must not be {@code null}
     * @param name the metric name, must not be {@code null}
     * @return the metric
     */
    @NonNull
    public Metric lookup(@NonNull MetricKind kind, @NonNull String name) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
        synchronized (lock) {
            final Entry entry = entries.get(name);
            if (entry == null) {
                throw new MetricNotFoundException(name);
            }
            if (entry.kind() != kind) {
                throw new MetricKindMismatchException(name, entry.kind(), kind);
            }
            if (entry.index() == NO_INDEX) {
                throw new MetricNotLookupableException(name, kind);
            }
            return stores.get(kind).get(entry.index());
        }
    }

    /**
     * Creates a throttle for a metric with the default operation limit of this registry.
     *
     * @see #createThrottle(Throttleable, Duration, long)
     */
    @NonNull
    public <T> T createThrottle(@NonNull Throttleable<T> metric, @NonNull Duration timeLimit) {
        return createThrottle(metric, timeLimit, config.defaultThrottleOpLimit());
    }

    /**
     * Creates a throttle for a metric, reading this registry's time source. The throttle is not thread-safe and
     * must be used by a single thread.
     *
     * @param metric    the metric to throttle, must not be {@code null}
     * @param timeLimit minimum time between two applied updates, must not be {@code null}
     * @param opLimit   only every {@code opLimit}-th update attempt may apply; values below one mean one
     * @param <T>       the throttle type
     * @return the throttle
     */
    @NonNull
    public <T> T createThrottle(@NonNull Throttleable<T> metric, @NonNull Duration timeLimit, long opLimit) {
        Objects.requireNonNull(metric, "metric must not be null");
        return metric.newThrottle(timeSource, timeLimit, opLimit);
    }

    /**
     * Renders all metrics.
     *
     * @see #render(Renderer, String)
     */
    public void render(@NonNull Renderer renderer) throws RenderException {
        render(renderer, "");
    }

    /**
     * Renders every metric whose name starts with the prefix, in ascending name order, recomputing each right
     * before it is rendered. Anonymous metrics are rendered first when the prefix is empty.
     * <p>
     * A failure of {@link Renderer#end()} is not propagated; it is flagged on the renderer instead, see
     * {@link Renderer#hasSuppressedFailure()}. {@code end()} is also called when rendering a metric failed.
     *
     * @param renderer the renderer, must not be {@code null}
     * @param prefix   the name prefix, empty for all metrics, must not be {@code null}
     * @throws RenderException if the renderer fails to begin or to render a metric
     */
    public void render(@NonNull Renderer renderer, @NonNull String prefix) throws RenderException {
        Objects.requireNonNull(renderer, "renderer must not be null");
        Objects.requireNonNull(prefix, "prefix must not be null");

        synchronized (lock) {
            renderer.suppressedFailure(false);
            renderer.begin();
            try {
                if (prefix.isEmpty()) {
                    for (Metric metric : anonymousMetrics) {
                        renderOne(renderer, metric);
                    }
                }
                // names with the prefix form a contiguous range starting at the prefix itself
                for (Map.Entry<String, Entry> entry : entries.tailMap(prefix, true).entrySet()) {
                    if (!entry.getKey().startsWith(prefix)) {
                        break;
                    }
                    renderOne(renderer, entry.getValue().metric());
                }
            } finally {
                endQuietly(renderer);
            }
        }
    }

    private static void renderOne(Renderer renderer, Metric metric) throws RenderException {
        metric.recompute();
        renderer.render(metric);
    }

    private static void endQuietly(Renderer renderer) {
        try {
            renderer.end();
        } catch (RenderException | RuntimeException e) {
            renderer.suppressedFailure(true);
            logger.warn("Suppressed failure of renderer {} while ending a render", renderer.getClass().getName(), e);
        }
    }

    /**
     * Starts rendering all metrics periodically in a background thread, replacing the active schedule if there is
     * one. The first render happens one interval after this call.
     *
     * @param renderer the renderer, must not be {@code null}
     * @param interval time between the end of one render and the start of the next, must be positive
     */
    public void renderSchedule(@NonNull Renderer renderer, @NonNull Duration interval) {
        Objects.requireNonNull(renderer, "renderer must not be null");
        RenderSchedule.checkInterval(interval);
        final RenderSchedule replaced;
        synchronized (scheduleLock) {
            replaced = detachSchedule();
        }
        stopOutsideLock(replaced);
        final RenderSchedule concurrent;
        synchronized (scheduleLock) {
            // a schedule started by another caller since the first detach is replaced as well
            concurrent = detachSchedule();
            renderSchedule = new RenderSchedule(this, renderer, interval, executorServiceFactory);
        }
        stopOutsideLock(concurrent);
    }

    /**
     * Stops the active render schedule, if any, and waits until its thread has finished. Calling it without an
     * active schedule has no effect. A renderer may call it from the render thread, which does not wait.
     */
    public void cancelRenderSchedule() {
        final RenderSchedule cancelled;
        synchronized (scheduleLock) {
            cancelled = detachSchedule();
        }
        stopOutsideLock(cancelled);
    }

    /**
     * @return {@code true} if a render schedule is active
     */
    public boolean hasRenderSchedule() {
        synchronized (scheduleLock) {
            return renderSchedule != null;
        }
    }

    private RenderSchedule detachSchedule() {
        final RenderSchedule detached = renderSchedule;
        renderSchedule = null;
        return detached;
    }

    // stopping waits for the render thread, which may itself need scheduleLock
    private static void stopOutsideLock(RenderSchedule schedule) {
        if (schedule != null) {
            schedule.stop();
        }
    }

    /**
     * Cancels the render schedule. Registered metrics stay usable.
     */
    @Override
    public void close() {
        cancelRenderSchedule();
    }

    /**
     * Builder of {@link MetricRegistry}. All settings are optional.
     */
    public static final class Builder {

        private TimeSource timeSource = TimeSource.system();
        private RegistryConfig config = RegistryConfig.defaults();
        private Supplier<ScheduledExecutorService> executorServiceFactory;

        private Builder() {}

        /**
         * @param timeSource time source for metrics and throttles, must not be {@code null}
         * @return the builder instance
         */
        @NonNull
        public Builder withTimeSource(@NonNull TimeSource timeSource) {
            this.timeSource = Objects.requireNonNull(timeSource, "time source must not be null");
            return this;
        }

        /**
         * @param config registry configuration, must not be {@code null}
         * @return the builder instance
         */
        @NonNull
        public Builder withConfig(@NonNull RegistryConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /**
         * Sets the factory of executors running render schedules. Every schedule takes a new executor from the
         * factory and shuts it down when stopped. Defaults to a single daemon thread executor.
         *
         * @param executorServiceFactory the factory, must not be {@code null}
         * @return the builder instance
         */
        @NonNull
        public Builder withExecutorServiceFactory(@NonNull Supplier<ScheduledExecutorService> executorServiceFactory) {
            this.executorServiceFactory =
                    Objects.requireNonNull(executorServiceFactory, "executor service factory must not be null");
            return this;
        }

        @NonNull
        public MetricRegistry build() {
            return new MetricRegistry(this);
        }
    }
}
