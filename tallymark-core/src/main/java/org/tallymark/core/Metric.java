// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base class for all metrics.
 * <p>
 * A metric is identified by its name, unit, description and {@link MetricKind}, all immutable. Concrete
 * metrics hold a value of the kind's native type and call {@link #notifyHooks()} after every mutation of that
 * value. Registered {@link MetricHook}s are then invoked, at most once per hook rate limit interval.
 * <p>
 * The value mutation itself never takes the hook lock, so hooks may update this or other metrics.
 * Hooks can only be added, never removed.
 * <p>
 * Metrics computed from other metrics override {@link #recompute()}, which the registry calls right before
 * rendering. Plain metrics keep the default no-op.
 */
public abstract class Metric {

    private final MetricKind kind;
    private final String name;
    private final String unit;
    private final String description;
    private final TimeSource timeSource;
    private final long hookRateLimitMillis;

    // guarded by itself
    private final List<MetricHook> hooks = new ArrayList<>();
    private volatile boolean hasHooks;
    private volatile long lastHookTime;

    /**
     * Constructor for a metric, reading its identity from the builder. Unset time source defaults to
     * {@link TimeSource#system()}, unset hook rate limit to zero (no limit).
     *
     * @param builder the builder, must not be {@code null}
     */
    protected Metric(@NonNull Builder<?, ?> builder) {
        Objects.requireNonNull(builder, "builder must not be null");
        this.kind = builder.kind();
        this.name = builder.name();
        this.unit = builder.getUnit();
        this.description = builder.getDescription();
        this.timeSource = builder.getTimeSource() != null ? builder.getTimeSource() : TimeSource.system();
        this.hookRateLimitMillis =
                builder.getHookRateLimit() != null ? builder.getHookRateLimit().toMillis() : 0L;
        this.lastHookTime = timeSource.millis();
    }

    /**
     * @return the metric kind, never {@code null}
     */
    @NonNull
    public final MetricKind kind() {
        return kind;
    }

    /**
     * @return the kind label, e.g. {@code UINT}
     */
    @NonNull
    public final String kindName() {
        return kind.label();
    }

    /**
     * @return the metric name, empty for anonymous metrics, never {@code null}
     */
    @NonNull
    public final String name() {
        return name;
    }

    /**
     * @return the metric unit, possibly empty, never {@code null}
     */
    @NonNull
    public final String unit() {
        return unit;
    }

    /**
     * @return the metric description, possibly empty, never {@code null}
     */
    @NonNull
    public final String description() {
        return description;
    }

    /**
     * @return the time source this metric reads for hook rate limiting and derived computations
     */
    @NonNull
    protected final TimeSource timeSource() {
        return timeSource;
    }

    /**
     * @return minimum duration between two hook notifications, zero if notifications are not limited
     */
    @NonNull
    public final Duration hookRateLimit() {
        return Duration.ofMillis(hookRateLimitMillis);
    }

    /**
     * Registers a hook invoked after subsequent updates of this metric.
     *
     * @param hook the hook, must not be {@code null}
     */
    public final void registerHook(@NonNull MetricHook hook) {
        Objects.requireNonNull(hook, "hook must not be null");
        synchronized (hooks) {
            hooks.add(hook);
            hasHooks = true;
        }
    }

    /**
     * Must be called by subclasses after every mutation of the value. Notifies the hooks in registration
     * order if there are any and the hook rate limit has elapsed since the last notification.
     * Without hooks this reads neither the clock nor any lock.
     */
    protected final void notifyHooks() {
        if (!hasHooks) {
            return;
        }
        final long now = timeSource.millis();
        if (hookRateLimitMillis == 0 || now - lastHookTime >= hookRateLimitMillis) {
            synchronized (hooks) {
                for (MetricHook hook : hooks) {
                    hook.onUpdate(this);
                }
                lastHookTime = now;
            }
        }
    }

    /**
     * Refreshes the cached value of a metric computed from other metrics. No-op for plain metrics.
     */
    public void recompute() {}

    /**
     * @return current value formatted for rendering, never {@code null}
     */
    @NonNull
    public abstract String valueAsString();

    /**
     * @return current value as a 64-bit integer
     * @throws MetricCastException if the value of this kind is not numeric
     */
    public long asLong() {
        throw new MetricCastException(this, "long");
    }

    /**
     * @return current value as double
     * @throws MetricCastException if the value of this kind is not numeric
     */
    public double asDouble() {
        throw new MetricCastException(this, "double");
    }

    /**
     * @return current value as boolean
     * @throws MetricCastException if this is not a boolean metric
     */
    public boolean asBoolean() {
        throw new MetricCastException(this, "boolean");
    }

    /**
     * @return current value as string, which for every kind is {@link #valueAsString()}
     */
    @NonNull
    public String asString() {
        return valueAsString();
    }

    @Override
    public String toString() {
        return kind.label() + " metric '" + name + "' = " + valueAsString();
    }

    /**
     * Base builder for all metric kinds. Registries fill in the time source and hook rate limit if they are
     * not set when the builder is registered.
     * <p>
     * Builder is mutable so must not be reused for building multiple metric instances.
     *
     * @param <B> the concrete builder type
     * @param <M> the concrete metric type
     */
    public abstract static class Builder<B extends Builder<B, M>, M extends Metric> {

        private final MetricKind kind;
        private final String name;
        private String unit = "";
        private String description = "";
        private Duration hookRateLimit;
        private TimeSource timeSource;

        /**
         * @param kind the metric kind, must not be {@code null}
         * @param name the metric name, empty for anonymous metrics, must not be {@code null}
         */
        protected Builder(@NonNull MetricKind kind, @NonNull String name) {
            this.kind = Objects.requireNonNull(kind, "kind must not be null");
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        @NonNull
        public final MetricKind kind() {
            return kind;
        }

        @NonNull
        public final String name() {
            return name;
        }

        @NonNull
        public final String getUnit() {
            return unit;
        }

        @NonNull
        public final String getDescription() {
            return description;
        }

        /**
         * @return the hook rate limit, {@code null} if not set
         */
        @Nullable
        public final Duration getHookRateLimit() {
            return hookRateLimit;
        }

        /**
         * @return the time source, {@code null} if not set
         */
        @Nullable
        public final TimeSource getTimeSource() {
            return timeSource;
        }

        /**
         * @param unit the unit, {@code null} is treated as empty
         * @return the builder instance
         */
        @NonNull
        public final B withUnit(@Nullable String unit) {
            this.unit = unit == null ? "" : unit;
            return self();
        }

        /**
         * @param description the description, {@code null} is treated as empty
         * @return the builder instance
         */
        @NonNull
        public final B withDescription(@Nullable String description) {
            this.description = description == null ? "" : description;
            return self();
        }

        /**
         * Sets the minimum duration between two hook notifications. Zero disables limiting.
         *
         * @param hookRateLimit the limit, must not be {@code null} or negative
         * @return the builder instance
         */
        @NonNull
        public final B withHookRateLimit(@NonNull Duration hookRateLimit) {
            Objects.requireNonNull(hookRateLimit, "hook rate limit must not be null");
            if (hookRateLimit.isNegative()) {
                throw new IllegalArgumentException("Hook rate limit must not be negative: " + hookRateLimit);
            }
            this.hookRateLimit = hookRateLimit;
            return self();
        }

        /**
         * @param timeSource the time source, must not be {@code null}
         * @return the builder instance
         */
        @NonNull
        public final B withTimeSource(@NonNull TimeSource timeSource) {
            this.timeSource = Objects.requireNonNull(timeSource, "time source must not be null");
            return self();
        }

        /**
         * Builds the metric. Prefer {@link MetricRegistry#register(Builder)}, which also makes the metric
         * renderable and, for lookup-able kinds, retrievable by name.
         *
         * @return the new metric, never {@code null}
         */
        @NonNull
        public abstract M build();

        @NonNull
        protected abstract B self();
    }
}
