// SPDX-License-Identifier: Apache-2.0
package org.tallymark.metric;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;
import org.tallymark.core.Metric;
import org.tallymark.core.MetricKind;
import org.tallymark.core.NumericMetric;
import org.tallymark.core.NumericType;
import org.tallymark.metric.container.AtomicFloat;

/**
 * Rate of change per second of another numeric metric, the distance.
 * <p>
 * The rate is computed on {@link #recompute()} only, at most once per second: the change of the distance
 * since the previous computation is divided by the elapsed time and passed through the optional proxy
 * function, e.g. to convert bytes per second to bits per second. Between two computations the cached rate is
 * returned. The first computation measures from the moment this metric was constructed.
 */
public final class RateMetric extends Metric implements NumericMetric {

    static final long MIN_CALCULATION_INTERVAL_MILLIS = 1000L;

    private final NumericMetric distance;
    private final DoubleUnaryOperator proxy;
    private final AtomicFloat cache = new AtomicFloat();

    // guarded by this
    private double lastDistance;
    private long lastCalcTime;

    private RateMetric(@NonNull Builder builder) {
        super(builder);
        distance = builder.distance;
        proxy = builder.proxy;
        lastDistance = distance.doubleValue();
        lastCalcTime = timeSource().millis();
    }

    /**
     * @param name     the metric name, must not be {@code null}
     * @param distance the metric whose rate of change is measured, must not be {@code null}
     * @return a new builder
     */
    @NonNull
    public static Builder builder(@NonNull String name, @NonNull NumericMetric distance) {
        return new Builder(name, distance);
    }

    /**
     * @return the cached rate
     */
    public float get() {
        return cache.get();
    }

    /**
     * @return the metric whose rate is measured
     */
    @NonNull
    public NumericMetric distance() {
        return distance;
    }

    /**
     * Applies the proxy function of this metric.
     *
     * @param value a raw rate
     * @return the value as it would be cached, unchanged if there is no proxy
     */
    public float proxyValue(float value) {
        return proxy == null ? value : (float) proxy.applyAsDouble(value);
    }

    @Override
    public void recompute() {
        final float result;
        synchronized (this) {
            final long now = timeSource().millis();
            final long elapsedMillis = now - lastCalcTime;
            if (elapsedMillis < MIN_CALCULATION_INTERVAL_MILLIS) {
                return;
            }
            final double currentDistance = distance.doubleValue();
            // elapsed time is at least one second here, never zero
            result = proxyValue((float) ((currentDistance - lastDistance) / (elapsedMillis / 1000.0)));
            lastDistance = currentDistance;
            lastCalcTime = now;
        }
        cache.set(result);
        notifyHooks();
    }

    @NonNull
    @Override
    public NumericType numericType() {
        return NumericType.FLOAT;
    }

    @Override
    public long longValue() {
        return (long) cache.get();
    }

    @Override
    public double doubleValue() {
        return cache.get();
    }

    @Override
    public long asLong() {
        return longValue();
    }

    @Override
    public double asDouble() {
        return doubleValue();
    }

    @NonNull
    @Override
    public String valueAsString() {
        return NumericType.formatFloat(cache.get());
    }

    public static final class Builder extends Metric.Builder<Builder, RateMetric> {

        private final NumericMetric distance;
        private DoubleUnaryOperator proxy;

        private Builder(@NonNull String name, @NonNull NumericMetric distance) {
            super(MetricKind.RATE, name);
            this.distance = Objects.requireNonNull(distance, "distance must not be null");
        }

        /**
         * @param proxy function applied to every computed rate before it is cached, {@code null} for none
         * @return the builder instance
         */
        @NonNull
        public Builder withProxy(@Nullable DoubleUnaryOperator proxy) {
            this.proxy = proxy;
            return this;
        }

        @NonNull
        @Override
        public RateMetric build() {
            return new RateMetric(this);
        }

        @NonNull
        @Override
        protected Builder self() {
            return this;
        }
    }
}
