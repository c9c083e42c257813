// SPDX-License-Identifier: Apache-2.0
package org.tallymark.metric;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import org.tallymark.core.Metric;
import org.tallymark.core.MetricKey;
import org.tallymark.core.MetricKind;
import org.tallymark.core.NumericMetric;
import org.tallymark.core.NumericType;
import org.tallymark.core.Throttleable;
import org.tallymark.core.TimeSource;
import org.tallymark.metric.container.AtomicFloat;
import org.tallymark.throttle.FloatThrottle;

/**
 * 32-bit floating point metric, rendered with two fraction digits.
 */
public final class FloatMetric extends Metric implements NumericMetric, Throttleable<FloatThrottle> {

    private final AtomicFloat value;

    private FloatMetric(@NonNull Builder builder) {
        super(builder);
        value = new AtomicFloat(builder.initialValue);
    }

    /**
     * @param name the metric name, must not be {@code null}
     * @return key for looking the metric up in a registry
     */
    @NonNull
    public static MetricKey<FloatMetric> key(@NonNull String name) {
        return new MetricKey<>(name, MetricKind.FLOAT, FloatMetric.class);
    }

    /**
     * @param name the metric name, must not be {@code null}
     * @return a new builder
     */
    @NonNull
    public static Builder builder(@NonNull String name) {
        return new Builder(name);
    }

    public float get() {
        return value.get();
    }

    public void set(float newValue) {
        value.set(newValue);
        notifyHooks();
    }

    /**
     * @param delta value to add
     * @return the updated value
     */
    public float add(float delta) {
        final float result = value.addAndGet(delta);
        notifyHooks();
        return result;
    }

    /**
     * @param delta value to subtract
     * @return the updated value
     */
    public float subtract(float delta) {
        return add(-delta);
    }

    @NonNull
    @Override
    public NumericType numericType() {
        return NumericType.FLOAT;
    }

    @Override
    public long longValue() {
        return (long) value.get();
    }

    @Override
    public double doubleValue() {
        return value.get();
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
        return NumericType.formatFloat(value.get());
    }

    @NonNull
    @Override
    public FloatThrottle newThrottle(@NonNull TimeSource timeSource, @NonNull Duration timeLimit, long opLimit) {
        return new FloatThrottle(this, timeSource, timeLimit, opLimit);
    }

    public static final class Builder extends Metric.Builder<Builder, FloatMetric> {

        private float initialValue;

        private Builder(@NonNull String name) {
            super(MetricKind.FLOAT, name);
        }

        /**
         * @param initialValue value of the metric after construction, zero if not set
         * @return the builder instance
         */
        @NonNull
        public Builder withInitialValue(float initialValue) {
            this.initialValue = initialValue;
            return this;
        }

        @NonNull
        @Override
        public FloatMetric build() {
            return new FloatMetric(this);
        }

        @NonNull
        @Override
        protected Builder self() {
            return this;
        }
    }
}
