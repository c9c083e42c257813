// SPDX-License-Identifier: Apache-2.0
package org.tallymark.metric;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.tallymark.core.Metric;
import org.tallymark.core.MetricKind;
import org.tallymark.core.NumericMetric;
import org.tallymark.core.Throttleable;
import org.tallymark.core.TimeSource;
import org.tallymark.throttle.LongThrottle;

/**
 * Base class of the 64-bit integer metrics. The value is held in an {@link AtomicLong}, so updates from
 * concurrent threads never need a lock. Arithmetic wraps around on overflow.
 */
public abstract class IntegerMetric extends Metric implements NumericMetric, Throttleable<LongThrottle> {

    private final AtomicLong value;

    protected IntegerMetric(@NonNull Builder<?, ?> builder) {
        super(builder);
        value = new AtomicLong(builder.getInitialValue());
    }

    /**
     * @return the current value
     */
    public final long get() {
        return value.get();
    }

    /**
     * @param newValue the new value
     */
    public final void set(long newValue) {
        value.set(newValue);
        notifyHooks();
    }

    /**
     * @param delta value to add
     * @return the updated value
     */
    public final long add(long delta) {
        final long result = value.addAndGet(delta);
        notifyHooks();
        return result;
    }

    /**
     * @param delta value to subtract
     * @return the updated value
     */
    public final long subtract(long delta) {
        final long result = value.addAndGet(-delta);
        notifyHooks();
        return result;
    }

    /**
     * @return the updated value
     */
    public final long increment() {
        final long result = value.incrementAndGet();
        notifyHooks();
        return result;
    }

    /**
     * @return the value before the increment
     */
    public final long getAndIncrement() {
        final long result = value.getAndIncrement();
        notifyHooks();
        return result;
    }

    /**
     * @return the updated value
     */
    public final long decrement() {
        final long result = value.decrementAndGet();
        notifyHooks();
        return result;
    }

    /**
     * @return the value before the decrement
     */
    public final long getAndDecrement() {
        final long result = value.getAndDecrement();
        notifyHooks();
        return result;
    }

    @Override
    public final long longValue() {
        return value.get();
    }

    @Override
    public final double doubleValue() {
        return numericType().toDouble(value.get());
    }

    @Override
    public final long asLong() {
        return longValue();
    }

    @Override
    public final double asDouble() {
        return doubleValue();
    }

    @NonNull
    @Override
    public final String valueAsString() {
        return numericType().format(value.get(), 0.0f);
    }

    @NonNull
    @Override
    public final LongThrottle newThrottle(@NonNull TimeSource timeSource, @NonNull Duration timeLimit, long opLimit) {
        return new LongThrottle(this, timeSource, timeLimit, opLimit);
    }

    /**
     * Builder of integer metrics, adding the initial value.
     *
     * @param <B> the concrete builder type
     * @param <M> the concrete metric type
     */
    public abstract static class Builder<B extends Builder<B, M>, M extends IntegerMetric>
            extends Metric.Builder<B, M> {

        private long initialValue;

        protected Builder(@NonNull MetricKind kind, @NonNull String name) {
            super(kind, name);
        }

        public final long getInitialValue() {
            return initialValue;
        }

        /**
         * @param initialValue value of the metric after construction, zero if not set
         * @return the builder instance
         */
        @NonNull
        public final B withInitialValue(long initialValue) {
            this.initialValue = initialValue;
            return self();
        }
    }
}
