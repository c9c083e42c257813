// SPDX-License-Identifier: Apache-2.0
package org.tallymark.metric;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.tallymark.core.Metric;
import org.tallymark.core.MetricCastException;
import org.tallymark.core.MetricKind;
import org.tallymark.core.NumericMetric;
import org.tallymark.core.NumericType;
import org.tallymark.metric.container.AtomicFloat;

/**
 * Sum of the values of other numeric metrics of one {@link NumericType}.
 * <p>
 * The total is cached and only refreshed by {@link #recompute()}. Targets passed to the builder are summed
 * when the metric is constructed; targets added later with {@link #addTarget(NumericMetric)} count from the
 * next recompute on. A derived target contributes its cached value, not a fresh computation.
 */
public final class SumMetric extends Metric implements NumericMetric {

    private final NumericType numericType;
    // guarded by itself
    private final List<NumericMetric> targets = new ArrayList<>();
    private final AtomicLong longTotal = new AtomicLong();
    private final AtomicFloat floatTotal = new AtomicFloat();

    private SumMetric(@NonNull Builder builder) {
        super(builder);
        numericType = builder.numericType;
        for (NumericMetric target : builder.targets) {
            addTarget(target);
        }
        storeTotal();
    }

    /**
     * @param name        the metric name, must not be {@code null}
     * @param numericType numeric type of all targets and of the total, must not be {@code null}
     * @return a new builder
     */
    @NonNull
    public static Builder builder(@NonNull String name, @NonNull NumericType numericType) {
        return new Builder(name, numericType);
    }

    /**
     * Adds a metric to the sum, taking effect on the next {@link #recompute()}.
     *
     * @param target the metric to add, must not be {@code null}
     * @throws MetricCastException if the target has another numeric type than this sum
     */
    public void addTarget(@NonNull NumericMetric target) {
        Objects.requireNonNull(target, "target must not be null");
        if (target.numericType() != numericType) {
            throw new MetricCastException("Cannot add a target of numeric type " + target.numericType()
                    + " to the sum \"" + name() + "\" of numeric type " + numericType);
        }
        synchronized (targets) {
            targets.add(target);
        }
    }

    /**
     * @return number of summed metrics
     */
    public int targetCount() {
        synchronized (targets) {
            return targets.size();
        }
    }

    @Override
    public void recompute() {
        storeTotal();
        notifyHooks();
    }

    private void storeTotal() {
        synchronized (targets) {
            if (numericType == NumericType.FLOAT) {
                float total = 0.0f;
                for (NumericMetric target : targets) {
                    total += (float) target.doubleValue();
                }
                floatTotal.set(total);
            } else {
                long total = 0L;
                for (NumericMetric target : targets) {
                    total += target.longValue();
                }
                longTotal.set(total);
            }
        }
    }

    @NonNull
    @Override
    public NumericType numericType() {
        return numericType;
    }

    @Override
    public long longValue() {
        return numericType == NumericType.FLOAT ? (long) floatTotal.get() : longTotal.get();
    }

    @Override
    public double doubleValue() {
        return numericType == NumericType.FLOAT ? floatTotal.get() : numericType.toDouble(longTotal.get());
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
        return numericType.format(longTotal.get(), floatTotal.get());
    }

    public static final class Builder extends Metric.Builder<Builder, SumMetric> {

        private final NumericType numericType;
        private final List<NumericMetric> targets = new ArrayList<>();

        private Builder(@NonNull String name, @NonNull NumericType numericType) {
            super(MetricKind.SUM, name);
            this.numericType = Objects.requireNonNull(numericType, "numeric type must not be null");
        }

        /**
         * @param targets metrics to sum, must not be {@code null}
         * @return the builder instance
         */
        @NonNull
        public Builder withTargets(@NonNull NumericMetric... targets) {
            Objects.requireNonNull(targets, "targets must not be null");
            this.targets.addAll(Arrays.asList(targets));
            return this;
        }

        @NonNull
        @Override
        public SumMetric build() {
            return new SumMetric(this);
        }

        @NonNull
        @Override
        protected Builder self() {
            return this;
        }
    }
}
