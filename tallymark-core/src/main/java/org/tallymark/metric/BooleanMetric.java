// SPDX-License-Identifier: Apache-2.0
package org.tallymark.metric;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.tallymark.core.Metric;
import org.tallymark.core.MetricKey;
import org.tallymark.core.MetricKind;
import org.tallymark.core.Throttleable;
import org.tallymark.core.TimeSource;
import org.tallymark.throttle.BooleanThrottle;

/**
 * Boolean metric. Its string form is one of two display labels, {@code TRUE} and {@code FALSE} unless
 * configured otherwise with {@link Builder#withLabels(String, String)}.
 */
public final class BooleanMetric extends Metric implements Throttleable<BooleanThrottle> {

    public static final String DEFAULT_TRUE_LABEL = "TRUE";
    public static final String DEFAULT_FALSE_LABEL = "FALSE";

    private final AtomicBoolean value;
    private final String trueLabel;
    private final String falseLabel;

    private BooleanMetric(@NonNull Builder builder) {
        super(builder);
        value = new AtomicBoolean(builder.initialValue);
        trueLabel = builder.trueLabel;
        falseLabel = builder.falseLabel;
    }

    @NonNull
    public static MetricKey<BooleanMetric> key(@NonNull String name) {
        return new MetricKey<>(name, MetricKind.BOOL, BooleanMetric.class);
    }

    @NonNull
    public static Builder builder(@NonNull String name) {
        return new Builder(name);
    }

    public boolean get() {
        return value.get();
    }

    public void set(boolean newValue) {
        value.set(newValue);
        notifyHooks();
    }

    /**
     * @return the inverse of the current value
     */
    public boolean negated() {
        return !value.get();
    }

    @NonNull
    public String trueLabel() {
        return trueLabel;
    }

    @NonNull
    public String falseLabel() {
        return falseLabel;
    }

    @Override
    public boolean asBoolean() {
        return value.get();
    }

    @NonNull
    @Override
    public String valueAsString() {
        return value.get() ? trueLabel : falseLabel;
    }

    @NonNull
    @Override
    public BooleanThrottle newThrottle(@NonNull TimeSource timeSource, @NonNull Duration timeLimit, long opLimit) {
        return new BooleanThrottle(this, timeSource, timeLimit, opLimit);
    }

    public static final class Builder extends Metric.Builder<Builder, BooleanMetric> {

        private boolean initialValue;
        private String trueLabel = DEFAULT_TRUE_LABEL;
        private String falseLabel = DEFAULT_FALSE_LABEL;

        private Builder(@NonNull String name) {
            super(MetricKind.BOOL, name);
        }

        @NonNull
        public Builder withInitialValue(boolean initialValue) {
            this.initialValue = initialValue;
            return this;
        }

        /**
         * @param trueLabel  string form of {@code true}, must not be {@code null}
         * @param falseLabel string form of {@code false}, must not be {@code null}
         * @return the builder instance
         */
        @NonNull
        public Builder withLabels(@NonNull String trueLabel, @NonNull String falseLabel) {
            this.trueLabel = Objects.requireNonNull(trueLabel, "true label must not be null");
            this.falseLabel = Objects.requireNonNull(falseLabel, "false label must not be null");
            return this;
        }

        @NonNull
        @Override
        public BooleanMetric build() {
            return new BooleanMetric(this);
        }

        @NonNull
        @Override
        protected Builder self() {
            return this;
        }
    }
}
