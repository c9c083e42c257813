// SPDX-License-Identifier: Apache-2.0
package org.tallymark.metric;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.tallymark.core.Metric;
import org.tallymark.core.MetricKey;
import org.tallymark.core.MetricKind;
import org.tallymark.core.Throttleable;
import org.tallymark.core.TimeSource;
import org.tallymark.throttle.StringThrottle;

/**
 * Metric holding a string, e.g. a state name or a version. String metrics have no unit.
 */
public final class StringMetric extends Metric implements Throttleable<StringThrottle> {

    private final AtomicReference<String> value;

    private StringMetric(@NonNull Builder builder) {
        super(builder);
        value = new AtomicReference<>(builder.initialValue);
    }

    @NonNull
    public static MetricKey<StringMetric> key(@NonNull String name) {
        return new MetricKey<>(name, MetricKind.STRING, StringMetric.class);
    }

    @NonNull
    public static Builder builder(@NonNull String name) {
        return new Builder(name);
    }

    @NonNull
    public String get() {
        return value.get();
    }

    /**
     * @param newValue the new value, must not be {@code null}
     */
    public void set(@NonNull String newValue) {
        value.set(Objects.requireNonNull(newValue, "value must not be null"));
        notifyHooks();
    }

    @NonNull
    @Override
    public String valueAsString() {
        return value.get();
    }

    @NonNull
    @Override
    public StringThrottle newThrottle(@NonNull TimeSource timeSource, @NonNull Duration timeLimit, long opLimit) {
        return new StringThrottle(this, timeSource, timeLimit, opLimit);
    }

    public static final class Builder extends Metric.Builder<Builder, StringMetric> {

        private String initialValue = "";

        private Builder(@NonNull String name) {
            super(MetricKind.STRING, name);
        }

        /**
         * @param initialValue value of the metric after construction, empty if not set
         * @return the builder instance
         */
        @NonNull
        public Builder withInitialValue(@NonNull String initialValue) {
            this.initialValue = Objects.requireNonNull(initialValue, "initial value must not be null");
            return this;
        }

        @NonNull
        @Override
        public StringMetric build() {
            return new StringMetric(this);
        }

        @NonNull
        @Override
        protected Builder self() {
            return this;
        }
    }
}
