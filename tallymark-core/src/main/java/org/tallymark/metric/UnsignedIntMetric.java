// SPDX-License-Identifier: Apache-2.0
package org.tallymark.metric;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.tallymark.core.MetricKey;
import org.tallymark.core.MetricKind;
import org.tallymark.core.NumericType;

/**
 * Unsigned 64-bit integer metric, typically a counter. Values are rendered as unsigned, so decrementing
 * below zero wraps to {@code 18446744073709551615}.
 */
public final class UnsignedIntMetric extends IntegerMetric {

    private UnsignedIntMetric(@NonNull Builder builder) {
        super(builder);
    }

    /**
     * @param name the metric name, must not be {@code null}
     * @return key for looking the metric up in a registry
     */
    @NonNull
    public static MetricKey<UnsignedIntMetric> key(@NonNull String name) {
        return new MetricKey<>(name, MetricKind.UNSIGNED_INT, UnsignedIntMetric.class);
    }

    /**
     * @param name the metric name, must not be {@code null}
     * @return a new builder
     */
    @NonNull
    public static Builder builder(@NonNull String name) {
        return new Builder(name);
    }

    @NonNull
    @Override
    public NumericType numericType() {
        return NumericType.UNSIGNED;
    }

    public static final class Builder extends IntegerMetric.Builder<Builder, UnsignedIntMetric> {

        private Builder(@NonNull String name) {
            super(MetricKind.UNSIGNED_INT, name);
        }

        @NonNull
        @Override
        public UnsignedIntMetric build() {
            return new UnsignedIntMetric(this);
        }

        @NonNull
        @Override
        protected Builder self() {
            return this;
        }
    }
}
