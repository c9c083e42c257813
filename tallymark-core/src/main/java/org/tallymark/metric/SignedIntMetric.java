// SPDX-License-Identifier: Apache-2.0
package org.tallymark.metric;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.tallymark.core.MetricKey;
import org.tallymark.core.MetricKind;
import org.tallymark.core.NumericType;

/**
 * Signed 64-bit integer metric.
 */
public final class SignedIntMetric extends IntegerMetric {

    private SignedIntMetric(@NonNull Builder builder) {
        super(builder);
    }

    /**
     * @param name the metric name, must not be {@code null}
     * @return key for looking the metric up in a registry
     */
    @NonNull
    public static MetricKey<SignedIntMetric> key(@NonNull String name) {
        return new MetricKey<>(name, MetricKind.SIGNED_INT, SignedIntMetric.class);
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
        return NumericType.SIGNED;
    }

    public static final class Builder extends IntegerMetric.Builder<Builder, SignedIntMetric> {

        private Builder(@NonNull String name) {
            super(MetricKind.SIGNED_INT, name);
        }

        @NonNull
        @Override
        public SignedIntMetric build() {
            return new SignedIntMetric(this);
        }

        @NonNull
        @Override
        protected Builder self() {
            return this;
        }
    }
}
