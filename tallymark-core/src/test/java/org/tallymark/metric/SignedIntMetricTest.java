// SPDX-License-Identifier: Apache-2.0
package org.tallymark.metric;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.tallymark.core.MetricKind;
import org.tallymark.core.NumericType;

public class SignedIntMetricTest {

    @Test
    void testNegativeValues() {
        SignedIntMetric metric =
                SignedIntMetric.builder("balance").withInitialValue(-1024).build();

        assertThat(metric.kind()).isEqualTo(MetricKind.SIGNED_INT);
        assertThat(metric.numericType()).isEqualTo(NumericType.SIGNED);
        assertThat(metric.valueAsString()).isEqualTo("-1024");
        assertThat(metric.asDouble()).isEqualTo(-1024.0);

        metric.subtract(1);
        assertThat(metric.get()).isEqualTo(-1025);
    }

    @ParameterizedTest
    @ValueSource(longs = {Long.MIN_VALUE, -1, 0, 1, Long.MAX_VALUE})
    void testStringForm(long value) {
        SignedIntMetric metric = SignedIntMetric.builder("m").build();

        metric.set(value);

        assertThat(metric.valueAsString()).isEqualTo(Long.toString(value));
    }

    @Test
    void testOverflowWraps() {
        SignedIntMetric metric =
                SignedIntMetric.builder("m").withInitialValue(Long.MAX_VALUE).build();

        metric.increment();

        assertThat(metric.get()).isEqualTo(Long.MIN_VALUE);
    }
}
