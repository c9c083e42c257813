// SPDX-License-Identifier: Apache-2.0
package org.tallymark.metric;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.tallymark.core.MetricKind;

public class BooleanMetricTest {

    @Test
    void testDefaultLabels() {
        BooleanMetric metric = BooleanMetric.builder("flag").build();

        assertThat(metric.kind()).isEqualTo(MetricKind.BOOL);
        assertThat(metric.get()).isFalse();
        assertThat(metric.valueAsString()).isEqualTo("FALSE");
        metric.set(true);
        assertThat(metric.valueAsString()).isEqualTo("TRUE");
    }

    @Test
    void testCustomLabels() {
        BooleanMetric metric = BooleanMetric.builder("enabled")
                .withInitialValue(true)
                .withLabels("yes", "no")
                .build();

        assertThat(metric.trueLabel()).isEqualTo("yes");
        assertThat(metric.falseLabel()).isEqualTo("no");
        assertThat(metric.valueAsString()).isEqualTo("yes");
        metric.set(false);
        assertThat(metric.valueAsString()).isEqualTo("no");
    }

    @ParameterizedTest
    @ValueSource(booleans = {true, false})
    void testNegated(boolean value) {
        BooleanMetric metric =
                BooleanMetric.builder("flag").withInitialValue(value).build();

        assertThat(metric.negated()).isEqualTo(!value);
        assertThat(metric.get()).isEqualTo(value);
    }
}
