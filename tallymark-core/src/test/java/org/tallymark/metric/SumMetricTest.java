// SPDX-License-Identifier: Apache-2.0
package org.tallymark.metric;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.tallymark.core.ManualTimeSource;
import org.tallymark.core.MetricCastException;
import org.tallymark.core.MetricKind;
import org.tallymark.core.NumericType;

public class SumMetricTest {

    private static FloatMetric floatTarget(float value) {
        return FloatMetric.builder("target").withInitialValue(value).build();
    }

    @Test
    void testFloatSum() {
        SumMetric sum = SumMetric.builder("total", NumericType.FLOAT)
                .withUnit("bps")
                .withTargets(floatTarget(10.25f), floatTarget(35.25f), floatTarget(100.25f))
                .build();

        assertThat(sum.kind()).isEqualTo(MetricKind.SUM);
        assertThat(sum.numericType()).isEqualTo(NumericType.FLOAT);
        assertThat(sum.targetCount()).isEqualTo(3);
        assertThat(sum.asDouble()).isEqualTo(145.75);
        assertThat(sum.valueAsString()).isEqualTo("145.75");
    }

    @Test
    void testUnsignedSum() {
        SumMetric sum = SumMetric.builder("total", NumericType.UNSIGNED)
                .withTargets(
                        UnsignedIntMetric.builder("a").withInitialValue(100).build(),
                        UnsignedIntMetric.builder("b").withInitialValue(45).build())
                .build();

        assertThat(sum.longValue()).isEqualTo(145);
        assertThat(sum.valueAsString()).isEqualTo("145");
    }

    @Test
    void testSignedSum() {
        SumMetric sum = SumMetric.builder("total", NumericType.SIGNED)
                .withTargets(
                        SignedIntMetric.builder("a").withInitialValue(-100).build(),
                        SignedIntMetric.builder("b").withInitialValue(30).build())
                .build();

        assertThat(sum.valueAsString()).isEqualTo("-70");
        assertThat(sum.asDouble()).isEqualTo(-70.0);
    }

    @Test
    void testEmptySum() {
        SumMetric sum = SumMetric.builder("total", NumericType.SIGNED).build();

        assertThat(sum.targetCount()).isZero();
        assertThat(sum.valueAsString()).isEqualTo("0");
    }

    @Test
    void testTargetChangesVisibleAfterRecompute() {
        UnsignedIntMetric target =
                UnsignedIntMetric.builder("a").withInitialValue(1).build();
        SumMetric sum = SumMetric.builder("total", NumericType.UNSIGNED)
                .withTargets(target)
                .build();

        target.set(5);
        assertThat(sum.longValue()).isEqualTo(1);

        sum.recompute();
        assertThat(sum.longValue()).isEqualTo(5);
    }

    @Test
    void testAddedTargetCountsFromNextRecompute() {
        SumMetric sum = SumMetric.builder("total", NumericType.FLOAT)
                .withTargets(floatTarget(10.25f), floatTarget(35.25f), floatTarget(100.25f))
                .build();

        sum.addTarget(floatTarget(4.25f));

        assertThat(sum.targetCount()).isEqualTo(4);
        assertThat(sum.valueAsString()).isEqualTo("145.75");
        sum.recompute();
        assertThat(sum.valueAsString()).isEqualTo("150.00");
    }

    @Test
    void testTargetOfOtherNumericTypeRejected() {
        SumMetric sum = SumMetric.builder("total", NumericType.UNSIGNED).build();
        SignedIntMetric signed = SignedIntMetric.builder("signed").build();

        assertThatThrownBy(() -> sum.addTarget(signed))
                .isInstanceOf(MetricCastException.class)
                .hasMessage("Cannot add a target of numeric type SIGNED to the sum \"total\" of numeric type UNSIGNED");
        assertThat(sum.targetCount()).isZero();
    }

    @Test
    void testRecomputeNotifiesHooks() {
        SumMetric sum = SumMetric.builder("total", NumericType.UNSIGNED)
                .withTargets(UnsignedIntMetric.builder("a").withInitialValue(3).build())
                .build();
        List<Long> seen = new ArrayList<>();
        sum.registerHook(m -> seen.add(m.asLong()));

        sum.recompute();
        sum.recompute();

        assertThat(seen).containsExactly(3L, 3L);
    }

    @Test
    void testSumOfRatesReadsCachedRates() {
        ManualTimeSource time = ManualTimeSource.startingAt(0);
        UnsignedIntMetric first = UnsignedIntMetric.builder("first").build();
        UnsignedIntMetric second = UnsignedIntMetric.builder("second").build();
        RateMetric firstRate =
                RateMetric.builder("first_rate", first).withTimeSource(time).build();
        RateMetric secondRate =
                RateMetric.builder("second_rate", second).withTimeSource(time).build();
        SumMetric sum = SumMetric.builder("total_rate", NumericType.FLOAT)
                .withTargets(firstRate, secondRate)
                .build();

        first.set(10);
        second.set(20);
        time.advance(1000);

        sum.recompute();
        assertThat(sum.valueAsString()).isEqualTo("0.00");

        firstRate.recompute();
        secondRate.recompute();
        sum.recompute();
        assertThat(sum.valueAsString()).isEqualTo("30.00");
    }
}
