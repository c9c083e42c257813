// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Locale;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class NumericTypeTest {

    @ParameterizedTest
    @CsvSource({"UNSIGNED, -1, 0, 18446744073709551615", "SIGNED, -1, 0, -1", "FLOAT, 0, 145.75, 145.75"})
    void testFormat(NumericType type, long longValue, float floatValue, String expected) {
        assertThat(type.format(longValue, floatValue)).isEqualTo(expected);
    }

    @Test
    void testFloatFormatIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            assertThat(NumericType.formatFloat(1.5f)).isEqualTo("1.50");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void testUnsignedToDouble() {
        assertThat(NumericType.UNSIGNED.toDouble(42)).isEqualTo(42.0);
        assertThat(NumericType.UNSIGNED.toDouble(Long.MIN_VALUE)).isEqualTo(9.223372036854775808E18);
        assertThat(NumericType.SIGNED.toDouble(Long.MIN_VALUE)).isEqualTo(-9.223372036854775808E18);
    }
}
