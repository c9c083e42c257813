// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

import java.util.Locale;

/**
 * Native representation of a {@link NumericMetric} value.
 */
public enum NumericType {
    /** 64-bit integer interpreted as unsigned. */
    UNSIGNED,
    /** 64-bit two's complement integer. */
    SIGNED,
    /** 32-bit IEEE 754 float. */
    FLOAT;

    /**
     * Formats a value held in this representation. Integers are written in plain decimal, floats with
     * exactly two fraction digits.
     *
     * @param longValue  the value if this type is an integer type
     * @param floatValue the value if this type is {@link #FLOAT}
     * @return the formatted value
     */
    public String format(long longValue, float floatValue) {
        switch (this) {
            case UNSIGNED:
                return Long.toUnsignedString(longValue);
            case SIGNED:
                return Long.toString(longValue);
            default:
                return formatFloat(floatValue);
        }
    }

    /**
     * Converts a value held in this integer representation to a double.
     *
     * @param value raw 64-bit value
     * @return value as double, treating the bits as unsigned for {@link #UNSIGNED}
     */
    public double toDouble(long value) {
        if (this == UNSIGNED && value < 0) {
            return (double) (value >>> 1) * 2.0 + (value & 1L);
        }
        return value;
    }

    /**
     * @param value float value
     * @return value with two fraction digits, independent of the default locale
     */
    public static String formatFloat(float value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
