// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A metric with a current numeric value. Implemented by every numeric-like metric, plain and derived, so
 * rate and sum metrics can be built over any of them.
 */
public interface NumericMetric {

    /**
     * @return the native representation of the value, never {@code null}
     */
    @NonNull
    NumericType numericType();

    /**
     * @return current value as raw 64-bit integer; floats are truncated
     */
    long longValue();

    /**
     * @return current value as double
     */
    double doubleValue();
}
