// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a metric is looked up with a kind other than the one it was registered with.
 */
public class MetricKindMismatchException extends MetricException {

    private final MetricKind actualKind;
    private final MetricKind expectedKind;

    public MetricKindMismatchException(
            @NonNull String metricName, @NonNull MetricKind actualKind, @NonNull MetricKind expectedKind) {
        super("The metric called \"" + metricName + "\" is of an unexpected kind: actual kind is "
                + actualKind.label() + "; expected kind is " + expectedKind.label());
        this.actualKind = actualKind;
        this.expectedKind = expectedKind;
    }

    @NonNull
    public MetricKind actualKind() {
        return actualKind;
    }

    @NonNull
    public MetricKind expectedKind() {
        return expectedKind;
    }
}
