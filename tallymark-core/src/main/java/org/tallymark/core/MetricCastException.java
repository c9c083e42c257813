// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when the value of a metric is requested as a type its kind cannot provide, or when a metric of the
 * wrong value type is combined with another.
 */
public class MetricCastException extends MetricException {

    public MetricCastException(@NonNull String message) {
        super(message);
    }

    MetricCastException(@NonNull Metric metric, @NonNull String targetType) {
        this("The metric called \"" + metric.name() + "\" of kind " + metric.kindName() + " cannot be read as "
                + targetType);
    }
}
