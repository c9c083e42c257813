// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a registered metric of a derived kind is looked up. Derived metrics are rendered but the
 * registry does not hand them out by name.
 */
public class MetricNotLookupableException extends MetricException {

    public MetricNotLookupableException(@NonNull String metricName, @NonNull MetricKind kind) {
        super("The metric called \"" + metricName + "\" of kind " + kind.label() + " cannot be looked up");
    }
}
