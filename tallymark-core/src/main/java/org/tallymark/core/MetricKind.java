// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Kind of a {@link Metric}. The kind determines the native value type of the metric and whether it can be
 * retrieved from a {@link MetricRegistry} by name.
 */
public enum MetricKind {
    UNSIGNED_INT("UINT", true),
    SIGNED_INT("INT", true),
    FLOAT("FLOAT", true),
    RATE("RATE", false),
    STRING("STR", true),
    BOOL("BOOL", true),
    SUM("SUM", false);

    private final String label;
    private final boolean lookupable;

    MetricKind(String label, boolean lookupable) {
        this.label = label;
        this.lookupable = lookupable;
    }

    /**
     * @return short label of the kind as written by renderers, e.g. {@code UINT} or {@code STR}
     */
    @NonNull
    public String label() {
        return label;
    }

    /**
     * Derived kinds are computed from other metrics and the registry keeps them without a kind-local
     * index, so they are rendered but never returned by a lookup.
     *
     * @return {@code true} if metrics of this kind can be looked up by name
     */
    public boolean isLookupable() {
        return lookupable;
    }
}
