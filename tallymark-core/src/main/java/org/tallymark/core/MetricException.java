// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

/**
 * Base class of the unchecked exceptions raised when metrics are misused, e.g. registered twice under the
 * same name or looked up with the wrong kind.
 */
public class MetricException extends RuntimeException {

    public MetricException(String message) {
        super(message);
    }
}
