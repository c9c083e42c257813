// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

/**
 * Checked exception thrown by a {@link Renderer} when it fails to write metrics to its destination.
 */
public class RenderException extends Exception {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
