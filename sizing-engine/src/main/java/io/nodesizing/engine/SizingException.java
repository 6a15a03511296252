/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine;

/**
 * Base class of the failures which abort the sizing of a pod. A sizing failure is terminal for the admission request
 * which triggered it: no patch is ever produced for a pod whose sizing failed.
 */
public abstract class SizingException extends RuntimeException {
    /**
     * Constructor
     *
     * @param message   Message describing the issue
     */
    protected SizingException(String message) {
        super(message);
    }

    /**
     * Constructor
     *
     * @param message   Message describing the issue
     * @param cause     Cause of the issue
     */
    protected SizingException(String message, Throwable cause) {
        super(message, cause);
    }
}
