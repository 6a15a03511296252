/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine;

/**
 * Exception thrown when an operation on resource properties expects a binding on its operand which is not there.
 * This is a programming error rather than an input error.
 */
public class MissingBindingException extends SizingException {
    /**
     * Constructor
     *
     * @param message   Message describing the issue
     */
    public MissingBindingException(String message) {
        super(message);
    }
}
