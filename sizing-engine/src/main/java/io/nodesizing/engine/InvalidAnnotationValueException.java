/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine;

/**
 * Exception thrown when a sizing annotation holds a value which cannot be parsed as a fraction or a quantity
 */
public class InvalidAnnotationValueException extends SizingException {
    /**
     * Constructor
     *
     * @param message   Message describing the issue
     */
    public InvalidAnnotationValueException(String message) {
        super(message);
    }

    /**
     * Constructor
     *
     * @param message   Message describing the issue
     * @param cause     Cause of the issue
     */
    public InvalidAnnotationValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
