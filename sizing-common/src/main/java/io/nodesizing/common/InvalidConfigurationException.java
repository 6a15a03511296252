/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.common;

/**
 * Represents an exception raised when invalid configuration is passed at webhook startup
 */
public class InvalidConfigurationException extends RuntimeException {
    /**
     * Constructor
     *
     * @param message   Message describe the issue
     */
    public InvalidConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructor
     *
     * @param message   Message describing the issue
     * @param t         Cause of the issue
     */
    public InvalidConfigurationException(String message, Throwable t) {
        super(message, t);
    }
}
