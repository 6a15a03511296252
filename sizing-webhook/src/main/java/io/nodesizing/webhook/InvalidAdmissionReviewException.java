/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.webhook;

/**
 * Thrown when the body sent to the webhook is not a usable AdmissionReview
 */
public class InvalidAdmissionReviewException extends RuntimeException {
    /**
     * Constructor
     *
     * @param message   Message describing the issue
     */
    public InvalidAdmissionReviewException(String message) {
        super(message);
    }

    /**
     * Constructor
     *
     * @param message   Message describing the issue
     * @param cause     Cause of the issue
     */
    public InvalidAdmissionReviewException(String message, Throwable cause) {
        super(message, cause);
    }
}
