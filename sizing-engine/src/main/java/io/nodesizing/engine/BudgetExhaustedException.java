/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine;

/**
 * Exception thrown when nothing is left of the pod budget, typically because the excluded containers already use more
 * than the fraction of the node granted to the pod.
 */
public class BudgetExhaustedException extends SizingException {
    /**
     * Constructor
     *
     * @param message   Message describing the issue
     */
    public BudgetExhaustedException(String message) {
        super(message);
    }
}
