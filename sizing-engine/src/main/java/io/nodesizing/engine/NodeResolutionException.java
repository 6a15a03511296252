/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine;

/**
 * Exception thrown when the node a pod is pinned to cannot be determined or is not known to the node snapshot
 */
public class NodeResolutionException extends SizingException {
    /**
     * Constructor
     *
     * @param message   Message describing the issue
     */
    public NodeResolutionException(String message) {
        super(message);
    }
}
