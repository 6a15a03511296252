/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Quantity;

import java.util.Map;

/**
 * Which node resources the fractions apply to
 */
public enum NodeResourceSource {
    /**
     * Total resources of the node
     */
    CAPACITY,

    /**
     * Resources available for pods (capacity minus the system reservations)
     */
    ALLOCATABLE;

    /**
     * @param node  The node
     *
     * @return  The selected resources of the node or null if the node has no status
     */
    public Map<String, Quantity> resources(Node node) {
        if (node.getStatus() == null) {
            return null;
        }

        return this == CAPACITY ? node.getStatus().getCapacity() : node.getStatus().getAllocatable();
    }
}
