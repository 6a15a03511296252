/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine;

import io.fabric8.kubernetes.api.model.Node;

/**
 * Read access to the known nodes. Implementations must not block: lookups are done while the API server waits for the
 * admission response.
 */
public interface NodeSnapshotProvider {
    /**
     * @param name  Name of the node
     *
     * @return  The node or null if it is not known
     */
    Node get(String name);
}
