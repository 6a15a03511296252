/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.webhook.http;

/**
 * Liveness check used by the /healthy endpoint
 */
public interface Liveness {
    /**
     * @return  True when the component is alive, false when it should be restarted
     */
    boolean isAlive();
}
