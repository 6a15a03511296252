/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.webhook.http;

/**
 * Readiness check used by the /ready endpoint
 */
public interface Readiness {
    /**
     * @return  True when the component can serve admission requests
     */
    boolean isReady();
}
