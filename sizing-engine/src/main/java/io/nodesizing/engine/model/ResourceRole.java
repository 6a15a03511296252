/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine.model;

/**
 * The logical bucket a binding belongs to
 */
public enum ResourceRole {
    REQUESTS("requests"),
    LIMITS("limits"),
    POD_MINIMUM("pod-minimum"),
    POD_MAXIMUM("pod-maximum");

    private final String role;

    ResourceRole(String role) {
        this.role = role;
    }

    /**
     * @return  The name of the role as used in the container resources (for requests and limits) and in logs
     */
    public String getRole() {
        return role;
    }

    @Override
    public String toString() {
        return role;
    }
}
