/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine.model;

import java.util.Objects;

/**
 * Value bound to one (kind, role, resource) coordinate. Bindings are immutable: changing the value of a binding means
 * creating a new one, so that two sets of resource properties never share mutable state.
 *
 * @param kind          Kind of the value
 * @param role          Role the value plays
 * @param resourceName  Name of the resource (cpu, memory, ...)
 * @param value         The value
 */
public record ResourceBinding(ResourceKind kind, ResourceRole role, String resourceName, double value) {
    /**
     * Constructor
     *
     * @param kind          Kind of the value
     * @param role          Role the value plays
     * @param resourceName  Name of the resource (cpu, memory, ...)
     * @param value         The value
     */
    public ResourceBinding {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(resourceName, "resourceName");
    }

    /**
     * @param newValue  The new value
     *
     * @return  Copy of this binding with a different value
     */
    public ResourceBinding withValue(double newValue) {
        return new ResourceBinding(kind, role, resourceName, newValue);
    }

    /**
     * @param newKind   The new kind
     * @param newValue  The new value
     *
     * @return  Copy of this binding with a different kind and value
     */
    public ResourceBinding withValue(ResourceKind newKind, double newValue) {
        return new ResourceBinding(newKind, role, resourceName, newValue);
    }

    /**
     * Renders the value the way it would be written in a pod definition, for example {@code 200m} or {@code 2G}.
     *
     * @return  Human-readable value
     */
    public String humanValue() {
        return kind.format(value);
    }

    /**
     * @param containerIndex    Index of the container in the pod specification
     *
     * @return  JSON pointer to this resource in the container resources
     */
    public String jsonPath(int containerIndex) {
        return String.format("/spec/containers/%d/resources/%s/%s", containerIndex, role.getRole(), resourceName);
    }

    @Override
    public String toString() {
        return role + "." + resourceName + "=" + value + "=" + humanValue() + " (" + kind + ")";
    }
}
