/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine;

import io.nodesizing.engine.model.ResourceProperties;

import java.util.Set;

/**
 * Sizing settings configured on a pod through its annotations
 *
 * @param fractions             Fractions of the node resources the pod is entitled to (requests and limits roles)
 * @param requestBounds         Pod minimum and maximum applied to the requests budget
 * @param limitBounds           Pod minimum and maximum applied to the limits budget
 * @param excludedContainers    Names of the containers which are left untouched
 */
public record SizingSettings(ResourceProperties fractions, ResourceProperties requestBounds, ResourceProperties limitBounds, Set<String> excludedContainers) {
    /**
     * @return  True when at least one fraction is configured, which means the pod opted in for sizing
     */
    public boolean hasFractions() {
        return !fractions.isEmpty();
    }

    /**
     * @param containerName     Name of the container
     *
     * @return  True if the container should be left untouched
     */
    public boolean isExcluded(String containerName) {
        return excludedContainers.contains(containerName);
    }
}
