/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine;

import io.fabric8.kubernetes.api.model.Container;
import io.nodesizing.engine.model.ResourceProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the share of each container in the resources declared by the whole pod. For example, with two containers
 * requesting 100m and 300m CPU, the first one gets 25% of the CPU request budget and the second one 75%.
 */
public class ProportionalAllocator {
    private ProportionalAllocator() { }

    /**
     * Sums the resources declared by the included containers.
     *
     * @param containers    Containers of the pod
     * @param excluded      Names of the excluded containers
     *
     * @return  Pod totals without the zero totals
     */
    public static ResourceProperties totals(List<Container> containers, Set<String> excluded) {
        ResourceProperties total = new ResourceProperties();

        for (Container container : containers) {
            if (!excluded.contains(container.getName())) {
                total.add(ResourceProperties.fromResourceRequirements(container.getResources()));
            }
        }

        // Dividing by a zero total is meaningless, the containers are left untouched for that resource
        return total.retainNonZero();
    }

    /**
     * Computes the shares of the included containers. Shares are fractions. A container gets no share for a resource
     * it does not declare, or for a resource whose pod total is zero.
     *
     * @param containers    Containers of the pod
     * @param excluded      Names of the excluded containers
     *
     * @return  Map with the shares of each included container, in pod order
     */
    public static Map<String, ResourceProperties> shares(List<Container> containers, Set<String> excluded) {
        ResourceProperties total = totals(containers, excluded);
        Map<String, ResourceProperties> shares = new LinkedHashMap<>();

        for (Container container : containers) {
            if (!excluded.contains(container.getName())) {
                ResourceProperties own = ResourceProperties.fromResourceRequirements(container.getResources());
                shares.put(container.getName(), own.retainMatching(total).div(total));
            }
        }

        return shares;
    }
}
