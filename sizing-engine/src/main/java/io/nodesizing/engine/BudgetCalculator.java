/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Node;
import io.nodesizing.engine.model.ResourceProperties;

import java.util.List;
import java.util.Set;

/**
 * Computes the absolute budget of a pod: the configured fractions of the node resources, minus what the excluded
 * containers already declare. Resources without a fraction are not part of the budget.
 */
public class BudgetCalculator {
    private final NodeResourceSource source;

    /**
     * Constructor
     *
     * @param source    Node resources the fractions apply to
     */
    public BudgetCalculator(NodeResourceSource source) {
        this.source = source;
    }

    /**
     * @param node          Node the pod is pinned to
     * @param fractions     Configured fractions
     * @param containers    Containers of the pod
     * @param excluded      Names of the excluded containers
     *
     * @return  The pod budget
     */
    public ResourceProperties budget(Node node, ResourceProperties fractions, List<Container> containers, Set<String> excluded) {
        ResourceProperties budget = ResourceProperties.fromNodeResources(source.resources(node)).mul(fractions);
        return budget.subtract(excludedTotals(containers, excluded));
    }

    /* test */ static ResourceProperties excludedTotals(List<Container> containers, Set<String> excluded) {
        ResourceProperties total = new ResourceProperties();

        for (Container container : containers) {
            if (excluded.contains(container.getName())) {
                total.add(ResourceProperties.fromResourceRequirements(container.getResources()));
            }
        }

        return total;
    }
}
