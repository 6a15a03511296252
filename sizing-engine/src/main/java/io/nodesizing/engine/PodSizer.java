/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import io.nodesizing.common.AdmissionContext;
import io.nodesizing.common.SizingLogger;
import io.nodesizing.engine.model.ResourceProperties;

import java.util.List;
import java.util.Map;

/**
 * Sizes the containers of a pod according to the node the pod is pinned to:
 *
 * <ol>
 *     <li>parses the sizing annotations,</li>
 *     <li>resolves the node from the node affinity,</li>
 *     <li>computes the share of each container in the pod resources,</li>
 *     <li>computes the pod budget from the node resources and clamps it,</li>
 *     <li>distributes the budget and renders the patch.</li>
 * </ol>
 *
 * Any failure aborts the whole sizing: a partial patch is never returned.
 */
public class PodSizer {
    private static final SizingLogger LOGGER = SizingLogger.create(PodSizer.class);

    private final NodeResolver nodeResolver;
    private final BudgetCalculator budgetCalculator;

    /**
     * Constructor
     *
     * @param nodes     Provider of the known nodes
     * @param source    Node resources the fractions apply to
     */
    public PodSizer(NodeSnapshotProvider nodes, NodeResourceSource source) {
        this.nodeResolver = new NodeResolver(nodes);
        this.budgetCalculator = new BudgetCalculator(source);
    }

    /**
     * @param pod       The pod to size
     * @param context   Admission context
     *
     * @return  The sizing result
     *
     * @throws SizingException if the pod cannot be sized
     */
    public SizingResult size(Pod pod, AdmissionContext context) {
        SizingSettings settings = SizingAnnotations.parse(pod.getMetadata() != null ? pod.getMetadata().getAnnotations() : null);

        if (!settings.hasFractions()) {
            LOGGER.debugPod(context, "No sizing fraction is configured, the pod is left unchanged");
            return SizingResult.UNCHANGED;
        }

        List<Container> containers = pod.getSpec() != null && pod.getSpec().getContainers() != null ? pod.getSpec().getContainers() : List.of();

        Node node = nodeResolver.resolve(pod);
        LOGGER.debugPod(context, "Sizing pod for node {} with fractions {} and excluded containers {}", NodeResolver.nodeName(pod), settings.fractions(), settings.excludedContainers());

        Map<String, ResourceProperties> shares = ProportionalAllocator.shares(containers, settings.excludedContainers());
        LOGGER.debugPod(context, "Container shares: {}", shares);

        ResourceProperties budget = budgetCalculator.budget(node, settings.fractions(), containers, settings.excludedContainers());
        LOGGER.debugPod(context, "Pod budget: {}", budget);

        BudgetNormalizer normalizer = new BudgetNormalizer(context);
        normalizer.clamp(budget, settings);
        LOGGER.debugPod(context, "Clamped pod budget: {}", budget);

        Map<String, ResourceProperties> resources = normalizer.distribute(shares, budget);
        LOGGER.debugPod(context, "Container resources: {}", resources);

        List<PatchOperation> operations = PatchBuilder.build(containers, resources);
        if (operations.isEmpty()) {
            LOGGER.debugPod(context, "Sizing finished without any patch");
        } else {
            LOGGER.debugPod(context, "Sizing finished with {} patch operations", operations.size());
        }

        return new SizingResult(operations, normalizer.limitCorrections());
    }
}
