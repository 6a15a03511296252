/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeSelectorRequirement;
import io.fabric8.kubernetes.api.model.NodeSelectorTerm;
import io.fabric8.kubernetes.api.model.Pod;

import java.util.List;

/**
 * Finds the node a pod is pinned to. The pod's nodeName is not set yet when it is created, so the node is read from
 * the required node affinity, which must have exactly this shape:
 *
 * <pre>
 * spec:
 *   affinity:
 *     nodeAffinity:
 *       requiredDuringSchedulingIgnoredDuringExecution:
 *         nodeSelectorTerms:
 *         - matchFields:
 *           - key: metadata.name
 *             operator: In
 *             values:
 *             - my-node
 * </pre>
 *
 * This is the shape DaemonSet controllers give to their pods. The matchExpressions of the term are ignored.
 */
public class NodeResolver {
    /* test */ static final String NODE_NAME_FIELD = "metadata.name";
    /* test */ static final String OPERATOR_IN = "In";

    private final NodeSnapshotProvider nodes;

    /**
     * Constructor
     *
     * @param nodes     Provider of the known nodes
     */
    public NodeResolver(NodeSnapshotProvider nodes) {
        this.nodes = nodes;
    }

    /**
     * @param pod   The pod
     *
     * @return  Name of the node the pod is pinned to
     *
     * @throws NodeResolutionException if the node affinity does not have the expected shape
     */
    public static String nodeName(Pod pod) {
        if (pod.getSpec() == null || pod.getSpec().getAffinity() == null) {
            throw new NodeResolutionException("Pod does not have affinity");
        } else if (pod.getSpec().getAffinity().getNodeAffinity() == null) {
            throw new NodeResolutionException("Pod does not have affinity.nodeAffinity");
        } else if (pod.getSpec().getAffinity().getNodeAffinity().getRequiredDuringSchedulingIgnoredDuringExecution() == null) {
            throw new NodeResolutionException("Pod does not have affinity.nodeAffinity.requiredDuringSchedulingIgnoredDuringExecution");
        }

        List<NodeSelectorTerm> terms = pod.getSpec().getAffinity().getNodeAffinity().getRequiredDuringSchedulingIgnoredDuringExecution().getNodeSelectorTerms();
        if (terms == null || terms.size() != 1) {
            throw new NodeResolutionException("Pod should have exactly one nodeSelectorTerm but has " + (terms == null ? 0 : terms.size()));
        }

        List<NodeSelectorRequirement> fields = terms.get(0).getMatchFields();
        if (fields == null || fields.size() != 1) {
            throw new NodeResolutionException("The nodeSelectorTerm should have exactly one matchFields entry but has " + (fields == null ? 0 : fields.size()));
        }

        NodeSelectorRequirement field = fields.get(0);
        if (!NODE_NAME_FIELD.equals(field.getKey())) {
            throw new NodeResolutionException("The matchFields entry should use key " + NODE_NAME_FIELD + " but uses " + field.getKey());
        } else if (!OPERATOR_IN.equals(field.getOperator())) {
            throw new NodeResolutionException("The matchFields entry should use operator " + OPERATOR_IN + " but uses " + field.getOperator());
        } else if (field.getValues() == null || field.getValues().size() != 1) {
            throw new NodeResolutionException("The matchFields entry should have exactly one value but has " + (field.getValues() == null ? 0 : field.getValues().size()));
        }

        return field.getValues().get(0);
    }

    /**
     * @param pod   The pod
     *
     * @return  The node the pod is pinned to
     *
     * @throws NodeResolutionException if the node cannot be determined or is not known
     */
    public Node resolve(Pod pod) {
        String name = nodeName(pod);
        Node node = nodes.get(name);

        if (node == null) {
            throw new NodeResolutionException("Cannot find node " + name);
        }

        return node;
    }
}
