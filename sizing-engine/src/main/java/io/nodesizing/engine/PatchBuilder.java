/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.Container;
import io.nodesizing.common.Util;
import io.nodesizing.engine.model.ResourceBinding;
import io.nodesizing.engine.model.ResourceProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders the final container resources as JSON Patch operations
 */
public class PatchBuilder {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * JSON pointer to the status annotation
     */
    public static final String STATUS_PATH = "/metadata/annotations/" + Util.escapeJsonPointerToken(SizingAnnotations.ANNO_STATUS);

    private PatchBuilder() { }

    /**
     * Builds the patch. Each binding of each container becomes one replace operation, containers are visited in pod
     * order. When at least one resource is replaced, the status annotation with the number of replaced resources is
     * added at the end.
     *
     * @param containers    Containers of the pod
     * @param resources     Final resources per container name. Containers without an entry are not patched.
     *
     * @return  List of operations, empty when nothing is patched
     */
    public static List<PatchOperation> build(List<Container> containers, Map<String, ResourceProperties> resources) {
        List<PatchOperation> operations = new ArrayList<>();

        for (int i = 0; i < containers.size(); i++) {
            ResourceProperties containerResources = resources.get(containers.get(i).getName());
            if (containerResources != null) {
                for (ResourceBinding binding : containerResources.all()) {
                    operations.add(PatchOperation.replace(binding.jsonPath(i), binding.humanValue()));
                }
            }
        }

        if (!operations.isEmpty()) {
            operations.add(PatchOperation.add(STATUS_PATH, "patch_count=" + operations.size()));
        }

        return operations;
    }

    /**
     * @param operations    Patch operations
     *
     * @return  The operations serialized as a JSON array
     */
    public static byte[] toJson(List<PatchOperation> operations) {
        try {
            return MAPPER.writeValueAsBytes(operations);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize the patch", e);
        }
    }
}
