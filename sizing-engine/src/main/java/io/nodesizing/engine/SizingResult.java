/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine;

import java.util.List;

/**
 * Outcome of the sizing of a pod
 *
 * @param operations        Patch operations, empty when the pod is left unchanged
 * @param limitCorrections  Number of requests which had to be lowered to their limit
 */
public record SizingResult(List<PatchOperation> operations, int limitCorrections) {
    /**
     * Result of a pod which is left unchanged
     */
    public static final SizingResult UNCHANGED = new SizingResult(List.of(), 0);

    /**
     * @return  True when the pod needs to be patched
     */
    public boolean hasPatch() {
        return !operations.isEmpty();
    }
}
