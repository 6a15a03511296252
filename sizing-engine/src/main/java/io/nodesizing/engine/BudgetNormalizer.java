/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine;

import io.nodesizing.common.AdmissionContext;
import io.nodesizing.common.SizingLogger;
import io.nodesizing.engine.model.ResourceBinding;
import io.nodesizing.engine.model.ResourceProperties;
import io.nodesizing.engine.model.ResourceRole;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the pod budget and the container shares into the final container resources
 */
public class BudgetNormalizer {
    private static final SizingLogger LOGGER = SizingLogger.create(BudgetNormalizer.class);

    private final AdmissionContext context;
    private int limitCorrections = 0;

    /**
     * Constructor
     *
     * @param context   Admission context used for logging
     */
    public BudgetNormalizer(AdmissionContext context) {
        this.context = context;
    }

    /**
     * Clamps the pod budget between the configured bounds. The budget is modified in place.
     *
     * @param budget        Pod budget
     * @param settings      Sizing settings with the bounds
     *
     * @return  The clamped budget
     */
    public ResourceProperties clamp(ResourceProperties budget, SizingSettings settings) {
        budget.clamp(settings.requestBounds(), ResourceRole.REQUESTS);
        budget.clamp(settings.limitBounds(), ResourceRole.LIMITS);
        return budget;
    }

    /**
     * Distributes the pod budget between the containers according to their shares and makes sure no request ends up
     * above its limit.
     *
     * @param shares    Shares of the containers
     * @param budget    Clamped pod budget
     *
     * @return  Final resources of each container, in the order of the shares
     *
     * @throws BudgetExhaustedException if a resource of the budget which is shared between the containers is not
     *                                  positive
     */
    public Map<String, ResourceProperties> distribute(Map<String, ResourceProperties> shares, ResourceProperties budget) {
        checkDistributable(shares, budget);

        Map<String, ResourceProperties> resources = new LinkedHashMap<>();

        for (Map.Entry<String, ResourceProperties> share : shares.entrySet()) {
            ResourceProperties containerResources = share.getValue().mul(budget);

            List<String> corrected = containerResources.forceLimitAboveRequest();
            if (!corrected.isEmpty()) {
                LOGGER.warnPod(context, "Requests of container {} were above limits for {} and were lowered to the limits", share.getKey(), corrected);
                limitCorrections += corrected.size();
            }

            resources.put(share.getKey(), containerResources);
        }

        return resources;
    }

    /**
     * Budget resources no container has a share in are never distributed, so only the shared ones have to be positive.
     */
    private static void checkDistributable(Map<String, ResourceProperties> shares, ResourceProperties budget) {
        for (ResourceBinding binding : budget.all()) {
            if (binding.value() <= 0 && isShared(shares, binding)) {
                throw new BudgetExhaustedException("The pod budget for " + binding.role() + "." + binding.resourceName()
                        + " is " + binding.humanValue() + ": the excluded containers use more than the configured fraction of the node");
            }
        }
    }

    private static boolean isShared(Map<String, ResourceProperties> shares, ResourceBinding binding) {
        return shares.values().stream().anyMatch(share -> share.has(binding.role(), binding.resourceName()));
    }

    /**
     * @return  Number of requests lowered to their limit so far
     */
    public int limitCorrections() {
        return limitCorrections;
    }
}
