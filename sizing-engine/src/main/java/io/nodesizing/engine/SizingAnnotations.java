/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine;

import io.nodesizing.engine.model.ResourceKind;
import io.nodesizing.engine.model.ResourceProperties;
import io.nodesizing.engine.model.ResourceRole;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Annotations recognized on the pods and their parsing into {@link SizingSettings}
 */
public class SizingAnnotations {
    /**
     * Prefix of all the annotations
     */
    public static final String DOMAIN = "node-specific-sizing.manomano.tech/";

    public static final String ANNO_REQUEST_CPU_FRACTION = DOMAIN + "request-cpu-fraction";
    public static final String ANNO_REQUEST_MEMORY_FRACTION = DOMAIN + "request-memory-fraction";
    public static final String ANNO_LIMIT_CPU_FRACTION = DOMAIN + "limit-cpu-fraction";
    public static final String ANNO_LIMIT_MEMORY_FRACTION = DOMAIN + "limit-memory-fraction";

    public static final String ANNO_MINIMUM_CPU = DOMAIN + "minimum-cpu";
    public static final String ANNO_MINIMUM_MEMORY = DOMAIN + "minimum-memory";
    public static final String ANNO_MAXIMUM_CPU = DOMAIN + "maximum-cpu";
    public static final String ANNO_MAXIMUM_MEMORY = DOMAIN + "maximum-memory";

    public static final String ANNO_MINIMUM_CPU_REQUEST = DOMAIN + "minimum-cpu-request";
    public static final String ANNO_MINIMUM_CPU_LIMIT = DOMAIN + "minimum-cpu-limit";
    public static final String ANNO_MINIMUM_MEMORY_REQUEST = DOMAIN + "minimum-memory-request";
    public static final String ANNO_MINIMUM_MEMORY_LIMIT = DOMAIN + "minimum-memory-limit";
    public static final String ANNO_MAXIMUM_CPU_REQUEST = DOMAIN + "maximum-cpu-request";
    public static final String ANNO_MAXIMUM_CPU_LIMIT = DOMAIN + "maximum-cpu-limit";
    public static final String ANNO_MAXIMUM_MEMORY_REQUEST = DOMAIN + "maximum-memory-request";
    public static final String ANNO_MAXIMUM_MEMORY_LIMIT = DOMAIN + "maximum-memory-limit";

    public static final String ANNO_EXCLUDED_CONTAINERS = DOMAIN + "excluded-containers";

    /**
     * Annotation added to the patched pods with the number of patched resources
     */
    public static final String ANNO_STATUS = DOMAIN + "status";

    private static final String CPU = "cpu";
    private static final String MEMORY = "memory";

    /**
     * Where a recognized annotation goes. The applyTo list holds the bound sets (requests or limits bounds) the value
     * is bound into. It is empty for fractions, which always go into the fractions set.
     */
    private record Target(ResourceKind kind, ResourceRole role, String resourceName, List<ResourceRole> applyTo) { }

    private static final List<ResourceRole> BOTH = List.of(ResourceRole.REQUESTS, ResourceRole.LIMITS);
    private static final List<ResourceRole> REQUESTS_ONLY = List.of(ResourceRole.REQUESTS);
    private static final List<ResourceRole> LIMITS_ONLY = List.of(ResourceRole.LIMITS);

    // Shared bounds come first so that the role specific ones override them
    private static final Map<String, Target> TARGETS = orderedTargets();

    private static Map<String, Target> orderedTargets() {
        Map<String, Target> targets = new LinkedHashMap<>();
        targets.put(ANNO_REQUEST_CPU_FRACTION, new Target(ResourceKind.FRACTION, ResourceRole.REQUESTS, CPU, List.of()));
        targets.put(ANNO_REQUEST_MEMORY_FRACTION, new Target(ResourceKind.FRACTION, ResourceRole.REQUESTS, MEMORY, List.of()));
        targets.put(ANNO_LIMIT_CPU_FRACTION, new Target(ResourceKind.FRACTION, ResourceRole.LIMITS, CPU, List.of()));
        targets.put(ANNO_LIMIT_MEMORY_FRACTION, new Target(ResourceKind.FRACTION, ResourceRole.LIMITS, MEMORY, List.of()));

        targets.put(ANNO_MINIMUM_CPU, new Target(ResourceKind.QUANTITY, ResourceRole.POD_MINIMUM, CPU, BOTH));
        targets.put(ANNO_MINIMUM_MEMORY, new Target(ResourceKind.QUANTITY, ResourceRole.POD_MINIMUM, MEMORY, BOTH));
        targets.put(ANNO_MAXIMUM_CPU, new Target(ResourceKind.QUANTITY, ResourceRole.POD_MAXIMUM, CPU, BOTH));
        targets.put(ANNO_MAXIMUM_MEMORY, new Target(ResourceKind.QUANTITY, ResourceRole.POD_MAXIMUM, MEMORY, BOTH));

        targets.put(ANNO_MINIMUM_CPU_REQUEST, new Target(ResourceKind.QUANTITY, ResourceRole.POD_MINIMUM, CPU, REQUESTS_ONLY));
        targets.put(ANNO_MINIMUM_CPU_LIMIT, new Target(ResourceKind.QUANTITY, ResourceRole.POD_MINIMUM, CPU, LIMITS_ONLY));
        targets.put(ANNO_MINIMUM_MEMORY_REQUEST, new Target(ResourceKind.QUANTITY, ResourceRole.POD_MINIMUM, MEMORY, REQUESTS_ONLY));
        targets.put(ANNO_MINIMUM_MEMORY_LIMIT, new Target(ResourceKind.QUANTITY, ResourceRole.POD_MINIMUM, MEMORY, LIMITS_ONLY));
        targets.put(ANNO_MAXIMUM_CPU_REQUEST, new Target(ResourceKind.QUANTITY, ResourceRole.POD_MAXIMUM, CPU, REQUESTS_ONLY));
        targets.put(ANNO_MAXIMUM_CPU_LIMIT, new Target(ResourceKind.QUANTITY, ResourceRole.POD_MAXIMUM, CPU, LIMITS_ONLY));
        targets.put(ANNO_MAXIMUM_MEMORY_REQUEST, new Target(ResourceKind.QUANTITY, ResourceRole.POD_MAXIMUM, MEMORY, REQUESTS_ONLY));
        targets.put(ANNO_MAXIMUM_MEMORY_LIMIT, new Target(ResourceKind.QUANTITY, ResourceRole.POD_MAXIMUM, MEMORY, LIMITS_ONLY));
        return Collections.unmodifiableMap(targets);
    }

    private SizingAnnotations() { }

    /**
     * Parses the sizing annotations of a pod. Unknown annotations are ignored.
     *
     * @param annotations   Annotations of the pod (can be null)
     *
     * @return  The sizing settings
     *
     * @throws InvalidAnnotationValueException if any of the recognized annotations has an invalid value
     */
    public static SizingSettings parse(Map<String, String> annotations) {
        ResourceProperties fractions = new ResourceProperties();
        ResourceProperties requestBounds = new ResourceProperties();
        ResourceProperties limitBounds = new ResourceProperties();
        Set<String> excluded = Set.of();

        if (annotations == null) {
            return new SizingSettings(fractions, requestBounds, limitBounds, excluded);
        }

        for (Map.Entry<String, Target> entry : TARGETS.entrySet()) {
            String value = annotations.get(entry.getKey());
            if (value == null) {
                continue;
            }

            Target target = entry.getValue();
            double parsed = parseValue(entry.getKey(), target.kind(), value);

            if (target.applyTo().isEmpty()) {
                fractions.bind(target.kind(), target.role(), target.resourceName(), parsed);
            } else {
                for (ResourceRole role : target.applyTo()) {
                    ResourceProperties bounds = role == ResourceRole.REQUESTS ? requestBounds : limitBounds;
                    bounds.bind(target.kind(), target.role(), target.resourceName(), parsed);
                }
            }
        }

        String excludedContainers = annotations.get(ANNO_EXCLUDED_CONTAINERS);
        if (excludedContainers != null) {
            excluded = parseExcludedContainers(excludedContainers);
        }

        return new SizingSettings(fractions, requestBounds, limitBounds, excluded);
    }

    private static double parseValue(String annotation, ResourceKind kind, String value) {
        try {
            return kind.parse(value);
        } catch (InvalidAnnotationValueException e) {
            throw new InvalidAnnotationValueException("Invalid value of annotation " + annotation + ": " + e.getMessage(), e);
        }
    }

    /* test */ static Set<String> parseExcludedContainers(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
