/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine.model;

import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import io.nodesizing.engine.MissingBindingException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Set of resource bindings describing one container or one pod at some stage of the sizing. There is at most one
 * binding per role and resource. A missing binding means the resource is not set, which is different from a binding
 * with a zero value.
 *
 * <p>{@link #add(ResourceProperties)}, {@link #subtract(ResourceProperties)}, {@link #clamp(ResourceProperties)} and
 * {@link #forceLimitAboveRequest()} modify the receiver. All other operations return new instances. Bindings are
 * immutable, so two instances never share mutable state.</p>
 */
public class ResourceProperties {
    private final Map<ResourceRole, TreeMap<String, ResourceBinding>> bindings = new EnumMap<>(ResourceRole.class);

    /**
     * Creates empty resource properties
     */
    public ResourceProperties() {
        for (ResourceRole role : ResourceRole.values()) {
            bindings.put(role, new TreeMap<>());
        }
    }

    /**
     * Creates quantity bindings from the resource requirements of a container.
     *
     * @param requirements  Resource requirements of the container (can be null)
     *
     * @return  Resource properties with one binding per request and limit
     */
    public static ResourceProperties fromResourceRequirements(ResourceRequirements requirements) {
        ResourceProperties properties = new ResourceProperties();

        if (requirements != null) {
            bindQuantities(properties, ResourceRole.REQUESTS, requirements.getRequests());
            bindQuantities(properties, ResourceRole.LIMITS, requirements.getLimits());
        }

        return properties;
    }

    /**
     * Creates quantity bindings from the resources of a node. Every resource is bound both as a request and as a
     * limit, so that the node can be multiplied by request and limit fractions alike.
     *
     * @param resources     Node resources (capacity or allocatable)
     *
     * @return  Resource properties with the node resources
     */
    public static ResourceProperties fromNodeResources(Map<String, Quantity> resources) {
        ResourceProperties properties = new ResourceProperties();

        if (resources != null) {
            bindQuantities(properties, ResourceRole.REQUESTS, resources);
            bindQuantities(properties, ResourceRole.LIMITS, resources);
        }

        return properties;
    }

    private static void bindQuantities(ResourceProperties properties, ResourceRole role, Map<String, Quantity> quantities) {
        if (quantities != null) {
            for (Map.Entry<String, Quantity> entry : quantities.entrySet()) {
                if (entry.getValue() != null) {
                    properties.bind(ResourceKind.QUANTITY, role, entry.getKey(), entry.getValue().getNumericalAmount().doubleValue());
                }
            }
        }
    }

    /**
     * Adds a binding, replacing any previous binding with the same role and resource.
     *
     * @param binding   The binding
     *
     * @return  This instance
     */
    public ResourceProperties bind(ResourceBinding binding) {
        bindings.get(binding.role()).put(binding.resourceName(), binding);
        return this;
    }

    /**
     * Binds a value.
     *
     * @param kind          Kind of the value
     * @param role          Role of the value
     * @param resourceName  Name of the resource
     * @param value         The value
     *
     * @return  This instance
     */
    public ResourceProperties bind(ResourceKind kind, ResourceRole role, String resourceName, double value) {
        return bind(new ResourceBinding(kind, role, resourceName, value));
    }

    /**
     * Parses and binds a value.
     *
     * @param kind          Kind of the value
     * @param role          Role of the value
     * @param resourceName  Name of the resource
     * @param text          The value to parse according to its kind
     *
     * @return  This instance
     *
     * @throws io.nodesizing.engine.InvalidAnnotationValueException if the value cannot be parsed
     */
    public ResourceProperties bind(ResourceKind kind, ResourceRole role, String resourceName, String text) {
        return bind(kind, role, resourceName, kind.parse(text));
    }

    /**
     * @param role          Role
     * @param resourceName  Resource name
     *
     * @return  The binding or null when the resource is not set for this role
     */
    public ResourceBinding get(ResourceRole role, String resourceName) {
        return bindings.get(role).get(resourceName);
    }

    /**
     * @param role          Role
     * @param resourceName  Resource name
     *
     * @return  True if the resource is set for this role
     */
    public boolean has(ResourceRole role, String resourceName) {
        return bindings.get(role).containsKey(resourceName);
    }

    /**
     * @return  All the bindings, ordered by role and then by resource name
     */
    public List<ResourceBinding> all() {
        List<ResourceBinding> all = new ArrayList<>();
        for (TreeMap<String, ResourceBinding> roleBindings : bindings.values()) {
            all.addAll(roleBindings.values());
        }
        return all;
    }

    /**
     * @param role  Role
     *
     * @return  Bindings of a single role, ordered by resource name
     */
    public List<ResourceBinding> all(ResourceRole role) {
        return List.copyOf(bindings.get(role).values());
    }

    /**
     * @return  Names of all the resources bound in any role
     */
    public List<String> resourceNames() {
        TreeSet<String> names = new TreeSet<>();
        for (TreeMap<String, ResourceBinding> roleBindings : bindings.values()) {
            names.addAll(roleBindings.keySet());
        }
        return List.copyOf(names);
    }

    /**
     * @return  True when nothing is bound
     */
    public boolean isEmpty() {
        return bindings.values().stream().allMatch(Map::isEmpty);
    }

    /**
     * @return  A copy of these properties
     */
    public ResourceProperties copy() {
        ResourceProperties copy = new ResourceProperties();
        all().forEach(copy::bind);
        return copy;
    }

    /**
     * Sums the other bindings into this instance. Bindings not set here are copied.
     *
     * @param other     Properties to add
     *
     * @return  This instance
     */
    public ResourceProperties add(ResourceProperties other) {
        for (ResourceBinding binding : other.all()) {
            ResourceBinding current = get(binding.role(), binding.resourceName());
            if (current == null) {
                bind(binding);
            } else {
                bind(current.withValue(current.value() + binding.value()));
            }
        }

        return this;
    }

    /**
     * Subtracts the other bindings from this instance. Only the bindings of this instance are considered: resources
     * set only in the other properties are ignored.
     *
     * @param other     Properties to subtract
     *
     * @return  This instance
     */
    public ResourceProperties subtract(ResourceProperties other) {
        for (ResourceBinding binding : all()) {
            ResourceBinding operand = other.get(binding.role(), binding.resourceName());
            if (operand != null) {
                bind(binding.withValue(binding.value() - operand.value()));
            }
        }

        return this;
    }

    /**
     * Multiplies the bindings set in both instances. Bindings set in only one of them are dropped.
     *
     * @param other     The other operand
     *
     * @return  New resource properties with the products
     */
    public ResourceProperties mul(ResourceProperties other) {
        ResourceProperties result = new ResourceProperties();

        for (ResourceBinding binding : all()) {
            ResourceBinding operand = other.get(binding.role(), binding.resourceName());
            if (operand != null) {
                result.bind(binding.withValue(ResourceKind.product(binding.kind(), operand.kind()), binding.value() * operand.value()));
            }
        }

        return result;
    }

    /**
     * Divides each binding of this instance by the matching binding of the other instance.
     *
     * @param other     The divisor
     *
     * @return  New resource properties with the quotients
     *
     * @throws MissingBindingException if the divisor misses one of the bindings of this instance
     */
    public ResourceProperties div(ResourceProperties other) {
        ResourceProperties result = new ResourceProperties();

        for (ResourceBinding binding : all()) {
            ResourceBinding operand = other.get(binding.role(), binding.resourceName());
            if (operand == null) {
                throw new MissingBindingException("Cannot divide " + binding + ": " + binding.role() + "." + binding.resourceName() + " is not set in the divisor");
            }
            result.bind(binding.withValue(ResourceKind.quotient(binding.kind(), operand.kind()), binding.value() / operand.value()));
        }

        return result;
    }

    /**
     * @return  New resource properties without the bindings whose value is zero
     */
    public ResourceProperties retainNonZero() {
        ResourceProperties result = new ResourceProperties();
        all().stream().filter(b -> b.value() != 0).forEach(result::bind);
        return result;
    }

    /**
     * @param other     Properties whose coordinates are retained
     *
     * @return  New resource properties with only the bindings whose role and resource are also set in the other
     *          instance
     */
    public ResourceProperties retainMatching(ResourceProperties other) {
        ResourceProperties result = new ResourceProperties();
        all().stream().filter(b -> other.has(b.role(), b.resourceName())).forEach(result::bind);
        return result;
    }

    /**
     * Lowers each request which is above its limit down to the limit. Limits are never changed.
     *
     * @return  Names of the resources whose request was lowered
     */
    public List<String> forceLimitAboveRequest() {
        List<String> corrected = new ArrayList<>();

        for (ResourceBinding limit : all(ResourceRole.LIMITS)) {
            ResourceBinding request = get(ResourceRole.REQUESTS, limit.resourceName());
            if (request != null && request.value() > limit.value()) {
                bind(request.withValue(limit.value()));
                corrected.add(limit.resourceName());
            }
        }

        return corrected;
    }

    /**
     * Clamps the requests and the limits between the pod minimum and the pod maximum set in the bounds.
     *
     * @param bounds    Properties with {@link ResourceRole#POD_MINIMUM} and {@link ResourceRole#POD_MAXIMUM} bindings
     *
     * @return  This instance
     */
    public ResourceProperties clamp(ResourceProperties bounds) {
        clamp(bounds, ResourceRole.REQUESTS);
        return clamp(bounds, ResourceRole.LIMITS);
    }

    /**
     * Clamps the bindings of a single role between the pod minimum and the pod maximum set in the bounds.
     *
     * @param bounds    Properties with {@link ResourceRole#POD_MINIMUM} and {@link ResourceRole#POD_MAXIMUM} bindings
     * @param role      Role to clamp
     *
     * @return  This instance
     */
    public ResourceProperties clamp(ResourceProperties bounds, ResourceRole role) {
        for (ResourceBinding binding : all(role)) {
            ResourceBinding minimum = bounds.get(ResourceRole.POD_MINIMUM, binding.resourceName());
            ResourceBinding maximum = bounds.get(ResourceRole.POD_MAXIMUM, binding.resourceName());

            double value = binding.value();
            if (minimum != null && value < minimum.value()) {
                value = minimum.value();
            }
            if (maximum != null && value > maximum.value()) {
                value = maximum.value();
            }

            if (value != binding.value()) {
                bind(binding.withValue(value));
            }
        }

        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o == null || getClass() != o.getClass()) {
            return false;
        } else {
            return bindings.equals(((ResourceProperties) o).bindings);
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(bindings);
    }

    @Override
    public String toString() {
        return all().stream().map(ResourceBinding::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
