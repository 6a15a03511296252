/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine.model;

import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import io.fabric8.kubernetes.api.model.ResourceRequirementsBuilder;
import io.nodesizing.engine.InvalidAnnotationValueException;
import io.nodesizing.engine.MissingBindingException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ResourcePropertiesTest {
    private static final String CPU = "cpu";
    private static final String MEMORY = "memory";

    private static ResourceProperties quantities(double requestCpu, double requestMemory, double limitCpu, double limitMemory) {
        return new ResourceProperties()
                .bind(ResourceKind.QUANTITY, ResourceRole.REQUESTS, CPU, requestCpu)
                .bind(ResourceKind.QUANTITY, ResourceRole.REQUESTS, MEMORY, requestMemory)
                .bind(ResourceKind.QUANTITY, ResourceRole.LIMITS, CPU, limitCpu)
                .bind(ResourceKind.QUANTITY, ResourceRole.LIMITS, MEMORY, limitMemory);
    }

    @Test
    public void testBindReplacesPreviousBinding() {
        ResourceProperties properties = new ResourceProperties()
                .bind(ResourceKind.QUANTITY, ResourceRole.REQUESTS, CPU, 1)
                .bind(ResourceKind.QUANTITY, ResourceRole.REQUESTS, CPU, 2);

        assertThat(properties.all().size(), is(1));
        assertThat(properties.get(ResourceRole.REQUESTS, CPU).value(), is(2.0));
        assertThat(properties.has(ResourceRole.LIMITS, CPU), is(false));
        assertThat(properties.get(ResourceRole.LIMITS, CPU), is(nullValue()));
    }

    @Test
    public void testBindText() {
        ResourceProperties properties = new ResourceProperties()
                .bind(ResourceKind.FRACTION, ResourceRole.REQUESTS, CPU, "0.25")
                .bind(ResourceKind.QUANTITY, ResourceRole.POD_MINIMUM, MEMORY, "512Mi");

        assertThat(properties.get(ResourceRole.REQUESTS, CPU).value(), is(0.25));
        assertThat(properties.get(ResourceRole.REQUESTS, CPU).kind(), is(ResourceKind.FRACTION));
        assertThat(properties.get(ResourceRole.POD_MINIMUM, MEMORY).value(), is(536_870_912.0));
    }

    @Test
    public void testBindInvalidText() {
        ResourceProperties properties = new ResourceProperties();

        assertThrows(InvalidAnnotationValueException.class, () -> properties.bind(ResourceKind.FRACTION, ResourceRole.REQUESTS, CPU, "1.5"));
        assertThrows(InvalidAnnotationValueException.class, () -> properties.bind(ResourceKind.FRACTION, ResourceRole.REQUESTS, CPU, "0"));
        assertThrows(InvalidAnnotationValueException.class, () -> properties.bind(ResourceKind.FRACTION, ResourceRole.REQUESTS, CPU, "-0.1"));
        assertThrows(InvalidAnnotationValueException.class, () -> properties.bind(ResourceKind.FRACTION, ResourceRole.REQUESTS, CPU, "10%"));
        assertThrows(InvalidAnnotationValueException.class, () -> properties.bind(ResourceKind.QUANTITY, ResourceRole.POD_MINIMUM, CPU, "-1"));
        assertThrows(InvalidAnnotationValueException.class, () -> properties.bind(ResourceKind.QUANTITY, ResourceRole.POD_MINIMUM, CPU, "lots"));
        assertThrows(InvalidAnnotationValueException.class, () -> properties.bind(ResourceKind.QUANTITY, ResourceRole.POD_MINIMUM, CPU, "1e400"));
        assertThrows(InvalidAnnotationValueException.class, () -> properties.bind(ResourceKind.QUANTITY, ResourceRole.POD_MAXIMUM, CPU, "1e2147483647"));
        assertThrows(InvalidAnnotationValueException.class, () -> properties.bind(ResourceKind.FRACTION, ResourceRole.REQUESTS, CPU, "1e400"));

        assertThat(properties.isEmpty(), is(true));
    }

    @Test
    public void testFractionBounds() {
        assertThat(ResourceKind.FRACTION.parse("1"), is(1.0));
        assertThat(ResourceKind.FRACTION.parse("0.000001"), is(0.000001));
    }

    @Test
    public void testAdd() {
        ResourceProperties total = new ResourceProperties()
                .bind(ResourceKind.QUANTITY, ResourceRole.REQUESTS, CPU, 0.1);
        ResourceProperties other = quantities(0.3, 100, 1, 200);

        ResourceProperties result = total.add(other);

        assertThat(result == total, is(true));
        assertThat(total.get(ResourceRole.REQUESTS, CPU).value(), closeTo(0.4, 1e-12));
        assertThat(total.get(ResourceRole.REQUESTS, MEMORY).value(), is(100.0));
        assertThat(total.get(ResourceRole.LIMITS, CPU).value(), is(1.0));
        assertThat(total.get(ResourceRole.LIMITS, MEMORY).value(), is(200.0));
        // The operand is not modified
        assertThat(other.get(ResourceRole.REQUESTS, CPU).value(), is(0.3));
    }

    @Test
    public void testSubtractIgnoresBindingsOnlyInOperand() {
        ResourceProperties budget = new ResourceProperties()
                .bind(ResourceKind.QUANTITY, ResourceRole.REQUESTS, CPU, 1);

        budget.subtract(quantities(0.25, 100, 1, 200));

        assertThat(budget.all().size(), is(1));
        assertThat(budget.get(ResourceRole.REQUESTS, CPU).value(), is(0.75));
    }

    @Test
    public void testMulKeepsOnlyMatchingBindings() {
        ResourceProperties node = new ResourceProperties()
                .bind(ResourceKind.QUANTITY, ResourceRole.REQUESTS, CPU, 4)
                .bind(ResourceKind.QUANTITY, ResourceRole.REQUESTS, MEMORY, 8_589_934_592.0)
                .bind(ResourceKind.QUANTITY, ResourceRole.LIMITS, CPU, 4);
        ResourceProperties fractions = new ResourceProperties()
                .bind(ResourceKind.FRACTION, ResourceRole.REQUESTS, CPU, 0.1)
                .bind(ResourceKind.FRACTION, ResourceRole.LIMITS, MEMORY, 0.5);

        ResourceProperties budget = node.mul(fractions);

        assertThat(budget.all().size(), is(1));
        assertThat(budget.get(ResourceRole.REQUESTS, CPU).value(), closeTo(0.4, 1e-12));
        assertThat(budget.get(ResourceRole.REQUESTS, CPU).kind(), is(ResourceKind.QUANTITY));
        // Operands are not modified
        assertThat(node.all().size(), is(3));
        assertThat(fractions.all().size(), is(2));
    }

    @Test
    public void testMulKinds() {
        ResourceProperties fraction = new ResourceProperties().bind(ResourceKind.FRACTION, ResourceRole.REQUESTS, CPU, 0.5);
        ResourceProperties quantity = new ResourceProperties().bind(ResourceKind.QUANTITY, ResourceRole.REQUESTS, CPU, 2);

        assertThat(fraction.mul(fraction).get(ResourceRole.REQUESTS, CPU).kind(), is(ResourceKind.FRACTION));
        assertThat(fraction.mul(quantity).get(ResourceRole.REQUESTS, CPU).kind(), is(ResourceKind.QUANTITY));
        assertThat(quantity.mul(fraction).get(ResourceRole.REQUESTS, CPU).kind(), is(ResourceKind.QUANTITY));
        assertThat(quantity.mul(quantity).get(ResourceRole.REQUESTS, CPU).kind(), is(ResourceKind.QUANTITY));
    }

    @Test
    public void testDivKinds() {
        ResourceProperties fraction = new ResourceProperties().bind(ResourceKind.FRACTION, ResourceRole.REQUESTS, CPU, 0.5);
        ResourceProperties quantity = new ResourceProperties().bind(ResourceKind.QUANTITY, ResourceRole.REQUESTS, CPU, 2);

        assertThat(quantity.div(quantity).get(ResourceRole.REQUESTS, CPU).kind(), is(ResourceKind.FRACTION));
        assertThat(fraction.div(fraction).get(ResourceRole.REQUESTS, CPU).kind(), is(ResourceKind.FRACTION));
        assertThat(quantity.div(fraction).get(ResourceRole.REQUESTS, CPU).kind(), is(ResourceKind.QUANTITY));
        assertThat(quantity.div(fraction).get(ResourceRole.REQUESTS, CPU).value(), is(4.0));
    }

    @Test
    public void testDivWithMissingBindingThrows() {
        ResourceProperties dividend = quantities(0.1, 100, 0.2, 200);
        ResourceProperties divisor = new ResourceProperties()
                .bind(ResourceKind.QUANTITY, ResourceRole.REQUESTS, CPU, 0.4);

        MissingBindingException e = assertThrows(MissingBindingException.class, () -> dividend.div(divisor));
        assertThat(e.getMessage().contains("limits.cpu"), is(true));
    }

    @Test
    public void testMulOfDivGivesBackTheDividend() {
        ResourceProperties x = quantities(0.1, 104_857_600, 0.3, 943_718_400);
        ResourceProperties y = quantities(0.4, 1_048_576_000, 1.7, 3_000_000_000.0);

        ResourceProperties result = x.div(y).mul(y);

        for (ResourceBinding binding : x.all()) {
            assertThat(result.get(binding.role(), binding.resourceName()).value(), closeTo(binding.value(), Math.abs(binding.value()) * 1e-12));
        }
    }

    @Test
    public void testRetainNonZero() {
        ResourceProperties properties = quantities(0, 100, 1, 0).retainNonZero();

        assertThat(properties.all().size(), is(2));
        assertThat(properties.has(ResourceRole.REQUESTS, CPU), is(false));
        assertThat(properties.has(ResourceRole.LIMITS, MEMORY), is(false));
    }

    @Test
    public void testRetainMatching() {
        ResourceProperties coordinates = new ResourceProperties()
                .bind(ResourceKind.QUANTITY, ResourceRole.LIMITS, MEMORY, 1);

        ResourceProperties properties = quantities(0.1, 100, 1, 200).retainMatching(coordinates);

        assertThat(properties.all().size(), is(1));
        assertThat(properties.get(ResourceRole.LIMITS, MEMORY).value(), is(200.0));
    }

    @Test
    public void testForceLimitAboveRequest() {
        ResourceProperties properties = quantities(2, 100, 1, 200);

        List<String> corrected = properties.forceLimitAboveRequest();

        assertThat(corrected, contains(CPU));
        assertThat(properties.get(ResourceRole.REQUESTS, CPU).value(), is(1.0));
        assertThat(properties.get(ResourceRole.LIMITS, CPU).value(), is(1.0));
        // Requests below their limit are never raised
        assertThat(properties.get(ResourceRole.REQUESTS, MEMORY).value(), is(100.0));
    }

    @Test
    public void testForceLimitAboveRequestIsIdempotent() {
        ResourceProperties properties = quantities(2, 300, 1, 200);

        properties.forceLimitAboveRequest();
        ResourceProperties once = properties.copy();

        assertThat(properties.forceLimitAboveRequest(), is(empty()));
        assertThat(properties, is(once));
    }

    @Test
    public void testForceLimitAboveRequestWithoutLimits() {
        ResourceProperties properties = new ResourceProperties()
                .bind(ResourceKind.QUANTITY, ResourceRole.REQUESTS, CPU, 2);

        assertThat(properties.forceLimitAboveRequest(), is(empty()));
        assertThat(properties.get(ResourceRole.REQUESTS, CPU).value(), is(2.0));
    }

    @Test
    public void testClamp() {
        ResourceProperties bounds = new ResourceProperties()
                .bind(ResourceKind.QUANTITY, ResourceRole.POD_MINIMUM, CPU, 0.5)
                .bind(ResourceKind.QUANTITY, ResourceRole.POD_MAXIMUM, CPU, 1.5)
                .bind(ResourceKind.QUANTITY, ResourceRole.POD_MAXIMUM, MEMORY, 150);

        ResourceProperties properties = quantities(0.1, 100, 2, 200).clamp(bounds);

        assertThat(properties.get(ResourceRole.REQUESTS, CPU).value(), is(0.5));
        assertThat(properties.get(ResourceRole.LIMITS, CPU).value(), is(1.5));
        assertThat(properties.get(ResourceRole.REQUESTS, MEMORY).value(), is(100.0));
        assertThat(properties.get(ResourceRole.LIMITS, MEMORY).value(), is(150.0));
    }

    @Test
    public void testClampStaysWithinBounds() {
        ResourceProperties bounds = new ResourceProperties()
                .bind(ResourceKind.QUANTITY, ResourceRole.POD_MINIMUM, CPU, 0.5)
                .bind(ResourceKind.QUANTITY, ResourceRole.POD_MAXIMUM, CPU, 1.5);

        for (double value : new double[] {-1, 0, 0.25, 0.5, 1, 1.5, 3, 1e9}) {
            ResourceProperties properties = quantities(value, 1, value, 1).clamp(bounds);

            for (ResourceRole role : List.of(ResourceRole.REQUESTS, ResourceRole.LIMITS)) {
                double clamped = properties.get(role, CPU).value();
                assertThat(clamped >= 0.5 && clamped <= 1.5, is(true));
            }
        }
    }

    @Test
    public void testClampWithoutBoundsIsNoOp() {
        ResourceProperties properties = quantities(0.1, 100, 2, 200);
        ResourceProperties before = properties.copy();

        properties.clamp(new ResourceProperties());

        assertThat(properties, is(before));
    }

    @Test
    public void testClampSingleRole() {
        ResourceProperties bounds = new ResourceProperties()
                .bind(ResourceKind.QUANTITY, ResourceRole.POD_MINIMUM, CPU, 0.5);

        ResourceProperties properties = quantities(0.1, 100, 0.2, 200).clamp(bounds, ResourceRole.REQUESTS);

        assertThat(properties.get(ResourceRole.REQUESTS, CPU).value(), is(0.5));
        assertThat(properties.get(ResourceRole.LIMITS, CPU).value(), is(0.2));
    }

    @Test
    public void testCopyIsIndependent() {
        ResourceProperties original = quantities(0.1, 100, 0.2, 200);
        ResourceProperties copy = original.copy();

        copy.add(original);

        assertThat(copy, is(not(original)));
        assertThat(original.get(ResourceRole.REQUESTS, CPU).value(), is(0.1));
    }

    @Test
    public void testFromResourceRequirements() {
        ResourceRequirements requirements = new ResourceRequirementsBuilder()
                .withRequests(Map.of(CPU, new Quantity("100m"), MEMORY, new Quantity("100Mi")))
                .withLimits(Map.of(CPU, new Quantity("1")))
                .build();

        ResourceProperties properties = ResourceProperties.fromResourceRequirements(requirements);

        assertThat(properties.all().size(), is(3));
        assertThat(properties.get(ResourceRole.REQUESTS, CPU).value(), is(0.1));
        assertThat(properties.get(ResourceRole.REQUESTS, MEMORY).value(), is(104_857_600.0));
        assertThat(properties.get(ResourceRole.LIMITS, CPU).value(), is(1.0));
        assertThat(properties.get(ResourceRole.LIMITS, CPU).kind(), is(ResourceKind.QUANTITY));

        assertThat(ResourceProperties.fromResourceRequirements(null).isEmpty(), is(true));
        assertThat(ResourceProperties.fromResourceRequirements(new ResourceRequirements()).isEmpty(), is(true));
    }

    @Test
    public void testFromNodeResources() {
        ResourceProperties properties = ResourceProperties.fromNodeResources(Map.of(CPU, new Quantity("4"), MEMORY, new Quantity("8Gi")));

        assertThat(properties.all().size(), is(4));
        assertThat(properties.get(ResourceRole.REQUESTS, CPU).value(), is(4.0));
        assertThat(properties.get(ResourceRole.LIMITS, CPU).value(), is(4.0));
        assertThat(properties.get(ResourceRole.REQUESTS, MEMORY).value(), is(8_589_934_592.0));
        assertThat(properties.get(ResourceRole.LIMITS, MEMORY).value(), is(8_589_934_592.0));
        assertThat(properties.resourceNames(), contains(CPU, MEMORY));
    }

    @Test
    public void testBindingRendering() {
        ResourceBinding cpu = new ResourceBinding(ResourceKind.QUANTITY, ResourceRole.REQUESTS, CPU, 0.4);
        ResourceBinding fraction = new ResourceBinding(ResourceKind.FRACTION, ResourceRole.LIMITS, MEMORY, 0.25);

        assertThat(cpu.humanValue(), is("400m"));
        assertThat(cpu.jsonPath(1), is("/spec/containers/1/resources/requests/cpu"));
        assertThat(cpu.toString(), is("requests.cpu=0.4=400m (quantity)"));
        assertThat(fraction.humanValue(), is("0.25"));
        assertThat(fraction.jsonPath(0), is("/spec/containers/0/resources/limits/memory"));
    }

    @Test
    public void testAllIsOrderedByRoleAndResource() {
        ResourceProperties properties = new ResourceProperties()
                .bind(ResourceKind.QUANTITY, ResourceRole.LIMITS, MEMORY, 4)
                .bind(ResourceKind.QUANTITY, ResourceRole.REQUESTS, MEMORY, 2)
                .bind(ResourceKind.QUANTITY, ResourceRole.LIMITS, CPU, 3)
                .bind(ResourceKind.QUANTITY, ResourceRole.REQUESTS, CPU, 1);

        assertThat(properties.all().stream().map(ResourceBinding::value).toList(), contains(1.0, 2.0, 3.0, 4.0));
    }
}
