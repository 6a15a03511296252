/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine.model;

import io.nodesizing.engine.InvalidAnnotationValueException;

/**
 * Tells how the value of a binding is parsed and rendered.
 */
public enum ResourceKind {
    /**
     * Unit-less ratio in (0, 1]
     */
    FRACTION("fraction"),

    /**
     * Absolute amount of a resource (cores, bytes, ...)
     */
    QUANTITY("quantity");

    private final String kind;

    ResourceKind(String kind) {
        this.kind = kind;
    }

    /**
     * Parses a value of this kind.
     *
     * <ul>
     *     <li>Fractions are plain decimals between 0 (excluded, as it makes no sense as a request or limit) and 1
     *     (included)</li>
     *     <li>Quantities are anything Kubernetes would accept as a non-negative resource quantity, including SI
     *     suffixes such as {@code 100m} or {@code 2Gi}</li>
     * </ul>
     *
     * @param text  Value to parse
     *
     * @return  The parsed value
     *
     * @throws InvalidAnnotationValueException if the value is not valid for this kind
     */
    public double parse(String text) {
        double value;
        try {
            value = this == FRACTION ? Quantities.parseDecimal(text) : Quantities.parse(text);
        } catch (IllegalArgumentException e) {
            throw new InvalidAnnotationValueException(text + " cannot be parsed as a " + kind + ": " + e.getMessage(), e);
        }

        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidAnnotationValueException(text + " is not a valid " + kind + ": out of range");
        }

        if (this == FRACTION) {
            if (value <= 0) {
                throw new InvalidAnnotationValueException(text + " is not a valid fraction: cannot be <= 0");
            } else if (value > 1) {
                throw new InvalidAnnotationValueException(text + " is not a valid fraction: cannot be > 1");
            }
        } else if (value < 0) {
            throw new InvalidAnnotationValueException(text + " is not a valid quantity: cannot be < 0");
        }

        return value;
    }

    /**
     * Renders a value of this kind.
     *
     * @param value     Value to render
     *
     * @return  Plain decimal for fractions, quantity string for quantities
     */
    public String format(double value) {
        return this == FRACTION ? Quantities.formatDecimal(value) : Quantities.format(value);
    }

    /**
     * Multiplying two fractions produces another fraction, any other combination produces a quantity.
     *
     * @param left      Kind of the left operand
     * @param right     Kind of the right operand
     *
     * @return  Kind of the product
     */
    public static ResourceKind product(ResourceKind left, ResourceKind right) {
        return left == FRACTION && right == FRACTION ? FRACTION : QUANTITY;
    }

    /**
     * Dividing two values of the same kind produces a fraction (quantity / quantity is the share of one amount in
     * another), mixing kinds produces a quantity.
     *
     * @param dividend  Kind of the dividend
     * @param divisor   Kind of the divisor
     *
     * @return  Kind of the quotient
     */
    public static ResourceKind quotient(ResourceKind dividend, ResourceKind divisor) {
        return dividend == divisor ? FRACTION : QUANTITY;
    }

    @Override
    public String toString() {
        return kind;
    }
}
