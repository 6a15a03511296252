/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine.model;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class QuantitiesTest {
    @Test
    public void testParse() {
        assertThat(Quantities.parse("4"), is(4.0));
        assertThat(Quantities.parse("100m"), is(0.1));
        assertThat(Quantities.parse("0.5"), is(0.5));
        assertThat(Quantities.parse(".5"), is(0.5));
        assertThat(Quantities.parse("+1"), is(1.0));
        assertThat(Quantities.parse("1.5k"), is(1500.0));
        assertThat(Quantities.parse("2M"), is(2_000_000.0));
        assertThat(Quantities.parse("1G"), is(1_000_000_000.0));
        assertThat(Quantities.parse("1E"), is(1e18));
        assertThat(Quantities.parse("100u"), closeTo(0.0001, 1e-12));
        assertThat(Quantities.parse("500n"), closeTo(0.0000005, 1e-15));
    }

    @Test
    public void testParseBinarySuffixes() {
        assertThat(Quantities.parse("1Ki"), is(1024.0));
        assertThat(Quantities.parse("100Mi"), is(104_857_600.0));
        assertThat(Quantities.parse("8Gi"), is(8_589_934_592.0));
        assertThat(Quantities.parse("1.5Gi"), is(1_610_612_736.0));
        assertThat(Quantities.parse("1Ti"), is(1_099_511_627_776.0));
    }

    @Test
    public void testParseExponent() {
        assertThat(Quantities.parse("1e3"), is(1000.0));
        assertThat(Quantities.parse("1E3"), is(1000.0));
        assertThat(Quantities.parse("5e-3"), is(0.005));
        assertThat(Quantities.parse("12E+2"), is(1200.0));
    }

    @Test
    public void testParseInvalid() {
        assertThrows(IllegalArgumentException.class, () -> Quantities.parse(null));
        assertThrows(IllegalArgumentException.class, () -> Quantities.parse(""));
        assertThrows(IllegalArgumentException.class, () -> Quantities.parse("abc"));
        assertThrows(IllegalArgumentException.class, () -> Quantities.parse("Mi"));
        assertThrows(IllegalArgumentException.class, () -> Quantities.parse("1.2.3"));
        assertThrows(IllegalArgumentException.class, () -> Quantities.parse("1x"));
        assertThrows(IllegalArgumentException.class, () -> Quantities.parse("1mi"));
        assertThrows(IllegalArgumentException.class, () -> Quantities.parse("1e"));
        assertThrows(IllegalArgumentException.class, () -> Quantities.parse("1 Gi"));
        assertThrows(IllegalArgumentException.class, () -> Quantities.parse("1e99999999999"));
        assertThrows(IllegalArgumentException.class, () -> Quantities.parse("1.5e-2147483648"));
    }

    @Test
    public void testParseOverflowsToInfinity() {
        assertThat(Double.isInfinite(Quantities.parse("1e400")), is(true));
    }

    @Test
    public void testParseDecimal() {
        assertThat(Quantities.parseDecimal("0.25"), is(0.25));
        assertThat(Quantities.parseDecimal("1"), is(1.0));
        assertThat(Quantities.parseDecimal("-0.5"), is(-0.5));

        assertThrows(IllegalArgumentException.class, () -> Quantities.parseDecimal(null));
        assertThrows(IllegalArgumentException.class, () -> Quantities.parseDecimal("1e-1"));
        assertThrows(IllegalArgumentException.class, () -> Quantities.parseDecimal("100m"));
        assertThrows(IllegalArgumentException.class, () -> Quantities.parseDecimal("NaN"));
        assertThrows(IllegalArgumentException.class, () -> Quantities.parseDecimal("0x1p-1"));
    }

    @Test
    public void testFormatMilli() {
        assertThat(Quantities.format(0), is("0"));
        assertThat(Quantities.format(0.1), is("100m"));
        assertThat(Quantities.format(0.4), is("400m"));
        assertThat(Quantities.format(0.25), is("250m"));
        assertThat(Quantities.format(2), is("2"));
        assertThat(Quantities.format(10), is("10"));
        assertThat(Quantities.format(1.5), is("1500m"));
    }

    @Test
    public void testFormatRemovesFloatingPointNoise() {
        // 0.3 / 0.4 * 0.4 is 0.29999999999999993
        assertThat(Quantities.format(0.3 / 0.4 * 0.4), is("300m"));
        assertThat(Quantities.format(0.1 + 0.2), is("300m"));
    }

    @Test
    public void testFormatScaled() {
        assertThat(Quantities.format(10.5), is("10.5"));
        assertThat(Quantities.format(1500), is("1.5k"));
        assertThat(Quantities.format(100_000), is("100k"));
        assertThat(Quantities.format(840_000_000), is("840M"));
        assertThat(Quantities.format(858_993_459.2), is("858.993M"));
        assertThat(Quantities.format(1_073_741_824), is("1.074G"));
        assertThat(Quantities.format(2e12), is("2T"));
        assertThat(Quantities.format(1e21), is("1000E"));
    }

    @Test
    public void testFormatInvalid() {
        assertThrows(IllegalArgumentException.class, () -> Quantities.format(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> Quantities.format(Double.POSITIVE_INFINITY));
    }

    @Test
    public void testFormattedValuesParseBackWithinPrecision() {
        double[] values = {0.001, 0.1234, 3.999, 12.345678, 85_899_345.92, 773_094_113.28, 8_589_934_592.0, 123_456_789_012.0};

        for (double value : values) {
            double parsed = Quantities.parse(Quantities.format(value));

            if (value * 1000 <= 10_000) {
                assertThat(parsed, closeTo(value, 0.0005));
            } else {
                assertThat(parsed, closeTo(value, value * 1e-3));
            }
        }
    }

    @Test
    public void testFormatDecimal() {
        assertThat(Quantities.formatDecimal(0.25), is("0.25"));
        assertThat(Quantities.formatDecimal(1.0), is("1"));
        assertThat(Quantities.formatDecimal(0.1), is("0.1"));
        assertThat(Quantities.formatDecimal(0.000001), is("0.000001"));
    }
}
