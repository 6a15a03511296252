/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing and formatting of Kubernetes resource quantities as doubles.
 *
 * <p>Formatting mimics the canonical decimal SI notation used by Kubernetes: small amounts are rendered in milli-units
 * ({@code 250m}, {@code 2}), larger ones with the biggest SI suffix whose exponent does not exceed the magnitude of the
 * amount ({@code 840M}, {@code 85.899M}). Milli notation is rounded to the nearest milli-unit, scaled notation keeps at
 * most three decimals of the mantissa, so the relative error of the scaled notation stays below 1e-3.</p>
 */
public class Quantities {
    private static final Pattern QUANTITY = Pattern.compile("^(?<number>[+-]?(\\d+(\\.\\d*)?|\\.\\d+))(?<suffix>[eE][+-]?\\d+|Ki|Mi|Gi|Ti|Pi|Ei|[numkMGTPE])?$");
    private static final Pattern DECIMAL = Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)$");

    private static final Map<String, BigDecimal> SUFFIXES = Map.ofEntries(
            Map.entry("Ki", BigDecimal.valueOf(1L << 10)),
            Map.entry("Mi", BigDecimal.valueOf(1L << 20)),
            Map.entry("Gi", BigDecimal.valueOf(1L << 30)),
            Map.entry("Ti", BigDecimal.valueOf(1L << 40)),
            Map.entry("Pi", BigDecimal.valueOf(1L << 50)),
            Map.entry("Ei", BigDecimal.valueOf(1L << 60)),
            Map.entry("n", BigDecimal.ONE.scaleByPowerOfTen(-9)),
            Map.entry("u", BigDecimal.ONE.scaleByPowerOfTen(-6)),
            Map.entry("m", BigDecimal.ONE.scaleByPowerOfTen(-3)),
            Map.entry("k", BigDecimal.ONE.scaleByPowerOfTen(3)),
            Map.entry("M", BigDecimal.ONE.scaleByPowerOfTen(6)),
            Map.entry("G", BigDecimal.ONE.scaleByPowerOfTen(9)),
            Map.entry("T", BigDecimal.ONE.scaleByPowerOfTen(12)),
            Map.entry("P", BigDecimal.ONE.scaleByPowerOfTen(15)),
            Map.entry("E", BigDecimal.ONE.scaleByPowerOfTen(18))
    );

    private static final String[] SCALED_SUFFIXES = {"", "k", "M", "G", "T", "P", "E"};
    private static final double MILLI_NOTATION_THRESHOLD = 10_000;

    private Quantities() { }

    /**
     * Parses a quantity using the Kubernetes resource quantity grammar ({@code 100m}, {@code 2Gi}, {@code 1e3}, ...).
     *
     * @param quantity  The quantity string
     *
     * @return  The amount expressed in base units (cores, bytes, ...)
     *
     * @throws IllegalArgumentException if the string is not a valid quantity
     */
    public static double parse(String quantity) {
        if (quantity == null) {
            throw new IllegalArgumentException("null is not a valid quantity");
        }

        Matcher matcher = QUANTITY.matcher(quantity.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException(quantity + " is not a valid quantity");
        }

        BigDecimal amount = new BigDecimal(matcher.group("number"));
        String suffix = matcher.group("suffix");
        if (suffix == null) {
            return amount.doubleValue();
        } else if (suffix.charAt(0) == 'e' || (suffix.charAt(0) == 'E' && suffix.length() > 1)) {
            try {
                return amount.scaleByPowerOfTen(Integer.parseInt(suffix.substring(1))).doubleValue();
            } catch (ArithmeticException e) {
                // Scale overflow of the BigDecimal
                throw new IllegalArgumentException(quantity + " is out of range", e);
            }
        } else {
            return amount.multiply(SUFFIXES.get(suffix)).doubleValue();
        }
    }

    /**
     * Parses a plain decimal number such as {@code 0.25}. Exponents, hexadecimal notation, NaN and infinities are
     * rejected.
     *
     * @param decimal   The decimal string
     *
     * @return  The parsed value
     *
     * @throws IllegalArgumentException if the string is not a plain decimal
     */
    public static double parseDecimal(String decimal) {
        if (decimal == null || !DECIMAL.matcher(decimal.trim()).matches()) {
            throw new IllegalArgumentException(decimal + " is not a valid decimal number");
        }
        return new BigDecimal(decimal.trim()).doubleValue();
    }

    /**
     * Formats an amount as a quantity string.
     *
     * @param amount    Amount in base units
     *
     * @return  Quantity string
     */
    public static String format(double amount) {
        if (Double.isNaN(amount) || Double.isInfinite(amount)) {
            throw new IllegalArgumentException(amount + " cannot be formatted as a quantity");
        }

        if (amount * 1000 <= MILLI_NOTATION_THRESHOLD) {
            return formatMilli(Math.round(amount * 1000));
        }

        int scale = (int) Math.floor(Math.log10(amount)) / 3 * 3;
        scale = Math.min(scale, 3 * (SCALED_SUFFIXES.length - 1));

        BigDecimal mantissa = BigDecimal.valueOf(amount)
                .scaleByPowerOfTen(-scale)
                .setScale(3, RoundingMode.HALF_UP)
                .stripTrailingZeros();

        return mantissa.toPlainString() + SCALED_SUFFIXES[scale / 3];
    }

    private static String formatMilli(long milli) {
        if (milli % 1000 == 0) {
            return String.valueOf(milli / 1000);
        } else {
            return milli + "m";
        }
    }

    /**
     * Formats a unit-less number as a plain decimal, without exponent and without trailing zeros.
     *
     * @param value     The value
     *
     * @return  Decimal string
     */
    public static String formatDecimal(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
