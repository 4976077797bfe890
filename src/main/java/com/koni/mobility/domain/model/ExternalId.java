package com.koni.mobility.domain.model;

import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Canonical form of an identifier assigned by an external source.
 *
 * Sources deliver the same id as JSON numbers, strings, or floats produced by a
 * lossy intermediate step ({@code 123}, {@code "123"}, {@code 123.0}). All of them
 * normalize to the same canonical string so lookups and uniqueness checks agree.
 * An absent id is represented by the sentinel {@link #UNKNOWN} ("-1"), which is
 * never used for identity lookups.
 */
@EqualsAndHashCode
public final class ExternalId implements Comparable<ExternalId> {

    public static final String UNKNOWN_VALUE = "-1";
    public static final ExternalId UNKNOWN = new ExternalId(UNKNOWN_VALUE);

    private static final Pattern INTEGRAL_TEXT = Pattern.compile("-?(0|[1-9]\\d*)(\\.0+)?");
    private static final Pattern DIGITS = Pattern.compile("-?\\d+");

    private final String value;

    private ExternalId(String value) {
        this.value = value;
    }

    /**
     * Normalizes a raw identifier.
     *
     * @param raw number, string or {@code ExternalId}; {@code null} and blank strings map to {@link #UNKNOWN}
     * @return the canonical id
     */
    public static ExternalId of(Object raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        if (raw instanceof ExternalId) {
            return (ExternalId) raw;
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return canonical(String.valueOf(((Number) raw).longValue()));
        }
        if (raw instanceof BigInteger) {
            return canonical(raw.toString());
        }
        if (raw instanceof Double && !Double.isFinite((Double) raw)
                || raw instanceof Float && !Float.isFinite((Float) raw)) {
            return canonical(raw.toString());
        }
        if (raw instanceof Number) {
            return ofDecimal(new BigDecimal(raw.toString()));
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return UNKNOWN;
        }
        if (INTEGRAL_TEXT.matcher(text).matches()) {
            int dot = text.indexOf('.');
            return canonical(dot < 0 ? text : text.substring(0, dot));
        }
        return canonical(text);
    }

    private static ExternalId ofDecimal(BigDecimal decimal) {
        BigDecimal stripped = decimal.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            return canonical(stripped.toBigIntegerExact().toString());
        }
        return canonical(stripped.toPlainString());
    }

    private static ExternalId canonical(String text) {
        if (UNKNOWN_VALUE.equals(text)) {
            return UNKNOWN;
        }
        return new ExternalId("-0".equals(text) ? "0" : text);
    }

    public boolean isKnown() {
        return !UNKNOWN_VALUE.equals(value);
    }

    public String getValue() {
        return value;
    }

    /**
     * Numeric ids sort numerically, everything else lexicographically after them.
     */
    @Override
    public int compareTo(ExternalId other) {
        boolean numeric = DIGITS.matcher(value).matches();
        boolean otherNumeric = DIGITS.matcher(other.value).matches();
        if (numeric && otherNumeric) {
            return new BigInteger(value).compareTo(new BigInteger(other.value));
        }
        if (numeric != otherNumeric) {
            return numeric ? -1 : 1;
        }
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
