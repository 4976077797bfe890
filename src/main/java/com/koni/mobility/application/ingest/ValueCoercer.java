package com.koni.mobility.application.ingest;

import java.math.BigDecimal;
import java.util.OptionalDouble;

/**
 * Converts raw source values to finite doubles.
 *
 * Numbers pass through; strings are parsed as plain decimals, with a single comma
 * accepted as decimal separator. Booleans, blanks, NaN, infinities and anything else
 * yield an empty result.
 */
public final class ValueCoercer {

    private ValueCoercer() {
    }

    public static OptionalDouble toDouble(Object raw) {
        if (raw == null || raw instanceof Boolean) {
            return OptionalDouble.empty();
        }
        if (raw instanceof Number) {
            return finite(((Number) raw).doubleValue());
        }
        if (raw instanceof CharSequence) {
            return parse(raw.toString());
        }
        return OptionalDouble.empty();
    }

    private static OptionalDouble parse(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return OptionalDouble.empty();
        }
        if (trimmed.indexOf('.') < 0 && trimmed.indexOf(',') == trimmed.lastIndexOf(',')) {
            trimmed = trimmed.replace(',', '.');
        }
        try {
            return finite(new BigDecimal(trimmed).doubleValue());
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private static OptionalDouble finite(double value) {
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
}
