package com.purchasingpower.itemgraph.normalize.impl;

import com.purchasingpower.itemgraph.normalize.FieldType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts loosely-typed JSON values to the canonical Java type of a field.
 *
 * <p>STRING becomes {@link String}, INTEGER {@link Long}, DECIMAL {@link Double},
 * BOOLEAN {@link Boolean}, NUMBER_LIST {@code List<Double>}.
 */
final class ValueCoercer {

    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private ValueCoercer() {
    }

    /**
     * Coerced value, or a problem description when the raw value does not fit.
     * A problem with a non-null value means the value was adjusted, not discarded.
     */
    record Coercion(Object value, String problem) {

        static Coercion ok(Object value) {
            return new Coercion(value, null);
        }

        static Coercion adjusted(Object value, String problem) {
            return new Coercion(value, problem);
        }

        static Coercion failed(String problem) {
            return new Coercion(null, problem);
        }

        boolean isFailed() {
            return value == null;
        }
    }

    static Coercion coerce(FieldType type, Object raw) {
        return switch (type) {
            case STRING -> toText(raw);
            case INTEGER -> toInteger(raw);
            case DECIMAL -> toDecimal(raw);
            case BOOLEAN -> toBoolean(raw);
            case NUMBER_LIST -> toNumberList(raw);
            case INGREDIENT_LIST -> Coercion.failed("ingredient lists are not coerced as values");
        };
    }

    private static Coercion toText(Object raw) {
        if (raw instanceof String s) {
            return Coercion.ok(s);
        }
        if (raw instanceof Number || raw instanceof Boolean) {
            return Coercion.ok(raw.toString());
        }
        return Coercion.failed("expected text but got " + describe(raw));
    }

    private static Coercion toInteger(Object raw) {
        BigDecimal number = toBigDecimal(raw);
        if (number == null) {
            return Coercion.failed("expected an integer but got " + describe(raw));
        }
        BigDecimal whole = number.setScale(0, RoundingMode.DOWN);
        if (whole.compareTo(LONG_MIN) < 0 || whole.compareTo(LONG_MAX) > 0) {
            return Coercion.failed("integer value " + number.toPlainString() + " is outside the 64-bit range");
        }
        long truncated = whole.longValueExact();
        if (number.compareTo(whole) != 0) {
            return Coercion.adjusted(truncated, "fractional value " + number.toPlainString() + " truncated to " + truncated);
        }
        return Coercion.ok(truncated);
    }

    private static Coercion toDecimal(Object raw) {
        BigDecimal number = toBigDecimal(raw);
        if (number == null) {
            return Coercion.failed("expected a number but got " + describe(raw));
        }
        return Coercion.ok(number.doubleValue());
    }

    private static Coercion toBoolean(Object raw) {
        if (raw instanceof Boolean b) {
            return Coercion.ok(b);
        }
        if (raw instanceof String s) {
            String text = s.trim().toLowerCase(Locale.ROOT);
            if (text.equals("true") || text.equals("false")) {
                return Coercion.ok(Boolean.valueOf(text));
            }
        }
        if (raw instanceof Number n) {
            if (n.doubleValue() == 0) {
                return Coercion.ok(Boolean.FALSE);
            }
            if (n.doubleValue() == 1) {
                return Coercion.ok(Boolean.TRUE);
            }
        }
        return Coercion.failed("expected a boolean but got " + describe(raw));
    }

    private static Coercion toNumberList(Object raw) {
        if (raw instanceof Number || raw instanceof String) {
            Coercion single = toDecimal(raw);
            return single.isFailed() ? single : Coercion.ok(List.of((Double) single.value()));
        }
        if (!(raw instanceof Collection<?> items)) {
            return Coercion.failed("expected a list of numbers but got " + describe(raw));
        }
        List<Double> values = new ArrayList<>(items.size());
        for (Object item : items) {
            BigDecimal number = toBigDecimal(item);
            if (number == null) {
                return Coercion.failed("list element " + describe(item) + " is not a number");
            }
            values.add(number.doubleValue());
        }
        return Coercion.ok(List.copyOf(values));
    }

    private static BigDecimal toBigDecimal(Object raw) {
        if (raw instanceof Double d && (d.isNaN() || d.isInfinite())) {
            return null;
        }
        if (raw instanceof Float f && (f.isNaN() || f.isInfinite())) {
            return null;
        }
        if (raw instanceof BigDecimal bd) {
            return bd;
        }
        if (raw instanceof Number n) {
            return new BigDecimal(n.toString());
        }
        if (raw instanceof String s) {
            try {
                return new BigDecimal(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static String describe(Object raw) {
        if (raw == null) {
            return "null";
        }
        if (raw instanceof Map<?, ?>) {
            return "an object";
        }
        if (raw instanceof Collection<?>) {
            return "a list";
        }
        if (raw instanceof String s) {
            return "\"" + s + "\"";
        }
        return raw.toString();
    }
}
