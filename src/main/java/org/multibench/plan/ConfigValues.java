package org.multibench.plan;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shape checks for the untyped map/list tree produced by the YAML and JSON parsers.
 */
final class ConfigValues {
    private ConfigValues() {}

    static Map<String, Object> asStringMap(final Object value, final String fieldName) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException(fieldName + " must be an object");
        }
        final Map<String, Object> normalized = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : map.entrySet()) {
            normalized.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return Collections.unmodifiableMap(normalized);
    }

    static Map<String, Object> asOptionalMap(final Object value, final String fieldName) {
        if (value == null) {
            return Map.of();
        }
        return asStringMap(value, fieldName);
    }

    static List<Object> asList(final Object value, final String fieldName) {
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException(fieldName + " must be an array");
        }
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    static List<Object> asOptionalList(final Object value, final String fieldName) {
        if (value == null) {
            return List.of();
        }
        return asList(value, fieldName);
    }

    /**
     * Ordered name to text mapping; scalar values are stringified.
     */
    static Map<String, String> asTextMap(final Object value, final String fieldName) {
        final Map<String, Object> raw = asOptionalMap(value, fieldName);
        final Map<String, String> text = new LinkedHashMap<>();
        for (final Map.Entry<String, Object> entry : raw.entrySet()) {
            text.put(entry.getKey(), scalarText(entry.getValue(), fieldName + "." + entry.getKey()));
        }
        return Collections.unmodifiableMap(text);
    }

    static List<String> asTextList(final Object value, final String fieldName) {
        final List<Object> raw = asOptionalList(value, fieldName);
        final List<String> text = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            text.add(scalarText(raw.get(i), fieldName + "[" + i + "]"));
        }
        return List.copyOf(text);
    }

    /**
     * Renders a YAML/JSON scalar the way it is written: integral doubles lose their ".0" so that
     * {@code 4} and {@code 4.0} from different parsers produce the same identifier.
     */
    static String scalarText(final Object value, final String fieldName) {
        if (value == null) {
            throw new IllegalArgumentException(fieldName + " must not be null");
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            throw new IllegalArgumentException(fieldName + " must be a scalar value");
        }
        if (value instanceof Double || value instanceof Float) {
            final double number = ((Number) value).doubleValue();
            if (Double.isFinite(number) && number == Math.rint(number) && Math.abs(number) < 1e15) {
                return Long.toString((long) number);
            }
            return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }

    static String requireText(final Object value, final String fieldName) {
        if (value == null) {
            throw new IllegalArgumentException(fieldName + " must not be null");
        }
        final String trimmed = scalarText(value, fieldName).trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return trimmed;
    }

    static String optionalText(final Object value, final String fieldName) {
        if (value == null) {
            return null;
        }
        final String text = scalarText(value, fieldName);
        return text.isBlank() ? null : text;
    }

    static int requireInt(final Object value, final String fieldName) {
        if (!(value instanceof Number number)) {
            throw new IllegalArgumentException(fieldName + " must be numeric");
        }
        final double numeric = number.doubleValue();
        if (!Double.isFinite(numeric) || numeric != Math.rint(numeric)) {
            throw new IllegalArgumentException(fieldName + " must be an integer (actual: " + number + ")");
        }
        if (numeric < Integer.MIN_VALUE || numeric > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(fieldName + " is out of range (actual: " + number + ")");
        }
        return number.intValue();
    }

    static boolean optionalBoolean(final Object value, final boolean defaultValue, final String fieldName) {
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Boolean flag)) {
            throw new IllegalArgumentException(fieldName + " must be a boolean");
        }
        return flag;
    }
}
