package uk.gegc.planconfigurator.features.workflow.application;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes incoming field values to the few types workflow state holds: String, Long,
 * BigDecimal, Boolean, and maps/lists of those. Whole numbers always become Long so a
 * persisted state reads back equal to the one written.
 */
public final class FieldValues {

    private FieldValues() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * @return the normalized value, or {@code null} for blank text and empty collections
     */
    public static Object normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String text) {
            return text.isBlank() ? null : text;
        }
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return big.longValueExact();
        }
        if (value instanceof Number number) {
            BigDecimal decimal = number instanceof BigDecimal d ? d : new BigDecimal(number.toString());
            return decimal.stripTrailingZeros().scale() <= 0 ? decimal.longValueExact() : decimal;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            map.forEach((key, element) -> {
                Object normalizedElement = normalize(element);
                if (normalizedElement != null) {
                    normalized.put(String.valueOf(key), normalizedElement);
                }
            });
            return normalized.isEmpty() ? null : Collections.unmodifiableMap(normalized);
        }
        if (value instanceof List<?> list) {
            List<Object> normalized = new ArrayList<>();
            for (Object element : list) {
                Object normalizedElement = normalize(element);
                if (normalizedElement != null) {
                    normalized.add(normalizedElement);
                }
            }
            return normalized.isEmpty() ? null : Collections.unmodifiableList(normalized);
        }
        throw new IllegalArgumentException("Unsupported field value type: " + value.getClass().getSimpleName());
    }

    public static long asLong(Object value, long fallback) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        return fallback;
    }
}
