package uk.gegc.planconfigurator.features.backend.domain.model;

import java.util.Objects;

/**
 * One row of a mapping table.
 *
 * @param canonicalPath field name in the canonical shape; flat, no dots
 * @param wirePath      dotted path in the backend payload, e.g. {@code billing.currency}
 * @param type          expected value type
 * @param required      whether absence is a shape mismatch
 * @param element       mapping applied to each element of a LIST field, {@code null} to copy elements as-is
 */
public record FieldMapping(
        String canonicalPath,
        String wirePath,
        FieldType type,
        boolean required,
        ShapeMapping element
) {

    public FieldMapping {
        Objects.requireNonNull(canonicalPath, "canonicalPath must not be null");
        Objects.requireNonNull(wirePath, "wirePath must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (canonicalPath.contains(".")) {
            throw new IllegalArgumentException("Canonical field names are flat: " + canonicalPath);
        }
        if (element != null && type != FieldType.LIST) {
            throw new IllegalArgumentException("Element mapping only applies to LIST fields: " + canonicalPath);
        }
    }

    public static FieldMapping required(String canonicalPath, String wirePath, FieldType type) {
        return new FieldMapping(canonicalPath, wirePath, type, true, null);
    }

    public static FieldMapping optional(String canonicalPath, String wirePath, FieldType type) {
        return new FieldMapping(canonicalPath, wirePath, type, false, null);
    }

    public static FieldMapping list(String canonicalPath, String wirePath, boolean required, ShapeMapping element) {
        return new FieldMapping(canonicalPath, wirePath, FieldType.LIST, required, element);
    }
}
