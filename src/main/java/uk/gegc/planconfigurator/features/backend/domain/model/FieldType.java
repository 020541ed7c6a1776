package uk.gegc.planconfigurator.features.backend.domain.model;

/**
 * Canonical value type of a mapped field. INTEGER values surface as {@link Long},
 * DECIMAL values as {@link java.math.BigDecimal}.
 */
public enum FieldType {
    STRING,
    INTEGER,
    DECIMAL,
    BOOLEAN,
    LIST,
    ANY
}
