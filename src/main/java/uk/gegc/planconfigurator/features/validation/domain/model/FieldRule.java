package uk.gegc.planconfigurator.features.validation.domain.model;

/**
 * Local, synchronous check of a non-null field value.
 */
@FunctionalInterface
public interface FieldRule {

    ValidationResult apply(Object value);
}
