package uk.gegc.planconfigurator.features.backend.domain.model;

import java.util.Objects;

/**
 * Request and response mapping tables of one operation. Either side may be {@code null}
 * when the operation has no body in that direction.
 */
public record OperationShape(String operation, ShapeMapping request, ShapeMapping response) {

    public OperationShape {
        Objects.requireNonNull(operation, "operation must not be null");
    }

    public static OperationShape response(String operation, ShapeMapping response) {
        return new OperationShape(operation, null, response);
    }
}
