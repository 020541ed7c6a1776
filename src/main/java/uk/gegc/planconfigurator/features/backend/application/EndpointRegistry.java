package uk.gegc.planconfigurator.features.backend.application;

import uk.gegc.planconfigurator.features.backend.domain.exception.UnknownOperationException;
import uk.gegc.planconfigurator.features.backend.domain.model.EndpointDefinition;
import uk.gegc.planconfigurator.features.backend.domain.model.OperationParams;
import uk.gegc.planconfigurator.features.backend.domain.model.RequestDescriptor;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps a logical operation plus parameters onto a {@link RequestDescriptor}. No I/O.
 * <p>
 * The table is supplied at construction, so adding or changing an endpoint is a data edit
 * that cannot affect the other rows.
 */
public class EndpointRegistry {

    private final Map<String, EndpointDefinition> endpoints;

    public EndpointRegistry(Collection<EndpointDefinition> definitions) {
        Map<String, EndpointDefinition> table = new LinkedHashMap<>();
        for (EndpointDefinition definition : definitions) {
            if (table.putIfAbsent(definition.operation(), definition) != null) {
                throw new IllegalArgumentException("Duplicate endpoint definition for operation: " + definition.operation());
            }
        }
        this.endpoints = Collections.unmodifiableMap(table);
    }

    /**
     * @throws UnknownOperationException when the operation has no endpoint
     * @throws uk.gegc.planconfigurator.features.backend.domain.exception.MissingParameterException
     *         when a parameter the endpoint requires is absent
     */
    public RequestDescriptor resolve(String operation, OperationParams params) {
        Objects.requireNonNull(operation, "operation must not be null");
        EndpointDefinition definition = endpoints.get(operation);
        if (definition == null) {
            throw new UnknownOperationException(operation);
        }
        return definition.resolve(params);
    }

    public boolean isKnown(String operation) {
        return endpoints.containsKey(operation);
    }

    public Set<String> operations() {
        return endpoints.keySet();
    }
}
