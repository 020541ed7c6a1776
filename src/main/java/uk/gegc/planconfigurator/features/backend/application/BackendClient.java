package uk.gegc.planconfigurator.features.backend.application;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.planconfigurator.features.backend.domain.exception.ShapeMismatchException;
import uk.gegc.planconfigurator.features.backend.domain.model.ExecutionOptions;
import uk.gegc.planconfigurator.features.backend.domain.model.OperationParams;
import uk.gegc.planconfigurator.features.backend.domain.model.RequestDescriptor;
import uk.gegc.planconfigurator.features.backend.domain.model.ResponseEnvelope;
import uk.gegc.planconfigurator.features.backend.domain.model.ShapeMapping;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for calling the billing backend with canonical shapes.
 * <p>
 * Resolution and outbound shape errors are programming errors and are thrown immediately;
 * everything that happens on the wire is reported through the returned future.
 */
@Slf4j
@Service
public class BackendClient {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final EndpointRegistry endpointRegistry;
    private final RequestExecutor requestExecutor;
    private final DataTransformer dataTransformer;
    private final ObjectMapper objectMapper;

    public BackendClient(EndpointRegistry endpointRegistry,
                         RequestExecutor requestExecutor,
                         DataTransformer dataTransformer,
                         ObjectMapper objectMapper) {
        this.endpointRegistry = endpointRegistry;
        this.requestExecutor = requestExecutor;
        this.dataTransformer = dataTransformer;
        this.objectMapper = objectMapper;
    }

    public CompletableFuture<ResponseEnvelope> call(String operation, OperationParams params, String authToken) {
        return call(operation, params, null, authToken);
    }

    public CompletableFuture<ResponseEnvelope> call(String operation, OperationParams params,
                                                    Map<String, ?> body, String authToken) {
        return execute(operation, params, body, new ExecutionOptions(authToken, null));
    }

    /**
     * Like {@link #call(String, OperationParams, String)}, except that a newer call for the same
     * operation from the same {@code slotScope} supersedes this one while it is in flight.
     * Use it for reads whose result is applied to the scope's state, where only the latest
     * answer counts.
     */
    public CompletableFuture<ResponseEnvelope> callLatest(String slotScope, String operation,
                                                          OperationParams params, String authToken) {
        return execute(operation, params, null, new ExecutionOptions(authToken, null, slotScope));
    }

    private CompletableFuture<ResponseEnvelope> execute(String operation, OperationParams params,
                                                        Map<String, ?> body, ExecutionOptions options) {
        RequestDescriptor descriptor = endpointRegistry.resolve(operation, params);
        Object wireBody = toWireBody(operation, body);

        return requestExecutor.execute(descriptor, new ExecutionOptions(options.authToken(), wireBody, options.slotScope()))
                .thenApply(response -> response.withData(toCanonical(operation, response.raw())));
    }

    private Object toWireBody(String operation, Map<String, ?> body) {
        if (body == null) {
            return null;
        }
        Optional<ShapeMapping> mapping = dataTransformer.requestMapping(operation);
        if (mapping.isPresent()) {
            return dataTransformer.toWire(operation, mapping.get(), body);
        }
        return body;
    }

    private Map<String, Object> toCanonical(String operation, JsonNode raw) {
        Optional<ShapeMapping> mapping = dataTransformer.responseMapping(operation);
        if (mapping.isEmpty()) {
            return raw != null && raw.isObject() ? objectMapper.convertValue(raw, MAP_TYPE) : Map.of();
        }
        try {
            return dataTransformer.fromWire(operation, mapping.get(), raw);
        } catch (ShapeMismatchException e) {
            log.error("Backend response for '{}' does not match its mapping at '{}': {}",
                    operation, e.getFieldPath(), e.getMessage());
            throw e;
        }
    }
}
