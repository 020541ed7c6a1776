package uk.gegc.planconfigurator.features.backend.domain.model;

import lombok.Builder;
import lombok.Singular;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameters recognised by backend operations. Each endpoint decides which of them it
 * consumes and whether they become path segments or query parameters.
 */
@Builder(toBuilder = true)
public record OperationParams(
        String id,
        String secondaryId,
        Integer limit,
        String sort,
        @Singular Map<String, String> filters
) {

    public OperationParams {
        filters = filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    }

    public static OperationParams none() {
        return new OperationParams(null, null, null, null, Map.of());
    }

    public static OperationParams ofId(String id) {
        return new OperationParams(id, null, null, null, Map.of());
    }

    public Object value(Param param) {
        return switch (param) {
            case ID -> id;
            case SECONDARY_ID -> secondaryId;
            case LIMIT -> limit;
            case SORT -> sort;
        };
    }

    public enum Param {
        ID("id"),
        SECONDARY_ID("secondaryId"),
        LIMIT("limit"),
        SORT("sort");

        private final String parameterName;

        Param(String parameterName) {
            this.parameterName = parameterName;
        }

        public String parameterName() {
            return parameterName;
        }
    }
}
