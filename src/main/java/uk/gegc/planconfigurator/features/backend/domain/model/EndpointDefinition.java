package uk.gegc.planconfigurator.features.backend.domain.model;

import org.springframework.http.HttpMethod;
import org.springframework.web.util.UriUtils;
import uk.gegc.planconfigurator.features.backend.domain.exception.MissingParameterException;
import uk.gegc.planconfigurator.features.backend.domain.model.OperationParams.Param;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One row of the endpoint table: how a logical operation maps onto an HTTP route.
 * <p>
 * Path placeholders ({@code {id}}, {@code {secondaryId}}) make the matching parameter a
 * required path segment. Query bindings declare the backend parameter name and an optional
 * endpoint-specific default. Resolution is pure: equal params always give an equal descriptor.
 */
public final class EndpointDefinition {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");
    private static final Set<HttpMethod> SUPPORTED_METHODS =
            Set.of(HttpMethod.GET, HttpMethod.POST, HttpMethod.PUT, HttpMethod.DELETE);

    private final String operation;
    private final HttpMethod method;
    private final String pathTemplate;
    private final List<Param> pathParams;
    private final List<QueryBinding> queryBindings;
    private final boolean passFilters;
    private final Set<String> requiredFilters;
    private final boolean publicAccess;

    private EndpointDefinition(Builder builder) {
        this.operation = builder.operation;
        this.method = builder.method;
        this.pathTemplate = builder.pathTemplate;
        this.pathParams = parsePathParams(builder.operation, builder.pathTemplate);
        this.queryBindings = List.copyOf(builder.queryBindings.values());
        this.passFilters = builder.passFilters;
        this.requiredFilters = Set.copyOf(builder.requiredFilters);
        this.publicAccess = builder.publicAccess;
    }

    public static Builder get(String operation, String pathTemplate) {
        return new Builder(operation, HttpMethod.GET, pathTemplate);
    }

    public static Builder post(String operation, String pathTemplate) {
        return new Builder(operation, HttpMethod.POST, pathTemplate);
    }

    public static Builder put(String operation, String pathTemplate) {
        return new Builder(operation, HttpMethod.PUT, pathTemplate);
    }

    public static Builder delete(String operation, String pathTemplate) {
        return new Builder(operation, HttpMethod.DELETE, pathTemplate);
    }

    public RequestDescriptor resolve(OperationParams params) {
        OperationParams effective = params != null ? params : OperationParams.none();

        String path = pathTemplate;
        for (Param param : pathParams) {
            Object value = effective.value(param);
            if (isAbsent(value)) {
                throw new MissingParameterException(operation, param.parameterName());
            }
            path = path.replace("{" + param.parameterName() + "}",
                    UriUtils.encodePathSegment(value.toString(), StandardCharsets.UTF_8));
        }

        Map<String, List<String>> query = new LinkedHashMap<>();
        for (QueryBinding binding : queryBindings) {
            Object value = effective.value(binding.param());
            if (isAbsent(value)) {
                value = binding.defaultValue();
            }
            if (isAbsent(value)) {
                if (binding.required()) {
                    throw new MissingParameterException(operation, binding.param().parameterName());
                }
                continue;
            }
            query.put(binding.name(), List.of(value.toString()));
        }

        for (String filter : requiredFilters) {
            if (isAbsent(effective.filters().get(filter))) {
                throw new MissingParameterException(operation, "filters." + filter);
            }
        }
        if (passFilters) {
            // sorted so the descriptor does not depend on the caller's map ordering
            new TreeMap<>(effective.filters()).forEach((name, value) -> {
                if (!isAbsent(value)) {
                    query.putIfAbsent(name, List.of(value));
                }
            });
        }

        return new RequestDescriptor(operation, method, path, query, null, publicAccess);
    }

    public String operation() {
        return operation;
    }

    public HttpMethod method() {
        return method;
    }

    public String pathTemplate() {
        return pathTemplate;
    }

    public boolean publicAccess() {
        return publicAccess;
    }

    private static boolean isAbsent(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }

    private static List<Param> parsePathParams(String operation, String template) {
        Map<String, Param> byName = new LinkedHashMap<>();
        for (Param param : Param.values()) {
            byName.put(param.parameterName(), param);
        }
        List<Param> params = new ArrayList<>();
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            Param param = byName.get(matcher.group(1));
            if (param == null) {
                throw new IllegalArgumentException("Endpoint '" + operation + "' uses unknown path placeholder: " + matcher.group());
            }
            params.add(param);
        }
        return List.copyOf(params);
    }

    public record QueryBinding(Param param, String name, Object defaultValue, boolean required) {
    }

    public static final class Builder {

        private final String operation;
        private final HttpMethod method;
        private final String pathTemplate;
        private final Map<Param, QueryBinding> queryBindings = new EnumMap<>(Param.class);
        private final Set<String> requiredFilters = new LinkedHashSet<>();
        private boolean passFilters;
        private boolean publicAccess;

        private Builder(String operation, HttpMethod method, String pathTemplate) {
            this.operation = Objects.requireNonNull(operation, "operation must not be null");
            this.method = Objects.requireNonNull(method, "method must not be null");
            this.pathTemplate = Objects.requireNonNull(pathTemplate, "pathTemplate must not be null");
            if (!SUPPORTED_METHODS.contains(method)) {
                throw new IllegalArgumentException("Unsupported method for endpoint '" + operation + "': " + method);
            }
        }

        public Builder query(Param param, String name) {
            return bind(param, name, null, false);
        }

        public Builder query(Param param, String name, Object defaultValue) {
            return bind(param, name, defaultValue, false);
        }

        public Builder requiredQuery(Param param, String name) {
            return bind(param, name, null, true);
        }

        public Builder filters() {
            this.passFilters = true;
            return this;
        }

        public Builder requiredFilter(String name) {
            this.passFilters = true;
            this.requiredFilters.add(name);
            return this;
        }

        public Builder publicAccess() {
            this.publicAccess = true;
            return this;
        }

        public EndpointDefinition build() {
            return new EndpointDefinition(this);
        }

        private Builder bind(Param param, String name, Object defaultValue, boolean required) {
            if (pathTemplate.contains("{" + param.parameterName() + "}")) {
                throw new IllegalArgumentException("Parameter '" + param.parameterName()
                        + "' is already a path segment of endpoint '" + operation + "'");
            }
            queryBindings.put(param, new QueryBinding(param, name, defaultValue, required));
            return this;
        }
    }
}
