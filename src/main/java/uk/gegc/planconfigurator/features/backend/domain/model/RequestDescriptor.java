package uk.gegc.planconfigurator.features.backend.domain.model;

import org.springframework.http.HttpMethod;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Concrete request for one backend operation. Immutable once built.
 *
 * @param operation    logical operation name the descriptor was resolved from
 * @param method       HTTP method
 * @param path         path relative to the backend base URL, with segments already percent-encoded
 * @param query        query parameters in resolution order, values not encoded
 * @param body         default request body, usually {@code null}; callers pass the body at execution time
 * @param publicAccess {@code true} when the operation may be called without a bearer token
 */
public record RequestDescriptor(
        String operation,
        HttpMethod method,
        String path,
        Map<String, List<String>> query,
        Object body,
        boolean publicAccess
) {

    public RequestDescriptor {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (query != null) {
            query.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        }
        query = Collections.unmodifiableMap(copy);
        if (body instanceof Map<?, ?> map) {
            body = Collections.unmodifiableMap(new LinkedHashMap<>(map));
        }
    }

    /**
     * Only GET requests are safe to repeat after a transport failure.
     */
    public boolean idempotent() {
        return HttpMethod.GET.equals(method);
    }

    /**
     * Path plus encoded query string, e.g. {@code /v1/accounts?limit=10&sort=name}.
     */
    public String relativeUri() {
        if (query.isEmpty()) {
            return path;
        }
        String queryString = query.entrySet().stream()
                .flatMap(entry -> entry.getValue().stream()
                        .map(value -> encode(entry.getKey()) + "=" + encode(value)))
                .collect(Collectors.joining("&"));
        return path + "?" + queryString;
    }

    /**
     * Identity of this request, used for logging and, combined with the caller's scope,
     * for race guarding.
     */
    public String slotKey() {
        return method.name() + " " + operation + " " + relativeUri();
    }

    /**
     * Race guard slot of this request within {@code scope}: a newer call from the same scope
     * for the same operation supersedes an older one still in flight. The query is left out
     * so that a check re-run with a new value overtakes the run for the old value.
     */
    public String slotKey(String scope) {
        return scope + " " + method.name() + " " + operation + " " + path;
    }

    public URI toUri(String baseUrl) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return UriComponentsBuilder.fromUriString(base + relativeUri()).build(true).toUri();
    }

    private static String encode(String value) {
        return UriUtils.encodeQueryParam(value, StandardCharsets.UTF_8);
    }
}
