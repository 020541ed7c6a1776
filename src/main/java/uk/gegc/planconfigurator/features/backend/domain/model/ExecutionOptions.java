package uk.gegc.planconfigurator.features.backend.domain.model;

/**
 * Per-call inputs that are not part of the resolved route.
 *
 * @param authToken bearer token from the auth collaborator, {@code null} when unauthenticated
 * @param body      request body in wire shape; a {@link java.util.Map} containing a
 *                  {@link BinaryPayload} value is sent as multipart form data
 * @param slotScope owner of the call for race guarding, e.g. a workflow session; {@code null}
 *                  when the result is not applied to shared state and must never be discarded
 */
public record ExecutionOptions(String authToken, Object body, String slotScope) {

    public ExecutionOptions(String authToken, Object body) {
        this(authToken, body, null);
    }

    public static ExecutionOptions withToken(String authToken) {
        return new ExecutionOptions(authToken, null, null);
    }

    public static ExecutionOptions unauthenticated() {
        return new ExecutionOptions(null, null, null);
    }

    public ExecutionOptions inSlot(String scope) {
        return new ExecutionOptions(authToken, body, scope);
    }

    public boolean hasAuthToken() {
        return authToken != null && !authToken.isBlank();
    }

    public boolean hasSlotScope() {
        return slotScope != null && !slotScope.isBlank();
    }
}
