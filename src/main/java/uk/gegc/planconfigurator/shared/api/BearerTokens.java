package uk.gegc.planconfigurator.shared.api;

import org.springframework.util.StringUtils;

/**
 * Extracts the bearer token forwarded to the billing backend from an {@code Authorization} header.
 */
public final class BearerTokens {

    private static final String PREFIX = "Bearer ";

    private BearerTokens() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * @return the token, or {@code null} when the header is absent or not a bearer credential
     */
    public static String fromHeader(String authorizationHeader) {
        if (!StringUtils.hasText(authorizationHeader)) {
            return null;
        }
        String header = authorizationHeader.trim();
        if (header.length() <= PREFIX.length() || !header.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            return null;
        }
        String token = header.substring(PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
