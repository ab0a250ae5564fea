package com.ellin.agentcore.authgateway.identity;

import org.springframework.http.HttpHeaders;
import org.springframework.lang.Nullable;

/**
 * Caller supplied act-as values. Only honored for callers holding the impersonation role.
 *
 * @param user  requested user, null when absent or blank
 * @param email requested email, null when absent or blank
 */
public record ActorOverrides(@Nullable String user, @Nullable String email) {

    public static final ActorOverrides NONE = new ActorOverrides(null, null);

    public ActorOverrides {
        user = trimToNull(user);
        email = trimToNull(email);
    }

    public static ActorOverrides fromHeaders(HttpHeaders headers, String userHeader, String emailHeader) {
        return new ActorOverrides(headers.getFirst(userHeader), headers.getFirst(emailHeader));
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
