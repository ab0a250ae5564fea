package com.ellin.agentcore.authgateway.identity;

import org.springframework.security.oauth2.jwt.Jwt;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Derives the acting identity from verified claims. Pure; never fails.
 */
public class IdentityResolver {

    static final String REALM_ACCESS = "realm_access";
    static final String ROLES = "roles";
    static final String PREFERRED_USERNAME = "preferred_username";
    static final String EMAIL = "email";

    private final String impersonationRole;

    public IdentityResolver(String impersonationRole) {
        this.impersonationRole = impersonationRole;
    }

    public ActorIdentity resolve(Jwt claims, ActorOverrides overrides) {
        DelegationDecision decision = DelegationDecision.of(realmRoles(claims), impersonationRole);
        return identityFor(decision, claims, overrides == null ? ActorOverrides.NONE : overrides);
    }

    private static String tokenUser(Jwt claims) {
        return firstNonEmpty(claims.getClaimAsString(PREFERRED_USERNAME), claims.getSubject());
    }

    private static ActorIdentity identityFor(DelegationDecision decision, Jwt claims, ActorOverrides overrides) {
        String tokenUser = tokenUser(claims);
        String tokenEmail = firstNonEmpty(claims.getClaimAsString(EMAIL));
        return switch (decision) {
            case DELEGATED -> new ActorIdentity(
                    firstNonEmpty(overrides.user(), tokenUser),
                    firstNonEmpty(overrides.email(), tokenEmail),
                    decision,
                    claims);
            case DIRECT -> new ActorIdentity(tokenUser, tokenEmail, decision, claims);
        };
    }

    /**
     * {@code realm_access.roles}, or an empty set when missing or not shaped as expected.
     */
    static Set<String> realmRoles(Jwt claims) {
        Set<String> roles = new LinkedHashSet<>();
        Object realmAccess = claims.getClaims().get(REALM_ACCESS);
        if (realmAccess instanceof Map<?, ?> access && access.get(ROLES) instanceof Collection<?> values) {
            for (Object value : values) {
                if (value instanceof String role) {
                    roles.add(role);
                }
            }
        }
        return roles;
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "";
    }
}
