package com.ellin.agentcore.authgateway.identity;

import org.springframework.lang.Nullable;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.server.ServerWebExchange;

import java.util.Objects;

/**
 * The identity a request acts as, after delegation has been applied.
 *
 * @param user       acting user; empty only for a token with neither preferred_username nor sub
 * @param email      acting email, empty when unknown
 * @param delegation whether act-as overrides were allowed for this request
 * @param claims     verified token the identity was derived from
 */
public record ActorIdentity(String user, String email, DelegationDecision delegation, Jwt claims) {

    public static final String EXCHANGE_ATTRIBUTE = ActorIdentity.class.getName();

    public ActorIdentity {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(delegation, "delegation");
        Objects.requireNonNull(claims, "claims");
        if (email == null) {
            email = "";
        }
    }

    @Nullable
    public static ActorIdentity from(ServerWebExchange exchange) {
        return exchange.getAttribute(EXCHANGE_ATTRIBUTE);
    }

    // claims are left out on purpose, they carry the raw token
    @Override
    public String toString() {
        return "ActorIdentity{user='" + user + "', email='" + email + "', delegation=" + delegation + "}";
    }
}
