package com.ellin.agentcore.authgateway.identity;

import java.util.Collection;

/**
 * Whether a request may act as someone other than its token's user.
 */
public enum DelegationDecision {

    /** Identity comes from the token only; overrides are discarded. */
    DIRECT,

    /** Overrides replace the token identity where present. */
    DELEGATED;

    public static DelegationDecision of(Collection<String> roles, String impersonationRole) {
        return roles.contains(impersonationRole) ? DELEGATED : DIRECT;
    }
}
