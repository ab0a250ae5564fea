package com.ellin.agentcore.authgateway.identity;

import reactor.core.publisher.Mono;
import reactor.util.context.Context;

/**
 * Reactor context access to the request's {@link ActorIdentity}.
 */
public final class ActorContext {

    private static final Class<ActorIdentity> KEY = ActorIdentity.class;

    private ActorContext() {
    }

    public static Context with(ActorIdentity identity) {
        return Context.of(KEY, identity);
    }

    /**
     * The current actor, or empty outside an authenticated request.
     */
    public static Mono<ActorIdentity> current() {
        return Mono.deferContextual(ctx -> Mono.justOrEmpty(ctx.<ActorIdentity>getOrEmpty(KEY)));
    }
}
