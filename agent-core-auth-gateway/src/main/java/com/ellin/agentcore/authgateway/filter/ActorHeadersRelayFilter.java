package com.ellin.agentcore.authgateway.filter;

import com.ellin.agentcore.authgateway.config.AuthProperties;
import com.ellin.agentcore.authgateway.identity.ActorIdentity;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.core.Ordered;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Hands the resolved actor to the agent as request headers.
 * Inbound copies of the relay headers are always dropped so callers cannot forge them.
 */
@Component
public class ActorHeadersRelayFilter implements GlobalFilter, Ordered {

    private final AuthProperties.Relay relay;

    public ActorHeadersRelayFilter(AuthProperties properties) {
        this.relay = properties.getRelay();
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        ActorIdentity identity = ActorIdentity.from(exchange);

        ServerHttpRequest mutatedRequest = exchange.getRequest()
                .mutate()
                .headers(h -> {
                    h.remove(relay.getUserHeader());
                    h.remove(relay.getEmailHeader());
                    if (relay.isEnabled() && identity != null) {
                        h.set(relay.getUserHeader(), identity.user());
                        if (!identity.email().isEmpty()) {
                            h.set(relay.getEmailHeader(), identity.email());
                        }
                    }
                })
                .build();

        return chain.filter(exchange.mutate().request(mutatedRequest).build());
    }

    @Override
    public int getOrder() {
        // Before DownstreamLoggingFilter and the Netty routing filter
        return 10001;
    }
}
