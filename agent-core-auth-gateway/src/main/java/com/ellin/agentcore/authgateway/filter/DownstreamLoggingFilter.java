package com.ellin.agentcore.authgateway.filter;

import com.ellin.agentcore.authgateway.identity.ActorIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.cloud.gateway.support.ServerWebExchangeUtils;
import org.springframework.core.Ordered;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Logs each call forwarded to the agent and how it ended.
 * Headers are never logged: they carry bearer tokens.
 */
@Component
public class DownstreamLoggingFilter implements GlobalFilter, Ordered {

    private static final Logger log = LoggerFactory.getLogger(DownstreamLoggingFilter.class);

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        long startTime = System.currentTimeMillis();

        ServerHttpRequest request = exchange.getRequest();
        URI targetUri = exchange.getAttribute(ServerWebExchangeUtils.GATEWAY_REQUEST_URL_ATTR);
        ActorIdentity identity = ActorIdentity.from(exchange);

        log.info("Forwarding {} {} to {}", request.getMethod(), request.getPath(), targetUri);
        if (identity != null) {
            log.debug("Acting user: {}", identity.user());
        }

        return chain.filter(exchange).then(Mono.fromRunnable(() -> {
            long duration = System.currentTimeMillis() - startTime;
            log.info("Agent responded {} for {} {} in {}ms",
                    exchange.getResponse().getStatusCode(), request.getMethod(), request.getPath(), duration);
        }));
    }

    @Override
    public int getOrder() {
        // Run after ActorHeadersRelayFilter (10001)
        // and before routing filters (NettyRoutingFilter at 2147483647)
        return 10002;
    }
}
