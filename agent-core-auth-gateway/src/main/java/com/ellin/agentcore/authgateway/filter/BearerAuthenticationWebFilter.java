package com.ellin.agentcore.authgateway.filter;

import com.ellin.agentcore.authgateway.config.AuthProperties;
import com.ellin.agentcore.authgateway.identity.ActorContext;
import com.ellin.agentcore.authgateway.identity.ActorIdentity;
import com.ellin.agentcore.authgateway.identity.ActorOverrides;
import com.ellin.agentcore.authgateway.identity.IdentityResolver;
import com.ellin.agentcore.authgateway.service.TokenVerificationException;
import com.ellin.agentcore.authgateway.service.TokenVerifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Requires a verified bearer token on every non-public request and attaches the resolved
 * {@link ActorIdentity} before handing the exchange on.
 *
 * <p>Registered as a {@link WebFilter} rather than a gateway filter so it also guards local
 * controllers. This is the only place verification failures become HTTP responses.</p>
 */
@Component
public class BearerAuthenticationWebFilter implements WebFilter, Ordered {

    private static final Logger log = LoggerFactory.getLogger(BearerAuthenticationWebFilter.class);

    static final String BEARER_PREFIX = "Bearer ";
    static final String MISSING_BEARER_MESSAGE = "Missing bearer token";

    private final TokenVerifier tokenVerifier;
    private final IdentityResolver identityResolver;
    private final AuthProperties properties;
    private final ObjectMapper objectMapper;

    public BearerAuthenticationWebFilter(
            TokenVerifier tokenVerifier,
            IdentityResolver identityResolver,
            AuthProperties properties,
            ObjectMapper objectMapper) {
        this.tokenVerifier = tokenVerifier;
        this.identityResolver = identityResolver;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String path = request.getPath().pathWithinApplication().value();

        if (isPublic(path)) {
            return chain.filter(exchange);
        }

        String authHeader = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || !authHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            log.debug("Rejected {} {}: no bearer token", request.getMethod(), path);
            return reject(exchange, MISSING_BEARER_MESSAGE);
        }

        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        String audience = properties.getAudience();
        String issuer = properties.resolveIssuer();

        return Mono.fromCallable(() -> tokenVerifier.verify(token, audience, issuer))
                .flatMap(claims -> forward(exchange, chain, claims))
                .onErrorResume(TokenVerificationException.class, e -> {
                    log.debug("Rejected {} {}: {}", request.getMethod(), path, e.getFailure());
                    return reject(exchange, e.getMessage());
                });
    }

    private Mono<Void> forward(ServerWebExchange exchange, WebFilterChain chain, Jwt claims) {
        ActorOverrides overrides = ActorOverrides.fromHeaders(
                exchange.getRequest().getHeaders(),
                properties.getActorUserHeader(),
                properties.getActorEmailHeader());
        ActorIdentity identity = identityResolver.resolve(claims, overrides);

        exchange.getAttributes().put(ActorIdentity.EXCHANGE_ATTRIBUTE, identity);
        return chain.filter(exchange)
                .contextWrite(ActorContext.with(identity));
    }

    private boolean isPublic(String path) {
        List<String> publicPaths = properties.getPublicPaths();
        if (publicPaths == null) {
            return false;
        }
        for (String prefix : publicPaths) {
            if (prefix != null && !prefix.isEmpty() && path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private Mono<Void> reject(ServerWebExchange exchange, String detail) {
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(HttpStatus.UNAUTHORIZED);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        response.getHeaders().set(HttpHeaders.WWW_AUTHENTICATE, "Bearer");

        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(Map.of("detail", detail == null ? "Unauthorized" : detail));
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
        DataBuffer buffer = response.bufferFactory().wrap(body);
        return response.writeWith(Mono.just(buffer));
    }

    @Override
    public int getOrder() {
        // After Spring Security's WebFilterChainProxy (-100)
        return -50;
    }
}
