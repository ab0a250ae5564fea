package com.ellin.agentcore.authgateway.controller;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
public class HealthController {

    /**
     * Liveness probe. Public, see {@code auth.public-paths}.
     */
    @GetMapping(value = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> healthz() {
        return Mono.just(Map.of("ok", true));
    }
}
