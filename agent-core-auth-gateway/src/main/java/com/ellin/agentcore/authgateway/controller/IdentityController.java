package com.ellin.agentcore.authgateway.controller;

import com.ellin.agentcore.authgateway.identity.ActorContext;
import com.ellin.agentcore.authgateway.identity.DelegationDecision;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class IdentityController {

    /**
     * Returns the actor this request runs as.
     * Use this to check what the agent will see for a given token and act-as headers.
     */
    @GetMapping(value = "/whoami", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> whoami() {
        return ActorContext.current()
                .map(identity -> {
                    Map<String, Object> response = new LinkedHashMap<>();
                    response.put("user", identity.user());
                    response.put("email", identity.email());
                    response.put("subject", identity.claims().getSubject());
                    response.put("delegated", identity.delegation() == DelegationDecision.DELEGATED);
                    return ResponseEntity.ok(response);
                })
                .defaultIfEmpty(ResponseEntity.status(HttpStatus.UNAUTHORIZED).build());
    }
}
