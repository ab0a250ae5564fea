package com.ellin.agentcore.authgateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Authenticating gateway for the agent runtime.
 *
 * <p>Every request except the public health check must carry a bearer token issued by the
 * configured Keycloak realm. The resolved actor is attached to the exchange and relayed to the
 * agent behind the {@code agent-core} route.</p>
 */
@SpringBootApplication
public class AuthGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuthGatewayApplication.class, args);
    }
}
