package com.ellin.agentcore.authgateway.config;

import com.ellin.agentcore.authgateway.identity.IdentityResolver;
import com.ellin.agentcore.authgateway.service.KeyDirectory;
import com.ellin.agentcore.authgateway.service.KeyDirectoryLoader;
import com.ellin.agentcore.authgateway.service.TokenVerifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(AuthProperties.class)
public class AuthGatewayConfig {

    @Bean
    public KeyDirectoryLoader keyDirectoryLoader(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        return new KeyDirectoryLoader(webClientBuilder.build(), objectMapper);
    }

    /**
     * Loaded before the server starts accepting traffic. A failure here aborts startup.
     */
    @Bean
    public KeyDirectory keyDirectory(KeyDirectoryLoader loader, AuthProperties properties) {
        return loader.load(properties.resolveRealmUrl(), properties.getDiscoveryTimeout());
    }

    @Bean
    public TokenVerifier tokenVerifier(KeyDirectory keyDirectory, AuthProperties properties) {
        return new TokenVerifier(keyDirectory, properties.getClockSkew());
    }

    @Bean
    public IdentityResolver identityResolver(AuthProperties properties) {
        return new IdentityResolver(properties.getImpersonationRole());
    }
}
