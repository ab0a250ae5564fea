package com.ellin.agentcore.authgateway.service;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import com.nimbusds.jose.proc.BadJOSEException;
import com.nimbusds.jose.proc.JWSVerificationKeySelector;
import com.nimbusds.jose.proc.SecurityContext;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.nimbusds.jwt.proc.BadJWTException;
import com.nimbusds.jwt.proc.DefaultJWTClaimsVerifier;
import com.nimbusds.jwt.proc.DefaultJWTProcessor;
import org.springframework.security.oauth2.jwt.Jwt;

import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Verifies bearer tokens against the cached {@link KeyDirectory}.
 *
 * <p>The verification algorithm always comes from the resolved key, so a token whose header
 * names a different algorithm than its key is rejected before any signature check. Verification
 * performs no I/O.</p>
 */
public class TokenVerifier {

    static final String UNKNOWN_KEY_MESSAGE = "Unknown key id (kid)";
    static final String BAD_ISSUER_MESSAGE = "Bad issuer";

    private final KeyDirectory keyDirectory;
    private final int clockSkewSeconds;

    public TokenVerifier(KeyDirectory keyDirectory, Duration clockSkew) {
        this.keyDirectory = keyDirectory;
        this.clockSkewSeconds = (int) clockSkew.getSeconds();
    }

    public Jwt verify(String token, String expectedAudience, String expectedIssuer)
            throws TokenVerificationException {
        SignedJWT signedJwt;
        try {
            signedJwt = SignedJWT.parse(token);
        } catch (ParseException e) {
            throw new TokenVerificationException(VerificationFailure.MALFORMED, e.getMessage(), e);
        }

        SigningKey key = keyDirectory.lookup(signedJwt.getHeader().getKeyID())
                .orElseThrow(() -> new TokenVerificationException(
                        VerificationFailure.UNKNOWN_KEY, UNKNOWN_KEY_MESSAGE));

        JWTClaimsSet claimsSet;
        try {
            claimsSet = processorFor(key, expectedAudience).process(signedJwt, null);
        } catch (BadJWTException e) {
            throw new TokenVerificationException(VerificationFailure.INVALID_CLAIMS, e.getMessage(), e);
        } catch (BadJOSEException | JOSEException e) {
            throw new TokenVerificationException(VerificationFailure.INVALID_SIGNATURE, e.getMessage(), e);
        }

        if (!Objects.equals(claimsSet.getIssuer(), expectedIssuer)) {
            throw new TokenVerificationException(VerificationFailure.BAD_ISSUER, BAD_ISSUER_MESSAGE);
        }

        return toJwt(token, signedJwt, claimsSet);
    }

    private DefaultJWTProcessor<SecurityContext> processorFor(SigningKey key, String expectedAudience) {
        DefaultJWTProcessor<SecurityContext> processor = new DefaultJWTProcessor<>();
        processor.setJWSKeySelector(new JWSVerificationKeySelector<>(
                key.algorithm(), new ImmutableJWKSet<>(new JWKSet(key.jwk()))));

        DefaultJWTClaimsVerifier<SecurityContext> claimsVerifier = new DefaultJWTClaimsVerifier<>(
                Set.of(expectedAudience),
                null,
                null,
                null);
        claimsVerifier.setMaxClockSkew(clockSkewSeconds);
        processor.setJWTClaimsSetVerifier(claimsVerifier);
        return processor;
    }

    private static Jwt toJwt(String token, SignedJWT signedJwt, JWTClaimsSet claimsSet)
            throws TokenVerificationException {
        Map<String, Object> headers = signedJwt.getHeader().toJSONObject();
        Map<String, Object> claims = claimsSet.toJSONObject();
        Instant issuedAt = claimsSet.getIssueTime() != null
                ? claimsSet.getIssueTime().toInstant()
                : null;
        Instant expiresAt = claimsSet.getExpirationTime() != null
                ? claimsSet.getExpirationTime().toInstant()
                : null;
        try {
            return new Jwt(token, issuedAt, expiresAt, headers, claims);
        } catch (IllegalArgumentException e) {
            // iat not before exp
            throw new TokenVerificationException(VerificationFailure.INVALID_CLAIMS, e.getMessage(), e);
        }
    }
}
