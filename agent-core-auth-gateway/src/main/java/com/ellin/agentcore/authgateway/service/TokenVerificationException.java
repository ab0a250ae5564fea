package com.ellin.agentcore.authgateway.service;

/**
 * A bearer token failed verification. The message is safe to return to the caller.
 */
public class TokenVerificationException extends Exception {

    private final VerificationFailure failure;

    public TokenVerificationException(VerificationFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public TokenVerificationException(VerificationFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public VerificationFailure getFailure() {
        return failure;
    }
}
