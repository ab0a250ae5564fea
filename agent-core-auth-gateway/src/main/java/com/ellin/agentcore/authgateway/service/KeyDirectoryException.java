package com.ellin.agentcore.authgateway.service;

/**
 * The discovery document or key set could not be loaded. Thrown during startup only.
 */
public class KeyDirectoryException extends RuntimeException {

    public KeyDirectoryException(String message) {
        super(message);
    }

    public KeyDirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
