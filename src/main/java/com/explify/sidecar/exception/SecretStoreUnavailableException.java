package com.explify.sidecar.exception;

/**
 * The OS credential store cannot be used and the operating mode forbids an in-memory substitute.
 */
public class SecretStoreUnavailableException extends RuntimeException {
    public SecretStoreUnavailableException(String message) {
        super(message);
    }

    public SecretStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
