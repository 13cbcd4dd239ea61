package com.explify.sidecar.exception;

/**
 * No identity, or the presented credential could not be verified.
 */
public class UnauthenticatedException extends RuntimeException {
    public static final String DEFAULT_MESSAGE = "Authentication required.";

    public UnauthenticatedException() {
        super(DEFAULT_MESSAGE);
    }

    public UnauthenticatedException(String message) {
        super(message);
    }
}
