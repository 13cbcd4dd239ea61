package com.explify.sidecar.exception;

/**
 * The identity is valid but lacks the privilege for the operation.
 */
public class ForbiddenException extends RuntimeException {
    public ForbiddenException(String message) {
        super(message);
    }
}
