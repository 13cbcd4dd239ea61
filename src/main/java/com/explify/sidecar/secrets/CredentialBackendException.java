package com.explify.sidecar.secrets;

public class CredentialBackendException extends Exception {
    public CredentialBackendException(String message) {
        super(message);
    }

    public CredentialBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
