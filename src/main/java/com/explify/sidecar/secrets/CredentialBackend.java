package com.explify.sidecar.secrets;

import java.util.Optional;

/**
 * Durable credential storage scoped to one service identifier.
 * Implementations should use the platform's secure store (Keychain, Credential Manager, Secret Service).
 */
public interface CredentialBackend {

    /**
     * Checks that the backing store can be reached.
     *
     * @throws CredentialBackendException if the store is not usable on this host
     */
    void checkAvailable() throws CredentialBackendException;

    /**
     * @return the stored value, or empty if no entry exists
     */
    Optional<String> read(String name) throws CredentialBackendException;

    void write(String name, String value) throws CredentialBackendException;

    void remove(String name) throws CredentialBackendException;

    /**
     * Short human-readable name for logs.
     */
    String describe();
}
