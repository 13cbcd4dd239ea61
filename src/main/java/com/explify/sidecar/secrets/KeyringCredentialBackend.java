package com.explify.sidecar.secrets;

import com.github.javakeyring.BackendNotSupportedException;
import com.github.javakeyring.Keyring;
import com.github.javakeyring.PasswordAccessException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OS keyring backend (macOS Keychain, Windows Credential Manager, freedesktop Secret Service).
 * Encryption at rest is the platform's responsibility.
 */
public class KeyringCredentialBackend implements CredentialBackend {
    private static final Logger log = LoggerFactory.getLogger(KeyringCredentialBackend.class);
    private final String serviceName;
    private volatile Keyring keyring;

    public KeyringCredentialBackend(String serviceName) {
        this.serviceName = serviceName;
    }

    @Override
    public void checkAvailable() throws CredentialBackendException {
        this.keyring();
    }

    @Override
    public Optional<String> read(String name) throws CredentialBackendException {
        Keyring store = this.keyring();
        try {
            return Optional.ofNullable(store.getPassword(this.serviceName, name));
        } catch (PasswordAccessException e) {
            // Backends report a missing entry the same way as a denied read.
            log.debug("No keyring entry for {}: {}", name, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            throw new CredentialBackendException("Keyring read failed for " + name, e);
        }
    }

    @Override
    public void write(String name, String value) throws CredentialBackendException {
        Keyring store = this.keyring();
        try {
            store.setPassword(this.serviceName, name, value);
        } catch (PasswordAccessException | RuntimeException e) {
            throw new CredentialBackendException("Keyring write failed for " + name, e);
        }
    }

    @Override
    public void remove(String name) throws CredentialBackendException {
        Keyring store = this.keyring();
        try {
            store.deletePassword(this.serviceName, name);
        } catch (PasswordAccessException e) {
            log.debug("Keyring delete for {} reported: {}", name, e.getMessage());
        } catch (RuntimeException e) {
            throw new CredentialBackendException("Keyring delete failed for " + name, e);
        }
    }

    @Override
    public String describe() {
        return "OS keyring (service=" + this.serviceName + ")";
    }

    private Keyring keyring() throws CredentialBackendException {
        Keyring current = this.keyring;
        if (current != null) {
            return current;
        }
        try {
            current = Keyring.create();
        } catch (BackendNotSupportedException | RuntimeException | LinkageError e) {
            throw new CredentialBackendException("No supported OS keyring backend: " + e.getMessage(), e);
        }
        this.keyring = current;
        return current;
    }
}
