package com.explify.sidecar.secrets;

import com.explify.sidecar.config.ModeConfig;
import com.explify.sidecar.exception.SecretStoreUnavailableException;
import jakarta.annotation.PostConstruct;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Named credential storage with an explicit degradation state.
 *
 * <p>{@code PRIMARY}: values live in the {@link CredentialBackend}. {@code FALLBACK}: the backend
 * was unusable at startup or failed a write, and new values live in process memory until restart.
 * The transition happens once, is logged, and is never reversed. A backend that answered the
 * startup check stays readable after a failed write, so entries stored before the failure remain
 * visible; an entry written to memory afterwards shadows the backend copy.</p>
 *
 * <p>In networked mode memory is never an acceptable home for a credential: an unreachable backend
 * at startup is fatal and a failed write raises {@link SecretStoreUnavailableException}.</p>
 */
@Component
public class SecretStore {
    private static final Logger log = LoggerFactory.getLogger(SecretStore.class);

    public enum State {
        UNINITIALIZED,
        PRIMARY,
        FALLBACK
    }

    private final CredentialBackend backend;
    private final ModeConfig modeConfig;
    private final AtomicReference<State> state = new AtomicReference<>(State.UNINITIALIZED);
    private final Map<String, String> fallback = new ConcurrentHashMap<>();
    private volatile boolean backendReachable;

    public SecretStore(CredentialBackend backend, ModeConfig modeConfig) {
        this.backend = backend;
        this.modeConfig = modeConfig;
    }

    @PostConstruct
    public void initialize() {
        try {
            this.backend.checkAvailable();
            this.backendReachable = true;
            if (!this.state.compareAndSet(State.UNINITIALIZED, State.PRIMARY)) {
                return;
            }
            log.info("Secret store using {}", this.backend.describe());
        } catch (CredentialBackendException e) {
            if (this.modeConfig.isNetworked()) {
                log.error("=================================================================");
                log.error("SECURITY CONFIGURATION ERROR: secure credential store unavailable");
                log.error("{}", e.getMessage());
                log.error("Networked mode refuses to keep credentials in memory.");
                log.error("=================================================================");
                throw new SecretStoreUnavailableException("Secure credential store unavailable: " + e.getMessage(), e);
            }
            if (!this.state.compareAndSet(State.UNINITIALIZED, State.FALLBACK)) {
                return;
            }
            log.warn("Secure credential store unavailable ({}); credentials will be held in memory and lost on restart", e.getMessage());
        }
    }

    public Optional<String> get(String name) {
        if (this.currentState() == State.FALLBACK) {
            String written = this.fallback.get(name);
            if (written != null) {
                return Optional.of(written);
            }
        }
        if (this.backendReachable) {
            try {
                Optional<String> value = this.backend.read(name);
                if (value.isPresent()) {
                    return value;
                }
            } catch (CredentialBackendException e) {
                log.warn("Credential read for {} failed, consulting in-memory store: {}", name, e.getMessage());
            }
        }
        return Optional.ofNullable(this.fallback.get(name));
    }

    public void set(String name, String value) {
        if (this.currentState() == State.PRIMARY) {
            try {
                this.backend.write(name, value);
                return;
            } catch (CredentialBackendException e) {
                if (this.modeConfig.isNetworked()) {
                    throw new SecretStoreUnavailableException("Could not store credential " + name, e);
                }
                if (this.state.compareAndSet(State.PRIMARY, State.FALLBACK)) {
                    log.warn("Credential write to {} failed, switching to in-memory storage until restart: {}",
                            this.backend.describe(), e.getMessage());
                }
            }
        }
        this.fallback.put(name, value);
    }

    public void delete(String name) {
        // initializes on first use
        this.currentState();
        if (this.backendReachable) {
            try {
                this.backend.remove(name);
            } catch (CredentialBackendException e) {
                log.warn("Credential delete for {} failed: {}", name, e.getMessage());
            }
        }
        this.fallback.remove(name);
    }

    public State getState() {
        return this.state.get();
    }

    public boolean isDegraded() {
        return this.state.get() == State.FALLBACK;
    }

    private State currentState() {
        State current = this.state.get();
        if (current == State.UNINITIALIZED) {
            this.initialize();
            current = this.state.get();
        }
        return current;
    }
}
