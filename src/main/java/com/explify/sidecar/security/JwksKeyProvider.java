package com.explify.sidecar.security;

import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.proc.SecurityContext;
import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.ParseException;
import java.time.Instant;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signing keys of the identity provider.
 *
 * Key sources, first match wins:
 * 1. Local JWKS file (offline deployments and tests)
 * 2. Configured JWKS URI
 * 3. The issuer's {@code /.well-known/jwks.json} (Cognito publishes its keys there)
 *
 * Keys are cached for {@code cacheTtlSeconds}. A failed refresh keeps serving the previous set.
 */
public class JwksKeyProvider {
    private static final Logger log = LoggerFactory.getLogger(JwksKeyProvider.class);

    private final String jwksUri;
    private final String localJwksPath;
    private final String issuer;
    private final long cacheTtlSeconds;

    private JWKSet cachedKeySet;
    private Instant cacheExpiry = Instant.MIN;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public JwksKeyProvider(String jwksUri, String localJwksPath, String issuer, long cacheTtlSeconds) {
        this.jwksUri = jwksUri;
        this.localJwksPath = localJwksPath;
        this.issuer = issuer;
        this.cacheTtlSeconds = cacheTtlSeconds;
    }

    /**
     * @return key source for signature verification, or null if no keys could be loaded
     */
    public JWKSource<SecurityContext> getKeySource() {
        lock.readLock().lock();
        try {
            if (cachedKeySet != null && Instant.now().isBefore(cacheExpiry)) {
                return new ImmutableJWKSet<>(cachedKeySet);
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            if (cachedKeySet != null && Instant.now().isBefore(cacheExpiry)) {
                return new ImmutableJWKSet<>(cachedKeySet);
            }
            JWKSet newKeySet = loadKeys();
            if (newKeySet != null) {
                cachedKeySet = newKeySet;
                cacheExpiry = Instant.now().plusSeconds(cacheTtlSeconds);
                log.info("JWKS refreshed: {} keys loaded, cache expires at {}",
                        newKeySet.getKeys().size(), cacheExpiry);
            }
            return cachedKeySet != null ? new ImmutableJWKSet<>(cachedKeySet) : null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private JWKSet loadKeys() {
        if (hasText(localJwksPath)) {
            JWKSet localKeys = loadFromFile(localJwksPath);
            if (localKeys != null) {
                return localKeys;
            }
        }
        if (hasText(jwksUri)) {
            JWKSet remoteKeys = loadFromUri(jwksUri);
            if (remoteKeys != null) {
                return remoteKeys;
            }
        }
        if (hasText(issuer)) {
            JWKSet discovered = loadFromUri(issuer + "/.well-known/jwks.json");
            if (discovered != null) {
                return discovered;
            }
        }
        log.error("Failed to load JWKS from any source");
        return null;
    }

    private JWKSet loadFromFile(String path) {
        try {
            Path filePath = Path.of(path);
            if (!Files.exists(filePath)) {
                log.warn("Local JWKS file not found: {}", path);
                return null;
            }
            JWKSet keySet = JWKSet.parse(Files.readString(filePath));
            log.info("Loaded {} keys from local JWKS file {}", keySet.getKeys().size(), path);
            return keySet;
        } catch (IOException | ParseException e) {
            log.error("Failed to load JWKS from file {}: {}", path, e.getMessage());
            return null;
        }
    }

    private JWKSet loadFromUri(String uri) {
        try {
            log.debug("Fetching JWKS from: {}", uri);
            JWKSet keySet = JWKSet.load(new URL(uri));
            log.info("Loaded {} keys from {}", keySet.getKeys().size(), uri);
            return keySet;
        } catch (IOException | ParseException e) {
            log.warn("Failed to load JWKS from {}: {}", uri, e.getMessage());
            return null;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
