package com.explify.sidecar.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.proc.BadJOSEException;
import com.nimbusds.jose.proc.JWSVerificationKeySelector;
import com.nimbusds.jose.proc.SecurityContext;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.nimbusds.jwt.proc.DefaultJWTProcessor;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies RS256 access tokens issued by the identity provider. Signature checking is delegated to
 * Nimbus; time, issuer and audience claims are checked here so an expired token can be reported
 * as such.
 */
public class JwtValidator {
    private static final Logger log = LoggerFactory.getLogger(JwtValidator.class);
    private final JwksKeyProvider keyProvider;
    private final String expectedIssuer;
    private final String expectedAudience;
    private final long clockSkewSeconds;
    private final Clock clock;

    public JwtValidator(JwksKeyProvider keyProvider, String expectedIssuer, String expectedAudience, long clockSkewSeconds) {
        this(keyProvider, expectedIssuer, expectedAudience, clockSkewSeconds, Clock.systemUTC());
    }

    JwtValidator(JwksKeyProvider keyProvider, String expectedIssuer, String expectedAudience, long clockSkewSeconds, Clock clock) {
        this.keyProvider = keyProvider;
        this.expectedIssuer = expectedIssuer;
        this.expectedAudience = expectedAudience;
        this.clockSkewSeconds = clockSkewSeconds;
        this.clock = clock;
    }

    public ValidationResult validate(String token) {
        if (token == null || token.isEmpty()) {
            return ValidationResult.failure(Failure.MALFORMED, "empty token");
        }
        try {
            SignedJWT signedJWT = SignedJWT.parse(token);
            JWSAlgorithm algorithm = signedJWT.getHeader().getAlgorithm();
            if (!JWSAlgorithm.RS256.equals(algorithm)) {
                return ValidationResult.failure(Failure.MALFORMED, "algorithm not allowed: " + algorithm);
            }
            JWKSource<SecurityContext> keySource = this.keyProvider.getKeySource();
            if (keySource == null) {
                return ValidationResult.failure(Failure.KEYS_UNAVAILABLE, "signing keys unavailable");
            }
            DefaultJWTProcessor<SecurityContext> processor = new DefaultJWTProcessor<>();
            processor.setJWSKeySelector(new JWSVerificationKeySelector<>(JWSAlgorithm.RS256, keySource));
            processor.setJWTClaimsSetVerifier(null);
            JWTClaimsSet claims = processor.process(signedJWT, null);
            ValidationResult claimsValidation = this.validateClaims(claims);
            if (!claimsValidation.isValid()) {
                return claimsValidation;
            }
            log.debug("JWT validated for subject: {}", claims.getSubject());
            return claimsValidation;
        } catch (ParseException e) {
            log.debug("Failed to parse JWT: {}", e.getMessage());
            return ValidationResult.failure(Failure.MALFORMED, "malformed token");
        } catch (BadJOSEException e) {
            log.warn("JWT signature verification failed: {}", e.getMessage());
            return ValidationResult.failure(Failure.BAD_SIGNATURE, "signature verification failed");
        } catch (JOSEException e) {
            log.error("JWT processing error: {}", e.getMessage());
            return ValidationResult.failure(Failure.BAD_SIGNATURE, "token could not be processed");
        }
    }

    private ValidationResult validateClaims(JWTClaimsSet claims) {
        Instant now = this.clock.instant();
        Date expirationTime = claims.getExpirationTime();
        if (expirationTime != null && now.isAfter(expirationTime.toInstant().plusSeconds(this.clockSkewSeconds))) {
            return ValidationResult.failure(Failure.EXPIRED, "token expired");
        }
        Date notBeforeTime = claims.getNotBeforeTime();
        if (notBeforeTime != null && now.isBefore(notBeforeTime.toInstant().minusSeconds(this.clockSkewSeconds))) {
            return ValidationResult.failure(Failure.INVALID_CLAIMS, "token not yet valid");
        }
        if (hasText(this.expectedIssuer) && !this.expectedIssuer.equals(claims.getIssuer())) {
            return ValidationResult.failure(Failure.INVALID_CLAIMS, "invalid issuer");
        }
        if (hasText(this.expectedAudience) && !this.audienceMatches(claims)) {
            return ValidationResult.failure(Failure.INVALID_CLAIMS, "invalid audience");
        }
        if (!hasText(claims.getSubject())) {
            return ValidationResult.failure(Failure.MISSING_SUBJECT, "missing sub");
        }
        return ValidationResult.success(claims);
    }

    // Cognito access tokens carry the app client in client_id instead of aud.
    private boolean audienceMatches(JWTClaimsSet claims) {
        List<String> audience = claims.getAudience();
        if (audience != null && audience.contains(this.expectedAudience)) {
            return true;
        }
        Object clientId = claims.getClaim("client_id");
        return clientId != null && this.expectedAudience.equals(clientId.toString());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public enum Failure {
        MALFORMED,
        BAD_SIGNATURE,
        KEYS_UNAVAILABLE,
        EXPIRED,
        INVALID_CLAIMS,
        MISSING_SUBJECT
    }

    public static class ValidationResult {
        private final JWTClaimsSet claims;
        private final Failure failure;
        private final String error;

        private ValidationResult(JWTClaimsSet claims, Failure failure, String error) {
            this.claims = claims;
            this.failure = failure;
            this.error = error;
        }

        public static ValidationResult success(JWTClaimsSet claims) {
            return new ValidationResult(claims, null, null);
        }

        public static ValidationResult failure(Failure failure, String error) {
            return new ValidationResult(null, failure, error);
        }

        public boolean isValid() {
            return this.failure == null;
        }

        public Failure getFailure() {
            return this.failure;
        }

        public String getError() {
            return this.error;
        }

        public String getSubject() {
            return this.claims != null ? this.claims.getSubject() : null;
        }
    }
}
