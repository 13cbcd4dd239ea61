package com.explify.sidecar.service;

import static org.junit.jupiter.api.Assertions.*;

import com.explify.sidecar.security.JwksKeyProvider;
import com.explify.sidecar.security.JwtValidator;
import com.explify.sidecar.support.TestTokens;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockHttpServletRequest;

class JwtIdentityResolverTest {

    @TempDir
    Path tempDir;

    private TestTokens tokens;
    private JwtIdentityResolver resolver;

    @BeforeEach
    void setUp() throws Exception {
        tokens = new TestTokens();
        JwksKeyProvider keys = new JwksKeyProvider("", tokens.writeJwks(tempDir).toString(), "", 3600);
        resolver = new JwtIdentityResolver(new JwtValidator(keys, TestTokens.ISSUER, TestTokens.CLIENT_ID, 0));
    }

    private MockHttpServletRequest withAuthorization(String value) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/history");
        if (value != null) {
            request.addHeader("Authorization", value);
        }
        return request;
    }

    @Test
    void resolvesSubjectOfValidBearerToken() {
        IdentityResolution resolution = resolver.resolve(withAuthorization("Bearer " + tokens.token("u1")));

        assertTrue(resolution.isResolved());
        assertEquals("u1", resolution.getIdentity());
    }

    @Test
    void missingOrNonBearerHeader() {
        assertEquals(JwtIdentityResolver.MISSING_HEADER, resolver.resolve(withAuthorization(null)).getReason());
        assertEquals(JwtIdentityResolver.MISSING_HEADER, resolver.resolve(withAuthorization("Basic dTpw")).getReason());
    }

    @Test
    void expiredToken() {
        String expired = tokens.token("u1", Instant.now().minusSeconds(60));

        assertEquals(JwtIdentityResolver.TOKEN_EXPIRED, resolver.resolve(withAuthorization("Bearer " + expired)).getReason());
    }

    @Test
    void invalidToken() {
        IdentityResolution resolution = resolver.resolve(withAuthorization("Bearer abc.def.ghi"));

        assertFalse(resolution.isResolved());
        assertEquals(JwtIdentityResolver.INVALID_TOKEN, resolution.getReason());
    }

    @Test
    void tokenWithoutSubject() {
        assertEquals(JwtIdentityResolver.MISSING_SUBJECT, resolver.resolve(withAuthorization("Bearer " + tokens.token(null))).getReason());
    }

    @Test
    void localResolverAlwaysYieldsLocalUser() {
        LocalIdentityResolver local = new LocalIdentityResolver("local-user");

        assertEquals("local-user", local.resolve(withAuthorization(null)).getIdentity());
        assertEquals("local-user", local.resolve(withAuthorization("Bearer garbage")).getIdentity());
    }
}
