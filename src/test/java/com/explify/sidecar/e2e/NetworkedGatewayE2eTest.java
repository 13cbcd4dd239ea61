package com.explify.sidecar.e2e;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.explify.sidecar.model.BaaAcceptance;
import com.explify.sidecar.model.PhiAccessRecord;
import com.explify.sidecar.model.RequestAuditRecord;
import com.explify.sidecar.model.UsageRecord;
import com.explify.sidecar.model.User;
import com.explify.sidecar.repository.UserRepository;
import com.explify.sidecar.secrets.CredentialBackend;
import com.explify.sidecar.support.TestTokens;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.gridfs.GridFsTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class NetworkedGatewayE2eTest {

    private static final TestTokens TOKENS = new TestTokens();
    private static final Path JWKS_PATH = writeJwks();

    @DynamicPropertySource
    static void configureNetworked(DynamicPropertyRegistry registry) {
        registry.add("app.require-auth", () -> "true");
        registry.add("app.admin.emails", () -> "Admin@Example.com");
        registry.add("app.oidc.issuer", () -> TestTokens.ISSUER);
        registry.add("app.oidc.client-id", () -> TestTokens.CLIENT_ID);
        registry.add("app.oidc.local-jwks-path", () -> JWKS_PATH.toString());
        registry.add("app.rate-limit.analyze.limit", () -> "2");
    }

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private MongoTemplate mongoTemplate;

    @MockitoBean
    private GridFsTemplate gridFsTemplate;

    @MockitoBean
    private UserRepository userRepository;

    @MockitoBean
    private CredentialBackend credentialBackend;

    @BeforeEach
    void setup() {
        when(userRepository.findById("u1")).thenReturn(Optional.of(new User("u1", "admin@example.com")));
        when(userRepository.findById("u2")).thenReturn(Optional.of(new User("u2", "clinician@example.com")));
        when(userRepository.findAll(any(Sort.class))).thenReturn(List.of(new User("u1", "admin@example.com")));
        when(credentialBackend.describe()).thenReturn("mock keyring");
    }

    private static Path writeJwks() {
        try {
            return TOKENS.writeJwks(Files.createTempDirectory("explify-jwks"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String bearer(String subject) {
        return "Bearer " + TOKENS.token(subject);
    }

    @Test
    void healthIsPublic() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.mode").value("NETWORKED"))
                .andExpect(header().string("Cache-Control", containsString("no-store")))
                .andExpect(header().string("X-Frame-Options", "DENY"));
    }

    @Test
    void missingTokenIsRejectedBeforeAnyAuditWrite() throws Exception {
        mockMvc.perform(get("/admin/users"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Missing authorization header"));

        verify(mongoTemplate, after(200).never()).insert(argThat((Object row) ->
                row instanceof RequestAuditRecord && ((RequestAuditRecord) row).getStatusCode() == 401));
    }

    @Test
    void tamperedTokenIsRejected() throws Exception {
        String token = TOKENS.token("u1");
        String tampered = token.substring(0, token.length() - 4) + "AAAA";

        mockMvc.perform(get("/admin/users").header("Authorization", "Bearer " + tampered))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Invalid token"));
    }

    @Test
    void adminSeesUserListAndRequestIsAudited() throws Exception {
        mockMvc.perform(get("/admin/users").header("Authorization", bearer("u1")))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$[0].email").value("admin@example.com"));

        verify(mongoTemplate, timeout(2000)).insert(any(RequestAuditRecord.class));
    }

    @Test
    void nonAdminIsForbidden() throws Exception {
        mockMvc.perform(get("/admin/audit-log").header("Authorization", bearer("u2")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.detail").value("Admin access required."));
    }

    @Test
    void consentStatusAndAcceptance() throws Exception {
        when(mongoTemplate.exists(any(Query.class), any(Class.class))).thenReturn(false);

        mockMvc.perform(get("/baa/status").header("Authorization", bearer("u2")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(false))
                .andExpect(jsonPath("$.version").value("1.0"));

        mockMvc.perform(post("/baa/accept").header("Authorization", bearer("u2")).header("User-Agent", "ExplifyDesktop/2.1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(true));

        verify(mongoTemplate).insert(any(BaaAcceptance.class));
    }

    @Test
    void accountExportIsRecordedAsPhiAccess() throws Exception {
        mockMvc.perform(get("/account/export").header("Authorization", bearer("u2")))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("explify-data-export.json")))
                .andExpect(jsonPath("$.userId").value("u2"))
                .andExpect(jsonPath("$.baaAcceptances").isArray())
                .andExpect(jsonPath("$.phiAccess").isArray());

        verify(mongoTemplate, timeout(2000)).insert(argThat((Object row) ->
                row instanceof PhiAccessRecord && "export_account".equals(((PhiAccessRecord) row).getAction())));
    }

    @Test
    void usageReportIsStoredWithClientFieldNames() throws Exception {
        mockMvc.perform(post("/admin/usage/log")
                        .header("Authorization", bearer("u2"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"model_used\":\"claude-sonnet-4\",\"input_tokens\":120,\"output_tokens\":40,"
                                + "\"request_type\":\"explain\",\"deep_analysis\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));

        verify(mongoTemplate, timeout(2000)).insert(argThat((Object row) -> row instanceof UsageRecord
                && "u2".equals(((UsageRecord) row).getUserId())
                && "claude-sonnet-4".equals(((UsageRecord) row).getModelUsed())
                && ((UsageRecord) row).getInputTokens() == 120
                && ((UsageRecord) row).isDeepAnalysis()));
    }

    @Test
    void analyzeRoutesAreRateLimitedPerUser() throws Exception {
        String token = bearer("rate-limited-user");
        mockMvc.perform(post("/analyze/report").header("Authorization", token));
        mockMvc.perform(post("/analyze/report").header("Authorization", token));

        mockMvc.perform(post("/analyze/report").header("Authorization", token))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists("Retry-After"))
                .andExpect(jsonPath("$.retryAfter").value(greaterThanOrEqualTo(1)));

        mockMvc.perform(post("/analyze/report").header("Authorization", bearer("someone-else")))
                .andExpect(header().string("X-RateLimit-Remaining", "1"));
    }

    @Test
    void keyWritesAreIgnoredWhenNetworked() throws Exception {
        mockMvc.perform(put("/settings/keys/claude_api_key")
                        .header("Authorization", bearer("u1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":\"sk-ant-123\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stored").value(false));
    }
}
