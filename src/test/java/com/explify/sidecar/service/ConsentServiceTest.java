package com.explify.sidecar.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.explify.sidecar.config.ModeConfig;
import com.explify.sidecar.exception.UnauthenticatedException;
import com.explify.sidecar.model.BaaAcceptance;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

class ConsentServiceTest {

    private MongoTemplate mongoTemplate;
    private final List<BaaAcceptance> stored = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
        when(mongoTemplate.insert(any(BaaAcceptance.class))).thenAnswer(invocation -> {
            BaaAcceptance acceptance = invocation.getArgument(0);
            stored.add(acceptance);
            return acceptance;
        });
        when(mongoTemplate.exists(any(Query.class), eq(BaaAcceptance.class))).thenAnswer(invocation -> {
            Document criteria = invocation.<Query>getArgument(0).getQueryObject();
            return stored.stream().anyMatch(a -> a.getUserId().equals(criteria.get("userId"))
                    && a.getBaaVersion().equals(criteria.get("baaVersion")));
        });
    }

    @Test
    void acceptanceIsVisibleForSameVersionOnly() {
        ConsentService service = new ConsentService(mongoTemplate, ModeConfig.networked(), "1.0");

        assertFalse(service.status("u1", "1.0"));
        service.accept("u1", "1.0", "203.0.113.7", "Mozilla/5.0");

        assertTrue(service.status("u1", "1.0"));
        assertFalse(service.status("u1", "2.0"));
        assertFalse(service.status("u2", "1.0"));
    }

    @Test
    void reacceptanceAppendsNewRecord() {
        ConsentService service = new ConsentService(mongoTemplate, ModeConfig.networked(), "1.0");

        service.accept("u1", "1.0", "203.0.113.7", "ua-1");
        service.accept("u1", "1.0", "198.51.100.1", "ua-2");

        assertEquals(2, stored.size());
        assertEquals("203.0.113.7", stored.get(0).getIpAddress());
        assertEquals("ua-2", stored.get(1).getUserAgent());
        assertNotNull(stored.get(1).getAcceptedAt());
    }

    @Test
    void identityIsRequired() {
        ConsentService service = new ConsentService(mongoTemplate, ModeConfig.networked(), "1.0");

        assertThrows(UnauthenticatedException.class, () -> service.status(null, "1.0"));
        assertThrows(UnauthenticatedException.class, () -> service.accept("", "1.0", null, null));
        verifyNoInteractions(mongoTemplate);
    }

    @Test
    void localModeIsInert() {
        ConsentService service = new ConsentService(mongoTemplate, ModeConfig.local(), "1.0");

        service.accept("local-user", "1.0", "127.0.0.1", "desktop");

        assertFalse(service.status("local-user", "1.0"));
        verifyNoInteractions(mongoTemplate);
    }
}
