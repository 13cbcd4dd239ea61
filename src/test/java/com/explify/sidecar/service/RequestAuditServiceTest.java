package com.explify.sidecar.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.explify.sidecar.config.ModeConfig;
import com.explify.sidecar.model.RequestAuditRecord;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.mongodb.core.MongoTemplate;

class RequestAuditServiceTest {

    @Test
    void persistsRecordThroughAuditWriter() {
        MongoTemplate mongoTemplate = mock(MongoTemplate.class);
        AuditWriter auditWriter = mock(AuditWriter.class);
        RequestAuditService service = new RequestAuditService(mongoTemplate, auditWriter, ModeConfig.networked());

        service.recordRequestAudit("u1", "GET", "/history", 200, 12.34);

        ArgumentCaptor<Runnable> write = ArgumentCaptor.forClass(Runnable.class);
        verify(auditWriter).submit(eq("request_audit"), write.capture());
        verifyNoInteractions(mongoTemplate);
        write.getValue().run();
        ArgumentCaptor<RequestAuditRecord> record = ArgumentCaptor.forClass(RequestAuditRecord.class);
        verify(mongoTemplate).insert(record.capture());
        assertEquals("u1", record.getValue().getUserId());
        assertEquals("GET", record.getValue().getMethod());
        assertEquals("/history", record.getValue().getPath());
        assertEquals(200, record.getValue().getStatusCode());
        assertEquals(12.34, record.getValue().getDurationMs(), 0.001);
    }

    @Test
    void requestIdIsStoredWithTheRecord() {
        MongoTemplate mongoTemplate = mock(MongoTemplate.class);
        AuditWriter auditWriter = mock(AuditWriter.class);
        doAnswer(invocation -> {
            invocation.<Runnable>getArgument(1).run();
            return null;
        }).when(auditWriter).submit(anyString(), any(Runnable.class));
        RequestAuditService service = new RequestAuditService(mongoTemplate, auditWriter, ModeConfig.networked());

        service.recordRequestAudit("u1", "GET", "/history", 200, 4.0, "desktop-7f3a.1");

        ArgumentCaptor<RequestAuditRecord> record = ArgumentCaptor.forClass(RequestAuditRecord.class);
        verify(mongoTemplate).insert(record.capture());
        assertEquals("desktop-7f3a.1", record.getValue().getRequestId());
    }

    @Test
    void missingIdentityIsRecordedAsAnonymous() {
        MongoTemplate mongoTemplate = mock(MongoTemplate.class);
        AuditWriter auditWriter = mock(AuditWriter.class);
        doAnswer(invocation -> {
            invocation.<Runnable>getArgument(1).run();
            return null;
        }).when(auditWriter).submit(anyString(), any(Runnable.class));
        RequestAuditService service = new RequestAuditService(mongoTemplate, auditWriter, ModeConfig.networked());

        service.recordRequestAudit(null, "GET", "/health", 200, 1.0);

        ArgumentCaptor<RequestAuditRecord> record = ArgumentCaptor.forClass(RequestAuditRecord.class);
        verify(mongoTemplate).insert(record.capture());
        assertEquals(RequestAuditRecord.ANONYMOUS, record.getValue().getUserId());
    }

    @Test
    void localModeRecordsNothing() {
        MongoTemplate mongoTemplate = mock(MongoTemplate.class);
        AuditWriter auditWriter = mock(AuditWriter.class);
        RequestAuditService service = new RequestAuditService(mongoTemplate, auditWriter, ModeConfig.local());

        service.recordRequestAudit("local-user", "GET", "/history", 200, 1.0);

        verifyNoInteractions(mongoTemplate, auditWriter);
    }

    @Test
    void writerFailureNeverReachesCaller() {
        MongoTemplate mongoTemplate = mock(MongoTemplate.class);
        AuditWriter auditWriter = mock(AuditWriter.class);
        doThrow(new IllegalStateException("boom")).when(auditWriter).submit(anyString(), any(Runnable.class));
        RequestAuditService service = new RequestAuditService(mongoTemplate, auditWriter, ModeConfig.networked());

        assertDoesNotThrow(() -> service.recordRequestAudit("u1", "POST", "/analyze/report", 500, 3.0));
    }
}
