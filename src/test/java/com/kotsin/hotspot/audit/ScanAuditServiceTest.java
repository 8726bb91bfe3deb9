package com.kotsin.hotspot.audit;

import com.kotsin.hotspot.model.EventCategory;
import com.kotsin.hotspot.model.ScanResult;
import com.kotsin.hotspot.model.ScanStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScanAuditService")
class ScanAuditServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-30T12:00:00Z");

    @Mock
    private ScanAuditRepository repository;

    private ScanAuditService service;

    @BeforeEach
    void setUp() {
        service = new ScanAuditService(repository);
    }

    @Test
    @DisplayName("Successful scan is recorded with its stats")
    void testRecordSuccess() {
        ScanResult result = ScanResult.builder()
                .category(EventCategory.FIRE)
                .regionKey("cordoba")
                .scannedAt(NOW)
                .stats(ScanStats.builder().pointsReceived(12).clusters(2).created(1).matched(1).notifications(1).build())
                .build();

        service.recordSuccess(result, 3);

        ArgumentCaptor<ScanAuditRecord> captor = ArgumentCaptor.forClass(ScanAuditRecord.class);
        verify(repository).save(captor.capture());
        ScanAuditRecord record = captor.getValue();
        assertEquals("fire:cordoba", record.getStoreKey());
        assertEquals(ScanAuditRecord.STATUS_OK, record.getStatus());
        assertEquals(NOW, record.getScannedAt());
        assertEquals(12, record.getPointsReceived());
        assertEquals(2, record.getClusters());
        assertEquals(3, record.getEventCount());
    }

    @Test
    @DisplayName("Failed scan is recorded with the error message")
    void testRecordFailure() {
        service.recordFailure(EventCategory.FLOOD, "delta", NOW, new IllegalStateException("redis down"));

        ArgumentCaptor<ScanAuditRecord> captor = ArgumentCaptor.forClass(ScanAuditRecord.class);
        verify(repository).save(captor.capture());
        assertEquals("flood:delta", captor.getValue().getStoreKey());
        assertEquals(ScanAuditRecord.STATUS_FAILED, captor.getValue().getStatus());
        assertEquals("redis down", captor.getValue().getError());
    }

    @Test
    @DisplayName("Mongo failures never propagate")
    void testRecord_RepositoryFailure() {
        when(repository.save(any())).thenThrow(new DataAccessResourceFailureException("mongo down"));
        when(repository.findByStoreKeyOrderByScannedAtDesc(any(), any()))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        assertDoesNotThrow(() -> service.recordFailure(EventCategory.FIRE, "cordoba", NOW, new RuntimeException("x")));
        assertTrue(service.recent(EventCategory.FIRE, "cordoba", 10).isEmpty());
    }

    @Test
    @DisplayName("Disabled audit writes nothing")
    void testRecord_Disabled() {
        ReflectionTestUtils.setField(service, "auditEnabled", false);

        service.recordFailure(EventCategory.FIRE, "cordoba", NOW, new RuntimeException("x"));

        verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("Recent records are paged newest first")
    void testRecent() {
        ScanAuditRecord record = ScanAuditRecord.builder().storeKey("fire:cordoba").build();
        when(repository.findByStoreKeyOrderByScannedAtDesc("fire:cordoba", PageRequest.of(0, 5)))
                .thenReturn(List.of(record));

        assertEquals(List.of(record), service.recent(EventCategory.FIRE, "cordoba", 5));
    }
}
