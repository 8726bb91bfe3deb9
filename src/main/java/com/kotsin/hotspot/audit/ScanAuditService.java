package com.kotsin.hotspot.audit;

import com.kotsin.hotspot.model.EventCategory;
import com.kotsin.hotspot.model.ScanResult;
import com.kotsin.hotspot.model.ScanStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Scan audit trail in MongoDB.
 *
 * Audit writes are best effort: a Mongo failure is logged and never
 * propagates into the scan that triggered it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScanAuditService {

    private final ScanAuditRepository repository;

    @Value("${features.audit-logging.enabled:true}")
    private boolean auditEnabled = true;

    public void recordSuccess(ScanResult result, int eventCount) {
        ScanStats stats = result.getStats() == null ? new ScanStats() : result.getStats();
        ScanAuditRecord record = ScanAuditRecord.builder()
                .storeKey(storeKey(result.getCategory(), result.getRegionKey()))
                .category(result.getCategory().getWireValue())
                .regionKey(result.getRegionKey())
                .scannedAt(result.getScannedAt())
                .status(ScanAuditRecord.STATUS_OK)
                .pointsReceived(stats.getPointsReceived())
                .pointsDropped(stats.getPointsDropped())
                .clusters(stats.getClusters())
                .created(stats.getCreated())
                .matched(stats.getMatched())
                .duplicates(stats.getDuplicates())
                .stale(stats.getStale())
                .evicted(stats.getEvicted())
                .notifications(stats.getNotifications())
                .eventCount(eventCount)
                .durationMs(stats.getDurationMs())
                .build();
        save(record);
    }

    public void recordFailure(EventCategory category, String regionKey, Instant scannedAt, Throwable error) {
        ScanAuditRecord record = ScanAuditRecord.builder()
                .storeKey(storeKey(category, regionKey))
                .category(category.getWireValue())
                .regionKey(regionKey)
                .scannedAt(scannedAt)
                .status(ScanAuditRecord.STATUS_FAILED)
                .error(error.getMessage())
                .build();
        save(record);
    }

    public List<ScanAuditRecord> recent(EventCategory category, String regionKey, int limit) {
        try {
            return repository.findByStoreKeyOrderByScannedAtDesc(
                    storeKey(category, regionKey), PageRequest.of(0, Math.max(1, limit)));
        } catch (RuntimeException e) {
            log.warn("[AUDIT] Failed to read audit trail for {}:{}: {}", category.getWireValue(), regionKey, e.getMessage());
            return Collections.emptyList();
        }
    }

    private void save(ScanAuditRecord record) {
        if (!auditEnabled) {
            return;
        }
        try {
            repository.save(record);
            log.debug("[AUDIT] {} {} at {}", record.getStatus(), record.getStoreKey(), record.getScannedAt());
        } catch (RuntimeException e) {
            log.warn("[AUDIT] Failed to write audit record for {}: {}", record.getStoreKey(), e.getMessage());
        }
    }

    static String storeKey(EventCategory category, String regionKey) {
        return category.getWireValue() + ":" + regionKey;
    }
}
