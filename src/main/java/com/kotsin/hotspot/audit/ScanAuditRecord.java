package com.kotsin.hotspot.audit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * ScanAuditRecord - One row per scan attempt.
 *
 * MongoDB collection: scan_audit
 * storeKey = "{category}:{regionKey}"
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "scan_audit")
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScanAuditRecord {

    public static final String STATUS_OK = "OK";
    public static final String STATUS_FAILED = "FAILED";

    @Id
    private String id;

    @Indexed
    private String storeKey;

    private String category;
    private String regionKey;
    private Instant scannedAt;

    /**
     * OK | FAILED
     */
    private String status;
    private String error;

    private int pointsReceived;
    private int pointsDropped;
    private int clusters;
    private int created;
    private int matched;
    private int duplicates;
    private int stale;
    private int evicted;
    private int notifications;
    private int eventCount;
    private long durationMs;
}
