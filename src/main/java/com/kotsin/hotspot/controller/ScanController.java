package com.kotsin.hotspot.controller;

import com.kotsin.hotspot.audit.ScanAuditRecord;
import com.kotsin.hotspot.audit.ScanAuditService;
import com.kotsin.hotspot.model.ScanRequest;
import com.kotsin.hotspot.model.ScanResult;
import com.kotsin.hotspot.service.ScanService;
import com.kotsin.hotspot.util.ValidationUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Scan entry points.
 *
 * POST /api/v1/scans/{category}/{regionKey}          - run one scan over the posted detections
 * POST /api/v1/scans/{category}/{regionKey}/refresh  - merge an empty batch
 * GET  /api/v1/scans/{category}/{regionKey}/audit    - recent scan audit records
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/scans")
@RequiredArgsConstructor
public class ScanController {

    private final ScanService scanService;
    private final ScanAuditService auditService;

    @PostMapping("/{category}/{regionKey}")
    public ResponseEntity<ScanResult> scan(@PathVariable String category,
                                           @PathVariable String regionKey,
                                           @RequestBody(required = false) ScanRequest request) {
        return ResponseEntity.ok(scanService.scan(category, regionKey, request));
    }

    @PostMapping("/{category}/{regionKey}/refresh")
    public ResponseEntity<ScanResult> refresh(@PathVariable String category,
                                              @PathVariable String regionKey,
                                              @RequestParam(required = false) String regionLabel) {
        log.info("[SCAN] Refresh requested for {}:{}", category, regionKey);
        return ResponseEntity.ok(scanService.refresh(category, regionKey, regionLabel));
    }

    @GetMapping("/{category}/{regionKey}/audit")
    public ResponseEntity<List<ScanAuditRecord>> audit(@PathVariable String category,
                                                       @PathVariable String regionKey,
                                                       @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(auditService.recent(ValidationUtils.requireCategory(category), regionKey, limit));
    }
}
