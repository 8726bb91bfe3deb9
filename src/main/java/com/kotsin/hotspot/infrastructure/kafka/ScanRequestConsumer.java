package com.kotsin.hotspot.infrastructure.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.hotspot.config.KafkaTopics;
import com.kotsin.hotspot.model.ScanRequest;
import com.kotsin.hotspot.model.ScanResult;
import com.kotsin.hotspot.service.ScanService;
import com.kotsin.hotspot.store.StorePersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Consumes ScanRequest JSON from hotspot-scan-requests.
 *
 * Bad payloads and invalid requests are logged and skipped so one poisoned
 * record never stalls the partition.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "kafka.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ScanRequestConsumer {

    private final ScanService scanService;
    private final ObjectMapper objectMapper;

    @KafkaListener(
            topics = KafkaTopics.SCAN_REQUESTS,
            groupId = "${kafka.consumer.group-id:hotspot-tracker}",
            containerFactory = "commonKafkaListenerContainerFactory"
    )
    public void onScanRequest(String payload) {
        ScanRequest request;
        try {
            request = objectMapper.readValue(payload, ScanRequest.class);
        } catch (Exception e) {
            log.error("[SCAN] Unparseable scan request skipped: {}", e.getMessage());
            return;
        }
        if (request == null) {
            log.warn("[SCAN] Empty scan request skipped");
            return;
        }

        try {
            ScanResult result = scanService.scan(request.getCategory(), request.getRegionKey(), request);
            log.debug("[SCAN] Kafka scan {}:{} → {} events",
                    request.getCategory(), request.getRegionKey(), result.getEvents().size());
        } catch (IllegalArgumentException e) {
            log.warn("[SCAN] Invalid scan request skipped: {}", e.getMessage());
        } catch (StorePersistenceException e) {
            log.error("[SCAN] Scan {}:{} not persisted: {}",
                    request.getCategory(), request.getRegionKey(), e.getMessage());
        }
    }
}
