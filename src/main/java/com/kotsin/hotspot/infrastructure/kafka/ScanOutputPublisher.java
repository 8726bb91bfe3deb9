package com.kotsin.hotspot.infrastructure.kafka;

import com.kotsin.hotspot.config.KafkaTopics;
import com.kotsin.hotspot.config.TrackingProperties;
import com.kotsin.hotspot.model.AlertNotification;
import com.kotsin.hotspot.model.ScanResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Publishes scan output to Kafka.
 *
 * - hotspot-notifications: one AlertNotification per record, keyed by eventId
 * - hotspot-events: the whole ScanResult, keyed by "{category}:{regionKey}"
 *
 * Sends are fire-and-forget. A broker failure is logged; the scan has
 * already been persisted and still succeeds.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScanOutputPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final TrackingProperties properties;

    public void publishNotifications(List<AlertNotification> notifications) {
        if (!properties.getPublish().isEnabled() || notifications == null) {
            return;
        }
        for (AlertNotification notification : notifications) {
            try {
                kafkaTemplate.send(KafkaTopics.NOTIFICATIONS, notification.getEventId(), notification);
                log.info("[NOTIFY] {} {} ({}) → {}", notification.getReason(), notification.getEventId(),
                        notification.getBody(), KafkaTopics.NOTIFICATIONS);
            } catch (Exception e) {
                log.error("[NOTIFY] Failed to publish notification for {}: {}",
                        notification.getEventId(), e.getMessage());
            }
        }
    }

    public void publishResult(ScanResult result) {
        if (!properties.getPublish().isEnabled() || result == null) {
            return;
        }
        String key = result.getCategory().getWireValue() + ":" + result.getRegionKey();
        try {
            kafkaTemplate.send(KafkaTopics.EVENTS, key, result);
            log.debug("[SCAN] Published {} events for {} → {}", result.getEvents().size(), key, KafkaTopics.EVENTS);
        } catch (Exception e) {
            log.error("[SCAN] Failed to publish event set for {}: {}", key, e.getMessage());
        }
    }
}
