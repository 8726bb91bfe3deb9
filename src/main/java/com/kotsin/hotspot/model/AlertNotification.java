package com.kotsin.hotspot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * AlertNotification - A triggered alert. Delivery (toast, push) is the caller's job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertNotification {

    private String title;
    private String body;
    private String eventId;
    private String url;

    private NotificationReason reason;
    private EventCategory category;
    private String regionKey;
    private Instant createdAt;
}
