package com.kotsin.hotspot.tracking;

import com.kotsin.hotspot.model.AlertNotification;
import com.kotsin.hotspot.model.EventCategory;
import com.kotsin.hotspot.model.EventStatus;
import com.kotsin.hotspot.model.EventTrend;
import com.kotsin.hotspot.model.NotificationReason;
import com.kotsin.hotspot.model.Severity;
import com.kotsin.hotspot.model.TrackedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NotificationPolicy - alerts on change")
class NotificationPolicyTest {

    private static final Instant NOW = Instant.parse("2026-01-30T12:00:00Z");

    private NotificationPolicy policy;
    private TrackedEvent base;

    @BeforeEach
    void setUp() {
        policy = new NotificationPolicy("Hotspot Alert", "/");
        base = TrackedEvent.builder()
                .id("fire_abc_123456")
                .category(EventCategory.FIRE)
                .location("Sierras Chicas")
                .severity(Severity.MODERATE)
                .status(EventStatus.ACTIVE)
                .trend(EventTrend.STABLE)
                .build();
    }

    @Test
    @DisplayName("Creation never notifies")
    void testEvaluate_NoPrevious() {
        assertTrue(policy.evaluate(null, base).isEmpty());
    }

    @Test
    @DisplayName("Unchanged event does not notify")
    void testEvaluate_NoChange() {
        assertTrue(policy.evaluate(base, base.toBuilder().build()).isEmpty());
    }

    @Test
    @DisplayName("Severity increase wins over status and trend changes")
    void testEvaluate_SeverityFirst() {
        TrackedEvent next = base.toBuilder()
                .severity(Severity.CRITICAL)
                .status(EventStatus.ESCALATING)
                .trend(EventTrend.RISING)
                .build();

        assertEquals(NotificationReason.SEVERITY, policy.evaluate(base, next).orElseThrow());
    }

    @Test
    @DisplayName("Severity decrease does not notify")
    void testEvaluate_SeverityDecrease() {
        TrackedEvent prev = base.toBuilder().severity(Severity.HIGH).build();
        assertTrue(policy.evaluate(prev, base).isEmpty());
    }

    @Test
    @DisplayName("Becoming escalating notifies with reason status")
    void testEvaluate_Status() {
        TrackedEvent next = base.toBuilder().status(EventStatus.ESCALATING).trend(EventTrend.RISING).build();
        assertEquals(NotificationReason.STATUS, policy.evaluate(base, next).orElseThrow());
    }

    @Test
    @DisplayName("Staying escalating does not notify again")
    void testEvaluate_StillEscalating() {
        TrackedEvent prev = base.toBuilder().status(EventStatus.ESCALATING).build();
        assertTrue(policy.evaluate(prev, prev.toBuilder().build()).isEmpty());
    }

    @Test
    @DisplayName("Turning rising notifies with reason trend")
    void testEvaluate_Trend() {
        TrackedEvent next = base.toBuilder().trend(EventTrend.RISING).build();
        assertEquals(NotificationReason.TREND, policy.evaluate(base, next).orElseThrow());
    }

    @Test
    @DisplayName("Notification carries title, body, event id and url")
    void testNotificationFor_Payload() {
        TrackedEvent next = base.toBuilder().severity(Severity.CRITICAL).build();

        AlertNotification notification = policy.notificationFor(base, next, "cordoba", NOW).orElseThrow();

        assertEquals("Hotspot Alert", notification.getTitle());
        assertEquals("Sierras Chicas: severity increased to CRITICAL", notification.getBody());
        assertEquals("fire_abc_123456", notification.getEventId());
        assertEquals("/", notification.getUrl());
        assertEquals(NotificationReason.SEVERITY, notification.getReason());
        assertEquals(EventCategory.FIRE, notification.getCategory());
        assertEquals("cordoba", notification.getRegionKey());
        assertEquals(NOW, notification.getCreatedAt());
    }

    @Test
    @DisplayName("Bodies name the change")
    void testBodies() {
        assertEquals("Sierras Chicas: event is now ESCALATING", policy.bodyFor(NotificationReason.STATUS, base));
        assertEquals("Sierras Chicas: fire activity is rising", policy.bodyFor(NotificationReason.TREND, base));
        assertEquals("Unknown location: event is now ESCALATING",
                policy.bodyFor(NotificationReason.STATUS, base.toBuilder().location(null).build()));
    }
}
