package com.kotsin.hotspot.tracking;

import com.kotsin.hotspot.model.AlertNotification;
import com.kotsin.hotspot.model.EventStatus;
import com.kotsin.hotspot.model.EventTrend;
import com.kotsin.hotspot.model.NotificationReason;
import com.kotsin.hotspot.model.Severity;
import com.kotsin.hotspot.model.TrackedEvent;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * NotificationPolicy - Decides whether a change to an existing event deserves an alert.
 *
 * Fires only on change, never on creation. Reasons in priority order:
 * 1. severity rank increased
 * 2. status became ESCALATING
 * 3. trend became RISING
 */
public class NotificationPolicy {

    private final String title;
    private final String url;

    public NotificationPolicy(String title, String url) {
        this.title = title;
        this.url = url;
    }

    public Optional<NotificationReason> evaluate(TrackedEvent previous, TrackedEvent next) {
        if (previous == null || next == null) {
            return Optional.empty();
        }

        if (Severity.rankOf(next.getSeverity()) > Severity.rankOf(previous.getSeverity())) {
            return Optional.of(NotificationReason.SEVERITY);
        }
        if (next.getStatus() == EventStatus.ESCALATING
                && !Objects.equals(previous.getStatus(), next.getStatus())) {
            return Optional.of(NotificationReason.STATUS);
        }
        if (next.getTrend() == EventTrend.RISING
                && !Objects.equals(previous.getTrend(), next.getTrend())) {
            return Optional.of(NotificationReason.TREND);
        }
        return Optional.empty();
    }

    /**
     * Evaluate and, when a reason applies, build the alert for it.
     */
    public Optional<AlertNotification> notificationFor(TrackedEvent previous, TrackedEvent next,
                                                       String regionKey, Instant now) {
        return evaluate(previous, next).map(reason -> build(reason, next, regionKey, now));
    }

    public AlertNotification build(NotificationReason reason, TrackedEvent event, String regionKey, Instant now) {
        return AlertNotification.builder()
                .title(title)
                .body(bodyFor(reason, event))
                .eventId(event.getId())
                .url(url)
                .reason(reason)
                .category(event.getCategory())
                .regionKey(regionKey)
                .createdAt(now)
                .build();
    }

    String bodyFor(NotificationReason reason, TrackedEvent event) {
        String location = event.getLocation() != null ? event.getLocation() : "Unknown location";
        return switch (reason) {
            case SEVERITY -> location + ": severity increased to "
                    + event.getSeverity().getWireValue().toUpperCase(Locale.ROOT);
            case STATUS -> location + ": event is now ESCALATING";
            case TREND -> location + ": " + activityNoun(event) + " activity is rising";
        };
    }

    private String activityNoun(TrackedEvent event) {
        return event.getCategory() == null ? "event" : event.getCategory().getLabel().toLowerCase(Locale.ROOT);
    }
}
