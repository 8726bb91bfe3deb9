package com.kotsin.hotspot.tracking;

import com.kotsin.hotspot.model.EventCategory;
import com.kotsin.hotspot.model.EventInsight;
import com.kotsin.hotspot.model.EventStatus;
import com.kotsin.hotspot.model.Severity;
import com.kotsin.hotspot.model.TrackedEvent;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * EventPresenter - Fills the human-facing fields of a merged event: title,
 * narrative description, risk indicators, a viewer link and a short outlook.
 *
 * Derived fresh every scan from the event's metrics, status and staleness.
 */
public class EventPresenter {

    static final String FIRMS_VIEWER = "https://firms.modaps.eosdis.nasa.gov/map/";
    static final String STALE_INDICATOR = "No recent detections (possible containment)";

    public TrackedEvent present(TrackedEvent event, Instant now) {
        int focusCount = event.getFocusCount() == null ? 0 : event.getFocusCount();
        double frpMax = event.getFrpMax() == null ? 0.0 : event.getFrpMax();
        double frpSum = event.getFrpSum() == null ? 0.0 : event.getFrpSum();
        String noun = categoryNoun(event.getCategory());

        String narrative = String.format(Locale.ROOT,
                "Satellite sensors detected %d %s %s near %s. Radiative power suggests %s intensity.",
                focusCount, noun, focusCount > 1 ? "signals" : "signal", event.getLocation(),
                isSevere(event.getSeverity()) ? "high" : "moderate");

        return event.toBuilder()
                .title(titleFor(event.getCategory(), focusCount))
                .description(String.format(Locale.ROOT, "%s FRP max %.2f • FRP sum %.2f.", narrative, frpMax, frpSum))
                .riskIndicators(riskIndicators(event, frpMax, now))
                .liveFeedUrl(event.getCategory() == EventCategory.FIRE ? viewerUrl(event, now) : event.getLiveFeedUrl())
                .insight(insightFor(event.getStatus(), event.getSeverity()))
                .build();
    }

    String titleFor(EventCategory category, int focusCount) {
        String label = category == null ? "Event" : category.getLabel();
        return focusCount > 1
                ? String.format(Locale.ROOT, "Active %s Cluster (%d detections)", label, focusCount)
                : "Active " + label;
    }

    List<String> riskIndicators(TrackedEvent event, double frpMax, Instant now) {
        List<String> indicators = new ArrayList<>();
        Severity severity = event.getSeverity() == null ? Severity.LOW : event.getSeverity();
        switch (severity) {
            case CRITICAL -> indicators.add("Rapid spread potential");
            case HIGH -> indicators.add("High intensity signal");
            case MODERATE -> indicators.add("Moderate intensity");
            default -> indicators.add("Low intensity / monitoring");
        }
        indicators.add("Satellite detection");
        indicators.add(String.format(Locale.ROOT, "FRP max %.1f", frpMax));

        String age = ageLabel(event.getLastDetectedAt(), now);
        if (age != null) {
            indicators.add(age);
        }
        if (event.isStale()) {
            indicators.add(STALE_INDICATOR);
        }
        return indicators;
    }

    /**
     * "Last detection: ..." label, or null when the detection time is unknown or in the future.
     */
    public static String ageLabel(Instant lastDetection, Instant now) {
        if (lastDetection == null) {
            return null;
        }
        double ageH = LifecycleStateMachine.ageHours(lastDetection, now);
        if (!Double.isFinite(ageH) || ageH < 0) {
            return null;
        }
        if (ageH < 1) {
            return "Last detection: < 1h";
        }
        if (ageH < 24) {
            return "Last detection: " + Math.round(ageH) + "h ago";
        }
        double days = ageH / 24;
        if (days < 7) {
            return String.format(Locale.ROOT, "Last detection: %.1fd ago", days);
        }
        return "Last detection: " + Math.round(days) + "d ago";
    }

    String viewerUrl(TrackedEvent event, Instant now) {
        Instant reference = event.getLastDetectedAt() != null ? event.getLastDetectedAt() : now;
        LocalDate day = LocalDate.ofInstant(reference, ZoneOffset.UTC);
        return String.format(Locale.ROOT, "%s#t:adv;d:%s;@%.4f,%.4f,7z",
                FIRMS_VIEWER, day, event.getLongitude(), event.getLatitude());
    }

    EventInsight insightFor(EventStatus status, Severity severity) {
        if (status == EventStatus.RESOLVED) {
            return EventInsight.builder()
                    .probabilityNext12h(8)
                    .narrative("No recent satellite detections for this cluster. This may suggest containment, "
                            + "but ground confirmation is recommended.")
                    .recommendations(List.of("Confirm containment with local sources",
                            "Continue periodic monitoring", "Review nearby risk areas"))
                    .build();
        }

        int probability = switch (severity == null ? Severity.LOW : severity) {
            case CRITICAL -> 78;
            case HIGH -> 62;
            case MODERATE -> 48;
            case LOW -> 35;
        };

        if (isSevere(severity)) {
            return EventInsight.builder()
                    .probabilityNext12h(probability)
                    .narrative("Meaningful probability of continued activity in the next 12 hours. "
                            + "Maintain vigilance and verify conditions on the ground where possible.")
                    .recommendations(List.of("Monitor wind/humidity shifts",
                            "Track nearby settlements", "Prepare response readiness"))
                    .build();
        }
        return EventInsight.builder()
                .probabilityNext12h(probability)
                .narrative("Monitoring continues for this signal. Verify with local sources if available.")
                .recommendations(List.of("Continue observation",
                        "Check for new detections", "Confirm local conditions"))
                .build();
    }

    private static boolean isSevere(Severity severity) {
        return severity != null && severity.isSevere();
    }

    private static String categoryNoun(EventCategory category) {
        return category == null ? "event" : category.getLabel().toLowerCase(Locale.ROOT);
    }
}
