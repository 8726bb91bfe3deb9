package com.kotsin.hotspot.cluster;

import com.kotsin.hotspot.model.DetectionPoint;
import com.kotsin.hotspot.model.Severity;

import java.util.Collection;

import static com.kotsin.hotspot.config.ProcessingConstants.*;

/**
 * SeverityClassifier - Maps cluster radiative-power statistics and member
 * confidence to a severity tier.
 *
 * Ordered rule, first match wins (the clauses overlap):
 * <pre>
 *   CRITICAL  any member confidence "high" | frpMax ≥ 50 | frpSum ≥ 200
 *   HIGH      frpMax ≥ 20 | frpSum ≥ 80
 *   MODERATE  frpMax ≥ 5  | frpSum ≥ 20
 *   LOW       otherwise
 * </pre>
 * A coarse monotone heuristic, not calibrated against ground truth.
 */
public class SeverityClassifier {

    /**
     * Classify a group of detections. Absent FRP counts as 0.
     */
    public Assessment classify(Collection<DetectionPoint> members) {
        double frpMax = 0.0;
        double frpSum = 0.0;
        boolean highConfidence = false;

        if (members != null) {
            for (DetectionPoint member : members) {
                double frp = member.frpOrZero();
                frpMax = Math.max(frpMax, frp);
                frpSum += frp;
                highConfidence |= isHighConfidence(member.getConfidence());
            }
        }

        return new Assessment(classify(frpMax, frpSum, highConfidence), frpMax, frpSum);
    }

    public Severity classify(double frpMax, double frpSum, boolean highConfidence) {
        if (highConfidence || frpMax >= CRITICAL_FRP_MAX || frpSum >= CRITICAL_FRP_SUM) {
            return Severity.CRITICAL;
        }
        if (frpMax >= HIGH_FRP_MAX || frpSum >= HIGH_FRP_SUM) {
            return Severity.HIGH;
        }
        if (frpMax >= MODERATE_FRP_MAX || frpSum >= MODERATE_FRP_SUM) {
            return Severity.MODERATE;
        }
        return Severity.LOW;
    }

    /**
     * "high" in full or the sensor short form "h", case-insensitive.
     */
    public static boolean isHighConfidence(String confidence) {
        if (confidence == null) {
            return false;
        }
        String normalized = confidence.trim();
        return normalized.equalsIgnoreCase("high") || normalized.equalsIgnoreCase("h");
    }

    /**
     * Severity together with the FRP statistics it was derived from.
     */
    public record Assessment(Severity severity, double frpMax, double frpSum) {
    }
}
