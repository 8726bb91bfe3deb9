package com.kotsin.hotspot.cluster;

import com.kotsin.hotspot.model.DetectionPoint;
import com.kotsin.hotspot.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SeverityClassifier - ordered FRP rule")
class SeverityClassifierTest {

    private SeverityClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new SeverityClassifier();
    }

    @ParameterizedTest(name = "max={0} sum={1} → {2}")
    @CsvSource({
            "50.0, 50.0, CRITICAL",
            "10.0, 200.0, CRITICAL",
            "49.9, 199.9, HIGH",
            "20.0, 20.0, HIGH",
            "1.0, 80.0, HIGH",
            "19.9, 79.9, MODERATE",
            "5.0, 5.0, MODERATE",
            "1.0, 20.0, MODERATE",
            "4.9, 19.9, LOW",
            "0.0, 0.0, LOW"
    })
    @DisplayName("Thresholds are inclusive and checked in order")
    void testClassify_Thresholds(double frpMax, double frpSum, Severity expected) {
        assertEquals(expected, classifier.classify(frpMax, frpSum, false));
    }

    @Test
    @DisplayName("A single high-confidence member makes the cluster critical")
    void testClassify_HighConfidence() {
        List<DetectionPoint> members = List.of(
                point(1.0, "nominal"),
                point(0.5, "high"));

        SeverityClassifier.Assessment assessment = classifier.classify(members);

        assertEquals(Severity.CRITICAL, assessment.severity());
        assertEquals(1.0, assessment.frpMax(), 1e-9);
        assertEquals(1.5, assessment.frpSum(), 1e-9);
    }

    @Test
    @DisplayName("Short-form and mixed-case confidence tags count as high")
    void testIsHighConfidence() {
        assertTrue(SeverityClassifier.isHighConfidence("h"));
        assertTrue(SeverityClassifier.isHighConfidence("HIGH"));
        assertTrue(SeverityClassifier.isHighConfidence(" High "));
        assertFalse(SeverityClassifier.isHighConfidence("nominal"));
        assertFalse(SeverityClassifier.isHighConfidence("l"));
        assertFalse(SeverityClassifier.isHighConfidence(null));
    }

    @Test
    @DisplayName("Absent FRP counts as zero")
    void testClassify_AbsentFrp() {
        SeverityClassifier.Assessment assessment = classifier.classify(List.of(point(null, "low"), point(6.0, "low")));
        assertEquals(Severity.MODERATE, assessment.severity());
        assertEquals(6.0, assessment.frpSum(), 1e-9);
    }

    private static DetectionPoint point(Double frp, String confidence) {
        return DetectionPoint.builder().latitude(0.0).longitude(0.0).frp(frp).confidence(confidence).build();
    }
}
