package com.gdin.inspection.riskgraph.index.severity;

import com.gdin.inspection.riskgraph.exception.InvalidMetricValueException;
import com.gdin.inspection.riskgraph.models.Severity;
import com.gdin.inspection.riskgraph.models.Threshold;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SeverityClassifierTest {

    private final SeverityClassifier classifier = new SeverityClassifier();

    private final Threshold oilTemp = Threshold.builder()
            .metric("engine_oil_temp_c").scopeEquipmentType("engine").unit("°C")
            .warnHigh(110.0).alarmHigh(120.0)
            .build();

    private final Threshold oilPressure = Threshold.builder()
            .metric("engine_oil_pressure_psi").scopeEquipmentType("engine").unit("psi")
            .warnLow(30.0).alarmLow(25.0).warnHigh(90.0).alarmHigh(100.0)
            .build();

    @Test
    void highSide() {
        assertEquals(Severity.HIGH, classifier.classify(oilTemp, 129.0));
        assertEquals(Severity.HIGH, classifier.classify(oilTemp, 115.0));
        assertEquals(Severity.HIGH, classifier.classify(oilTemp, 110.0));
        assertEquals(Severity.MED, classifier.classify(oilTemp, 95.0));
    }

    @Test
    void lowSide() {
        assertEquals(Severity.LOW, classifier.classify(oilPressure, 20.0));
        assertEquals(Severity.LOW, classifier.classify(oilPressure, 28.0));
        assertEquals(Severity.LOW, classifier.classify(oilPressure, 30.0));
        assertEquals(Severity.MED, classifier.classify(oilPressure, 62.0));
        assertEquals(Severity.HIGH, classifier.classify(oilPressure, 101.0));
    }

    @Test
    void emptyThresholdIsAlwaysInRange() {
        Threshold bare = Threshold.builder().metric("engine_load_pct").build();
        assertEquals(Severity.MED, classifier.classify(bare, 1_000.0));
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(InvalidMetricValueException.class, () -> classifier.classify(oilTemp, Double.NaN));
        assertThrows(InvalidMetricValueException.class, () -> classifier.classify(oilTemp, Double.POSITIVE_INFINITY));
        assertThrows(InvalidMetricValueException.class, () -> classifier.classify(oilTemp, null));
    }

    @Test
    void breach() {
        assertTrue(SeverityClassifier.isBreach(Severity.HIGH));
        assertTrue(SeverityClassifier.isBreach(Severity.LOW));
        assertFalse(SeverityClassifier.isBreach(Severity.MED));
        assertFalse(SeverityClassifier.isBreach(null));
    }
}
