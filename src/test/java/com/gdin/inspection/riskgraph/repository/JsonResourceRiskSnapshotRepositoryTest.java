package com.gdin.inspection.riskgraph.repository;

import com.gdin.inspection.riskgraph.models.Equipment;
import com.gdin.inspection.riskgraph.models.Fact;
import com.gdin.inspection.riskgraph.models.RiskSnapshot;
import com.gdin.inspection.riskgraph.models.Threshold;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JsonResourceRiskSnapshotRepositoryTest {

    private final JsonResourceRiskSnapshotRepository repository = new JsonResourceRiskSnapshotRepository(
            new DefaultResourceLoader(),
            "classpath:seed/facts.json",
            "classpath:seed/thresholds.json",
            "classpath:seed/equipment.json"
    );

    @Test
    void loadsSeedSnapshot() {
        RiskSnapshot snapshot = repository.loadSnapshot();

        assertEquals(16, snapshot.getFacts().size());
        assertEquals(9, snapshot.getThresholds().size());
        assertEquals(5, snapshot.getEquipment().size());
    }

    @Test
    void factFieldsAreMapped() {
        Fact temp = repository.loadFacts().stream()
                .filter(f -> "ENG-34".equals(f.getSubjectId()) && "engine_oil_temp_c".equals(f.getMetric()))
                .findFirst().orElseThrow();

        assertEquals(129.0, temp.getValue());
        assertEquals("PAD-C", temp.getLocationId());
        assertEquals(Instant.parse("2025-09-12T12:30:00Z"), temp.getTimestamp());
        assertNull(temp.getSeverity());
    }

    @Test
    void thresholdAndEquipmentFieldsAreMapped() {
        Threshold pressure = repository.loadThresholds().stream()
                .filter(t -> "engine_oil_pressure_psi".equals(t.getMetric()))
                .findFirst().orElseThrow();
        assertEquals("engine", pressure.getScopeEquipmentType());
        assertEquals(25.0, pressure.getAlarmLow());
        assertTrue(pressure.isActive());

        Equipment fluidEnd = repository.loadEquipment().stream()
                .filter(e -> "FLUEND-12".equals(e.getEquipmentId()))
                .findFirst().orElseThrow();
        assertEquals("fluid_end", fluidEnd.getEquipmentType());
    }

    @Test
    void missingOrBlankLocationGivesEmptyList() {
        JsonResourceRiskSnapshotRepository empty = new JsonResourceRiskSnapshotRepository(
                new DefaultResourceLoader(), "classpath:seed/none.json", "", null);

        assertEquals(List.of(), empty.loadFacts());
        assertEquals(List.of(), empty.loadThresholds());
        assertEquals(List.of(), empty.loadEquipment());
    }
}
