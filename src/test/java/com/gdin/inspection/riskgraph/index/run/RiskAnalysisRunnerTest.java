package com.gdin.inspection.riskgraph.index.run;

import com.gdin.inspection.riskgraph.config.properties.RiskProperties;
import com.gdin.inspection.riskgraph.exception.MalformedFactException;
import com.gdin.inspection.riskgraph.index.pipeline.PipelineFactory;
import com.gdin.inspection.riskgraph.index.pipeline.StandardPipelineRegistrar;
import com.gdin.inspection.riskgraph.models.Fact;
import com.gdin.inspection.riskgraph.models.LocationRiskFact;
import com.gdin.inspection.riskgraph.models.RiskNode;
import com.gdin.inspection.riskgraph.models.RiskReport;
import com.gdin.inspection.riskgraph.models.RiskSnapshot;
import com.gdin.inspection.riskgraph.models.Severity;
import com.gdin.inspection.riskgraph.repository.InMemoryRiskSnapshotRepository;
import com.gdin.inspection.riskgraph.repository.JsonResourceRiskSnapshotRepository;
import com.gdin.inspection.riskgraph.repository.RiskSnapshotRepository;
import com.gdin.inspection.riskgraph.util.IOUtil;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ResourceLoader;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
@SpringBootTest
public class RiskAnalysisRunnerTest {
    @Resource
    private RiskAnalysisRunner riskAnalysisRunner;

    @Resource
    private RiskSnapshotRepository seedSnapshotRepository;

    @Resource
    private ResourceLoader resourceLoader;

    @Resource
    private PipelineFactory<RiskProperties> factory;

    @Test
    void standardPipelineIsRegistered() {
        assertEquals(
                List.of("annotate_severity", "build_graph", "graph_signals", "aggregate_report"),
                factory.createPipeline(StandardPipelineRegistrar.STANDARD_PIPELINE).stepNames()
        );
    }

    @Test
    void seedSnapshotProducesFullReport() throws Exception {
        RiskReport report = riskAnalysisRunner.run(seedSnapshotRepository);
        log.info("report: {}", IOUtil.jsonSerialize(report, true));

        assertFalse(report.getTopRiskNodes().isEmpty());
        assertEquals(Severity.HIGH, report.getTopRiskNodes().get(0).getSeverity());
        assertFalse(report.getTopSimilarPairs().isEmpty());
        assertEquals(List.of("PAD-A", "PAD-B", "PAD-C"), new ArrayList<>(report.getLocationRiskGroups().keySet()));

        // ENG-34 oil temp 129 越上界：HIGH 读数 + 派生的 exceeded_limits
        List<LocationRiskFact> padC = report.getLocationRiskGroups().get("PAD-C");
        assertTrue(padC.stream().anyMatch(f -> "engine_oil_temp_c".equals(f.getMetric()) && f.getSeverity() == Severity.HIGH));
        assertTrue(padC.stream().anyMatch(f -> "exceeded_limits".equals(f.getObjectId())));

        for (RiskNode n : report.getTopRiskNodes()) {
            assertTrue(n.getDegree() >= 0.0 && n.getDegree() <= 1.0);
        }
        assertEquals(0, report.getStats().getUnclassifiedFactCount());
    }

    @Test
    void identicalInputGivesIdenticalReport() {
        RiskSnapshot snapshot = seedSnapshotRepository.loadSnapshot();
        assertEquals(riskAnalysisRunner.run(snapshot), riskAnalysisRunner.run(snapshot));
    }

    @Test
    void emptyInputGivesEmptyReport() {
        RiskReport report = riskAnalysisRunner.run(new InMemoryRiskSnapshotRepository());

        assertTrue(report.getTopRiskNodes().isEmpty());
        assertTrue(report.getTopSimilarPairs().isEmpty());
        assertTrue(report.getLocationRiskGroups().isEmpty());
    }

    @Test
    void inMemorySnapshot() {
        InMemoryRiskSnapshotRepository repository = new InMemoryRiskSnapshotRepository()
                .saveEquipment(seedSnapshotRepository.loadEquipment())
                .saveThresholds(seedSnapshotRepository.loadThresholds())
                .saveFacts(List.of(
                        Fact.builder().subjectId("FLUEND-12").subjectType("component")
                                .predicate(Fact.PREDICATE_HAS_METRIC)
                                .objectId("fluid_end_vibration_mms").objectType("metric")
                                .metric("fluid_end_vibration_mms").value(8.1).unit("mm/s")
                                .equipmentId("FLUEND-12")
                                .build()
                ));

        RiskReport report = riskAnalysisRunner.run(repository);

        assertEquals("FLUEND-12", report.getTopRiskNodes().get(0).getNodeId());
        assertEquals(Severity.HIGH, report.getTopRiskNodes().get(0).getSeverity());
        // 读数 + 派生症状都落在登记的 PAD-A
        assertEquals(2, report.getLocationRiskGroups().get("PAD-A").size());
        assertEquals(3, report.getStats().getNodeCount());
    }

    @Test
    void malformedFactPropagates() {
        RiskSnapshotRepository malformed = new JsonResourceRiskSnapshotRepository(
                resourceLoader, "classpath:malformed-facts.json", "classpath:seed/thresholds.json", null);

        MalformedFactException e = assertThrows(MalformedFactException.class, () -> riskAnalysisRunner.run(malformed));
        assertEquals("ENG-27", e.getFact().getSubjectId());
    }

    @Test
    void unknownPipelineIsRejected() {
        RiskSnapshot snapshot = RiskSnapshot.builder()
                .facts(List.of(Fact.builder().subjectId("a").predicate("p").objectId("b").build()))
                .build();
        assertThrows(IllegalArgumentException.class, () -> riskAnalysisRunner.run(snapshot, "nope"));
    }
}
