package com.gdin.inspection.riskgraph.index.graph;

import com.gdin.inspection.riskgraph.exception.MalformedFactException;
import com.gdin.inspection.riskgraph.models.Fact;
import com.gdin.inspection.riskgraph.models.GraphEdge;
import com.gdin.inspection.riskgraph.models.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GraphBuilderTest {

    private final GraphBuilder builder = new GraphBuilder();

    private static Fact fact(String s, String p, String o, Severity severity) {
        return Fact.builder()
                .subjectId(s).subjectType("component")
                .predicate(p)
                .objectId(o).objectType("metric")
                .severity(severity)
                .build();
    }

    @Test
    void duplicateSubjectsCollapseToOneNodeWithMaxSeverity() {
        KnowledgeGraph graph = builder.build(List.of(
                fact("ENG-12", "has_metric", "engine_oil_temp_c", Severity.MED),
                fact("ENG-12", "has_metric", "engine_water_temp_c", Severity.HIGH),
                fact("ENG-12", "has_metric", "engine_load_pct", Severity.LOW)
        ));

        assertEquals(4, graph.nodeCount());
        assertEquals(Severity.HIGH, graph.getNode("ENG-12").getSeverity());
        assertEquals(Severity.LOW, graph.getNode("engine_load_pct").getSeverity());
        assertEquals(List.of("ENG-12", "engine_oil_temp_c", "engine_water_temp_c", "engine_load_pct"), graph.nodeIds());
    }

    @Test
    void severityIsOrderIndependent() {
        Fact high = fact("ENG-12", "has_metric", "engine_oil_temp_c", Severity.HIGH);
        Fact low = fact("ENG-12", "has_metric", "engine_oil_temp_c", Severity.LOW);

        assertEquals(Severity.HIGH, builder.build(List.of(high, low)).getNode("ENG-12").getSeverity());
        assertEquals(Severity.HIGH, builder.build(List.of(low, high)).getNode("ENG-12").getSeverity());
    }

    @Test
    void samePairKeepsOneEdgeWithAllPredicates() {
        KnowledgeGraph graph = builder.build(List.of(
                fact("ENG-27", "located_at", "PAD-B", null),
                fact("ENG-27", "serviced_at", "PAD-B", null),
                fact("ENG-27", "located_at", "PAD-B", null)
        ));

        assertEquals(1, graph.edgeCount());
        GraphEdge edge = graph.getEdge("ENG-27", "PAD-B");
        assertEquals(Set.of("located_at", "serviced_at"), edge.getPredicates());
        assertEquals(Severity.NORMAL, graph.getNode("PAD-B").getSeverity());
    }

    @Test
    void selfLoopIsStoredButNotANeighbor() {
        KnowledgeGraph graph = builder.build(List.of(
                fact("ENG-1", "relates_to", "ENG-1", null),
                fact("ENG-1", "has_metric", "m", null)
        ));

        assertEquals(2, graph.edgeCount());
        assertTrue(graph.getEdge("ENG-1", "ENG-1").isSelfLoop());
        assertEquals(Set.of("m"), graph.neighbors("ENG-1"));
    }

    @Test
    void emptyInputGivesEmptyGraph() {
        assertTrue(builder.build(List.of()).isEmpty());
        assertTrue(builder.build(null).isEmpty());
    }

    @Test
    void malformedFactIsRejected() {
        Fact noObject = Fact.builder().subjectId("ENG-27").predicate("has_metric").build();
        Fact noPredicate = Fact.builder().subjectId("ENG-27").objectId("PAD-B").build();

        MalformedFactException e = assertThrows(MalformedFactException.class, () -> builder.build(List.of(noObject)));
        assertEquals(noObject, e.getFact());
        assertThrows(MalformedFactException.class, () -> builder.build(List.of(noPredicate)));
    }
}
