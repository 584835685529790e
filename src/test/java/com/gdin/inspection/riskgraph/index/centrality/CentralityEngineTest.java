package com.gdin.inspection.riskgraph.index.centrality;

import com.gdin.inspection.riskgraph.index.graph.GraphBuilder;
import com.gdin.inspection.riskgraph.index.graph.KnowledgeGraph;
import com.gdin.inspection.riskgraph.models.CentralityScore;
import com.gdin.inspection.riskgraph.models.Fact;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CentralityEngineTest {

    private static final double EPS = 1e-9;

    private final CentralityEngine engine = new CentralityEngine();
    private final GraphBuilder builder = new GraphBuilder();

    private static Fact edge(String s, String o) {
        return Fact.builder().subjectId(s).predicate("relates_to").objectId(o).build();
    }

    @Test
    void directedPath() {
        KnowledgeGraph graph = builder.build(List.of(edge("a", "b"), edge("b", "c")));
        Map<String, CentralityScore> scores = engine.compute(graph, 2);

        assertEquals(0.0, scores.get("a").getBetweenness(), EPS);
        assertEquals(0.5, scores.get("b").getBetweenness(), EPS);
        assertEquals(0.0, scores.get("c").getBetweenness(), EPS);

        assertEquals(2.0 / 3.0, scores.get("a").getCloseness(), EPS);
        assertEquals(1.0, scores.get("b").getCloseness(), EPS);
        assertEquals(0.0, scores.get("c").getCloseness(), EPS);

        assertEquals(0.5, scores.get("a").getDegree(), EPS);
        assertEquals(1.0, scores.get("b").getDegree(), EPS);
    }

    @Test
    void degreeStaysWithinBoundsWithReciprocalEdges() {
        KnowledgeGraph graph = builder.build(List.of(
                edge("a", "b"), edge("b", "a"), edge("a", "c"), edge("c", "a"), edge("a", "a")));
        Map<String, CentralityScore> scores = engine.compute(graph, 1);

        for (CentralityScore s : scores.values()) {
            assertTrue(s.getDegree() >= 0.0 && s.getDegree() <= 1.0);
        }
        assertEquals(1.0, scores.get("a").getDegree(), EPS);
    }

    @Test
    void disconnectedComponentsDoNotFail() {
        KnowledgeGraph graph = builder.build(List.of(edge("a", "b"), edge("x", "y"), edge("y", "z")));
        Map<String, CentralityScore> scores = engine.compute(graph, 4);

        assertEquals(5, scores.size());
        assertEquals(1.0, scores.get("a").getCloseness(), EPS);
        assertEquals(2.0 / 3.0, scores.get("x").getCloseness(), EPS);
        assertEquals(0.0, scores.get("b").getCloseness(), EPS);
    }

    @Test
    void singleNodeGraph() {
        KnowledgeGraph graph = builder.build(List.of(edge("a", "a")));
        CentralityScore s = engine.compute(graph, 1).get("a");

        assertEquals(0.0, s.getDegree(), EPS);
        assertEquals(0.0, s.getBetweenness(), EPS);
        assertEquals(0.0, s.getCloseness(), EPS);
        assertEquals(1.0, s.getPageRank(), EPS);
    }

    @Test
    void resultDoesNotDependOnWorkerCount() {
        // 超过一个源点分块
        List<Fact> facts = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            facts.add(edge("n" + i, "n" + ((i * 7 + 3) % 150)));
            facts.add(edge("n" + i, "hub"));
        }
        KnowledgeGraph graph = builder.build(facts);

        Map<String, CentralityScore> one = engine.compute(graph, 1);
        Map<String, CentralityScore> many = engine.compute(graph, 8);
        assertEquals(one, many);
    }

    @Test
    void pageRankSumsToOne() {
        KnowledgeGraph graph = builder.build(List.of(edge("a", "b"), edge("b", "c"), edge("c", "a"), edge("c", "d")));
        double sum = 0.0;
        for (double r : engine.pageRank(graph.adjacency(false))) sum += r;
        assertEquals(1.0, sum, 1e-9);
    }

    @Test
    void emptyGraph() {
        assertTrue(engine.compute(new GraphBuilder().build(List.of()), 2).isEmpty());
    }
}
