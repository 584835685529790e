package com.gdin.inspection.riskgraph.index.centrality;

import com.gdin.inspection.riskgraph.index.graph.KnowledgeGraph;
import com.gdin.inspection.riskgraph.models.CentralityScore;
import com.gdin.inspection.riskgraph.models.GraphNode;
import com.gdin.inspection.riskgraph.models.RiskNode;
import com.gdin.inspection.riskgraph.models.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 高风险节点排序：(severity_rank 降序, degree 降序)，其余同分保持建图时的首次出现顺序。
 */
@Component
public class TopRiskRanker {

    public List<RiskNode> rank(
            KnowledgeGraph graph,
            Map<String, CentralityScore> scores,
            Map<Severity, Integer> severityRank,
            int topK
    ) {
        if (graph == null || graph.isEmpty() || topK <= 0) return List.of();

        List<RiskNode> candidates = new ArrayList<>(graph.nodeCount());
        for (GraphNode node : graph.nodes()) {
            CentralityScore s = scores.getOrDefault(node.getId(), CentralityScore.ZERO);
            candidates.add(RiskNode.builder()
                    .nodeId(node.getId())
                    .type(node.getEntityType())
                    .severity(node.getSeverity())
                    .degree(s.getDegree())
                    .betweenness(s.getBetweenness())
                    .closeness(s.getCloseness())
                    .pageRank(s.getPageRank())
                    .build());
        }

        // List.sort 是稳定排序，candidates 已按首次出现顺序排列
        candidates.sort(Comparator
                .comparingInt((RiskNode r) -> rankOf(r.getSeverity(), severityRank)).reversed()
                .thenComparing(Comparator.comparingDouble(RiskNode::getDegree).reversed()));

        return List.copyOf(candidates.subList(0, Math.min(topK, candidates.size())));
    }

    static int rankOf(Severity severity, Map<Severity, Integer> severityRank) {
        Severity s = severity == null ? Severity.NORMAL : severity;
        if (severityRank != null) {
            Integer configured = severityRank.get(s);
            if (configured != null) return configured;
        }
        return s.getDefaultRank();
    }
}
