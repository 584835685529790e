package com.gdin.inspection.riskgraph.index.workflows;

import com.gdin.inspection.riskgraph.index.graph.KnowledgeGraph;
import com.gdin.inspection.riskgraph.index.report.RiskAggregator;
import com.gdin.inspection.riskgraph.models.Fact;
import com.gdin.inspection.riskgraph.models.RiskReport;
import com.gdin.inspection.riskgraph.models.Severity;
import jakarta.annotation.Resource;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

/**
 * workflow: aggregate_report
 *
 * 输入：facts / graph / graph_signals 的结果；输出：risk_report
 */
@Service
public class AggregateReportWorkflow {

    @Resource
    private RiskAggregator riskAggregator;

    public RiskReport run(
            List<Fact> facts,
            KnowledgeGraph graph,
            GraphSignalsWorkflow.Result signals,
            Collection<Severity> elevatedSeverities,
            int unclassifiedFactCount
    ) {
        if (signals == null) throw new IllegalStateException("graph_signals 结果不能为空");

        RiskReport.Stats stats = RiskReport.Stats.builder()
                .factCount(facts == null ? 0 : facts.size())
                .nodeCount(graph == null ? 0 : graph.nodeCount())
                .edgeCount(graph == null ? 0 : graph.edgeCount())
                .embeddedNodeCount(signals.getEmbedding().getEmbeddings().size())
                .unclassifiedFactCount(unclassifiedFactCount)
                .build();

        return riskAggregator.aggregate(
                facts,
                signals.getTopRiskNodes(),
                signals.getEmbedding().getTopPairs(),
                elevatedSeverities,
                stats
        );
    }
}
