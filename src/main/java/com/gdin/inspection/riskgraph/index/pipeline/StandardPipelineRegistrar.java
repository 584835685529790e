package com.gdin.inspection.riskgraph.index.pipeline;

import com.gdin.inspection.riskgraph.config.properties.RiskProperties;
import com.gdin.inspection.riskgraph.index.graph.KnowledgeGraph;
import com.gdin.inspection.riskgraph.index.severity.SeverityAnnotationOperation;
import com.gdin.inspection.riskgraph.index.workflows.AggregateReportWorkflow;
import com.gdin.inspection.riskgraph.index.workflows.AnnotateSeverityWorkflow;
import com.gdin.inspection.riskgraph.index.workflows.BuildGraphWorkflow;
import com.gdin.inspection.riskgraph.index.workflows.GraphSignalsWorkflow;
import com.gdin.inspection.riskgraph.models.RiskReport;
import com.gdin.inspection.riskgraph.models.RiskSnapshot;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.Resource;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class StandardPipelineRegistrar {

    public static final String STANDARD_PIPELINE = "risk_standard";

    @Resource
    private AnnotateSeverityWorkflow annotateSeverityWorkflow;
    @Resource
    private BuildGraphWorkflow buildGraphWorkflow;
    @Resource
    private GraphSignalsWorkflow graphSignalsWorkflow;
    @Resource
    private AggregateReportWorkflow aggregateReportWorkflow;

    @Resource
    public PipelineFactory<RiskProperties> factory;

    @PostConstruct
    public void init() {

        // 1) annotate_severity
        factory.register("annotate_severity", (cfg, ctx) -> {
            RiskSnapshot snapshot = ctx.require("snapshot");
            if (snapshot.getFacts().isEmpty()) {
                // 空输入不是错误：直接给出空报告
                ctx.put("risk_report", RiskReport.empty());
                return WorkflowFunctionOutput.builder().result("annotate_severity_empty").stop(true).build();
            }

            SeverityAnnotationOperation.Result out = annotateSeverityWorkflow.run(snapshot);

            ctx.put("facts", out.getFacts());
            ctx.getStats().setUnclassifiedFacts(out.getUnclassifiedCount());
            return WorkflowFunctionOutput.done("annotate_severity");
        });

        // 2) build_graph
        factory.register("build_graph", (cfg, ctx) -> {
            KnowledgeGraph graph = buildGraphWorkflow.run(ctx.require("facts"));

            ctx.put("graph", graph);
            return WorkflowFunctionOutput.done("build_graph");
        });

        // 3) graph_signals
        factory.register("graph_signals", (cfg, ctx) -> {
            GraphSignalsWorkflow.Result out = graphSignalsWorkflow.run(ctx.require("graph"), cfg);

            ctx.put("centrality_scores", out.getCentralityScores());
            ctx.put("top_risk_nodes", out.getTopRiskNodes());
            ctx.put("graph_signals", out);
            return WorkflowFunctionOutput.done("graph_signals");
        });

        // 4) aggregate_report
        factory.register("aggregate_report", (cfg, ctx) -> {
            RiskReport report = aggregateReportWorkflow.run(
                    ctx.require("facts"),
                    ctx.get("graph"),
                    ctx.require("graph_signals"),
                    cfg.getRanking().getElevatedSeverities(),
                    ctx.getStats().getUnclassifiedFacts()
            );

            ctx.put("risk_report", report);
            return WorkflowFunctionOutput.done("aggregate_report");
        });

        factory.registerPipeline(STANDARD_PIPELINE, List.of(
                "annotate_severity",
                "build_graph",
                "graph_signals",
                "aggregate_report"
        ));
    }
}
