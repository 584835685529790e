package com.gdin.inspection.riskgraph.index.run;

import com.gdin.inspection.riskgraph.config.properties.RiskProperties;
import com.gdin.inspection.riskgraph.exception.RiskAnalysisException;
import com.gdin.inspection.riskgraph.index.pipeline.Pipeline;
import com.gdin.inspection.riskgraph.index.pipeline.PipelineFactory;
import com.gdin.inspection.riskgraph.index.pipeline.StandardPipelineRegistrar;
import com.gdin.inspection.riskgraph.index.pipeline.context.PipelineRunContext;
import com.gdin.inspection.riskgraph.index.pipeline.context.PipelineRunResult;
import com.gdin.inspection.riskgraph.index.pipeline.context.RunPipeline;
import com.gdin.inspection.riskgraph.models.RiskReport;
import com.gdin.inspection.riskgraph.models.RiskSnapshot;
import com.gdin.inspection.riskgraph.repository.RiskSnapshotRepository;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 风险分析入口：一次调用 = 一个批次。
 * 仓库只在开始时读一次，之后全部在内存中计算，不回写。
 */
@Slf4j
@Service
public class RiskAnalysisRunner {
    @Resource
    private RiskProperties riskProperties;

    @Resource
    private PipelineFactory<RiskProperties> factory;

    public RiskReport run(RiskSnapshotRepository repository) {
        if (repository == null) throw new IllegalArgumentException("repository 不能为空");
        return run(repository.loadSnapshot());
    }

    public RiskReport run(RiskSnapshot snapshot) {
        return run(snapshot, StandardPipelineRegistrar.STANDARD_PIPELINE);
    }

    public RiskReport run(RiskSnapshot snapshot, String pipelineName) {
        PipelineRunContext ctx = new PipelineRunContext();
        ctx.put("snapshot", snapshot == null ? RiskSnapshot.builder().build() : snapshot);

        Pipeline<RiskProperties> pipeline = factory.createPipeline(pipelineName);
        List<PipelineRunResult> results = new RunPipeline<RiskProperties>().run(pipeline, riskProperties, ctx);

        rethrowFailure(results);

        RiskReport report = ctx.getOrDefault("risk_report", RiskReport.empty());
        log.info("risk analysis {} finished in {}s: topRiskNodes={}, topSimilarPairs={}, locations={}",
                pipelineName,
                String.format("%.3f", ctx.getStats().getTotalSeconds()),
                report.getTopRiskNodes().size(),
                report.getTopSimilarPairs().size(),
                report.getLocationRiskGroups().size());
        return report;
    }

    // RunPipeline 只记录异常，这里把它还给调用方
    private void rethrowFailure(List<PipelineRunResult> results) {
        for (PipelineRunResult r : results) {
            if (!r.hasErrors()) continue;
            Exception e = r.getErrors().get(0);
            if (e instanceof RiskAnalysisException) throw (RiskAnalysisException) e;
            throw new RiskAnalysisException("workflow 执行失败: " + r.getWorkflow(), e);
        }
    }
}
