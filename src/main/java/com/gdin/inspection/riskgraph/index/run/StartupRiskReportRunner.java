package com.gdin.inspection.riskgraph.index.run;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.riskgraph.config.properties.RiskProperties;
import com.gdin.inspection.riskgraph.models.LocationRiskFact;
import com.gdin.inspection.riskgraph.models.RiskNode;
import com.gdin.inspection.riskgraph.models.RiskReport;
import com.gdin.inspection.riskgraph.models.SimilarPair;
import com.gdin.inspection.riskgraph.repository.RiskSnapshotRepository;
import com.gdin.inspection.riskgraph.util.IOUtil;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 启动时对种子快照跑一次分析并打印结果，gdin.ai.risk.startup.enabled=true 时生效。
 */
@Slf4j
@Component
public class StartupRiskReportRunner implements CommandLineRunner {
    @Resource
    private RiskProperties riskProperties;
    @Resource
    private RiskAnalysisRunner riskAnalysisRunner;
    @Resource
    private RiskSnapshotRepository seedSnapshotRepository;

    @Override
    public void run(String... args) throws Exception {
        RiskProperties.Startup startup = riskProperties.getStartup();
        if (!Boolean.TRUE.equals(startup.getEnabled())) return;

        RiskReport report = riskAnalysisRunner.run(seedSnapshotRepository);

        log.info("=== Top risk nodes ===");
        for (RiskNode n : report.getTopRiskNodes()) {
            log.info("{} ({}) severity={} degree={} betweenness={} pageRank={}",
                    n.getNodeId(), n.getType(), n.getSeverity(),
                    fmt(n.getDegree()), fmt(n.getBetweenness()), fmt(n.getPageRank()));
        }
        log.info("=== Top similar pairs ===");
        for (SimilarPair p : report.getTopSimilarPairs()) {
            log.info("{} ~ {} similarity={}", p.getNodeA(), p.getNodeB(), fmt(p.getSimilarity()));
        }
        log.info("=== Elevated facts by location ===");
        for (Map.Entry<String, List<LocationRiskFact>> e : report.getLocationRiskGroups().entrySet()) {
            for (LocationRiskFact f : e.getValue()) {
                log.info("[{}] {} {} {} {}", e.getKey(), f.getSubjectId(), f.getPredicate(), f.getObjectId(), f.getSeverity());
            }
        }

        if (StrUtil.isNotBlank(startup.getReportOutput())) {
            Path out = Path.of(startup.getReportOutput());
            IOUtil.writeJson(out, report);
            log.info("risk report written to {}", out.toAbsolutePath());
        }
    }

    private static String fmt(double v) {
        return String.format("%.4f", v);
    }
}
