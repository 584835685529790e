package com.gdin.inspection.riskgraph.config;

import com.gdin.inspection.riskgraph.config.properties.RiskProperties;
import com.gdin.inspection.riskgraph.index.pipeline.PipelineFactory;
import com.gdin.inspection.riskgraph.repository.JsonResourceRiskSnapshotRepository;
import com.gdin.inspection.riskgraph.repository.RiskSnapshotRepository;
import jakarta.annotation.Resource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class RiskConfig {
    @Resource
    private RiskProperties riskProperties;

    @Bean
    protected PipelineFactory<RiskProperties> pipelineFactory() {
        return new PipelineFactory<>();
    }

    // 种子快照，资源位置取自 gdin.ai.risk.startup.*
    @Bean
    protected RiskSnapshotRepository seedSnapshotRepository(ResourceLoader resourceLoader) {
        RiskProperties.Startup startup = riskProperties.getStartup();
        return new JsonResourceRiskSnapshotRepository(
                resourceLoader,
                startup.getFactsResource(),
                startup.getThresholdsResource(),
                startup.getEquipmentResource()
        );
    }
}
