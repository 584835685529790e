package com.gdin.inspection.riskgraph.index.pipeline.context;

import lombok.Getter;
import lombok.Setter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Getter
public class PipelineRunStats {

    private final Map<String, Double> workflowSeconds = new ConcurrentHashMap<>();

    @Setter
    private double totalSeconds;

    // 读数无效、跳过分级的事实数
    @Setter
    private int unclassifiedFacts;
}
