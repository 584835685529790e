package com.gdin.inspection.riskgraph.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 一次运行的只读输入快照，在运行开始时一次性从仓库加载。
 */
@Value
@Builder
public class RiskSnapshot {
    @Builder.Default
    List<Fact> facts = List.of();
    @Builder.Default
    List<Threshold> thresholds = List.of();
    @Builder.Default
    List<Equipment> equipment = List.of();
}
