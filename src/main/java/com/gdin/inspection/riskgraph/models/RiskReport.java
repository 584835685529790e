package com.gdin.inspection.riskgraph.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * 引擎唯一的输出：高风险节点、相似节点对、按位置分组的高风险事实。
 * 文本渲染由外部组件负责。
 */
@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RiskReport {

    @JsonProperty("top_risk_nodes")
    List<RiskNode> topRiskNodes;

    @JsonProperty("top_similar_pairs")
    List<SimilarPair> topSimilarPairs;

    @JsonProperty("location_risk_groups")
    Map<String, List<LocationRiskFact>> locationRiskGroups;

    @JsonProperty("stats")
    Stats stats;

    @Value
    @Jacksonized
    @Builder
    public static class Stats {
        @JsonProperty("fact_count")
        int factCount;

        @JsonProperty("node_count")
        int nodeCount;

        @JsonProperty("edge_count")
        int edgeCount;

        @JsonProperty("embedded_node_count")
        int embeddedNodeCount;

        @JsonProperty("unclassified_fact_count")
        int unclassifiedFactCount;
    }

    public static RiskReport empty() {
        return RiskReport.builder()
                .topRiskNodes(List.of())
                .topSimilarPairs(List.of())
                .locationRiskGroups(Map.of())
                .stats(Stats.builder().build())
                .build();
    }
}
