package com.gdin.inspection.riskgraph.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 单个节点的结构向量。每次运行重新训练，不落库。
 */
@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NodeEmbedding {

    @JsonProperty("node_id")
    String nodeId;

    @JsonProperty("dimension")
    Integer dimension;

    // 训练得到的原始向量，未归一化
    @JsonProperty("vector")
    float[] vector;
}
