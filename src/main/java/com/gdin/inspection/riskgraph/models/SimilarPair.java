package com.gdin.inspection.riskgraph.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Comparator;

/**
 * 相似节点对，nodeA 按字典序不大于 nodeB。
 */
@Value
@Jacksonized
@Builder
public class SimilarPair {

    /**
     * 相似度降序，同分按 (nodeA, nodeB) 字典序。
     */
    public static final Comparator<SimilarPair> RANKING = Comparator
            .comparingDouble(SimilarPair::getSimilarity).reversed()
            .thenComparing(SimilarPair::getNodeA)
            .thenComparing(SimilarPair::getNodeB);

    @JsonProperty("node_a")
    String nodeA;

    @JsonProperty("node_b")
    String nodeB;

    @JsonProperty("similarity")
    double similarity;

    public static SimilarPair of(String x, String y, double similarity) {
        boolean ordered = x.compareTo(y) <= 0;
        return new SimilarPair(ordered ? x : y, ordered ? y : x, similarity);
    }
}
