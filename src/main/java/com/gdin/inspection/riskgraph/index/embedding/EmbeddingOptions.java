package com.gdin.inspection.riskgraph.index.embedding;

import com.gdin.inspection.riskgraph.config.properties.RiskProperties;
import lombok.Builder;
import lombok.Value;

/**
 * 结构向量训练参数，缺省值与 RiskProperties.Embedding 一致。
 */
@Value
@Builder(toBuilder = true)
public class EmbeddingOptions {
    @Builder.Default
    int dimensions = 32;
    @Builder.Default
    int walkLength = 10;
    @Builder.Default
    int numWalks = 100;
    @Builder.Default
    int window = 5;
    @Builder.Default
    double returnParam = 1.0;
    @Builder.Default
    double inOutParam = 1.0;
    @Builder.Default
    int epochs = 5;
    @Builder.Default
    int negativeSamples = 5;
    @Builder.Default
    double learningRate = 0.025;
    @Builder.Default
    double minLearningRate = 0.0001;
    @Builder.Default
    long seed = 42L;
    @Builder.Default
    int topK = 10;

    public static EmbeddingOptions from(RiskProperties.Embedding cfg) {
        return EmbeddingOptions.builder()
                .dimensions(cfg.getDimensions())
                .walkLength(cfg.getWalkLength())
                .numWalks(cfg.getNumWalks())
                .window(cfg.getWindow())
                .returnParam(cfg.getReturnParam())
                .inOutParam(cfg.getInOutParam())
                .epochs(cfg.getEpochs())
                .negativeSamples(cfg.getNegativeSamples())
                .learningRate(cfg.getLearningRate())
                .minLearningRate(cfg.getMinLearningRate())
                .seed(cfg.getSeed())
                .topK(cfg.getTopSimilarPairs())
                .build();
    }

    public void validate() {
        if (dimensions <= 0) throw new IllegalArgumentException("dimensions 必须大于 0");
        if (walkLength <= 0) throw new IllegalArgumentException("walkLength 必须大于 0");
        if (numWalks <= 0) throw new IllegalArgumentException("numWalks 必须大于 0");
        if (window <= 0) throw new IllegalArgumentException("window 必须大于 0");
        if (returnParam <= 0 || inOutParam <= 0) throw new IllegalArgumentException("p / q 必须大于 0");
        if (epochs <= 0) throw new IllegalArgumentException("epochs 必须大于 0");
        if (negativeSamples < 0) throw new IllegalArgumentException("negativeSamples 不能为负");
    }
}
