package com.gdin.inspection.riskgraph.index.embedding;

import com.gdin.inspection.riskgraph.index.graph.KnowledgeGraph;
import com.gdin.inspection.riskgraph.models.SimilarPair;
import jakarta.annotation.Resource;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 结构向量 + 相似度排序：
 *
 * 1. 无向视图上做 node2vec 随机游走（并行）；
 * 2. skip-gram 负采样训练节点向量；
 * 3. 所有已嵌入节点对做余弦相似度，取 top-K。
 *
 * 孤立节点没有向量，不参与相似度；可嵌入节点少于 2 个时返回空列表。
 */
@Slf4j
@Component
public class EmbeddingSimilarityEngine {

    @Resource
    private RandomWalkGenerator randomWalkGenerator;
    @Resource
    private SkipGramTrainer skipGramTrainer;
    @Resource
    private SimilarityRanker similarityRanker;

    @Value
    public static class Result {
        EmbeddingTable embeddings;
        List<SimilarPair> topPairs;
    }

    public Result embedAndRank(KnowledgeGraph graph, EmbeddingOptions options, int workers) {
        options.validate();
        List<String> ids = graph == null ? List.of() : graph.nodeIds();
        if (ids.size() < 2) {
            return new Result(new EmbeddingTable(List.of(), new float[0][]), List.of());
        }

        int[][] adjacency = graph.adjacency(true);
        List<int[]> walks = randomWalkGenerator.generate(adjacency, options, workers);
        float[][] trained = skipGramTrainer.train(walks, ids.size(), options);
        EmbeddingTable table = EmbeddingTable.fromTrained(ids, trained);

        if (table.size() < 2) {
            log.warn("embeddable nodes < 2 ({}), similarity ranking skipped", table.size());
            return new Result(table, List.of());
        }

        List<SimilarPair> top = similarityRanker.topPairs(table, options.getTopK(), workers);
        log.info("embedding done: nodes={}, embedded={}, walks={}, dimensions={}, topPairs={}",
                ids.size(), table.size(), walks.size(), options.getDimensions(), top.size());
        return new Result(table, top);
    }
}
