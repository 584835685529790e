package com.gdin.inspection.riskgraph.index.workflows;

import com.gdin.inspection.riskgraph.config.properties.RiskProperties;
import com.gdin.inspection.riskgraph.index.centrality.CentralityEngine;
import com.gdin.inspection.riskgraph.index.centrality.TopRiskRanker;
import com.gdin.inspection.riskgraph.index.embedding.EmbeddingOptions;
import com.gdin.inspection.riskgraph.index.embedding.EmbeddingSimilarityEngine;
import com.gdin.inspection.riskgraph.index.graph.KnowledgeGraph;
import com.gdin.inspection.riskgraph.models.CentralityScore;
import com.gdin.inspection.riskgraph.models.RiskNode;
import jakarta.annotation.Resource;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * workflow: graph_signals
 *
 * 中心性与结构向量都只读同一张图，互不依赖，两路并行：
 * - centrality -> top_risk_nodes
 * - embedding  -> top_similar_pairs
 *
 * 输入：graph；输出：centrality_scores / top_risk_nodes / embedding_result
 */
@Slf4j
@Service
public class GraphSignalsWorkflow {

    @Resource
    private CentralityEngine centralityEngine;
    @Resource
    private TopRiskRanker topRiskRanker;
    @Resource
    private EmbeddingSimilarityEngine embeddingSimilarityEngine;

    @Value
    public static class Result {
        Map<String, CentralityScore> centralityScores;
        List<RiskNode> topRiskNodes;
        EmbeddingSimilarityEngine.Result embedding;
    }

    public Result run(KnowledgeGraph graph, RiskProperties properties) {
        if (graph == null) throw new IllegalStateException("graph 不能为空");

        int workers = properties.getWorkers() == null ? 1 : Math.max(1, properties.getWorkers());
        RiskProperties.Ranking ranking = properties.getRanking();
        EmbeddingOptions options = EmbeddingOptions.from(properties.getEmbedding());

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            CompletableFuture<Map<String, CentralityScore>> centralityFuture =
                    CompletableFuture.supplyAsync(() -> centralityEngine.compute(graph, workers), pool);
            CompletableFuture<EmbeddingSimilarityEngine.Result> embeddingFuture =
                    CompletableFuture.supplyAsync(() -> embeddingSimilarityEngine.embedAndRank(graph, options, workers), pool);

            Map<String, CentralityScore> scores = join(centralityFuture);
            EmbeddingSimilarityEngine.Result embedding = join(embeddingFuture);

            List<RiskNode> topRiskNodes = topRiskRanker.rank(
                    graph,
                    scores,
                    ranking.getSeverityRank(),
                    ranking.getTopRiskNodes() == null ? 0 : ranking.getTopRiskNodes()
            );

            log.info("graph signals done: nodes={}, topRiskNodes={}, topSimilarPairs={}",
                    graph.nodeCount(), topRiskNodes.size(), embedding.getTopPairs().size());
            return new Result(scores, topRiskNodes, embedding);
        } finally {
            pool.shutdown();
        }
    }

    // 解包 CompletionException，让 RunPipeline 记录原始异常
    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw e;
        }
    }
}
