package com.gdin.inspection.riskgraph.index.embedding;

import com.gdin.inspection.riskgraph.models.SimilarPair;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 所有无序节点对的余弦相似度 top-K。
 *
 * 按行分块 (i, j>i) 并行打分，每块维护自己的有界堆，互不共享状态；
 * 全部完成后协调方拼接、重排、截断。
 */
@Slf4j
@Component
public class SimilarityRanker {

    static final int ROW_BLOCK_SIZE = 32;

    public List<SimilarPair> topPairs(EmbeddingTable table, int topK, int workers) {
        int n = table.size();
        if (n < 2 || topK <= 0) return List.of();

        int blocks = (n + ROW_BLOCK_SIZE - 1) / ROW_BLOCK_SIZE;
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, Math.min(workers, blocks)));
        try {
            List<CompletableFuture<List<SimilarPair>>> futures = new ArrayList<>(blocks);
            for (int b = 0; b < blocks; b++) {
                int from = b * ROW_BLOCK_SIZE;
                int to = Math.min(n, from + ROW_BLOCK_SIZE);
                futures.add(CompletableFuture.supplyAsync(() -> scoreRows(table, from, to, topK), pool));
            }

            List<SimilarPair> merged = new ArrayList<>();
            for (CompletableFuture<List<SimilarPair>> f : futures) {
                merged.addAll(f.join());
            }
            merged.sort(SimilarPair.RANKING);
            List<SimilarPair> top = List.copyOf(merged.subList(0, Math.min(topK, merged.size())));
            log.debug("similarity ranked: embedded={}, pairs={}, top={}", n, (long) n * (n - 1) / 2, top.size());
            return top;
        } finally {
            pool.shutdown();
        }
    }

    private List<SimilarPair> scoreRows(EmbeddingTable table, int from, int to, int topK) {
        int n = table.size();
        // 块内 pair 数可能远小于 topK，初始容量按两者较小值
        long pairsInBlock = 0;
        for (int i = from; i < to; i++) pairsInBlock += n - 1 - i;
        int capacity = (int) Math.max(1, Math.min(topK, pairsInBlock));
        // 堆顶是当前最差的一对
        PriorityQueue<SimilarPair> heap = new PriorityQueue<>(capacity, SimilarPair.RANKING.reversed());
        for (int i = from; i < to; i++) {
            for (int j = i + 1; j < n; j++) {
                SimilarPair pair = SimilarPair.of(table.nodeId(i), table.nodeId(j), table.similarity(i, j));
                if (heap.size() < topK) {
                    heap.add(pair);
                } else if (SimilarPair.RANKING.compare(pair, heap.peek()) < 0) {
                    heap.poll();
                    heap.add(pair);
                }
            }
        }
        return new ArrayList<>(heap);
    }
}
