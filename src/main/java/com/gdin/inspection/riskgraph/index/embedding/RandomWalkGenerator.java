package com.gdin.inspection.riskgraph.index.embedding;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * node2vec 二阶有偏随机游走（无向邻接表）。
 *
 * 每条游走使用由 (seed, 轮次, 起点) 派生的独立随机源，所以语料与 worker 数、线程调度无关。
 * 没有邻居的节点不产生游走。
 */
@Slf4j
@Component
public class RandomWalkGenerator {

    private static final long ROUND_MIX = 0x9E3779B97F4A7C15L;
    private static final long NODE_MIX = 0xC2B2AE3D27D4EB4FL;

    /**
     * @return 按 (轮次, 起点下标) 排序的游走，元素为节点下标
     */
    public List<int[]> generate(int[][] adjacency, EmbeddingOptions options, int workers) {
        int n = adjacency.length;
        if (n == 0) return List.of();

        int[][] sorted = new int[n][];
        for (int i = 0; i < n; i++) {
            sorted[i] = adjacency[i].clone();
            Arrays.sort(sorted[i]);
        }

        int rounds = options.getNumWalks();
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, Math.min(workers, rounds)));
        try {
            List<CompletableFuture<List<int[]>>> futures = new ArrayList<>(rounds);
            for (int r = 0; r < rounds; r++) {
                int round = r;
                futures.add(CompletableFuture.supplyAsync(() -> walkRound(sorted, round, options), pool));
            }
            List<int[]> walks = new ArrayList<>();
            for (CompletableFuture<List<int[]>> f : futures) {
                walks.addAll(f.join());
            }
            log.debug("random walks generated: nodes={}, walks={}", n, walks.size());
            return walks;
        } finally {
            pool.shutdown();
        }
    }

    private List<int[]> walkRound(int[][] adj, int round, EmbeddingOptions options) {
        List<int[]> walks = new ArrayList<>(adj.length);
        for (int start = 0; start < adj.length; start++) {
            if (adj[start].length == 0) continue;
            long s = options.getSeed() ^ ((round + 1L) * ROUND_MIX) ^ ((start + 1L) * NODE_MIX);
            walks.add(walk(adj, start, options, new SplittableRandom(s)));
        }
        return walks;
    }

    int[] walk(int[][] adj, int start, EmbeddingOptions options, SplittableRandom rnd) {
        int length = options.getWalkLength();
        boolean uniform = options.getReturnParam() == 1.0 && options.getInOutParam() == 1.0;

        int[] walk = new int[length];
        walk[0] = start;
        int size = 1;
        while (size < length) {
            int cur = walk[size - 1];
            int[] nbrs = adj[cur];
            if (nbrs.length == 0) break;
            int next;
            if (uniform || size == 1) {
                next = nbrs[rnd.nextInt(nbrs.length)];
            } else {
                next = biasedStep(adj, walk[size - 2], nbrs, options, rnd);
            }
            walk[size++] = next;
        }
        return size == length ? walk : Arrays.copyOf(walk, size);
    }

    /**
     * 回到上一个节点权重 1/p，与上一个节点相邻权重 1，其余 1/q。
     */
    private int biasedStep(int[][] adj, int prev, int[] nbrs, EmbeddingOptions options, SplittableRandom rnd) {
        double[] weights = new double[nbrs.length];
        double total = 0.0;
        for (int i = 0; i < nbrs.length; i++) {
            int x = nbrs[i];
            double w;
            if (x == prev) {
                w = 1.0 / options.getReturnParam();
            } else if (Arrays.binarySearch(adj[prev], x) >= 0) {
                w = 1.0;
            } else {
                w = 1.0 / options.getInOutParam();
            }
            weights[i] = w;
            total += w;
        }
        double r = rnd.nextDouble() * total;
        for (int i = 0; i < nbrs.length; i++) {
            r -= weights[i];
            if (r < 0) return nbrs[i];
        }
        return nbrs[nbrs.length - 1];
    }
}
