package com.gdin.inspection.riskgraph.index.embedding;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.SplittableRandom;

/**
 * skip-gram + 负采样，在游走语料上学习节点向量。
 *
 * 单线程顺序训练，随机源固定，所以同一语料 + 同一 seed 得到逐位相同的向量。
 * 负样本按 count^0.75 的一元分布抽取；窗口每个位置随机缩小；学习率线性衰减到 minLearningRate。
 */
@Slf4j
@Component
public class SkipGramTrainer {

    private static final double UNIGRAM_POWER = 0.75;
    private static final double MAX_EXP = 6.0;

    /**
     * @param walks     节点下标序列
     * @param nodeCount 下标上界
     * @return 下标 -> 向量；未出现在语料中的节点为 null
     */
    public float[][] train(List<int[]> walks, int nodeCount, EmbeddingOptions options) {
        float[][] vectors = new float[nodeCount][];
        if (walks == null || walks.isEmpty()) return vectors;

        long[] counts = new long[nodeCount];
        long totalTokens = 0;
        for (int[] walk : walks) {
            for (int node : walk) {
                counts[node]++;
                totalTokens++;
            }
        }

        int dim = options.getDimensions();
        SplittableRandom rnd = new SplittableRandom(options.getSeed());
        float[][] syn0 = new float[nodeCount][];
        float[][] syn1neg = new float[nodeCount][];
        for (int i = 0; i < nodeCount; i++) {
            if (counts[i] == 0) continue;
            syn0[i] = new float[dim];
            for (int d = 0; d < dim; d++) {
                syn0[i][d] = (float) ((rnd.nextDouble() - 0.5) / dim);
            }
            syn1neg[i] = new float[dim];
        }

        double[] cumulative = unigramDistribution(counts);
        long totalWork = totalTokens * options.getEpochs();
        long processed = 0;
        float[] neu1e = new float[dim];

        for (int epoch = 0; epoch < options.getEpochs(); epoch++) {
            for (int[] walk : walks) {
                for (int pos = 0; pos < walk.length; pos++) {
                    double progress = (double) processed / totalWork;
                    float alpha = (float) Math.max(options.getMinLearningRate(),
                            options.getLearningRate() - (options.getLearningRate() - options.getMinLearningRate()) * progress);
                    processed++;

                    int center = walk[pos];
                    int reduced = rnd.nextInt(options.getWindow());
                    int span = options.getWindow() - reduced;
                    int from = Math.max(0, pos - span);
                    int to = Math.min(walk.length - 1, pos + span);
                    for (int c = from; c <= to; c++) {
                        if (c == pos) continue;
                        trainPair(syn0[walk[c]], center, syn1neg, cumulative, options.getNegativeSamples(), alpha, neu1e, rnd);
                    }
                }
            }
        }

        for (int i = 0; i < nodeCount; i++) {
            if (syn0[i] != null) vectors[i] = syn0[i];
        }
        log.debug("skip-gram trained: vocab={}, tokens={}, epochs={}", countNonNull(vectors), totalTokens, options.getEpochs());
        return vectors;
    }

    /**
     * 用 context 的输入向量预测 center：1 个正样本 + negative 个负样本。
     */
    private void trainPair(float[] l1, int center, float[][] syn1neg, double[] cumulative,
                           int negative, float alpha, float[] neu1e, SplittableRandom rnd) {
        Arrays.fill(neu1e, 0f);
        for (int d = 0; d <= negative; d++) {
            int target;
            int label;
            if (d == 0) {
                target = center;
                label = 1;
            } else {
                target = sample(cumulative, rnd);
                if (target == center) continue;
                label = 0;
            }
            float[] l2 = syn1neg[target];
            double f = 0.0;
            for (int k = 0; k < l1.length; k++) f += l1[k] * l2[k];
            double g = (label - sigmoid(f)) * alpha;
            for (int k = 0; k < l1.length; k++) {
                neu1e[k] += (float) (g * l2[k]);
                l2[k] += (float) (g * l1[k]);
            }
        }
        for (int k = 0; k < l1.length; k++) l1[k] += neu1e[k];
    }

    private static double sigmoid(double f) {
        if (f > MAX_EXP) return 1.0;
        if (f < -MAX_EXP) return 0.0;
        return 1.0 / (1.0 + Math.exp(-f));
    }

    static double[] unigramDistribution(long[] counts) {
        double[] cumulative = new double[counts.length];
        double acc = 0.0;
        for (int i = 0; i < counts.length; i++) {
            acc += counts[i] == 0 ? 0.0 : Math.pow(counts[i], UNIGRAM_POWER);
            cumulative[i] = acc;
        }
        if (acc > 0) {
            for (int i = 0; i < cumulative.length; i++) cumulative[i] /= acc;
        }
        return cumulative;
    }

    static int sample(double[] cumulative, SplittableRandom rnd) {
        double r = rnd.nextDouble();
        int idx = Arrays.binarySearch(cumulative, r);
        if (idx < 0) idx = -idx - 1;
        idx = Math.min(idx, cumulative.length - 1);
        while (idx < cumulative.length - 1 && cumulative[idx] <= 0.0) idx++;
        // 跳过计数为 0 的下标（累积值与前一个相同）
        while (idx > 0 && cumulative[idx] == cumulative[idx - 1]) idx--;
        return idx;
    }

    private static int countNonNull(float[][] vectors) {
        int c = 0;
        for (float[] v : vectors) if (v != null) c++;
        return c;
    }
}
