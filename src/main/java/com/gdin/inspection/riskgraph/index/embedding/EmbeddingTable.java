package com.gdin.inspection.riskgraph.index.embedding;

import com.gdin.inspection.riskgraph.models.NodeEmbedding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 只读的节点向量表，保持节点首次出现顺序。
 */
public class EmbeddingTable {

    private final List<String> nodeIds;
    private final float[][] vectors;
    private final double[] norms;
    private final Map<String, Integer> index = new LinkedHashMap<>();

    public EmbeddingTable(List<String> nodeIds, float[][] vectors) {
        if (nodeIds.size() != vectors.length) {
            throw new IllegalArgumentException("nodeIds 与 vectors 数量不一致");
        }
        this.nodeIds = List.copyOf(nodeIds);
        this.vectors = vectors;
        this.norms = new double[vectors.length];
        for (int i = 0; i < vectors.length; i++) {
            index.put(nodeIds.get(i), i);
            double sq = 0.0;
            for (float x : vectors[i]) sq += (double) x * x;
            norms[i] = Math.sqrt(sq);
        }
    }

    /**
     * 只保留训练出向量的节点。
     */
    static EmbeddingTable fromTrained(List<String> allNodeIds, float[][] trained) {
        List<String> ids = new ArrayList<>();
        List<float[]> vecs = new ArrayList<>();
        for (int i = 0; i < allNodeIds.size(); i++) {
            if (trained[i] == null) continue;
            ids.add(allNodeIds.get(i));
            vecs.add(trained[i]);
        }
        return new EmbeddingTable(ids, vecs.toArray(new float[0][]));
    }

    public int size() {
        return nodeIds.size();
    }

    public List<String> nodeIds() {
        return nodeIds;
    }

    public boolean contains(String nodeId) {
        return index.containsKey(nodeId);
    }

    String nodeId(int i) {
        return nodeIds.get(i);
    }

    /**
     * 余弦相似度，结果夹在 [-1, 1]；零向量视为 0。
     */
    double similarity(int i, int j) {
        double denom = norms[i] * norms[j];
        if (denom == 0.0) return 0.0;
        float[] a = vectors[i];
        float[] b = vectors[j];
        double dot = 0.0;
        for (int k = 0; k < a.length; k++) dot += (double) a[k] * b[k];
        return Math.max(-1.0, Math.min(1.0, dot / denom));
    }

    /**
     * 任一节点没有向量时返回 null。
     */
    public Double similarity(String a, String b) {
        Integer i = index.get(a);
        Integer j = index.get(b);
        if (i == null || j == null) return null;
        return i <= j ? similarity(i, j) : similarity(j, i);
    }

    public List<NodeEmbedding> toEmbeddings() {
        List<NodeEmbedding> out = new ArrayList<>(nodeIds.size());
        for (int i = 0; i < nodeIds.size(); i++) {
            out.add(NodeEmbedding.builder()
                    .nodeId(nodeIds.get(i))
                    .dimension(vectors[i].length)
                    .vector(vectors[i].clone())
                    .build());
        }
        return Collections.unmodifiableList(out);
    }
}
