package com.gdin.inspection.riskgraph.index.graph;

import com.gdin.inspection.riskgraph.models.GraphEdge;
import com.gdin.inspection.riskgraph.models.GraphNode;
import com.gdin.inspection.riskgraph.models.Severity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 有向属性图。节点按首次出现顺序保存，同一有序节点对只有一条边（谓词集合）。
 *
 * 建图阶段由 GraphBuilder 单线程写入；建好之后只读，centrality / embedding 可以并发读取。
 */
public class KnowledgeGraph {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    // source -> (target -> edge)
    private final Map<String, Map<String, GraphEdge>> outEdges = new LinkedHashMap<>();
    // target -> sources
    private final Map<String, Set<String>> inSources = new LinkedHashMap<>();
    private int edgeCount;

    GraphNode upsertNode(String id, String entityType, Severity severity) {
        GraphNode node = nodes.get(id);
        if (node == null) {
            node = GraphNode.builder()
                    .id(id)
                    .label(id)
                    .entityType(entityType)
                    .firstSeen(nodes.size())
                    .build();
            nodes.put(id, node);
        } else if (node.getEntityType() == null && entityType != null) {
            node.setEntityType(entityType);
        }
        node.upgradeSeverity(severity);
        return node;
    }

    void addEdge(String source, String target, String predicate) {
        Map<String, GraphEdge> targets = outEdges.computeIfAbsent(source, k -> new LinkedHashMap<>());
        GraphEdge edge = targets.get(target);
        if (edge == null) {
            edge = GraphEdge.builder().source(source).target(target).build();
            targets.put(target, edge);
            inSources.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(source);
            edgeCount++;
        }
        edge.getPredicates().add(predicate);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public GraphNode getNode(String id) {
        return nodes.get(id);
    }

    /**
     * 按首次出现顺序。
     */
    public Collection<GraphNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public List<String> nodeIds() {
        return new ArrayList<>(nodes.keySet());
    }

    public GraphEdge getEdge(String source, String target) {
        Map<String, GraphEdge> targets = outEdges.get(source);
        return targets == null ? null : targets.get(target);
    }

    /**
     * 后继节点（不含自环）。
     */
    public Set<String> successors(String id) {
        Map<String, GraphEdge> targets = outEdges.get(id);
        if (targets == null) return Collections.emptySet();
        Set<String> out = new LinkedHashSet<>(targets.keySet());
        out.remove(id);
        return out;
    }

    /**
     * 前驱节点（不含自环）。
     */
    public Set<String> predecessors(String id) {
        Set<String> sources = inSources.get(id);
        if (sources == null) return Collections.emptySet();
        Set<String> in = new LinkedHashSet<>(sources);
        in.remove(id);
        return in;
    }

    /**
     * 无向视图下的邻居：前驱 ∪ 后继，不含自身。
     */
    public Set<String> neighbors(String id) {
        Set<String> all = new LinkedHashSet<>(successors(id));
        all.addAll(predecessors(id));
        return all;
    }

    /**
     * 以首次出现顺序为下标的邻接表，供算法按 int 下标遍历。
     *
     * @param undirected true 时为无向邻居，否则为有向后继
     */
    public int[][] adjacency(boolean undirected) {
        List<String> ids = nodeIds();
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < ids.size(); i++) index.put(ids.get(i), i);

        int[][] adj = new int[ids.size()][];
        for (int i = 0; i < ids.size(); i++) {
            Set<String> nbrs = undirected ? neighbors(ids.get(i)) : successors(ids.get(i));
            int[] row = new int[nbrs.size()];
            int k = 0;
            for (String n : nbrs) row[k++] = index.get(n);
            adj[i] = row;
        }
        return adj;
    }
}
