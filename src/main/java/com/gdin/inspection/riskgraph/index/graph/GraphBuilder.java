package com.gdin.inspection.riskgraph.index.graph;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.riskgraph.exception.MalformedFactException;
import com.gdin.inspection.riskgraph.models.Fact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 事实 -> 有向图。每条事实：upsert 主体 / 客体节点（严重度取最大），再加一条 subject -> object 边。
 * 节点 / 边集合与事实顺序无关，严重度是 max 归约所以也与顺序无关。
 */
@Slf4j
@Component
public class GraphBuilder {

    public KnowledgeGraph build(List<Fact> facts) {
        KnowledgeGraph graph = new KnowledgeGraph();
        if (facts == null || facts.isEmpty()) return graph;

        for (Fact fact : facts) {
            if (fact == null) continue;
            validate(fact);
            graph.upsertNode(fact.getSubjectId(), fact.getSubjectType(), fact.getSeverity());
            graph.upsertNode(fact.getObjectId(), fact.getObjectType(), fact.getSeverity());
            graph.addEdge(fact.getSubjectId(), fact.getObjectId(), fact.getPredicate());
        }

        log.info("graph built: facts={}, nodes={}, edges={}", facts.size(), graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    private void validate(Fact fact) {
        if (StrUtil.isBlank(fact.getSubjectId())) throw new MalformedFactException("subject_id 为空", fact);
        if (StrUtil.isBlank(fact.getObjectId())) throw new MalformedFactException("object_id 为空", fact);
        if (StrUtil.isBlank(fact.getPredicate())) throw new MalformedFactException("predicate 为空", fact);
    }
}
