package com.gdin.inspection.riskgraph.index.workflows;

import com.gdin.inspection.riskgraph.index.graph.GraphBuilder;
import com.gdin.inspection.riskgraph.index.graph.KnowledgeGraph;
import com.gdin.inspection.riskgraph.models.Fact;
import jakarta.annotation.Resource;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * workflow: build_graph
 *
 * 输入：facts；输出：graph
 */
@Service
public class BuildGraphWorkflow {

    @Resource
    private GraphBuilder graphBuilder;

    public KnowledgeGraph run(List<Fact> facts) {
        return graphBuilder.build(facts);
    }
}
