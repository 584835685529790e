package com.gdin.inspection.riskgraph.index.pipeline;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * workflow 注册表 + 命名 pipeline（workflow 名称序列）。
 */
public class PipelineFactory<C> {

    private final Map<String, WorkflowFunction<C>> workflows = new LinkedHashMap<>();
    private final Map<String, List<String>> pipelines = new LinkedHashMap<>();

    public void register(String name, WorkflowFunction<C> workflow) {
        if (workflows.putIfAbsent(name, workflow) != null) {
            throw new IllegalStateException("Workflow already registered: " + name);
        }
    }

    public void registerPipeline(String name, List<String> workflowNames) {
        pipelines.put(name, List.copyOf(workflowNames));
    }

    public Pipeline<C> createPipeline(String pipelineName) {
        List<String> names = pipelines.get(pipelineName);
        if (names == null) {
            throw new IllegalArgumentException("Pipeline not registered: " + pipelineName);
        }
        Pipeline<C> pipeline = new Pipeline<>(pipelineName);
        for (String n : names) {
            WorkflowFunction<C> wf = workflows.get(n);
            if (wf == null) {
                throw new IllegalStateException("Workflow not registered: " + n);
            }
            pipeline.add(n, wf);
        }
        return pipeline;
    }
}
