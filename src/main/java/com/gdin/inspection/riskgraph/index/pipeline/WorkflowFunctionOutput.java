package com.gdin.inspection.riskgraph.index.pipeline;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WorkflowFunctionOutput {
    Object result;
    // 为 true 时 RunPipeline 不再执行后续 workflow（例如空快照）
    @Builder.Default
    boolean stop = false;

    public static WorkflowFunctionOutput done(String workflow) {
        return WorkflowFunctionOutput.builder().result(workflow + "_done").build();
    }
}
