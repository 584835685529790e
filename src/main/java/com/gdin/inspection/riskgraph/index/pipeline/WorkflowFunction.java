package com.gdin.inspection.riskgraph.index.pipeline;

import com.gdin.inspection.riskgraph.index.pipeline.context.PipelineRunContext;

/**
 * 单个 workflow：从 context.state 取输入，把输出写回 context.state。
 */
@FunctionalInterface
public interface WorkflowFunction<C> {
    WorkflowFunctionOutput run(C config, PipelineRunContext context) throws Exception;
}
