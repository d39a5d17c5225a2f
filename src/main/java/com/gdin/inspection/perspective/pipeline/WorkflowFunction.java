package com.gdin.inspection.perspective.pipeline;

import com.gdin.inspection.perspective.pipeline.context.PipelineRunContext;

/**
 * 流水线中的一步：从 context 取输入，把输出写回 context。
 */
@FunctionalInterface
public interface WorkflowFunction<C> {
    WorkflowFunctionOutput run(C config, PipelineRunContext context) throws Exception;
}
