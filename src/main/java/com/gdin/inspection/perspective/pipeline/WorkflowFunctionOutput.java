package com.gdin.inspection.perspective.pipeline;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WorkflowFunctionOutput {
    Object result;
    // true 时后续步骤不再执行
    @Builder.Default
    boolean stop = false;

    public static WorkflowFunctionOutput done(String stepName) {
        return WorkflowFunctionOutput.builder().result(stepName + "_done").build();
    }
}
