package com.gdin.inspection.perspective.pipeline.context;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PipelineRunResult {
    String workflow;
    Object result;
    List<Exception> errors;

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}
