package com.gdin.inspection.perspective.pipeline.context;

import com.gdin.inspection.perspective.exception.PerspectiveException;
import com.gdin.inspection.perspective.pipeline.Pipeline;
import com.gdin.inspection.perspective.pipeline.WorkflowFunctionOutput;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 顺序执行流水线。任何一步抛异常即停止，异常记录在最后一条结果里，不向外抛出。
 */
@Slf4j
public class RunPipeline<C> {

    public List<PipelineRunResult> run(Pipeline<C> pipeline, C config, PipelineRunContext context) {
        long start = System.nanoTime();
        List<PipelineRunResult> results = new ArrayList<>();
        String last = "<startup>";

        try {
            for (Pipeline.Step<C> step : pipeline) {
                last = step.getName();
                long t0 = System.nanoTime();

                WorkflowFunctionOutput out = step.getFn().run(config, context);

                double sec = (System.nanoTime() - t0) / 1_000_000_000.0;
                context.getStats().getWorkflowSeconds().put(last, sec);
                log.debug("[{}] workflow {} finished in {}s", context.getQueryId(), last, String.format("%.3f", sec));

                results.add(PipelineRunResult.builder()
                        .workflow(last)
                        .result(out == null ? null : out.getResult())
                        .errors(null)
                        .build());

                if (out != null && out.isStop()) {
                    log.info("[{}] pipeline halted by workflow request: {}", context.getQueryId(), last);
                    break;
                }
            }

            context.getStats().setTotalSeconds((System.nanoTime() - start) / 1_000_000_000.0);
            return results;

        } catch (Exception e) {
            // 业务异常只记一行，其余打印堆栈
            if (e instanceof PerspectiveException) {
                log.warn("[{}] workflow {} failed: {}", context.getQueryId(), last, e.getMessage());
            } else {
                log.error("[{}] error running workflow {}", context.getQueryId(), last, e);
            }
            results.add(PipelineRunResult.builder()
                    .workflow(last)
                    .result(null)
                    .errors(List.of(e))
                    .build());
            context.getStats().setTotalSeconds((System.nanoTime() - start) / 1_000_000_000.0);
            return results;
        }
    }

    public static Exception firstError(List<PipelineRunResult> results) {
        for (PipelineRunResult r : results) {
            if (r.hasErrors()) return r.getErrors().get(0);
        }
        return null;
    }
}
