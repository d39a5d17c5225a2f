package com.gdin.inspection.perspective.pipeline;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

public class PipelineFactory<C> {

    private final Map<String, WorkflowFunction<C>> workflows = new ConcurrentHashMap<>();
    private final Map<String, List<String>> pipelines = new ConcurrentHashMap<>();

    public void register(String name, WorkflowFunction<C> workflow) {
        workflows.put(name, workflow);
    }

    public void registerPipeline(String name, List<String> workflowNames) {
        pipelines.put(name, List.copyOf(workflowNames));
    }

    public boolean hasPipeline(String name) {
        return pipelines.containsKey(name);
    }

    /**
     * 按注册顺序组装；未注册的流水线或步骤直接报错，避免静默跑一个空流水线
     */
    public Pipeline<C> createPipeline(String pipelineName) {
        List<String> names = pipelines.get(pipelineName);
        if (names == null) {
            throw new IllegalStateException("Pipeline not registered: " + pipelineName);
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
