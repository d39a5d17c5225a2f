package com.gdin.inspection.perspective.pipeline;

import lombok.Getter;
import lombok.Value;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * 有序的命名步骤列表，由 {@link PipelineFactory} 按注册名组装。
 */
public class Pipeline<C> implements Iterable<Pipeline.Step<C>> {

    @Value
    public static class Step<C> {
        String name;
        WorkflowFunction<C> fn;
    }

    @Getter
    private final String name;
    private final List<Step<C>> steps = new ArrayList<>();

    public Pipeline(String name) {
        this.name = name;
    }

    public Pipeline<C> add(String stepName, WorkflowFunction<C> fn) {
        steps.add(new Step<>(stepName, fn));
        return this;
    }

    @Override
    public Iterator<Step<C>> iterator() {
        return steps.iterator();
    }
}
