package com.gdin.inspection.perspective.pipeline.context;

import lombok.Getter;
import lombok.Setter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

@Getter
public class PipelineRunStats {

    private final Map<String, Double> workflowSeconds = new ConcurrentHashMap<>();

    // 校验驱动的重新生成轮数
    private final AtomicInteger regenerationRounds = new AtomicInteger();

    @Setter
    private double totalSeconds;
}
