package com.gdin.inspection.perspective.pipeline.context;

import lombok.Getter;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 单次查询的运行上下文。每个查询一个实例，不在查询之间共享。
 */
@Getter
public class PipelineRunContext {

    private final String queryId;
    private final PipelineRunStats stats = new PipelineRunStats();
    private final Map<String, Object> state = new ConcurrentHashMap<>();

    public PipelineRunContext(String queryId) {
        this.queryId = queryId;
    }

    public void put(String key, Object value) {
        // ConcurrentHashMap 不接受 null，null 等同于未设置
        if (value == null) state.remove(key);
        else state.put(key, value);
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String key) { return (T) state.get(key); }

    /**
     * 必须由前置步骤写入的值，缺失说明流水线组装有误
     */
    public <T> T require(String key) {
        T value = get(key);
        if (value == null) {
            throw new IllegalStateException("[" + queryId + "] missing pipeline state: " + key);
        }
        return value;
    }

    public Set<String> keySet() {
        return state.keySet();
    }
}
