package com.gdin.inspection.riskgraph.index.pipeline.context;

import lombok.Getter;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 一次运行的共享状态：workflow 之间只通过 state 传值。
 * ConcurrentHashMap 不接受 null，put(null) 等价于 remove。
 */
@Getter
public class PipelineRunContext {

    private final PipelineRunStats stats = new PipelineRunStats();
    private final Map<String, Object> state = new ConcurrentHashMap<>();

    public void put(String key, Object value) {
        if (value == null) {
            state.remove(key);
        } else {
            state.put(key, value);
        }
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        return (T) state.get(key);
    }

    @SuppressWarnings("unchecked")
    public <T> T getOrDefault(String key, T defaultValue) {
        Object v = state.get(key);
        return v == null ? defaultValue : (T) v;
    }

    /**
     * 取上游 workflow 的必需输出，缺失说明 pipeline 顺序配错了。
     */
    public <T> T require(String key) {
        T v = get(key);
        if (v == null) {
            throw new IllegalStateException("pipeline state missing: " + key);
        }
        return v;
    }

    public Set<String> keySet() {
        return state.keySet();
    }
}
