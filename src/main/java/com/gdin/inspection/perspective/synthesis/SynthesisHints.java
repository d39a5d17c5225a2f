package com.gdin.inspection.perspective.synthesis;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * 校验失败后对单个分支的定向重新生成要求。
 */
@Value
@Builder
public class SynthesisHints {

    public static final SynthesisHints NONE = SynthesisHints.builder().build();

    // 不允许再被引用的文档
    @Singular("excludedDocId")
    Set<String> excludedDocIds;

    // 每组 id 所在的簇必须合并成一个（用于消除近似重复视角）
    @Singular("mergeGroup")
    List<Set<String>> mergeGroups;

    public boolean isEmpty() {
        return excludedDocIds.isEmpty() && mergeGroups.isEmpty();
    }
}
