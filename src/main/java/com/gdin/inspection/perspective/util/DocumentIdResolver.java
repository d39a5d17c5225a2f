package com.gdin.inspection.perspective.util;

import java.util.*;

/**
 * 把模型输出或标注里的 id 对应回真实文档 id。
 * <p>
 * 先按原样匹配，匹配不上再比较两边归一化后的形式（"Doc 7" / "7" / "doc_7"）。
 * 归一化后有多篇文档撞在一起时不做猜测，返回 null。
 */
public class DocumentIdResolver {

    private final Set<String> ids = new LinkedHashSet<>();
    private final Map<String, String> byNormalized = new HashMap<>();
    private final Set<String> ambiguous = new HashSet<>();

    public DocumentIdResolver(Collection<String> documentIds) {
        if (documentIds == null) return;
        for (String id : documentIds) {
            if (id == null || !ids.add(id)) continue;
            String n = DocumentIds.normalize(id);
            String previous = byNormalized.putIfAbsent(n, id);
            if (previous != null && !previous.equals(id)) ambiguous.add(n);
        }
    }

    /**
     * @return 真实文档 id，不认识时返回 null
     */
    public String resolve(String key) {
        if (key == null) return null;
        String trimmed = key.trim();
        if (ids.contains(trimmed)) return trimmed;
        String n = DocumentIds.normalize(trimmed);
        if (ids.contains(n)) return n;
        if (ambiguous.contains(n)) return null;
        return byNormalized.get(n);
    }
}
