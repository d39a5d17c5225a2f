package com.gdin.inspection.perspective.synthesis;

import lombok.Value;

import java.util.*;

/**
 * 论点簇：一组文档 id，按证据池中的顺序排列。一个簇对应一条视角。
 */
@Value
public class DocumentCluster {
    List<String> documentIds;

    public int size() {
        return documentIds.size();
    }

    public boolean intersects(Collection<String> ids) {
        for (String id : documentIds) {
            if (ids.contains(id)) return true;
        }
        return false;
    }

    /**
     * 合并两个簇，结果按 poolOrder 中的位置排序
     */
    public DocumentCluster merge(DocumentCluster other, Map<String, Integer> poolOrder) {
        List<String> ids = new ArrayList<>(documentIds.size() + other.documentIds.size());
        ids.addAll(documentIds);
        for (String id : other.documentIds) {
            if (!ids.contains(id)) ids.add(id);
        }
        ids.sort(Comparator.comparingInt(id -> poolOrder.getOrDefault(id, Integer.MAX_VALUE)));
        return new DocumentCluster(List.copyOf(ids));
    }
}
