package com.gdin.inspection.perspective.repository;

import com.gdin.inspection.perspective.models.Document;

import java.util.Collection;
import java.util.Map;

/**
 * 证据文档存储契约。对其他组件只读；写入由实现保证单写者。
 */
public interface DocumentStore {

    /**
     * 单文档查找
     * @param id 文档 id
     * @return 文档
     * @throws com.gdin.inspection.perspective.exception.DocumentNotFoundException 不存在时
     */
    Document get(String id);

    /**
     * 批量查找：未知 id 静默跳过并记录在 {@link BulkLookup#getMissingIds()} 中，从不抛异常
     * @param ids 文档 id（按此顺序返回）
     */
    BulkLookup getMany(Collection<String> ids);

    /**
     * 当前快照（不可变），读操作不加锁
     */
    Map<String, Document> snapshot();

    /**
     * 批量写入。已存在的 id 正文相同时忽略
     * @throws com.gdin.inspection.perspective.exception.DocumentConflictException 同 id 正文不同，此时整批都不写入
     */
    void putAll(Collection<Document> documents);

    default int size() {
        return snapshot().size();
    }
}
