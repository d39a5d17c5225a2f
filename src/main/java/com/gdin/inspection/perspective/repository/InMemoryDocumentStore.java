package com.gdin.inspection.perspective.repository;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.perspective.exception.DocumentConflictException;
import com.gdin.inspection.perspective.exception.DocumentNotFoundException;
import com.gdin.inspection.perspective.models.Document;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.*;

/**
 * 内存实现：写入串行化（synchronized），每次写入生成新快照并通过 volatile 发布；
 * 读操作直接读当前快照，无锁。
 * <p>
 * 同 id 同正文重复写入不做任何事；同 id 不同正文整批拒绝。
 */
@Slf4j
@Repository
public class InMemoryDocumentStore implements DocumentStore {

    private volatile Map<String, Document> snapshot = Collections.emptyMap();

    public InMemoryDocumentStore() {
    }

    public InMemoryDocumentStore(Collection<Document> documents) {
        putAll(documents);
    }

    @Override
    public Document get(String id) {
        Document doc = id == null ? null : snapshot.get(id);
        if (doc == null) throw new DocumentNotFoundException(id);
        return doc;
    }

    @Override
    public BulkLookup getMany(Collection<String> ids) {
        Map<String, Document> current = snapshot;
        Map<String, Document> found = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        if (ids != null) {
            for (String id : ids) {
                Document doc = id == null ? null : current.get(id);
                if (doc != null) found.put(id, doc);
                else missing.add(id);
            }
        }
        return new BulkLookup(Collections.unmodifiableMap(found), Collections.unmodifiableList(missing));
    }

    @Override
    public Map<String, Document> snapshot() {
        return snapshot;
    }

    @Override
    public synchronized void putAll(Collection<Document> documents) {
        if (CollectionUtil.isEmpty(documents)) return;
        Map<String, Document> next = new LinkedHashMap<>(snapshot);
        for (Document doc : documents) {
            if (doc == null || doc.getId() == null) continue;
            Document previous = next.putIfAbsent(doc.getId(), doc);
            if (previous != null && !Objects.equals(previous.getText(), doc.getText())) {
                // 整批作废，当前快照不变
                log.warn("document {} rejected: already stored with different text", doc.getId());
                throw new DocumentConflictException(doc.getId());
            }
        }
        snapshot = Collections.unmodifiableMap(next);
        log.info("document store now holds {} documents", next.size());
    }
}
