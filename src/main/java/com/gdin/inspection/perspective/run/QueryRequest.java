package com.gdin.inspection.perspective.run;

import com.gdin.inspection.perspective.io.QueryRecord;
import com.gdin.inspection.perspective.models.Document;
import com.gdin.inspection.perspective.models.Query;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次查询请求。documents 非空时只在这些文档上检索，为空时检索共享文档库。
 */
@Value
@Builder
public class QueryRequest {
    Query query;
    // id -> text，保持输入顺序
    Map<String, String> documents;
    List<String> favorIds;
    List<String> againstIds;

    public static QueryRequest from(QueryRecord record) {
        return QueryRequest.builder()
                .query(Query.of(record.getId(), record.getQuery()))
                .documents(record.getDocs() == null ? null : new LinkedHashMap<>(record.getDocs()))
                .favorIds(record.getFavorIds())
                .againstIds(record.getAgainstIds())
                .build();
    }

    public boolean hasDocuments() {
        return documents != null && !documents.isEmpty();
    }

    public List<Document> toDocuments() {
        List<Document> docs = new ArrayList<>();
        if (documents == null) return docs;
        documents.forEach((id, text) -> docs.add(Document.of(id, text)));
        return docs;
    }
}
