package com.gdin.inspection.perspective.retrieval;

import com.gdin.inspection.perspective.models.Query;
import com.gdin.inspection.perspective.repository.DocumentStore;

import java.util.List;

/**
 * 按相关度检索文档 id。
 * <p>
 * 对同一 (query, 语料) 结果确定；语料非空时结果非空；语料为空返回空列表。
 */
public interface Retriever {

    /**
     * 在共享文档库上检索
     */
    List<String> retrieve(Query query);

    /**
     * 在给定语料上检索，idf 也只按这份语料计算
     */
    List<String> retrieve(Query query, DocumentStore corpus);

    /**
     * 带分数的完整排序，不截断
     */
    List<ScoredDocument> score(Query query, DocumentStore corpus);
}
