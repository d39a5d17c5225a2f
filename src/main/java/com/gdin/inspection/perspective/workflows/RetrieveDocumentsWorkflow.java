package com.gdin.inspection.perspective.workflows;

import com.gdin.inspection.perspective.exception.InsufficientEvidenceException;
import com.gdin.inspection.perspective.models.Document;
import com.gdin.inspection.perspective.models.Polarity;
import com.gdin.inspection.perspective.models.Query;
import com.gdin.inspection.perspective.repository.BulkLookup;
import com.gdin.inspection.perspective.repository.DocumentStore;
import com.gdin.inspection.perspective.retrieval.Retriever;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * workflow: retrieve_documents
 *
 * 输入（来自 context.state）：
 * - query
 * - document_store（可选，本次查询自带的语料；缺省为共享文档库）
 *
 * 输出（写回 context.state）：
 * - retrieved_documents
 */
@Slf4j
@Service
public class RetrieveDocumentsWorkflow {

    @Resource
    private Retriever retriever;

    @Resource
    private DocumentStore documentStore;

    public List<Document> run(Query query, DocumentStore corpus) {
        DocumentStore source = corpus == null ? documentStore : corpus;
        List<String> ids = retriever.retrieve(query, source);
        if (ids.isEmpty()) {
            // 没有任何候选文档，两边都无从谈起
            throw new InsufficientEvidenceException(query.getId(), EnumSet.allOf(Polarity.class));
        }

        BulkLookup lookup = source.getMany(ids);
        if (lookup.hasMissing()) {
            log.warn("[{}] retrieved ids missing from store: {}", query.getId(), lookup.getMissingIds());
        }
        return new ArrayList<>(lookup.getFound().values());
    }
}
