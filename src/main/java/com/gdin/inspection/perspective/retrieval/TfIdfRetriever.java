package com.gdin.inspection.perspective.retrieval;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.perspective.config.properties.PerspectiveProperties;
import com.gdin.inspection.perspective.doc.tokenizer.ITokenizer;
import com.gdin.inspection.perspective.models.Document;
import com.gdin.inspection.perspective.models.Query;
import com.gdin.inspection.perspective.repository.DocumentStore;
import com.gdin.inspection.perspective.util.DocumentIds;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * TF-IDF 余弦相似度检索。
 * <ul>
 *   <li>idf 使用平滑形式 ln((1+N)/(1+df)) + 1，N 为候选集大小</li>
 *   <li>tf·idf 向量做 l2 归一化后点积即为余弦</li>
 *   <li>分数降序，同分按文档 id 升序（数字 id 按数值）</li>
 * </ul>
 * 分数为 0 的文档依然参与排序，所以语料非空时结果一定非空。
 */
@Slf4j
public class TfIdfRetriever implements Retriever {

    private final DocumentStore documentStore;
    private final ITokenizer tokenizer;
    private final int documentBudget;

    public TfIdfRetriever(DocumentStore documentStore, ITokenizer tokenizer, int documentBudget) {
        this.documentStore = documentStore;
        this.tokenizer = tokenizer;
        this.documentBudget = documentBudget;
    }

    public TfIdfRetriever(DocumentStore documentStore, ITokenizer tokenizer, PerspectiveProperties properties) {
        this(documentStore, tokenizer, properties.getRetrieval().getDocumentBudget());
    }

    @Override
    public List<String> retrieve(Query query) {
        return retrieve(query, documentStore);
    }

    @Override
    public List<String> retrieve(Query query, DocumentStore corpus) {
        List<ScoredDocument> scored = score(query, corpus);
        int limit = documentBudget <= 0 ? scored.size() : Math.min(documentBudget, scored.size());
        List<String> ids = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) ids.add(scored.get(i).getDocumentId());
        log.info("[{}] retrieved {} of {} candidate documents: {}", query.getId(), ids.size(), scored.size(), ids);
        return ids;
    }

    @Override
    public List<ScoredDocument> score(Query query, DocumentStore corpus) {
        if (corpus == null) return List.of();
        // 读一次快照，整个打分过程看到的是同一份语料
        Map<String, Document> docs = corpus.snapshot();
        if (CollectionUtil.isEmpty(docs)) return List.of();

        // 1) 分词 + 文档频率
        Map<String, Map<String, Integer>> termCounts = new LinkedHashMap<>();
        Map<String, Integer> df = new HashMap<>();
        for (Document doc : docs.values()) {
            Map<String, Integer> tc = countTerms(tokenizer.terms(doc.getText()));
            termCounts.put(doc.getId(), tc);
            for (String term : tc.keySet()) df.merge(term, 1, Integer::sum);
        }

        int n = docs.size();
        Map<String, Double> idf = new HashMap<>();
        for (Map.Entry<String, Integer> e : df.entrySet()) {
            idf.put(e.getKey(), Math.log((1.0 + n) / (1.0 + e.getValue())) + 1.0);
        }

        // 2) 查询向量：只保留语料里出现过的词
        Map<String, Double> queryVec = new HashMap<>();
        for (Map.Entry<String, Integer> e : countTerms(tokenizer.terms(query.getText())).entrySet()) {
            Double w = idf.get(e.getKey());
            if (w != null) queryVec.put(e.getKey(), e.getValue() * w);
        }
        normalize(queryVec);

        // 3) 余弦
        List<ScoredDocument> scored = new ArrayList<>(n);
        for (Map.Entry<String, Map<String, Integer>> entry : termCounts.entrySet()) {
            double score = 0.0;
            if (!queryVec.isEmpty()) {
                Map<String, Double> docVec = new HashMap<>();
                for (Map.Entry<String, Integer> e : entry.getValue().entrySet()) {
                    docVec.put(e.getKey(), e.getValue() * idf.get(e.getKey()));
                }
                normalize(docVec);
                for (Map.Entry<String, Double> q : queryVec.entrySet()) {
                    Double d = docVec.get(q.getKey());
                    if (d != null) score += q.getValue() * d;
                }
            }
            scored.add(new ScoredDocument(entry.getKey(), score));
        }

        scored.sort(Comparator.comparingDouble(ScoredDocument::getScore).reversed()
                .thenComparing(ScoredDocument::getDocumentId, DocumentIds.ASCENDING));
        return scored;
    }

    private static Map<String, Integer> countTerms(List<String> terms) {
        Map<String, Integer> counts = new HashMap<>();
        for (String t : terms) counts.merge(t, 1, Integer::sum);
        return counts;
    }

    private static void normalize(Map<String, Double> vec) {
        double sum = 0.0;
        for (double v : vec.values()) sum += v * v;
        if (sum == 0.0) return;
        double norm = Math.sqrt(sum);
        vec.replaceAll((k, v) -> v / norm);
    }
}
