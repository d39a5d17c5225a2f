package com.gdin.inspection.perspective.stance;

import cn.hutool.core.collection.CollectionUtil;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.gdin.inspection.perspective.models.Document;
import com.gdin.inspection.perspective.models.Polarity;
import com.gdin.inspection.perspective.models.Query;
import com.gdin.inspection.perspective.service.TextGenerator;
import com.gdin.inspection.perspective.synthesis.prompts.StancePrompts;
import com.gdin.inspection.perspective.util.DocumentIdResolver;
import com.gdin.inspection.perspective.util.ResponseUtil;
import com.gdin.inspection.perspective.util.TokenUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 用大模型一次性给所有文档打立场标签。
 * <p>
 * 模型返回 {id: PRO|CON|NEUTRAL}；返回的 id 通过 {@link DocumentIdResolver} 对应回文档 id
 * （"Doc 205" -> "205"，"doc1" 原样命中），
 * 不认识的 id、无法解析的标签、同一文档给出矛盾标签的情况一律排除。
 */
@Slf4j
public class LlmStancePartitioner implements StancePartitioner {

    private final TextGenerator textGenerator;
    private final TokenUtil tokenUtil;
    private final int maxDocumentTokens;

    public LlmStancePartitioner(TextGenerator textGenerator, TokenUtil tokenUtil, int maxDocumentTokens) {
        this.textGenerator = textGenerator;
        this.tokenUtil = tokenUtil;
        this.maxDocumentTokens = maxDocumentTokens;
    }

    @Override
    public StancePartition partition(Query query, List<Document> documents) {
        if (CollectionUtil.isEmpty(documents)) {
            return new StancePartition(List.of(), List.of(), List.of());
        }

        String prompt = StancePrompts.STANCE_CLASSIFICATION_PROMPT
                .replace("{query}", query.getText())
                .replace("{documents}", formatDocuments(documents));
        DocumentIdResolver resolver = new DocumentIdResolver(documents.stream().map(Document::getId).toList());
        Map<String, Polarity> labels = parseLabels(query, textGenerator.generate(prompt), resolver);

        List<String> pro = new ArrayList<>();
        List<String> con = new ArrayList<>();
        List<String> excluded = new ArrayList<>();
        for (Document doc : documents) {
            Polarity p = labels.get(doc.getId());
            if (p == Polarity.PRO) pro.add(doc.getId());
            else if (p == Polarity.CON) con.add(doc.getId());
            else excluded.add(doc.getId());
        }
        log.info("[{}] stance partition: pro={}, con={}, excluded={}", query.getId(), pro, con, excluded);
        return new StancePartition(List.copyOf(pro), List.copyOf(con), List.copyOf(excluded));
    }

    private String formatDocuments(List<Document> documents) {
        StringBuilder sb = new StringBuilder();
        for (Document doc : documents) {
            sb.append("[Doc ").append(doc.getId()).append("]: ")
                    .append(tokenUtil.truncate(doc.getText(), maxDocumentTokens))
                    .append('\n');
        }
        return sb.toString();
    }

    private Map<String, Polarity> parseLabels(Query query, String response, DocumentIdResolver resolver) {
        JSONObject json;
        try {
            json = ResponseUtil.getJSONResponse(response);
        } catch (JSONException e) {
            log.warn("[{}] stance response is not valid JSON, all documents excluded: {}", query.getId(), e.getMessage());
            return Map.of();
        }

        Map<String, Polarity> labels = new HashMap<>();
        Set<String> conflicting = new HashSet<>();
        List<String> unknown = new ArrayList<>();
        for (String rawKey : json.keySet()) {
            String id = resolver.resolve(rawKey);
            if (id == null) {
                unknown.add(rawKey);
                continue;
            }
            Polarity p = Polarity.parseLoose(json.getString(rawKey));
            if (p == null) continue;
            Polarity previous = labels.putIfAbsent(id, p);
            if (previous != null && previous != p) conflicting.add(id);
        }
        if (!unknown.isEmpty()) {
            log.warn("[{}] stance labels for unknown documents ignored: {}", query.getId(), unknown);
        }
        if (!conflicting.isEmpty()) {
            log.warn("[{}] conflicting stance labels, excluded: {}", query.getId(), conflicting);
            conflicting.forEach(labels::remove);
        }
        return labels;
    }
}
