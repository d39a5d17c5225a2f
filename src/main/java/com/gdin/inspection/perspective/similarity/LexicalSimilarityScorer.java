package com.gdin.inspection.perspective.similarity;

import com.gdin.inspection.perspective.doc.tokenizer.ITokenizer;
import lombok.RequiredArgsConstructor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 词频向量余弦相似度（去停用词），确定性、无外部调用。
 */
@RequiredArgsConstructor
public class LexicalSimilarityScorer implements SimilarityScorer {

    private final ITokenizer tokenizer;

    @Override
    public double similarity(String a, String b) {
        Map<String, Integer> va = termCounts(tokenizer.terms(a));
        Map<String, Integer> vb = termCounts(tokenizer.terms(b));
        if (va.isEmpty() || vb.isEmpty()) return 0.0;

        double dot = 0.0;
        for (Map.Entry<String, Integer> e : va.entrySet()) {
            Integer other = vb.get(e.getKey());
            if (other != null) dot += e.getValue() * (double) other;
        }
        if (dot == 0.0) return 0.0;
        return dot / (norm(va) * norm(vb));
    }

    private static Map<String, Integer> termCounts(List<String> terms) {
        Map<String, Integer> counts = new HashMap<>();
        for (String t : terms) counts.merge(t, 1, Integer::sum);
        return counts;
    }

    private static double norm(Map<String, Integer> v) {
        double sum = 0.0;
        for (int c : v.values()) sum += (double) c * c;
        return Math.sqrt(sum);
    }
}
