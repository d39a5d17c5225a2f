package com.gdin.inspection.perspective.similarity;

import cn.hutool.cache.CacheUtil;
import cn.hutool.cache.impl.LRUCache;
import cn.hutool.core.util.StrUtil;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.CosineSimilarity;
import lombok.extern.slf4j.Slf4j;

/**
 * 向量余弦相似度。同一段文本在聚类和去重中会被反复比较，向量走 LRU 缓存。
 * 超时由 EmbeddingModel 自身的 timeout 控制。
 */
@Slf4j
public class EmbeddingSimilarityScorer implements SimilarityScorer {

    private final EmbeddingModel embeddingModel;
    private final LRUCache<String, Embedding> cache;

    public EmbeddingSimilarityScorer(EmbeddingModel embeddingModel, int cacheSize) {
        this.embeddingModel = embeddingModel;
        this.cache = CacheUtil.newLRUCache(Math.max(1, cacheSize));
    }

    @Override
    public double similarity(String a, String b) {
        if (StrUtil.isBlank(a) || StrUtil.isBlank(b)) return 0.0;
        double cos = CosineSimilarity.between(embed(a), embed(b));
        // 负相关按不相似处理
        return Math.max(0.0, Math.min(1.0, cos));
    }

    private Embedding embed(String text) {
        return cache.get(text, () -> {
            log.debug("embedding text of length {}", text.length());
            return embeddingModel.embed(text).content();
        });
    }
}
