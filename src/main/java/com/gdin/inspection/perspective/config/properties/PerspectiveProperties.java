package com.gdin.inspection.perspective.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

@Data
@ConfigurationProperties(prefix = "gdin.ai.perspective")
@Component
public class PerspectiveProperties implements Serializable {
    private Llm llm = new Llm();
    private Embedding embedding = new Embedding();
    private Similarity similarity = new Similarity();
    private Retrieval retrieval = new Retrieval();
    private Stance stance = new Stance();
    private Synthesis synthesis = new Synthesis();
    private Validation validation = new Validation();
    private Generation generation = new Generation();
    private Batch batch = new Batch();

    @Data
    public static class Llm implements Serializable {
        private String baseUrl = "https://dashscope.aliyuncs.com/api/v1";
        private String apiKey;
        private String modelName = "qwen3-32b";
        private Float temperature = 0.1f;
        private Boolean enableThinking = false;
        // 单次生成的超时时间，超时视为可重试失败
        private Long timeoutMillis = 120_000L;
    }

    @Data
    public static class Embedding implements Serializable {
        private String baseUrl = "http://localhost:11434/";
        private String modelName = "bge-m3:latest";
        private Integer timeoutSeconds = 30;
        // 文本 -> 向量 的 LRU 缓存容量
        private Integer cacheSize = 2048;
    }

    @Data
    public static class Similarity implements Serializable {
        // lexical | embedding
        private String mode = "lexical";
    }

    @Data
    public static class Retrieval implements Serializable {
        // 每个查询检索的文档数（top-k），<=0 表示全部候选
        private Integer documentBudget = 6;
    }

    @Data
    public static class Stance implements Serializable {
        // 立场判定 prompt 中每篇文档的 token 上限
        private Integer maxDocumentTokens = 384;
    }

    @Data
    public static class Synthesis implements Serializable {
        // =============== 聚类 ================
        // 平均每个视角覆盖的文档数，决定自适应 k
        private Double docsPerPerspective = 1.0;
        private Integer maxPerspectivesPerClaim = 5;
        // 簇间平均相似度超过该值时即使未达到 k 也合并
        private Double clusterMergeThreshold = 0.5;

        // =============== 生成 ================
        // 视角之间相似度 >= 该值视为近似重复
        private Double duplicateThreshold = 0.75;
        // 合成 / 校验驱动的重新生成上限
        private Integer maxAttempts = 3;
        // 视角 prompt 中每篇文档的 token 上限
        private Integer maxDocumentTokens = 512;
    }

    @Data
    public static class Validation implements Serializable {
        private Integer minPerspectiveWords = 4;
        private Integer maxPerspectiveWords = 30;
        private Integer maxClaimWords = 12;
    }

    @Data
    public static class Generation implements Serializable {
        // 单次调用级别的重试（超时 / 调用失败）
        private Integer maxAttempts = 3;
        // 仅当下游是限流服务时启用指数退避
        private Boolean rateLimited = false;
        private Long backoffMillis = 500L;
        private Double backoffMultiplier = 2.0;
    }

    @Data
    public static class Batch implements Serializable {
        // 并发处理的查询数
        private Integer concurrentQueries = 4;
    }
}
