package com.gdin.inspection.perspective.similarity;

/**
 * 两段文本的语义相似度，取值 [0, 1]，1 表示完全相同。
 * 聚类（文档之间）和去重（视角之间）共用同一个实现。
 */
public interface SimilarityScorer {

    double similarity(String a, String b);
}
