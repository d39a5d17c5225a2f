package com.gdin.inspection.perspective.validation;

public enum RejectionType {
    // claim 缺失 / 立场不对 / 没有视角 / 文本为空
    MALFORMED_CLAIM_COUNT,
    // 视角没有支撑文档，或引用了未检索到的文档
    UNGROUNDED_PERSPECTIVE,
    // 同一文档同时出现在正反两条 claim 下
    CROSS_POLARITY_CITATION,
    // 同一 claim 下的两条视角近似重复
    DUPLICATE_PERSPECTIVE
}
