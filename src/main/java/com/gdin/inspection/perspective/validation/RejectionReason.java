package com.gdin.inspection.perspective.validation;

import com.gdin.inspection.perspective.models.Polarity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 一条校验失败原因，定位到立场和视角下标，供定向重新生成使用。
 */
@Value
@Builder
public class RejectionReason {
    RejectionType type;
    Polarity polarity;
    @Singular("perspectiveIndex")
    List<Integer> perspectiveIndexes;
    // 涉及的文档 id（未检索到的 / 跨立场引用的）
    @Singular("docId")
    List<String> docIds;
    String detail;

    @Override
    public String toString() {
        return type + "[" + polarity + ", perspectives=" + perspectiveIndexes
                + (docIds.isEmpty() ? "" : ", docs=" + docIds) + "]: " + detail;
    }
}
