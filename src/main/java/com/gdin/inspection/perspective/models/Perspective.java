package com.gdin.inspection.perspective.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 单条视角：一句话 + 支撑它的文档 id（有序、去重）。
 * <p>
 * 生成端不可信，所以这里不做校验，非空 / 是否属于检索结果交给 GroundingValidator。
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
public class Perspective {

    @JsonProperty("text")
    String text;

    @Singular("supportingDocId")
    @JsonProperty("doc_ids")
    List<String> supportingDocIds;
}
