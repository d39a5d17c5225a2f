package com.gdin.inspection.perspective.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 争议性查询。身份只由 id 决定，文本相同的两个查询互不合并。
 */
@Value
@Jacksonized
@Builder
public class Query {

    @JsonProperty("id")
    String id;

    @JsonProperty("text")
    String text;

    public static Query of(String id, String text) {
        return Query.builder().id(id).text(text).build();
    }
}
