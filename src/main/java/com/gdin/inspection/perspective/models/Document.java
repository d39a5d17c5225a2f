package com.gdin.inspection.perspective.models;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Document {

    @JsonProperty("id")
    String id;

    @JsonProperty("text")
    String text;

    @JsonProperty("word_count")
    Integer wordCount;

    public static Document of(String id, String text) {
        return Document.builder()
                .id(id)
                .text(text)
                .wordCount(countWords(text))
                .build();
    }

    /**
     * 按空白切分计数
     */
    public static int countWords(String text) {
        if (StrUtil.isBlank(text)) return 0;
        return text.trim().split("\\s+").length;
    }
}
