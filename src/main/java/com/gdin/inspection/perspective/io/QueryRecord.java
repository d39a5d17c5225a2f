package com.gdin.inspection.perspective.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * 输入记录：{ "id"?, "query", "docs": {id: text}, "favor_ids"?, "against_ids"? }
 */
@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryRecord {

    @JsonProperty("id")
    String id;

    @JsonProperty("query")
    String query;

    // 保持输入顺序
    @JsonProperty("docs")
    Map<String, String> docs;

    @JsonProperty("favor_ids")
    List<String> favorIds;

    @JsonProperty("against_ids")
    List<String> againstIds;

    public boolean hasStanceLabels() {
        return (favorIds != null && !favorIds.isEmpty()) || (againstIds != null && !againstIds.isEmpty());
    }
}
