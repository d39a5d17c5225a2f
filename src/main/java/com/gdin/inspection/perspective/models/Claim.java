package com.gdin.inspection.perspective.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Value
@Jacksonized
@Builder(toBuilder = true)
public class Claim {

    @JsonProperty("text")
    String text;

    @JsonIgnore
    Polarity polarity;

    @Singular
    @JsonProperty("perspectives")
    List<Perspective> perspectives;

    /**
     * 该 claim 下所有视角引用到的文档 id（保持首次出现顺序）。
     */
    @JsonIgnore
    public Set<String> citedDocIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (Perspective p : perspectives) {
            if (p != null && p.getSupportingDocIds() != null) ids.addAll(p.getSupportingDocIds());
        }
        return ids;
    }
}
