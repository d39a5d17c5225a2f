package com.gdin.inspection.perspective.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 一个查询的最终产物：固定两个字段，一正一反。
 */
@Value
@Jacksonized
@Builder
public class Result {

    @JsonProperty("query_id")
    String queryId;

    @JsonProperty("claim_pro")
    Claim claimPro;

    @JsonProperty("claim_con")
    Claim claimCon;

    public Claim claimFor(Polarity polarity) {
        return polarity == Polarity.PRO ? claimPro : claimCon;
    }
}
