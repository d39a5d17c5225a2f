package com.gdin.inspection.perspective.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gdin.inspection.perspective.models.Claim;
import com.gdin.inspection.perspective.models.Perspective;
import com.gdin.inspection.perspective.models.Result;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 输出记录：{ "query_id", "claim_pro": {text, perspectives:[{text, doc_ids}]}, "claim_con": {...} }。
 * 查询失败时只有 query_id 和 error。
 */
@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResultRecord {

    @JsonProperty("query_id")
    String queryId;

    @JsonProperty("claim_pro")
    ClaimRecord claimPro;

    @JsonProperty("claim_con")
    ClaimRecord claimCon;

    @JsonProperty("error")
    String error;

    @Value
    @Jacksonized
    @Builder
    public static class ClaimRecord {
        @JsonProperty("text")
        String text;
        @JsonProperty("perspectives")
        List<PerspectiveRecord> perspectives;
    }

    @Value
    @Jacksonized
    @Builder
    public static class PerspectiveRecord {
        @JsonProperty("text")
        String text;
        @JsonProperty("doc_ids")
        List<String> docIds;
    }

    public static ResultRecord from(Result result) {
        return ResultRecord.builder()
                .queryId(result.getQueryId())
                .claimPro(toClaimRecord(result.getClaimPro()))
                .claimCon(toClaimRecord(result.getClaimCon()))
                .build();
    }

    public static ResultRecord failed(String queryId, String error) {
        return ResultRecord.builder().queryId(queryId).error(error).build();
    }

    private static ClaimRecord toClaimRecord(Claim claim) {
        if (claim == null) return null;
        List<PerspectiveRecord> perspectives = claim.getPerspectives().stream()
                .map(ResultRecord::toPerspectiveRecord)
                .toList();
        return ClaimRecord.builder().text(claim.getText()).perspectives(perspectives).build();
    }

    private static PerspectiveRecord toPerspectiveRecord(Perspective p) {
        return PerspectiveRecord.builder()
                .text(p.getText())
                .docIds(List.copyOf(p.getSupportingDocIds()))
                .build();
    }
}
