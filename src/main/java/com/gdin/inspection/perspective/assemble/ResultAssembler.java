package com.gdin.inspection.perspective.assemble;

import com.gdin.inspection.perspective.io.ResultRecord;
import com.gdin.inspection.perspective.models.Claim;
import com.gdin.inspection.perspective.models.Query;
import com.gdin.inspection.perspective.models.Result;

/**
 * 纯组装，不做校验。
 */
public class ResultAssembler {

    public Result assemble(Query query, Claim proClaim, Claim conClaim) {
        return Result.builder()
                .queryId(query.getId())
                .claimPro(proClaim)
                .claimCon(conClaim)
                .build();
    }

    public ResultRecord toOutputRecord(Result result) {
        return ResultRecord.from(result);
    }
}
