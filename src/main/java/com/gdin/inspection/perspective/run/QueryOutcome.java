package com.gdin.inspection.perspective.run;

import com.gdin.inspection.perspective.io.ResultRecord;
import com.gdin.inspection.perspective.models.Result;
import com.gdin.inspection.perspective.pipeline.context.PipelineRunStats;
import lombok.Value;

/**
 * 单个查询的处理结果：要么有 result，要么有 error，不会两者都有。
 */
@Value
public class QueryOutcome {
    String queryId;
    Result result;
    Exception error;
    PipelineRunStats stats;

    public static QueryOutcome success(String queryId, Result result, PipelineRunStats stats) {
        return new QueryOutcome(queryId, result, null, stats);
    }

    public static QueryOutcome failure(String queryId, Exception error, PipelineRunStats stats) {
        return new QueryOutcome(queryId, null, error, stats);
    }

    public boolean isSuccess() {
        return result != null && error == null;
    }

    public ResultRecord toRecord() {
        if (isSuccess()) return ResultRecord.from(result);
        return ResultRecord.failed(queryId, error == null ? "no result" : error.getMessage());
    }
}
