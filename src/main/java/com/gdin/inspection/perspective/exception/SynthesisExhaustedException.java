package com.gdin.inspection.perspective.exception;

import com.gdin.inspection.perspective.models.Polarity;
import lombok.Getter;

/**
 * 重新生成次数用尽。clusterIndex 为 -1 表示问题不在某个具体簇上（例如 claim 本身）。
 */
@Getter
public class SynthesisExhaustedException extends PerspectiveException {

    private final Polarity polarity;
    private final int clusterIndex;
    private final int attempts;

    public SynthesisExhaustedException(Polarity polarity, int clusterIndex, int attempts, String detail) {
        this(polarity, clusterIndex, attempts, detail, null);
    }

    public SynthesisExhaustedException(Polarity polarity, int clusterIndex, int attempts, String detail, Throwable cause) {
        super("synthesis exhausted after " + attempts + " attempt(s): polarity=" + polarity
                + ", cluster=" + clusterIndex + ", detail=" + detail, cause);
        this.polarity = polarity;
        this.clusterIndex = clusterIndex;
        this.attempts = attempts;
    }
}
