package com.gdin.inspection.perspective.exception;

import com.gdin.inspection.perspective.models.Polarity;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 某个立场池为空，该查询直接失败，不输出部分结果。
 */
@Getter
public class InsufficientEvidenceException extends PerspectiveException {

    private final String queryId;
    private final Set<Polarity> emptyPolarities;

    public InsufficientEvidenceException(String queryId, Set<Polarity> emptyPolarities) {
        super("insufficient evidence for query " + queryId + ": empty pool " + emptyPolarities);
        this.queryId = queryId;
        this.emptyPolarities = Collections.unmodifiableSet(emptyPolarities.isEmpty()
                ? EnumSet.noneOf(Polarity.class)
                : EnumSet.copyOf(emptyPolarities));
    }
}
