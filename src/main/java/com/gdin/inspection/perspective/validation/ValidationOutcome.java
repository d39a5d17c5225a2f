package com.gdin.inspection.perspective.validation;

import com.gdin.inspection.perspective.models.Polarity;
import com.gdin.inspection.perspective.models.Result;
import lombok.Value;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 校验结果：通过时 result 非空且 rejections 为空；不通过时 result 为 null。
 */
@Value
public class ValidationOutcome {
    Result result;
    List<RejectionReason> rejections;
    List<String> warnings;

    public boolean isValid() {
        return result != null && rejections.isEmpty();
    }

    public static ValidationOutcome valid(Result result, List<String> warnings) {
        return new ValidationOutcome(result, List.of(), List.copyOf(warnings));
    }

    public static ValidationOutcome rejected(List<RejectionReason> rejections, List<String> warnings) {
        return new ValidationOutcome(null, List.copyOf(rejections), List.copyOf(warnings));
    }

    /**
     * 需要重新生成的分支
     */
    public Set<Polarity> rejectedPolarities() {
        Set<Polarity> out = EnumSet.noneOf(Polarity.class);
        for (RejectionReason r : rejections) {
            if (r.getPolarity() != null) out.add(r.getPolarity());
        }
        return out;
    }

    public List<RejectionReason> rejectionsFor(Polarity polarity) {
        return rejections.stream().filter(r -> r.getPolarity() == polarity).toList();
    }
}
