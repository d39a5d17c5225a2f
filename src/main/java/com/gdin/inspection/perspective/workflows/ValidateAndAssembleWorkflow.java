package com.gdin.inspection.perspective.workflows;

import com.gdin.inspection.perspective.assemble.ResultAssembler;
import com.gdin.inspection.perspective.config.properties.PerspectiveProperties;
import com.gdin.inspection.perspective.exception.SynthesisExhaustedException;
import com.gdin.inspection.perspective.models.*;
import com.gdin.inspection.perspective.pipeline.context.PipelineRunStats;
import com.gdin.inspection.perspective.stance.StancePartition;
import com.gdin.inspection.perspective.synthesis.SynthesisHints;
import com.gdin.inspection.perspective.validation.GroundingValidator;
import com.gdin.inspection.perspective.validation.RejectionReason;
import com.gdin.inspection.perspective.validation.RejectionType;
import com.gdin.inspection.perspective.validation.ValidationOutcome;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * workflow: validate_and_assemble
 *
 * 输入：
 * - query
 * - retrieved_documents
 * - stance_partition
 * - claims
 *
 * 输出：
 * - result（只有校验通过的 Result 才会写入）
 *
 * 校验不通过时只重新生成被拒绝的分支，并把拒绝原因转换成 {@link SynthesisHints}；
 * 最多 synthesis.maxAttempts 轮。
 */
@Slf4j
@Service
public class ValidateAndAssembleWorkflow {

    @Resource
    private GroundingValidator groundingValidator;

    @Resource
    private ResultAssembler resultAssembler;

    @Resource
    private SynthesizeClaimsWorkflow synthesizeClaimsWorkflow;

    @Resource
    private PerspectiveProperties perspectiveProperties;

    public Result run(Query query, List<Document> retrieved, StancePartition partition,
                      Map<Polarity, Claim> initialClaims, PipelineRunStats stats) {
        Set<String> retrievedIds = new LinkedHashSet<>();
        for (Document d : retrieved) retrievedIds.add(d.getId());

        int maxAttempts = Math.max(1, perspectiveProperties.getSynthesis().getMaxAttempts());
        Map<Polarity, Claim> claims = new EnumMap<>(initialClaims);
        // 同一分支的排除项跨轮累积
        Map<Polarity, Set<String>> excluded = new EnumMap<>(Polarity.class);

        for (int attempt = 1; ; attempt++) {
            Result candidate = resultAssembler.assemble(query, claims.get(Polarity.PRO), claims.get(Polarity.CON));
            ValidationOutcome outcome = groundingValidator.validate(candidate, retrievedIds);
            if (outcome.isValid()) {
                log.info("[{}] result accepted after {} validation round(s)", query.getId(), attempt);
                return outcome.getResult();
            }

            RejectionReason first = outcome.getRejections().get(0);
            if (attempt >= maxAttempts) {
                int index = first.getPerspectiveIndexes().isEmpty() ? -1 : first.getPerspectiveIndexes().get(0);
                throw new SynthesisExhaustedException(first.getPolarity(), index, attempt,
                        "validation still failing: " + outcome.getRejections());
            }

            Map<Polarity, SynthesisHints> hints = new EnumMap<>(Polarity.class);
            for (Polarity p : outcome.rejectedPolarities()) {
                SynthesisHints h = toHints(p, outcome.rejectionsFor(p), claims.get(p), partition, excluded);
                if (h != null) hints.put(p, h);
            }
            if (hints.isEmpty()) {
                // 拒绝原因无法通过重新生成消除
                throw new SynthesisExhaustedException(first.getPolarity(), -1, attempt,
                        "no regeneration can fix: " + outcome.getRejections());
            }
            log.info("[{}] regenerating {} (round {}/{})", query.getId(), hints.keySet(), attempt + 1, maxAttempts);
            if (stats != null) stats.getRegenerationRounds().incrementAndGet();
            claims.putAll(synthesizeClaimsWorkflow.synthesize(query, retrieved, partition, hints));
        }
    }

    /**
     * 把拒绝原因翻译成定向重新生成要求；该分支无需重新生成时返回 null
     */
    SynthesisHints toHints(Polarity polarity, List<RejectionReason> rejections, Claim claim,
                           StancePartition partition, Map<Polarity, Set<String>> excluded) {
        Set<String> exclude = excluded.computeIfAbsent(polarity, k -> new LinkedHashSet<>());
        SynthesisHints.SynthesisHintsBuilder builder = SynthesisHints.builder();
        boolean regenerate = false;

        for (RejectionReason r : rejections) {
            if (r.getType() == RejectionType.CROSS_POLARITY_CITATION) {
                // 文档只保留在它所属的立场池里
                List<String> own = partition.pool(polarity);
                for (String id : r.getDocIds()) {
                    if (!own.contains(id)) {
                        exclude.add(id);
                        regenerate = true;
                    }
                }
            } else if (r.getType() == RejectionType.UNGROUNDED_PERSPECTIVE) {
                exclude.addAll(r.getDocIds());
                regenerate = true;
            } else if (r.getType() == RejectionType.DUPLICATE_PERSPECTIVE) {
                Set<String> group = new LinkedHashSet<>();
                if (claim != null) {
                    for (int idx : r.getPerspectiveIndexes()) {
                        if (idx >= 0 && idx < claim.getPerspectives().size()) {
                            group.addAll(claim.getPerspectives().get(idx).getSupportingDocIds());
                        }
                    }
                }
                if (!group.isEmpty()) builder.mergeGroup(group);
                regenerate = true;
            } else {
                regenerate = true;
            }
        }
        if (!regenerate) return null;
        return builder.excludedDocIds(exclude).build();
    }
}
