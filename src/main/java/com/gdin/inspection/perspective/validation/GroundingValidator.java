package com.gdin.inspection.perspective.validation;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.perspective.config.properties.PerspectiveProperties;
import com.gdin.inspection.perspective.models.*;
import com.gdin.inspection.perspective.similarity.SimilarityScorer;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 结果的最终把关。按顺序检查：
 * <ol>
 *   <li>两条 claim 都存在、立场正确、至少一条视角，文本非空</li>
 *   <li>每条视角至少一个支撑文档</li>
 *   <li>支撑文档都在检索结果中</li>
 *   <li>同一文档不能同时支撑正反两条 claim</li>
 *   <li>同一 claim 下没有近似重复的视角</li>
 *   <li>长度只记 warning，不拒绝</li>
 * </ol>
 * 校验不修改输入；拒绝时由调用方定向重新生成后构造新的 Result。
 */
@Slf4j
public class GroundingValidator {

    private final SimilarityScorer similarityScorer;
    private final double duplicateThreshold;
    private final PerspectiveProperties.Validation limits;

    public GroundingValidator(SimilarityScorer similarityScorer, double duplicateThreshold,
                              PerspectiveProperties.Validation limits) {
        this.similarityScorer = similarityScorer;
        this.duplicateThreshold = duplicateThreshold;
        this.limits = limits;
    }

    public ValidationOutcome validate(Result result, Set<String> retrievedIds) {
        List<RejectionReason> rejections = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (result == null) {
            for (Polarity p : Polarity.values()) {
                rejections.add(malformed(p, "result is missing"));
            }
            return ValidationOutcome.rejected(rejections, warnings);
        }

        for (Polarity p : Polarity.values()) {
            checkClaim(result.claimFor(p), p, retrievedIds, rejections, warnings);
        }
        checkCrossPolarity(result, rejections);

        String queryId = result.getQueryId();
        warnings.forEach(w -> log.warn("[{}] {}", queryId, w));
        if (!rejections.isEmpty()) {
            log.warn("[{}] result rejected: {}", queryId, rejections);
            return ValidationOutcome.rejected(rejections, warnings);
        }
        return ValidationOutcome.valid(result, warnings);
    }

    /**
     * 单条 claim 的检查（不含跨立场检查）
     */
    public List<RejectionReason> validateClaim(Claim claim, Polarity expected, Set<String> retrievedIds) {
        List<RejectionReason> rejections = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        checkClaim(claim, expected, retrievedIds, rejections, warnings);
        warnings.forEach(log::warn);
        return rejections;
    }

    private void checkClaim(Claim claim, Polarity expected, Set<String> retrievedIds,
                            List<RejectionReason> rejections, List<String> warnings) {
        // (a) 结构
        if (claim == null) {
            rejections.add(malformed(expected, "claim is missing"));
            return;
        }
        if (claim.getPolarity() != expected) {
            rejections.add(malformed(expected, "claim polarity is " + claim.getPolarity()));
            return;
        }
        if (StrUtil.isBlank(claim.getText())) {
            rejections.add(malformed(expected, "claim text is blank"));
        }
        List<Perspective> perspectives = claim.getPerspectives();
        if (CollectionUtil.isEmpty(perspectives)) {
            rejections.add(malformed(expected, "claim has no perspectives"));
            return;
        }
        for (int i = 0; i < perspectives.size(); i++) {
            Perspective p = perspectives.get(i);
            if (p == null || StrUtil.isBlank(p.getText())) {
                rejections.add(RejectionReason.builder()
                        .type(RejectionType.MALFORMED_CLAIM_COUNT)
                        .polarity(expected)
                        .perspectiveIndex(i)
                        .detail("perspective text is blank")
                        .build());
            }
        }

        // (b)(c) 证据
        for (int i = 0; i < perspectives.size(); i++) {
            Perspective p = perspectives.get(i);
            if (p == null) continue;
            List<String> ids = p.getSupportingDocIds();
            if (CollectionUtil.isEmpty(ids)) {
                rejections.add(RejectionReason.builder()
                        .type(RejectionType.UNGROUNDED_PERSPECTIVE)
                        .polarity(expected)
                        .perspectiveIndex(i)
                        .detail("perspective has no supporting documents")
                        .build());
                continue;
            }
            List<String> unknown = ids.stream().filter(id -> retrievedIds == null || !retrievedIds.contains(id)).toList();
            if (!unknown.isEmpty()) {
                rejections.add(RejectionReason.builder()
                        .type(RejectionType.UNGROUNDED_PERSPECTIVE)
                        .polarity(expected)
                        .perspectiveIndex(i)
                        .docIds(unknown)
                        .detail("cites documents that were not retrieved")
                        .build());
            }
        }

        // (d) 近似重复
        for (int i = 0; i < perspectives.size(); i++) {
            for (int j = i + 1; j < perspectives.size(); j++) {
                Perspective a = perspectives.get(i);
                Perspective b = perspectives.get(j);
                if (a == null || b == null || StrUtil.isBlank(a.getText()) || StrUtil.isBlank(b.getText())) continue;
                double sim = similarityScorer.similarity(a.getText(), b.getText());
                if (sim >= duplicateThreshold) {
                    rejections.add(RejectionReason.builder()
                            .type(RejectionType.DUPLICATE_PERSPECTIVE)
                            .polarity(expected)
                            .perspectiveIndex(i)
                            .perspectiveIndex(j)
                            .detail(String.format("similarity %.3f >= %.3f", sim, duplicateThreshold))
                            .build());
                }
            }
        }

        // (e) 长度
        if (StrUtil.isNotBlank(claim.getText())) {
            int claimWords = Document.countWords(claim.getText());
            if (claimWords > limits.getMaxClaimWords()) {
                warnings.add(expected + " claim has " + claimWords + " words (max " + limits.getMaxClaimWords() + ")");
            }
        }
        for (int i = 0; i < perspectives.size(); i++) {
            Perspective p = perspectives.get(i);
            if (p == null || StrUtil.isBlank(p.getText())) continue;
            int words = Document.countWords(p.getText());
            if (words < limits.getMinPerspectiveWords() || words > limits.getMaxPerspectiveWords()) {
                warnings.add(expected + " perspective " + i + " has " + words + " words (expected "
                        + limits.getMinPerspectiveWords() + "-" + limits.getMaxPerspectiveWords() + ")");
            }
        }
    }

    private void checkCrossPolarity(Result result, List<RejectionReason> rejections) {
        Claim pro = result.getClaimPro();
        Claim con = result.getClaimCon();
        if (pro == null || con == null || pro.getPerspectives() == null || con.getPerspectives() == null) return;

        Set<String> proIds = pro.citedDocIds();
        List<String> shared = con.citedDocIds().stream().filter(proIds::contains).toList();
        if (shared.isEmpty()) return;
        // 两边都报，由调用方按立场池决定从哪边去掉
        for (Polarity p : Polarity.values()) {
            Claim claim = result.claimFor(p);
            RejectionReason.RejectionReasonBuilder builder = RejectionReason.builder()
                    .type(RejectionType.CROSS_POLARITY_CITATION)
                    .polarity(p)
                    .docIds(shared)
                    .detail("documents cited under both claims");
            for (int i = 0; i < claim.getPerspectives().size(); i++) {
                Perspective persp = claim.getPerspectives().get(i);
                if (persp != null && persp.getSupportingDocIds() != null
                        && persp.getSupportingDocIds().stream().anyMatch(shared::contains)) {
                    builder.perspectiveIndex(i);
                }
            }
            rejections.add(builder.build());
        }
    }

    private static RejectionReason malformed(Polarity polarity, String detail) {
        return RejectionReason.builder()
                .type(RejectionType.MALFORMED_CLAIM_COUNT)
                .polarity(polarity)
                .detail(detail)
                .build();
    }
}
