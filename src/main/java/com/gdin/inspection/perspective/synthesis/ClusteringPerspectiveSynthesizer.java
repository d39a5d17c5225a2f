package com.gdin.inspection.perspective.synthesis;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.perspective.config.properties.PerspectiveProperties;
import com.gdin.inspection.perspective.exception.GenerationException;
import com.gdin.inspection.perspective.exception.InsufficientEvidenceException;
import com.gdin.inspection.perspective.exception.SynthesisExhaustedException;
import com.gdin.inspection.perspective.models.*;
import com.gdin.inspection.perspective.service.TextGenerator;
import com.gdin.inspection.perspective.similarity.SimilarityScorer;
import com.gdin.inspection.perspective.synthesis.prompts.PerspectivePrompts;
import com.gdin.inspection.perspective.util.ResponseUtil;
import com.gdin.inspection.perspective.util.TokenUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 先聚类再逐簇生成视角，最后生成 claim。
 * <ol>
 *   <li>ArgumentClusterer 按论点相似度把证据池分成 k 个簇（k 自适应）</li>
 *   <li>每个簇生成一句视角，支撑文档就是簇内文档</li>
 *   <li>视角两两近似重复时，合并对应的两个簇后重新生成，最多 maxAttempts 轮</li>
 *   <li>生成 claim；claim 只是复述某条视角时带反馈重新生成</li>
 * </ol>
 */
@Slf4j
public class ClusteringPerspectiveSynthesizer implements PerspectiveSynthesizer {

    private final TextGenerator textGenerator;
    private final SimilarityScorer similarityScorer;
    private final ArgumentClusterer clusterer;
    private final TokenUtil tokenUtil;
    private final PerspectiveProperties.Synthesis config;

    public ClusteringPerspectiveSynthesizer(TextGenerator textGenerator,
                                            SimilarityScorer similarityScorer,
                                            TokenUtil tokenUtil,
                                            PerspectiveProperties.Synthesis config) {
        this.textGenerator = textGenerator;
        this.similarityScorer = similarityScorer;
        this.clusterer = new ArgumentClusterer(similarityScorer);
        this.tokenUtil = tokenUtil;
        this.config = config;
    }

    @Override
    public Claim synthesize(Query query, List<Document> pool, Polarity polarity, SynthesisHints hints) {
        if (pool == null || pool.isEmpty()) {
            throw new InsufficientEvidenceException(query.getId(), EnumSet.of(polarity));
        }
        if (hints == null) hints = SynthesisHints.NONE;
        int maxAttempts = Math.max(1, config.getMaxAttempts());

        List<Document> docs = new ArrayList<>();
        for (Document d : pool) {
            if (!hints.getExcludedDocIds().contains(d.getId())) docs.add(d);
        }
        if (docs.isEmpty()) {
            throw new SynthesisExhaustedException(polarity, -1, 1,
                    "no documents left after excluding " + hints.getExcludedDocIds());
        }

        Map<String, Document> byId = new LinkedHashMap<>();
        Map<String, Integer> order = new HashMap<>();
        for (Document d : docs) {
            order.put(d.getId(), order.size());
            byId.put(d.getId(), d);
        }

        int k = ArgumentClusterer.adaptiveK(docs.size(), config.getDocsPerPerspective(), config.getMaxPerspectivesPerClaim());
        List<DocumentCluster> clusters = clusterer.cluster(docs, k, config.getClusterMergeThreshold());
        for (Set<String> group : hints.getMergeGroups()) {
            clusters = mergeGroup(clusters, group, order);
        }
        log.info("[{}][{}] {} documents -> {} clusters (k={})", query.getId(), polarity, docs.size(), clusters.size(), k);

        // 簇不变时复用已生成的视角
        Map<List<String>, String> generated = new HashMap<>();
        List<Perspective> perspectives;
        int attempt = 1;
        while (true) {
            perspectives = new ArrayList<>(clusters.size());
            List<String> siblings = new ArrayList<>();
            for (int i = 0; i < clusters.size(); i++) {
                DocumentCluster c = clusters.get(i);
                String text = generated.get(c.getDocumentIds());
                if (text == null) {
                    text = generatePerspective(query, polarity, c, i, byId, siblings, maxAttempts);
                    generated.put(c.getDocumentIds(), text);
                }
                siblings.add(text);
                perspectives.add(Perspective.builder().text(text).supportingDocIds(c.getDocumentIds()).build());
            }

            int[] dup = findDuplicate(perspectives);
            if (dup == null) break;
            log.warn("[{}][{}] perspectives {} and {} are near-duplicates (attempt {}/{})",
                    query.getId(), polarity, dup[0], dup[1], attempt, maxAttempts);
            if (attempt >= maxAttempts) {
                throw new SynthesisExhaustedException(polarity, dup[1], attempt,
                        "near-duplicate perspectives " + dup[0] + " and " + dup[1]);
            }
            DocumentCluster merged = clusters.get(dup[0]).merge(clusters.get(dup[1]), order);
            clusters = new ArrayList<>(clusters);
            clusters.set(dup[0], merged);
            clusters.remove(dup[1]);
            attempt++;
        }

        String claimText = generateClaim(query, polarity, perspectives, maxAttempts);
        return Claim.builder()
                .text(claimText)
                .polarity(polarity)
                .perspectives(perspectives)
                .build();
    }

    private String generatePerspective(Query query, Polarity polarity, DocumentCluster cluster, int clusterIndex,
                                       Map<String, Document> byId, List<String> siblings, int maxAttempts) {
        StringBuilder documents = new StringBuilder();
        for (String id : cluster.getDocumentIds()) {
            documents.append("[Doc ").append(id).append("]: ")
                    .append(tokenUtil.truncate(byId.get(id).getText(), config.getMaxDocumentTokens()))
                    .append('\n');
        }
        String avoid = "";
        if (!siblings.isEmpty()) {
            StringBuilder list = new StringBuilder();
            for (String s : siblings) list.append("- ").append(s).append('\n');
            avoid = PerspectivePrompts.AVOID_SECTION.replace("{siblings}", list.toString());
        }
        String prompt = PerspectivePrompts.PERSPECTIVE_PROMPT
                .replace("{stance}", PerspectivePrompts.stanceName(polarity))
                .replace("{avoid}", avoid)
                .replace("{query}", query.getText())
                .replace("{documents}", documents.toString());

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String text = ResponseUtil.firstSentence(callGenerator(prompt, polarity, clusterIndex, attempt));
            if (StrUtil.isNotBlank(text)) return text;
            log.warn("[{}][{}] empty perspective for cluster {} (attempt {}/{})",
                    query.getId(), polarity, clusterIndex, attempt, maxAttempts);
        }
        throw new SynthesisExhaustedException(polarity, clusterIndex, maxAttempts, "generator returned no perspective text");
    }

    private String generateClaim(Query query, Polarity polarity, List<Perspective> perspectives, int maxAttempts) {
        StringBuilder list = new StringBuilder();
        for (Perspective p : perspectives) list.append("- ").append(p.getText()).append('\n');

        String feedback = "";
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String prompt = PerspectivePrompts.CLAIM_PROMPT
                    .replace("{stance}", PerspectivePrompts.stanceName(polarity))
                    .replace("{feedback}", feedback)
                    .replace("{query}", query.getText())
                    .replace("{perspectives}", list.toString());
            String claim = ResponseUtil.firstSentence(callGenerator(prompt, polarity, -1, attempt));
            if (StrUtil.isBlank(claim)) {
                log.warn("[{}][{}] empty claim (attempt {}/{})", query.getId(), polarity, attempt, maxAttempts);
                continue;
            }
            if (!copiesPerspective(claim, perspectives)) return claim;
            log.warn("[{}][{}] claim copies a perspective, regenerating (attempt {}/{}): {}",
                    query.getId(), polarity, attempt, maxAttempts, claim);
            feedback = PerspectivePrompts.CLAIM_FEEDBACK_SECTION.replace("{previous}", claim);
        }
        throw new SynthesisExhaustedException(polarity, -1, maxAttempts, "no acceptable claim text");
    }

    private String callGenerator(String prompt, Polarity polarity, int clusterIndex, int attempt) {
        try {
            return textGenerator.generate(prompt);
        } catch (GenerationException e) {
            throw new SynthesisExhaustedException(polarity, clusterIndex, attempt, "generation failed: " + e.getMessage(), e);
        }
    }

    private boolean copiesPerspective(String claim, List<Perspective> perspectives) {
        for (Perspective p : perspectives) {
            if (sameText(claim, p.getText())) return true;
            if (similarityScorer.similarity(claim, p.getText()) >= config.getDuplicateThreshold()) return true;
        }
        return false;
    }

    /**
     * 第一对近似重复的视角下标，没有返回 null
     */
    private int[] findDuplicate(List<Perspective> perspectives) {
        for (int i = 0; i < perspectives.size(); i++) {
            for (int j = i + 1; j < perspectives.size(); j++) {
                String a = perspectives.get(i).getText();
                String b = perspectives.get(j).getText();
                if (sameText(a, b) || similarityScorer.similarity(a, b) >= config.getDuplicateThreshold()) {
                    return new int[]{i, j};
                }
            }
        }
        return null;
    }

    private static boolean sameText(String a, String b) {
        return StrUtil.equalsIgnoreCase(StrUtil.trim(StrUtil.removeSuffix(a, ".")), StrUtil.trim(StrUtil.removeSuffix(b, ".")));
    }

    private static List<DocumentCluster> mergeGroup(List<DocumentCluster> clusters, Set<String> group,
                                                    Map<String, Integer> order) {
        List<DocumentCluster> out = new ArrayList<>();
        DocumentCluster merged = null;
        int mergedAt = -1;
        for (DocumentCluster c : clusters) {
            if (c.intersects(group)) {
                if (merged == null) {
                    merged = c;
                    mergedAt = out.size();
                    out.add(c);
                } else {
                    merged = merged.merge(c, order);
                    out.set(mergedAt, merged);
                }
            } else {
                out.add(c);
            }
        }
        return out;
    }
}
