package com.gdin.inspection.perspective.workflows;

import com.gdin.inspection.perspective.models.Claim;
import com.gdin.inspection.perspective.models.Document;
import com.gdin.inspection.perspective.models.Polarity;
import com.gdin.inspection.perspective.models.Query;
import com.gdin.inspection.perspective.stance.StancePartition;
import com.gdin.inspection.perspective.synthesis.PerspectiveSynthesizer;
import com.gdin.inspection.perspective.synthesis.SynthesisHints;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * workflow: synthesize_claims
 *
 * 输入：
 * - query
 * - retrieved_documents
 * - stance_partition
 *
 * 输出：
 * - claims（Polarity -> Claim）
 *
 * 正反两个分支互不依赖，并发执行；任一分支失败整个查询失败。
 */
@Slf4j
@Service
public class SynthesizeClaimsWorkflow {

    @Resource
    private PerspectiveSynthesizer perspectiveSynthesizer;

    public Map<Polarity, Claim> run(Query query, List<Document> retrieved, StancePartition partition) {
        Map<Polarity, SynthesisHints> hints = new EnumMap<>(Polarity.class);
        for (Polarity p : Polarity.values()) hints.put(p, SynthesisHints.NONE);
        return synthesize(query, retrieved, partition, hints);
    }

    /**
     * 只合成 hints 中出现的分支
     */
    public Map<Polarity, Claim> synthesize(Query query, List<Document> retrieved, StancePartition partition,
                                          Map<Polarity, SynthesisHints> hints) {
        Map<Polarity, Claim> claims = new EnumMap<>(Polarity.class);
        if (hints.isEmpty()) return claims;

        ExecutorService pool = Executors.newFixedThreadPool(hints.size());
        try {
            Map<Polarity, CompletableFuture<Claim>> futures = new EnumMap<>(Polarity.class);
            for (Map.Entry<Polarity, SynthesisHints> e : hints.entrySet()) {
                Polarity polarity = e.getKey();
                List<Document> stancePool = poolOf(retrieved, partition.pool(polarity));
                futures.put(polarity, CompletableFuture.supplyAsync(
                        () -> perspectiveSynthesizer.synthesize(query, stancePool, polarity, e.getValue()), pool));
            }
            for (Map.Entry<Polarity, CompletableFuture<Claim>> e : futures.entrySet()) {
                claims.put(e.getKey(), join(e.getValue()));
            }
        } finally {
            pool.shutdown();
        }
        log.info("[{}] synthesized {} claim(s)", query.getId(), claims.keySet());
        return claims;
    }

    private static List<Document> poolOf(List<Document> retrieved, List<String> ids) {
        Set<String> wanted = new HashSet<>(ids);
        List<Document> out = new ArrayList<>(ids.size());
        for (Document d : retrieved) {
            if (wanted.contains(d.getId())) out.add(d);
        }
        return out;
    }

    private static Claim join(CompletableFuture<Claim> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            // 还原分支里抛出的原始异常
            if (e.getCause() instanceof RuntimeException) throw (RuntimeException) e.getCause();
            throw e;
        }
    }
}
