package com.gdin.inspection.perspective.synthesis;

import com.gdin.inspection.perspective.models.Document;
import com.gdin.inspection.perspective.similarity.SimilarityScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 平均连接的凝聚层次聚类，结果确定：
 * <ol>
 *   <li>每篇文档初始为一个簇，按证据池顺序排列</li>
 *   <li>每轮合并平均相似度最高的一对簇，同分取下标最小的一对</li>
 *   <li>簇数大于 k 时一定合并；簇数不大于 k 时，只有平均相似度超过 mergeThreshold 才继续合并</li>
 * </ol>
 */
@Slf4j
@RequiredArgsConstructor
public class ArgumentClusterer {

    private final SimilarityScorer similarityScorer;

    /**
     * 自适应簇数：round(n / docsPerPerspective)，限制在 [1, min(n, maxPerspectives)]
     */
    public static int adaptiveK(int n, double docsPerPerspective, int maxPerspectives) {
        if (n <= 0) return 0;
        double ratio = docsPerPerspective <= 0 ? n : n / docsPerPerspective;
        int k = (int) Math.round(ratio);
        int upper = Math.max(1, Math.min(n, maxPerspectives));
        return Math.max(1, Math.min(k, upper));
    }

    public List<DocumentCluster> cluster(List<Document> pool, int k, double mergeThreshold) {
        if (pool == null || pool.isEmpty()) return List.of();

        int n = pool.size();
        Map<String, Integer> order = new HashMap<>();
        for (int i = 0; i < n; i++) order.put(pool.get(i).getId(), i);

        double[][] sim = new double[n][n];
        for (int i = 0; i < n; i++) {
            sim[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                double s = similarityScorer.similarity(pool.get(i).getText(), pool.get(j).getText());
                sim[i][j] = s;
                sim[j][i] = s;
            }
        }

        List<List<Integer>> clusters = new ArrayList<>();
        for (int i = 0; i < n; i++) clusters.add(new ArrayList<>(List.of(i)));

        while (clusters.size() > 1) {
            int bestA = -1;
            int bestB = -1;
            double best = -1.0;
            for (int a = 0; a < clusters.size(); a++) {
                for (int b = a + 1; b < clusters.size(); b++) {
                    double s = averageLink(sim, clusters.get(a), clusters.get(b));
                    if (s > best) {
                        best = s;
                        bestA = a;
                        bestB = b;
                    }
                }
            }
            if (clusters.size() <= k && best <= mergeThreshold) break;

            List<Integer> merged = clusters.get(bestA);
            merged.addAll(clusters.remove(bestB));
            Collections.sort(merged);
        }

        List<DocumentCluster> result = new ArrayList<>(clusters.size());
        for (List<Integer> members : clusters) {
            List<String> ids = new ArrayList<>(members.size());
            for (int idx : members) ids.add(pool.get(idx).getId());
            result.add(new DocumentCluster(List.copyOf(ids)));
        }
        log.debug("clustered {} documents into {} clusters (k={}): {}", n, result.size(), k, result);
        return result;
    }

    private static double averageLink(double[][] sim, List<Integer> a, List<Integer> b) {
        double sum = 0.0;
        for (int i : a) {
            for (int j : b) sum += sim[i][j];
        }
        return sum / (a.size() * (double) b.size());
    }
}
