package com.gdin.inspection.perspective.run;

import com.gdin.inspection.perspective.config.properties.PerspectiveProperties;
import com.gdin.inspection.perspective.exception.PerspectiveException;
import com.gdin.inspection.perspective.io.QueryRecord;
import com.gdin.inspection.perspective.models.Document;
import com.gdin.inspection.perspective.models.Result;
import com.gdin.inspection.perspective.pipeline.Pipeline;
import com.gdin.inspection.perspective.pipeline.PipelineFactory;
import com.gdin.inspection.perspective.pipeline.context.PipelineRunContext;
import com.gdin.inspection.perspective.pipeline.context.PipelineRunResult;
import com.gdin.inspection.perspective.pipeline.context.RunPipeline;
import com.gdin.inspection.perspective.repository.DocumentStore;
import com.gdin.inspection.perspective.repository.InMemoryDocumentStore;
import com.gdin.inspection.perspective.workflows.PerspectivePipelineRegistrar;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 查询入口。
 * <p>
 * 自带文档的查询只在自己的文档上检索，不写共享库，所以不同查询可以复用同一个 id；
 * 不带文档的查询检索 {@link #loadCorpus} 预先装入的共享库。
 * 批量处理按 batch.concurrentQueries 并发，每个查询的失败只体现在自己的 {@link QueryOutcome} 中。
 */
@Slf4j
@Service
public class PerspectiveSummaryRunner {

    @Resource
    private PerspectiveProperties perspectiveProperties;

    @Resource
    private PipelineFactory<PerspectiveProperties> factory;

    @Resource
    private DocumentStore documentStore;

    /**
     * 装入共享语料
     * @throws com.gdin.inspection.perspective.exception.DocumentConflictException 已有同 id 不同正文的文档
     */
    public void loadCorpus(Collection<Document> documents) {
        documentStore.putAll(documents);
    }

    public QueryOutcome run(QueryRequest request) {
        return process(request);
    }

    public List<QueryOutcome> runRecords(List<QueryRecord> records) {
        return runAll(records.stream().map(QueryRequest::from).toList());
    }

    public List<QueryOutcome> runAll(List<QueryRequest> requests) {
        if (requests == null || requests.isEmpty()) return List.of();

        int threads = Math.max(1, Math.min(perspectiveProperties.getBatch().getConcurrentQueries(), requests.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<QueryOutcome> outcomes = new ArrayList<>(requests.size());
        try {
            List<CompletableFuture<QueryOutcome>> futures = new ArrayList<>();
            for (QueryRequest request : requests) {
                futures.add(CompletableFuture.supplyAsync(() -> process(request), pool));
            }
            for (CompletableFuture<QueryOutcome> future : futures) {
                outcomes.add(future.join());
            }
        } finally {
            pool.shutdown();
        }

        long ok = outcomes.stream().filter(QueryOutcome::isSuccess).count();
        log.info("batch finished: {} queries, {} succeeded, {} failed", outcomes.size(), ok, outcomes.size() - ok);
        return outcomes;
    }

    private QueryOutcome process(QueryRequest request) {
        String queryId = request.getQuery().getId();
        PipelineRunContext ctx = new PipelineRunContext(queryId);
        try {
            ctx.put("query", request.getQuery());
            // ==============retrieve_documents==============
            if (request.hasDocuments()) ctx.put("document_store", new InMemoryDocumentStore(request.toDocuments()));
            // ==============partition_stances==============
            ctx.put("favor_ids", request.getFavorIds());
            ctx.put("against_ids", request.getAgainstIds());

            Pipeline<PerspectiveProperties> pipeline = factory.createPipeline(PerspectivePipelineRegistrar.PIPELINE_NAME);
            List<PipelineRunResult> results = new RunPipeline<PerspectiveProperties>().run(pipeline, perspectiveProperties, ctx);

            Exception error = RunPipeline.firstError(results);
            if (error != null) return QueryOutcome.failure(queryId, error, ctx.getStats());
            Result result = ctx.get("result");
            if (result == null) {
                return QueryOutcome.failure(queryId, new PerspectiveException("pipeline produced no result"), ctx.getStats());
            }
            log.info("[{}] done in {}s", queryId, String.format("%.2f", ctx.getStats().getTotalSeconds()));
            return QueryOutcome.success(queryId, result, ctx.getStats());
        } catch (RuntimeException e) {
            log.error("[{}] query failed outside the pipeline", queryId, e);
            return QueryOutcome.failure(queryId, e, ctx.getStats());
        }
    }
}
