package com.gdin.inspection.perspective.workflows;

import com.gdin.inspection.perspective.config.properties.PerspectiveProperties;
import com.gdin.inspection.perspective.models.Claim;
import com.gdin.inspection.perspective.models.Document;
import com.gdin.inspection.perspective.models.Polarity;
import com.gdin.inspection.perspective.models.Query;
import com.gdin.inspection.perspective.models.Result;
import com.gdin.inspection.perspective.pipeline.PipelineFactory;
import com.gdin.inspection.perspective.pipeline.WorkflowFunctionOutput;
import com.gdin.inspection.perspective.stance.StancePartition;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.Resource;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class PerspectivePipelineRegistrar {

    public static final String PIPELINE_NAME = "perspective_summary";

    @Resource
    private RetrieveDocumentsWorkflow retrieveDocumentsWorkflow;
    @Resource
    private PartitionStancesWorkflow partitionStancesWorkflow;
    @Resource
    private SynthesizeClaimsWorkflow synthesizeClaimsWorkflow;
    @Resource
    private ValidateAndAssembleWorkflow validateAndAssembleWorkflow;

    @Resource
    private PipelineFactory<PerspectiveProperties> factory;

    @PostConstruct
    public void init() {

        // 1) retrieve_documents
        factory.register("retrieve_documents", (cfg, ctx) -> {
            List<Document> retrieved = retrieveDocumentsWorkflow.run(
                    ctx.require("query"),
                    ctx.get("document_store")
            );
            ctx.put("retrieved_documents", retrieved);
            return WorkflowFunctionOutput.done("retrieve_documents");
        });

        // 2) partition_stances
        factory.register("partition_stances", (cfg, ctx) -> {
            StancePartition partition = partitionStancesWorkflow.run(
                    ctx.require("query"),
                    ctx.require("retrieved_documents"),
                    ctx.get("favor_ids"),
                    ctx.get("against_ids")
            );
            ctx.put("stance_partition", partition);
            return WorkflowFunctionOutput.done("partition_stances");
        });

        // 3) synthesize_claims
        factory.register("synthesize_claims", (cfg, ctx) -> {
            Map<Polarity, Claim> claims = synthesizeClaimsWorkflow.run(
                    ctx.require("query"),
                    ctx.require("retrieved_documents"),
                    ctx.require("stance_partition")
            );
            ctx.put("claims", claims);
            return WorkflowFunctionOutput.done("synthesize_claims");
        });

        // 4) validate_and_assemble
        factory.register("validate_and_assemble", (cfg, ctx) -> {
            Query query = ctx.require("query");
            Result result = validateAndAssembleWorkflow.run(
                    query,
                    ctx.require("retrieved_documents"),
                    ctx.require("stance_partition"),
                    ctx.require("claims"),
                    ctx.getStats()
            );
            ctx.put("result", result);
            return WorkflowFunctionOutput.done("validate_and_assemble");
        });

        factory.registerPipeline(PIPELINE_NAME, List.of(
                "retrieve_documents",
                "partition_stances",
                "synthesize_claims",
                "validate_and_assemble"
        ));
    }
}
