package com.gdin.inspection.perspective.config;

import com.gdin.inspection.perspective.assemble.ResultAssembler;
import com.gdin.inspection.perspective.config.properties.PerspectiveProperties;
import com.gdin.inspection.perspective.doc.tokenizer.ITokenizer;
import com.gdin.inspection.perspective.pipeline.PipelineFactory;
import com.gdin.inspection.perspective.repository.DocumentStore;
import com.gdin.inspection.perspective.retrieval.Retriever;
import com.gdin.inspection.perspective.retrieval.TfIdfRetriever;
import com.gdin.inspection.perspective.service.TextGenerator;
import com.gdin.inspection.perspective.similarity.EmbeddingSimilarityScorer;
import com.gdin.inspection.perspective.similarity.LexicalSimilarityScorer;
import com.gdin.inspection.perspective.similarity.SimilarityScorer;
import com.gdin.inspection.perspective.stance.LlmStancePartitioner;
import com.gdin.inspection.perspective.stance.StancePartitioner;
import com.gdin.inspection.perspective.synthesis.ClusteringPerspectiveSynthesizer;
import com.gdin.inspection.perspective.synthesis.PerspectiveSynthesizer;
import com.gdin.inspection.perspective.util.TokenUtil;
import com.gdin.inspection.perspective.validation.GroundingValidator;
import dev.langchain4j.model.embedding.EmbeddingModel;
import jakarta.annotation.Resource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PerspectiveConfig {
    @Resource
    private PerspectiveProperties perspectiveProperties;

    @Bean
    protected PipelineFactory<PerspectiveProperties> pipelineFactory() {
        return new PipelineFactory<>();
    }

    @Bean
    public Retriever retriever(DocumentStore documentStore, ITokenizer tokenizer) {
        return new TfIdfRetriever(documentStore, tokenizer, perspectiveProperties);
    }

    @Bean
    @ConditionalOnProperty(prefix = "gdin.ai.perspective.similarity", name = "mode", havingValue = "lexical", matchIfMissing = true)
    public SimilarityScorer lexicalSimilarityScorer(ITokenizer tokenizer) {
        return new LexicalSimilarityScorer(tokenizer);
    }

    @Bean
    @ConditionalOnProperty(prefix = "gdin.ai.perspective.similarity", name = "mode", havingValue = "embedding")
    public SimilarityScorer embeddingSimilarityScorer(EmbeddingModel embeddingModel) {
        return new EmbeddingSimilarityScorer(embeddingModel, perspectiveProperties.getEmbedding().getCacheSize());
    }

    @Bean
    public StancePartitioner stancePartitioner(TextGenerator textGenerator, TokenUtil tokenUtil) {
        return new LlmStancePartitioner(textGenerator, tokenUtil, perspectiveProperties.getStance().getMaxDocumentTokens());
    }

    @Bean
    public PerspectiveSynthesizer perspectiveSynthesizer(TextGenerator textGenerator,
                                                         SimilarityScorer similarityScorer,
                                                         TokenUtil tokenUtil) {
        return new ClusteringPerspectiveSynthesizer(textGenerator, similarityScorer, tokenUtil, perspectiveProperties.getSynthesis());
    }

    @Bean
    public GroundingValidator groundingValidator(SimilarityScorer similarityScorer) {
        return new GroundingValidator(similarityScorer,
                perspectiveProperties.getSynthesis().getDuplicateThreshold(),
                perspectiveProperties.getValidation());
    }

    @Bean
    public ResultAssembler resultAssembler() {
        return new ResultAssembler();
    }
}
