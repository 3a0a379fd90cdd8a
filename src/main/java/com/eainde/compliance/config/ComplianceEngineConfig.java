package com.eainde.compliance.config;

import com.eainde.compliance.agent.AssessmentVerifier;
import com.eainde.compliance.agent.ComplianceAgentFactory;
import com.eainde.compliance.agent.ComplianceAssessor;
import com.eainde.compliance.agent.ModelCallLoggingListener;
import com.eainde.compliance.agent.RequirementPlanner;
import com.eainde.compliance.audit.AuditRepository;
import com.eainde.compliance.audit.AuditService;
import com.eainde.compliance.audit.InMemoryAuditRepository;
import com.eainde.compliance.catalog.RequirementCatalog;
import com.eainde.compliance.catalog.RequirementCatalogLoader;
import com.eainde.compliance.document.DocumentExtractor;
import com.eainde.compliance.document.PlainTextDocumentExtractor;
import com.eainde.compliance.explain.VerdictExplainer;
import com.eainde.compliance.export.SnapshotExporter;
import com.eainde.compliance.model.EvaluationMode;
import com.eainde.compliance.orchestration.AuditOrchestrator;
import com.eainde.compliance.orchestration.PipelineSettings;
import com.eainde.compliance.retrieval.EvidenceRetriever;
import com.eainde.compliance.retrieval.HybridEvidenceRetriever;
import com.eainde.compliance.retrieval.LexicalEvidenceRetriever;
import com.eainde.compliance.snapshot.AuditSnapshotter;
import com.eainde.compliance.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wiring of the compliance pipeline.
 *
 * FLOW:
 *
 *   document
 *     │
 *     ▼
 *   ┌──────────────────────────────┐
 *   │  extractor → retriever.index │
 *   └──────────────┬───────────────┘
 *                  │
 *                  ▼
 *   ┌──────────────────────────────┐
 *   │  planner (AGENT mode only)   │  → filtered plan
 *   └──────────────┬───────────────┘
 *                  │   per requirement, up to max-concurrency in parallel
 *                  ▼
 *   ┌──────────────────────────────────────────────┐
 *   │  retriever → assessor → verifier (AGENT)     │
 *   └──────────────┬───────────────────────────────┘
 *                  │
 *                  ▼
 *   ┌──────────────────────────────┐
 *   │  verdict → frozen snapshot   │
 *   └──────────────────────────────┘
 *
 * The retrieval strategy is chosen here, once: hybrid when an embedding model is
 * enabled, lexical otherwise.
 */
@Configuration
public class ComplianceEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(ComplianceEngineConfig.class);

    @Value("${compliance.llm.base-url:https://api.openai.com/v1}")
    private String llmBaseUrl;

    @Value("${compliance.llm.api-key}")
    private String llmApiKey;

    @Value("${compliance.llm.model-name:gpt-4o-mini}")
    private String llmModelName;

    @Value("${compliance.llm.temperature:0.0}")
    private double llmTemperature;

    @Value("${compliance.llm.timeout:PT60S}")
    private Duration llmTimeout;

    @Value("${compliance.llm.max-retries:2}")
    private int llmMaxRetries;

    @Value("${compliance.embedding.enabled:false}")
    private boolean embeddingEnabled;

    @Value("${compliance.embedding.model-name:text-embedding-3-small}")
    private String embeddingModelName;

    @Value("${compliance.pipeline.evaluation-mode:AGENT}")
    private EvaluationMode evaluationMode;

    @Value("${compliance.pipeline.max-concurrency:4}")
    private int maxConcurrency;

    @Value("${compliance.pipeline.top-k:4}")
    private int topK;

    @Value("${compliance.pipeline.max-segment-chars:1500}")
    private int maxSegmentChars;

    @Value("${compliance.engine.name:Compliance Audit Engine}")
    private String engineName;

    @Value("${compliance.engine.version:2.0.0}")
    private String engineVersion;

    @Value("${compliance.catalog.location:classpath:catalog/dpdp-2023.json}")
    private String catalogLocation;

    // =========================================================================
    //  Models
    // =========================================================================

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ChatModel chatModel() {
        log.info("Chat model: {} at {}", llmModelName, llmBaseUrl);
        return OpenAiChatModel.builder()
                .baseUrl(llmBaseUrl)
                .apiKey(llmApiKey)
                .modelName(llmModelName)
                .temperature(llmTemperature)
                .timeout(llmTimeout)
                .maxRetries(llmMaxRetries)
                .listeners(List.of(new ModelCallLoggingListener()))
                .build();
    }

    @Bean
    public EvidenceRetriever evidenceRetriever() {
        if (!embeddingEnabled) {
            log.info("Embeddings disabled - using lexical evidence retrieval (top-k {})", topK);
            return new LexicalEvidenceRetriever(topK);
        }
        log.info("Embeddings enabled - using hybrid evidence retrieval with {} (top-k {})", embeddingModelName, topK);
        OpenAiEmbeddingModel embeddingModel = OpenAiEmbeddingModel.builder()
                .baseUrl(llmBaseUrl)
                .apiKey(llmApiKey)
                .modelName(embeddingModelName)
                .timeout(llmTimeout)
                .maxRetries(llmMaxRetries)
                .build();
        return new HybridEvidenceRetriever(embeddingModel, new InMemoryEmbeddingStore<>(), topK);
    }

    // =========================================================================
    //  Agents
    // =========================================================================

    @Bean
    public ComplianceAgentFactory complianceAgentFactory(ChatModel chatModel, ObjectMapper objectMapper) {
        return new ComplianceAgentFactory(chatModel, objectMapper);
    }

    @Bean
    public RequirementPlanner requirementPlanner(ComplianceAgentFactory factory) {
        return factory.planner();
    }

    @Bean
    public ComplianceAssessor complianceAssessor(ComplianceAgentFactory factory) {
        return factory.assessor();
    }

    @Bean
    public AssessmentVerifier assessmentVerifier(ComplianceAgentFactory factory) {
        return factory.verifier();
    }

    // =========================================================================
    //  Pipeline
    // =========================================================================

    @Bean
    public RequirementCatalog requirementCatalog(ResourceLoader resourceLoader) {
        return new RequirementCatalogLoader().load(resourceLoader.getResource(catalogLocation));
    }

    @Bean
    public DocumentExtractor documentExtractor() {
        return PlainTextDocumentExtractor.builder()
                .maxSegmentChars(maxSegmentChars)
                .build();
    }

    @Bean
    public AuditSnapshotter auditSnapshotter(Clock clock) {
        return new AuditSnapshotter(engineName, engineVersion, clock);
    }

    @Bean
    public AuditRepository auditRepository() {
        return new InMemoryAuditRepository();
    }

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor requirementExecutor() {
        return new MdcAwareExecutor(maxConcurrency, "requirement");
    }

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor auditExecutor() {
        return new MdcAwareExecutor(2, "audit");
    }

    @Bean
    public PipelineSettings pipelineSettings() {
        log.info("Pipeline: {} mode, max concurrency {}", evaluationMode, maxConcurrency);
        return new PipelineSettings(evaluationMode, engineVersion);
    }

    @Bean
    public AuditOrchestrator auditOrchestrator(RequirementCatalog catalog,
                                               DocumentExtractor extractor,
                                               EvidenceRetriever retriever,
                                               RequirementPlanner planner,
                                               ComplianceAssessor assessor,
                                               AssessmentVerifier verifier,
                                               AuditSnapshotter snapshotter,
                                               AuditRepository repository,
                                               @Qualifier("requirementExecutor") MdcAwareExecutor executor,
                                               PipelineSettings settings,
                                               Clock clock) {
        return new AuditOrchestrator(catalog, extractor, retriever, planner, assessor, verifier,
                snapshotter, repository, executor, settings, clock);
    }

    @Bean
    public AuditService auditService(AuditOrchestrator orchestrator,
                                     AuditRepository repository,
                                     @Qualifier("auditExecutor") MdcAwareExecutor executor,
                                     Clock clock) {
        return new AuditService(orchestrator, repository, executor, clock);
    }

    @Bean
    public VerdictExplainer verdictExplainer() {
        return new VerdictExplainer();
    }

    @Bean
    public SnapshotExporter snapshotExporter(ObjectMapper objectMapper) {
        return new SnapshotExporter(objectMapper);
    }
}
