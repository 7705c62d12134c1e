package com.eainde.compliance.config;

import com.eainde.compliance.audit.AuditTrail;
import com.eainde.compliance.audit.JsonlAuditTrail;
import com.eainde.compliance.completion.CompletionService;
import com.eainde.compliance.completion.GenerationSettings;
import com.eainde.compliance.completion.LangChainCompletionService;
import com.eainde.compliance.completion.LoggingChatModelListener;
import com.eainde.compliance.domain.DemoDataset;
import com.eainde.compliance.graph.KnowledgeGraph;
import com.eainde.compliance.query.QueryEngine;
import com.eainde.compliance.query.QueryTemplateRegistry;
import com.eainde.compliance.query.YamlQueryTemplateLoader;
import com.eainde.compliance.reasoning.ComplianceEvaluator;
import com.eainde.compliance.reasoning.ReasoningController;
import com.eainde.compliance.retrieval.Retriever;
import com.eainde.compliance.support.MdcAwareExecutor;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Wires the agent from {@code compliance.*} properties.
 *
 * The graph is loaded and/or seeded, then frozen before any bean can query it.
 */
@Slf4j
@Configuration
public class ComplianceAgentConfig {

    @Bean
    public KnowledgeGraph knowledgeGraph(
            @Value("${compliance.graph.path:}") String graphPath,
            @Value("${compliance.graph.seed-demo:false}") boolean seedDemo) throws IOException {
        KnowledgeGraph graph = new KnowledgeGraph();
        if (!graphPath.isBlank()) {
            Path path = Path.of(graphPath);
            if (Files.exists(path)) {
                graph.load(path);
            } else {
                log.warn("Graph file {} does not exist, starting without it", path);
            }
        }
        if (seedDemo) {
            DemoDataset.seed(graph);
        }
        graph.freeze();
        return graph;
    }

    @Bean
    public QueryTemplateRegistry queryTemplateRegistry(
            ResourceLoader resourceLoader,
            @Value("${compliance.query.templates:classpath:query-templates.yml}") String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            QueryTemplateRegistry registry = new QueryTemplateRegistry(new YamlQueryTemplateLoader().load(in));
            log.info("Loaded {} query templates from {}: {}", registry.size(), location, registry.names());
            return registry;
        }
    }

    @Bean
    public QueryEngine queryEngine(KnowledgeGraph knowledgeGraph, QueryTemplateRegistry queryTemplateRegistry) {
        return new QueryEngine(knowledgeGraph, queryTemplateRegistry);
    }

    @Bean
    public Retriever retriever(QueryEngine queryEngine) {
        return new Retriever(queryEngine);
    }

    @Bean
    public GenerationSettings generationSettings(
            @Value("${compliance.llm.model-name:gpt-4o-mini}") String modelName,
            @Value("${compliance.llm.temperature:0.0}") double temperature,
            @Value("${compliance.llm.max-tokens:512}") int maxTokens,
            @Value("${compliance.llm.timeout:30s}") Duration timeout) {
        return GenerationSettings.builder()
                .modelName(modelName)
                .temperature(temperature)
                .maxOutputTokens(maxTokens)
                .timeout(timeout)
                .build();
    }

    @Bean
    public ChatModel chatModel(
            GenerationSettings generationSettings,
            @Value("${compliance.llm.api-key:}") String apiKey,
            @Value("${compliance.llm.max-retries:3}") int maxRetries) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException(
                    "compliance.llm.api-key is not set; export OPENAI_API_KEY or configure the property");
        }
        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(generationSettings.getModelName())
                .temperature(generationSettings.getTemperature())
                .maxTokens(generationSettings.getMaxOutputTokens())
                .timeout(generationSettings.getTimeout())
                .maxRetries(maxRetries)
                .listeners(List.of(new LoggingChatModelListener()))
                .build();
    }

    @Bean
    public CompletionService completionService(ChatModel chatModel, GenerationSettings generationSettings) {
        return new LangChainCompletionService(chatModel, generationSettings);
    }

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor completionExecutor() {
        return new MdcAwareExecutor("completion");
    }

    @Bean
    public AuditTrail auditTrail(@Value("${compliance.audit.path:}") String auditPath) {
        if (auditPath.isBlank()) {
            log.info("Audit trail disabled");
            return AuditTrail.NOOP;
        }
        log.info("Auditing answers to {}", auditPath);
        return new JsonlAuditTrail(Path.of(auditPath));
    }

    @Bean
    public ReasoningController reasoningController(Retriever retriever, CompletionService completionService,
                                                   GenerationSettings generationSettings,
                                                   MdcAwareExecutor completionExecutor, AuditTrail auditTrail) {
        return new ReasoningController(retriever, completionService, generationSettings,
                completionExecutor, auditTrail);
    }

    @Bean
    public ComplianceEvaluator complianceEvaluator(ReasoningController reasoningController,
                                                   KnowledgeGraph knowledgeGraph,
                                                   GenerationSettings generationSettings) {
        return new ComplianceEvaluator(reasoningController, knowledgeGraph, generationSettings.getTimeout());
    }
}
