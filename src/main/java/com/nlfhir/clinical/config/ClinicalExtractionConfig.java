package com.nlfhir.clinical.config;

import com.nlfhir.clinical.escalation.EscalationPolicy;
import com.nlfhir.clinical.extraction.ExtractionLexicons;
import com.nlfhir.clinical.extraction.PatternExtractor;
import com.nlfhir.clinical.grounding.SourceGroundingValidator;
import com.nlfhir.clinical.llm.ExtractionChatModelListener;
import com.nlfhir.clinical.llm.GenerativeExtractor;
import com.nlfhir.clinical.llm.GenerativeExtractorFactory;
import com.nlfhir.clinical.llm.LlmSettings;
import com.nlfhir.clinical.model.StructureMapper;
import com.nlfhir.clinical.pipeline.ClinicalPipelineCoordinator;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.context.support.PropertySourcesPlaceholderConfigurer;

import java.util.List;

/**
 * Wires the extraction pipeline. Properties come from {@code clinical-extraction.properties},
 * overridable by system properties and environment variables. The generative capability is
 * resolved here once; nothing is looked up per request.
 */
@Configuration
@PropertySource("classpath:clinical-extraction.properties")
public class ClinicalExtractionConfig {

    @Bean
    public static PropertySourcesPlaceholderConfigurer propertySourcesPlaceholderConfigurer() {
        return new PropertySourcesPlaceholderConfigurer();
    }

    @Bean
    public LlmSettings llmSettings(
            @Value("${clinical.llm.api-key:}") String apiKey,
            @Value("${clinical.llm.model-name:gpt-4o-mini}") String modelName,
            @Value("${clinical.llm.temperature:0.0}") double temperature,
            @Value("${clinical.llm.max-tokens:2000}") int maxTokens,
            @Value("${clinical.llm.timeout-seconds:30}") int timeoutSeconds,
            @Value("${clinical.llm.max-input-tokens:8000}") int maxInputTokens,
            @Value("${clinical.llm.log-requests:false}") boolean logRequests) {
        return new LlmSettings(apiKey, modelName, temperature, maxTokens, timeoutSeconds, maxInputTokens, logRequests);
    }

    @Bean
    public StructureMapper structureMapper() {
        return new StructureMapper();
    }

    @Bean
    public ExtractionLexicons extractionLexicons() {
        return ExtractionLexicons.loadDefaults();
    }

    @Bean
    public PatternExtractor patternExtractor(ExtractionLexicons extractionLexicons) {
        return new PatternExtractor(extractionLexicons);
    }

    @Bean
    public EscalationPolicy escalationPolicy() {
        return new EscalationPolicy();
    }

    @Bean
    public SourceGroundingValidator sourceGroundingValidator() {
        return new SourceGroundingValidator();
    }

    @Bean
    public ChatModelListener extractionChatModelListener() {
        return new ExtractionChatModelListener();
    }

    @Bean
    public GenerativeExtractor generativeExtractor(LlmSettings llmSettings,
                                                   SourceGroundingValidator sourceGroundingValidator,
                                                   StructureMapper structureMapper,
                                                   List<ChatModelListener> listeners) {
        return GenerativeExtractorFactory.create(llmSettings, sourceGroundingValidator, structureMapper, listeners);
    }

    @Bean
    public ClinicalPipelineCoordinator clinicalPipelineCoordinator(
            PatternExtractor patternExtractor,
            EscalationPolicy escalationPolicy,
            GenerativeExtractor generativeExtractor,
            @Value("${clinical.escalation.enabled:true}") boolean escalationEnabled) {
        return new ClinicalPipelineCoordinator(patternExtractor, escalationPolicy, generativeExtractor, escalationEnabled);
    }
}
