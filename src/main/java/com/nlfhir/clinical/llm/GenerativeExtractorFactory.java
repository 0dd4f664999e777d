package com.nlfhir.clinical.llm;

import com.nlfhir.clinical.grounding.SourceGroundingValidator;
import com.nlfhir.clinical.model.StructureMapper;
import dev.langchain4j.model.chat.Capability;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.service.AiServices;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;

/**
 * Resolves the generative capability once, from settings. Missing credentials are an expected
 * state and yield a {@link DisabledGenerativeExtractor}.
 */
@Slf4j
public final class GenerativeExtractorFactory {

    private GenerativeExtractorFactory() {
    }

    public static GenerativeExtractor create(LlmSettings settings,
                                             SourceGroundingValidator validator,
                                             StructureMapper mapper,
                                             List<ChatModelListener> listeners) {
        if (settings == null || !settings.hasCredentials()) {
            log.info("No model credentials configured, generative extraction disabled");
            return new DisabledGenerativeExtractor("no API key configured");
        }
        log.info("Generative extraction enabled: {}", settings);
        return create(buildChatModel(settings, listeners), settings.maxInputTokens(), validator, mapper);
    }

    public static GenerativeExtractor create(ChatModel chatModel,
                                             int maxInputTokens,
                                             SourceGroundingValidator validator,
                                             StructureMapper mapper) {
        ClinicalExtractionAssistant assistant = AiServices.builder(ClinicalExtractionAssistant.class)
                .chatModel(chatModel)
                .build();
        return new LlmGenerativeExtractor(assistant, validator, mapper, maxInputTokens);
    }

    static ChatModel buildChatModel(LlmSettings settings, List<ChatModelListener> listeners) {
        return OpenAiChatModel.builder()
                .apiKey(settings.apiKey())
                .modelName(settings.modelName())
                .temperature(settings.temperature())
                .maxTokens(settings.maxTokens())
                .timeout(settings.timeout())
                .maxRetries(0)
                .supportedCapabilities(Set.of(Capability.RESPONSE_FORMAT_JSON_SCHEMA))
                .logRequests(settings.logRequests())
                .logResponses(settings.logRequests())
                .listeners(listeners == null ? List.of() : listeners)
                .build();
    }
}
