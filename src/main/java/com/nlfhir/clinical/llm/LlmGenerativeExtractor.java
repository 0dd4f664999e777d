package com.nlfhir.clinical.llm;

import com.nlfhir.clinical.grounding.SourceGroundingValidator;
import com.nlfhir.clinical.model.ClinicalStructure;
import com.nlfhir.clinical.model.StructureMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Model-backed extractor. Raw model output is never returned as-is: it is converted to the
 * plain map shape, grounded against the source text, and rebuilt so every medication safety
 * flag reflects the fields that survived grounding.
 */
@Slf4j
public class LlmGenerativeExtractor implements GenerativeExtractor {

    private final ClinicalExtractionAssistant assistant;
    private final SourceGroundingValidator validator;
    private final StructureMapper mapper;
    private final int maxInputTokens;

    public LlmGenerativeExtractor(ClinicalExtractionAssistant assistant,
                                  SourceGroundingValidator validator,
                                  StructureMapper mapper,
                                  int maxInputTokens) {
        this.assistant = assistant;
        this.validator = validator;
        this.mapper = mapper;
        this.maxInputTokens = maxInputTokens;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public ClinicalStructure extract(String text, String requestId) {
        String source = text == null ? "" : text;
        String prompt = source;
        int estimated = TokenEstimator.estimateTokens(source);
        if (estimated > maxInputTokens) {
            prompt = TokenEstimator.truncate(source, maxInputTokens);
            log.warn("[{}] Input truncated for generative extraction ({} > {} estimated tokens)",
                    requestId, estimated, maxInputTokens);
        }

        ClinicalExtraction response;
        try {
            response = assistant.extract(prompt);
        } catch (RuntimeException e) {
            log.error("[{}] Generative extraction call failed", requestId, e);
            throw new GenerativeExtractionException(requestId, "Generative extraction failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new GenerativeExtractionException(requestId, "Generative extraction returned no content");
        }

        try {
            Map<String, Object> raw = mapper.toMap(response.toClinicalStructure());
            Map<String, Object> grounded = validator.validate(raw, source, requestId);
            ClinicalStructure structure = mapper.fromMap(grounded);
            if (!structure.hasOrders()) {
                log.warn("[{}] No clinical orders (medications, lab tests, procedures) after grounding", requestId);
            }
            log.info("[{}] Generative extraction produced {} medications, {} conditions, {} patients after grounding",
                    requestId, structure.medications().size(), structure.conditions().size(),
                    structure.patients().size());
            return structure;
        } catch (RuntimeException e) {
            throw new GenerativeExtractionException(requestId, "Failed to process model output: " + e.getMessage(), e);
        }
    }
}
