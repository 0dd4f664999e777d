package com.nlfhir.clinical.pipeline;

import com.nlfhir.clinical.escalation.EscalationDecision;
import com.nlfhir.clinical.escalation.EscalationPolicy;
import com.nlfhir.clinical.extraction.PatternExtractor;
import com.nlfhir.clinical.llm.GenerativeExtractor;
import com.nlfhir.clinical.model.ClinicalStructure;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Single entry point of the extraction pipeline.
 *
 * <p>Flow: pattern extraction, escalation check, then (only when escalation fires, is enabled and
 * the generative capability is available) generative extraction whose grounded output replaces
 * the pattern result entirely. The two outputs are never merged.</p>
 *
 * <p>{@link #process} never throws: any failure becomes a {@code failed} envelope with an empty
 * structure and method {@code fallback}.</p>
 */
@Slf4j
public class ClinicalPipelineCoordinator {

    public static final String MDC_REQUEST_ID = "requestId";

    private final PatternExtractor patternExtractor;
    private final EscalationPolicy escalationPolicy;
    private final GenerativeExtractor generativeExtractor;
    private final boolean escalationEnabled;

    public ClinicalPipelineCoordinator(PatternExtractor patternExtractor,
                                       EscalationPolicy escalationPolicy,
                                       GenerativeExtractor generativeExtractor,
                                       boolean escalationEnabled) {
        this.patternExtractor = patternExtractor;
        this.escalationPolicy = escalationPolicy;
        this.generativeExtractor = generativeExtractor;
        this.escalationEnabled = escalationEnabled;
    }

    public ProcessingResult process(String text) {
        return process(text, List.of(), null);
    }

    /**
     * Runs the pipeline on one text.
     *
     * @param text      raw clinical text
     * @param entities  pre-extracted entities; accepted for callers that have them, not used
     * @param requestId log correlation id, generated when null
     */
    public ProcessingResult process(String text, List<Map<String, Object>> entities, String requestId) {
        String id = requestId != null && !requestId.isBlank() ? requestId : newRequestId();
        String previousId = MDC.get(MDC_REQUEST_ID);
        MDC.put(MDC_REQUEST_ID, id);
        long start = System.nanoTime();
        try {
            log.info("[{}] Processing clinical text ({} chars, {} pre-extracted entities)",
                    id, text == null ? 0 : text.length(), entities == null ? 0 : entities.size());

            ClinicalStructure patternResult = patternExtractor.extract(text);
            EscalationDecision decision = escalationPolicy.evaluate(patternResult, text);

            if (decision.escalate() && canEscalate(id)) {
                log.info("[{}] Escalating to generative extraction: {}", id, decision.reason());
                ClinicalStructure generated = generativeExtractor.extract(text, id);
                ProcessingResult result = ProcessingResult.completed(
                        generated, elapsedMillis(start), ProcessingMethod.ESCALATED_TO_LLM);
                log.info("[{}] Completed via {} in {}ms", id, result.method().value(), result.processingTimeMs());
                return result;
            }

            ProcessingResult result = ProcessingResult.completed(
                    patternResult, elapsedMillis(start), ProcessingMethod.REGEX_ENHANCED);
            log.info("[{}] Completed via {} in {}ms", id, result.method().value(), result.processingTimeMs());
            return result;
        } catch (RuntimeException e) {
            log.error("[{}] Clinical extraction failed", id, e);
            return ProcessingResult.failed(elapsedMillis(start),
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            if (previousId != null) {
                MDC.put(MDC_REQUEST_ID, previousId);
            } else {
                MDC.remove(MDC_REQUEST_ID);
            }
        }
    }

    public ProcessorStatus status() {
        return ProcessorStatus.of(generativeExtractor.isAvailable());
    }

    private boolean canEscalate(String requestId) {
        if (!escalationEnabled) {
            log.info("[{}] Escalation warranted but disabled by configuration", requestId);
            return false;
        }
        if (!generativeExtractor.isAvailable()) {
            log.info("[{}] Escalation warranted but generative extraction is unavailable", requestId);
            return false;
        }
        return true;
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private static String newRequestId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
