package com.nlfhir.clinical.pipeline;

import com.nlfhir.clinical.escalation.EscalationDecision;
import com.nlfhir.clinical.escalation.EscalationPolicy;
import com.nlfhir.clinical.escalation.EscalationRule;
import com.nlfhir.clinical.extraction.PatternExtractor;
import com.nlfhir.clinical.llm.DisabledGenerativeExtractor;
import com.nlfhir.clinical.llm.GenerativeExtractionException;
import com.nlfhir.clinical.llm.GenerativeExtractor;
import com.nlfhir.clinical.model.ClinicalStructure;
import com.nlfhir.clinical.model.MedicationOrder;
import com.nlfhir.clinical.model.StructureMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ClinicalPipelineCoordinator} with mocked stages.
 */
@ExtendWith(MockitoExtension.class)
class ClinicalPipelineCoordinatorTest {

    private static final String TEXT = "Start tadalafil.";

    @Mock private PatternExtractor patternExtractor;
    @Mock private EscalationPolicy escalationPolicy;
    @Mock private GenerativeExtractor generativeExtractor;

    private final ClinicalStructure patternResult = new ClinicalStructure(
            List.of(MedicationOrder.named("start")), null, null, null, null, null, null, null, null);
    private final ClinicalStructure generatedResult = new ClinicalStructure(
            List.of(MedicationOrder.named("tadalafil")), null, null, null, null, null, null, null, null);

    private ClinicalPipelineCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = new ClinicalPipelineCoordinator(patternExtractor, escalationPolicy, generativeExtractor, true);
    }

    private void escalationFires() {
        when(patternExtractor.extract(TEXT)).thenReturn(patternResult);
        when(escalationPolicy.evaluate(patternResult, TEXT))
                .thenReturn(EscalationDecision.escalate(EscalationRule.HARD_MEDICATION_MISSED, "tadalafil missed"));
    }

    // =========================================================================
    //  Method selection
    // =========================================================================

    @Nested
    @DisplayName("method selection")
    class MethodSelection {

        @Test
        @DisplayName("sufficient pattern output is returned as regex_enhanced")
        void sufficientPatternResult() {
            when(patternExtractor.extract(TEXT)).thenReturn(patternResult);
            when(escalationPolicy.evaluate(patternResult, TEXT)).thenReturn(EscalationDecision.sufficient("ok"));

            ProcessingResult result = coordinator.process(TEXT, List.of(), "req-1");

            assertThat(result.method()).isEqualTo(ProcessingMethod.REGEX_ENHANCED);
            assertThat(result.status()).isEqualTo(ProcessingStatus.COMPLETED);
            assertThat(result.structuredOutput()).isSameAs(patternResult);
            assertThat(result.error()).isNull();
            verify(generativeExtractor, never()).extract(anyString(), anyString());
        }

        @Test
        @DisplayName("escalation replaces the pattern output entirely")
        void escalatedResultReplaces() {
            escalationFires();
            when(generativeExtractor.isAvailable()).thenReturn(true);
            when(generativeExtractor.extract(TEXT, "req-2")).thenReturn(generatedResult);

            ProcessingResult result = coordinator.process(TEXT, List.of(), "req-2");

            assertThat(result.method()).isEqualTo(ProcessingMethod.ESCALATED_TO_LLM);
            assertThat(result.structuredOutput()).isSameAs(generatedResult);
            assertThat(result.processingTimeMs()).isGreaterThanOrEqualTo(0.0);
        }

        @Test
        @DisplayName("unavailable generative capability keeps the pattern output")
        void unavailableCapability() {
            escalationFires();
            when(generativeExtractor.isAvailable()).thenReturn(false);

            ProcessingResult result = coordinator.process(TEXT, List.of(), "req-3");

            assertThat(result.method()).isEqualTo(ProcessingMethod.REGEX_ENHANCED);
            assertThat(result.structuredOutput()).isSameAs(patternResult);
            verify(generativeExtractor, never()).extract(anyString(), anyString());
        }

        @Test
        @DisplayName("escalation switched off by configuration keeps the pattern output")
        void escalationDisabled() {
            ClinicalPipelineCoordinator disabled =
                    new ClinicalPipelineCoordinator(patternExtractor, escalationPolicy, generativeExtractor, false);
            escalationFires();

            ProcessingResult result = disabled.process(TEXT, List.of(), "req-4");

            assertThat(result.method()).isEqualTo(ProcessingMethod.REGEX_ENHANCED);
            verify(generativeExtractor, never()).extract(anyString(), anyString());
        }
    }

    // =========================================================================
    //  Failures
    // =========================================================================

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("generative failure becomes a failed fallback envelope")
        void generativeFailure() {
            escalationFires();
            when(generativeExtractor.isAvailable()).thenReturn(true);
            when(generativeExtractor.extract(eq(TEXT), any()))
                    .thenThrow(new GenerativeExtractionException("req-5", "Generative extraction failed: timeout"));

            ProcessingResult result = coordinator.process(TEXT, List.of(), "req-5");

            assertThat(result.status()).isEqualTo(ProcessingStatus.FAILED);
            assertThat(result.method()).isEqualTo(ProcessingMethod.FALLBACK);
            assertThat(result.structuredOutput()).isEqualTo(ClinicalStructure.empty());
            assertThat(result.error()).contains("timeout");
        }

        @Test
        @DisplayName("unexpected stage failure is caught at the boundary")
        void unexpectedFailure() {
            when(patternExtractor.extract(TEXT)).thenReturn(patternResult);
            when(escalationPolicy.evaluate(patternResult, TEXT)).thenThrow(new NullPointerException());

            ProcessingResult result = coordinator.process(TEXT, null, null);

            assertThat(result.status()).isEqualTo(ProcessingStatus.FAILED);
            assertThat(result.error()).isEqualTo("NullPointerException");
        }
    }

    // =========================================================================
    //  Envelope and status
    // =========================================================================

    @Test
    @DisplayName("request id is placed in the MDC only for the duration of the call")
    void mdcIsRestored() {
        when(patternExtractor.extract(TEXT)).thenAnswer(invocation -> {
            assertThat(MDC.get(ClinicalPipelineCoordinator.MDC_REQUEST_ID)).isEqualTo("req-6");
            return patternResult;
        });
        when(escalationPolicy.evaluate(patternResult, TEXT)).thenReturn(EscalationDecision.sufficient("ok"));

        coordinator.process(TEXT, List.of(), "req-6");

        assertThat(MDC.get(ClinicalPipelineCoordinator.MDC_REQUEST_ID)).isNull();
    }

    @Test
    @DisplayName("envelope map omits error on success and carries it on failure")
    void envelopeMap() {
        StructureMapper mapper = new StructureMapper();

        Map<String, Object> ok = ProcessingResult.completed(patternResult, 12.5, ProcessingMethod.REGEX_ENHANCED)
                .toMap(mapper);
        Map<String, Object> failed = ProcessingResult.failed(3.0, "boom").toMap(mapper);

        assertThat(ok).containsOnlyKeys("structured_output", "processing_time_ms", "method", "status")
                .containsEntry("method", "regex_enhanced")
                .containsEntry("status", "completed")
                .containsEntry("processing_time_ms", 12.5);
        assertThat(failed).containsEntry("method", "fallback")
                .containsEntry("status", "failed")
                .containsEntry("error", "boom");
    }

    @Test
    void statusReflectsCapability() {
        when(generativeExtractor.isAvailable()).thenReturn(true);

        assertThat(coordinator.status())
                .isEqualTo(new ProcessorStatus(true, ProcessorStatus.METHOD_LLM, true, false));
    }

    @Test
    void statusWithoutCapability() {
        ClinicalPipelineCoordinator ruleBased = new ClinicalPipelineCoordinator(
                patternExtractor, escalationPolicy, new DisabledGenerativeExtractor("no key"), true);

        assertThat(ruleBased.status())
                .isEqualTo(new ProcessorStatus(true, ProcessorStatus.METHOD_RULE_BASED, false, true));
    }
}
