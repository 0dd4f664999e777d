package com.nlfhir.clinical.llm;

import com.nlfhir.clinical.grounding.SourceGroundingValidator;
import com.nlfhir.clinical.model.ClinicalSetting;
import com.nlfhir.clinical.model.ClinicalStructure;
import com.nlfhir.clinical.model.MedicalCondition;
import com.nlfhir.clinical.model.MedicationRoute;
import com.nlfhir.clinical.model.StructureMapper;
import com.nlfhir.clinical.model.UrgencyLevel;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link LlmGenerativeExtractor} with a mocked AI service.
 */
@ExtendWith(MockitoExtension.class)
class LlmGenerativeExtractorTest {

    @Mock private ClinicalExtractionAssistant assistant;

    private LlmGenerativeExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new LlmGenerativeExtractor(assistant, new SourceGroundingValidator(), new StructureMapper(), 50);
    }

    private static ClinicalExtraction response(List<ClinicalExtraction.Medication> meds,
                                               List<ClinicalExtraction.Condition> conditions,
                                               List<String> patients) {
        return new ClinicalExtraction(meds, List.of(), List.of(), conditions, patients,
                List.of(), "routine", "outpatient", List.of());
    }

    private static ClinicalExtraction.Medication med(String name, String dosage, String frequency) {
        return new ClinicalExtraction.Medication(name, dosage, frequency, "oral", null, null);
    }

    private static ClinicalExtraction.Condition condition(String name) {
        return new ClinicalExtraction.Condition(name, null, null, null);
    }

    // =========================================================================
    //  Grounding of model output
    // =========================================================================

    @Nested
    @DisplayName("grounding of model output")
    class Grounding {

        @Test
        @DisplayName("placeholder patient and hallucinated dose are removed, medication re-flagged")
        void hallucinationsRemoved() {
            // Arrange
            String text = "Patient on insulin for diabetes.";
            when(assistant.extract(text)).thenReturn(response(
                    List.of(med("insulin", "10 units", null)),
                    List.of(condition("diabetes"), condition("type 2 diabetes mellitus")),
                    List.of("Unknown Patient")));

            // Act
            ClinicalStructure result = extractor.extract(text, "req-1");

            // Assert
            assertThat(result.patients()).isEmpty();
            assertThat(result.medications()).singleElement().satisfies(med -> {
                assertThat(med.name()).isEqualTo("insulin");
                assertThat(med.dosage()).isNull();
                assertThat(med.safetyFlag()).isTrue();
                assertThat(med.route()).isEqualTo(MedicationRoute.ORAL);
            });
            assertThat(result.conditions()).extracting(MedicalCondition::name).containsExactly("diabetes");
        }

        @Test
        @DisplayName("fully grounded output passes through")
        void groundedOutputKept() {
            String text = "Prescribed patient Mary Johnson amoxicillin 500mg three times daily for acute bacterial sinusitis.";
            when(assistant.extract(anyString())).thenReturn(response(
                    List.of(med("amoxicillin", "500mg", "three times daily")),
                    List.of(condition("acute bacterial sinusitis")),
                    List.of("Mary Johnson")));

            ClinicalStructure result = extractor.extract(text, "req-2");

            assertThat(result.patients()).containsExactly("Mary Johnson");
            assertThat(result.medications()).singleElement().satisfies(med -> {
                assertThat(med.dosage()).isEqualTo("500mg");
                assertThat(med.frequency()).isEqualTo("three times daily");
                assertThat(med.safetyFlag()).isFalse();
            });
            assertThat(result.urgencyLevel()).isEqualTo(UrgencyLevel.ROUTINE);
            assertThat(result.clinicalSetting()).isEqualTo(ClinicalSetting.OUTPATIENT);
        }

        @Test
        @DisplayName("entries with blank names are skipped")
        void blankNamesSkipped() {
            String text = "Give aspirin.";
            when(assistant.extract(text)).thenReturn(response(
                    List.of(med(" ", "81mg", "daily"), med("aspirin", null, null)), null, null));

            ClinicalStructure result = extractor.extract(text, "req-3");

            assertThat(result.medications()).extracting(m -> m.name()).containsExactly("aspirin");
            assertThat(result.conditions()).isEmpty();
        }
    }

    // =========================================================================
    //  Structure-level defaults and warnings
    // =========================================================================

    @Nested
    @DisplayName("structure defaults")
    class StructureDefaults {

        @Test
        @DisplayName("missing clinical setting in the response defaults to outpatient")
        void missingSettingIsOutpatient() {
            when(assistant.extract(anyString())).thenReturn(new ClinicalExtraction(
                    List.of(med("aspirin", null, null)), List.of(), List.of(), List.of(), List.of(),
                    List.of(), null, null, List.of()));

            ClinicalStructure result = extractor.extract("Give aspirin.", "req-5");

            assertThat(result.clinicalSetting()).isEqualTo(ClinicalSetting.OUTPATIENT);
            assertThat(result.urgencyLevel()).isEqualTo(UrgencyLevel.ROUTINE);
        }

        @Test
        @DisplayName("warns when no orders survive grounding")
        void warnsWithoutOrders() {
            Logger logger = (Logger) LoggerFactory.getLogger(LlmGenerativeExtractor.class);
            ListAppender<ILoggingEvent> appender = new ListAppender<>();
            appender.start();
            logger.addAppender(appender);
            try {
                when(assistant.extract(anyString())).thenReturn(response(
                        List.of(med("lisinopril", "10mg", "daily")), List.of(condition("diabetes")), List.of()));

                ClinicalStructure result = extractor.extract("Patient has diabetes.", "req-6");

                assertThat(result.hasOrders()).isFalse();
                assertThat(appender.list)
                        .filteredOn(event -> event.getLevel() == Level.WARN)
                        .extracting(ILoggingEvent::getFormattedMessage)
                        .anySatisfy(message -> assertThat(message).contains("req-6").contains("No clinical orders"));
            } finally {
                logger.detachAppender(appender);
            }
        }
    }

    // =========================================================================
    //  Failures
    // =========================================================================

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        void callFailureIsWrapped() {
            when(assistant.extract(anyString())).thenThrow(new RuntimeException("timeout"));

            assertThatThrownBy(() -> extractor.extract("Start metformin.", "req-9"))
                    .isInstanceOf(GenerativeExtractionException.class)
                    .hasMessageContaining("timeout")
                    .extracting(e -> ((GenerativeExtractionException) e).getRequestId())
                    .isEqualTo("req-9");
        }

        @Test
        void nullResponseFails() {
            when(assistant.extract(anyString())).thenReturn(null);

            assertThatThrownBy(() -> extractor.extract("Start metformin.", "req-9"))
                    .isInstanceOf(GenerativeExtractionException.class)
                    .hasMessageContaining("no content");
        }
    }

    @Test
    @DisplayName("input over the token budget is truncated before the call")
    void longInputTruncated() {
        String text = "x".repeat(500);
        when(assistant.extract(anyString())).thenReturn(response(List.of(), List.of(), List.of()));

        extractor.extract(text, "req-4");

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(assistant).extract(prompt.capture());
        assertThat(prompt.getValue()).hasSize(200);
    }

    @Test
    void isAlwaysAvailable() {
        assertThat(extractor.isAvailable()).isTrue();
    }
}
