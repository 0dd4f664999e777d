package com.nlfhir.clinical.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nlfhir.clinical.model.ClinicalStructure;
import com.nlfhir.clinical.model.StructureMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result envelope for one {@code process} call.
 *
 * @param structuredOutput   extracted entities, empty on failure
 * @param processingTimeMs   wall-clock time spent in the pipeline
 * @param method             which path produced the output
 * @param status             completed or failed
 * @param error              failure message, null on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessingResult(
        @JsonProperty("structured_output")  ClinicalStructure structuredOutput,
        @JsonProperty("processing_time_ms") double processingTimeMs,
        @JsonProperty("method")             ProcessingMethod method,
        @JsonProperty("status")             ProcessingStatus status,
        @JsonProperty("error")              String error
) {

    public static ProcessingResult completed(ClinicalStructure output, double processingTimeMs,
                                             ProcessingMethod method) {
        return new ProcessingResult(output, processingTimeMs, method, ProcessingStatus.COMPLETED, null);
    }

    public static ProcessingResult failed(double processingTimeMs, String error) {
        return new ProcessingResult(ClinicalStructure.empty(), processingTimeMs,
                ProcessingMethod.FALLBACK, ProcessingStatus.FAILED, error);
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return status == ProcessingStatus.COMPLETED;
    }

    /**
     * Plain envelope map; the {@code error} key is present only on failure.
     */
    public Map<String, Object> toMap(StructureMapper mapper) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("structured_output", mapper.toMap(structuredOutput));
        map.put("processing_time_ms", processingTimeMs);
        map.put("method", method.value());
        map.put("status", status.value());
        if (error != null) {
            map.put("error", error);
        }
        return map;
    }
}
