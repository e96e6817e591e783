package com.abba.rxreminder.application.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Dosage, frequency, duration and timing. Reused for {@code source_details}, where each value is
 * "Prescription" or "AI Suggested".
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MedicationInstructionsDto {

    @JsonProperty(required = true)
    private String dosage = PrescriptionDocumentDto.NOT_AVAILABLE;

    @JsonProperty(required = true)
    private String frequency = PrescriptionDocumentDto.NOT_AVAILABLE;

    @JsonProperty(required = true)
    private String duration = PrescriptionDocumentDto.NOT_AVAILABLE;

    @JsonProperty(required = true)
    private String timing = PrescriptionDocumentDto.NOT_AVAILABLE;
}
