package com.abba.rxreminder.application.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MedicationDto {

    @JsonProperty(value = "tablet_name", required = true)
    private String tabletName = PrescriptionDocumentDto.NOT_AVAILABLE;

    @JsonProperty(required = true)
    private MedicationInstructionsDto instructions = new MedicationInstructionsDto();

    @JsonProperty(value = "source_details", required = true)
    private MedicationInstructionsDto sourceDetails = new MedicationInstructionsDto();

    @JsonProperty(value = "confidence_details", required = true)
    private ConfidenceDetailsDto confidenceDetails = new ConfidenceDetailsDto();

    @JsonProperty(value = "estimated_price_range_inr", required = true)
    private String estimatedPriceRangeInr = PrescriptionDocumentDto.NOT_AVAILABLE;
}
