package com.abba.rxreminder.application.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConfidenceDetailsDto {

    @JsonProperty(value = "tablet_name", required = true)
    private String tabletName = PrescriptionDocumentDto.NOT_AVAILABLE;

    @JsonProperty(required = true)
    private String dosage = PrescriptionDocumentDto.NOT_AVAILABLE;

    @JsonProperty(required = true)
    private String frequency = PrescriptionDocumentDto.NOT_AVAILABLE;

    @JsonProperty(required = true)
    private String duration = PrescriptionDocumentDto.NOT_AVAILABLE;

    @JsonProperty(required = true)
    private String timing = PrescriptionDocumentDto.NOT_AVAILABLE;
}
