package com.abba.rxreminder.application.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class HospitalDetailsDto {

    @JsonProperty(required = true)
    private String name = PrescriptionDocumentDto.NOT_AVAILABLE;

    @JsonProperty(required = true)
    private String address = PrescriptionDocumentDto.NOT_AVAILABLE;

    @JsonProperty(required = true)
    private String phone = PrescriptionDocumentDto.NOT_AVAILABLE;
}
