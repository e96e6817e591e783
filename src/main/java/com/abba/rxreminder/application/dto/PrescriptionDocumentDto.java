package com.abba.rxreminder.application.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PrescriptionDocumentDto {

    public static final String NOT_AVAILABLE = "N/A";

    @JsonProperty(value = "hospital_details", required = true)
    private HospitalDetailsDto hospitalDetails = new HospitalDetailsDto();

    @JsonProperty(value = "prescription_info", required = true)
    private PrescriptionInfoDto prescriptionInfo = new PrescriptionInfoDto();

    @JsonProperty(required = true)
    private List<MedicationDto> medications = new ArrayList<>();
}
