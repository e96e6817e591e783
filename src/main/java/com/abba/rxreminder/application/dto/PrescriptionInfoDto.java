package com.abba.rxreminder.application.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PrescriptionInfoDto {

    @JsonProperty(value = "doctor_name", required = true)
    private String doctorName = PrescriptionDocumentDto.NOT_AVAILABLE;

    @JsonProperty(value = "doctor_reg_no", required = true)
    private String doctorRegNo = PrescriptionDocumentDto.NOT_AVAILABLE;

    @JsonProperty(value = "doctor_contact", required = true)
    private String doctorContact = PrescriptionDocumentDto.NOT_AVAILABLE;

    @JsonProperty(value = "patient_name", required = true)
    private String patientName = PrescriptionDocumentDto.NOT_AVAILABLE;

    @JsonProperty(value = "patient_age", required = true)
    private String patientAge = PrescriptionDocumentDto.NOT_AVAILABLE;

    @JsonProperty(value = "patient_gender", required = true)
    private String patientGender = PrescriptionDocumentDto.NOT_AVAILABLE;

    @JsonProperty(required = true)
    private String date = PrescriptionDocumentDto.NOT_AVAILABLE;
}
