package com.abba.rxreminder.application.service;

import com.abba.rxreminder.application.dto.ConfidenceDetailsDto;
import com.abba.rxreminder.application.dto.HospitalDetailsDto;
import com.abba.rxreminder.application.dto.MedicationDto;
import com.abba.rxreminder.application.dto.MedicationInstructionsDto;
import com.abba.rxreminder.application.dto.PrescriptionDocumentDto;
import com.abba.rxreminder.application.dto.PrescriptionInfoDto;
import com.abba.rxreminder.domain.exception.ExtractionParseException;
import com.abba.rxreminder.domain.exception.MissingParameterException;
import com.abba.rxreminder.domain.exception.RxReminderException;
import com.abba.rxreminder.domain.exception.UpstreamServiceException;
import com.abba.rxreminder.domain.service.PrescriptionAnalysisService;
import com.abba.rxreminder.domain.service.PrescriptionVisionClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static com.abba.rxreminder.application.dto.PrescriptionDocumentDto.NOT_AVAILABLE;

@Service
@Slf4j
@RequiredArgsConstructor
public class PrescriptionAnalysisServiceImpl implements PrescriptionAnalysisService {

    private final PrescriptionVisionClient prescriptionVisionClient;
    private final ObjectMapper objectMapper;

    @Override
    public PrescriptionDocumentDto analyze(byte[] imageBytes, String mimeType) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new MissingParameterException("No image file provided");
        }

        String rawText;
        try {
            rawText = prescriptionVisionClient.extract(imageBytes, mimeType);
        } catch (RxReminderException e) {
            throw e;
        } catch (Exception e) {
            log.error("AI service call failed ({}): {}", e.getClass().getSimpleName(), e.getMessage(), e);
            throw new UpstreamServiceException("An internal server error occurred while contacting the AI service.", e);
        }

        String cleanedText = AiResponseCleaner.clean(rawText);
        log.debug("Raw AI response: {}", rawText);
        log.debug("Cleaned text for JSON parsing: {}", cleanedText);

        PrescriptionDocumentDto document;
        try {
            document = objectMapper.readerFor(PrescriptionDocumentDto.class)
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readValue(cleanedText);
        } catch (JsonProcessingException e) {
            log.error("JSON parsing error: {}. Failed on text: {}", e.getOriginalMessage(), rawText);
            throw new ExtractionParseException("Failed to parse the AI service response.", e.getOriginalMessage(), e);
        }
        if (document == null) {
            log.error("AI response parsed to null. Failed on text: {}", rawText);
            throw new ExtractionParseException("Failed to parse the AI service response.", "Response is not a JSON object", null);
        }

        PrescriptionDocumentDto normalized = normalize(document);
        log.info("Prescription analyzed with {} medication(s)", normalized.getMedications().size());
        return normalized;
    }

    private PrescriptionDocumentDto normalize(PrescriptionDocumentDto document) {
        HospitalDetailsDto hospital = document.getHospitalDetails() == null ? new HospitalDetailsDto() : document.getHospitalDetails();
        hospital.setName(orNotAvailable(hospital.getName()));
        hospital.setAddress(orNotAvailable(hospital.getAddress()));
        hospital.setPhone(orNotAvailable(hospital.getPhone()));
        document.setHospitalDetails(hospital);

        PrescriptionInfoDto info = document.getPrescriptionInfo() == null ? new PrescriptionInfoDto() : document.getPrescriptionInfo();
        info.setDoctorName(orNotAvailable(info.getDoctorName()));
        info.setDoctorRegNo(orNotAvailable(info.getDoctorRegNo()));
        info.setDoctorContact(orNotAvailable(info.getDoctorContact()));
        info.setPatientName(orNotAvailable(info.getPatientName()));
        info.setPatientAge(orNotAvailable(info.getPatientAge()));
        info.setPatientGender(orNotAvailable(info.getPatientGender()));
        info.setDate(orNotAvailable(info.getDate()));
        document.setPrescriptionInfo(info);

        List<MedicationDto> medications = document.getMedications() == null ? List.of() : document.getMedications();
        document.setMedications(medications.stream()
                .filter(Objects::nonNull)
                .map(this::normalizeMedication)
                .collect(Collectors.toCollection(ArrayList::new)));
        return document;
    }

    private MedicationDto normalizeMedication(MedicationDto medication) {
        medication.setTabletName(orNotAvailable(medication.getTabletName()));
        medication.setInstructions(normalizeInstructions(medication.getInstructions()));
        medication.setSourceDetails(normalizeInstructions(medication.getSourceDetails()));

        ConfidenceDetailsDto confidence = medication.getConfidenceDetails() == null ? new ConfidenceDetailsDto() : medication.getConfidenceDetails();
        confidence.setTabletName(orNotAvailable(confidence.getTabletName()));
        confidence.setDosage(orNotAvailable(confidence.getDosage()));
        confidence.setFrequency(orNotAvailable(confidence.getFrequency()));
        confidence.setDuration(orNotAvailable(confidence.getDuration()));
        confidence.setTiming(orNotAvailable(confidence.getTiming()));
        medication.setConfidenceDetails(confidence);

        medication.setEstimatedPriceRangeInr(orNotAvailable(medication.getEstimatedPriceRangeInr()));
        return medication;
    }

    private MedicationInstructionsDto normalizeInstructions(MedicationInstructionsDto instructions) {
        MedicationInstructionsDto normalized = instructions == null ? new MedicationInstructionsDto() : instructions;
        normalized.setDosage(orNotAvailable(normalized.getDosage()));
        normalized.setFrequency(orNotAvailable(normalized.getFrequency()));
        normalized.setDuration(orNotAvailable(normalized.getDuration()));
        normalized.setTiming(orNotAvailable(normalized.getTiming()));
        return normalized;
    }

    private String orNotAvailable(String value) {
        if (value == null || value.isBlank()) {
            return NOT_AVAILABLE;
        }
        return value.trim();
    }
}
