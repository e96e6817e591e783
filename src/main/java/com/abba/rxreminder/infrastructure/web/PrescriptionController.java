package com.abba.rxreminder.infrastructure.web;

import com.abba.rxreminder.application.dto.PrescriptionDocumentDto;
import com.abba.rxreminder.domain.exception.InvalidParameterException;
import com.abba.rxreminder.domain.exception.MissingParameterException;
import com.abba.rxreminder.domain.service.PrescriptionAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PrescriptionController {

    private final PrescriptionAnalysisService prescriptionAnalysisService;

    @PostMapping("/analyze-prescription")
    public ResponseEntity<PrescriptionDocumentDto> analyzePrescription(@RequestParam(value = "file", required = false) MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new MissingParameterException("No image file provided");
        }
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new InvalidParameterException("Invalid file type. Please upload an image.");
        }

        log.info("Analyzing prescription upload size={} contentType={}", file.getSize(), contentType);
        byte[] imageBytes;
        try {
            imageBytes = file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read uploaded file", e);
        }
        return ResponseEntity.ok(prescriptionAnalysisService.analyze(imageBytes, contentType));
    }
}
