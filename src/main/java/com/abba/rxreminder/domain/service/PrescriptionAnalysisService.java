package com.abba.rxreminder.domain.service;

import com.abba.rxreminder.application.dto.PrescriptionDocumentDto;

public interface PrescriptionAnalysisService {

    PrescriptionDocumentDto analyze(byte[] imageBytes, String mimeType);
}
