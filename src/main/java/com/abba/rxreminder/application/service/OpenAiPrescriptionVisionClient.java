package com.abba.rxreminder.application.service;

import com.abba.rxreminder.application.dto.PrescriptionDocumentDto;
import com.abba.rxreminder.domain.service.PrescriptionVisionClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.stereotype.Component;

@Component
public class OpenAiPrescriptionVisionClient implements PrescriptionVisionClient {

    private final OpenAiApiService openAiApiService;
    private final String documentSchema;

    public OpenAiPrescriptionVisionClient(OpenAiApiService openAiApiService) {
        this.openAiApiService = openAiApiService;
        this.documentSchema = new BeanOutputConverter<>(PrescriptionDocumentDto.class).getJsonSchema();
    }

    @Override
    public String extract(byte[] imageBytes, String mimeType) {
        return openAiApiService.sendPromptWithMedia(buildVisionPrompt(), imageBytes, mimeType, documentSchema);
    }

    private String buildVisionPrompt() {
        return String.format("""
                Analyze this prescription image and extract its details as a single JSON object.
                Do not add any text or markdown outside of the JSON object.
                The JSON must follow this schema:
                %s
                Rules:
                - Extract every value from the image. If a value is not present, use 'N/A'.
                - Do not invent personal information.
                - For medication details (dosage, frequency, duration, timing), if a value is missing,
                  suggest a standard clinical value and set its 'source_details' entry to 'AI Suggested'.
                  Otherwise set it to 'Prescription'.
                - Give a 'confidence_details' percentage for extracted values, or 'N/A' for suggested ones.
                - In 'estimated_price_range_inr' give a rough price range in INR for the medication as
                  typically sold in India (e.g. '₹50-₹80 per strip'), or 'N/A' if unknown.
                """, documentSchema);
    }
}
