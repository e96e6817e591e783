package com.abba.rxreminder.application.service;

import com.abba.rxreminder.infrastructure.config.OpenAiProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.stereotype.Component;
import org.springframework.util.InvalidMimeTypeException;
import org.springframework.util.MimeType;
import org.springframework.util.MimeTypeUtils;

import java.util.List;
import java.util.Objects;

@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiApiService {

    private final OpenAiChatModel openAiChatModel;
    private final OpenAiProperties openAiProperties;

    /**
     * Sends a prompt with one attached image and returns the model's raw text. The answer is
     * constrained to {@code jsonSchema} but is not converted here.
     */
    public String sendPromptWithMedia(String stringPrompt, byte[] mediaBytes, String mimeType, String jsonSchema) {
        if (mediaBytes == null || mediaBytes.length == 0) {
            throw new IllegalArgumentException("mediaBytes cannot be empty");
        }

        MimeType mediaMimeType = parseMimeType(mimeType);
        UserMessage userMessage = UserMessage.builder()
                .text(stringPrompt)
                .media(new Media(mediaMimeType, new ByteArrayResource(mediaBytes)))
                .build();

        var prompt = new Prompt(
                List.of(userMessage),
                OpenAiChatOptions.builder()
                        .model(openAiProperties.getModel())
                        .responseFormat(new ResponseFormat(ResponseFormat.Type.JSON_SCHEMA, jsonSchema))
                        .build()
        );

        log.debug("Sending prompt with {} bytes of {} to OpenAI model={}", mediaBytes.length, mediaMimeType, openAiProperties.getModel());

        var response = openAiChatModel.call(prompt);
        return Objects.requireNonNull(response.getResult().getOutput().getText(), "OpenAI returned no text");
    }

    private MimeType parseMimeType(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return MimeTypeUtils.IMAGE_JPEG;
        }
        try {
            return MimeTypeUtils.parseMimeType(mimeType);
        } catch (InvalidMimeTypeException e) {
            log.debug("Unparseable mime type '{}', sending as image/jpeg", mimeType);
            return MimeTypeUtils.IMAGE_JPEG;
        }
    }
}
