package com.abba.rxreminder.infrastructure.sms;

import com.abba.rxreminder.application.service.PhoneNumberNormalizer;
import com.abba.rxreminder.domain.exception.DeliveryException;
import com.abba.rxreminder.domain.service.SmsGateway;
import com.abba.rxreminder.infrastructure.config.TwilioProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import okhttp3.Credentials;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class TwilioSmsGateway implements SmsGateway {

    private static final Logger log = LoggerFactory.getLogger(TwilioSmsGateway.class);

    private final TwilioProperties twilioProperties;
    private final ObjectMapper objectMapper;
    private final OkHttpClient httpClient = new OkHttpClient();

    @Override
    public String send(String to, String body) {
        if (!twilioProperties.isEnabled()) {
            log.info("[SMS disabled] Would send to={} length={}", PhoneNumberNormalizer.mask(to), body == null ? 0 : body.length());
            return "disabled-" + UUID.randomUUID();
        }
        ensureConfigured();

        FormBody form = new FormBody.Builder()
                .add("To", to)
                .add("From", twilioProperties.getFromNumber())
                .add("Body", body)
                .build();
        Request request = new Request.Builder()
                .url(baseUrl() + "/2010-04-01/Accounts/" + twilioProperties.getAccountSid() + "/Messages.json")
                .addHeader("Authorization", Credentials.basic(twilioProperties.getAccountSid(), twilioProperties.getAuthToken()))
                .post(form)
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            String responseBody = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                String providerMessage = providerMessage(responseBody);
                log.warn("Twilio rejected message to={} status={} message={}", PhoneNumberNormalizer.mask(to), response.code(), providerMessage);
                throw new DeliveryException("SMS provider rejected the message with status " + response.code(), providerMessage);
            }
            String sid = objectMapper.readTree(responseBody).path("sid").asText(null);
            if (sid == null || sid.isBlank()) {
                throw new DeliveryException("SMS provider response has no message sid", responseBody);
            }
            return sid;
        } catch (IOException e) {
            throw new DeliveryException("Failed to reach SMS provider", e);
        }
    }

    private String providerMessage(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(responseBody);
            return root.path("message").asText(responseBody);
        } catch (IOException e) {
            return responseBody;
        }
    }

    private void ensureConfigured() {
        if (isBlank(twilioProperties.getAccountSid()) || isBlank(twilioProperties.getAuthToken()) || isBlank(twilioProperties.getFromNumber())) {
            throw new DeliveryException("Twilio credentials are not configured", "account-sid, auth-token and from-number are required");
        }
    }

    private String baseUrl() {
        String baseUrl = twilioProperties.getApiBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            return "https://api.twilio.com";
        }
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
