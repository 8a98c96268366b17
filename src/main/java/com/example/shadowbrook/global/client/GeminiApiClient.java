package com.example.shadowbrook.global.client;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Gemini generateContent API 호출 클라이언트.
 * 실패하면 null 을 반환하고, 대체 문구는 호출하는 쪽에서 결정합니다.
 */
@Component
@Slf4j
public class GeminiApiClient {

    private final String apiKey;
    private final String apiUrl;
    private final String model;
    private final String summaryModel;
    private final RestClient restClient;

    public GeminiApiClient(
            @Value("${gemini.api-key:}") String apiKey,
            @Value("${gemini.url:https://generativelanguage.googleapis.com/v1beta/models}") String apiUrl,
            @Value("${gemini.model:gemini-2.5-flash}") String model,
            @Value("${gemini.summary-model:gemini-2.5-pro}") String summaryModel,
            @Value("${gemini.connect-timeout-ms:5000}") int connectTimeoutMs,
            @Value("${gemini.read-timeout-ms:20000}") int readTimeoutMs) {
        this.apiKey = apiKey;
        this.apiUrl = apiUrl;
        this.model = model;
        this.summaryModel = summaryModel;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);
        this.restClient = RestClient.builder()
                .requestFactory(requestFactory)
                .build();
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * 일반 텍스트 생성 (내레이션용 모델)
     */
    public String generateContent(String prompt) {
        return call(model, new GeminiRequest(contentsOf(prompt), null));
    }

    /**
     * JSON 응답 생성 (요약용 모델). 응답 스키마를 함께 전달합니다.
     */
    public String generateJson(String prompt, Map<String, Object> responseSchema) {
        GenerationConfig config = new GenerationConfig(MediaType.APPLICATION_JSON_VALUE, responseSchema);
        return call(summaryModel, new GeminiRequest(contentsOf(prompt), config));
    }

    private String call(String modelName, GeminiRequest request) {
        if (!isConfigured()) {
            log.warn("Gemini API Key is missing. Please set 'gemini.api-key' in application.properties.");
            return null;
        }

        try {
            GeminiResponse response = restClient.post()
                    .uri(apiUrl + "/" + modelName + ":generateContent?key=" + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(GeminiResponse.class);

            String text = extractText(response);
            if (text == null) {
                log.warn("Gemini API returned empty response: model={}", modelName);
            }
            return text;
        } catch (RestClientException e) {
            log.warn("Failed to call Gemini API: model={}, error={}", modelName, e.getMessage());
            return null;
        }
    }

    private String extractText(GeminiResponse response) {
        if (response == null || response.candidates() == null || response.candidates().isEmpty()) {
            return null;
        }
        GeminiContent content = response.candidates().get(0).content();
        if (content == null || content.parts() == null || content.parts().isEmpty()) {
            return null;
        }
        String text = content.parts().get(0).text();
        return text == null || text.isBlank() ? null : text;
    }

    private List<GeminiContent> contentsOf(String prompt) {
        return List.of(new GeminiContent(List.of(new GeminiPart(prompt))));
    }

    // DTOs
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record GeminiRequest(List<GeminiContent> contents, GenerationConfig generationConfig) {
    }

    public record GeminiContent(List<GeminiPart> parts) {
    }

    public record GeminiPart(String text) {
    }

    public record GenerationConfig(String responseMimeType, Map<String, Object> responseSchema) {
    }

    public record GeminiResponse(List<Candidate> candidates) {
    }

    public record Candidate(GeminiContent content) {
    }
}
