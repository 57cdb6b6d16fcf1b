package my.cmmloutcomes.app.llm;

import org.jspecify.annotations.NonNull;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for OpenAI-compatible {@code /chat/completions} endpoints in JSON mode.
 */
public class OpenAiLlmClient implements LlmClient {
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofMinutes(2);
    private static final double TEMPERATURE = 0.1;
    private static final String SYSTEM_PROMPT = "You extract clinical trial outcomes from biomedical literature. "
            + "Respond in JSON only. Do not wrap in Markdown code fences.";
    private final RestClient restClient;
    private final String model;

    public OpenAiLlmClient(String baseUrl, String apiKey, String model) {
        this(baseUrl, apiKey, model, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
    }

    public OpenAiLlmClient(String baseUrl, String apiKey, String model, Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout);
        requestFactory.setReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
        this.restClient = RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.model = model;
    }

    public String getModel() {
        return model;
    }

    @Override
    public LlmResponse runJsonPrompt(String prompt, int maxOutputTokens) {
        Map<String, Object> request = buildRequest(prompt, maxOutputTokens);
        Map<?, ?> response;
        try {
            response = restClient.post().uri("/chat/completions").body(request).retrieve().body(Map.class);
        } catch (RestClientResponseException ex) {
            throw new LlmRequestException(safeMessage(ex), ex.getStatusCode().value(), isRetryable(ex), ex);
        } catch (ResourceAccessException ex) {
            throw new LlmRequestException(safeMessage(ex), null, true, ex);
        } catch (Exception ex) {
            throw new LlmRequestException(safeMessage(ex), null, false, ex);
        }
        return toResponse(response);
    }

    private Map<String, Object> buildRequest(String prompt, int maxOutputTokens) {
        Map<String, Object> request = new HashMap<>();
        request.put("model", model);
        request.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt == null ? "" : prompt)
        ));
        request.put("temperature", TEMPERATURE);
        if (maxOutputTokens > 0) {
            request.put("max_tokens", maxOutputTokens);
        }
        request.put("response_format", Map.of("type", "json_object"));
        return request;
    }

    private @NonNull LlmResponse toResponse(Map<?, ?> response) {
        String responseModel = model;
        if (response != null && response.get("model") instanceof String reported && !reported.isBlank()) {
            responseModel = reported;
        }
        if (response == null || !(response.get("choices") instanceof List<?> choices) || choices.isEmpty()) {
            return new LlmResponse("", responseModel);
        }
        Object first = choices.get(0);
        if (!(first instanceof Map<?, ?> choice) || !(choice.get("message") instanceof Map<?, ?> message)) {
            return new LlmResponse("", responseModel);
        }
        Object content = message.get("content");
        return new LlmResponse(content == null ? "" : content.toString(), responseModel);
    }

    private boolean isRetryable(RestClientResponseException ex) {
        if (ex == null || ex.getStatusCode() == null) {
            return false;
        }
        int status = ex.getStatusCode().value();
        return status == 408 || status == 429 || status >= 500;
    }

    private String safeMessage(Exception ex) {
        if (ex == null) {
            return "Unknown error";
        }
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        return message;
    }
}
