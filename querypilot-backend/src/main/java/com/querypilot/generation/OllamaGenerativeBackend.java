package com.querypilot.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.querypilot.error.ErrorKind;
import com.querypilot.error.QueryPilotException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Generative backend speaking the Ollama {@code /api/generate} protocol over plain HTTP.
 *
 * <p>Configuration is read from the Spring environment, property first and environment variable second:
 * {@code querypilot.llm.base-url} / {@code QUERYPILOT_LLM_BASE_URL}, {@code querypilot.llm.model} /
 * {@code QUERYPILOT_LLM_MODEL}, {@code querypilot.llm.api-key} / {@code QUERYPILOT_LLM_API_KEY} (sent as a
 * bearer token for gateways in front of Ollama) and {@code querypilot.llm.timeout-ms} /
 * {@code QUERYPILOT_LLM_TIMEOUT_MS}.
 */
public class OllamaGenerativeBackend implements GenerativeBackend {

    private static final Logger log = LoggerFactory.getLogger(OllamaGenerativeBackend.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final int DEFAULT_TIMEOUT_MS = 30000;

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final Environment environment;

    public OllamaGenerativeBackend(ObjectMapper objectMapper, Environment environment) {
        this.objectMapper = objectMapper;
        this.environment = environment;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Log whether generation is enabled. Never logs the API key.
     */
    @PostConstruct
    public void logConfigStatus() {
        OllamaConfig config = OllamaConfig.fromEnvironment(environment);
        if (config.isEnabled()) {
            log.info("Statement generation is ENABLED (base_url={}, model={}, api_key_configured={}, timeout_ms={})",
                    config.baseUrl(), config.model(), config.hasApiKey(), config.timeoutMs());
            return;
        }
        log.warn("Statement generation is DISABLED (base_url={}, model_configured=false); set QUERYPILOT_LLM_MODEL",
                config.baseUrl());
    }

    @Override
    public String generate(String prompt, List<String> stopSequences, int maxTokens, double temperature) {
        OllamaConfig config = OllamaConfig.fromEnvironment(environment);
        if (!config.isEnabled()) {
            throw new QueryPilotException(ErrorKind.SERVICE_UNAVAILABLE, "Statement generation is not configured",
                    List.of("Set QUERYPILOT_LLM_MODEL and QUERYPILOT_LLM_BASE_URL"));
        }

        Map<String, Object> options = new HashMap<>();
        options.put("temperature", temperature);
        options.put("num_predict", maxTokens);
        options.put("stop", stopSequences);

        Map<String, Object> payload = new HashMap<>();
        payload.put("model", config.model());
        payload.put("prompt", prompt);
        payload.put("stream", false);
        payload.put("options", options);

        try {
            String json = objectMapper.writeValueAsString(payload);
            HttpRequest.Builder request = HttpRequest.newBuilder()
                    .uri(URI.create(config.baseUrl() + "/api/generate"))
                    .timeout(Duration.ofMillis(config.timeoutMs()))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
            if (config.hasApiKey()) {
                request.header("Authorization", "Bearer " + config.apiKey());
            }

            HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() == 429) {
                throw new QueryPilotException(ErrorKind.RATE_LIMITED, "Generation backend is rate limiting requests",
                        List.of("Retry in a moment"));
            }
            if (response.statusCode() >= 400) {
                log.warn("Generation request failed (status_code={}, base_url={}, model={})",
                        response.statusCode(), config.baseUrl(), config.model());
                throw new QueryPilotException(ErrorKind.SERVICE_UNAVAILABLE,
                        "Generation backend returned HTTP " + response.statusCode(), List.of("Retry in a moment"));
            }

            JsonNode root = objectMapper.readTree(response.body());
            JsonNode text = root.path("response");
            log.debug("Generation completed (model={}, prompt_tokens={}, completion_tokens={})",
                    root.path("model").asText(config.model()), root.path("prompt_eval_count").asInt(-1),
                    root.path("eval_count").asInt(-1));
            return text.isTextual() ? text.asText() : "";
        } catch (IOException e) {
            throw new QueryPilotException(ErrorKind.SERVICE_UNAVAILABLE,
                    "Generation backend unreachable: " + e.getMessage(), List.of("Retry in a moment"), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryPilotException(ErrorKind.TIMEOUT, "Generation was interrupted", List.of(), e);
        }
    }

    /**
     * Immutable backend configuration resolved from properties or environment variables.
     */
    record OllamaConfig(String baseUrl, String model, String apiKey, int timeoutMs) {

        static OllamaConfig fromEnvironment(Environment environment) {
            String baseUrl = getTrimmed(environment, "querypilot.llm.base-url", "QUERYPILOT_LLM_BASE_URL");
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = DEFAULT_BASE_URL;
            }
            while (baseUrl.endsWith("/")) {
                baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
            }
            String model = getTrimmed(environment, "querypilot.llm.model", "QUERYPILOT_LLM_MODEL");
            String apiKey = getTrimmed(environment, "querypilot.llm.api-key", "QUERYPILOT_LLM_API_KEY");

            int timeoutMs = DEFAULT_TIMEOUT_MS;
            String timeoutRaw = getTrimmed(environment, "querypilot.llm.timeout-ms", "QUERYPILOT_LLM_TIMEOUT_MS");
            if (timeoutRaw != null && !timeoutRaw.isBlank()) {
                try {
                    timeoutMs = Integer.parseInt(timeoutRaw);
                } catch (NumberFormatException e) {
                    log.warn("Ignoring invalid generation timeout (value={})", timeoutRaw);
                }
            }
            return new OllamaConfig(baseUrl, model, apiKey, timeoutMs);
        }

        boolean isEnabled() {
            return model != null && !model.isBlank();
        }

        boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        private static String getTrimmed(Environment environment, String propKey, String envKey) {
            if (environment == null) {
                return null;
            }
            String v = environment.getProperty(propKey);
            if (v == null || v.isBlank()) {
                v = environment.getProperty(envKey);
            }
            return v == null ? null : v.trim();
        }
    }
}
