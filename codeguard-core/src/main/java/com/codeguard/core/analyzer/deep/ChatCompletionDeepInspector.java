package com.codeguard.core.analyzer.deep;

import com.codeguard.core.analyzer.DeepInspection;
import com.codeguard.core.analyzer.DeepInspectionException;
import com.codeguard.core.analyzer.DeepInspectionRequest;
import com.codeguard.core.analyzer.DeepInspector;
import com.codeguard.core.config.CodeGuardConfig;
import com.codeguard.core.config.ConfigurationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Deep inspector backed by an OpenAI-compatible {@code /chat/completions} endpoint
 * (Ollama, DeepSeek, OpenAI, vLLM).
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * DeepInspector inspector = ChatCompletionDeepInspector.fromSettings(config.deepTier());
 * AnalysisContext context = AnalysisContext.builder(analysisConfig)
 *     .deepInspector(inspector)
 *     .build();
 * }</pre>
 *
 * <p>The API key is read from the environment variable named in the settings and sent as a
 * bearer token when present; local servers usually need none. A base URL that is not an
 * absolute http(s) URL is rejected with {@link ConfigurationException} at construction.
 * Non-2xx responses, transport errors and unparseable answers raise
 * {@link DeepInspectionException}.
 *
 * @since 1.0.0
 */
public class ChatCompletionDeepInspector implements DeepInspector {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionDeepInspector.class);

    private static final double TEMPERATURE = 0.1;

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final URI endpoint;
    private final String model;
    private final String apiKey;
    private final Duration requestTimeout;
    private final DeepInspectionPromptBuilder promptBuilder;
    private final DeepInspectionParser parser;

    public ChatCompletionDeepInspector(CodeGuardConfig.DeepTierSettings settings, String apiKey, HttpClient http) {
        Objects.requireNonNull(settings, "settings must not be null");
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint(settings.effectiveBaseUrl());
        this.model = settings.effectiveModel();
        this.apiKey = apiKey;
        this.requestTimeout = settings.effectiveRequestTimeout();
        this.promptBuilder = new DeepInspectionPromptBuilder(settings.effectiveMaxContentChars());
        this.parser = new DeepInspectionParser(mapper);
    }

    /**
     * Creates an inspector from settings, reading the API key from the environment.
     *
     * @param settings deep tier settings
     * @return inspector
     */
    public static ChatCompletionDeepInspector fromSettings(CodeGuardConfig.DeepTierSettings settings) {
        String apiKey = System.getenv(settings.effectiveApiKeyEnv());
        HttpClient http = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .build();
        return new ChatCompletionDeepInspector(settings, apiKey, http);
    }

    @Override
    public DeepInspection inspect(DeepInspectionRequest request) throws DeepInspectionException {
        String body;
        try {
            body = mapper.writeValueAsString(requestBody(request));
        } catch (IOException e) {
            throw new DeepInspectionException("Could not serialize deep inspection request", e);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(endpoint)
            .header("Content-Type", "application/json")
            .timeout(requestTimeout)
            .POST(HttpRequest.BodyPublishers.ofString(body));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }

        log.debug("Requesting deep inspection of {} for {} from {}", request.file().path(), request.analyzerId(), model);
        HttpResponse<String> response;
        try {
            response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DeepInspectionException("Deep inspection request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeepInspectionException("Deep inspection request interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new DeepInspectionException("Deep inspection endpoint returned " + response.statusCode() + ": " + response.body());
        }

        String content;
        try {
            JsonNode root = mapper.readTree(response.body());
            content = root.path("choices").path(0).path("message").path("content").asText("");
            int promptTokens = root.path("usage").path("prompt_tokens").asInt(0);
            int completionTokens = root.path("usage").path("completion_tokens").asInt(0);
            log.debug("Deep inspection of {} used {} prompt and {} completion tokens",
                request.file().path(), promptTokens, completionTokens);
        } catch (IOException e) {
            throw new DeepInspectionException("Deep inspection endpoint returned malformed JSON", e);
        }
        return parser.parse(content, request);
    }

    /**
     * @param baseUrl configured base URL without trailing slash
     * @return chat completions endpoint
     * @throws ConfigurationException if the URL is malformed or not http(s)
     */
    static URI endpoint(String baseUrl) {
        URI uri;
        try {
            uri = new URI(baseUrl + "/chat/completions");
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Invalid deep_tier.base_url '" + baseUrl + "': " + e.getMessage(), e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                || uri.getHost() == null) {
            throw new ConfigurationException(
                "Invalid deep_tier.base_url '" + baseUrl + "': expected an absolute http or https URL");
        }
        return uri;
    }

    private ObjectNode requestBody(DeepInspectionRequest request) {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", model);
        body.put("temperature", TEMPERATURE);
        body.putObject("response_format").put("type", "json_object");

        ArrayNode messages = body.putArray("messages");
        messages.addObject()
            .put("role", "system")
            .put("content", promptBuilder.systemPrompt());
        messages.addObject()
            .put("role", "user")
            .put("content", promptBuilder.userPrompt(request));
        return body;
    }
}
