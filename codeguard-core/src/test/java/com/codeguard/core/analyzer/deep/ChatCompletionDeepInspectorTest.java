package com.codeguard.core.analyzer.deep;

import com.codeguard.core.analyzer.DeepInspection;
import com.codeguard.core.analyzer.DeepInspectionException;
import com.codeguard.core.analyzer.DeepInspectionRequest;
import com.codeguard.core.config.CodeGuardConfig;
import com.codeguard.core.config.ConfigurationException;
import com.codeguard.core.model.Finding;
import com.codeguard.core.model.SourceFile;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ChatCompletionDeepInspector} against a local HTTP endpoint.
 */
class ChatCompletionDeepInspectorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicReference<String> requestBody = new AtomicReference<>();
    private final AtomicReference<String> authorization = new AtomicReference<>();

    private HttpServer server;
    private volatile int status = 200;
    private volatile String responseBody = "{}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/chat/completions", exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void inspect_withSuccessfulAnswer_parsesMessageContent() throws Exception {
        // Given
        String answer = "{\"confirmed\": [0], \"issues\": [{\"title\": \"Unvalidated input\", "
            + "\"severity\": \"high\", \"line_number\": 1}], \"overall_assessment\": \"ok\"}";
        responseBody = mapper.writeValueAsString(mapper.createObjectNode()
            .set("choices", mapper.createArrayNode().add(mapper.createObjectNode()
                .set("message", mapper.createObjectNode().put("role", "assistant").put("content", answer)))));
        ChatCompletionDeepInspector inspector = inspector("secret-key");

        // When
        DeepInspection inspection = inspector.inspect(request());

        // Then
        assertThat(inspection.confirmed()).containsExactly(0);
        assertThat(inspection.findings()).extracting(Finding::title).containsExactly("Unvalidated input");
        assertThat(authorization.get()).isEqualTo("Bearer secret-key");

        JsonNode sent = mapper.readTree(requestBody.get());
        assertThat(sent.path("model").asText()).isEqualTo("test-model");
        assertThat(sent.path("response_format").path("type").asText()).isEqualTo("json_object");
        assertThat(sent.path("messages")).hasSize(2);
        assertThat(sent.path("messages").path(1).path("content").asText()).contains("handler.py");
    }

    @Test
    void inspect_withoutApiKey_sendsNoAuthorizationHeader() throws Exception {
        // Given
        responseBody = "{\"choices\": [{\"message\": {\"content\": \"{}\"}}]}";
        ChatCompletionDeepInspector inspector = inspector(null);

        // When
        DeepInspection inspection = inspector.inspect(request());

        // Then
        assertThat(inspection.findings()).isEmpty();
        assertThat(authorization.get()).isNull();
    }

    @Test
    void inspect_withErrorStatus_throwsException() {
        // Given
        status = 503;
        responseBody = "model is loading";
        ChatCompletionDeepInspector inspector = inspector(null);

        // When / Then
        assertThatThrownBy(() -> inspector.inspect(request()))
            .isInstanceOf(DeepInspectionException.class)
            .hasMessageContaining("503")
            .hasMessageContaining("model is loading");
    }

    @Test
    void inspect_withEmptyChoices_throwsException() {
        // Given
        responseBody = "{\"choices\": []}";
        ChatCompletionDeepInspector inspector = inspector(null);

        // When / Then
        assertThatThrownBy(() -> inspector.inspect(request()))
            .isInstanceOf(DeepInspectionException.class)
            .hasMessageContaining("empty");
    }

    @ParameterizedTest
    @ValueSource(strings = {"localhost:11434/v1", "ftp://models.internal/v1", "http://", "http://host name/v1"})
    void constructor_withMalformedBaseUrl_throwsConfigurationException(String baseUrl) {
        // Given
        CodeGuardConfig.DeepTierSettings settings =
            new CodeGuardConfig.DeepTierSettings(baseUrl, "test-model", null, 5, null);

        // When / Then
        assertThatThrownBy(() -> new ChatCompletionDeepInspector(settings, null, HttpClient.newHttpClient()))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("deep_tier.base_url");
    }

    private ChatCompletionDeepInspector inspector(String apiKey) {
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1/";
        CodeGuardConfig.DeepTierSettings settings =
            new CodeGuardConfig.DeepTierSettings(baseUrl, "test-model", null, 5, null);
        return new ChatCompletionDeepInspector(settings, apiKey, HttpClient.newHttpClient());
    }

    private static DeepInspectionRequest request() {
        SourceFile file = new SourceFile("handler.py", "def handle(req):\n    return eval(req.body)\n", "python");
        return new DeepInspectionRequest(file, "security", "security", null, List.of());
    }
}
