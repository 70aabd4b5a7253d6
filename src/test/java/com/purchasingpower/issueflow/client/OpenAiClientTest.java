package com.purchasingpower.issueflow.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.purchasingpower.issueflow.config.GlobalRetryConfig;
import com.purchasingpower.issueflow.configuration.AppProperties;
import com.purchasingpower.issueflow.exception.LlmClientException;
import com.purchasingpower.issueflow.support.StubHttpServer;
import com.purchasingpower.issueflow.support.StubHttpServer.Request;
import com.purchasingpower.issueflow.support.StubHttpServer.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OpenAI Client Tests")
class OpenAiClientTest {

    private static final String PATH = "/v1/chat/completions";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private StubHttpServer server;
    private OpenAiClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new StubHttpServer();
        AppProperties props = new AppProperties();
        props.getLlm().setBaseUrl(server.baseUrl() + "/v1");
        props.getLlm().setApiKey("sk-test");
        props.getLlm().setModel("test-model");
        props.getLlm().setReferer("https://example.com/agent");
        GlobalRetryConfig retryConfig = new GlobalRetryConfig();
        retryConfig.setMaxRateLimitWaitMs(20);
        client = new OpenAiClient(props, retryConfig, new StructuredOutputParser(objectMapper));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private static Response completion(String content) {
        String escaped = content.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
        return Response.json(200, "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"" + escaped + "\"}}],"
                + "\"usage\":{\"prompt_tokens\":10,\"completion_tokens\":5,\"total_tokens\":15}}");
    }

    @Test
    @DisplayName("Should send model, messages and headers and return the content")
    void testGenerate_ShouldReturnContent() throws Exception {
        // Given
        server.on("POST", PATH, completion("Hello there"));

        // When
        String answer = client.generate("Say hello", "Be brief");

        // Then
        assertThat(answer).isEqualTo("Hello there");
        Request request = server.requests().get(0);
        assertThat(request.headers().get("authorization")).isEqualTo("Bearer sk-test");
        assertThat(request.headers().get("http-referer")).isEqualTo("https://example.com/agent");

        JsonNode body = objectMapper.readTree(request.body());
        assertThat(body.get("model").asText()).isEqualTo("test-model");
        assertThat(body.get("messages")).hasSize(2);
        assertThat(body.get("messages").get(0).get("role").asText()).isEqualTo("system");
        assertThat(body.get("messages").get(1).get("content").asText()).isEqualTo("Say hello");
        assertThat(body.has("response_format")).isFalse();
    }

    @Test
    @DisplayName("Should retry server errors")
    void testGenerate_ShouldRetryServerError() {
        // Given
        server.on("POST", PATH, Response.json(502, "{\"error\":\"bad gateway\"}"), completion("ok"));

        // When
        String answer = client.generate("p", null);

        // Then
        assertThat(answer).isEqualTo("ok");
        assertThat(server.requests()).hasSize(2);
        assertThat(OpenAiClient.retryWait(
                WebClientResponseException.create(502, "Bad Gateway", new HttpHeaders(), new byte[0], null),
                new GlobalRetryConfig())).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("Should retry a rate-limited completion")
    void testGenerate_ShouldRetryOnRateLimit() {
        // Given
        server.on("POST", PATH,
                Response.json(429, "{\"error\":\"rate limited\"}").withHeader("Retry-After", "3"),
                completion("ok"));

        // When
        String answer = client.generate("p", null);

        // Then
        assertThat(answer).isEqualTo("ok");
        assertThat(server.requests()).hasSize(2);
    }

    @Test
    @DisplayName("Should wait for Retry-After on 429, capped by configuration")
    void testRetryWait_ShouldHonourRetryAfter() {
        // Given
        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.RETRY_AFTER, "3");
        WebClientResponseException tooMany =
                WebClientResponseException.create(429, "Too Many Requests", headers, new byte[0], null);
        WebClientResponseException noHint =
                WebClientResponseException.create(429, "Too Many Requests", new HttpHeaders(), new byte[0], null);
        GlobalRetryConfig config = new GlobalRetryConfig();

        // When / Then
        assertThat(OpenAiClient.retryWait(tooMany, config)).isEqualTo(Duration.ofSeconds(3));
        assertThat(OpenAiClient.retryWait(noHint, config)).isEqualTo(Duration.ofMillis(5000));
        config.setMaxRateLimitWaitMs(1000);
        assertThat(OpenAiClient.retryWait(tooMany, config)).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    @DisplayName("Should fail fast on client errors")
    void testGenerate_ShouldNotRetryBadRequest() {
        // Given
        server.on("POST", PATH, Response.json(400, "{\"error\":\"bad model\"}"));

        // When / Then
        assertThatThrownBy(() -> client.generate("p", null))
                .isInstanceOf(LlmClientException.class)
                .hasMessageContaining("400");
        assertThat(server.requests()).hasSize(1);
    }

    @Test
    @DisplayName("Should request JSON mode for structured output")
    void testGenerateStructured_ShouldUseJsonMode() throws Exception {
        // Given
        server.on("POST", PATH, completion("{\"summary\":\"ok\",\"tasks\":[]}"));

        // When
        ObjectNode result = client.generateStructured("Review this", "Return JSON");

        // Then
        assertThat(result.get("summary").asText()).isEqualTo("ok");
        JsonNode body = objectMapper.readTree(server.requests().get(0).body());
        assertThat(body.get("response_format").get("type").asText()).isEqualTo("json_object");
    }

    @Test
    @DisplayName("Should fall back to a plain completion when JSON mode is rejected")
    void testGenerateStructured_ShouldFallBackWithoutJsonMode() throws Exception {
        // Given
        server.on("POST", PATH,
                Response.json(400, "{\"error\":\"response_format not supported\"}"),
                completion("Sure!\n```json\n{\"restart\": false}\n```"));

        // When
        ObjectNode result = client.generateStructured("Decide", null);

        // Then
        assertThat(result.get("restart").asBoolean()).isFalse();
        List<Request> requests = server.requests();
        assertThat(requests).hasSize(2);
        assertThat(objectMapper.readTree(requests.get(1).body()).has("response_format")).isFalse();
    }

    @Test
    @DisplayName("Should ask the model to repair unparseable output once")
    void testGenerateStructured_ShouldRepairOnce() throws Exception {
        // Given
        server.on("POST", PATH, completion("summary: ok"), completion("{\"summary\":\"ok\"}"));

        // When
        ObjectNode result = client.generateStructured("Review", null);

        // Then
        assertThat(result.get("summary").asText()).isEqualTo("ok");
        JsonNode repairRequest = objectMapper.readTree(server.requests().get(1).body());
        JsonNode messages = repairRequest.get("messages");
        assertThat(messages.get(0).get("content").asText()).isEqualTo(StructuredOutputParser.REPAIR_SYSTEM);
        assertThat(messages.get(1).get("content").asText())
                .startsWith(StructuredOutputParser.REPAIR_PROMPT)
                .endsWith("summary: ok");
    }
}
