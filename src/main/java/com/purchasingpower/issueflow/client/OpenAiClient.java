package com.purchasingpower.issueflow.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.purchasingpower.issueflow.config.GlobalRetryConfig;
import com.purchasingpower.issueflow.configuration.AppProperties;
import com.purchasingpower.issueflow.configuration.LlmProperties;
import com.purchasingpower.issueflow.exception.LlmClientException;
import com.purchasingpower.issueflow.model.CallContext;
import com.purchasingpower.issueflow.model.ServiceType;
import com.purchasingpower.issueflow.util.ExternalCallLogger;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completions client ({@code POST {base-url}/chat/completions}).
 *
 * <p>Plain completions are retried up to three attempts on 429, 5xx and transport errors;
 * 429 waits for {@code Retry-After}. Structured completions first ask for
 * {@code response_format: json_object} once and fall back to a plain completion when the
 * endpoint rejects it.
 */
@Slf4j
@Component
public class OpenAiClient implements LlmClient {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration RESPONSE_TIMEOUT = Duration.ofSeconds(60);

    private final LlmProperties llm;
    private final StructuredOutputParser parser;
    private final GlobalRetryConfig retryConfig;
    private final WebClient webClient;

    public OpenAiClient(AppProperties props, GlobalRetryConfig retryConfig, StructuredOutputParser parser) {
        this.llm = props.getLlm();
        this.retryConfig = retryConfig;
        this.parser = parser;

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) CONNECT_TIMEOUT.toMillis())
                .responseTimeout(RESPONSE_TIMEOUT);
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(llm.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build());
        if (llm.getApiKey() != null && !llm.getApiKey().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + llm.getApiKey());
        }
        if (llm.getReferer() != null && !llm.getReferer().isBlank()) {
            builder.defaultHeader("HTTP-Referer", llm.getReferer());
        }
        if (llm.getTitle() != null && !llm.getTitle().isBlank()) {
            builder.defaultHeader("X-Title", llm.getTitle());
        }
        this.webClient = builder.build();
    }

    @Override
    public String generate(String prompt, String system) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.LLM, "generate", log);
        callCtx.logRequest(ExternalCallLogger.truncate(prompt, 200), "model", llm.getModel());
        try {
            String content = complete(prompt, system, false).retryWhen(buildRetrySpec(callCtx)).block();
            callCtx.logResponse(ExternalCallLogger.truncate(content, 200));
            return content;
        } catch (WebClientResponseException e) {
            callCtx.logError("HTTP " + e.getStatusCode().value(), e);
            throw new LlmClientException("Chat completion failed with HTTP " + e.getStatusCode().value()
                    + ": " + ExternalCallLogger.truncate(e.getResponseBodyAsString(), 300), e);
        } catch (WebClientRequestException e) {
            callCtx.logError(e.getMessage(), e);
            throw new LlmClientException("Chat completion request failed: " + e.getMessage(), e);
        }
    }

    @Override
    public ObjectNode generateStructured(String prompt, String system) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.LLM, "generateStructured", log);
        callCtx.logRequest(ExternalCallLogger.truncate(prompt, 200), "model", llm.getModel());

        String content;
        try {
            content = complete(prompt, system, true).block();
            callCtx.logResponse(ExternalCallLogger.truncate(content, 200));
        } catch (WebClientResponseException | WebClientRequestException | LlmClientException e) {
            log.warn("⚠️ Structured response_format failed ({}), falling back to plain completion", e.getMessage());
            content = generate(prompt, system);
        }
        return parser.parse(content, this);
    }

    private Mono<String> complete(String prompt, String system, boolean jsonMode) {
        List<Map<String, String>> messages = new ArrayList<>();
        if (system != null && !system.isBlank()) {
            messages.add(Map.of("role", "system", "content", system));
        }
        messages.add(Map.of("role", "user", "content", prompt));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", llm.getModel());
        body.put("messages", messages);
        if (jsonMode) {
            body.put("response_format", Map.of("type", "json_object"));
        }

        return webClient.post()
                .uri("/chat/completions")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .switchIfEmpty(Mono.error(() -> new LlmClientException("Empty response from chat completion endpoint")))
                .map(OpenAiClient::contentOf);
    }

    private static String contentOf(JsonNode response) {
        JsonNode usage = response.path("usage");
        if (!usage.isMissingNode()) {
            log.info("📊 LLM usage: prompt={} completion={} total={}",
                    usage.path("prompt_tokens").asInt(),
                    usage.path("completion_tokens").asInt(),
                    usage.path("total_tokens").asInt());
        }

        JsonNode message = response.path("choices").path(0).path("message").path("content");
        return message.isNull() || message.isMissingNode() ? "" : message.asText();
    }

    /**
     * 429, 5xx and transport failures are retried; 429 waits for {@code Retry-After} first.
     */
    private Retry buildRetrySpec(CallContext callCtx) {
        return RetrySpecs.serverPaced(
                retryConfig.getMaxAttempts(),
                OpenAiClient::isRetryable,
                ex -> retryWait(ex, retryConfig),
                callCtx);
    }

    private static boolean isRetryable(Throwable ex) {
        if (ex instanceof WebClientResponseException webEx) {
            int status = webEx.getStatusCode().value();
            return status == 429 || webEx.getStatusCode().is5xxServerError();
        }
        return ex instanceof WebClientRequestException || ex instanceof LlmClientException;
    }

    static Duration retryWait(Throwable ex, GlobalRetryConfig config) {
        if (!(ex instanceof WebClientResponseException webEx) || webEx.getStatusCode().value() != 429) {
            return Duration.ZERO;
        }
        String retryAfter = webEx.getHeaders().getFirst(HttpHeaders.RETRY_AFTER);
        long waitMs = config.getRateLimitWaitMs();
        if (retryAfter != null && retryAfter.trim().matches("\\d+")) {
            waitMs = Long.parseLong(retryAfter.trim()) * 1000;
        }
        return Duration.ofMillis(Math.min(waitMs, config.getMaxRateLimitWaitMs()));
    }
}
