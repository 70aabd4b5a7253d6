package com.purchasingpower.issueflow.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.issueflow.configuration.AppProperties;
import com.purchasingpower.issueflow.service.GitHubEventRouter;
import com.purchasingpower.issueflow.util.WebhookSignatureVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
public class GitHubWebhookController {

    private final GitHubEventRouter eventRouter;
    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;

    /**
     * GitHub webhook endpoint. The body is taken raw so the signature is computed over the exact bytes sent.
     */
    @PostMapping("/webhook/github")
    public ResponseEntity<Map<String, Object>> handleEvent(
            @RequestHeader(value = "X-GitHub-Event", required = false) String event,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature,
            @RequestBody byte[] body) {

        String secret = appProperties.getGithub().getWebhookSecret();
        if (secret == null || secret.isBlank()) {
            log.warn("⚠️ app.github.webhook-secret is not set, accepting unsigned webhook");
        } else if (!WebhookSignatureVerifier.isValid(secret, body, signature)) {
            log.warn("🚫 Rejected {} webhook with invalid signature", event);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "invalid signature"));
        }

        if (event == null || event.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "missing X-GitHub-Event header"));
        }
        if ("ping".equals(event)) {
            return ResponseEntity.ok(Map.of("status", "pong"));
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(body);
        } catch (IOException e) {
            log.error("Failed to parse GitHub webhook JSON", e);
            return ResponseEntity.badRequest().body(Map.of("error", "invalid JSON payload"));
        }
        if (payload == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "empty payload"));
        }

        log.info("📬 Received GitHub {} webhook ({})", event, payload.path("action").asText("-"));
        List<String> triggered = eventRouter.route(event, payload);
        if (triggered.isEmpty()) {
            return ResponseEntity.ok(Map.of("status", "ignored"));
        }
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "triggered", triggered));
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }
}
