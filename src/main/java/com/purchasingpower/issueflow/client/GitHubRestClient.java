package com.purchasingpower.issueflow.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.issueflow.config.GlobalRetryConfig;
import com.purchasingpower.issueflow.configuration.AppProperties;
import com.purchasingpower.issueflow.exception.GitHubApiException;
import com.purchasingpower.issueflow.model.CallContext;
import com.purchasingpower.issueflow.model.ServiceType;
import com.purchasingpower.issueflow.model.github.FileUpdate;
import com.purchasingpower.issueflow.model.github.GitHubIssue;
import com.purchasingpower.issueflow.model.github.IssueComment;
import com.purchasingpower.issueflow.model.github.PullRequest;
import com.purchasingpower.issueflow.model.github.ReviewComment;
import com.purchasingpower.issueflow.model.github.WorkflowRun;
import com.purchasingpower.issueflow.util.ExternalCallLogger;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * GitHub REST v3 client on top of WebClient.
 *
 * <p>Every call is retried up to {@code app.retry.max-attempts} times when GitHub answers
 * 403 or 429, waiting until {@code X-RateLimit-Reset} (or {@code Retry-After}) and falling
 * back to {@code app.retry.rate-limit-wait-ms}.
 */
@Slf4j
@Component
public class GitHubRestClient implements GitHubClient {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration RESPONSE_TIMEOUT = Duration.ofSeconds(30);
    private static final int PAGE_SIZE = 100;

    private final WebClient webClient;
    private final GlobalRetryConfig retryConfig;

    public GitHubRestClient(AppProperties props, GlobalRetryConfig retryConfig) {
        this.retryConfig = retryConfig;
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) CONNECT_TIMEOUT.toMillis())
                .responseTimeout(RESPONSE_TIMEOUT);
        this.webClient = WebClient.builder()
                .baseUrl(props.getGithub().getApiUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getGithub().getToken())
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .defaultHeader("X-GitHub-Api-Version", "2022-11-28")
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build())
                .build();
    }

    @Override
    public GitHubIssue getIssue(String repo, int issueNumber) {
        JsonNode node = execute("getIssue", repo + "#" + issueNumber, getJson(
                "/repos/" + repo + "/issues/" + issueNumber));

        List<String> labels = new ArrayList<>();
        node.path("labels").forEach(label -> labels.add(label.path("name").asText()));
        return new GitHubIssue(
                node.path("number").asInt(issueNumber),
                node.path("title").asText(""),
                node.path("body").isNull() ? "" : node.path("body").asText(""),
                node.path("state").asText(""),
                labels);
    }

    @Override
    public List<IssueComment> getIssueComments(String repo, int issueNumber) {
        List<IssueComment> comments = new ArrayList<>();
        for (int page = 1; ; page++) {
            JsonNode batch = execute("getIssueComments", repo + "#" + issueNumber + " page " + page,
                    getJson("/repos/" + repo + "/issues/" + issueNumber
                            + "/comments?per_page=" + PAGE_SIZE + "&page=" + page));
            if (batch == null || !batch.isArray()) {
                break;
            }
            batch.forEach(c -> comments.add(toComment(c)));
            if (batch.size() < PAGE_SIZE) {
                break;
            }
        }
        return comments;
    }

    @Override
    public boolean canPush(String repo) {
        JsonNode node = execute("canPush", repo, getJson("/repos/" + repo));
        JsonNode permissions = node.path("permissions");
        return permissions.path("push").asBoolean(false) || permissions.path("admin").asBoolean(false);
    }

    @Override
    public Optional<PullRequest> findPullByHead(String repo, String head) {
        JsonNode pulls = execute("findPullByHead", repo + " head=" + head, webClient.get()
                .uri(b -> b.path("/repos/" + repo + "/pulls")
                        .queryParam("state", "all")
                        .queryParam("head", head)
                        .build())
                .retrieve()
                .bodyToMono(JsonNode.class));
        if (pulls == null || !pulls.isArray() || pulls.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toPull(pulls.get(0)));
    }

    @Override
    public PullRequest getPull(String repo, int pullNumber) {
        return toPull(execute("getPull", repo + "#" + pullNumber,
                getJson("/repos/" + repo + "/pulls/" + pullNumber)));
    }

    @Override
    public PullRequest createPullRequest(String repo, String head, String base, String title, String body) {
        JsonNode node = execute("createPullRequest", repo + " " + head + " → " + base, webClient.post()
                .uri("/repos/" + repo + "/pulls")
                .bodyValue(Map.of("title", title, "body", body, "head", head, "base", base))
                .retrieve()
                .bodyToMono(JsonNode.class));
        PullRequest pr = toPull(node);
        log.info("🔀 Created PR #{} {}", pr.number(), pr.htmlUrl());
        return pr;
    }

    @Override
    public PullRequest updatePullRequest(String repo, int pullNumber, String title, String body) {
        JsonNode node = execute("updatePullRequest", repo + "#" + pullNumber, webClient.patch()
                .uri("/repos/" + repo + "/pulls/" + pullNumber)
                .bodyValue(Map.of("title", title, "body", body))
                .retrieve()
                .bodyToMono(JsonNode.class));
        log.info("🔀 Updated PR #{}", pullNumber);
        return toPull(node);
    }

    @Override
    public String getPullRequestDiff(String repo, int pullNumber) {
        String diff = execute("getPullRequestDiff", repo + "#" + pullNumber, webClient.get()
                .uri("/repos/" + repo + "/pulls/" + pullNumber)
                .header(HttpHeaders.ACCEPT, "application/vnd.github.v3.diff")
                .retrieve()
                .bodyToMono(String.class));
        return diff == null ? "" : diff;
    }

    @Override
    public void addIssueComment(String repo, int issueOrPullNumber, String body) {
        execute("addIssueComment", repo + "#" + issueOrPullNumber, webClient.post()
                .uri("/repos/" + repo + "/issues/" + issueOrPullNumber + "/comments")
                .bodyValue(Map.of("body", body))
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void ensureBranch(String repo, String baseBranch, String branch) {
        if (findRefSha(repo, branch).isPresent()) {
            return;
        }
        String baseSha = findRefSha(repo, baseBranch)
                .orElseThrow(() -> new GitHubApiException("ensureBranch", 404,
                        "base branch " + baseBranch + " not found", null));
        execute("createRef", repo + " " + branch, webClient.post()
                .uri("/repos/" + repo + "/git/refs")
                .bodyValue(Map.of("ref", "refs/heads/" + branch, "sha", baseSha))
                .retrieve()
                .toBodilessEntity());
        log.info("🌿 Created branch {} from {} on {}", branch, baseBranch, repo);
    }

    @Override
    public void applyFileChanges(String repo, String branch, List<FileUpdate> files, String commitMessage) {
        for (FileUpdate file : files) {
            Optional<String> existingSha = findContentSha(repo, branch, file.path());
            String uri = "/repos/" + repo + "/contents/" + file.path();

            if (file.delete()) {
                if (existingSha.isEmpty()) {
                    continue;
                }
                Map<String, Object> body = Map.of(
                        "message", commitMessage, "sha", existingSha.get(), "branch", branch);
                execute("deleteFile", file.path(), webClient.method(HttpMethod.DELETE)
                        .uri(uri)
                        .bodyValue(body)
                        .retrieve()
                        .toBodilessEntity());
                continue;
            }

            Map<String, Object> body = new HashMap<>();
            body.put("message", commitMessage);
            body.put("branch", branch);
            body.put("content", Base64.getEncoder().encodeToString(
                    file.content().getBytes(StandardCharsets.UTF_8)));
            existingSha.ifPresent(sha -> body.put("sha", sha));
            execute(existingSha.isPresent() ? "updateFile" : "createFile", file.path(), webClient.put()
                    .uri(uri)
                    .bodyValue(body)
                    .retrieve()
                    .toBodilessEntity());
        }
        log.info("📝 Applied {} file change(s) to {}:{} through the contents API", files.size(), repo, branch);
    }

    @Override
    public List<WorkflowRun> getWorkflowRuns(String repo, int pullNumber) {
        JsonNode node = execute("getWorkflowRuns", repo + "#" + pullNumber,
                getJson("/repos/" + repo + "/actions/runs?per_page=" + PAGE_SIZE));

        List<WorkflowRun> runs = new ArrayList<>();
        for (JsonNode run : node.path("workflow_runs")) {
            List<Integer> prNumbers = new ArrayList<>();
            run.path("pull_requests").forEach(pr -> prNumbers.add(pr.path("number").asInt()));
            if (!prNumbers.contains(pullNumber)) {
                continue;
            }
            runs.add(new WorkflowRun(
                    run.path("id").asLong(),
                    run.path("name").asText(""),
                    run.path("status").asText(""),
                    run.path("conclusion").isNull() ? null : run.path("conclusion").asText(null),
                    run.path("head_branch").asText(""),
                    run.path("head_sha").asText(""),
                    prNumbers));
        }
        return runs;
    }

    @Override
    public void createReview(String repo, int pullNumber, String event, String body, List<ReviewComment> comments) {
        List<Map<String, Object>> inline = comments.stream()
                .map(c -> Map.<String, Object>of("path", c.path(), "line", c.line(), "body", c.body()))
                .toList();
        execute("createReview", repo + "#" + pullNumber + " " + event, webClient.post()
                .uri("/repos/" + repo + "/pulls/" + pullNumber + "/reviews")
                .bodyValue(Map.of("event", event, "body", body, "comments", inline))
                .retrieve()
                .toBodilessEntity());
    }

    private Optional<String> findRefSha(String repo, String branch) {
        try {
            JsonNode ref = execute("getRef", repo + " " + branch,
                    getJson("/repos/" + repo + "/git/ref/heads/" + branch));
            return Optional.ofNullable(ref.path("object").path("sha").asText(null));
        } catch (GitHubApiException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    private Optional<String> findContentSha(String repo, String branch, String path) {
        try {
            JsonNode content = execute("getContents", path + "@" + branch, webClient.get()
                    .uri(b -> b.path("/repos/" + repo + "/contents/" + path)
                            .queryParam("ref", branch)
                            .build())
                    .retrieve()
                    .bodyToMono(JsonNode.class));
            return Optional.ofNullable(content.path("sha").asText(null));
        } catch (GitHubApiException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    private Mono<JsonNode> getJson(String uri) {
        return webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    private <T> T execute(String operation, String summary, Mono<T> call) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GITHUB, operation, log);
        callCtx.logRequest(summary);
        try {
            T result = call.retryWhen(buildRetrySpec(callCtx)).block();
            callCtx.logResponse(null);
            return result;
        } catch (WebClientResponseException e) {
            // 404 is an expected answer for ref and content probes
            if (e.getStatusCode().value() != 404) {
                callCtx.logError("HTTP " + e.getStatusCode().value(), e);
            }
            throw new GitHubApiException(operation, e.getStatusCode().value(),
                    ExternalCallLogger.truncate(e.getResponseBodyAsString(), 500), e);
        } catch (WebClientRequestException e) {
            callCtx.logError(e.getMessage(), e);
            throw new GitHubApiException(operation, 0, e.getMessage(), e);
        }
    }

    /**
     * Rate-limited answers (403/429) are retried after the wait GitHub asks for; anything else fails at once.
     */
    private Retry buildRetrySpec(CallContext callCtx) {
        return RetrySpecs.serverPaced(
                retryConfig.getMaxAttempts(),
                GitHubRestClient::isRateLimited,
                ex -> rateLimitWait(((WebClientResponseException) ex).getHeaders(), Instant.now(), retryConfig),
                callCtx);
    }

    private static boolean isRateLimited(Throwable ex) {
        return ex instanceof WebClientResponseException webEx
                && (webEx.getStatusCode().value() == 403 || webEx.getStatusCode().value() == 429);
    }

    /**
     * Time to wait before retrying a rate-limited call: {@code Retry-After} seconds, else the
     * distance to the {@code X-RateLimit-Reset} epoch second (at least one second), else the
     * configured default. Never more than the configured maximum.
     */
    static Duration rateLimitWait(HttpHeaders headers, Instant now, GlobalRetryConfig config) {
        long waitMs = config.getRateLimitWaitMs();
        String retryAfter = headers.getFirst(HttpHeaders.RETRY_AFTER);
        String reset = headers.getFirst("X-RateLimit-Reset");
        if (retryAfter != null && retryAfter.trim().matches("\\d+")) {
            waitMs = Long.parseLong(retryAfter.trim()) * 1000;
        } else if (reset != null && reset.trim().matches("\\d+")) {
            long seconds = Math.max(1, Long.parseLong(reset.trim()) - now.getEpochSecond());
            waitMs = seconds * 1000;
        }
        return Duration.ofMillis(Math.min(waitMs, config.getMaxRateLimitWaitMs()));
    }

    private static IssueComment toComment(JsonNode node) {
        JsonNode user = node.path("user");
        String createdAt = node.path("created_at").asText(null);
        return new IssueComment(
                node.path("id").asLong(),
                node.path("body").isNull() ? "" : node.path("body").asText(""),
                user.path("login").asText(""),
                "Bot".equalsIgnoreCase(user.path("type").asText("")),
                createdAt == null ? null : Instant.parse(createdAt));
    }

    private static PullRequest toPull(JsonNode node) {
        return new PullRequest(
                node.path("number").asInt(),
                node.path("title").asText(""),
                node.path("body").isNull() ? "" : node.path("body").asText(""),
                node.path("state").asText(""),
                node.path("html_url").asText(""),
                node.path("head").path("ref").asText(""),
                node.path("head").path("sha").asText(""),
                node.path("base").path("ref").asText(""));
    }
}
