package com.purchasingpower.issueflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry settings shared by the GitHub and inference clients.
 *
 * <p>Properties are loaded from the {@code app.retry} namespace in application.yml:
 * <pre>
 * app:
 *   retry:
 *     max-attempts: 3
 *     rate-limit-wait-ms: 5000
 *     max-rate-limit-wait-ms: 60000
 * </pre>
 *
 * <p>Rate-limit responses wait for the server-indicated time (X-RateLimit-Reset or
 * Retry-After), falling back to {@code rateLimitWaitMs}, and never longer than
 * {@code maxRateLimitWaitMs}. Other transient failures are retried without a pause.
 */
@ConfigurationProperties(prefix = "app.retry")
@Data
public class GlobalRetryConfig {

    /**
     * Total attempts, including the first one.
     */
    private int maxAttempts = 3;

    private long rateLimitWaitMs = 5000;

    private long maxRateLimitWaitMs = 60000;
}
