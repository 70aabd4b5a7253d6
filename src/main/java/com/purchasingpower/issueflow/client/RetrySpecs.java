package com.purchasingpower.issueflow.client;

import com.purchasingpower.issueflow.model.CallContext;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Reactor retry specs shared by the HTTP clients.
 */
final class RetrySpecs {

    private RetrySpecs() {
    }

    /**
     * Resubscribes after failures accepted by {@code retryable} until {@code maxAttempts} attempts
     * (the first one included) were made, waiting {@code waitFor} of each failure first.
     * The last failure, or the first non-retryable one, is propagated unchanged.
     */
    static Retry serverPaced(int maxAttempts,
                             Predicate<Throwable> retryable,
                             Function<Throwable, Duration> waitFor,
                             CallContext callCtx) {
        int attempts = Math.max(1, maxAttempts);
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            long attempt = signal.totalRetries() + 1;
            if (attempt >= attempts || !retryable.test(failure)) {
                return Mono.<Long>error(failure);
            }
            callCtx.logRetry((int) attempt, attempts, failure.getMessage());
            Duration wait = waitFor.apply(failure);
            if (wait == null || wait.isZero() || wait.isNegative()) {
                return Mono.just(attempt);
            }
            return Mono.delay(wait).thenReturn(attempt);
        }));
    }
}
