package gmail.toolkit.service;

import gmail.toolkit.model.RetryDecision;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Exponential backoff for rate-limit (429) and server (5xx) responses. Other statuses are never retried.
 * Decisions depend only on the status code and the attempt number, not on the transport.
 */
@Component
public class RetryPolicy {
    private final int maxAttempts;
    private final long initialDelayMs;

    public RetryPolicy(@Value("${gmail.retry.max-attempts:3}") int maxAttempts,
                       @Value("${gmail.retry.initial-delay-ms:1000}") long initialDelayMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelayMs = initialDelayMs;
    }

    /**
     * @param statusCode HTTP status of the failed attempt
     * @param attempt number of attempts made so far, starting at 1
     */
    public RetryDecision decide(int statusCode, int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1");
        }
        if (!isRetryable(statusCode) || attempt >= maxAttempts) {
            return RetryDecision.NO_RETRY;
        }
        return RetryDecision.retryAfter(initialDelayMs * (1L << (attempt - 1)));
    }

    static boolean isRetryable(int statusCode) {
        return statusCode == 429 || (statusCode >= 500 && statusCode <= 599);
    }
}
