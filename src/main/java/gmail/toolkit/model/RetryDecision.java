package gmail.toolkit.model;

import lombok.Value;

@Value
public class RetryDecision {
    public static final RetryDecision NO_RETRY = new RetryDecision(false, 0L);

    boolean retry;
    long delayMs;

    public static RetryDecision retryAfter(long delayMs) {
        return new RetryDecision(true, delayMs);
    }
}
