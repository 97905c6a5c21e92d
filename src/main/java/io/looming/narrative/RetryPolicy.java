package io.looming.narrative;

/**
 * Exponential backoff for recoverable backend errors.
 *
 * @param maxRetries retries after the first attempt; total attempts are {@code maxRetries + 1}
 */
public record RetryPolicy(int maxRetries, long baseBackoffMs, long maxBackoffMs) {
    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        baseBackoffMs = Math.max(0L, baseBackoffMs);
        maxBackoffMs = Math.max(baseBackoffMs, maxBackoffMs);
    }

    /**
     * Delay before retry number {@code retry} (1-based).
     */
    public long backoffMs(int retry) {
        int shift = Math.min(Math.max(0, retry - 1), 30);
        long delay = baseBackoffMs << shift;
        if (delay < 0 || delay > maxBackoffMs) {
            return maxBackoffMs;
        }
        return delay;
    }
}
