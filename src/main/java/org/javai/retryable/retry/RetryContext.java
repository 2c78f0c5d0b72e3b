package org.javai.retryable.retry;

/**
 * Where a retry sequence stands.
 *
 * @param retryIndex Retries performed so far (0 during the first attempt)
 */
public record RetryContext(int retryIndex) {

    public RetryContext {
        if (retryIndex < 0) {
            throw new IllegalArgumentException("retryIndex must be >= 0");
        }
    }

    public static RetryContext first() {
        return new RetryContext(0);
    }

    public RetryContext next() {
        return new RetryContext(retryIndex + 1);
    }

    /**
     * Attempts made once the current one completes.
     */
    public int attemptCount() {
        return retryIndex + 1;
    }
}
