package org.javai.retryable.retry;

/**
 * Thrown when the thread is interrupted while sleeping between attempts.
 * The thread's interrupt flag is set again before this is thrown. When the attempt before
 * the sleep threw, that exception is attached as suppressed.
 */
public class RetryInterruptedException extends RuntimeException {

    private final int completedAttempts;

    public RetryInterruptedException(String policyId, int completedAttempts, InterruptedException cause) {
        super("Interrupted while waiting to retry with policy [" + policyId + "] after "
                + completedAttempts + " attempt(s)", cause);
        this.completedAttempts = completedAttempts;
    }

    public int completedAttempts() {
        return completedAttempts;
    }
}
