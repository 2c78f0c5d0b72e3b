package org.javai.retryable.retry;

/**
 * Blocks the calling thread between attempts.
 * The default is {@link Thread#sleep(long)}; tests substitute a recording sleeper.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;
}
