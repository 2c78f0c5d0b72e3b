package org.javai.retryable.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.function.IntToDoubleFunction;

/**
 * How long to sleep before the next attempt.
 * Either a fixed delay or a function of the zero-based retry index.
 */
public sealed interface SleepSpec permits SleepSpec.Fixed, SleepSpec.Computed {

    /**
     * The delay before the retry with the given index.
     *
     * @param retryIndex zero-based index of the retry about to happen
     * @return a non-negative delay
     */
    Duration delayFor(int retryIndex);

    static SleepSpec fixed(Duration delay) {
        return new Fixed(delay);
    }

    /**
     * A fixed delay given in seconds, rounded to the nearest millisecond.
     */
    static SleepSpec seconds(double seconds) {
        return new Fixed(toDuration(seconds));
    }

    static SleepSpec computed(IntToDoubleFunction secondsForRetry) {
        return new Computed(secondsForRetry);
    }

    /**
     * Converts seconds to a duration rounded to the nearest millisecond.
     *
     * @throws IllegalArgumentException if seconds is negative, NaN or infinite
     */
    static Duration toDuration(double seconds) {
        if (Double.isNaN(seconds) || Double.isInfinite(seconds) || seconds < 0) {
            throw new IllegalArgumentException("sleep must be a finite, non-negative number of seconds, was: " + seconds);
        }
        return Duration.ofMillis(Math.round(seconds * 1000));
    }

    private static Duration roundToMillis(Duration delay) {
        long millis = delay.toMillis();
        return Duration.ofMillis(delay.toNanosPart() % 1_000_000 >= 500_000 ? millis + 1 : millis);
    }

    /**
     * A fixed delay, rounded to the nearest millisecond.
     */
    record Fixed(Duration delay) implements SleepSpec {
        public Fixed {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
            delay = roundToMillis(delay);
        }

        @Override
        public Duration delayFor(int retryIndex) {
            return delay;
        }
    }

    record Computed(IntToDoubleFunction secondsForRetry) implements SleepSpec {
        public Computed {
            Objects.requireNonNull(secondsForRetry, "secondsForRetry must not be null");
        }

        @Override
        public Duration delayFor(int retryIndex) {
            return toDuration(secondsForRetry.applyAsDouble(retryIndex));
        }
    }
}
