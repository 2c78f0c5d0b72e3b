package org.javai.retryable.retry;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Decides whether an exception message qualifies for retry.
 */
public sealed interface MessageMatcher permits MessageMatcher.Substring, MessageMatcher.Regex {

    boolean matches(String message);

    static MessageMatcher substring(String text) {
        return new Substring(text);
    }

    static MessageMatcher pattern(Pattern pattern) {
        return new Regex(pattern);
    }

    static MessageMatcher pattern(String regex) {
        return new Regex(Pattern.compile(regex));
    }

    /**
     * Matches when the message contains {@code text}.
     */
    record Substring(String text) implements MessageMatcher {
        public Substring {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public boolean matches(String message) {
            return message.contains(text);
        }
    }

    /**
     * Matches when the pattern is found anywhere in the message.
     * Two instances are equal when their source and flags are equal.
     */
    record Regex(Pattern pattern) implements MessageMatcher {
        public Regex {
            Objects.requireNonNull(pattern, "pattern must not be null");
        }

        @Override
        public boolean matches(String message) {
            return pattern.matcher(message).find();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Regex other
                    && pattern.pattern().equals(other.pattern.pattern())
                    && pattern.flags() == other.pattern.flags();
        }

        @Override
        public int hashCode() {
            return Objects.hash(pattern.pattern(), pattern.flags());
        }

        @Override
        public String toString() {
            return "Regex[" + pattern.pattern() + "]";
        }
    }
}
