package org.javai.retryable.retry;

import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.Set;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.*;

class MatcherTest {

    @Test
    void kind_matchesExactClassOnly() {
        FailureMatcher matcher = FailureMatcher.kind(IOException.class);

        assertThat(matcher.matches(new IOException())).isTrue();
        assertThat(matcher.matches(new FileNotFoundException())).isFalse();
        assertThat(matcher.matches(new IllegalStateException())).isFalse();
    }

    @Test
    void kindOrSubtype_matchesSubclasses() {
        FailureMatcher matcher = FailureMatcher.kindOrSubtype(IOException.class);

        assertThat(matcher.matches(new FileNotFoundException())).isTrue();
        assertThat(matcher.matches(new IllegalStateException())).isFalse();
    }

    @Test
    void kind_equalityFollowsClass() {
        assertThat(FailureMatcher.kind(IOException.class)).isEqualTo(FailureMatcher.kind(IOException.class));
        assertThat(FailureMatcher.kind(IOException.class)).isNotEqualTo(FailureMatcher.kindOrSubtype(IOException.class));
    }

    @Test
    void substring_matchesContainedText() {
        MessageMatcher matcher = MessageMatcher.substring("bad");

        assertThat(matcher.matches("bad args")).isTrue();
        assertThat(matcher.matches("really bad")).isTrue();
        assertThat(matcher.matches("good args")).isFalse();
    }

    @Test
    void pattern_findsAnywhereInMessage() {
        MessageMatcher matcher = MessageMatcher.pattern(Pattern.compile("throttl", Pattern.CASE_INSENSITIVE));

        assertThat(matcher.matches("Request Throttled by server")).isTrue();
        assertThat(matcher.matches("request timed out")).isFalse();
    }

    @Test
    void pattern_equalWhenSourceAndFlagsEqual() {
        Set<MessageMatcher> matchers = Set.of(
                MessageMatcher.pattern("bad"),
                MessageMatcher.pattern(Pattern.compile("bad", Pattern.CASE_INSENSITIVE)));

        assertThat(MessageMatcher.pattern("bad")).isEqualTo(MessageMatcher.pattern(Pattern.compile("bad")));
        assertThat(MessageMatcher.pattern("bad").hashCode()).isEqualTo(MessageMatcher.pattern("bad").hashCode());
        assertThat(matchers).hasSize(2);
    }
}
