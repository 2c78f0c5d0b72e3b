package org.javai.retryable.retry;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ErrorValuesTest {

    @Test
    void isError_bareTag() {
        assertThat(ErrorValues.isError("error")).isTrue();
        assertThat(ErrorValues.isError("ERROR")).isFalse();
        assertThat(ErrorValues.isError("ok")).isFalse();
        assertThat(ErrorValues.isError(null)).isFalse();
    }

    @Test
    void isError_taggedList() {
        assertThat(ErrorValues.isError(List.of("error", "fail", "extra"))).isTrue();
        assertThat(ErrorValues.isError(List.of("error"))).isTrue();
        assertThat(ErrorValues.isError(List.of("ok", "error"))).isFalse();
        assertThat(ErrorValues.isError(List.of())).isFalse();
    }

    @Test
    void isError_taggedArray() {
        assertThat(ErrorValues.isError(new Object[] {"error", 42})).isTrue();
        assertThat(ErrorValues.isError(new Object[] {"ok", 42})).isFalse();
        assertThat(ErrorValues.isError(new Object[0])).isFalse();
    }

    @Test
    void isError_mapEntryKeyedByTag() {
        assertThat(ErrorValues.isError(Map.entry("error", "no"))).isTrue();
        assertThat(ErrorValues.isError(Map.entry("ok", "yes"))).isFalse();
    }

    @Test
    void isError_mapsAreNotTagged() {
        assertThat(ErrorValues.isError(Map.of("ok", "success"))).isFalse();
        assertThat(ErrorValues.isError(Map.of("error", "no"))).isFalse();
    }
}
