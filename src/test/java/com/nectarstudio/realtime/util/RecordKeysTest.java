package com.nectarstudio.realtime.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RecordKeys Tests")
class RecordKeysTest {

    @Test
    @DisplayName("Should find the id regardless of column casing")
    void shouldFindIdCaseInsensitively() {
        assertThat(RecordKeys.idOf(Map.of("ID", 5))).isEqualTo(5);
        assertThat(RecordKeys.idOf(Map.of("Id", "abc"))).isEqualTo("abc");
        assertThat(RecordKeys.idOf(Map.of("name", "x"))).isNull();
        assertThat(RecordKeys.idOf(null)).isNull();
    }

    @Test
    @DisplayName("Should compare ids across numeric types and strings")
    void shouldCompareIdsLoosely() {
        assertThat(RecordKeys.sameId(7, 7L)).isTrue();
        assertThat(RecordKeys.sameId(7, "7")).isTrue();
        assertThat(RecordKeys.sameId(7.0, 7)).isTrue();
        assertThat(RecordKeys.sameId(7, 8L)).isFalse();
        assertThat(RecordKeys.sameId(null, null)).isFalse();
    }
}
