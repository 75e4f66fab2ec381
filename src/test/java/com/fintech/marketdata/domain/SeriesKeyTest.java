package com.fintech.marketdata.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SeriesKey Tests")
class SeriesKeyTest {

    @Test
    @DisplayName("Should trim surrounding whitespace")
    void testTrims() {
        assertThat(SeriesKey.of("  AAPL ").value()).isEqualTo("AAPL");
        assertThat(SeriesKey.of(" AAPL")).isEqualTo(SeriesKey.of("AAPL"));
    }

    @Test
    @DisplayName("Should keep case as given")
    void testCaseSensitive() {
        assertThat(SeriesKey.of("aapl")).isNotEqualTo(SeriesKey.of("AAPL"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "\t"})
    @DisplayName("Should reject blank keys")
    void testRejectsBlank(String value) {
        assertThatThrownBy(() -> SeriesKey.of(value))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("blank");
    }

    @Test
    @DisplayName("Should reject null")
    void testRejectsNull() {
        assertThatThrownBy(() -> SeriesKey.of(null))
            .isInstanceOf(NullPointerException.class);
    }
}
