package io.stepflow.core.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stepflow.core.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class DurationsTest {

    @ParameterizedTest(name = "{0} -> {1}ms")
    @CsvSource({
        "250, 250",
        "250ms, 250",
        "30s, 30000",
        "1.5s, 1500",
        "2m, 120000",
        "1h, 3600000",
        "1d, 86400000",
        "' 10 S ', 10000",
    })
    void shouldParseDurationStrings(String text, long expected) {
        assertThat(Durations.parseMillis(text)).isEqualTo(expected);
    }

    @Test
    void shouldAcceptNumbersAsMilliseconds() {
        assertThat(Durations.parseMillis(1500)).isEqualTo(1500L);
        assertThat(Durations.parseMillis(12.6)).isEqualTo(13L);
    }

    @Test
    void shouldUseDefaultForNull() {
        assertThat(Durations.parseMillis(null, 5_000)).isEqualTo(5_000L);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "soon", "10 minutes", "-5s", "5w"})
    void shouldRejectMalformedDurations(String text) {
        assertThatThrownBy(() -> Durations.parseMillis(text))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Invalid duration");
    }

    @Test
    void shouldRejectNegativeAndNull() {
        assertThatThrownBy(() -> Durations.parseMillis(-1))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("negative");
        assertThatThrownBy(() -> Durations.parseMillis(null))
                .isInstanceOf(ValidationException.class);
    }
}
