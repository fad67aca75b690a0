package com.phillippitts.videoconverter.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.tail(null, 10)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.tail("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.tail("hello world", -1)).isEmpty();
    }

    @Test
    void tailKeepsLastCharacters() {
        assertThat(LogSanitizer.tail("frame=1\nError opening output file\n", 26))
                .isEqualTo("Error opening output file");
        assertThat(LogSanitizer.tail("abcdef", 3)).isEqualTo("def");
    }

    @Test
    void tailNeverStartsWithTheLineBreakBeforeTheCut() {
        String stderr = "frame=1\nError opening output file";

        assertThat(LogSanitizer.tail(stderr, 26)).isEqualTo("Error opening output file");
    }

    @Test
    void tailTrimsSurroundingWhitespace() {
        assertThat(LogSanitizer.tail("  \n fatal \n\n", 100)).isEqualTo("fatal");
        assertThat(LogSanitizer.tail("\n\n", 100)).isEmpty();
    }
}
