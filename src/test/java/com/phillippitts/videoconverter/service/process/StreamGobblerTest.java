package com.phillippitts.videoconverter.service.process;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class StreamGobblerTest {

    private static InputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void collectsAllLines() {
        StreamGobbler gobbler = StreamGobbler.start(stream("first\nsecond\n"), "test-gobbler", 1024);

        gobbler.await(2000);

        assertThat(gobbler.content()).isEqualTo("first\nsecond\n");
    }

    @Test
    void stopsAccumulatingAtCap() {
        StreamGobbler gobbler = StreamGobbler.start(stream("0123456789\nabcdef\nmore\n"), "test-gobbler", 8);

        gobbler.await(2000);

        assertThat(gobbler.content()).startsWith("01234567").doesNotContain("abcdef", "more");
    }

    @Test
    void readFailureKeepsWhatWasRead() {
        InputStream failing = new InputStream() {
            private final InputStream head = stream("partial\n");

            @Override
            public int read() throws IOException {
                int b = head.read();
                if (b < 0) {
                    throw new IOException("broken pipe");
                }
                return b;
            }
        };
        StreamGobbler gobbler = StreamGobbler.start(failing, "test-gobbler", 1024);

        gobbler.await(2000);

        assertThat(gobbler.content()).isEqualTo("partial\n");
    }
}
