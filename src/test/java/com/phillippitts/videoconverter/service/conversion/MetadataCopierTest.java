package com.phillippitts.videoconverter.service.conversion;

import com.phillippitts.videoconverter.testutil.BlockingProcess;
import com.phillippitts.videoconverter.testutil.FakeProcess;
import com.phillippitts.videoconverter.testutil.ScriptedProcessFactory;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MetadataCopierTest {

    private static final Path SRC = Path.of("uploads", "clip.mov");
    private static final Path DST = Path.of("converted", "clip.mp4");

    @Test
    void successfulRunReturnsTrue() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory()
                .thenReturn(new FakeProcess("    1 image files updated\n", "", 0));
        MetadataCopier copier = new MetadataCopier(factory, true, "exiftool", Duration.ofSeconds(5));

        assertThat(copier.copy(SRC, DST)).isTrue();
        assertThat(factory.commands()).containsExactly(copier.buildCommand(SRC, DST));
    }

    @Test
    void commandCopiesAllTagsInPlace() {
        MetadataCopier copier = new MetadataCopier(new ScriptedProcessFactory(), true, "/opt/exiftool",
                MetadataCopier.DEFAULT_TIMEOUT);

        assertThat(copier.buildCommand(SRC, DST)).containsExactly(
                "/opt/exiftool", "-tagsFromFile", SRC.toString(), "-all:all>all:all",
                "-preserve", "-overwrite_original", DST.toString());
    }

    @Test
    void disabledCopierNeverStartsTool() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory();
        MetadataCopier copier = new MetadataCopier(factory, false, "exiftool", Duration.ofSeconds(5));

        assertThat(copier.isEnabled()).isFalse();
        assertThat(copier.copy(SRC, DST)).isFalse();
        assertThat(factory.commands()).isEmpty();
    }

    @Test
    void nonZeroExitReturnsFalse() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory()
                .thenReturn(new FakeProcess("", "Error: File not found - clip.mov", 1));
        MetadataCopier copier = new MetadataCopier(factory, true, "exiftool", Duration.ofSeconds(5));

        assertThat(copier.copy(SRC, DST)).isFalse();
    }

    @Test
    void missingToolReturnsFalse() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory()
                .thenFail(new IOException("Cannot run program \"exiftool\""));
        MetadataCopier copier = new MetadataCopier(factory, true, "exiftool", Duration.ofSeconds(5));

        assertThat(copier.copy(SRC, DST)).isFalse();
    }

    @Test
    void timeoutKillsToolAndReturnsFalse() {
        BlockingProcess hung = new BlockingProcess("");
        ScriptedProcessFactory factory = new ScriptedProcessFactory().thenReturn(hung);
        MetadataCopier copier = new MetadataCopier(factory, true, "exiftool", Duration.ofMillis(50));

        assertThat(copier.copy(SRC, DST)).isFalse();
        assertThat(hung.isAlive()).isFalse();
        assertThat(hung.exitValue()).isEqualTo(137);
    }
}
