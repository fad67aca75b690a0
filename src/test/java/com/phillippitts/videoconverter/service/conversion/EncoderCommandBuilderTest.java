package com.phillippitts.videoconverter.service.conversion;

import com.phillippitts.videoconverter.domain.ConversionJob;
import com.phillippitts.videoconverter.domain.TargetFormat;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EncoderCommandBuilderTest {

    private static final Path IN = Path.of("uploads", "clip.mov");

    private static ConversionJob job(TargetFormat format, String quality, boolean reverse, boolean mute) {
        Path out = Path.of("converted", "clip." + format.extension());
        return new ConversionJob("J1", null, "clip.mov", format, quality, IN, out, reverse, mute);
    }

    private static EncoderCommandBuilder builder(int cpus) {
        return new EncoderCommandBuilder("ffmpeg", 2, () -> cpus);
    }

    @Test
    void mp4UsesHevcWithFaststart() {
        List<String> cmd = builder(8).build(job(TargetFormat.MP4, "high", false, false));

        assertThat(cmd).containsExactly(
                "ffmpeg", "-i", IN.toString(), "-threads", "6",
                "-progress", "pipe:1", "-nostats", "-v", "warning",
                "-c:a", "copy",
                "-c:v", "libx265", "-preset", "slower", "-crf", "20",
                "-movflags", "+faststart",
                Path.of("converted", "clip.mp4").toString());
    }

    @Test
    void movTagsHvc1BeforeCodec() {
        List<String> cmd = builder(4).build(job(TargetFormat.MOV, "fast", false, false));

        assertThat(String.join(" ", cmd))
                .contains("-tag:v hvc1 -c:v libx265 -preset medium -crf 23")
                .doesNotContain("-movflags");
    }

    @Test
    void aviUsesXvidAndIgnoresQuality() {
        List<String> high = builder(4).build(job(TargetFormat.AVI, "high", false, false));
        List<String> fast = builder(4).build(job(TargetFormat.AVI, "fast", false, false));

        assertThat(String.join(" ", high)).contains("-c:v libxvid -q:v 3").doesNotContain("-crf");
        assertThat(high).isEqualTo(fast);
    }

    @Test
    void reverseAppliesToVideoAndAudio() {
        List<String> cmd = builder(4).build(job(TargetFormat.MP4, "default", true, false));

        assertThat(String.join(" ", cmd))
                .contains("-vf reverse")
                .contains("-af areverse")
                .doesNotContain("-c:a copy");
    }

    @Test
    void muteWinsOverAudioReverse() {
        List<String> cmd = builder(4).build(job(TargetFormat.MP4, "default", true, true));

        assertThat(cmd).contains("-an", "-vf").doesNotContain("-af", "areverse", "-c:a");
    }

    @Test
    void unknownQualityUsesDefaultPreset() {
        List<String> cmd = builder(4).build(job(TargetFormat.MP4, "bogus", false, false));

        assertThat(String.join(" ", cmd)).contains("-preset slow -crf 22");
    }

    @Test
    void outputPathIsLastArgument() {
        List<String> cmd = builder(4).build(job(TargetFormat.MOV, "default", false, false));

        assertThat(cmd.get(cmd.size() - 1)).isEqualTo(Path.of("converted", "clip.mov").toString());
    }

    @Test
    void threadCountKeepsAtLeastOne() {
        assertThat(builder(16).encoderThreads()).isEqualTo(14);
        assertThat(builder(2).encoderThreads()).isEqualTo(1);
        assertThat(builder(1).encoderThreads()).isEqualTo(1);
    }

    @Test
    void rejectsNegativeReserve() {
        assertThatThrownBy(() -> new EncoderCommandBuilder("ffmpeg", -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
