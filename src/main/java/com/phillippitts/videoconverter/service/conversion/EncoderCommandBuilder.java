package com.phillippitts.videoconverter.service.conversion;

import com.phillippitts.videoconverter.domain.ConversionJob;
import com.phillippitts.videoconverter.domain.QualitySetting;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.IntSupplier;

/**
 * Builds the ffmpeg command line for a job.
 *
 * <p>CLI contract:
 * <pre>
 * ${binary} -i ${in} -threads ${n} -progress pipe:1 -nostats -v warning
 *     [-vf reverse] [-an | -af areverse | -c:a copy] ${format args} ${out}
 * </pre>
 * where {@code n = max(1, cpus - reserve)} leaves headroom for the web tier.
 */
public class EncoderCommandBuilder {

    public static final String DEFAULT_BINARY = "ffmpeg";
    public static final int DEFAULT_THREAD_RESERVE = 2;

    private final String binary;
    private final int threadReserve;
    private final IntSupplier cpuCount;

    public EncoderCommandBuilder() {
        this(DEFAULT_BINARY, DEFAULT_THREAD_RESERVE);
    }

    public EncoderCommandBuilder(String binary, int threadReserve) {
        this(binary, threadReserve, () -> Runtime.getRuntime().availableProcessors());
    }

    EncoderCommandBuilder(String binary, int threadReserve, IntSupplier cpuCount) {
        this.binary = Objects.requireNonNull(binary, "binary");
        if (threadReserve < 0) {
            throw new IllegalArgumentException("threadReserve must not be negative");
        }
        this.threadReserve = threadReserve;
        this.cpuCount = Objects.requireNonNull(cpuCount, "cpuCount");
    }

    public List<String> build(ConversionJob job) {
        Objects.requireNonNull(job, "job");
        QualitySetting quality = QualityCatalog.resolveQualitySetting(job.quality());

        List<String> cmd = new ArrayList<>();
        cmd.add(binary);
        cmd.add("-i");
        cmd.add(job.inputPath().toString());
        cmd.add("-threads");
        cmd.add(String.valueOf(encoderThreads()));
        cmd.add("-progress");
        cmd.add("pipe:1");
        cmd.add("-nostats");
        cmd.add("-v");
        cmd.add("warning");

        if (job.reverseVideo()) {
            cmd.add("-vf");
            cmd.add("reverse");
        }

        // audio: muting wins over reversing
        if (job.removeSound()) {
            cmd.add("-an");
        } else if (job.reverseVideo()) {
            cmd.add("-af");
            cmd.add("areverse");
        } else {
            cmd.add("-c:a");
            cmd.add("copy");
        }

        switch (job.targetFormat()) {
            case MOV -> {
                cmd.add("-tag:v");
                cmd.add("hvc1");
                addHevc(cmd, quality);
            }
            case MP4 -> {
                addHevc(cmd, quality);
                cmd.add("-movflags");
                cmd.add("+faststart");
            }
            case AVI -> {
                cmd.add("-c:v");
                cmd.add("libxvid");
                cmd.add("-q:v");
                cmd.add("3");
            }
        }

        cmd.add(job.outputPath().toString());
        return cmd;
    }

    int encoderThreads() {
        return Math.max(1, cpuCount.getAsInt() - threadReserve);
    }

    private static void addHevc(List<String> cmd, QualitySetting quality) {
        cmd.add("-c:v");
        cmd.add("libx265");
        cmd.add("-preset");
        cmd.add(quality.preset());
        cmd.add("-crf");
        cmd.add(String.valueOf(quality.crf()));
    }
}
