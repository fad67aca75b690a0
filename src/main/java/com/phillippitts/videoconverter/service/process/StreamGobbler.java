package com.phillippitts.videoconverter.service.process;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Drains a process stream into a bounded buffer on a daemon thread.
 *
 * <p>Reads lines until end of stream. Once the cap is reached it keeps reading without
 * accumulating, so the child process never blocks on a full pipe.
 */
public final class StreamGobbler implements Runnable {

    private static final Logger LOG = LogManager.getLogger(StreamGobbler.class);

    private final InputStream inputStream;
    private final StringBuilder sink = new StringBuilder();
    private final String name;
    private final int maxChars;
    private volatile Thread thread;

    private StreamGobbler(InputStream inputStream, String name, int maxChars) {
        this.inputStream = inputStream;
        this.name = name;
        this.maxChars = maxChars;
    }

    /**
     * Starts draining {@code inputStream} on a new daemon thread.
     *
     * @param inputStream stream to drain
     * @param name thread name, also used in log messages
     * @param maxChars maximum characters retained
     * @return the running gobbler
     */
    public static StreamGobbler start(InputStream inputStream, String name, int maxChars) {
        StreamGobbler gobbler = new StreamGobbler(inputStream, name, maxChars);
        Thread thread = new Thread(gobbler, name);
        thread.setDaemon(true);
        gobbler.thread = thread;
        thread.start();
        return gobbler;
    }

    @Override
    public void run() {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            boolean capReached = false;
            while ((line = br.readLine()) != null) {
                synchronized (sink) {
                    if (sink.length() >= maxChars) {
                        if (!capReached) {
                            LOG.warn("Stream '{}' reached {} char cap; discarding further output", name, maxChars);
                            capReached = true;
                        }
                        continue;
                    }
                    int available = maxChars - sink.length();
                    String chunk = line.length() > available ? line.substring(0, available) : line;
                    sink.append(chunk).append('\n');
                }
            }
        } catch (IOException e) {
            LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
        }
    }

    /**
     * Waits up to {@code timeoutMillis} for the stream to be fully drained.
     */
    public void await(long timeoutMillis) {
        Thread t = thread;
        if (t == null) {
            return;
        }
        try {
            t.join(timeoutMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Output collected so far. */
    public String content() {
        synchronized (sink) {
            return sink.toString();
        }
    }
}
