package com.phillippitts.videoconverter.domain;

/**
 * Encoder parameters for a named quality preset.
 *
 * @param name canonical lower-case preset name
 * @param preset encoder speed preset (e.g. {@code slow})
 * @param crf constant-rate-factor value; lower means higher quality
 */
public record QualitySetting(String name, String preset, int crf) {
}
