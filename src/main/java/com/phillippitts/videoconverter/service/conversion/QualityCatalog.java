package com.phillippitts.videoconverter.service.conversion;

import com.phillippitts.videoconverter.domain.QualitySetting;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Static catalog of encoder quality presets.
 *
 * <p>Lookups are case-insensitive and ignore surrounding whitespace. Unknown or empty names
 * resolve to the {@value #DEFAULT_QUALITY_NAME} preset, so resolution never fails.
 */
public final class QualityCatalog {

    public static final String DEFAULT_QUALITY_NAME = "default";

    // insertion order is the presentation order
    private static final Map<String, QualitySetting> SETTINGS = new LinkedHashMap<>();

    static {
        register(new QualitySetting(DEFAULT_QUALITY_NAME, "slow", 22));
        register(new QualitySetting("high", "slower", 20));
        register(new QualitySetting("fast", "medium", 23));
    }

    private QualityCatalog() {
        // Utility class - prevent instantiation
    }

    private static void register(QualitySetting setting) {
        SETTINGS.put(setting.name(), setting);
    }

    /**
     * Returns the preset matching {@code name}, or the default preset when there is none.
     *
     * @param name preset name in any case (may be null)
     * @return matching or default setting, never null
     */
    public static QualitySetting resolveQualitySetting(String name) {
        QualitySetting setting = SETTINGS.get(normalize(name));
        return setting != null ? setting : SETTINGS.get(DEFAULT_QUALITY_NAME);
    }

    public static boolean isValidQualityName(String name) {
        return SETTINGS.containsKey(normalize(name));
    }

    /** All presets in a stable order: default, high, fast. */
    public static List<QualitySetting> availableQualitySettings() {
        return List.copyOf(SETTINGS.values());
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
