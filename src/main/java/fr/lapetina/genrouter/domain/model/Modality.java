package fr.lapetina.genrouter.domain.model;

import java.util.Locale;

/**
 * Kind of content a request asks for.
 * Each modality bills in its own unit (tokens for text, images for image).
 */
public enum Modality {
    TEXT("token"),
    IMAGE("image");

    private final String billedUnit;

    Modality(String billedUnit) {
        this.billedUnit = billedUnit;
    }

    public String getBilledUnit() {
        return billedUnit;
    }

    /**
     * Parses a configuration value such as {@code text} or {@code IMAGE}.
     *
     * @throws IllegalArgumentException if the value names no modality
     */
    public static Modality fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Modality is required");
        }
        try {
            return Modality.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown modality: " + value, e);
        }
    }

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
