package com.phillippitts.fonemas.domain;

import com.phillippitts.fonemas.exception.InvalidOptionException;

import java.util.Locale;

/**
 * The three representations a transcription produces.
 */
public enum Format {
    PHONOLOGY,
    PHONETICS,
    SAMPA;

    /**
     * Lower-case name used in JSON output and on the command line.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a format name case-insensitively.
     *
     * @param value format name (phonology, phonetics or sampa)
     * @return matching format
     * @throws InvalidOptionException if the value names no format
     */
    public static Format fromString(String value) {
        if (value != null) {
            for (Format format : values()) {
                if (format.key().equals(value.trim().toLowerCase(Locale.ROOT))) {
                    return format;
                }
            }
        }
        throw new InvalidOptionException("format", value, "must be one of: phonology, phonetics, sampa");
    }
}
