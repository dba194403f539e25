package com.phillippitts.fonemas.domain;

import com.phillippitts.fonemas.exception.InvalidOptionException;

/**
 * How many lexical exceptions the syllabifier applies. Passed through the pipeline unchanged.
 */
public enum ExceptionLevel {
    /** Syllabification rules only. */
    NONE(0),
    /** Rules plus prefix-boundary exceptions. */
    BASIC(1),
    /** Rules, prefix-boundary exceptions and lexical hiatus exceptions. */
    EXTENDED(2);

    private final int level;

    ExceptionLevel(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    /**
     * @param level numeric level (0, 1 or 2)
     * @return matching exception level
     * @throws InvalidOptionException for any other value
     */
    public static ExceptionLevel of(int level) {
        for (ExceptionLevel value : values()) {
            if (value.level == level) {
                return value;
            }
        }
        throw new InvalidOptionException("exceptions", String.valueOf(level), "must be 0, 1 or 2");
    }
}
