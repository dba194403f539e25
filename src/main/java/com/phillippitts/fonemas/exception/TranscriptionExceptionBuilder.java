package com.phillippitts.fonemas.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Assembles a {@link TranscriptionException} whose message names the failing stage, the
 * offending word and any extra context.
 *
 * <pre>
 * throw TranscriptionExceptionBuilder.create("Syllabification failed")
 *         .stage("phonology")
 *         .word("pst")
 *         .cause(e)
 *         .metadata("exceptions", 1)
 *         .build();
 * // Syllabification failed (word=pst, exceptions=1) (stage: phonology)
 * </pre>
 */
public final class TranscriptionExceptionBuilder {

    private static final String UNKNOWN_STAGE = "unknown";

    private final String message;
    private final Map<String, String> details = new LinkedHashMap<>();
    private String stage = UNKNOWN_STAGE;
    private String word;
    private Throwable cause;

    private TranscriptionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * @param message base message (must not be null or empty)
     * @throws IllegalArgumentException if the message is null or empty
     */
    public static TranscriptionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TranscriptionExceptionBuilder(message);
    }

    /**
     * @param stage pipeline stage that failed, e.g. "phonology"; null keeps "unknown"
     */
    public TranscriptionExceptionBuilder stage(String stage) {
        if (stage != null) {
            this.stage = stage;
        }
        return this;
    }

    /**
     * @param word word being transcribed when the stage failed; always listed first
     */
    public TranscriptionExceptionBuilder word(String word) {
        this.word = word;
        return this;
    }

    public TranscriptionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Adds a key=value pair to the message. Pairs with a null key or value are skipped.
     */
    public TranscriptionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            details.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * @return exception with message {@code message (k=v, ...) (stage: s)}; the parenthesised
     *         pairs are omitted when there are none
     */
    public TranscriptionException build() {
        return cause == null
                ? new TranscriptionException(describe(), stage)
                : new TranscriptionException(describe(), stage, cause);
    }

    private String describe() {
        if (word == null && details.isEmpty()) {
            return message;
        }
        StringJoiner joiner = new StringJoiner(", ", message + " (", ")");
        if (word != null) {
            joiner.add("word=" + word);
        }
        details.forEach((key, value) -> joiner.add(key + "=" + value));
        return joiner.toString();
    }
}
