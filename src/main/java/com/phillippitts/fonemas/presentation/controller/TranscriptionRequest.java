package com.phillippitts.fonemas.presentation.controller;

import com.phillippitts.fonemas.domain.ExceptionLevel;
import com.phillippitts.fonemas.domain.TranscriptionOptions;

/**
 * Body of {@code POST /api/transcriptions}.
 *
 * @param text    text to transcribe
 * @param options option overrides; null or missing fields keep the configured defaults
 */
public record TranscriptionRequest(String text, Overrides options) {

    /**
     * Nullable option values supplied by a client.
     */
    public record Overrides(
            Boolean mono,
            Integer exceptions,
            Boolean epenthesis,
            Boolean aspiration,
            Boolean rehash,
            String stress
    ) {

        static final Overrides NONE = new Overrides(null, null, null, null, null, null);

        /**
         * @param defaults options to start from
         * @return defaults with every non-null override applied
         * @throws com.phillippitts.fonemas.exception.InvalidOptionException on an out-of-range value
         */
        TranscriptionOptions applyTo(TranscriptionOptions defaults) {
            TranscriptionOptions result = defaults;
            if (mono != null) {
                result = result.withMono(mono);
            }
            if (exceptions != null) {
                result = result.withExceptions(ExceptionLevel.of(exceptions));
            }
            if (epenthesis != null) {
                result = result.withEpenthesis(epenthesis);
            }
            if (aspiration != null) {
                result = result.withAspiration(aspiration);
            }
            if (rehash != null) {
                result = result.withRehash(rehash);
            }
            if (stress != null) {
                result = result.withStress(stress);
            }
            return result;
        }
    }
}
