package com.phillippitts.fonemas.config.transcription;

import com.phillippitts.fonemas.domain.ExceptionLevel;
import com.phillippitts.fonemas.domain.TranscriptionOptions;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Default transcription options, used whenever a caller leaves an option out.
 * Binds to properties prefixed with "fonemas.transcription".
 *
 * <p>Example application.properties:
 * <pre>
 * fonemas.transcription.mono=false
 * fonemas.transcription.exceptions=1
 * fonemas.transcription.stress="
 * </pre>
 *
 * @param mono       mark stress on monosyllables
 * @param exceptions syllabifier exception level (0, 1 or 2)
 * @param epenthesis insert "e" before word-initial s + consonant
 * @param aspiration mark word-initial h as aspirated
 * @param rehash     resyllabify consonants across word boundaries
 * @param stress     primary stress marker for SAMPA output
 */
@ConfigurationProperties(prefix = "fonemas.transcription")
@Validated
public record TranscriptionProperties(
        @DefaultValue("false")
        boolean mono,

        @DefaultValue("1")
        @Min(value = 0, message = "Exception level must be 0, 1 or 2")
        @Max(value = 2, message = "Exception level must be 0, 1 or 2")
        int exceptions,

        @DefaultValue("false")
        boolean epenthesis,

        @DefaultValue("false")
        boolean aspiration,

        @DefaultValue("false")
        boolean rehash,

        @DefaultValue(TranscriptionOptions.DEFAULT_STRESS)
        @NotEmpty(message = "Stress marker must not be empty")
        String stress
) {

    /**
     * Properties equal to {@link TranscriptionOptions#defaults()}.
     */
    public static TranscriptionProperties defaults() {
        return new TranscriptionProperties(false, 1, false, false, false, TranscriptionOptions.DEFAULT_STRESS);
    }

    /**
     * @return the options these properties describe
     * @throws com.phillippitts.fonemas.exception.InvalidOptionException if a value is out of range
     */
    public TranscriptionOptions toOptions() {
        return new TranscriptionOptions(mono, ExceptionLevel.of(exceptions), epenthesis, aspiration, rehash, stress);
    }
}
