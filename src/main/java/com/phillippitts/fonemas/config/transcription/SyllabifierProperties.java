package com.phillippitts.fonemas.config.transcription;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Selects the syllabifier. Binds to properties prefixed with "fonemas.syllabifier".
 *
 * @param type syllabifier implementation
 */
@ConfigurationProperties(prefix = "fonemas.syllabifier")
@Validated
public record SyllabifierProperties(
        @DefaultValue("builtin")
        @NotNull(message = "Syllabifier type must not be null")
        SyllabifierType type
) {
}
