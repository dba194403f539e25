package com.phillippitts.fonemas.config.transcription;

import com.phillippitts.fonemas.domain.ExceptionLevel;
import com.phillippitts.fonemas.domain.TranscriptionOptions;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptionPropertiesTest {

    private Validator validator;

    @BeforeEach
    void setup() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    void defaultsMatchDefaultOptions() {
        assertThat(TranscriptionProperties.defaults().toOptions()).isEqualTo(TranscriptionOptions.defaults());
        assertThat(validator.validate(TranscriptionProperties.defaults())).isEmpty();
    }

    @Test
    void convertsToOptions() {
        TranscriptionProperties props = new TranscriptionProperties(true, 2, true, false, true, "'");

        TranscriptionOptions options = props.toOptions();

        assertThat(options.mono()).isTrue();
        assertThat(options.exceptions()).isEqualTo(ExceptionLevel.EXTENDED);
        assertThat(options.epenthesis()).isTrue();
        assertThat(options.aspiration()).isFalse();
        assertThat(options.rehash()).isTrue();
        assertThat(options.stress()).isEqualTo("'");
    }

    @Test
    void rejectsExceptionLevelOutOfRange() {
        Set<ConstraintViolation<TranscriptionProperties>> violations =
                validator.validate(new TranscriptionProperties(false, 3, false, false, false, "\""));

        assertThat(violations).hasSize(1);
        assertThat(violations.iterator().next().getMessage()).contains("Exception level must be 0, 1 or 2");
    }

    @Test
    void rejectsNegativeExceptionLevel() {
        Set<ConstraintViolation<TranscriptionProperties>> violations =
                validator.validate(new TranscriptionProperties(false, -1, false, false, false, "\""));

        assertThat(violations).hasSize(1);
    }

    @Test
    void rejectsEmptyStressMarker() {
        Set<ConstraintViolation<TranscriptionProperties>> violations =
                validator.validate(new TranscriptionProperties(false, 1, false, false, false, ""));

        assertThat(violations).hasSize(1);
        assertThat(violations.iterator().next().getMessage()).contains("Stress marker must not be empty");
    }

    @Test
    void rejectsMissingSyllabifierType() {
        Set<ConstraintViolation<SyllabifierProperties>> violations =
                validator.validate(new SyllabifierProperties(null));

        assertThat(violations).hasSize(1);
        assertThat(violations.iterator().next().getMessage()).contains("Syllabifier type must not be null");
    }
}
