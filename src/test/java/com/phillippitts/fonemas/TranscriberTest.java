package com.phillippitts.fonemas;

import com.phillippitts.fonemas.domain.ExceptionLevel;
import com.phillippitts.fonemas.domain.Format;
import com.phillippitts.fonemas.domain.Syllabification;
import com.phillippitts.fonemas.domain.Transcript;
import com.phillippitts.fonemas.domain.TranscriptionOptions;
import com.phillippitts.fonemas.domain.TranscriptionResult;
import com.phillippitts.fonemas.exception.SyllabificationException;
import com.phillippitts.fonemas.exception.TranscriptionException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end properties of the library facade.
 */
class TranscriberTest {

    private final Transcriber transcriber = Transcriber.create();

    private static final List<String> SENTENCES = List.of(
            "Averigüéis",
            "¿Qué tal estás, Juan?",
            "El perro de San Roque no tiene rabo",
            "Rápidamente llegó a México",
            "Los amigos hablan inglés",
            "un beso y un abrazo");

    @Test
    void transcribesAllFormats() {
        TranscriptionResult result = transcriber.transcribe("Averigüéis");

        assertThat(result.phonology().syllables()).containsExactly("a", "be", "ɾi", "ˈgwejs");
        assertThat(result.phonetics().syllables()).containsExactly("a", "βe", "ɾi", "ˈɣwejs");
        assertThat(result.sampa().syllables()).containsExactly("a", "Be", "ri", "\"Gwejs");
    }

    @Test
    void menteAdverbWithOneSyllableRootKeepsBothMarksOnMen() {
        TranscriptionResult result = transcriber.transcribe("fielmente");

        assertThat(result.phonology().words()).containsExactly("fjelˈˌmente");
        assertThat(result.phonology().syllables()).containsExactly("fjel", "ˈˌmen", "te");
        assertThat(result.sampa().words()).containsExactly("fjel\"%mente");
    }

    @Test
    void cleansPunctuationIntoSentence() {
        TranscriptionResult result = transcriber.transcribe("¿Qué tal?");

        assertThat(result.sentence()).isEqualTo(" qué tal ");
        assertThat(result.phonology().words()).containsExactly("ke", "tal");
    }

    @Test
    void wordCountIsTheSameInEveryFormat() {
        for (String text : SENTENCES) {
            TranscriptionResult result = transcriber.transcribe(text, TranscriptionOptions.defaults().withRehash(true));
            int words = result.sentence().trim().split("\\s+").length;

            for (Transcript transcript : result.all().values()) {
                assertThat(transcript.words()).as(text).hasSize(words);
            }
        }
    }

    @Test
    void syllableCountIsTheSameInEveryFormat() {
        for (String text : SENTENCES) {
            TranscriptionResult result = transcriber.transcribe(text);
            int syllables = result.phonology().syllables().size();

            assertThat(result.phonetics().syllables()).as(text).hasSize(syllables);
            assertThat(result.sampa().syllables()).as(text).hasSize(syllables);
        }
    }

    @Test
    void syllablesConcatenateToWordsWithoutRehash() {
        for (String text : SENTENCES) {
            TranscriptionResult result = transcriber.transcribe(text);

            for (Format format : Format.values()) {
                Transcript transcript = result.transcript(format);
                assertThat(String.join("", transcript.syllables()))
                        .as(text + " " + format)
                        .isEqualTo(String.join("", transcript.words()));
            }
        }
    }

    @Test
    void sampaIsAscii() {
        for (String text : SENTENCES) {
            TranscriptionResult result = transcriber.transcribe(text, TranscriptionOptions.defaults().withAspiration(true));

            for (String word : result.sampa().words()) {
                assertThat(word.chars().allMatch(c -> c < 128)).as(word).isTrue();
            }
        }
    }

    @Test
    void polysyllablesCarryOneStressMark() {
        TranscriptionResult result = transcriber.transcribe("El perro de San Roque no tiene rabo");

        for (String syllable : result.phonology().syllables()) {
            assertThat(syllable.chars().filter(c -> c == 'ˈ').count()).isLessThanOrEqualTo(1);
        }
        for (String word : result.phonology().words()) {
            assertThat(word.chars().filter(c -> c == 'ˈ').count()).as(word).isLessThanOrEqualTo(1);
        }
    }

    @Test
    void isDeterministic() {
        TranscriptionOptions options = TranscriptionOptions.defaults().withMono(true).withRehash(true);

        assertThat(transcriber.transcribe("Rápidamente llegó a México", options))
                .isEqualTo(transcriber.transcribe("Rápidamente llegó a México", options));
    }

    @Test
    void emptyInputGivesEmptyResult() {
        TranscriptionResult result = transcriber.transcribe("");

        assertThat(result.sentence()).isEmpty();
        for (Transcript transcript : result.all().values()) {
            assertThat(transcript.words()).isEmpty();
            assertThat(transcript.syllables()).isEmpty();
        }
    }

    @Test
    void punctuationOnlyInputGivesNoWords() {
        TranscriptionResult result = transcriber.transcribe("¡¿...?!");

        assertThat(result.phonology().words()).isEmpty();
    }

    @Test
    void monosyllableMarkingFollowsOption() {
        assertThat(transcriber.transcribe("sol").phonology().words()).containsExactly("sol");
        assertThat(transcriber.transcribe("sol", TranscriptionOptions.defaults().withMono(true)).phonology().words())
                .containsExactly("ˈsol");
    }

    @Test
    void menteAdverbsKeepBothStresses() {
        TranscriptionResult result = transcriber.transcribe("rápidamente", TranscriptionOptions.defaults().withMono(true));

        assertThat(result.phonology().words()).containsExactly("ˈrapidaˌmente");
        assertThat(result.phonetics().words()).containsExactly("ˈrapiðaˌmente");
        assertThat(result.sampa().words()).containsExactly("\"rrapiDa%mente");
    }

    @Test
    void extendedExceptionsSplitHiatus() {
        TranscriptionOptions extended = TranscriptionOptions.defaults().withExceptions(ExceptionLevel.EXTENDED);

        assertThat(transcriber.transcribe("cruel", extended).phonology().syllables()).containsExactly("kɾu", "ˈel");
    }

    @Test
    void unsyllabifiableWordAbortsTranscription() {
        assertThatThrownBy(() -> transcriber.transcribe("hola pst adiós"))
                .isInstanceOf(TranscriptionException.class)
                .hasRootCauseInstanceOf(SyllabificationException.class);
    }

    @Test
    void customSyllabifierIsUsed() {
        Transcriber custom = Transcriber.create((word, level) -> new Syllabification(List.of(word), -1));

        assertThat(custom.transcribe("casa").phonology().syllables()).containsExactly("kasa");
        assertThat(custom.transcribe("casa", TranscriptionOptions.defaults().withMono(true)).phonology().syllables())
                .containsExactly("ˈkasa");
    }

    @Test
    void isSafeForConcurrentUse() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<TranscriptionResult>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                String text = SENTENCES.get(i % SENTENCES.size());
                futures.add(executor.submit(() -> transcriber.transcribe(text)));
            }
            for (int i = 0; i < futures.size(); i++) {
                TranscriptionResult expected = transcriber.transcribe(SENTENCES.get(i % SENTENCES.size()));
                assertThat(futures.get(i).get(5, TimeUnit.SECONDS)).isEqualTo(expected);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
