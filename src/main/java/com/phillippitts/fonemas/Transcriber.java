package com.phillippitts.fonemas;

import com.phillippitts.fonemas.domain.TranscriptionOptions;
import com.phillippitts.fonemas.domain.TranscriptionResult;
import com.phillippitts.fonemas.service.DefaultTranscriptionService;
import com.phillippitts.fonemas.service.TranscriptionService;
import com.phillippitts.fonemas.service.metrics.TranscriptionMetricsPublisher;
import com.phillippitts.fonemas.service.normalize.SentenceNormalizer;
import com.phillippitts.fonemas.service.phonetics.PhoneticTransducer;
import com.phillippitts.fonemas.service.phonology.PhonologicalTransducer;
import com.phillippitts.fonemas.service.rehash.SyllableRehasher;
import com.phillippitts.fonemas.service.sampa.SampaTransliterator;
import com.phillippitts.fonemas.service.syllabify.SpanishSyllabifier;
import com.phillippitts.fonemas.service.syllabify.Syllabifier;

import java.util.Objects;

/**
 * Entry point for using the transcription pipeline as a library, without Spring.
 *
 * <pre>
 * TranscriptionResult result = Transcriber.create().transcribe("Averigüéis");
 * result.phonology().words();   // [abeɾiˈgwejs]
 * result.sampa().syllables();   // [a, Be, ri, "Gwejs]
 * </pre>
 */
public final class Transcriber {

    private final TranscriptionService service;

    private Transcriber(TranscriptionService service) {
        this.service = service;
    }

    /**
     * @return a transcriber using the built-in Spanish syllabifier and default options
     */
    public static Transcriber create() {
        return create(new SpanishSyllabifier());
    }

    /**
     * @param syllabifier syllabifier to use (must not be null)
     * @return a transcriber using default options
     */
    public static Transcriber create(Syllabifier syllabifier) {
        Objects.requireNonNull(syllabifier, "syllabifier must not be null");
        return new Transcriber(new DefaultTranscriptionService(
                new SentenceNormalizer(),
                new PhonologicalTransducer(syllabifier),
                new SyllableRehasher(),
                new PhoneticTransducer(),
                new SampaTransliterator(),
                TranscriptionMetricsPublisher.NOOP,
                TranscriptionOptions.defaults()));
    }

    public TranscriptionResult transcribe(String text) {
        return service.transcribe(text);
    }

    public TranscriptionResult transcribe(String text, TranscriptionOptions options) {
        return service.transcribe(text, options);
    }
}
