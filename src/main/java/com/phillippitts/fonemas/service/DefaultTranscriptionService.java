package com.phillippitts.fonemas.service;

import com.phillippitts.fonemas.domain.Sentence;
import com.phillippitts.fonemas.domain.Transcript;
import com.phillippitts.fonemas.domain.TranscriptionOptions;
import com.phillippitts.fonemas.domain.TranscriptionResult;
import com.phillippitts.fonemas.exception.SyllabificationException;
import com.phillippitts.fonemas.exception.TranscriptionException;
import com.phillippitts.fonemas.exception.TranscriptionExceptionBuilder;
import com.phillippitts.fonemas.service.metrics.TranscriptionMetricsPublisher;
import com.phillippitts.fonemas.service.normalize.SentenceNormalizer;
import com.phillippitts.fonemas.service.phonetics.PhoneticTransducer;
import com.phillippitts.fonemas.service.phonology.PhonologicalTransducer;
import com.phillippitts.fonemas.service.rehash.SyllableRehasher;
import com.phillippitts.fonemas.service.sampa.SampaTransliterator;
import com.phillippitts.fonemas.util.LogSanitizer;
import com.phillippitts.fonemas.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Default {@link TranscriptionService}: runs normalizer, phonological transducer, optional
 * rehash, phonetic transducer and SAMPA transliterator in that order.
 *
 * <p><b>Error Handling:</b> a syllabification failure aborts the whole transcription. It is
 * rethrown as a {@link TranscriptionException} naming the stage and the offending word, with
 * the original exception as cause. No partial result is returned.
 *
 * <p>Stateless apart from its collaborators, which are themselves thread-safe.
 */
public class DefaultTranscriptionService implements TranscriptionService {

    private static final Logger LOG = LogManager.getLogger(DefaultTranscriptionService.class);

    static final String STAGE_PHONOLOGY = "phonology";

    private final SentenceNormalizer normalizer;
    private final PhonologicalTransducer phonology;
    private final SyllableRehasher rehasher;
    private final PhoneticTransducer phonetics;
    private final SampaTransliterator sampa;
    private final TranscriptionMetricsPublisher metricsPublisher;
    private final TranscriptionOptions defaultOptions;

    /**
     * @throws NullPointerException if any parameter is null
     */
    public DefaultTranscriptionService(SentenceNormalizer normalizer,
                                       PhonologicalTransducer phonology,
                                       SyllableRehasher rehasher,
                                       PhoneticTransducer phonetics,
                                       SampaTransliterator sampa,
                                       TranscriptionMetricsPublisher metricsPublisher,
                                       TranscriptionOptions defaultOptions) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.phonology = Objects.requireNonNull(phonology, "phonology must not be null");
        this.rehasher = Objects.requireNonNull(rehasher, "rehasher must not be null");
        this.phonetics = Objects.requireNonNull(phonetics, "phonetics must not be null");
        this.sampa = Objects.requireNonNull(sampa, "sampa must not be null");
        this.metricsPublisher = Objects.requireNonNull(metricsPublisher, "metricsPublisher must not be null");
        this.defaultOptions = Objects.requireNonNull(defaultOptions, "defaultOptions must not be null");
    }

    @Override
    public TranscriptionResult transcribe(String text) {
        return transcribe(text, defaultOptions);
    }

    @Override
    public TranscriptionOptions defaultOptions() {
        return defaultOptions;
    }

    @Override
    public TranscriptionResult transcribe(String text, TranscriptionOptions options) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(options, "options must not be null");

        long startTime = System.nanoTime();
        try {
            TranscriptionResult result = runPipeline(text, options);
            int words = result.phonology().words().size();
            metricsPublisher.recordSuccess(TimeUtils.elapsedNanos(startTime), words);
            LOG.info("Transcribed {} words, {} syllables in {} ms",
                    words, result.phonology().syllables().size(), TimeUtils.elapsedMillis(startTime));
            return result;
        } catch (TranscriptionException te) {
            metricsPublisher.recordFailure("syllabification");
            LOG.warn("Transcription failed: {}", te.getMessage());
            throw te;
        } catch (RuntimeException re) {
            metricsPublisher.recordFailure("unexpected_error");
            LOG.error("Unexpected error while transcribing '{}'", LogSanitizer.preview(text), re);
            throw re;
        }
    }

    private TranscriptionResult runPipeline(String text, TranscriptionOptions options) {
        Sentence sentence = normalizer.normalize(text, options.epenthesis());
        LOG.debug("Cleaned '{}' into '{}'", LogSanitizer.preview(text), LogSanitizer.preview(sentence.text()));

        Transcript phonological = transcribePhonology(sentence, options);
        if (options.rehash()) {
            phonological = phonological.withSyllables(rehasher.rehash(phonological.syllables()));
            LOG.debug("Rehashed {} syllables", phonological.syllables().size());
        }

        Transcript phonetic = phonetics.transcribe(phonological);
        Transcript ascii = sampa.transliterate(phonetic, options.stress());
        return new TranscriptionResult(sentence.text(), phonological, phonetic, ascii);
    }

    private Transcript transcribePhonology(Sentence sentence, TranscriptionOptions options) {
        try {
            return phonology.transcribe(sentence, options);
        } catch (SyllabificationException se) {
            throw TranscriptionExceptionBuilder.create("Syllabification failed")
                    .stage(STAGE_PHONOLOGY)
                    .word(se.getWord())
                    .cause(se)
                    .metadata("exceptions", options.exceptions().level())
                    .build();
        }
    }
}
