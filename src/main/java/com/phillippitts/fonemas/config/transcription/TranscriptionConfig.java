package com.phillippitts.fonemas.config.transcription;

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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the pipeline stages and the transcription service. The stages are plain classes, so
 * they are declared here rather than annotated.
 */
@Configuration
public class TranscriptionConfig {

    private static final Logger LOG = LogManager.getLogger(TranscriptionConfig.class);

    @Bean
    public Syllabifier syllabifier(SyllabifierProperties props) {
        LOG.info("Using {} syllabifier", props.type());
        return switch (props.type()) {
            case BUILTIN -> new SpanishSyllabifier();
        };
    }

    @Bean
    public SentenceNormalizer sentenceNormalizer() {
        return new SentenceNormalizer();
    }

    @Bean
    public PhonologicalTransducer phonologicalTransducer(Syllabifier syllabifier) {
        return new PhonologicalTransducer(syllabifier);
    }

    @Bean
    public SyllableRehasher syllableRehasher() {
        return new SyllableRehasher();
    }

    @Bean
    public PhoneticTransducer phoneticTransducer() {
        return new PhoneticTransducer();
    }

    @Bean
    public SampaTransliterator sampaTransliterator() {
        return new SampaTransliterator();
    }

    @Bean
    public TranscriptionService transcriptionService(SentenceNormalizer normalizer,
                                                     PhonologicalTransducer phonology,
                                                     SyllableRehasher rehasher,
                                                     PhoneticTransducer phonetics,
                                                     SampaTransliterator sampa,
                                                     TranscriptionMetricsPublisher metricsPublisher,
                                                     TranscriptionProperties props) {
        return new DefaultTranscriptionService(normalizer, phonology, rehasher, phonetics, sampa,
                metricsPublisher, props.toOptions());
    }
}
