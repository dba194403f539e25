package com.phillippitts.fonemas.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for transcriptions.
 *
 * <p>Provides:
 * <ul>
 *   <li>{@code fonemas.transcription.latency} timer</li>
 *   <li>{@code fonemas.transcription.success} and {@code fonemas.transcription.failure}
 *       counters, the latter tagged with a reason</li>
 *   <li>{@code fonemas.transcription.words} summary of words per transcription</li>
 * </ul>
 *
 * <p>Exposed through the actuator metrics endpoint.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class TranscriptionMetrics {

    static final String METRIC_PREFIX = "fonemas.transcription";

    private final MeterRegistry registry;

    public TranscriptionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param durationNanos duration of the whole pipeline in nanoseconds
     */
    public void recordLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to transcribe one text")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess() {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful transcriptions")
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure category (syllabification, unexpected_error)
     */
    public void incrementFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed transcriptions")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param words number of words in the transcribed sentence
     */
    public void recordWords(int words) {
        DistributionSummary.builder(METRIC_PREFIX + ".words")
                .description("Words per transcribed text")
                .register(registry)
                .record(words);
    }
}
