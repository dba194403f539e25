package com.phillippitts.fonemas.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Seam between the transcription service and {@link TranscriptionMetrics}.
 *
 * <p>All methods tolerate a missing metrics instance, so the pipeline runs unchanged outside
 * Spring (see {@link #NOOP}).
 *
 * @see TranscriptionMetrics
 */
@Component
public final class TranscriptionMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(TranscriptionMetricsPublisher.class);

    /** Publisher that records nothing. Used by the standalone facade and by tests. */
    public static final TranscriptionMetricsPublisher NOOP = new TranscriptionMetricsPublisher(null);

    private final TranscriptionMetrics metrics;

    /**
     * @param metrics metrics service (nullable, in which case nothing is recorded)
     */
    public TranscriptionMetricsPublisher(TranscriptionMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("TranscriptionMetricsPublisher created without metrics");
        }
    }

    /**
     * @param durationNanos pipeline duration in nanoseconds
     * @param words         number of words transcribed
     */
    public void recordSuccess(long durationNanos, int words) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(durationNanos);
        metrics.incrementSuccess();
        metrics.recordWords(words);
    }

    /**
     * @param reason failure category, e.g. "syllabification" or "unexpected_error"
     */
    public void recordFailure(String reason) {
        if (metrics == null) {
            return;
        }
        metrics.incrementFailure(reason);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
