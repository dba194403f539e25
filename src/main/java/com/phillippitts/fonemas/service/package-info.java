/**
 * Transcription pipeline. Each stage lives in its own sub-package and is a plain,
 * thread-safe class; {@link com.phillippitts.fonemas.service.TranscriptionService} runs them
 * in order.
 */
package com.phillippitts.fonemas.service;
