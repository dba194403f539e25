/**
 * Domain models of the transcription pipeline.
 *
 * <p>All domain models are immutable records or enums that validate themselves on
 * construction. Lists are defensively copied.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.fonemas.domain.Sentence} - cleaned input split into words</li>
 *   <li>{@link com.phillippitts.fonemas.domain.Transcript} - words and flattened syllables of
 *       one representation</li>
 *   <li>{@link com.phillippitts.fonemas.domain.TranscriptionResult} - sentence plus the
 *       phonology, phonetics and SAMPA transcripts</li>
 *   <li>{@link com.phillippitts.fonemas.domain.TranscriptionOptions} - per-request options</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.fonemas.domain;
