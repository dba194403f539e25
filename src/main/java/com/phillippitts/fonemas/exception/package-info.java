/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.fonemas.exception.FonemasException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.fonemas.exception.SyllabificationException} - Thrown when
 *       the syllabifier rejects a word; aborts the whole transcription</li>
 *   <li>{@link com.phillippitts.fonemas.exception.TranscriptionException} - Thrown when a
 *       pipeline stage aborts, carrying the stage name</li>
 *   <li>{@link com.phillippitts.fonemas.exception.InvalidOptionException} - Thrown for caller
 *       errors (invalid option or format values) before the pipeline runs</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support chaining via {@code cause}, and map to HTTP
 * status codes via {@code GlobalExceptionHandler} and to exit codes in the command line runner.
 *
 * @see com.phillippitts.fonemas.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.fonemas.exception;
