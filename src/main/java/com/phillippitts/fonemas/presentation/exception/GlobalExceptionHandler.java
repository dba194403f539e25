package com.phillippitts.fonemas.presentation.exception;

import com.phillippitts.fonemas.exception.InvalidOptionException;
import com.phillippitts.fonemas.exception.SyllabificationException;
import com.phillippitts.fonemas.exception.TranscriptionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Global exception handler for the REST API.
 *
 * Caller errors map to 400, words the syllabifier rejects to 422, and everything else to 500
 * without exposing internals.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - invalid option or blank text (HTTP 400).
     */
    @ExceptionHandler(InvalidOptionException.class)
    ResponseEntity<ApiError> handleInvalidOption(InvalidOptionException ex) {
        LOG.warn("Invalid option: option={}, reason={}", ex.getOption(), ex.getMessage());
        return badRequest(ex.getClass().getSimpleName(), ex.getMessage());
    }

    /**
     * Client error - missing or malformed request parameters or body (HTTP 400).
     */
    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    ResponseEntity<ApiError> handleMalformedRequest(Exception ex) {
        LOG.warn("Malformed request: {}", ex.getMessage());
        return badRequest("MalformedRequest", ex.getMessage());
    }

    /**
     * Input the pipeline cannot transcribe (HTTP 422).
     */
    @ExceptionHandler(SyllabificationException.class)
    ResponseEntity<ApiError> handleSyllabification(SyllabificationException ex) {
        LOG.warn("Word rejected by syllabifier: word={}, reason={}", ex.getWord(), ex.getReason());
        return unprocessable(ex);
    }

    /**
     * Pipeline abort. Syllabification failures are the caller's input (HTTP 422), anything
     * else is an internal error (HTTP 500).
     */
    @ExceptionHandler(TranscriptionException.class)
    ResponseEntity<ApiError> handleTranscriptionFailure(TranscriptionException ex) {
        if (ex.getCause() instanceof SyllabificationException se) {
            LOG.warn("Transcription rejected: stage={}, word={}", ex.getStage(), se.getWord());
            return unprocessable(se);
        }
        LOG.error("Transcription failed: stage={}", ex.getStage(), ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Transcription failed",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> badRequest(String errorCode, String details) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(errorCode, "Invalid request", details, Instant.now()));
    }

    private static ResponseEntity<ApiError> unprocessable(SyllabificationException ex) {
        return ResponseEntity
            .status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(new ApiError(
                SyllabificationException.class.getSimpleName(),
                "Cannot transcribe word '" + ex.getWord() + "'",
                ex.getReason(),
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
