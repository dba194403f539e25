package com.phillippitts.fonemas.presentation.controller;

import com.phillippitts.fonemas.domain.TranscriptionOptions;
import com.phillippitts.fonemas.domain.TranscriptionResult;
import com.phillippitts.fonemas.exception.InvalidOptionException;
import com.phillippitts.fonemas.service.TranscriptionService;
import com.phillippitts.fonemas.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Objects;

/**
 * Transcription endpoints. Options a client leaves out fall back to the configured defaults.
 */
@RestController
@RequestMapping("/api/transcriptions")
class TranscriptionController {

    private static final Logger LOG = LogManager.getLogger(TranscriptionController.class);

    private final TranscriptionService service;

    TranscriptionController(TranscriptionService service) {
        this.service = Objects.requireNonNull(service, "service must not be null");
    }

    @GetMapping
    ResponseEntity<TranscriptionResult> transcribe(
            @RequestParam String text,
            @RequestParam(required = false) Boolean mono,
            @RequestParam(required = false) Integer exceptions,
            @RequestParam(required = false) Boolean epenthesis,
            @RequestParam(required = false) Boolean aspiration,
            @RequestParam(required = false) Boolean rehash,
            @RequestParam(required = false) String stress) {
        TranscriptionRequest.Overrides overrides = new TranscriptionRequest.Overrides(
                mono, exceptions, epenthesis, aspiration, rehash, stress);
        return ResponseEntity.ok(run(text, overrides));
    }

    @PostMapping
    ResponseEntity<TranscriptionResult> transcribe(@RequestBody TranscriptionRequest request) {
        TranscriptionRequest.Overrides overrides = request.options() == null
                ? TranscriptionRequest.Overrides.NONE
                : request.options();
        return ResponseEntity.ok(run(request.text(), overrides));
    }

    private TranscriptionResult run(String text, TranscriptionRequest.Overrides overrides) {
        if (text == null || text.isBlank()) {
            throw new InvalidOptionException("text", text, "text must not be blank");
        }
        TranscriptionOptions options = overrides.applyTo(service.defaultOptions());
        LOG.info("Transcription requested (chars={}, preview='{}')", text.length(), LogSanitizer.preview(text));
        return service.transcribe(text, options);
    }
}
