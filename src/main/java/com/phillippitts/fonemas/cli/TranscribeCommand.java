package com.phillippitts.fonemas.cli;

import com.phillippitts.fonemas.domain.Transcript;
import com.phillippitts.fonemas.domain.TranscriptionResult;
import com.phillippitts.fonemas.exception.InvalidOptionException;
import com.phillippitts.fonemas.exception.TranscriptionException;
import com.phillippitts.fonemas.service.TranscriptionService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Command-line front end, active with the {@code cli} profile.
 *
 * <p>Exit codes:
 * <ul>
 *   <li>0 - transcription printed, or help shown</li>
 *   <li>1 - missing text, unknown flag or invalid value; the pipeline is not run</li>
 *   <li>2 - the pipeline rejected the input</li>
 * </ul>
 */
@Component
@Profile(TranscribeCommand.PROFILE)
public class TranscribeCommand implements ApplicationRunner, ExitCodeGenerator {

    public static final String PROFILE = "cli";

    static final int EXIT_OK = 0;
    static final int EXIT_INPUT_ERROR = 1;
    static final int EXIT_TRANSCRIPTION_ERROR = 2;

    static final String USAGE = """
            fonemas - Spanish phonological and phonetic transcription

            Usage:
              fonemas [options] <text>
              echo <text> | fonemas [options]

            Options:
              -s, --structured         Output in structured JSON format
              -f, --format <type>      phonology|phonetics|sampa (default: phonology)
              -m, --mono               Mark stress on monosyllables
              -e, --epenthesis         Add 'e' before s+consonant clusters
              -a, --aspiration         Mark aspiration with ʰ
              -r, --rehash             Move final consonants to next syllable onset
                  --exceptions <0-2>   Syllabifier exception level (default: 1)
                  --stress <marker>    SAMPA stress marker (default: ")
              -h, --help               Show this help message
            """;

    private static final Logger LOG = LogManager.getLogger(TranscribeCommand.class);

    private final TranscriptionService service;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private final boolean interactive;

    private int exitCode = EXIT_OK;

    @Autowired
    public TranscribeCommand(TranscriptionService service) {
        this(service, System.in, System.out, System.err, System.console() != null);
    }

    TranscribeCommand(TranscriptionService service, InputStream in, PrintStream out, PrintStream err,
                      boolean interactive) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.in = Objects.requireNonNull(in, "in must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.err = Objects.requireNonNull(err, "err must not be null");
        this.interactive = interactive;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args.getSourceArgs());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Runs one command line.
     *
     * @param args raw arguments
     * @return process exit code
     */
    int execute(String[] args) {
        CommandLineOptions command;
        String text;
        try {
            command = CommandLineOptions.parse(args, service.defaultOptions());
            if (command.help()) {
                out.print(USAGE);
                return EXIT_OK;
            }
            text = command.text() != null ? command.text() : readInput();
        } catch (InvalidOptionException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_INPUT_ERROR;
        }
        if (text == null || text.isBlank()) {
            err.println("Error: No text provided");
            err.println("Usage: fonemas [options] <text>");
            return EXIT_INPUT_ERROR;
        }

        try {
            TranscriptionResult result = service.transcribe(text, command.options());
            out.println(command.structured()
                    ? toJson(result).toString(2)
                    : String.join(" ", result.transcript(command.format()).words()));
            return EXIT_OK;
        } catch (TranscriptionException e) {
            LOG.debug("Command failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_TRANSCRIPTION_ERROR;
        }
    }

    private String readInput() {
        if (interactive) {
            return null;
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining(" ")).trim();
        } catch (IOException | UncheckedIOException e) {
            throw new InvalidOptionException("text", null, "cannot read standard input: " + e.getMessage());
        }
    }

    static JSONObject toJson(TranscriptionResult result) {
        JSONObject json = new JSONObject();
        json.put("sentence", result.sentence());
        result.all().forEach((format, transcript) -> json.put(format.key(), toJson(transcript)));
        return json;
    }

    private static JSONObject toJson(Transcript transcript) {
        JSONObject json = new JSONObject();
        json.put("words", new JSONArray(transcript.words()));
        json.put("syllables", new JSONArray(transcript.syllables()));
        return json;
    }
}
