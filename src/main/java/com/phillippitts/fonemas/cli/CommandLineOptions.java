package com.phillippitts.fonemas.cli;

import com.phillippitts.fonemas.domain.ExceptionLevel;
import com.phillippitts.fonemas.domain.Format;
import com.phillippitts.fonemas.domain.TranscriptionOptions;
import com.phillippitts.fonemas.exception.InvalidOptionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parsed command line of the {@code cli} profile.
 *
 * <p>Accepted forms: {@code --name}, {@code --name=value}, {@code --name value} and the
 * short flags {@code -s -f -m -e -a -r -h}. Arguments after {@code --} are always text.
 * Spring properties ({@code --spring.profiles.active=cli} and any other dotted
 * {@code --key=value}) are skipped, since Spring Boot consumes them itself.
 *
 * @param help       print usage and exit
 * @param structured print JSON instead of plain words
 * @param format     representation printed in plain mode
 * @param options    transcription options
 * @param text       text from the arguments, or null when it must be read from standard input
 */
public record CommandLineOptions(
        boolean help,
        boolean structured,
        Format format,
        TranscriptionOptions options,
        String text
) {

    public CommandLineOptions {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * @param args     raw arguments (must not be null)
     * @param defaults options used for every flag not given
     * @return parsed command line
     * @throws InvalidOptionException on an unknown flag, a missing value or an invalid value
     */
    public static CommandLineOptions parse(String[] args, TranscriptionOptions defaults) {
        Objects.requireNonNull(args, "args must not be null");
        Objects.requireNonNull(defaults, "defaults must not be null");

        boolean help = false;
        boolean structured = false;
        Format format = Format.PHONOLOGY;
        TranscriptionOptions options = defaults;
        List<String> words = new ArrayList<>();
        boolean textOnly = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (textOnly || !arg.startsWith("-") || arg.equals("-")) {
                words.add(arg);
                continue;
            }
            if (arg.equals("--")) {
                textOnly = true;
                continue;
            }

            String name = arg;
            String inlineValue = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                name = arg.substring(0, eq);
                inlineValue = arg.substring(eq + 1);
            }

            switch (name) {
                case "-h", "--help" -> help = true;
                case "-s", "--structured" -> structured = true;
                case "-m", "--mono" -> options = options.withMono(true);
                case "-e", "--epenthesis" -> options = options.withEpenthesis(true);
                case "-a", "--aspiration" -> options = options.withAspiration(true);
                case "-r", "--rehash" -> options = options.withRehash(true);
                case "-f", "--format" -> {
                    String value = inlineValue != null ? inlineValue : valueAfter(args, i++, "format");
                    format = Format.fromString(value);
                }
                case "--exceptions" -> {
                    String value = inlineValue != null ? inlineValue : valueAfter(args, i++, "exceptions");
                    options = options.withExceptions(ExceptionLevel.of(parseLevel(value)));
                }
                case "--stress" -> {
                    String value = inlineValue != null ? inlineValue : valueAfter(args, i++, "stress");
                    options = options.withStress(value);
                }
                default -> {
                    if (!isSpringProperty(name)) {
                        throw new InvalidOptionException(arg, null, "unknown option, use --help");
                    }
                }
            }
        }

        String text = words.isEmpty() ? null : String.join(" ", words);
        return new CommandLineOptions(help, structured, format, options, text);
    }

    private static String valueAfter(String[] args, int index, String option) {
        if (index + 1 >= args.length) {
            throw new InvalidOptionException(option, null, "a value is required");
        }
        return args[index + 1];
    }

    private static int parseLevel(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidOptionException("exceptions", value, "must be 0, 1 or 2");
        }
    }

    private static boolean isSpringProperty(String name) {
        return name.startsWith("--") && name.indexOf('.', 2) > 0;
    }
}
