package com.phillippitts.fonemas.service.rules;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single context-sensitive rewrite: every non-overlapping match of {@code pattern},
 * scanned left to right, is replaced once by {@code replacement}.
 *
 * <p>The replacement follows {@link Matcher#replaceAll(String)} syntax, so
 * {@code $1} refers to a captured group. The description records the linguistic intent of the
 * rule, which the pattern alone does not convey.
 *
 * @param pattern     compiled match pattern
 * @param replacement replacement template
 * @param description what the rule models
 */
public record RewriteRule(Pattern pattern, String replacement, String description) {

    public RewriteRule {
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(replacement, "replacement must not be null");
        Objects.requireNonNull(description, "description must not be null");
    }

    /**
     * Builds a rule from a regular expression.
     */
    public static RewriteRule of(String regex, String replacement, String description) {
        return new RewriteRule(Pattern.compile(regex), replacement, description);
    }

    /**
     * Builds a rule that replaces a fixed string, with no context.
     */
    public static RewriteRule literal(String target, String replacement, String description) {
        return new RewriteRule(Pattern.compile(Pattern.quote(target)),
                Matcher.quoteReplacement(replacement), description);
    }

    /**
     * Applies the rule once over the whole input.
     *
     * @param input text to rewrite
     * @return rewritten text (the input itself when nothing matches)
     */
    public String apply(String input) {
        return pattern.matcher(input).replaceAll(replacement);
    }
}
