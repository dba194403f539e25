package com.phillippitts.fonemas.service.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Named, ordered list of rewrite rules.
 *
 * <p>Rules run exactly once each, strictly in table order: an earlier rewrite can create or
 * remove the context a later rule matches, so the order is part of the table's meaning.
 * Tables are immutable and safe to share between threads.
 */
public final class RuleTable {

    private final String name;
    private final List<RewriteRule> rules;

    private RuleTable(String name, List<RewriteRule> rules) {
        this.name = name;
        this.rules = List.copyOf(rules);
    }

    public static RuleTable of(String name, RewriteRule... rules) {
        Objects.requireNonNull(name, "name must not be null");
        return new RuleTable(name, List.of(rules));
    }

    public static RuleTable of(String name, List<RewriteRule> rules) {
        Objects.requireNonNull(name, "name must not be null");
        return new RuleTable(name, rules);
    }

    /**
     * Runs every rule once, in order.
     *
     * @param input text to rewrite
     * @return rewritten text
     */
    public String apply(String input) {
        String result = input;
        for (RewriteRule rule : rules) {
            result = rule.apply(result);
        }
        return result;
    }

    /**
     * Returns a new table with {@code rule} appended.
     */
    public RuleTable with(RewriteRule rule) {
        List<RewriteRule> extended = new ArrayList<>(rules);
        extended.add(rule);
        return new RuleTable(name, extended);
    }

    public String name() {
        return name;
    }

    public List<RewriteRule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    @Override
    public String toString() {
        return "RuleTable[" + name + ", " + rules.size() + " rules]";
    }
}
