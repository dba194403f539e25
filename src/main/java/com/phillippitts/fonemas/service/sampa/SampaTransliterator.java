package com.phillippitts.fonemas.service.sampa;

import com.phillippitts.fonemas.domain.Transcript;
import com.phillippitts.fonemas.service.rules.RewriteRule;
import com.phillippitts.fonemas.service.rules.RuleTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Transliterates an IPA transcript into ASCII-safe SAMPA.
 *
 * <p>The symbol table is fixed except for the primary stress mark, which is replaced by the
 * caller's marker. The marker comes from the request, so the table for it is built per call
 * and never retained.
 */
public class SampaTransliterator {

    private static final RuleTable SYMBOLS = symbolTable();

    private static final RewriteRule SECONDARY_STRESS = RewriteRule.literal(
            SampaSymbols.SECONDARY_STRESS_IPA, SampaSymbols.SECONDARY_STRESS, "secondary stress");

    /**
     * @param phonetics  phonetic transcript (must not be null)
     * @param stressMark replacement for the primary stress mark (must not be null)
     * @return SAMPA transcript with the same word and syllable counts
     */
    public Transcript transliterate(Transcript phonetics, String stressMark) {
        Objects.requireNonNull(phonetics, "phonetics must not be null");
        Objects.requireNonNull(stressMark, "stressMark must not be null");

        RuleTable table = tableFor(stressMark);
        return new Transcript(applyAll(table, phonetics.words()), applyAll(table, phonetics.syllables()));
    }

    private static List<String> applyAll(RuleTable table, List<String> values) {
        List<String> result = new ArrayList<>(values.size());
        for (String value : values) {
            result.add(table.apply(value));
        }
        return result;
    }

    private static RuleTable tableFor(String stressMark) {
        return SYMBOLS
                .with(RewriteRule.literal(SampaSymbols.PRIMARY_STRESS_IPA, stressMark, "primary stress"))
                .with(SECONDARY_STRESS);
    }

    private static RuleTable symbolTable() {
        List<RewriteRule> rules = new ArrayList<>();
        for (String[] pair : SampaSymbols.IPA_TO_SAMPA) {
            rules.add(RewriteRule.literal(pair[0], pair[1], pair[0] + " as " + pair[1]));
        }
        return RuleTable.of("sampa", rules);
    }
}
