package com.phillippitts.fonemas.service.phonetics;

import com.phillippitts.fonemas.service.rules.RewriteRule;
import com.phillippitts.fonemas.service.rules.RuleTable;

/**
 * Phonology to phonetics rule tables.
 *
 * <p>Rules see either words joined by spaces or syllables joined by hyphens, so a separator
 * is written as {@code [\s\-ˈ]*}: any mix of space, hyphen and stress mark.
 */
public final class PhoneticRules {

    /**
     * Voiced stops soften to fricatives unless the previous sound is a nasal or there is no
     * previous sound. The look-back window is one character plus an optional single separator
     * and an optional stress mark.
     */
    public static final RuleTable ALLOPHONES = RuleTable.of("allophones",
            allophone("b", "β"),
            allophone("d", "ð"),
            allophone("g", "ɣ"));

    /** Assimilations, each applied once in this order. */
    public static final RuleTable COARTICULATION = RuleTable.of("coarticulation",
            RewriteRule.of("θ([\\s\\-ˈ]*)([bdgβðɣmnɲlʎrɾ])", "ð$1$2", "θ voices before a voiced consonant"),
            RewriteRule.of("s([\\s\\-ˈ]*)([bdgβðɣmnɲlʎrɾ])", "z$1$2", "s voices before a voiced consonant"),
            RewriteRule.of("f([\\s\\-ˈ]*)([bdgβðɣmnɲʎ])", "v$1$2", "f voices before a voiced consonant"),
            RewriteRule.of("([lmn])([\\s\\-ˈ]*)ð", "$1$2d", "ð hardens after l, m, n"),
            RewriteRule.of("n([\\s\\-ˈ]*)([bpm])", "m$1$2", "bilabial nasal"),
            RewriteRule.of("n([\\s\\-ˈ]*)f", "ɱ$1f", "labiodental nasal"),
            RewriteRule.of("n([\\s\\-ˈ]*)k", "ŋ$1k", "velar nasal before k"),
            RewriteRule.of("n([\\s\\-ˈ]*)[gɣ]", "ŋ$1g", "velar nasal before g"),
            RewriteRule.of("n([\\s\\-ˈ]*)x", "ŋ$1x", "velar nasal before x"),
            RewriteRule.of("x([\\s\\-ˈ]*)([uow])", "χ$1$2", "uvular before back vowels"));

    private PhoneticRules() {
    }

    private static RewriteRule allophone(String stop, String fricative) {
        return RewriteRule.of("([^mnɲ\\n\\-\\sˈ][\\-\\s]?ˈ?)" + stop, "$1" + fricative,
                stop + " softens to " + fricative);
    }
}
