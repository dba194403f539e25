package com.phillippitts.fonemas.service.sampa;

import com.phillippitts.fonemas.service.rules.IpaSymbols;

import java.util.List;

/**
 * IPA to SAMPA symbol pairs, in application order. The primary stress mark is not listed: its
 * replacement is chosen per request.
 */
final class SampaSymbols {

    static final List<String[]> IPA_TO_SAMPA = List.of(
            new String[]{"β", "B"},
            new String[]{"ð", "D"},
            new String[]{"ɣ", "G"},
            new String[]{"ʎ", "L"},
            new String[]{"r", "rr"},
            new String[]{"ɾ", "r"},
            new String[]{"ɱ", "M"},
            new String[]{"ŋ", "N"},
            new String[]{"ɲ", "J"},
            new String[]{"ʧ", "tS"},
            new String[]{"ʝ", "y"},
            new String[]{"χ", "4"},
            new String[]{"θ", "T"},
            new String[]{"ʰ", "_h"});

    static final String SECONDARY_STRESS = "%";

    static final String PRIMARY_STRESS_IPA = IpaSymbols.PRIMARY_STRESS;
    static final String SECONDARY_STRESS_IPA = IpaSymbols.SECONDARY_STRESS;

    private SampaSymbols() {
    }
}
