package com.phillippitts.fonemas.service.syllabify;

import java.util.List;
import java.util.OptionalInt;

/**
 * Closed lexical exception tables for the built-in syllabifier, keyed on word beginnings
 * written in the transducer's phonological spelling (tap as ɾ, c as k or θ, and so on).
 */
final class SyllabifierExceptions {

    /**
     * A word beginning and the position inside it where a syllable boundary is forced.
     */
    record StemBoundary(String stem, int position) {
    }

    /** Prefixed stems whose morpheme boundary wins over onset maximisation (sub-al-ter-no). */
    static final List<StemBoundary> PREFIXES = List.of(
            new StemBoundary("subalt", 3),
            new StemBoundary("subaren", 3),
            new StemBoundary("subestim", 3),
            new StemBoundary("subuɾban", 3),
            new StemBoundary("subakuá", 3),
            new StemBoundary("tɾansatl", 5),
            new StemBoundary("tɾansalp", 5),
            new StemBoundary("inteɾuɾban", 5),
            new StemBoundary("inteɾameɾik", 5),
            new StemBoundary("panameɾik", 3),
            new StemBoundary("desigw", 3),
            new StemBoundary("desaθ", 3),
            new StemBoundary("inaktib", 2));

    /** Stems pronounced with a hiatus although no accent marks it (cru-el, tri-un-fo). */
    static final List<StemBoundary> HIATUSES = List.of(
            new StemBoundary("kɾuel", 3),
            new StemBoundary("kɾia", 3),
            new StemBoundary("tɾiunf", 3),
            new StemBoundary("tɾuan", 3),
            new StemBoundary("dueto", 2),
            new StemBoundary("ɾiada", 2),
            new StemBoundary("biaxe", 2),
            new StemBoundary("liaɾ", 2));

    private SyllabifierExceptions() {
    }

    static OptionalInt prefixBoundary(String word) {
        return lookup(PREFIXES, word);
    }

    static OptionalInt hiatusBoundary(String word) {
        return lookup(HIATUSES, word);
    }

    private static OptionalInt lookup(List<StemBoundary> table, String word) {
        for (StemBoundary entry : table) {
            if (word.startsWith(entry.stem())) {
                return OptionalInt.of(entry.position());
            }
        }
        return OptionalInt.empty();
    }
}
