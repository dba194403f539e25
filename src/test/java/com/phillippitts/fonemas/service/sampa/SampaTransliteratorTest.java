package com.phillippitts.fonemas.service.sampa;

import com.phillippitts.fonemas.domain.Transcript;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SampaTransliteratorTest {

    private final SampaTransliterator transliterator = new SampaTransliterator();

    private Transcript transliterate(List<String> words, String stress) {
        return transliterator.transliterate(new Transcript(words, words), stress);
    }

    @Test
    void replacesPrimaryStressWithMarker() {
        assertThat(transliterate(List.of("ˈkasa"), "\"").words()).containsExactly("\"kasa");
        assertThat(transliterate(List.of("ˈkasa"), "'").words()).containsExactly("'kasa");
    }

    @Test
    void mapsSecondaryStressToPercent() {
        assertThat(transliterate(List.of("ˈrapiðaˌmente"), "\"").words()).containsExactly("\"rrapiDa%mente");
    }

    @Test
    void keepsSecondaryMarkAfterPrimaryMark() {
        assertThat(transliterate(List.of("fjelˈˌmente"), "\"").words()).containsExactly("fjel\"%mente");
    }

    @Test
    void holdsNoStatePerMarker() {
        for (int i = 0; i < 1000; i++) {
            String marker = "m" + i;
            assertThat(transliterate(List.of("ˈkasa"), marker).words()).containsExactly(marker + "kasa");
        }

        for (Field field : SampaTransliterator.class.getDeclaredFields()) {
            assertThat(Modifier.isStatic(field.getModifiers()))
                    .as("field %s", field.getName())
                    .isTrue();
        }
    }

    @Test
    void distinguishesTrillFromTap() {
        assertThat(transliterate(List.of("ˈpero", "ˈpeɾo"), "\"").words()).containsExactly("\"perro", "\"pero");
    }

    @Test
    void mapsConsonantSymbols() {
        Transcript result = transliterate(
                List.of("ˈʧiko", "ˈʎaβe", "θaˈpato", "ˈniɲo", "ˈʝelo", "χwan", "aˈɣo", "ˈkaða"), "\"");

        assertThat(result.words()).containsExactly(
                "\"tSiko", "\"LaBe", "Ta\"pato", "\"niJo", "\"yelo", "4wan", "a\"Go", "\"kaDa");
    }

    @Test
    void mapsNasalAllophones() {
        assertThat(transliterate(List.of("eɱˈfeɾmo", "iŋˈgles"), "\"").words())
                .containsExactly("eM\"fermo", "iN\"gles");
    }

    @Test
    void mapsAspiration() {
        assertThat(transliterate(List.of("ˈʰola"), "\"").words()).containsExactly("\"_hola");
    }

    @Test
    void outputIsAscii() {
        Transcript result = transliterate(List.of("aβeɾiˈɣwejs", "ˈrapiðaˌmente", "ˈʧiko", "ˈʰola"), "\"");

        for (String word : result.words()) {
            assertThat(word.chars().allMatch(c -> c < 128)).as(word).isTrue();
        }
    }

    @Test
    void keepsSyllablesSeparate() {
        Transcript result = transliterator.transliterate(
                new Transcript(List.of("aβeɾiˈɣwejs"), List.of("a", "βe", "ɾi", "ˈɣwejs")), "\"");

        assertThat(result.words()).containsExactly("aBeri\"Gwejs");
        assertThat(result.syllables()).containsExactly("a", "Be", "ri", "\"Gwejs");
    }

    @Test
    void repeatedMarkersGiveSameResult() {
        Transcript first = transliterate(List.of("ˈkasa"), "*");
        Transcript second = transliterate(List.of("ˈkasa"), "*");

        assertThat(second).isEqualTo(first);
    }

    @Test
    void rejectsNullMarker() {
        assertThatThrownBy(() -> transliterate(List.of("ˈkasa"), null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("stressMark");
    }
}
