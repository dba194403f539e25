package com.phillippitts.fonemas.cli;

import com.phillippitts.fonemas.domain.TranscriptionOptions;
import com.phillippitts.fonemas.service.DefaultTranscriptionService;
import com.phillippitts.fonemas.service.TranscriptionService;
import com.phillippitts.fonemas.service.metrics.TranscriptionMetricsPublisher;
import com.phillippitts.fonemas.service.normalize.SentenceNormalizer;
import com.phillippitts.fonemas.service.phonetics.PhoneticTransducer;
import com.phillippitts.fonemas.service.phonology.PhonologicalTransducer;
import com.phillippitts.fonemas.service.rehash.SyllableRehasher;
import com.phillippitts.fonemas.service.sampa.SampaTransliterator;
import com.phillippitts.fonemas.service.syllabify.SpanishSyllabifier;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TranscribeCommandTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private static TranscriptionService realService() {
        return new DefaultTranscriptionService(
                new SentenceNormalizer(),
                new PhonologicalTransducer(new SpanishSyllabifier()),
                new SyllableRehasher(),
                new PhoneticTransducer(),
                new SampaTransliterator(),
                TranscriptionMetricsPublisher.NOOP,
                TranscriptionOptions.defaults());
    }

    private TranscribeCommand command(TranscriptionService service, String stdin, boolean interactive) {
        return new TranscribeCommand(service,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                interactive);
    }

    private TranscribeCommand command() {
        return command(realService(), "", true);
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void printsPhonologyWordsByDefault() {
        int code = command().execute(new String[] {"un", "beso"});

        assertThat(code).isEqualTo(TranscribeCommand.EXIT_OK);
        assertThat(out().trim()).isEqualTo("un ˈbeso");
        assertThat(err()).isEmpty();
    }

    @Test
    void printsSelectedFormat() {
        command().execute(new String[] {"--format", "phonetics", "un beso"});
        assertThat(out().trim()).isEqualTo("um ˈbeso");
    }

    @Test
    void printsSampaWithCustomMarker() {
        command().execute(new String[] {"-f", "sampa", "--stress='", "casa"});
        assertThat(out().trim()).isEqualTo("'kasa");
    }

    @Test
    void printsStructuredJson() {
        int code = command().execute(new String[] {"--structured", "Averigüéis"});

        assertThat(code).isEqualTo(TranscribeCommand.EXIT_OK);
        JSONObject json = new JSONObject(out());
        assertThat(json.getString("sentence")).isEqualTo("averigüéis");
        assertThat(json.getJSONObject("phonology").getJSONArray("words").getString(0)).isEqualTo("abeɾiˈgwejs");
        assertThat(json.getJSONObject("phonetics").getJSONArray("syllables").length()).isEqualTo(4);
        assertThat(json.getJSONObject("sampa").getJSONArray("syllables").getString(3)).isEqualTo("\"Gwejs");
    }

    @Test
    void readsTextFromStandardInput() {
        TranscribeCommand command = command(realService(), "buenos\ndías\n", false);

        int code = command.execute(new String[] {"-f", "phonology"});

        assertThat(code).isEqualTo(TranscribeCommand.EXIT_OK);
        assertThat(out().trim()).isEqualTo("ˈbwenos ˈdias");
    }

    @Test
    void showsHelp() {
        TranscriptionService service = mock(TranscriptionService.class);
        when(service.defaultOptions()).thenReturn(TranscriptionOptions.defaults());

        int code = command(service, "", true).execute(new String[] {"--help"});

        assertThat(code).isEqualTo(TranscribeCommand.EXIT_OK);
        assertThat(out()).contains("Usage:").contains("--structured");
        verify(service, never()).transcribe(any(), any());
    }

    @Test
    void missingTextOnTerminalIsInputError() {
        int code = command().execute(new String[] {"-m"});

        assertThat(code).isEqualTo(TranscribeCommand.EXIT_INPUT_ERROR);
        assertThat(err()).contains("Error: No text provided");
        assertThat(out()).isEmpty();
    }

    @Test
    void blankStandardInputIsInputError() {
        int code = command(realService(), "  \n ", false).execute(new String[0]);

        assertThat(code).isEqualTo(TranscribeCommand.EXIT_INPUT_ERROR);
        assertThat(err()).contains("No text provided");
    }

    @Test
    void unknownFlagIsInputError() {
        int code = command().execute(new String[] {"--loud", "casa"});

        assertThat(code).isEqualTo(TranscribeCommand.EXIT_INPUT_ERROR);
        assertThat(err()).startsWith("Error: ").contains("--loud");
        assertThat(out()).isEmpty();
    }

    @Test
    void invalidFormatIsInputError() {
        int code = command().execute(new String[] {"--format", "ipa", "casa"});

        assertThat(code).isEqualTo(TranscribeCommand.EXIT_INPUT_ERROR);
        assertThat(err()).contains("phonology, phonetics, sampa");
    }

    @Test
    void unsyllabifiableWordIsTranscriptionError() {
        int code = command().execute(new String[] {"hola", "pst"});

        assertThat(code).isEqualTo(TranscribeCommand.EXIT_TRANSCRIPTION_ERROR);
        assertThat(err()).startsWith("Error: ").contains("pst");
        assertThat(out()).isEmpty();
    }

    @Test
    void runStoresExitCode() {
        TranscribeCommand command = command();

        command.run(new DefaultApplicationArguments("--exceptions=9", "casa"));

        assertThat(command.getExitCode()).isEqualTo(TranscribeCommand.EXIT_INPUT_ERROR);
    }

    @Test
    void jsonHasAllFormats() {
        JSONObject json = TranscribeCommand.toJson(realService().transcribe("sol"));

        assertThat(json.keySet()).containsExactlyInAnyOrder("sentence", "phonology", "phonetics", "sampa");
        assertThat(json.getJSONObject("phonology").keySet()).containsExactlyInAnyOrder("words", "syllables");
    }
}
