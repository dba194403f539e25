package com.phillippitts.fonemas.integration;

import org.json.JSONObject;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Exercises the transcription endpoints over HTTP against the real pipeline.
 */
@Tag("integration")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class TranscriptionApiIntegrationTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void getReturnsAllRepresentations() {
        ResponseEntity<String> response = restTemplate.getForEntity(
                "/api/transcriptions?text={text}", String.class, "Averigüéis");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        JSONObject body = new JSONObject(response.getBody());
        assertThat(body.getString("sentence")).isEqualTo("averigüéis");
        assertThat(body.getJSONObject("phonology").getJSONArray("words").getString(0)).isEqualTo("abeɾiˈgwejs");
        assertThat(body.getJSONObject("phonetics").getJSONArray("words").getString(0)).isEqualTo("aβeɾiˈɣwejs");
        assertThat(body.getJSONObject("sampa").getJSONArray("syllables").getString(3)).isEqualTo("\"Gwejs");
    }

    @Test
    void getAppliesQueryOptions() {
        ResponseEntity<String> response = restTemplate.getForEntity(
                "/api/transcriptions?text={text}&mono=true&stress={stress}", String.class, "sol", "'");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        JSONObject body = new JSONObject(response.getBody());
        assertThat(body.getJSONObject("phonology").getJSONArray("words").getString(0)).isEqualTo("ˈsol");
        assertThat(body.getJSONObject("sampa").getJSONArray("words").getString(0)).isEqualTo("'sol");
    }

    @Test
    void postAcceptsJsonBody() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String json = new JSONObject()
                .put("text", "los amigos")
                .put("options", new JSONObject().put("rehash", true))
                .toString();

        ResponseEntity<String> response = restTemplate.postForEntity(
                "/api/transcriptions", new HttpEntity<>(json, headers), String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        JSONObject phonology = new JSONObject(response.getBody()).getJSONObject("phonology");
        assertThat(phonology.getJSONArray("words").toList()).containsExactly("los", "aˈmigos");
        assertThat(phonology.getJSONArray("syllables").toList()).containsExactly("lo", "sa", "ˈmi", "gos");
    }

    @Test
    void missingTextReturns400() {
        ResponseEntity<String> response = restTemplate.getForEntity("/api/transcriptions", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(new JSONObject(response.getBody()).getString("errorCode")).isEqualTo("MalformedRequest");
    }

    @Test
    void invalidOptionReturns400() {
        ResponseEntity<String> response = restTemplate.getForEntity(
                "/api/transcriptions?text=casa&exceptions=9", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(new JSONObject(response.getBody()).getString("errorCode")).isEqualTo("InvalidOptionException");
    }

    @Test
    void unsyllabifiableWordReturns422() {
        ResponseEntity<String> response = restTemplate.getForEntity(
                "/api/transcriptions?text={text}", String.class, "hola pst");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        JSONObject body = new JSONObject(response.getBody());
        assertThat(body.getString("errorCode")).isEqualTo("SyllabificationException");
        assertThat(body.getString("message")).contains("pst");
    }

    @Test
    void echoesRequestIdHeader() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("X-Request-ID", "req-echo");

        ResponseEntity<String> response = restTemplate.exchange(
                "/api/transcriptions?text=casa", HttpMethod.GET,
                new HttpEntity<>(headers), String.class);

        assertThat(response.getHeaders().getFirst("X-Request-ID")).isEqualTo("req-echo");
    }

    @Test
    void exposesTranscriptionMetrics() {
        restTemplate.getForEntity("/api/transcriptions?text=casa", String.class);

        ResponseEntity<String> response = restTemplate.getForEntity(
                "/actuator/metrics/fonemas.transcription.success", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).contains("fonemas.transcription.success");
    }
}
