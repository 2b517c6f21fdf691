package com.phillippitts.streamtalker.service.synthesis;

import com.phillippitts.streamtalker.domain.SynthesisParameters;
import com.phillippitts.streamtalker.exception.SynthesisException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpSynthesisClientTest {

    private static final String BASE = "http://tts.local:7860";

    private MockRestServiceServer server;
    private MockRestServiceServer probeServer;
    private HttpSynthesisClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        RestTemplate probeTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        probeServer = MockRestServiceServer.bindTo(probeTemplate).build();
        client = new HttpSynthesisClient(restTemplate, probeTemplate, BASE);
    }

    private static List<SynthesisRequest> requests(String... texts) {
        SynthesisParameters params = SynthesisParameters.defaults().withSpeed(1.25);
        return Arrays.stream(texts).map(t -> new SynthesisRequest(t, "bob", params)).toList();
    }

    private static byte[] zip(String... namesAndContents) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            for (int i = 0; i < namesAndContents.length; i += 2) {
                zip.putNextEntry(new ZipEntry(namesAndContents[i]));
                zip.write(namesAndContents[i + 1].getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }
        return out.toByteArray();
    }

    @Test
    void postsBatchAndReturnsBlobsInRequestOrder() throws IOException {
        server.expect(requestTo(BASE + "/synthesize_speech/"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.text[0]").value("first"))
                .andExpect(jsonPath("$.text[1]").value("second"))
                .andExpect(jsonPath("$.voice").value("bob"))
                .andExpect(jsonPath("$.speed").value(1.25))
                .andExpect(jsonPath("$.do_sample").value(true))
                .andExpect(jsonPath("$.max_new_tokens").value(SynthesisParameters.DEFAULT_MAX_NEW_TOKENS))
                .andRespond(withSuccess(zip("1.wav", "B", "out/0.wav", "A", "readme.txt", "x"),
                        MediaType.APPLICATION_OCTET_STREAM));

        List<byte[]> blobs = client.synthesizeBatch(requests("first", "second"));

        assertThat(blobs).hasSize(2);
        assertThat(new String(blobs.get(0), StandardCharsets.UTF_8)).isEqualTo("A");
        assertThat(new String(blobs.get(1), StandardCharsets.UTF_8)).isEqualTo("B");
        server.verify();
    }

    @Test
    void missingArchiveEntryFailsBatch() throws IOException {
        server.expect(requestTo(BASE + "/synthesize_speech/"))
                .andRespond(withSuccess(zip("0.wav", "A"), MediaType.APPLICATION_OCTET_STREAM));

        assertThatThrownBy(() -> client.synthesizeBatch(requests("first", "second")))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("1.wav");
    }

    @Test
    void serverErrorFailsBatch() {
        server.expect(requestTo(BASE + "/synthesize_speech/")).andRespond(withServerError());

        assertThatThrownBy(() -> client.synthesizeBatch(requests("first")))
                .isInstanceOf(SynthesisException.class)
                .satisfies(e -> assertThat(((SynthesisException) e).getVoice()).isEqualTo("bob"));
    }

    @Test
    void garbageResponseFailsBatch() {
        server.expect(requestTo(BASE + "/synthesize_speech/"))
                .andRespond(withSuccess("not a zip".getBytes(StandardCharsets.UTF_8),
                        MediaType.APPLICATION_OCTET_STREAM));

        assertThatThrownBy(() -> client.synthesizeBatch(requests("first")))
                .isInstanceOf(SynthesisException.class);
    }

    @Test
    void rejectsEmptyBatch() {
        assertThatThrownBy(() -> client.synthesizeBatch(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void healthReflectsServerStatus() {
        probeServer.expect(requestTo(BASE + "/health")).andRespond(withSuccess("ok", MediaType.TEXT_PLAIN));
        probeServer.expect(requestTo(BASE + "/health")).andRespond(withServerError());

        assertThat(client.isHealthy()).isTrue();
        assertThat(client.isHealthy()).isFalse();
        probeServer.verify();
    }

    @Test
    void skipInferencePostsToServer() {
        probeServer.expect(requestTo(BASE + "/skip_inference"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess());

        assertThat(client.skipInference()).isTrue();
        probeServer.verify();
    }

    @Test
    void skipInferenceFailureReturnsFalse() {
        probeServer.expect(requestTo(BASE + "/skip_inference")).andRespond(withServerError());

        assertThat(client.skipInference()).isFalse();
    }

    @Test
    void listsVoiceNames() {
        server.expect(requestTo(BASE + "/voices"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"voices\":[{\"name\":\"bob\"},{\"name\":\"\"},{\"name\":\"alice\"}]}",
                        MediaType.APPLICATION_JSON));

        assertThat(client.listVoices()).containsExactly("bob", "alice");
    }

    @Test
    void malformedVoiceListThrows() {
        server.expect(requestTo(BASE + "/voices"))
                .andRespond(withSuccess("{\"voices\":[1,2]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.listVoices()).isInstanceOf(SynthesisException.class);
    }
}
