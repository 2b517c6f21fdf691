package com.phillippitts.streamtalker.service.synthesis;

import com.phillippitts.streamtalker.domain.SynthesisParameters;
import com.phillippitts.streamtalker.exception.SynthesisException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * {@link SynthesisClient} for the TTS server's HTTP API.
 *
 * <p>A batch is one {@code POST /synthesize_speech/} with a JSON body carrying every text plus
 * the shared voice and parameters. The server answers with a ZIP archive holding one WAV per text,
 * named by its index ({@code 0.wav}, {@code 1.wav}, ...).
 */
public class HttpSynthesisClient implements SynthesisClient {

    private static final Logger LOG = LogManager.getLogger(HttpSynthesisClient.class);

    static final String SYNTHESIZE_PATH = "/synthesize_speech/";
    static final String HEALTH_PATH = "/health";
    static final String SKIP_PATH = "/skip_inference";
    static final String VOICES_PATH = "/voices";

    private final RestTemplate restTemplate;
    private final RestTemplate probeTemplate;
    private final String baseUrl;

    /**
     * @param restTemplate template for synthesis and voice listing, with the long read timeout
     * @param probeTemplate template for health and skip requests, with short timeouts
     * @param baseUrl server root without trailing slash
     */
    public HttpSynthesisClient(RestTemplate restTemplate, RestTemplate probeTemplate, String baseUrl) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.probeTemplate = Objects.requireNonNull(probeTemplate, "probeTemplate");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
    }

    @Override
    public List<byte[]> synthesizeBatch(List<SynthesisRequest> requests) {
        if (requests.isEmpty()) {
            throw new IllegalArgumentException("requests must not be empty");
        }
        SynthesisRequest first = requests.get(0);
        String body = requestBody(requests).toString();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_OCTET_STREAM, MediaType.ALL));

        byte[] archive;
        try {
            ResponseEntity<byte[]> response = restTemplate.postForEntity(
                    baseUrl + SYNTHESIZE_PATH, new HttpEntity<>(body, headers), byte[].class);
            archive = response.getBody();
        } catch (RestClientException e) {
            throw new SynthesisException("TTS request failed: " + e.getMessage(), first.voice(), requests.size(), e);
        }
        if (archive == null || archive.length == 0) {
            throw new SynthesisException("TTS server returned an empty response", first.voice(), requests.size());
        }

        Map<Integer, byte[]> files = unzip(archive, first.voice(), requests.size());
        List<byte[]> blobs = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            byte[] wav = files.get(i);
            if (wav == null) {
                throw new SynthesisException("Response is missing " + i + ".wav", first.voice(), requests.size());
            }
            blobs.add(wav);
        }
        LOG.debug("Unpacked {} audio files for voice {}", blobs.size(), first.voice());
        return blobs;
    }

    static JSONObject requestBody(List<SynthesisRequest> requests) {
        SynthesisRequest first = requests.get(0);
        SynthesisParameters p = first.parameters();
        JSONArray texts = new JSONArray();
        requests.forEach(r -> texts.put(r.text()));
        return new JSONObject()
                .put("text", texts)
                .put("voice", first.voice())
                .put("model", p.model())
                .put("language", p.language())
                .put("do_sample", true)
                .put("speed", p.speed())
                .put("temperature", p.temperature())
                .put("max_new_tokens", p.maxNewTokens())
                .put("repetition_penalty", p.repetitionPenalty());
    }

    static Map<Integer, byte[]> unzip(byte[] archive, String voice, int batchSize) {
        Map<Integer, byte[]> files = new TreeMap<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                String name = entry.getName();
                int slash = name.lastIndexOf('/');
                name = slash >= 0 ? name.substring(slash + 1) : name;
                if (entry.isDirectory() || !name.toLowerCase(Locale.ROOT).endsWith(".wav")) {
                    continue;
                }
                try {
                    files.put(Integer.parseInt(name.substring(0, name.length() - 4)), zip.readAllBytes());
                } catch (NumberFormatException e) {
                    LOG.debug("Ignoring unexpected archive entry {}", name);
                }
            }
        } catch (IOException e) {
            throw new SynthesisException("Unreadable audio archive: " + e.getMessage(), voice, batchSize, e);
        }
        return files;
    }

    @Override
    public boolean isHealthy() {
        try {
            return probeTemplate.getForEntity(baseUrl + HEALTH_PATH, String.class).getStatusCode().is2xxSuccessful();
        } catch (RestClientException e) {
            LOG.debug("Health check failed for {}: {}", baseUrl, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean skipInference() {
        try {
            boolean accepted = probeTemplate.postForEntity(baseUrl + SKIP_PATH, null, String.class)
                    .getStatusCode().is2xxSuccessful();
            LOG.info("Inference skip {}", accepted ? "requested" : "rejected");
            return accepted;
        } catch (RestClientException e) {
            LOG.warn("Failed to request inference skip: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public List<String> listVoices() {
        String body;
        try {
            body = restTemplate.getForObject(baseUrl + VOICES_PATH, String.class);
        } catch (RestClientException e) {
            throw new SynthesisException("Failed to list voices: " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            return List.of();
        }
        try {
            JSONArray voices = new JSONObject(body).optJSONArray("voices");
            if (voices == null) {
                return List.of();
            }
            List<String> names = new ArrayList<>(voices.length());
            for (int i = 0; i < voices.length(); i++) {
                String name = voices.getJSONObject(i).optString("name", "");
                if (!name.isBlank()) {
                    names.add(name);
                }
            }
            return names;
        } catch (JSONException e) {
            throw new SynthesisException("Malformed voice list: " + e.getMessage(), e);
        }
    }
}
