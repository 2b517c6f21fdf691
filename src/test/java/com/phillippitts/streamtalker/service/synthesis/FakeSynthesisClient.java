package com.phillippitts.streamtalker.service.synthesis;

import com.phillippitts.streamtalker.exception.SynthesisException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * In-memory {@link SynthesisClient}: every text becomes the blob {@code "wav:" + text}.
 */
class FakeSynthesisClient implements SynthesisClient {

    final List<List<String>> calls = new CopyOnWriteArrayList<>();
    final Set<String> failingVoices = ConcurrentHashMap.newKeySet();
    volatile boolean healthy = true;
    volatile int skipRequests;
    volatile List<String> voices = List.of();
    volatile Function<List<SynthesisRequest>, List<byte[]>> responder = FakeSynthesisClient::echo;

    static byte[] blob(String text) {
        return ("wav:" + text).getBytes(StandardCharsets.UTF_8);
    }

    static List<byte[]> echo(List<SynthesisRequest> requests) {
        List<byte[]> blobs = new ArrayList<>();
        requests.forEach(r -> blobs.add(blob(r.text())));
        return blobs;
    }

    @Override
    public List<byte[]> synthesizeBatch(List<SynthesisRequest> requests) {
        calls.add(requests.stream().map(SynthesisRequest::text).toList());
        String voice = requests.get(0).voice();
        if (failingVoices.contains(voice)) {
            throw new SynthesisException("server error", voice, requests.size());
        }
        return responder.apply(requests);
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }

    @Override
    public boolean skipInference() {
        skipRequests++;
        return true;
    }

    @Override
    public List<String> listVoices() {
        return voices;
    }
}
