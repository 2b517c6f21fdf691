package com.phillippitts.streamtalker.service.synthesis;

import java.util.List;

/**
 * Remote batch text-to-speech service.
 *
 * <p>Implementations must be thread-safe; the scheduler calls {@link #synthesizeBatch} from
 * several executor threads at once.
 */
public interface SynthesisClient {

    /**
     * Synthesizes every request of one batch. All requests share voice and parameters.
     *
     * @param requests texts to synthesize, at least one
     * @return one WAV blob per request, in request order
     * @throws com.phillippitts.streamtalker.exception.SynthesisException if the batch fails; a
     *         batch never partially succeeds
     */
    List<byte[]> synthesizeBatch(List<SynthesisRequest> requests);

    /**
     * Quick availability probe; never throws.
     */
    boolean isHealthy();

    /**
     * Asks the server to abort the inference it is currently running.
     *
     * @return true if the server accepted the request
     */
    boolean skipInference();

    /**
     * Voice names the server can synthesize.
     *
     * @throws com.phillippitts.streamtalker.exception.SynthesisException if the list cannot be fetched
     */
    List<String> listVoices();
}
