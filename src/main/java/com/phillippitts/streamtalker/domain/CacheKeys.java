package com.phillippitts.streamtalker.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Computes content-addressed cache keys for synthesized audio.
 *
 * <p>The key is the lowercase hex SHA-256 of the normalized text, the voice and every
 * {@link SynthesisParameters} field. Voices are compared case-insensitively, text is not.
 */
public final class CacheKeys {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern KEY_PATTERN = Pattern.compile("[0-9a-f]{64}");
    private static final char SEPARATOR = '\u001f';

    private CacheKeys() {
    }

    /**
     * Builds the cache key for one synthesis request.
     *
     * @param text message text (normalized before hashing)
     * @param voice voice name
     * @param params synthesis parameters
     * @return 64 character lowercase hex key
     */
    public static String of(String text, String voice, SynthesisParameters params) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(voice, "voice");
        Objects.requireNonNull(params, "params");

        String material = params.model() + SEPARATOR
                + params.language() + SEPARATOR
                + voice.toLowerCase(Locale.ROOT) + SEPARATOR
                + Double.toString(params.speed()) + SEPARATOR
                + Double.toString(params.temperature()) + SEPARATOR
                + params.maxNewTokens() + SEPARATOR
                + Double.toString(params.repetitionPenalty()) + SEPARATOR
                + normalizeText(text);
        return HexFormat.of().formatHex(sha256().digest(material.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Normalizes text for hashing: Unicode NFC, trimmed, whitespace runs collapsed to one space.
     */
    public static String normalizeText(String text) {
        String nfc = Normalizer.normalize(text, Normalizer.Form.NFC);
        return WHITESPACE_RUN.matcher(nfc.strip()).replaceAll(" ");
    }

    /**
     * Returns whether {@code candidate} has the shape of a key produced by {@link #of}.
     */
    public static boolean isValidKey(String candidate) {
        return candidate != null && KEY_PATTERN.matcher(candidate).matches();
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
