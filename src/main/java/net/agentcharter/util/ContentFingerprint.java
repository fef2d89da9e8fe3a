package net.agentcharter.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Stable fingerprint of charter text used as the freshness token of every derived artifact.
 *
 * <p>Text is trimmed and internal whitespace runs are collapsed to a single space before hashing,
 * so formatting-only edits do not invalidate artifacts. Blank input yields the empty token.</p>
 *
 * <pre>{@code
 * ContentFingerprint.fingerprint("Help with  sales\n");
 * // same token as ContentFingerprint.fingerprint("Help with sales")
 * }</pre>
 */
public final class ContentFingerprint {

    public static final String EMPTY = "";

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private ContentFingerprint() {
    }

    /**
     * Computes the 64-character lowercase SHA-256 hex fingerprint of the normalized text.
     *
     * @param text charter text, may be {@code null}
     * @return fingerprint, or {@link #EMPTY} when the text is blank
     */
    public static String fingerprint(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return EMPTY;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest(normalized.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashed);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm unavailable", ex);
        }
    }

    /**
     * Trims and collapses whitespace runs; {@code null} becomes the empty string.
     */
    public static String normalize(String text) {
        if (text == null) {
            return EMPTY;
        }
        return WHITESPACE_RUN.matcher(text.trim()).replaceAll(" ");
    }

    public static boolean isBlank(String text) {
        return normalize(text).isEmpty();
    }
}
