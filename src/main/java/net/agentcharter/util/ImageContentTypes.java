package net.agentcharter.util;

import java.util.Locale;

/**
 * Image content-type helpers for generated avatars.
 */
public final class ImageContentTypes {

    public static final String PNG = "image/png";
    public static final String JPEG = "image/jpeg";
    public static final String WEBP = "image/webp";
    public static final String GIF = "image/gif";

    private ImageContentTypes() {
    }

    /**
     * Detects the content type from the leading magic bytes.
     *
     * @param bytes image payload
     * @param fallback value returned when the format is not recognized
     * @return detected content type or {@code fallback}
     */
    public static String sniff(byte[] bytes, String fallback) {
        if (bytes == null || bytes.length < 4) {
            return fallback;
        }
        if ((bytes[0] & 0xFF) == 0x89 && bytes[1] == 'P' && bytes[2] == 'N' && bytes[3] == 'G') {
            return PNG;
        }
        if ((bytes[0] & 0xFF) == 0xFF && (bytes[1] & 0xFF) == 0xD8 && (bytes[2] & 0xFF) == 0xFF) {
            return JPEG;
        }
        if (bytes[0] == 'G' && bytes[1] == 'I' && bytes[2] == 'F' && bytes[3] == '8') {
            return GIF;
        }
        if (bytes.length >= 12
            && bytes[0] == 'R' && bytes[1] == 'I' && bytes[2] == 'F' && bytes[3] == 'F'
            && bytes[8] == 'W' && bytes[9] == 'E' && bytes[10] == 'B' && bytes[11] == 'P') {
            return WEBP;
        }
        return fallback;
    }

    public static String fileExtension(String contentType) {
        if (contentType == null) {
            return ".bin";
        }
        return switch (contentType.toLowerCase(Locale.ROOT)) {
            case PNG -> ".png";
            case JPEG, "image/jpg" -> ".jpg";
            case WEBP -> ".webp";
            case GIF -> ".gif";
            default -> ".bin";
        };
    }
}
