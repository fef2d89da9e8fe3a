package net.agentcharter.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ImageContentTypesTest {

    @Test
    void should_DetectFormatFromMagicBytes_When_Sniffing() {
        assertThat(ImageContentTypes.sniff(new byte[] {(byte) 0x89, 'P', 'N', 'G', 0x0D}, "x")).isEqualTo(ImageContentTypes.PNG);
        assertThat(ImageContentTypes.sniff(new byte[] {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0x00}, "x")).isEqualTo(ImageContentTypes.JPEG);
        assertThat(ImageContentTypes.sniff("GIF89a".getBytes(), "x")).isEqualTo(ImageContentTypes.GIF);
        assertThat(ImageContentTypes.sniff("RIFF\0\0\0\0WEBPVP8".getBytes(), "x")).isEqualTo(ImageContentTypes.WEBP);
    }

    @Test
    void should_ReturnFallback_When_FormatUnknown() {
        assertThat(ImageContentTypes.sniff(new byte[] {1, 2, 3, 4}, ImageContentTypes.PNG)).isEqualTo(ImageContentTypes.PNG);
        assertThat(ImageContentTypes.sniff(null, "fallback")).isEqualTo("fallback");
    }

    @Test
    void should_MapExtension_When_ContentTypeKnown() {
        assertThat(ImageContentTypes.fileExtension("IMAGE/JPEG")).isEqualTo(".jpg");
        assertThat(ImageContentTypes.fileExtension("application/octet-stream")).isEqualTo(".bin");
    }
}
