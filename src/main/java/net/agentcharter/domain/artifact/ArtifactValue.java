package net.agentcharter.domain.artifact;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * A produced artifact value. Text and tag values are persisted inline; avatar images are
 * produced as an {@link ImagePayload} and persisted as an {@link ImageReference} to object storage.
 */
public sealed interface ArtifactValue
    permits ArtifactValue.Text, ArtifactValue.TagList, ArtifactValue.ImagePayload, ArtifactValue.ImageReference {

    /**
     * Indicates whether the value carries usable content.
     */
    boolean isPresent();

    record Text(String text) implements ArtifactValue {
        public Text {
            text = text == null ? "" : text;
        }

        @Override
        public boolean isPresent() {
            return StringUtils.hasText(text);
        }
    }

    record TagList(List<String> tags) implements ArtifactValue {
        public TagList {
            tags = tags == null ? List.of() : List.copyOf(tags);
        }

        @Override
        public boolean isPresent() {
            return !tags.isEmpty();
        }
    }

    /**
     * Raw generated image bytes, not yet written to storage.
     */
    record ImagePayload(byte[] bytes, String contentType) implements ArtifactValue {
        public ImagePayload {
            bytes = bytes == null ? new byte[0] : bytes.clone();
        }

        @Override
        public byte[] bytes() {
            return bytes.clone();
        }

        public int size() {
            return bytes.length;
        }

        @Override
        public boolean isPresent() {
            return bytes.length > 0 && StringUtils.hasText(contentType);
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof ImagePayload payload)) {
                return false;
            }
            return Arrays.equals(bytes, payload.bytes) && Objects.equals(contentType, payload.contentType);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(bytes) + Objects.hashCode(contentType);
        }

        @Override
        public String toString() {
            return "ImagePayload[size=" + bytes.length + ", contentType=" + contentType + "]";
        }
    }

    /**
     * Stored avatar image: object-storage key plus content type.
     */
    record ImageReference(String storageKey, String contentType) implements ArtifactValue {
        public ImageReference {
            storageKey = storageKey == null ? "" : storageKey;
            contentType = contentType == null ? "" : contentType;
        }

        @Override
        public boolean isPresent() {
            return StringUtils.hasText(storageKey);
        }
    }
}
