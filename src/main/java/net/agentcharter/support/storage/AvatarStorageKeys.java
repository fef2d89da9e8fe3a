package net.agentcharter.support.storage;

import java.util.UUID;
import net.agentcharter.util.ImageContentTypes;

final class AvatarStorageKeys {

    private AvatarStorageKeys() {
    }

    static String newKey(String prefix, UUID agentId, String contentType) {
        if (agentId == null) {
            throw new IllegalArgumentException("agentId is required");
        }
        String normalizedPrefix = prefix == null ? "" : prefix.trim();
        if (normalizedPrefix.startsWith("/")) {
            normalizedPrefix = normalizedPrefix.substring(1);
        }
        if (!normalizedPrefix.isEmpty() && !normalizedPrefix.endsWith("/")) {
            normalizedPrefix = normalizedPrefix + "/";
        }
        return normalizedPrefix + agentId + "/" + UUID.randomUUID() + ImageContentTypes.fileExtension(contentType);
    }

    static String joinUrl(String base, String key) {
        String trimmedBase = base == null ? "" : base.trim();
        while (trimmedBase.endsWith("/")) {
            trimmedBase = trimmedBase.substring(0, trimmedBase.length() - 1);
        }
        String trimmedKey = key.startsWith("/") ? key.substring(1) : key;
        return trimmedBase.isEmpty() ? "/" + trimmedKey : trimmedBase + "/" + trimmedKey;
    }
}
