package net.agentcharter.support.storage;

/**
 * Avatar object storage operation failed.
 */
public class AvatarStorageException extends RuntimeException {

    private final String storageKey;

    public AvatarStorageException(String message, String storageKey, Throwable cause) {
        super(message, cause);
        this.storageKey = storageKey;
    }

    public String storageKey() {
        return storageKey;
    }
}
