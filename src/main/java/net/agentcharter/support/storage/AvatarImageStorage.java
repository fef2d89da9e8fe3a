package net.agentcharter.support.storage;

import java.util.UUID;

/**
 * Object storage for generated avatar images.
 */
public interface AvatarImageStorage {

    /**
     * Writes a new object. Every call produces a fresh key; existing objects are never overwritten.
     *
     * @return storage key of the new object
     * @throws AvatarStorageException when the write fails
     */
    String store(UUID agentId, byte[] bytes, String contentType);

    /**
     * Removes the object. A missing object is not an error.
     *
     * @throws AvatarStorageException when the delete fails
     */
    void delete(String storageKey);

    /**
     * Resolves the URL clients use to fetch the object.
     */
    String publicUrl(String storageKey);
}
