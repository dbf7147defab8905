package io.zynox.memory;

import java.util.List;

/**
 * Owner-scoped storage of encrypted memories.
 * Implementations encrypt on {@link #save} and decrypt only on {@link #download}.
 */
public interface MemoryStore {

    /**
     * Stores a new memory. Every call creates a new record; nothing is updated in place.
     *
     * @param ownerId   owner partition, required and non-blank
     * @param key       optional label (null stored as empty string)
     * @param tags      optional caller tags; the detected emotion tag is appended unless already present
     * @param plaintext the memory text, encrypted before it reaches storage
     * @return the persisted record metadata
     * @throws StoreUnavailableException if the database cannot be written
     */
    MemoryRecord save(String ownerId, String key, List<String> tags, String plaintext);

    /**
     * Lists record metadata for one owner, oldest first. Empty if the owner has no records.
     */
    List<MemoryRecord> list(String ownerId);

    /**
     * Returns the decrypted text of one memory.
     *
     * @throws MemoryNotFoundException              if no record has this id
     * @throws io.zynox.crypto.DecryptionException if the stored token cannot be decrypted
     */
    String download(String id);

    /**
     * Hard-deletes a memory. Succeeds whether or not a record matched.
     *
     * @return the id that was passed in
     */
    String delete(String id);

    /**
     * Loads every row of an owner, still encrypted, oldest first.
     */
    List<EncryptedMemory> scan(String ownerId);
}
