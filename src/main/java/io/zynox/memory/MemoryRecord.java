package io.zynox.memory;

import java.time.Instant;
import java.util.List;

/**
 * Metadata of one stored memory. The ciphertext never leaves the store through this type.
 *
 * @param id        generated identifier, immutable
 * @param ownerId   partition key the record belongs to
 * @param key       caller-supplied label, empty when none was given
 * @param tags      deduplicated tags in first-insertion order
 * @param createdAt creation time (UTC)
 * @param updatedAt equal to {@code createdAt}; no operation modifies a record
 * @param version   always {@value #INITIAL_VERSION}
 */
public record MemoryRecord(
        String id,
        String ownerId,
        String key,
        List<String> tags,
        Instant createdAt,
        Instant updatedAt,
        int version
) {
    public static final int INITIAL_VERSION = 1;

    public MemoryRecord {
        tags = tags == null ? List.of() : List.copyOf(tags);
        if (key == null) {
            key = "";
        }
    }
}
