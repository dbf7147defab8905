package io.zynox.memory;

/**
 * Filters for an owner-scoped query. Null and empty values count as absent; whitespace is a real
 * filter value.
 *
 * @param emotion tag that must be present on the record (exact match)
 * @param keyword case-insensitive substring of the decrypted text
 */
public record MemoryQuery(String emotion, String keyword) {

    public MemoryQuery {
        emotion = emotion == null || emotion.isEmpty() ? null : emotion;
        keyword = keyword == null || keyword.isEmpty() ? null : keyword;
    }

    public boolean hasEmotion() {
        return emotion != null;
    }

    public boolean hasKeyword() {
        return keyword != null;
    }

    /** True when neither filter is set; such a query matches nothing. */
    public boolean isEmpty() {
        return !hasEmotion() && !hasKeyword();
    }
}
