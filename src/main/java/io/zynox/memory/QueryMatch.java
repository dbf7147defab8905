package io.zynox.memory;

/**
 * A record that satisfied a query, with its decrypted text.
 */
public record QueryMatch(MemoryRecord record, String text) {
}
