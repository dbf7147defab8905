package io.zynox.memory;

/**
 * A stored row as scanned from the database: record metadata plus its ciphertext token.
 */
public record EncryptedMemory(MemoryRecord record, String encBlob) {
}
