package io.zynox.crypto;

/**
 * Thrown when a ciphertext token cannot be turned back into plaintext: the token is malformed,
 * was produced under a different key, or failed its integrity check.
 */
public class DecryptionException extends RuntimeException {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
