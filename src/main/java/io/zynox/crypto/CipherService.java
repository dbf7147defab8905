package io.zynox.crypto;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Encrypts memory text at rest with a single AES key.
 *
 * <p>Tokens are URL-safe base64 (no padding) of:</p>
 * <pre>
 *   version (1) | iv (12) | ciphertext + GCM tag (16)
 * </pre>
 * <p>A token carries everything needed to decrypt it except the key, so callers never manage IVs.</p>
 */
public class CipherService {

    static final byte TOKEN_VERSION = 0x01;
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;
    private static final int MIN_TOKEN_LENGTH = 1 + GCM_IV_LENGTH + GCM_TAG_LENGTH / 8;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final SecretKey key;
    private final SecureRandom random;

    public CipherService(SecretKey key) {
        this(key, new SecureRandom());
    }

    CipherService(SecretKey key, SecureRandom random) {
        if (key == null) {
            throw new IllegalArgumentException("Cipher key must not be null");
        }
        if (!"AES".equalsIgnoreCase(key.getAlgorithm())) {
            throw new IllegalArgumentException("Cipher key must be an AES key, got " + key.getAlgorithm());
        }
        this.key = key;
        this.random = random;
    }

    /**
     * Encrypts plaintext into a self-describing token.
     *
     * @param plaintext the text to protect, never null
     * @return the ciphertext token
     */
    public String encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Plaintext must not be null");
        }
        byte[] iv = new byte[GCM_IV_LENGTH];
        random.nextBytes(iv);

        byte[] sealed;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cipher key is not usable for " + TRANSFORMATION, e);
        }

        ByteBuffer token = ByteBuffer.allocate(1 + iv.length + sealed.length);
        token.put(TOKEN_VERSION).put(iv).put(sealed);
        return ENCODER.encodeToString(token.array());
    }

    /**
     * Decrypts a token produced by {@link #encrypt(String)} under the same key.
     *
     * @param token the ciphertext token
     * @return the original plaintext
     * @throws DecryptionException if the token is malformed, tampered with, or from another key
     */
    public String decrypt(String token) {
        if (token == null || token.isEmpty()) {
            throw new DecryptionException("Empty ciphertext token");
        }

        byte[] raw;
        try {
            raw = DECODER.decode(token);
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Ciphertext token is not valid base64", e);
        }
        // Canonical form only: reject tokens with non-zero trailing bits
        if (!ENCODER.encodeToString(raw).equals(token)) {
            throw new DecryptionException("Ciphertext token is not canonically encoded");
        }
        if (raw.length < MIN_TOKEN_LENGTH) {
            throw new DecryptionException("Ciphertext token is too short");
        }
        if (raw[0] != TOKEN_VERSION) {
            throw new DecryptionException("Unsupported ciphertext token version: " + raw[0]);
        }

        byte[] plaintext;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, raw, 1, GCM_IV_LENGTH));
            plaintext = cipher.doFinal(raw, 1 + GCM_IV_LENGTH, raw.length - 1 - GCM_IV_LENGTH);
        } catch (AEADBadTagException e) {
            throw new DecryptionException("Ciphertext token failed integrity check", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Ciphertext token could not be decrypted", e);
        }

        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(plaintext))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new DecryptionException("Decrypted payload is not valid UTF-8", e);
        }
    }
}
