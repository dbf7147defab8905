package io.zynox.crypto;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CipherServiceTest {

    private CipherService cipher;

    @BeforeEach
    void setUp() throws Exception {
        cipher = new CipherService(newKey());
    }

    static SecretKey newKey() throws Exception {
        KeyGenerator generator = KeyGenerator.getInstance("AES");
        generator.init(256);
        return generator.generateKey();
    }

    @Test
    void shouldRoundTripPlaintext() {
        for (String plaintext : List.of("", "I feel so lonely today", "ünïcödé ✓ 日本語 🙂",
                "line one\nline two\ttabbed", "x".repeat(10_000))) {
            assertEquals(plaintext, cipher.decrypt(cipher.encrypt(plaintext)));
        }
    }

    @Test
    void shouldProduceDifferentTokensForSamePlaintext() {
        String first = cipher.encrypt("same text");
        String second = cipher.encrypt("same text");

        assertNotEquals(first, second);
        assertEquals("same text", cipher.decrypt(first));
        assertEquals("same text", cipher.decrypt(second));
    }

    @Test
    void shouldNotContainPlaintextInToken() {
        String token = cipher.encrypt("secret diary entry");
        assertFalse(token.contains("secret"));
    }

    @Test
    void shouldStartTokenWithVersionByte() {
        byte[] raw = Base64.getUrlDecoder().decode(cipher.encrypt("hello"));
        assertEquals(CipherService.TOKEN_VERSION, raw[0]);
        // version + iv + "hello" + tag
        assertEquals(1 + 12 + 5 + 16, raw.length);
    }

    @Test
    void shouldRejectEveryTamperedCharacter() {
        String token = cipher.encrypt("I am sad but happy");

        for (int i = 0; i < token.length(); i++) {
            char original = token.charAt(i);
            char replacement = original == 'A' ? 'B' : 'A';
            String tampered = token.substring(0, i) + replacement + token.substring(i + 1);

            int position = i;
            assertThrows(DecryptionException.class, () -> cipher.decrypt(tampered),
                    "tampering at position " + position + " was not detected");
        }
    }

    @Test
    void shouldRejectEveryFlippedByte() {
        byte[] raw = Base64.getUrlDecoder().decode(cipher.encrypt("payload"));

        for (int i = 0; i < raw.length; i++) {
            byte[] copy = raw.clone();
            copy[i] ^= 0x01;
            String tampered = Base64.getUrlEncoder().withoutPadding().encodeToString(copy);

            assertThrows(DecryptionException.class, () -> cipher.decrypt(tampered));
        }
    }

    @Test
    void shouldRejectTokenFromDifferentKey() throws Exception {
        String token = new CipherService(newKey()).encrypt("other tenant");

        assertThrows(DecryptionException.class, () -> cipher.decrypt(token));
    }

    @Test
    void shouldRejectMalformedTokens() {
        assertThrows(DecryptionException.class, () -> cipher.decrypt(null));
        assertThrows(DecryptionException.class, () -> cipher.decrypt(""));
        assertThrows(DecryptionException.class, () -> cipher.decrypt("not base64 at all!"));
        assertThrows(DecryptionException.class, () -> cipher.decrypt("AQID"));
        assertThrows(DecryptionException.class, () -> cipher.decrypt(cipher.encrypt("x") + "=="));
    }

    @Test
    void shouldRejectTruncatedToken() {
        String token = cipher.encrypt("truncate me");
        byte[] raw = Base64.getUrlDecoder().decode(token);
        byte[] shorter = java.util.Arrays.copyOf(raw, raw.length - 1);

        String truncated = Base64.getUrlEncoder().withoutPadding().encodeToString(shorter);
        assertThrows(DecryptionException.class, () -> cipher.decrypt(truncated));
    }

    @Test
    void shouldRejectNullPlaintext() {
        assertThrows(IllegalArgumentException.class, () -> cipher.encrypt(null));
    }

    @Test
    void shouldRejectNonAesKey() {
        var hmacKey = new SecretKeySpec(new byte[32], "HmacSHA256");
        assertThrows(IllegalArgumentException.class, () -> new CipherService(hmacKey));
        assertThrows(IllegalArgumentException.class, () -> new CipherService(null));
    }

    @Test
    void shouldDecryptWithEquivalentKeyInstance() throws Exception {
        SecretKey key = newKey();
        String token = new CipherService(key).encrypt("portable");

        var sameKey = new SecretKeySpec(key.getEncoded(), "AES");
        assertEquals("portable", new CipherService(sameKey).decrypt(token));
    }
}
