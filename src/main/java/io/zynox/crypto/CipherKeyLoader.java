package io.zynox.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Resolves the process-wide AES key once at startup.
 *
 * <p>Precedence: an explicitly provided secret (usually from the environment), then the key file,
 * otherwise a fresh 256-bit key is generated and written to the key file.</p>
 *
 * <p>There is no rotation. Replacing the key makes every previously stored token undecryptable.</p>
 */
public class CipherKeyLoader {

    private static final Logger log = LoggerFactory.getLogger(CipherKeyLoader.class);
    private static final int GENERATED_KEY_BITS = 256;

    /** Where the key came from. */
    public enum Source {
        ENVIRONMENT,
        FILE,
        GENERATED
    }

    /**
     * A resolved key together with its origin.
     */
    public record LoadedKey(SecretKey key, Source source) {
    }

    private final String secret;
    private final Path keyFile;

    /**
     * @param secret  base64-encoded key material, may be null or blank
     * @param keyFile file to read the key from, or to persist a generated key to
     */
    public CipherKeyLoader(String secret, Path keyFile) {
        this.secret = secret;
        this.keyFile = keyFile;
    }

    /**
     * Loads (or creates) the key.
     *
     * @throws IllegalStateException if the configured key material is not a valid AES key
     */
    public LoadedKey load() {
        if (secret != null && !secret.isBlank()) {
            log.info("Using cipher key from environment");
            return new LoadedKey(parse(secret, "environment secret"), Source.ENVIRONMENT);
        }

        if (keyFile == null) {
            throw new IllegalStateException("No cipher key configured and no key file location given");
        }

        if (Files.exists(keyFile)) {
            try {
                String encoded = Files.readString(keyFile, StandardCharsets.UTF_8);
                log.info("Using cipher key from {}", keyFile);
                return new LoadedKey(parse(encoded, "key file " + keyFile), Source.FILE);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read cipher key file " + keyFile, e);
            }
        }

        SecretKey generated = generate();
        persist(generated);
        log.info("Generated new cipher key and stored it at {}", keyFile);
        return new LoadedKey(generated, Source.GENERATED);
    }

    static SecretKey parse(String encoded, String origin) {
        String trimmed = encoded.trim();
        byte[] bytes;
        try {
            bytes = trimmed.indexOf('-') >= 0 || trimmed.indexOf('_') >= 0
                    ? Base64.getUrlDecoder().decode(trimmed)
                    : Base64.getDecoder().decode(trimmed);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Cipher key from " + origin + " is not valid base64", e);
        }
        if (bytes.length != 16 && bytes.length != 24 && bytes.length != 32) {
            throw new IllegalStateException("Cipher key from " + origin + " must be 16, 24 or 32 bytes, got " + bytes.length);
        }
        return new SecretKeySpec(bytes, "AES");
    }

    static String encode(SecretKey key) {
        return Base64.getUrlEncoder().encodeToString(key.getEncoded());
    }

    private SecretKey generate() {
        try {
            KeyGenerator generator = KeyGenerator.getInstance("AES");
            generator.init(GENERATED_KEY_BITS, new SecureRandom());
            return generator.generateKey();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("AES key generation is not available", e);
        }
    }

    private void persist(SecretKey key) {
        try {
            Path parent = keyFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(keyFile, encode(key) + "\n", StandardCharsets.UTF_8);
            try {
                Files.setPosixFilePermissions(keyFile, PosixFilePermissions.fromString("rw-------"));
            } catch (UnsupportedOperationException e) {
                log.debug("Key file permissions not restricted, filesystem is not POSIX: {}", keyFile);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write cipher key file " + keyFile, e);
        }
    }
}
