package io.zynox.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * Configuration properties for storage and encryption.
 *
 * <p>Binds to {@code zynox} in application.yml:</p>
 * <pre>
 * zynox:
 *   store:
 *     path: ${ZYNX_DATA_DIR:./data}
 *     file-name: zynox_cloud.db
 *   cipher:
 *     key: ${ZYNX_CIPHER_KEY:}
 *     key-file: ${ZYNX_KEY_FILE:./data/secret.key}
 * </pre>
 */
@ConfigurationProperties(prefix = "zynox")
public record ZynoxProperties(Store store, CipherSettings cipher) {

    public ZynoxProperties {
        if (store == null) {
            store = new Store(null, null);
        }
        if (cipher == null) {
            cipher = new CipherSettings(null, null);
        }
    }

    /**
     * @param path     directory holding the database
     * @param fileName database file name inside {@code path}
     */
    public record Store(String path, String fileName) {

        public Store {
            if (path == null || path.isBlank()) {
                path = "./data";
            }
            if (fileName == null || fileName.isBlank()) {
                fileName = "zynox_cloud.db";
            }
        }

        public Path databaseFile() {
            return Path.of(path).resolve(fileName);
        }
    }

    /**
     * @param key     base64 AES key; takes precedence over the key file when set
     * @param keyFile where the key is read from, or written to when generated
     */
    public record CipherSettings(String key, String keyFile) {

        public CipherSettings {
            if (keyFile == null || keyFile.isBlank()) {
                keyFile = "./data/secret.key";
            }
        }
    }
}
