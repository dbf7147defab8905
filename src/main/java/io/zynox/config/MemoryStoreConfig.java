package io.zynox.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.zynox.crypto.CipherKeyLoader;
import io.zynox.crypto.CipherService;
import io.zynox.memory.MemoryQueryService;
import io.zynox.memory.MemoryStore;
import io.zynox.memory.SQLiteMemoryStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the cipher, the SQLite store and the query service.
 * The cipher key is resolved once here and shared by every request.
 */
@Configuration
@EnableConfigurationProperties(ZynoxProperties.class)
public class MemoryStoreConfig {

    @Bean
    public CipherService cipherService(ZynoxProperties properties) {
        var settings = properties.cipher();
        var loaded = new CipherKeyLoader(settings.key(), Path.of(settings.keyFile())).load();
        return new CipherService(loaded.key());
    }

    @Bean
    public SQLiteMemoryStore memoryStore(ZynoxProperties properties, CipherService cipherService,
                                         ObjectMapper objectMapper) {
        return new SQLiteMemoryStore(properties.store().databaseFile(), cipherService, objectMapper);
    }

    @Bean
    public MemoryQueryService memoryQueryService(MemoryStore memoryStore, CipherService cipherService) {
        return new MemoryQueryService(memoryStore, cipherService);
    }
}
