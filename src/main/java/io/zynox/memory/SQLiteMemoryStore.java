package io.zynox.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.zynox.crypto.CipherService;
import io.zynox.crypto.DecryptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PostConstruct;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.*;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * SQLite-backed memory store. Memory text is encrypted with {@link CipherService} before insert.
 *
 * <p>Schema:</p>
 * <ul>
 *   <li>{@code memories}: one row per memory with owner, label, JSON tag array, timestamps,
 *       ciphertext token and a version counter fixed at 1</li>
 * </ul>
 *
 * <p>Each operation opens its own connection and closes it before returning, so the store holds
 * no state between requests apart from the database path and the cipher.</p>
 */
public class SQLiteMemoryStore implements MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(SQLiteMemoryStore.class);
    private static final TypeReference<List<String>> TAG_LIST = new TypeReference<>() {
    };

    private final String jdbcUrl;
    private final Path dbPath;
    private final CipherService cipher;
    private final ObjectMapper mapper;
    private final Clock clock;

    public SQLiteMemoryStore(Path dbPath, CipherService cipher, ObjectMapper mapper) {
        this(dbPath, cipher, mapper, Clock.systemUTC());
    }

    public SQLiteMemoryStore(Path dbPath, CipherService cipher, ObjectMapper mapper, Clock clock) {
        this.dbPath = dbPath.toAbsolutePath();
        this.jdbcUrl = "jdbc:sqlite:" + this.dbPath;
        this.cipher = cipher;
        this.mapper = mapper;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        Path dir = dbPath.getParent();
        if (dir != null) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                log.error("Failed to create memory directory: {}", dir, e);
                throw new StoreUnavailableException("Cannot create memory directory " + dir, e);
            }
        }
        try (Connection connection = openConnection();
             Statement stmt = connection.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS memories (
                    id TEXT PRIMARY KEY,
                    owner_id TEXT NOT NULL,
                    key TEXT,
                    tags TEXT,
                    created_at TEXT,
                    updated_at TEXT,
                    enc_blob TEXT,
                    version INTEGER DEFAULT 1
                )
                """);
            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_memories_owner ON memories(owner_id)
                """);
            log.info("SQLiteMemoryStore initialized at: {}", dbPath);
        } catch (SQLException e) {
            log.error("Failed to initialize SQLite memory store at {}", dbPath, e);
            throw new StoreUnavailableException("Memory store initialization failed", e);
        }
    }

    @Override
    public MemoryRecord save(String ownerId, String key, List<String> tags, String plaintext) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("owner_id is required");
        }
        if (plaintext == null) {
            throw new IllegalArgumentException("data is required");
        }

        List<String> mergedTags = Tags.merge(tags, Emotion.classify(plaintext));
        String encrypted = cipher.encrypt(plaintext);
        // Microsecond precision, same as the stored text form
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        var record = new MemoryRecord(UUID.randomUUID().toString(), ownerId, key, mergedTags,
                now, now, MemoryRecord.INITIAL_VERSION);

        String sql = """
            INSERT INTO memories (id, owner_id, key, tags, created_at, updated_at, enc_blob, version)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, record.id());
            stmt.setString(2, record.ownerId());
            stmt.setString(3, record.key());
            stmt.setString(4, writeTags(record.tags()));
            stmt.setString(5, Timestamps.format(record.createdAt()));
            stmt.setString(6, Timestamps.format(record.updatedAt()));
            stmt.setString(7, encrypted);
            stmt.setInt(8, record.version());
            stmt.executeUpdate();
        } catch (SQLException e) {
            log.error("Failed to save memory for owner '{}'", ownerId, e);
            throw new StoreUnavailableException("Failed to save memory", e);
        }

        log.info("Saved memory: id={}, owner='{}', tags={}", record.id(), ownerId, record.tags());
        return record;
    }

    @Override
    public List<MemoryRecord> list(String ownerId) {
        String sql = """
            SELECT id, owner_id, key, tags, created_at, updated_at, version
            FROM memories
            WHERE owner_id = ?
            ORDER BY created_at, rowid
            """;
        List<MemoryRecord> results = new ArrayList<>();
        try (Connection connection = openConnection();
             PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, ownerId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(toRecord(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to list memories for owner '{}'", ownerId, e);
            throw new StoreUnavailableException("Failed to list memories", e);
        }
        return results;
    }

    @Override
    public String download(String id) {
        String encrypted;
        try (Connection connection = openConnection();
             PreparedStatement stmt = connection.prepareStatement("SELECT enc_blob FROM memories WHERE id = ?")) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new MemoryNotFoundException(id);
                }
                encrypted = rs.getString(1);
            }
        } catch (SQLException e) {
            log.error("Failed to load memory id={}", id, e);
            throw new StoreUnavailableException("Failed to load memory", e);
        }

        try {
            return cipher.decrypt(encrypted);
        } catch (DecryptionException e) {
            log.warn("Stored memory id={} could not be decrypted: {}", id, e.getMessage());
            throw e;
        }
    }

    @Override
    public String delete(String id) {
        try (Connection connection = openConnection();
             PreparedStatement stmt = connection.prepareStatement("DELETE FROM memories WHERE id = ?")) {
            stmt.setString(1, id);
            int deleted = stmt.executeUpdate();
            log.info("Deleted memory: id={}, matched={}", id, deleted > 0);
        } catch (SQLException e) {
            log.error("Failed to delete memory id={}", id, e);
            throw new StoreUnavailableException("Failed to delete memory", e);
        }
        return id;
    }

    @Override
    public List<EncryptedMemory> scan(String ownerId) {
        String sql = """
            SELECT id, owner_id, key, tags, created_at, updated_at, version, enc_blob
            FROM memories
            WHERE owner_id = ?
            ORDER BY created_at, rowid
            """;
        List<EncryptedMemory> results = new ArrayList<>();
        try (Connection connection = openConnection();
             PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, ownerId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(new EncryptedMemory(toRecord(rs), rs.getString("enc_blob")));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to scan memories for owner '{}'", ownerId, e);
            throw new StoreUnavailableException("Failed to scan memories", e);
        }
        return results;
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("PRAGMA busy_timeout=5000");
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
        return connection;
    }

    private MemoryRecord toRecord(ResultSet rs) throws SQLException {
        return new MemoryRecord(
                rs.getString("id"),
                rs.getString("owner_id"),
                rs.getString("key"),
                readTags(rs.getString("tags")),
                Timestamps.parse(rs.getString("created_at")),
                Timestamps.parse(rs.getString("updated_at")),
                rs.getInt("version")
        );
    }

    private String writeTags(List<String> tags) {
        try {
            return mapper.writeValueAsString(tags);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tags", e);
        }
    }

    private List<String> readTags(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return mapper.readValue(json, TAG_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt tags column: " + json, e);
        }
    }
}
