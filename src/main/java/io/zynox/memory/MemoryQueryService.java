package io.zynox.memory;

import io.zynox.crypto.CipherService;
import io.zynox.crypto.DecryptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Searches one owner's memories by emotion tag and/or keyword.
 *
 * <p>Every row is decrypted in memory for the duration of the call; no plaintext index exists.
 * A row matches when its tags contain the emotion <em>or</em> its text contains the keyword.
 * Rows that fail to decrypt are left out and counted in {@link QueryOutcome#undecryptable()}.</p>
 */
public class MemoryQueryService {

    private static final Logger log = LoggerFactory.getLogger(MemoryQueryService.class);

    private final MemoryStore store;
    private final CipherService cipher;

    public MemoryQueryService(MemoryStore store, CipherService cipher) {
        this.store = store;
        this.cipher = cipher;
    }

    public QueryOutcome query(String ownerId, MemoryQuery query) {
        if (query == null || query.isEmpty()) {
            return new QueryOutcome(List.of(), 0);
        }

        String needle = query.hasKeyword() ? query.keyword().toLowerCase(Locale.ROOT) : null;
        List<QueryMatch> matches = new ArrayList<>();
        int skipped = 0;

        for (EncryptedMemory row : store.scan(ownerId)) {
            String text;
            try {
                text = cipher.decrypt(row.encBlob());
            } catch (DecryptionException e) {
                skipped++;
                log.debug("Skipping memory id={} during query: {}", row.record().id(), e.getMessage());
                continue;
            }

            boolean emotionHit = query.hasEmotion() && row.record().tags().contains(query.emotion());
            boolean keywordHit = needle != null && text.toLowerCase(Locale.ROOT).contains(needle);
            if (emotionHit || keywordHit) {
                matches.add(new QueryMatch(row.record(), text));
            }
        }

        if (skipped > 0) {
            log.warn("Query for owner '{}' skipped {} undecryptable memories", ownerId, skipped);
        }
        return new QueryOutcome(matches, skipped);
    }
}
