package io.zynox.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.zynox.memory.MemoryRecord;
import io.zynox.memory.QueryMatch;
import io.zynox.memory.Timestamps;

import java.time.Instant;
import java.util.List;

/**
 * Request and response bodies of the {@code /v1} API. Field names are snake_case on the wire.
 */
public final class MemoryDtos {

    private MemoryDtos() {
    }

    public record SaveRequest(
            @JsonProperty("owner_id") String ownerId,
            String key,
            List<String> tags,
            String data
    ) {}

    public record QueryRequest(String emotion, String keyword) {}

    public record SaveResponse(String status, String id, List<String> tags) {
        static SaveResponse of(MemoryRecord record) {
            return new SaveResponse(STATUS_OK, record.id(), record.tags());
        }
    }

    public record ListItem(
            String id,
            String key,
            List<String> tags,
            @JsonProperty("created_at") String createdAt,
            @JsonProperty("updated_at") String updatedAt,
            int version
    ) {
        static ListItem of(MemoryRecord record) {
            return new ListItem(record.id(), record.key(), record.tags(),
                    timestamp(record.createdAt()), timestamp(record.updatedAt()), record.version());
        }
    }

    public record ListResponse(String status, List<ListItem> items) {}

    public record DownloadResponse(String status, String data) {}

    public record DeleteResponse(String status, String deleted) {}

    public record QueryResult(
            String id,
            String key,
            List<String> tags,
            @JsonProperty("created_at") String createdAt,
            String text
    ) {
        static QueryResult of(QueryMatch match) {
            MemoryRecord record = match.record();
            return new QueryResult(record.id(), record.key(), record.tags(),
                    timestamp(record.createdAt()), match.text());
        }
    }

    public record QueryResponse(String status, List<QueryResult> results) {}

    public record ErrorResponse(String detail) {}

    public static final String STATUS_OK = "ok";

    static String timestamp(Instant instant) {
        return instant == null ? null : Timestamps.format(instant);
    }
}
