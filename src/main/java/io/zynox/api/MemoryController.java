package io.zynox.api;

import io.zynox.api.MemoryDtos.*;
import io.zynox.memory.MemoryQuery;
import io.zynox.memory.MemoryQueryService;
import io.zynox.memory.MemoryStore;
import io.zynox.memory.QueryOutcome;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Objects;

/**
 * REST API for saving, listing, downloading, deleting and querying encrypted memories.
 * All routes require the {@code X-API-Key} header (see {@link io.zynox.security.ApiKeyFilter}).
 */
@RestController
@RequestMapping("/v1")
public class MemoryController {

    private final MemoryStore memoryStore;
    private final MemoryQueryService queryService;

    public MemoryController(MemoryStore memoryStore, MemoryQueryService queryService) {
        this.memoryStore = memoryStore;
        this.queryService = queryService;
    }

    /**
     * Encrypts and stores a new memory. The detected emotion is added to the returned tags.
     */
    @PostMapping("/save")
    public ResponseEntity<SaveResponse> save(@RequestBody SaveRequest request) {
        if (request.ownerId() == null || request.ownerId().isBlank()) {
            throw new IllegalArgumentException("owner_id is required");
        }
        if (request.data() == null) {
            throw new IllegalArgumentException("data is required");
        }
        if (request.tags() != null && request.tags().stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("tags must not contain null");
        }
        var record = memoryStore.save(request.ownerId(), request.key(), request.tags(), request.data());
        return ResponseEntity.ok(SaveResponse.of(record));
    }

    /**
     * Lists record metadata for an owner. Memory text is not included.
     */
    @GetMapping("/list/{ownerId}")
    public ResponseEntity<ListResponse> list(@PathVariable String ownerId) {
        List<ListItem> items = memoryStore.list(ownerId).stream()
                .map(ListItem::of)
                .toList();
        return ResponseEntity.ok(new ListResponse(MemoryDtos.STATUS_OK, items));
    }

    /**
     * Returns the decrypted text of one memory, or 404.
     */
    @GetMapping("/download/{id}")
    public ResponseEntity<DownloadResponse> download(@PathVariable String id) {
        return ResponseEntity.ok(new DownloadResponse(MemoryDtos.STATUS_OK, memoryStore.download(id)));
    }

    /**
     * Deletes a memory. Reports the id whether or not it existed.
     */
    @DeleteMapping("/delete/{id}")
    public ResponseEntity<DeleteResponse> delete(@PathVariable String id) {
        return ResponseEntity.ok(new DeleteResponse(MemoryDtos.STATUS_OK, memoryStore.delete(id)));
    }

    /**
     * Finds memories carrying the emotion tag or containing the keyword (either one suffices).
     * A body with neither filter yields no results.
     */
    @PostMapping("/query/{ownerId}")
    public ResponseEntity<QueryResponse> query(@PathVariable String ownerId,
                                               @RequestBody(required = false) QueryRequest request) {
        MemoryQuery query = request == null
                ? new MemoryQuery(null, null)
                : new MemoryQuery(request.emotion(), request.keyword());
        QueryOutcome outcome = queryService.query(ownerId, query);
        List<QueryResult> results = outcome.matches().stream()
                .map(QueryResult::of)
                .toList();
        return ResponseEntity.ok(new QueryResponse(MemoryDtos.STATUS_OK, results));
    }
}
