package com.openforge.mnemosyne.admin;

import com.openforge.mnemosyne.host.PersonaResolver;
import com.openforge.mnemosyne.host.RequestOrigin;
import com.openforge.mnemosyne.vector.DeleteResult;
import com.openforge.mnemosyne.vector.MemorySchema;
import com.openforge.mnemosyne.vector.VectorStore;
import com.openforge.mnemosyne.vector.VectorStoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maintenance operations behind the memory admin commands: browse and drop
 * collections, list records, purge a session's memories.
 *
 * Destructive calls require {@code confirmed == true}; without it they only
 * report what would happen.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MemoryAdminService {

    public static final int MAX_LIST_LIMIT = 50;
    public static final int FETCH_CAP      = 1000;

    private final VectorStore           vectorStore;
    private final VectorStoreProperties vectorProps;
    private final PersonaResolver       personas;

    // ── Collections ──────────────────────────────────────────────────────────

    /** Empty when the backend call failed; an empty list means no collections. */
    public Optional<List<String>> listCollections() {
        if (!vectorStore.isConnected()) return Optional.empty();
        return vectorStore.listCollections();
    }

    public AdminResult deleteCollection(String name, boolean confirmed) {
        if (!vectorStore.isConnected()) return AdminResult.failed("Vector store is not connected.");
        if (name == null || name.isBlank()) return AdminResult.failed("Collection name is required.");
        if (!vectorStore.hasCollection(name)) {
            return AdminResult.failed("Collection '" + name + "' does not exist.");
        }
        boolean active = name.equals(vectorProps.collectionName());
        if (!confirmed) {
            String warning = active ? " It is the active memory collection." : "";
            return AdminResult.failed("Deleting collection '" + name + "' needs confirmation." + warning);
        }
        if (active) {
            log.warn("[Admin] Dropping the ACTIVE memory collection '{}'; memory stops working until restart.", name);
        }
        if (!vectorStore.dropCollection(name)) {
            return AdminResult.failed("Failed to delete collection '" + name + "'.");
        }
        log.info("[Admin] Dropped collection '{}'.", name);
        return AdminResult.ok("Collection '" + name + "' deleted.");
    }

    // ── Records ──────────────────────────────────────────────────────────────

    /**
     * Newest {@code limit} records of a collection (the active one when
     * {@code collection} is blank).
     */
    public RecordListing listRecords(@Nullable String collection, int limit) {
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            return RecordListing.failed("Limit must be between 1 and " + MAX_LIST_LIMIT + ".");
        }
        if (!vectorStore.isConnected()) return RecordListing.failed("Vector store is not connected.");
        String target = collection == null || collection.isBlank() ? vectorProps.collectionName() : collection;
        if (!vectorStore.hasCollection(target)) {
            return RecordListing.failed("Collection '" + target + "' does not exist.");
        }

        Optional<List<Map<String, Object>>> fetched = vectorStore.query(
                target, MemorySchema.PRIMARY_FIELD + " >= 0", vectorProps.effectiveOutputFields(), FETCH_CAP);
        if (fetched.isEmpty()) return RecordListing.failed("Query on '" + target + "' failed.");

        List<Map<String, Object>> records = new ArrayList<>(fetched.get());
        records.sort(Comparator.<Map<String, Object>>comparingLong(MemoryAdminService::createTime).reversed());
        boolean capReached = fetched.get().size() >= FETCH_CAP;
        if (capReached) {
            log.warn("[Admin] Listing '{}' hit the fetch cap of {}; newest records may be missing.", target, FETCH_CAP);
        }
        return new RecordListing(true, null, List.copyOf(records.subList(0, Math.min(limit, records.size()))),
                capReached);
    }

    // ── Session purge ────────────────────────────────────────────────────────

    public PurgeResult deleteSessionMemory(String sessionId, boolean confirmed) {
        String id = unquote(sessionId);
        if (id.isEmpty()) return PurgeResult.failed("Session id is required.");
        if (!vectorStore.isConnected()) return PurgeResult.failed("Vector store is not connected.");
        if (!confirmed) return PurgeResult.failed("Deleting memories of session '" + id + "' needs confirmation.");

        String collection = vectorProps.collectionName();
        Optional<DeleteResult> deleted = vectorStore.delete(collection, MemorySchema.eq(MemorySchema.SESSION_FIELD, id));
        if (deleted.isEmpty()) return PurgeResult.failed("Delete failed for session '" + id + "'.");

        boolean flushed = vectorStore.flush(List.of(collection));
        if (!flushed) {
            log.warn("[Admin] Flush after deleting session {} failed; deletion becomes visible later.", id);
        }
        log.info("[Admin] Deleted {} memories of session {} (flushed={}).", deleted.get().deleteCount(), id, flushed);
        return new PurgeResult(true, id, deleted.get().deleteCount(), flushed, null);
    }

    public Optional<String> currentSessionId(RequestOrigin origin) {
        return personas.sessionId(origin);
    }

    public PurgeResult resetCurrentSessionMemory(RequestOrigin origin, boolean confirmed) {
        Optional<String> sessionId = currentSessionId(origin);
        if (sessionId.isEmpty()) return PurgeResult.failed("No active session for this conversation.");
        return deleteSessionMemory(sessionId.get(), confirmed);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    static String unquote(@Nullable String raw) {
        if (raw == null) return "";
        String s = raw.strip();
        while (s.length() >= 2 && isQuote(s.charAt(0)) && s.charAt(s.length() - 1) == s.charAt(0)) {
            s = s.substring(1, s.length() - 1).strip();
        }
        return s;
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'' || c == '`';
    }

    private static long createTime(Map<String, Object> record) {
        return record.get(MemorySchema.CREATE_TIME_FIELD) instanceof Number n ? n.longValue() : 0L;
    }

    // ── Results ──────────────────────────────────────────────────────────────

    public record AdminResult(boolean success, String message) {
        static AdminResult ok(String message)     { return new AdminResult(true, message); }
        static AdminResult failed(String message) { return new AdminResult(false, message); }
    }

    public record RecordListing(boolean success, String error,
                                List<Map<String, Object>> records, boolean fetchCapReached) {
        static RecordListing failed(String error) { return new RecordListing(false, error, List.of(), false); }
    }

    public record PurgeResult(boolean success, String sessionId, long deletedCount,
                              boolean flushed, String error) {
        static PurgeResult failed(String error) { return new PurgeResult(false, null, 0L, false, error); }
    }
}
