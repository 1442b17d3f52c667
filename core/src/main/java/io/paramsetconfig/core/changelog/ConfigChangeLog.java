package io.paramsetconfig.core.changelog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.paramsetconfig.core.error.ChangeLogLoadException;
import io.paramsetconfig.core.model.ValueChange;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only, FIFO-capped history of committed paramset changes.
 *
 * <p>
 * The log never holds more than {@link #maxEntries()} entries. When full, the
 * single oldest entry is evicted before a new one is appended. Entries are
 * returned newest first.
 *
 * <p>
 * Persistence is the caller's job: {@link #toDicts()} and
 * {@link #loadEntries(List)} round-trip the full log through plain mappings;
 * {@link #toJson()} and {@link #loadJson(String)} do the same through a JSON
 * document.
 *
 * <p>
 * Thread-safe: every method synchronizes on the log.
 */
public final class ConfigChangeLog {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigChangeLog.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<List<Object>> RAW_LIST = new TypeReference<>() {};

    /** Capacity used when none is configured. */
    public static final int DEFAULT_MAX_ENTRIES = 500;

    private final int maxEntries;
    private final Clock clock;
    private final Deque<ChangeLogEntry> entries = new ArrayDeque<>();

    /** Creates a log with {@link #DEFAULT_MAX_ENTRIES} capacity and the UTC system clock. */
    public ConfigChangeLog() {
        this(DEFAULT_MAX_ENTRIES);
    }

    /** Creates a log with the given capacity and the UTC system clock. */
    public ConfigChangeLog(int maxEntries) {
        this(maxEntries, Clock.systemUTC());
    }

    /**
     * Creates a log.
     *
     * @param maxEntries capacity, at least 1
     * @param clock      source of entry timestamps
     */
    public ConfigChangeLog(int maxEntries, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /** The capacity of this log. */
    public int maxEntries() {
        return maxEntries;
    }

    /** Current number of entries. */
    public synchronized int size() {
        return entries.size();
    }

    /**
     * Records a change, stamping the current time. Evicts the oldest entry if
     * the log is full.
     *
     * @return the recorded entry
     */
    public synchronized ChangeLogEntry add(
            String entryId,
            String interfaceId,
            String channelAddress,
            String deviceName,
            String deviceModel,
            String paramsetKey,
            Map<String, ValueChange> changes,
            String source) {
        Objects.requireNonNull(entryId, "entryId must not be null");
        ChangeLogEntry entry = new ChangeLogEntry(
                OffsetDateTime.now(clock).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                entryId,
                interfaceId,
                channelAddress,
                deviceName,
                deviceModel,
                paramsetKey,
                changes,
                source);
        if (entries.size() >= maxEntries) {
            ChangeLogEntry evicted = entries.removeFirst();
            LOG.debug("changelog.evict entry_id={} timestamp={}", evicted.entryId(), evicted.timestamp());
        }
        entries.addLast(entry);
        LOG.debug(
                "changelog.add entry_id={} channel={} paramset={} parameters={}",
                entryId,
                entry.channelAddress(),
                entry.paramsetKey(),
                entry.changes().size());
        return entry;
    }

    /**
     * Returns entries for an entry id, newest first.
     *
     * @param entryId filter, or {@code null} / empty for all entries
     * @param limit   maximum entries to return, or {@code null} for all
     */
    public ChangeLogPage getEntries(String entryId, Integer limit) {
        return getEntries(entryId, null, limit);
    }

    /**
     * Returns entries filtered by entry id and channel address, newest first.
     *
     * @param entryId        filter, or {@code null} / empty for any
     * @param channelAddress filter, or {@code null} / empty for any
     * @param limit          maximum entries to return, or {@code null} for all
     * @return the page; {@code total} counts matches before truncation
     */
    public synchronized ChangeLogPage getEntries(String entryId, String channelAddress, Integer limit) {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        List<ChangeLogEntry> matches = new ArrayList<>();
        Iterator<ChangeLogEntry> newestFirst = entries.descendingIterator();
        while (newestFirst.hasNext()) {
            ChangeLogEntry entry = newestFirst.next();
            if (isSet(entryId) && !entryId.equals(entry.entryId())) {
                continue;
            }
            if (isSet(channelAddress) && !channelAddress.equals(entry.channelAddress())) {
                continue;
            }
            matches.add(entry);
        }
        int total = matches.size();
        List<ChangeLogEntry> page = limit != null && limit < total ? matches.subList(0, limit) : matches;
        return new ChangeLogPage(page, total);
    }

    /**
     * Removes every entry of an entry id. The remaining entries keep their
     * order.
     *
     * @return the number of removed entries
     */
    public synchronized int clearByEntryId(String entryId) {
        Objects.requireNonNull(entryId, "entryId must not be null");
        int before = entries.size();
        entries.removeIf(e -> entryId.equals(e.entryId()));
        int removed = before - entries.size();
        if (removed > 0) {
            LOG.info("Change log cleared for entry_id={}: removed={}", entryId, removed);
        }
        return removed;
    }

    /** Removes all entries. */
    public synchronized void clear() {
        entries.clear();
    }

    // --- Persistence ---

    /**
     * Serializes the full log, oldest first, as mutable mappings with the
     * fields of {@link ChangeLogEntry} in snake_case.
     */
    public synchronized List<Map<String, Object>> toDicts() {
        List<Map<String, Object>> result = new ArrayList<>(entries.size());
        for (ChangeLogEntry entry : entries) {
            result.add(ChangeLogCodec.toMap(entry));
        }
        return result;
    }

    /**
     * Replaces the whole log with previously serialized entries (oldest
     * first). Only the most recent {@link #maxEntries()} entries are kept.
     * Missing fields default to empty values. The log is left unchanged if
     * any entry is malformed.
     *
     * @param rawEntries entries as produced by {@link #toDicts()}
     * @throws ChangeLogLoadException if an entry is not a mapping or a field
     *                                has the wrong type
     */
    public void loadEntries(List<?> rawEntries) {
        Objects.requireNonNull(rawEntries, "rawEntries must not be null");
        List<ChangeLogEntry> loaded = new ArrayList<>(rawEntries.size());
        int legacy = 0;
        for (int i = 0; i < rawEntries.size(); i++) {
            Object raw = rawEntries.get(i);
            loaded.add(ChangeLogCodec.fromMap(raw, i));
            if (ChangeLogCodec.missingFieldCount(raw) > 0) {
                legacy++;
            }
        }
        if (legacy > 0) {
            LOG.warn("Loaded {} change log entries with missing fields; defaults substituted", legacy);
        }
        int from = Math.max(0, loaded.size() - maxEntries);
        synchronized (this) {
            entries.clear();
            entries.addAll(loaded.subList(from, loaded.size()));
        }
        LOG.info("Change log restored: entries={}, dropped={}", loaded.size() - from, from);
    }

    /** Serializes the full log as a JSON array. */
    public String toJson() {
        try {
            return JSON.writeValueAsString(toDicts());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize change log", e);
        }
    }

    /**
     * Replaces the log with the entries of a JSON array produced by
     * {@link #toJson()}.
     *
     * @throws ChangeLogLoadException if the document is not a JSON array or an
     *                                entry is malformed
     */
    public void loadJson(String json) {
        Objects.requireNonNull(json, "json must not be null");
        List<Object> raw;
        try {
            raw = JSON.readValue(json, RAW_LIST);
        } catch (JsonProcessingException e) {
            throw new ChangeLogLoadException("Change log document is not a JSON array: " + e.getOriginalMessage(), e);
        }
        if (raw == null) {
            throw new ChangeLogLoadException("Change log document must be a JSON array, got null");
        }
        loadEntries(raw);
    }

    private static boolean isSet(String filter) {
        return filter != null && !filter.isEmpty();
    }
}
