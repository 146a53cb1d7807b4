package com.analyticscache.infrastructure.cache;

import com.analyticscache.config.CacheProperties;
import com.analyticscache.domain.model.CacheDimension;
import com.analyticscache.domain.model.CacheStaleness;
import com.analyticscache.domain.model.DataSourceType;
import com.analyticscache.domain.model.IndexQuery;
import com.analyticscache.exception.CacheUnavailableException;
import com.analyticscache.exception.CacheWriteException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Secondary-index cache over granular entries.
 *
 * Write path (warming only):
 * - One JSON entry per (measure, practice, provider, frequency), TTL bounded
 * - Entry key added to the master index and every granularity index, same TTL
 * - Commands staged into pipelined batches of fixed size
 *
 * Read path:
 * - Base measure+frequency index, narrowed by practice/provider indexes
 * - Multi-valued filters unioned into short-lived temp keys, then intersected
 * - Matching entries fetched with chunked MGET
 *
 * A cold index is a miss, not an error. Store failures surface as
 * CacheUnavailableException so callers can fall back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsIndexStore {

    private static final TypeReference<List<Map<String, Object>>> ROWS_TYPE = new TypeReference<>() {
    };

    private final CacheStore cacheStore;
    private final CacheKeyCodec keyCodec;
    private final ObjectMapper objectMapper;
    private final CacheProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * TTL shared by entries, indexes and metadata.
     */
    public Duration defaultTtl() {
        return Duration.ofSeconds(properties.getTtlSeconds());
    }

    // Write path

    /**
     * Stage one entry and its index memberships into the batch.
     *
     * @return false when the serialized entry exceeds the size ceiling; nothing is staged
     */
    public boolean stage(WriteBatch batch, CacheDimension dimension, List<Map<String, Object>> rows, Duration ttl) {
        String primaryKey = keyCodec.primaryKey(dimension);
        String json = serialize(rows, primaryKey);

        if (isOversized(json, primaryKey)) {
            return false;
        }

        batch.set(primaryKey, json, ttl);
        for (String indexKey : keyCodec.indexKeys(dimension)) {
            batch.addToSet(indexKey, primaryKey);
            batch.expire(indexKey, ttl);
        }
        batch.markEntry();
        return true;
    }

    /**
     * Execute the staged batch. Any failure aborts the caller's warm.
     */
    public void flush(WriteBatch batch) {
        if (batch.isEmpty()) {
            return;
        }
        int entries = batch.entryCount();
        try {
            cacheStore.execute(batch);
        } catch (CacheUnavailableException e) {
            throw new CacheWriteException("Store unavailable while writing " + entries + " entries", e);
        }
        log.debug("Flushed write batch: {} entries, {} commands", entries, batch.commands().size());
        batch.clear();
    }

    /**
     * Stage and flush a single entry with the default TTL.
     *
     * @return false when the entry was too large to store
     */
    public boolean write(CacheDimension dimension, List<Map<String, Object>> rows) {
        WriteBatch batch = new WriteBatch();
        boolean staged = stage(batch, dimension, rows, defaultTtl());
        flush(batch);
        return staged;
    }

    /**
     * Store a whole table-based data source as one entry registered in its master index.
     */
    public boolean writeTable(int dataSourceId, List<Map<String, Object>> rows, Duration ttl) {
        String tableKey = keyCodec.tableKey(dataSourceId);
        String json = serialize(rows, tableKey);
        if (isOversized(json, tableKey)) {
            return false;
        }

        String masterKey = keyCodec.masterIndexKey(dataSourceId);
        WriteBatch batch = new WriteBatch()
                .set(tableKey, json, ttl)
                .addToSet(masterKey, tableKey)
                .expire(masterKey, ttl);
        batch.markEntry();
        flush(batch);
        return true;
    }

    /**
     * Record the last completed warm. Table-based sources use the
     * [{"timestamp": ...}] form, measure-based sources a bare ISO-8601 instant.
     */
    public void writeMetadata(int dataSourceId, Instant warmedAt, DataSourceType type) {
        String value = type == DataSourceType.TABLE_BASED
                ? "[{\"timestamp\":\"" + warmedAt + "\"}]"
                : warmedAt.toString();
        cacheStore.set(keyCodec.metadataKey(dataSourceId), value, defaultTtl());
        log.debug("Cache metadata set: dataSourceId={}, lastWarmed={}", dataSourceId, warmedAt);
    }

    // Read path

    /**
     * Rows of every entry matching the measure, frequency and optional
     * practice/provider lists.
     *
     * Multi-valued filters are unioned into temp keys, which are deleted
     * before returning.
     *
     * @return empty list when nothing matches or the index is cold
     * @throws CacheUnavailableException when the store cannot be reached
     */
    public List<Map<String, Object>> query(IndexQuery query) {
        long startTime = System.currentTimeMillis();
        int ds = query.getDataSourceId();
        List<String> tempKeys = new ArrayList<>();

        try {
            List<String> indexSets = new ArrayList<>();
            indexSets.add(keyCodec.baseIndexKey(ds, query.getMeasure(), query.getFrequency()));

            if (!query.getPracticeUids().isEmpty()) {
                indexSets.add(practiceIndexSet(query, tempKeys));
            }
            if (!query.getProviderUids().isEmpty()) {
                indexSets.add(providerIndexSet(query, tempKeys));
            }

            List<String> matchingKeys = matchingKeys(ds, indexSets, tempKeys);
            long lookupMs = System.currentTimeMillis() - startTime;

            if (matchingKeys.isEmpty()) {
                log.debug("Index lookup found no entries: ds={}, measure={}, frequency={} ({} ms)",
                        ds, query.getMeasure(), query.getFrequency(), lookupMs);
                return Collections.emptyList();
            }

            List<Map<String, Object>> rows = fetchEntries(matchingKeys);

            log.info("Cache query completed: ds={}, measure={}, frequency={}, practices={}, providers={}, " +
                            "keys={}, rows={}, lookup={} ms, total={} ms",
                    ds, query.getMeasure(), query.getFrequency(), query.getPracticeUids().size(),
                    query.getProviderUids().size(), matchingKeys.size(), rows.size(), lookupMs,
                    System.currentTimeMillis() - startTime);
            return rows;
        } finally {
            cleanupTempKeys(tempKeys);
        }
    }

    /**
     * Several measures of one data source and frequency, keyed by measure.
     */
    public Map<String, List<Map<String, Object>>> batchQuery(List<IndexQuery> queries) {
        Map<String, List<Map<String, Object>>> results = new LinkedHashMap<>();
        if (queries.isEmpty()) {
            return results;
        }

        IndexQuery first = queries.get(0);
        boolean sameSource = queries.stream().allMatch(q ->
                q.getDataSourceId() == first.getDataSourceId() && q.getFrequency().equals(first.getFrequency()));
        if (!sameSource) {
            throw new IllegalArgumentException("Batch query requires one data source and one frequency");
        }

        for (IndexQuery query : queries) {
            results.put(query.getMeasure(), query(query));
        }
        return results;
    }

    /**
     * The single entry of a table-based data source. A corrupted entry is deleted and reads as absent.
     */
    public Optional<List<Map<String, Object>>> readTable(int dataSourceId) {
        String tableKey = keyCodec.tableKey(dataSourceId);
        String json = cacheStore.get(tableKey);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, ROWS_TYPE));
        } catch (JsonProcessingException e) {
            log.warn("Corrupted table entry, deleting: key={}, error={}", tableKey, e.getMessage());
            cacheStore.delete(List.of(tableKey));
            return Optional.empty();
        }
    }

    /**
     * Timestamp of the last completed warm, empty when cold or unreadable.
     */
    public Optional<Instant> lastWarmed(int dataSourceId) {
        String raw = cacheStore.get(keyCodec.metadataKey(dataSourceId));
        if (raw == null) {
            return Optional.empty();
        }
        return parseTimestamp(raw, dataSourceId);
    }

    public boolean isWarm(int dataSourceId) {
        return lastWarmed(dataSourceId).isPresent();
    }

    /**
     * COLD without metadata, otherwise FRESH or STALE by the age of the last warm.
     */
    public CacheStaleness staleness(int dataSourceId, Instant now) {
        return lastWarmed(dataSourceId)
                .map(warmedAt -> classify(warmedAt, now))
                .orElse(CacheStaleness.COLD);
    }

    /**
     * STALE once the age exceeds the staleness threshold, FRESH at or below it.
     */
    public CacheStaleness classify(Instant warmedAt, Instant now) {
        Duration age = Duration.between(warmedAt, now);
        return age.compareTo(Duration.ofHours(properties.getStalenessThresholdHours())) > 0
                ? CacheStaleness.STALE
                : CacheStaleness.FRESH;
    }

    /**
     * Entries registered in the master index.
     */
    public long indexedEntryCount(int dataSourceId) {
        return cacheStore.cardinality(keyCodec.masterIndexKey(dataSourceId));
    }

    /**
     * Remove every entry, index and the metadata key of one data source.
     *
     * @return number of keys that existed and were deleted
     */
    public long invalidate(int dataSourceId) {
        long startTime = System.currentTimeMillis();

        Set<String> entryKeys = cacheStore.members(keyCodec.masterIndexKey(dataSourceId));
        long entriesRemoved = deleteInBatches(new ArrayList<>(entryKeys));

        List<String> indexKeys = cacheStore.scan(keyCodec.indexPattern(dataSourceId), properties.getScanCount());
        long indexesRemoved = deleteInBatches(indexKeys);

        long metadataRemoved = cacheStore.delete(List.of(keyCodec.metadataKey(dataSourceId)));

        log.info("Cache invalidated: dataSourceId={}, entries={}/{}, indexes={}, metadata={}, {} ms",
                dataSourceId, entriesRemoved, entryKeys.size(), indexesRemoved, metadataRemoved,
                System.currentTimeMillis() - startTime);

        return entriesRemoved + indexesRemoved + metadataRemoved;
    }

    private String practiceIndexSet(IndexQuery query, List<String> tempKeys) {
        int ds = query.getDataSourceId();
        List<Integer> practiceUids = query.getPracticeUids();
        if (practiceUids.size() == 1) {
            return keyCodec.practiceIndexKey(ds, query.getMeasure(), practiceUids.get(0), query.getFrequency());
        }

        List<String> sources = new ArrayList<>(practiceUids.size());
        for (Integer practiceUid : practiceUids) {
            sources.add(keyCodec.practiceIndexKey(ds, query.getMeasure(), practiceUid, query.getFrequency()));
        }
        return unionIntoTemp(ds, sources, tempKeys);
    }

    private String providerIndexSet(IndexQuery query, List<String> tempKeys) {
        int ds = query.getDataSourceId();
        List<Integer> providerUids = query.getProviderUids();
        if (providerUids.size() == 1) {
            return keyCodec.providerIndexKey(ds, query.getMeasure(), query.getFrequency(), providerUids.get(0));
        }

        List<String> sources = new ArrayList<>(providerUids.size());
        for (Integer providerUid : providerUids) {
            sources.add(keyCodec.providerIndexKey(ds, query.getMeasure(), query.getFrequency(), providerUid));
        }
        return unionIntoTemp(ds, sources, tempKeys);
    }

    private String unionIntoTemp(int dataSourceId, List<String> sources, List<String> tempKeys) {
        String tempKey = keyCodec.tempKey(dataSourceId, "union");
        tempKeys.add(tempKey);
        cacheStore.unionStore(tempKey, sources, tempKeyTtl());
        return tempKey;
    }

    private List<String> matchingKeys(int dataSourceId, List<String> indexSets, List<String> tempKeys) {
        Set<String> members;
        if (indexSets.size() == 1) {
            members = cacheStore.members(indexSets.get(0));
        } else {
            String resultKey = keyCodec.tempKey(dataSourceId, "result");
            tempKeys.add(resultKey);
            long count = cacheStore.intersectStore(resultKey, indexSets, tempKeyTtl());
            members = count > 0 ? cacheStore.members(resultKey) : Collections.emptySet();
        }
        List<String> keys = new ArrayList<>(members);
        Collections.sort(keys);
        return keys;
    }

    private List<Map<String, Object>> fetchEntries(List<String> keys) {
        List<Map<String, Object>> rows = new ArrayList<>();
        List<String> corrupted = new ArrayList<>();
        int batchSize = properties.getQueryBatchSize();

        for (int i = 0; i < keys.size(); i += batchSize) {
            List<String> chunk = keys.subList(i, Math.min(i + batchSize, keys.size()));
            List<String> values = cacheStore.multiGet(chunk);

            for (int j = 0; j < chunk.size(); j++) {
                String value = j < values.size() ? values.get(j) : null;
                if (value == null) {
                    // Index outlived the entry; treated as a miss for this key
                    continue;
                }
                try {
                    rows.addAll(objectMapper.readValue(value, ROWS_TYPE));
                } catch (JsonProcessingException e) {
                    log.warn("Corrupted cache entry, skipping: key={}, error={}", chunk.get(j), e.getMessage());
                    corrupted.add(chunk.get(j));
                }
            }
        }

        if (!corrupted.isEmpty()) {
            try {
                cacheStore.delete(corrupted);
            } catch (CacheUnavailableException e) {
                log.warn("Could not delete {} corrupted entries: {}", corrupted.size(), e.getMessage());
            }
        }
        return rows;
    }

    private long deleteInBatches(List<String> keys) {
        long removed = 0;
        int batchSize = properties.getDeleteBatchSize();
        for (int i = 0; i < keys.size(); i += batchSize) {
            removed += cacheStore.delete(keys.subList(i, Math.min(i + batchSize, keys.size())));
        }
        return removed;
    }

    private void cleanupTempKeys(List<String> tempKeys) {
        if (tempKeys.isEmpty()) {
            return;
        }
        try {
            cacheStore.delete(tempKeys);
        } catch (CacheUnavailableException e) {
            // They carry their own short expiry
            log.warn("Failed to clean up {} temp keys: {}", tempKeys.size(), e.getMessage());
        }
    }

    private Duration tempKeyTtl() {
        return Duration.ofSeconds(properties.getTempKeyTtlSeconds());
    }

    private String serialize(List<Map<String, Object>> rows, String key) {
        try {
            return objectMapper.writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new CacheWriteException("Could not serialize rows for " + key, e);
        }
    }

    private boolean isOversized(String json, String key) {
        long size = json.getBytes(StandardCharsets.UTF_8).length;
        if (size <= properties.getMaxEntrySizeBytes()) {
            return false;
        }
        log.warn("Cache entry rejected, too large: key={}, sizeBytes={}, maxBytes={}",
                key, size, properties.getMaxEntrySizeBytes());
        Counter.builder("cache.entry.oversized")
                .register(meterRegistry)
                .increment();
        return true;
    }

    private Optional<Instant> parseTimestamp(String raw, int dataSourceId) {
        try {
            String trimmed = raw.trim();
            if (trimmed.startsWith("[") || trimmed.startsWith("{")) {
                JsonNode node = objectMapper.readTree(trimmed);
                JsonNode holder = node.isArray() ? node.path(0) : node;
                JsonNode timestamp = holder.path("timestamp");
                if (!timestamp.isTextual()) {
                    log.warn("Cache metadata missing timestamp: dataSourceId={}", dataSourceId);
                    return Optional.empty();
                }
                return Optional.of(Instant.parse(timestamp.asText()));
            }
            return Optional.of(Instant.parse(trimmed));
        } catch (JsonProcessingException | DateTimeParseException e) {
            log.warn("Unreadable cache metadata, treating as cold: dataSourceId={}, error={}",
                    dataSourceId, e.getMessage());
            return Optional.empty();
        }
    }
}
