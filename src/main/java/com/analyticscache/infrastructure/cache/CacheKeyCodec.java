package com.analyticscache.infrastructure.cache;

import com.analyticscache.config.CacheProperties;
import com.analyticscache.domain.model.CacheDimension;
import com.analyticscache.exception.InvalidCacheKeyException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds and parses every key of the indexed analytics cache.
 *
 * Key format:
 * - Entry:    cache:{ds:1}:m:Revenue:p:114:prov:501:freq:Monthly
 * - Indexes:  idx:{ds:1}:master, idx:{ds:1}:m:Revenue:freq:Monthly, ...
 * - Metadata: cache:meta:{ds:1}:last_warm
 *
 * Partitioning rule: every key that belongs to one data source embeds the
 * {ds:id} hash tag from {@link #hashTag(int)}, so in Redis Cluster all of
 * them map to one slot and SUNIONSTORE/SINTERSTORE work across indexes.
 *
 * Positions are fixed; an absent dimension is written as the wildcard token.
 * Pure functions only, no I/O.
 */
@Component
public class CacheKeyCodec {

    public static final String WILDCARD = "*";

    public static final String SCHEDULER_LOCK = "cache:background-warming:scheduler-lock";
    public static final String GLOBAL_WARMING_LOCK = "cache:background-warming:warming-lock";

    private static final Pattern PRIMARY_KEY = Pattern.compile(
            "^cache:\\{ds:(\\d+)\\}:m:([^:]+):p:(\\d+|\\*):prov:(\\d+|\\*):freq:([^:]+)$");
    private static final Pattern HASH_TAG = Pattern.compile("\\{ds:(\\d+)\\}");
    private static final Pattern INDEX_MEASURE = Pattern.compile("(?:^|:)m:([^:]+)");
    private static final Pattern INDEX_PRACTICE = Pattern.compile(":p:(\\d+)");
    private static final Pattern INDEX_PROVIDER = Pattern.compile(":prov:(\\d+)");
    private static final Pattern INDEX_FREQUENCY = Pattern.compile(":freq:([^:]+)");

    private final String prefix;

    public CacheKeyCodec(CacheProperties properties) {
        this.prefix = properties.getKeyPrefix() == null ? "" : properties.getKeyPrefix();
    }

    /**
     * Redis Cluster hash tag of a data source.
     *
     * @throws InvalidCacheKeyException when the id is not positive
     */
    public String hashTag(int dataSourceId) {
        if (dataSourceId <= 0) {
            throw new InvalidCacheKeyException("Data source id must be positive: " + dataSourceId);
        }
        return "{ds:" + dataSourceId + "}";
    }

    /**
     * Key of one granular entry. Absent practice or provider becomes the wildcard.
     *
     * @throws InvalidCacheKeyException when the measure or frequency is missing or
     *                                  contains a reserved character, or a UID is not positive
     */
    public String primaryKey(CacheDimension dimension) {
        String ds = hashTag(dimension.getDataSourceId());
        return prefix + "cache:" + ds
                + ":m:" + token(dimension.getMeasure(), "measure")
                + ":p:" + token(dimension.getPracticeUid())
                + ":prov:" + token(dimension.getProviderUid())
                + ":freq:" + token(dimension.getFrequency(), "frequency");
    }

    /**
     * Single entry holding a whole table-based data source.
     */
    public String tableKey(int dataSourceId) {
        return prefix + "cache:" + hashTag(dataSourceId) + ":table";
    }

    /**
     * Inverse of {@link #primaryKey(CacheDimension)}.
     *
     * @return empty for anything that is not a well-formed entry key
     */
    public Optional<CacheDimension> parsePrimaryKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        Matcher matcher = PRIMARY_KEY.matcher(stripPrefix(key));
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(CacheDimension.builder()
                    .dataSourceId(Integer.parseInt(matcher.group(1)))
                    .measure(nullIfWildcard(matcher.group(2)))
                    .practiceUid(parseUid(matcher.group(3)))
                    .providerUid(parseUid(matcher.group(4)))
                    .frequency(nullIfWildcard(matcher.group(5)))
                    .build());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * All index sets a primary key of this dimension belongs to:
     * master, measure+frequency, +practice, +provider, full tuple.
     */
    public List<String> indexKeys(CacheDimension dimension) {
        int ds = dimension.getDataSourceId();
        String m = token(dimension.getMeasure(), "measure");
        String p = token(dimension.getPracticeUid());
        String prov = token(dimension.getProviderUid());
        String freq = token(dimension.getFrequency(), "frequency");
        String base = prefix + "idx:" + hashTag(ds);

        return List.of(
                masterIndexKey(ds),
                base + ":m:" + m + ":freq:" + freq,
                base + ":m:" + m + ":p:" + p + ":freq:" + freq,
                base + ":m:" + m + ":freq:" + freq + ":prov:" + prov,
                base + ":m:" + m + ":p:" + p + ":prov:" + prov + ":freq:" + freq
        );
    }

    /**
     * Set of every entry key of the data source.
     */
    public String masterIndexKey(int dataSourceId) {
        return prefix + "idx:" + hashTag(dataSourceId) + ":master";
    }

    /**
     * Measure+frequency index, the starting set of every query.
     */
    public String baseIndexKey(int dataSourceId, String measure, String frequency) {
        return prefix + "idx:" + hashTag(dataSourceId)
                + ":m:" + token(measure, "measure")
                + ":freq:" + token(frequency, "frequency");
    }

    /**
     * Measure+practice+frequency index.
     */
    public String practiceIndexKey(int dataSourceId, String measure, int practiceUid, String frequency) {
        return prefix + "idx:" + hashTag(dataSourceId)
                + ":m:" + token(measure, "measure")
                + ":p:" + practiceUid
                + ":freq:" + token(frequency, "frequency");
    }

    /**
     * Measure+frequency+provider index.
     */
    public String providerIndexKey(int dataSourceId, String measure, String frequency, int providerUid) {
        return prefix + "idx:" + hashTag(dataSourceId)
                + ":m:" + token(measure, "measure")
                + ":freq:" + token(frequency, "frequency")
                + ":prov:" + providerUid;
    }

    /**
     * Parses whatever dimension components an index key carries.
     * The master index yields only the data source id.
     */
    public Optional<CacheDimension> parseIndexKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String raw = stripPrefix(key);
        if (!raw.startsWith("idx:")) {
            return Optional.empty();
        }
        Optional<Integer> ds = dataSourceIdOf(raw);
        if (ds.isEmpty()) {
            return Optional.empty();
        }
        String rest = raw.substring(raw.indexOf('}') + 1);

        CacheDimension.CacheDimensionBuilder builder = CacheDimension.builder().dataSourceId(ds.get());
        Matcher measure = INDEX_MEASURE.matcher(rest);
        if (measure.find()) {
            builder.measure(nullIfWildcard(measure.group(1)));
        }
        Matcher practice = INDEX_PRACTICE.matcher(rest);
        if (practice.find()) {
            builder.practiceUid(Integer.parseInt(practice.group(1)));
        }
        Matcher provider = INDEX_PROVIDER.matcher(rest);
        if (provider.find()) {
            builder.providerUid(Integer.parseInt(provider.group(1)));
        }
        Matcher frequency = INDEX_FREQUENCY.matcher(rest);
        if (frequency.find()) {
            builder.frequency(nullIfWildcard(frequency.group(1)));
        }
        return Optional.of(builder.build());
    }

    /**
     * Last-warm timestamp of a data source.
     */
    public String metadataKey(int dataSourceId) {
        return prefix + "cache:meta:" + hashTag(dataSourceId) + ":last_warm";
    }

    /**
     * Per-data-source warming lock.
     */
    public String lockKey(int dataSourceId) {
        return prefix + "lock:cache:warm:" + hashTag(dataSourceId);
    }

    /**
     * Auto-warm cooldown marker. Carries no hash tag, it is never combined with other keys.
     */
    public String rateLimitKey(int dataSourceId) {
        if (dataSourceId <= 0) {
            throw new InvalidCacheKeyException("Data source id must be positive: " + dataSourceId);
        }
        return prefix + "cache:auto-warm:last:" + dataSourceId;
    }

    /**
     * Lock held by the scheduler instance running a tick.
     */
    public String schedulerLockKey() {
        return prefix + SCHEDULER_LOCK;
    }

    /**
     * Lock held while a scheduled warm-all runs on any instance.
     */
    public String globalWarmingLockKey() {
        return prefix + GLOBAL_WARMING_LOCK;
    }

    /**
     * Transient destination for SUNIONSTORE/SINTERSTORE; shares the data source's hash tag.
     */
    public String tempKey(int dataSourceId, String operation) {
        return prefix + "temp:" + hashTag(dataSourceId) + ":" + operation + ":" + UUID.randomUUID();
    }

    // Scan patterns, never used on the request path

    public String indexPattern(int dataSourceId) {
        return prefix + "idx:" + hashTag(dataSourceId) + ":*";
    }

    /**
     * Matches entry keys of every data source, table entries included.
     */
    public String primaryPattern() {
        return prefix + "cache:{ds:*}:*";
    }

    public String metadataPattern() {
        return prefix + "cache:meta:{ds:*}:last_warm";
    }

    /**
     * Data source id carried by the key's hash tag.
     */
    public Optional<Integer> dataSourceIdOf(String key) {
        if (key == null) {
            return Optional.empty();
        }
        Matcher matcher = HASH_TAG.matcher(key);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(matcher.group(1)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Rejects values that would break the fixed-arity format or collide with the wildcard.
     */
    public static void validateToken(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidCacheKeyException(field + " must not be blank");
        }
        if (WILDCARD.equals(value)) {
            throw new InvalidCacheKeyException(field + " must not equal the wildcard token");
        }
        if (value.indexOf(':') >= 0 || value.indexOf('{') >= 0 || value.indexOf('}') >= 0) {
            throw new InvalidCacheKeyException(field + " contains a reserved character: " + value);
        }
    }

    private static String token(String value, String field) {
        if (value == null) {
            return WILDCARD;
        }
        validateToken(value, field);
        return value;
    }

    private static String token(Integer uid) {
        if (uid == null) {
            return WILDCARD;
        }
        if (uid <= 0) {
            throw new InvalidCacheKeyException("UID must be positive: " + uid);
        }
        return uid.toString();
    }

    private static Integer parseUid(String value) {
        return WILDCARD.equals(value) ? null : Integer.valueOf(value);
    }

    private static String nullIfWildcard(String value) {
        return WILDCARD.equals(value) ? null : value;
    }

    private String stripPrefix(String key) {
        return !prefix.isEmpty() && key.startsWith(prefix) ? key.substring(prefix.length()) : key;
    }
}
