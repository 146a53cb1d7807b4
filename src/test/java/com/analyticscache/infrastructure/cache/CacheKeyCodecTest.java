package com.analyticscache.infrastructure.cache;

import com.analyticscache.config.CacheProperties;
import com.analyticscache.domain.model.CacheDimension;
import com.analyticscache.exception.InvalidCacheKeyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeyCodecTest {

    private CacheKeyCodec codec;

    @BeforeEach
    void setUp() {
        codec = new CacheKeyCodec(new CacheProperties());
    }

    @Test
    void testPrimaryKey_FullDimension() {
        CacheDimension dimension = dimension("Revenue", 114, 501, "Monthly");

        assertEquals("cache:{ds:1}:m:Revenue:p:114:prov:501:freq:Monthly", codec.primaryKey(dimension));
    }

    @Test
    void testPrimaryKey_AbsentProviderUsesWildcard() {
        CacheDimension dimension = dimension("Revenue", 114, null, "Monthly");

        assertEquals("cache:{ds:1}:m:Revenue:p:114:prov:*:freq:Monthly", codec.primaryKey(dimension));
    }

    @Test
    void testParsePrimaryKey_RecoversDimension() {
        CacheDimension withProvider = dimension("Charges", 200, 7, "Weekly");
        CacheDimension withoutProvider = dimension("Charges", 200, null, "Weekly");

        assertEquals(Optional.of(withProvider), codec.parsePrimaryKey(codec.primaryKey(withProvider)));
        assertEquals(Optional.of(withoutProvider), codec.parsePrimaryKey(codec.primaryKey(withoutProvider)));
    }

    @Test
    void testParsePrimaryKey_RejectsForeignKeys() {
        assertTrue(codec.parsePrimaryKey("cache:meta:{ds:1}:last_warm").isEmpty());
        assertTrue(codec.parsePrimaryKey("idx:{ds:1}:master").isEmpty());
        assertTrue(codec.parsePrimaryKey(null).isEmpty());
    }

    @Test
    void testIndexKeys_AllGranularities() {
        List<String> keys = codec.indexKeys(dimension("Revenue", 114, 501, "Monthly"));

        assertEquals(List.of(
                "idx:{ds:1}:master",
                "idx:{ds:1}:m:Revenue:freq:Monthly",
                "idx:{ds:1}:m:Revenue:p:114:freq:Monthly",
                "idx:{ds:1}:m:Revenue:freq:Monthly:prov:501",
                "idx:{ds:1}:m:Revenue:p:114:prov:501:freq:Monthly"
        ), keys);
    }

    @Test
    void testLookupIndexKeys_MatchWriteSide() {
        List<String> keys = codec.indexKeys(dimension("Revenue", 114, 501, "Monthly"));

        assertTrue(keys.contains(codec.baseIndexKey(1, "Revenue", "Monthly")));
        assertTrue(keys.contains(codec.practiceIndexKey(1, "Revenue", 114, "Monthly")));
        assertTrue(keys.contains(codec.providerIndexKey(1, "Revenue", "Monthly", 501)));
    }

    @Test
    void testEveryDataSourceKey_SharesHashTag() {
        String tag = codec.hashTag(42);
        CacheDimension dimension = CacheDimension.builder()
                .dataSourceId(42).measure("Visits").practiceUid(3).frequency("Daily").build();

        assertTrue(codec.primaryKey(dimension).contains(tag));
        codec.indexKeys(dimension).forEach(key -> assertTrue(key.contains(tag), key));
        assertTrue(codec.metadataKey(42).contains(tag));
        assertTrue(codec.lockKey(42).contains(tag));
        assertTrue(codec.tableKey(42).contains(tag));
        assertTrue(codec.tempKey(42, "union").contains(tag));
    }

    @Test
    void testParseIndexKey_ExtractsComponents() {
        CacheDimension parsed = codec.parseIndexKey("idx:{ds:9}:m:Revenue:freq:Monthly:prov:501").orElseThrow();

        assertEquals(9, parsed.getDataSourceId());
        assertEquals("Revenue", parsed.getMeasure());
        assertEquals("Monthly", parsed.getFrequency());
        assertEquals(501, parsed.getProviderUid());
        assertNull(parsed.getPracticeUid());

        CacheDimension master = codec.parseIndexKey(codec.masterIndexKey(9)).orElseThrow();
        assertEquals(9, master.getDataSourceId());
        assertNull(master.getMeasure());
    }

    @Test
    void testDataSourceIdOf() {
        assertEquals(Optional.of(17), codec.dataSourceIdOf("cache:{ds:17}:m:A:p:1:prov:*:freq:Monthly"));
        assertTrue(codec.dataSourceIdOf("cache:background-warming:scheduler-lock").isEmpty());
    }

    @Test
    void testReservedCharacters_Rejected() {
        assertThrows(InvalidCacheKeyException.class,
                () -> codec.primaryKey(dimension("Rev:enue", 1, null, "Monthly")));
        assertThrows(InvalidCacheKeyException.class,
                () -> codec.primaryKey(dimension("*", 1, null, "Monthly")));
        assertThrows(InvalidCacheKeyException.class,
                () -> codec.primaryKey(dimension("Revenue", 1, null, "Mon{thly}")));
        assertThrows(InvalidCacheKeyException.class,
                () -> codec.primaryKey(dimension("  ", 1, null, "Monthly")));
    }

    @Test
    void testNonPositiveIds_Rejected() {
        assertThrows(InvalidCacheKeyException.class, () -> codec.hashTag(0));
        assertThrows(InvalidCacheKeyException.class, () -> codec.rateLimitKey(-1));
        assertThrows(InvalidCacheKeyException.class,
                () -> codec.primaryKey(dimension("Revenue", -5, null, "Monthly")));
    }

    @Test
    void testKeyPrefix_AppliedAndStripped() {
        CacheProperties properties = new CacheProperties();
        properties.setKeyPrefix("staging:");
        CacheKeyCodec prefixed = new CacheKeyCodec(properties);
        CacheDimension dimension = dimension("Revenue", 114, null, "Monthly");

        String key = prefixed.primaryKey(dimension);

        assertEquals("staging:cache:{ds:1}:m:Revenue:p:114:prov:*:freq:Monthly", key);
        assertEquals(Optional.of(dimension), prefixed.parsePrimaryKey(key));
        assertEquals("staging:cache:auto-warm:last:1", prefixed.rateLimitKey(1));
        assertEquals("staging:" + CacheKeyCodec.SCHEDULER_LOCK, prefixed.schedulerLockKey());
    }

    private static CacheDimension dimension(String measure, Integer practiceUid, Integer providerUid, String frequency) {
        return CacheDimension.builder()
                .dataSourceId(1)
                .measure(measure)
                .practiceUid(practiceUid)
                .providerUid(providerUid)
                .frequency(frequency)
                .build();
    }
}
