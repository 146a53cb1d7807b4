package com.analyticscache.domain.service;

import com.analyticscache.domain.model.DataSourceConfig;
import com.analyticscache.domain.model.DataSourceType;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DataSourceConfigCacheTest {

    @Mock
    private DataSourceConfigProvider configProvider;

    private DataSourceConfigCache configCache;

    @BeforeEach
    void setUp() {
        configCache = new DataSourceConfigCache(configProvider, Caffeine.newBuilder().maximumSize(10).build());
    }

    @Test
    void testGet_MemoizesLookups() {
        when(configProvider.findById(2)).thenReturn(Optional.of(DataSourceConfig.builder()
                .dataSourceId(2).type(DataSourceType.TABLE_BASED).build()));

        assertEquals(DataSourceType.TABLE_BASED, configCache.typeOf(2));
        assertTrue(configCache.get(2).isPresent());

        verify(configProvider, times(1)).findById(2);
    }

    @Test
    void testTypeOf_UnknownSourceIsMeasureBasedAndNotMemoized() {
        when(configProvider.findById(9)).thenReturn(Optional.empty());

        assertEquals(DataSourceType.MEASURE_BASED, configCache.typeOf(9));
        assertTrue(configCache.get(9).isEmpty());

        verify(configProvider, times(2)).findById(9);
    }

    @Test
    void testEvict_ForcesFreshLookup() {
        when(configProvider.findById(1)).thenReturn(Optional.of(DataSourceConfig.builder().dataSourceId(1).build()));

        configCache.get(1);
        configCache.evict(1);
        configCache.get(1);

        verify(configProvider, times(2)).findById(1);
    }
}
