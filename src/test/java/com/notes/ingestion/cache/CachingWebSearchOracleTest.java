package com.notes.ingestion.cache;

import com.notes.ingestion.enrichment.LocationSearchResult;
import com.notes.ingestion.enrichment.WebSearchOracle;
import com.notes.ingestion.llm.LLMException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CachingWebSearchOracleTest {

    private static final LocationSearchResult OSLO = new LocationSearchResult("Norway", "Oslo", null, null);

    @Mock
    private WebSearchOracle delegate;

    private CachingWebSearchOracle oracle;

    @BeforeEach
    void setUp() {
        oracle = new CachingWebSearchOracle(delegate, LocationCacheConfig.defaults());
    }

    @Test
    @DisplayName("Repeated names are served from the cache, ignoring case")
    void cachesByNormalizedName() {
        when(delegate.searchOfficeLocation(anyString())).thenReturn(Optional.of(OSLO));

        oracle.searchOfficeLocation("Snøhetta");
        Optional<LocationSearchResult> second = oracle.searchOfficeLocation(" SNØHETTA ");

        assertEquals(Optional.of(OSLO), second);
        verify(delegate, times(1)).searchOfficeLocation(anyString());
        assertEquals(1, oracle.stats().hitCount());
        assertEquals(0.5, oracle.stats().hitRate(), 1e-9);
    }

    @Test
    @DisplayName("Empty answers are cached")
    void cachesEmpty() {
        when(delegate.searchOfficeLocation("Nobody")).thenReturn(Optional.empty());

        oracle.searchOfficeLocation("Nobody");
        oracle.searchOfficeLocation("Nobody");

        verify(delegate, times(1)).searchOfficeLocation("Nobody");
    }

    @Test
    @DisplayName("Failures are not cached")
    void failuresNotCached() {
        when(delegate.searchOfficeLocation("Snøhetta"))
                .thenThrow(new LLMException("timeout"))
                .thenReturn(Optional.of(OSLO));

        assertThrows(LLMException.class, () -> oracle.searchOfficeLocation("Snøhetta"));
        assertEquals(Optional.of(OSLO), oracle.searchOfficeLocation("Snøhetta"));
    }

    @Test
    @DisplayName("invalidateAll forces a new lookup")
    void invalidate() {
        when(delegate.searchOfficeLocation("Snøhetta")).thenReturn(Optional.of(OSLO));

        oracle.searchOfficeLocation("Snøhetta");
        oracle.invalidateAll();
        oracle.searchOfficeLocation("Snøhetta");

        verify(delegate, times(2)).searchOfficeLocation("Snøhetta");
    }

    @Test
    @DisplayName("A disabled cache always delegates")
    void disabled() {
        CachingWebSearchOracle uncached = new CachingWebSearchOracle(delegate, LocationCacheConfig.disabled());
        when(delegate.searchOfficeLocation("Snøhetta")).thenReturn(Optional.of(OSLO));

        uncached.searchOfficeLocation("Snøhetta");
        uncached.searchOfficeLocation("Snøhetta");

        verify(delegate, times(2)).searchOfficeLocation("Snøhetta");
    }

    @Test
    @DisplayName("Config rejects non-positive limits")
    void configValidation() {
        assertThrows(IllegalArgumentException.class, () -> new LocationCacheConfig(0, 10, true));
        assertThrows(IllegalArgumentException.class, () -> new LocationCacheConfig(10, 0, true));
    }
}
