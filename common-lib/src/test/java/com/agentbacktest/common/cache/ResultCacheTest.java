package com.agentbacktest.common.cache;

import com.agentbacktest.common.model.AgentRole;
import com.agentbacktest.common.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class ResultCacheTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
    }

    @Nested
    @DisplayName("TTL")
    class TtlTests {

        @Test
        @DisplayName("value served until its TTL elapses, then a miss")
        void expiresAfterTtl() {
            ResultCache<String> cache = new ResultCache<>(10, Duration.ofMinutes(5), clock);
            cache.put("k", "v", Duration.ofSeconds(30));

            clock.advance(Duration.ofSeconds(29));
            assertEquals("v", cache.get("k").orElseThrow());

            clock.advance(Duration.ofSeconds(1));
            assertTrue(cache.get("k").isEmpty());
            assertEquals(1, cache.stats().expirations());
            assertEquals(0, cache.size());
        }

        @Test
        @DisplayName("access does not extend the TTL")
        void accessDoesNotExtend() {
            ResultCache<String> cache = new ResultCache<>(10, Duration.ofSeconds(10), clock);
            cache.put("k", "v");
            clock.advance(Duration.ofSeconds(9));
            assertTrue(cache.get("k").isPresent());
            clock.advance(Duration.ofSeconds(2));
            assertTrue(cache.get("k").isEmpty());
        }
    }

    @Nested
    @DisplayName("LRU")
    class LruTests {

        @Test
        @DisplayName("full cache evicts the least recently used entry")
        void evictsLeastRecentlyUsed() {
            ResultCache<Integer> cache = new ResultCache<>(2, Duration.ofMinutes(1), clock);
            cache.put("a", 1);
            cache.put("b", 2);
            cache.get("a");           // b is now least recently used
            cache.put("c", 3);

            assertTrue(cache.get("b").isEmpty());
            assertEquals(1, cache.get("a").orElseThrow());
            assertEquals(3, cache.get("c").orElseThrow());
            assertEquals(1, cache.stats().evictions());
        }

        @Test
        @DisplayName("expired entries are swept before any live entry is evicted")
        void expiryBeatsLru() {
            ResultCache<Integer> cache = new ResultCache<>(2, Duration.ofMinutes(1), clock);
            cache.put("short", 1, Duration.ofSeconds(5));
            cache.put("long", 2, Duration.ofMinutes(10));
            cache.get("short");       // long is the LRU entry, but short is about to expire

            clock.advance(Duration.ofSeconds(6));
            cache.put("new", 3);

            assertEquals(2, cache.get("long").orElseThrow());
            assertEquals(3, cache.get("new").orElseThrow());
            assertEquals(0, cache.stats().evictions());
            assertEquals(1, cache.stats().expirations());
        }

        @Test
        @DisplayName("overwriting an existing key never evicts")
        void overwriteDoesNotEvict() {
            ResultCache<Integer> cache = new ResultCache<>(2, Duration.ofMinutes(1), clock);
            cache.put("a", 1);
            cache.put("b", 2);
            cache.put("a", 10);
            assertEquals(2, cache.size());
            assertEquals(10, cache.get("a").orElseThrow());
            assertEquals(2, cache.get("b").orElseThrow());
        }
    }

    @Test
    @DisplayName("stats count hits and misses")
    void stats() {
        ResultCache<String> cache = new ResultCache<>(4, Duration.ofMinutes(1), clock);
        cache.put("k", "v");
        cache.get("k");
        cache.get("k");
        cache.get("missing");

        CacheStats stats = cache.stats();
        assertEquals(2, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(2.0 / 3.0, stats.hitRate(), 1e-9);
    }

    @Test
    @DisplayName("invalid capacity or TTL rejected")
    void invalidConstruction() {
        assertThrows(IllegalArgumentException.class, () -> new ResultCache<>(0, Duration.ofSeconds(1), clock));
        assertThrows(IllegalArgumentException.class, () -> new ResultCache<>(1, Duration.ZERO, clock));
    }

    @Nested
    @DisplayName("CacheKey")
    class CacheKeyTests {

        @Test
        @DisplayName("independent of map insertion order")
        void stableAcrossOrdering() {
            Map<String, Object> first = new LinkedHashMap<>();
            first.put("symbol", "AAPL");
            first.put("date", "2024-01-02");
            first.put("nested", new LinkedHashMap<>(Map.of("x", 1, "y", 2)));

            Map<String, Object> second = new LinkedHashMap<>();
            second.put("nested", new TreeMap<>(Map.of("y", 2, "x", 1)));
            second.put("date", "2024-01-02");
            second.put("symbol", "AAPL");

            assertEquals(CacheKey.of(AgentRole.NEWS_ANALYST, first),
                         CacheKey.of(AgentRole.NEWS_ANALYST, second));
        }

        @Test
        @DisplayName("role is part of the key")
        void roleMatters() {
            Map<String, Object> ctx = Map.of("symbol", "AAPL");
            assertNotEquals(CacheKey.of(AgentRole.BULL_RESEARCHER, ctx),
                            CacheKey.of(AgentRole.BEAR_RESEARCHER, ctx));
        }
    }
}
