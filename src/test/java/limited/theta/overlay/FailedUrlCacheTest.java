// FailedUrlCacheTest.java

package limited.theta.overlay;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

class FailedUrlCacheTest
{
    // settable clock so expiry can be tested without sleeping
    private static final class ManualClock extends Clock
    {
        private Instant now = Instant.parse("2024-05-01T12:00:00Z");

        void advanceMillis(long millis)
        {
            now = now.plusMillis(millis);
        }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant() { return now; }
    }

    @Test
    void remembersUntilTheTtlRunsOut()
    {
        ManualClock clock = new ManualClock();
        FailedUrlCache cache = new FailedUrlCache(8, 1_000L, clock);
        cache.markFailed("https://h/a.tif");
        assertTrue(cache.isRecentlyFailed("https://h/a.tif"));

        clock.advanceMillis(1_000L);
        assertTrue(cache.isRecentlyFailed("https://h/a.tif"));

        clock.advanceMillis(1L);
        assertFalse(cache.isRecentlyFailed("https://h/a.tif"));
        assertEquals(0, cache.size());
    }

    @Test
    void evictsTheLeastRecentlyUsed()
    {
        FailedUrlCache cache = new FailedUrlCache(2, 60_000L);
        cache.markFailed("a");
        cache.markFailed("b");
        assertTrue(cache.isRecentlyFailed("a")); // touches a, so b is now eldest
        cache.markFailed("c");

        assertEquals(2, cache.size());
        assertTrue(cache.isRecentlyFailed("a"));
        assertFalse(cache.isRecentlyFailed("b"));
        assertTrue(cache.isRecentlyFailed("c"));
    }

    @Test
    void forgetAndClear()
    {
        FailedUrlCache cache = new FailedUrlCache(4, 60_000L);
        cache.markFailed("a");
        cache.markFailed("b");
        cache.forget("a");
        assertFalse(cache.isRecentlyFailed("a"));
        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    void instancesDoNotShareState()
    {
        FailedUrlCache one = new FailedUrlCache(4, 60_000L);
        FailedUrlCache two = new FailedUrlCache(4, 60_000L);
        one.markFailed("a");
        assertFalse(two.isRecentlyFailed("a"));
    }

    @Test
    void sizedFromConfig()
    {
        FailedUrlCache cache = FailedUrlCache.fromConfig(PipelineConfig.defaults());
        assertEquals(0, cache.size());
        assertThrows(IllegalArgumentException.class, () -> new FailedUrlCache(0, 1L));
    }

} // FailedUrlCacheTest
