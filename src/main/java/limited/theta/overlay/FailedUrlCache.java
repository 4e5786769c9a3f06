// FailedUrlCache.java
// caller-owned memory of URLs that failed recently, bounded LRU with a
// time-to-live; construct a fresh one per session (or per test)

package limited.theta.overlay;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public final class FailedUrlCache
{
    private final int maxEntries;
    private final long ttlMillis;
    private final Clock clock;
    private final LinkedHashMap<String, Instant> entries;

    public FailedUrlCache(int maxEntries, long ttlMillis)
    {
        this(maxEntries, ttlMillis, Clock.systemUTC());
    }

    public FailedUrlCache(int maxEntries, long ttlMillis, Clock clock)
    {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1");
        }
        this.maxEntries = maxEntries;
        this.ttlMillis = ttlMillis;
        this.clock = clock;
        this.entries = new LinkedHashMap<String, Instant>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Instant> eldest) {
                return size() > FailedUrlCache.this.maxEntries;
            }
        };
    }

    public static FailedUrlCache fromConfig(PipelineConfig config)
    {
        return new FailedUrlCache(config.getFailureCacheMaxEntries(), config.getFailureCacheTtlMillis());
    }

    public synchronized void markFailed(String url)
    {
        entries.put(url, clock.instant());
    }

    public synchronized boolean isRecentlyFailed(String url)
    {
        Instant failedAt = entries.get(url);
        if (failedAt == null) {
            return false;
        }
        if (clock.instant().isAfter(failedAt.plusMillis(ttlMillis))) {
            entries.remove(url);
            return false;
        }
        return true;
    }

    public synchronized void forget(String url)
    {
        entries.remove(url);
    }

    public synchronized void clear()
    {
        entries.clear();
    }

    public synchronized int size()
    {
        return entries.size();
    }

} // FailedUrlCache
