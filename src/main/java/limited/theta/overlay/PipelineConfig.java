// PipelineConfig.java
// tunables for locating, fetching and placing raster overlays
// defaults come from raster-overlay.properties on the classpath;
// any key can be overridden from the environment, e.g.
//   retry.maxAttempts -> RASTER_OVERLAY_RETRY_MAXATTEMPTS

package limited.theta.overlay;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class PipelineConfig
{
    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String RESOURCE_NAME = "raster-overlay.properties";
    public static final String ENV_PREFIX = "RASTER_OVERLAY_";

    public static final String DEFAULT_REGION = "eu-north-1";

    public static final String RETRY_MAX_ATTEMPTS = "retry.maxAttempts";
    public static final String RETRY_BASE_DELAY_MILLIS = "retry.baseDelayMillis";
    public static final String CONNECT_TIMEOUT_MILLIS = "fetch.connectTimeoutMillis";
    public static final String READ_TIMEOUT_MILLIS = "fetch.readTimeoutMillis";
    public static final String FETCH_THREADS = "fetch.threads";
    public static final String LOCATOR_DEFAULT_REGION = "locator.defaultRegion";
    public static final String FALLBACK_MARGIN_DEGREES = "fallback.marginDegrees";
    public static final String FALLBACK_VIEW_OFFSET_DEGREES = "fallback.viewOffsetDegrees";
    public static final String FAILURE_CACHE_MAX_ENTRIES = "failureCache.maxEntries";
    public static final String FAILURE_CACHE_TTL_MILLIS = "failureCache.ttlMillis";

    private final int maxAttempts;
    private final long baseDelayMillis;
    private final int connectTimeoutMillis;
    private final int readTimeoutMillis;
    private final int fetchThreads;
    private final String defaultRegion;
    private final double fallbackMarginDegrees;
    private final double fallbackViewOffsetDegrees;
    private final int failureCacheMaxEntries;
    private final long failureCacheTtlMillis;

    private PipelineConfig(Properties p)
    {
        maxAttempts = intValue(p, RETRY_MAX_ATTEMPTS, 2);
        baseDelayMillis = longValue(p, RETRY_BASE_DELAY_MILLIS, 500L);
        connectTimeoutMillis = intValue(p, CONNECT_TIMEOUT_MILLIS, 10_000);
        readTimeoutMillis = intValue(p, READ_TIMEOUT_MILLIS, 30_000);
        fetchThreads = intValue(p, FETCH_THREADS, 4);
        defaultRegion = p.getProperty(LOCATOR_DEFAULT_REGION, DEFAULT_REGION).trim();
        fallbackMarginDegrees = doubleValue(p, FALLBACK_MARGIN_DEGREES, 0.001);
        fallbackViewOffsetDegrees = doubleValue(p, FALLBACK_VIEW_OFFSET_DEGREES, 0.01);
        failureCacheMaxEntries = intValue(p, FAILURE_CACHE_MAX_ENTRIES, 256);
        failureCacheTtlMillis = longValue(p, FAILURE_CACHE_TTL_MILLIS, 30_000L);

        if (maxAttempts < 1) {
            throw new IllegalArgumentException(RETRY_MAX_ATTEMPTS + " must be at least 1, was " + maxAttempts);
        }
        if (fetchThreads < 1) {
            throw new IllegalArgumentException(FETCH_THREADS + " must be at least 1, was " + fetchThreads);
        }
    }

    /** Classpath defaults with environment overrides applied. */
    public static PipelineConfig load()
    {
        return load(System.getenv());
    }

    static PipelineConfig load(Map<String, String> env)
    {
        Properties p = new Properties();
        try (InputStream in = PipelineConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                p.load(in);
            } else {
                log.warn("{} not found on classpath, using built-in defaults", RESOURCE_NAME);
            }
        }
        catch (IOException e) {
            throw new IllegalStateException("Could not read " + RESOURCE_NAME, e);
        }

        for (String key : p.stringPropertyNames()) {
            String override = env.get(envName(key));
            if (override != null && !override.isBlank()) {
                log.info("Overriding {} from environment", key);
                p.setProperty(key, override.trim());
            }
        }
        return new PipelineConfig(p);
    }

    /** Exactly the given properties; missing keys take built-in defaults. */
    public static PipelineConfig fromProperties(Properties p)
    {
        return new PipelineConfig(p);
    }

    public static PipelineConfig defaults()
    {
        return new PipelineConfig(new Properties());
    }

    static String envName(String key)
    {
        return ENV_PREFIX + key.toUpperCase(Locale.ROOT).replace('.', '_');
    }

    public int getMaxAttempts() { return maxAttempts; }
    public long getBaseDelayMillis() { return baseDelayMillis; }
    public int getConnectTimeoutMillis() { return connectTimeoutMillis; }
    public int getReadTimeoutMillis() { return readTimeoutMillis; }
    public int getFetchThreads() { return fetchThreads; }
    public String getDefaultRegion() { return defaultRegion; }
    public double getFallbackMarginDegrees() { return fallbackMarginDegrees; }
    public double getFallbackViewOffsetDegrees() { return fallbackViewOffsetDegrees; }
    public int getFailureCacheMaxEntries() { return failureCacheMaxEntries; }
    public long getFailureCacheTtlMillis() { return failureCacheTtlMillis; }

    public RetryPolicy retryPolicy()
    {
        return new RetryPolicy(maxAttempts, baseDelayMillis);
    }

    private static int intValue(Properties p, String key, int def)
    {
        String v = p.getProperty(key);
        if (v == null || v.isBlank()) {
            return def;
        }
        try {
            return Integer.parseInt(v.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + v, e);
        }
    }

    private static long longValue(Properties p, String key, long def)
    {
        String v = p.getProperty(key);
        if (v == null || v.isBlank()) {
            return def;
        }
        try {
            return Long.parseLong(v.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid long for " + key + ": " + v, e);
        }
    }

    private static double doubleValue(Properties p, String key, double def)
    {
        String v = p.getProperty(key);
        if (v == null || v.isBlank()) {
            return def;
        }
        try {
            return Double.parseDouble(v.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + v, e);
        }
    }

} // PipelineConfig
