// RetryPolicy.java
// how many times to hit one candidate URL and how long to wait between
// hits; which URLs to try is the locator's business, not this class's

package limited.theta.overlay;

public final class RetryPolicy
{
    private final int maxAttempts;
    private final long baseDelayMillis;

    public RetryPolicy(int maxAttempts, long baseDelayMillis)
    {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        if (baseDelayMillis < 0) {
            throw new IllegalArgumentException("baseDelayMillis must be >= 0, was " + baseDelayMillis);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMillis = baseDelayMillis;
    }

    /** One attempt per candidate, no waiting. */
    public static RetryPolicy once()
    {
        return new RetryPolicy(1, 0L);
    }

    public int getMaxAttempts() { return maxAttempts; }
    public long getBaseDelayMillis() { return baseDelayMillis; }

    // attempt is 1-based; the first attempt never waits, then base, 2*base, 4*base ...
    public long delayBeforeAttempt(int attempt)
    {
        if (attempt <= 1 || baseDelayMillis == 0) {
            return 0L;
        }
        int shift = Math.min(attempt - 2, 20);
        return baseDelayMillis << shift;
    }

    public boolean hasAttemptsLeft(int attemptsMade)
    {
        return attemptsMade < maxAttempts;
    }

    /**
     * Server-side trouble and throttling are worth retrying on the same
     * URL; any other status will not change by asking again.
     */
    public static boolean isRetryableStatus(int status)
    {
        return status >= 500 || status == 429;
    }

    void pauseBefore(int attempt) throws InterruptedException
    {
        long delay = delayBeforeAttempt(attempt);
        if (delay > 0) {
            Thread.sleep(delay);
        }
    }

    @Override
    public String toString()
    {
        return "RetryPolicy(maxAttempts=" + maxAttempts + ", baseDelayMillis=" + baseDelayMillis + ")";
    }

} // RetryPolicy
