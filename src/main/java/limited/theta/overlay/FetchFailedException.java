// FetchFailedException.java

package limited.theta.overlay;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Every candidate URL was exhausted. Carries the redacted URLs that were
 * tried, in order, and the log of each failed attempt so the caller can
 * offer a retry, a fallback visualization or a diagnostic export.
 */
public class FetchFailedException extends RasterPipelineException
{
    private final String originalUrl;
    private final List<String> attemptedUrls;
    private final List<FetchAttempt> attempts;

    public FetchFailedException(String originalUrl, List<FetchAttempt> attempts)
    {
        super(ErrorKind.FETCH_FAILURE, buildMessage(originalUrl, attempts));
        this.originalUrl = SignedUrls.redact(originalUrl);
        this.attempts = Collections.unmodifiableList(new ArrayList<>(attempts));

        LinkedHashSet<String> urls = new LinkedHashSet<>();
        for (FetchAttempt a : attempts) {
            urls.add(a.getUrl());
        }
        this.attemptedUrls = Collections.unmodifiableList(new ArrayList<>(urls));
    }

    public String getOriginalUrl() { return originalUrl; }
    public List<String> getAttemptedUrls() { return attemptedUrls; }
    public List<FetchAttempt> getAttempts() { return attempts; }

    public FetchAttempt getLastAttempt()
    {
        return attempts.isEmpty() ? null : attempts.get(attempts.size() - 1);
    }

    private static String buildMessage(String originalUrl, List<FetchAttempt> attempts)
    {
        String msg = "All " + attempts.size() + " fetch attempts failed for "
            + SignedUrls.redact(originalUrl);
        if (!attempts.isEmpty()) {
            msg += "; last error: " + attempts.get(attempts.size() - 1).getMessage();
        }
        return msg;
    }

} // FetchFailedException
