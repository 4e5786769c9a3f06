// FetchEngine.java
// tries candidate URLs in order, each under its own retry policy, and
// hands back the first usable binary response; work runs on a small
// worker pool and completes a future, the blocking variant is the same
// loop run on the caller's thread

package limited.theta.overlay;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FetchEngine implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(FetchEngine.class);

    private final HttpTransport transport;
    private final RetryPolicy retryPolicy;
    private final FailedUrlCache failedUrls;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    public FetchEngine(HttpTransport transport, RetryPolicy retryPolicy, FailedUrlCache failedUrls, int threads)
    {
        this(transport, retryPolicy, failedUrls, Executors.newFixedThreadPool(threads, workerThreads()), true);
    }

    public FetchEngine(HttpTransport transport, RetryPolicy retryPolicy, FailedUrlCache failedUrls,
                       ExecutorService executor, boolean ownsExecutor)
    {
        this.transport = transport;
        this.retryPolicy = retryPolicy;
        this.failedUrls = failedUrls;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    /** Engine over the real HTTP transport, sized and timed from the config. */
    public static FetchEngine create(PipelineConfig config)
    {
        return new FetchEngine(new HttpUrlConnectionTransport(config), config.retryPolicy(),
                               FailedUrlCache.fromConfig(config), config.getFetchThreads());
    }

    public FailedUrlCache getFailedUrls() { return failedUrls; }
    public RetryPolicy getRetryPolicy() { return retryPolicy; }

    Executor executor()
    {
        return executor;
    }

    public CompletableFuture<FetchOutcome> fetch(CandidateUrlSet candidates, String accept)
    {
        return fetch(candidates, accept, ProgressListener.NONE);
    }

    /**
     * Asynchronous fetch. Cancelling the returned future stops the
     * engine before its next attempt; an attempt already on the wire
     * runs to completion but its result is dropped.
     */
    public CompletableFuture<FetchOutcome> fetch(CandidateUrlSet candidates, String accept,
                                                 ProgressListener progress)
    {
        CompletableFuture<FetchOutcome> future = new CompletableFuture<>();
        executor.execute(new Runnable() {
            @Override
            public void run()
            {
                try {
                    FetchOutcome outcome = fetchBlocking(candidates, accept, progress, future::isDone);
                    future.complete(outcome);
                }
                catch (Exception e) {
                    future.completeExceptionally(e);
                }
            } // run
        });
        return future;
    }

    /**
     * Runs the candidate loop on the calling thread.
     *
     * @param abandoned checked before every attempt; once true the loop
     *        stops with a {@link CancellationException}
     * @throws FetchFailedException when every candidate is exhausted
     */
    public FetchOutcome fetchBlocking(CandidateUrlSet candidates, String accept, ProgressListener progress,
                                      BooleanSupplier abandoned) throws FetchFailedException
    {
        List<FetchAttempt> attempts = new ArrayList<>();
        List<String> urls = candidates.asList();
        MonotonicProgress monotonic = new MonotonicProgress(progress);
        // the transport's own 100 only means that response is complete; it may still be rejected
        ProgressListener beforeAcceptance = percent -> {
            if (percent < 100) {
                monotonic.onProgress(percent);
            }
        };

        boolean skipCached = failedUrls != null && !allRecentlyFailed(urls);

        for (String url : urls) {
            if (skipCached && failedUrls.isRecentlyFailed(url)) {
                attempts.add(new FetchAttempt(url, 0, FetchAttempt.NO_STATUS, "skipped, failed recently"));
                log.debug("Skipping recently failed {}", SignedUrls.redact(url));
                continue;
            }

            int attemptsMade = 0;
            while (retryPolicy.hasAttemptsLeft(attemptsMade)) {
                if (abandoned.getAsBoolean()) {
                    throw new CancellationException("fetch abandoned");
                }
                attemptsMade++;
                pause(attemptsMade);

                try {
                    TransportResponse response = transport.get(url, accept, beforeAcceptance);
                    if (response.isSuccess()) {
                        String problem = ContentTypes.rejectReason(accept, response.getContentType(),
                                                                   response.getBody());
                        if (problem == null) {
                            if (failedUrls != null) {
                                failedUrls.forget(url);
                            }
                            log.info("Fetched {} bytes from {}", response.getBody().length,
                                     SignedUrls.redact(url));
                            monotonic.onProgress(100);
                            return new FetchOutcome(url, response.getBody(), response.getContentType());
                        }
                        attempts.add(new FetchAttempt(url, attemptsMade, response.getStatus(), problem));
                        log.warn("Rejected response from {}: {}", SignedUrls.redact(url), problem);
                        break;
                    }

                    int status = response.getStatus();
                    attempts.add(new FetchAttempt(url, attemptsMade, status, "HTTP " + status));
                    log.warn("Attempt {} on {} returned HTTP {}", attemptsMade, SignedUrls.redact(url), status);
                    if (!RetryPolicy.isRetryableStatus(status)) {
                        break;
                    }
                }
                catch (IOException e) {
                    attempts.add(new FetchAttempt(url, attemptsMade, FetchAttempt.NO_STATUS, describe(e)));
                    log.warn("Attempt {} on {} failed: {}", attemptsMade, SignedUrls.redact(url), describe(e));
                }
            }

            if (failedUrls != null) {
                failedUrls.markFailed(url);
            }
        }

        FetchFailedException failure = new FetchFailedException(candidates.getOriginal(), attempts);
        log.error(failure.getMessage());
        throw failure;
    }

    /**
     * Existence check across all candidates without downloading them.
     * Uses neither the retry budget nor the failed-URL cache.
     */
    public CompletableFuture<List<ProbeResult>> probe(CandidateUrlSet candidates)
    {
        return CompletableFuture.supplyAsync(() -> probeBlocking(candidates), executor);
    }

    public List<ProbeResult> probeBlocking(CandidateUrlSet candidates)
    {
        List<ProbeResult> results = new ArrayList<>();
        for (String url : candidates) {
            results.add(probeOne(url));
        }
        return results;
    }

    /** First reachable URL of a probe run, or null. */
    public static String firstReachable(List<ProbeResult> results)
    {
        for (ProbeResult r : results) {
            if (r.isReachable()) {
                return r.getUrl();
            }
        }
        return null;
    }

    private ProbeResult probeOne(String url)
    {
        try {
            TransportResponse head = transport.head(url);
            if (head.isSuccess()) {
                return new ProbeResult(url, true, head.getStatus(), head.getContentType(),
                                       head.getContentLength(), false, null);
            }
            if (head.getStatus() != 403) {
                return new ProbeResult(url, false, head.getStatus(), head.getContentType(),
                                       head.getContentLength(), false, "HEAD refused");
            }

            // some stores sign URLs for GET only, so HEAD is forbidden while reads work
            TransportResponse range = transport.probeRange(url);
            boolean ok = range.isSuccess();
            return new ProbeResult(url, ok, range.getStatus(), range.getContentType(),
                                   range.getContentLength(), true,
                                   ok ? "HEAD forbidden, ranged GET allowed" : "HEAD and ranged GET refused");
        }
        catch (IOException e) {
            return new ProbeResult(url, false, FetchAttempt.NO_STATUS, null, -1L, false, describe(e));
        }
    }

    private boolean allRecentlyFailed(List<String> urls)
    {
        if (urls.isEmpty()) {
            return false;
        }
        for (String url : urls) {
            if (!failedUrls.isRecentlyFailed(url)) {
                return false;
            }
        }
        return true;
    }

    private void pause(int attempt)
    {
        try {
            retryPolicy.pauseBefore(attempt);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("fetch interrupted while backing off");
        }
    }

    private static String describe(IOException e)
    {
        String msg = e.getMessage();
        return msg == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + msg;
    }

    @Override
    public void close()
    {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    private static ThreadFactory workerThreads()
    {
        AtomicInteger count = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "raster-fetch-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // a retried attempt restarts its byte count; listeners only ever see increases
    private static final class MonotonicProgress implements ProgressListener
    {
        private final ProgressListener delegate;
        private int last = -1;

        MonotonicProgress(ProgressListener delegate)
        {
            this.delegate = delegate == null ? ProgressListener.NONE : delegate;
        }

        @Override
        public synchronized void onProgress(int percent)
        {
            if (percent > last) {
                last = percent;
                delegate.onProgress(percent);
            }
        }
    }

} // FetchEngine
