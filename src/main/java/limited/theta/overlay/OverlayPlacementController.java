// OverlayPlacementController.java
// drives one raster overlay from reference to pixels:
// Idle -> Locating -> Fetching -> Decoding -> Rendered | Fallback | Failed
// one controller per raster resource on screen

package limited.theta.overlay;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class OverlayPlacementController
{
    private static final Logger log = LoggerFactory.getLogger(OverlayPlacementController.class);

    private final FetchEngine engine;
    private final ResourceLocator locator;
    private final ChunkReassembler reassembler;
    private final GeoTiffDecoder decoder;
    private final RasterCompositor compositor;
    private final FallbackVisualizer visualizer;
    private final Clock clock;

    private volatile OverlayStateListener listener = OverlayStateListener.NONE;
    private volatile ProgressListener progressListener = ProgressListener.NONE;

    // everything below is guarded by this
    private OverlayState state = OverlayState.idle();
    private Object target;                 // ResourceReference or ChunkGroup
    private long generation;
    private CompletableFuture<FetchOutcome> inFlight;
    private CompletableFuture<OverlayState> settled = CompletableFuture.completedFuture(OverlayState.idle());
    private CandidateUrlSet lastCandidates = CandidateUrlSet.empty();
    private RasterPipelineException lastFailure;
    private RasterDescriptor lastDescriptor;
    private List<GeoLocationRecord> knownLocations = new ArrayList<>();
    private double viewLon;
    private double viewLat;

    public OverlayPlacementController(FetchEngine engine, ResourceLocator locator, GeoTiffDecoder decoder,
                                      RasterCompositor compositor, FallbackVisualizer visualizer, Clock clock)
    {
        this.engine = engine;
        this.locator = locator;
        this.reassembler = new ChunkReassembler(engine, locator);
        this.decoder = decoder;
        this.compositor = compositor;
        this.visualizer = visualizer;
        this.clock = clock;
    }

    /** Controller over the given engine with every other part configured from {@code config}. */
    public static OverlayPlacementController create(FetchEngine engine, PipelineConfig config)
    {
        return new OverlayPlacementController(engine, new ResourceLocator(config), new GeoTiffDecoder(),
                                              new RasterCompositor(), new FallbackVisualizer(config),
                                              Clock.systemUTC());
    }

    public void setListener(OverlayStateListener listener)
    {
        this.listener = listener == null ? OverlayStateListener.NONE : listener;
    }

    public void setProgressListener(ProgressListener progressListener)
    {
        this.progressListener = progressListener == null ? ProgressListener.NONE : progressListener;
    }

    /** Image locations of the same booking; used to size a fallback polygon. */
    public synchronized void setKnownLocations(Collection<GeoLocationRecord> locations)
    {
        this.knownLocations = locations == null ? new ArrayList<>() : new ArrayList<>(locations);
    }

    public synchronized void setViewCenter(double lon, double lat)
    {
        this.viewLon = lon;
        this.viewLat = lat;
    }

    public synchronized OverlayState state()
    {
        return state;
    }

    public synchronized RasterDescriptor getLastDescriptor()
    {
        return lastDescriptor;
    }

    public synchronized RasterPipelineException getLastFailure()
    {
        return lastFailure;
    }

    /**
     * Completes with the next terminal state of the current run, or with
     * IDLE if the run is discarded first. Already settled runs complete
     * immediately.
     */
    public synchronized CompletableFuture<OverlayState> whenSettled()
    {
        return settled;
    }

    /**
     * Starts placing a raster. Ignored while a run is in flight (the
     * running attempt is kept) and when the same reference already
     * reached a terminal state; use {@link #retry()} for that.
     *
     * @return true if a new run was started
     */
    public boolean trigger(ResourceReference ref)
    {
        return triggerTarget(ref);
    }

    /** Same as {@link #trigger(ResourceReference)} for a chunked upload. */
    public boolean trigger(ChunkGroup group)
    {
        return triggerTarget(group);
    }

    /** User-initiated restart from a terminal state with the same reference. */
    public boolean retry()
    {
        long gen;
        CompletableFuture<FetchOutcome> fetch;
        synchronized (this) {
            if (!state.isTerminal() || target == null) {
                return false;
            }
            log.info("Retrying {}", target);
            gen = begin(target);
            fetch = inFlight;
        }
        notifyListener(OverlayState.locating());
        advanceToFetching(gen, fetch);
        return true;
    }

    /**
     * Abandons the current run. A fetch still on the wire is cancelled
     * and whatever it eventually produces is ignored.
     */
    public void discard()
    {
        synchronized (this) {
            generation++;
            if (inFlight != null) {
                inFlight.cancel(true);
                inFlight = null;
            }
            target = null;
            state = OverlayState.idle();
            settled.complete(state);
            settled = CompletableFuture.completedFuture(state);
        }
        notifyListener(OverlayState.idle());
    }

    private boolean triggerTarget(Object newTarget)
    {
        if (newTarget == null) {
            return false;
        }
        long gen;
        CompletableFuture<FetchOutcome> fetch;
        synchronized (this) {
            if (state.isInFlight()) {
                log.debug("Already {} for {}; trigger coalesced", state, target);
                return false;
            }
            if (state.isTerminal() && newTarget.equals(target)) {
                log.debug("{} already settled as {}", newTarget, state.getPhase());
                return false;
            }
            gen = begin(newTarget);
            fetch = inFlight;
        }
        notifyListener(OverlayState.locating());
        advanceToFetching(gen, fetch);
        return true;
    }

    // called holding the lock; the caller tells the listener about LOCATING
    // and only then lets the run advance
    private long begin(Object newTarget)
    {
        long gen = ++generation;
        target = newTarget;
        lastFailure = null;
        lastDescriptor = null;
        settled = new CompletableFuture<>();
        state = OverlayState.locating();

        CompletableFuture<FetchOutcome> fetch;
        if (newTarget instanceof ChunkGroup) {
            ChunkGroup group = (ChunkGroup) newTarget;
            ResourceReference first = group.getFirst();
            lastCandidates = first == null ? CandidateUrlSet.empty() : locator.generateCandidates(first);
            fetch = reassembler.reassemble(group, progressListener);
        } else {
            lastCandidates = locator.generateCandidates((ResourceReference) newTarget);
            fetch = engine.fetch(lastCandidates, ContentTypes.GEOTIFF_ACCEPT, progressListener);
        }
        inFlight = fetch;
        return gen;
    }

    // the fetch may already be done; the FETCHING transition must land first
    private void advanceToFetching(long gen, CompletableFuture<FetchOutcome> fetch)
    {
        if (moveTo(gen, OverlayState.fetching())) {
            fetch.whenCompleteAsync((outcome, error) -> onFetched(gen, outcome, error), engine.executor());
        }
    }

    private void onFetched(long gen, FetchOutcome outcome, Throwable error)
    {
        if (error != null) {
            Throwable cause = unwrap(error);
            if (cause instanceof CancellationException) {
                return; // discarded; nothing to report
            }
            RasterPipelineException failure = cause instanceof RasterPipelineException
                ? (RasterPipelineException) cause
                : new RasterPipelineException(ErrorKind.FETCH_FAILURE, String.valueOf(cause.getMessage()), cause);
            fetchFailed(gen, failure);
            return;
        }

        if (!moveTo(gen, OverlayState.decoding())) {
            return;
        }
        try {
            DecodedRaster raster = decoder.decode(outcome.getPayload());
            PixelBuffer buffer = compositor.composite(raster);
            synchronized (this) {
                if (gen == generation) {
                    lastDescriptor = raster.getDescriptor();
                }
            }
            moveTo(gen, OverlayState.rendered(buffer));
        }
        catch (RasterFormatException e) {
            log.warn("Could not decode raster from {}: {}", SignedUrls.redact(outcome.getSucceededUrl()), e.getMessage());
            decodeFailed(gen, e);
        }
        catch (RuntimeException e) {
            // the run must still settle or it would stay in DECODING for good
            log.error("Decoding raster from {} failed unexpectedly", SignedUrls.redact(outcome.getSucceededUrl()), e);
            decodeFailed(gen, new RasterFormatException(ErrorKind.CORRUPT_PAYLOAD,
                                                        "raster could not be decoded: " + e, e));
        }
    }

    private void decodeFailed(long gen, RasterFormatException failure)
    {
        recordFailure(gen, failure);
        moveTo(gen, OverlayState.fallback(fallbackPolygon(), FallbackReason.UNDECODABLE_FORMAT,
                                          failure.getKind(), failure.getMessage()));
    }

    private void fetchFailed(long gen, RasterPipelineException failure)
    {
        recordFailure(gen, failure);
        boolean unrecoverable = (failure instanceof ReassemblyFailedException
                                 && ((ReassemblyFailedException) failure).isMalformedGroup())
            || (failure instanceof FetchFailedException
                && ((FetchFailedException) failure).getAttempts().isEmpty());
        if (unrecoverable) {
            log.error("Raster cannot be placed: {}", failure.getMessage());
            moveTo(gen, OverlayState.failed(failure.getKind(), failure.getMessage()));
        } else {
            log.warn("Raster fetch failed, showing estimated coverage: {}", failure.getMessage());
            moveTo(gen, OverlayState.fallback(fallbackPolygon(), FallbackReason.FETCH_FAILED,
                                              failure.getKind(), failure.getMessage()));
        }
    }

    private synchronized void recordFailure(long gen, RasterPipelineException failure)
    {
        if (gen == generation) {
            lastFailure = failure;
        }
    }

    private synchronized CornerQuad fallbackPolygon()
    {
        return visualizer.polygon(knownLocations, viewLon, viewLat);
    }

    // applies the state if the run is still current, then tells the listener
    private boolean moveTo(long gen, OverlayState next)
    {
        CompletableFuture<OverlayState> toComplete = null;
        synchronized (this) {
            if (gen != generation) {
                return false;
            }
            state = next;
            if (next.isTerminal()) {
                inFlight = null;
                toComplete = settled;
            }
        }
        log.debug("Overlay state -> {}", next);
        notifyListener(next);
        if (toComplete != null) {
            toComplete.complete(next);
        }
        return true;
    }

    private void notifyListener(OverlayState s)
    {
        try {
            listener.onStateChanged(s);
        }
        catch (RuntimeException e) {
            log.warn("Overlay state listener failed", e);
        }
    }

    /**
     * Report on the last failure: redacted original URL, every candidate
     * tried and what happened at each step.
     */
    public synchronized DiagnosticReport diagnosticReport()
    {
        return DiagnosticReport.build(originalUrl(), lastCandidates, lastFailure, null, clock.instant());
    }

    /** Like {@link #diagnosticReport()} but probes every candidate first. */
    public CompletableFuture<DiagnosticReport> probeAndReport()
    {
        CandidateUrlSet candidates;
        synchronized (this) {
            candidates = lastCandidates;
        }
        return engine.probe(candidates).thenApply(probes -> {
            synchronized (this) {
                return DiagnosticReport.build(originalUrl(), lastCandidates, lastFailure, probes, clock.instant());
            }
        });
    }

    private String originalUrl()
    {
        if (target instanceof ResourceReference) {
            return ((ResourceReference) target).getPrimaryUrl();
        }
        if (target instanceof ChunkGroup && ((ChunkGroup) target).getFirst() != null) {
            return ((ChunkGroup) target).getFirst().getPrimaryUrl();
        }
        return lastCandidates.getOriginal();
    }

    /**
     * Fetches the current resource again, untouched by decoding, and
     * writes it into {@code directory}. The overlay state is not changed.
     */
    public CompletableFuture<Path> downloadOriginal(Path directory)
    {
        Object current;
        synchronized (this) {
            current = target;
        }
        if (current == null) {
            CompletableFuture<Path> none = new CompletableFuture<>();
            none.completeExceptionally(new IllegalStateException("no resource to download"));
            return none;
        }

        CompletableFuture<FetchOutcome> fetch;
        String fileName;
        if (current instanceof ChunkGroup) {
            fetch = reassembler.reassemble((ChunkGroup) current);
            fileName = ((ChunkGroup) current).displayFileName();
        } else {
            ResourceReference ref = (ResourceReference) current;
            fetch = engine.fetch(locator.generateCandidates(ref), ContentTypes.BINARY);
            fileName = ref.getFileName();
        }
        String safeName = sanitizeFileName(fileName);
        return fetch.thenApply(outcome -> {
            try {
                Files.createDirectories(directory);
                Path file = Files.write(directory.resolve(safeName), outcome.getPayload());
                log.info("Saved original {} ({} bytes)", file, outcome.getPayload().length);
                return file;
            }
            catch (IOException e) {
                throw new CompletionException(e);
            }
        });
    }

    /** Replaces characters that are unsafe in file names with '-'. */
    public static String sanitizeFileName(String name)
    {
        if (name == null || name.trim().isEmpty()) {
            return "raster.tif";
        }
        return name.trim().replaceAll("[/\\\\?%*:|\"<>]", "-");
    }

    static Throwable unwrap(Throwable t)
    {
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

} // OverlayPlacementController
