// OverlayPlacementControllerTest.java

package limited.theta.overlay;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OverlayPlacementControllerTest
{
    private static final String REGIONAL = "https://bucket.s3.eu-north-1.amazonaws.com/maps/Ortho%281%29.tif";
    private static final String GLOBAL = "https://bucket.s3.amazonaws.com/maps/Ortho%281%29.tif";
    private static final String DECODED = "https://bucket.s3.eu-north-1.amazonaws.com/maps/Ortho(1).tif";
    private static final String HOST = "https://files.example.org/uploads/";

    private final ScriptedTransport transport = new ScriptedTransport();
    private final FetchEngine engine = new FetchEngine(transport, RetryPolicy.once(), new FailedUrlCache(16, 60_000L), 2);
    private final OverlayPlacementController controller = new OverlayPlacementController(
        engine, new ResourceLocator("eu-north-1"), new GeoTiffDecoder(), new RasterCompositor(),
        new FallbackVisualizer(0.001, 0.01), Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC));
    private final List<OverlayPhase> phases = Collections.synchronizedList(new ArrayList<>());

    OverlayPlacementControllerTest()
    {
        controller.setListener(state -> phases.add(state.getPhase()));
    }

    @AfterEach
    void tearDown()
    {
        transport.release();
        engine.close();
    }

    private OverlayState settle()
        throws Exception
    {
        return controller.whenSettled().get(5, TimeUnit.SECONDS);
    }

    @Test
    void walksThroughCandidatesAndFallsBackOnAnUnsupportedLayout()
        throws Exception
    {
        transport.onGet(REGIONAL, ScriptedTransport.status(403))
                 .onGet(GLOBAL, ScriptedTransport.status(404))
                 .onGet(DECODED, ScriptedTransport.tiff(GeoTiffFixtures.builder(2, 2, 2).fill(5).build()));

        assertTrue(controller.trigger(ResourceReference.of(REGIONAL)));
        OverlayState state = settle();

        assertEquals(OverlayPhase.FALLBACK, state.getPhase());
        assertEquals(FallbackReason.UNDECODABLE_FORMAT, state.getFallbackReason());
        assertTrue(state.getReason().contains("format"));
        assertFalse(state.getReason().contains("network"));
        assertEquals(ErrorKind.UNSUPPORTED_FORMAT, state.getErrorKind());
        assertTrue(state.canDownloadOriginal());
        assertFalse(state.canExportDiagnostics());
        assertEquals(List.of(OverlayPhase.LOCATING, OverlayPhase.FETCHING, OverlayPhase.DECODING,
                             OverlayPhase.FALLBACK), new ArrayList<>(phases));
        assertEquals(List.of("GET " + REGIONAL, "GET " + GLOBAL, "GET " + DECODED), transport.requests());
    }

    @Test
    void secondTriggerWhileFetchingIsCoalesced()
        throws Exception
    {
        String url = HOST + "ortho.tif";
        transport.onGet(url, ScriptedTransport.tiff(GeoTiffFixtures.grey(2, 2, 100)));
        transport.hold();

        ResourceReference ref = ResourceReference.of(url);
        assertTrue(controller.trigger(ref));
        assertFalse(controller.trigger(ref));
        assertFalse(controller.trigger(ResourceReference.of(HOST + "other.tif")));
        transport.release();

        assertEquals(OverlayPhase.RENDERED, settle().getPhase());
        assertEquals(1, transport.count("GET", url));
        assertEquals(0, transport.count("GET", HOST + "other.tif"));
    }

    @Test
    void renderedRasterIsKeptUntilRetry()
        throws Exception
    {
        String url = HOST + "ortho.tif";
        transport.onGet(url, ScriptedTransport.tiff(GeoTiffFixtures.grey(2, 2, 100)));
        ResourceReference ref = ResourceReference.of(url);

        assertTrue(controller.trigger(ref));
        OverlayState state = settle();
        assertEquals(OverlayPhase.RENDERED, state.getPhase());
        assertEquals(2, state.getPixelBuffer().getWidth());
        assertArrayEquals(new int[] {100, 100, 100, 255}, state.getPixelBuffer().pixel(1, 1));
        assertEquals(new BoundingBox(-1, 50, 1, 52), controller.getLastDescriptor().getBoundingBox());

        assertFalse(controller.trigger(ref), "same reference already rendered");
        assertEquals(1, transport.count("GET", url));

        assertTrue(controller.retry());
        assertEquals(OverlayPhase.RENDERED, settle().getPhase());
        assertEquals(2, transport.count("GET", url));
    }

    @Test
    void retryNeedsATerminalState()
    {
        assertFalse(controller.retry());
        transport.hold();
        controller.trigger(ResourceReference.of(HOST + "slow.tif"));
        assertFalse(controller.retry());
    }

    @Test
    void exhaustedFetchShowsEstimatedCoverage()
        throws Exception
    {
        controller.setKnownLocations(List.of(
            GeoLocationRecord.at("u1", "IMG_1.JPG", 50.0, -1.0),
            GeoLocationRecord.at("u2", "IMG_2.JPG", 52.0, 1.0)));

        assertTrue(controller.trigger(ResourceReference.of(HOST + "missing.tif")));
        OverlayState state = settle();

        assertEquals(OverlayPhase.FALLBACK, state.getPhase());
        assertEquals(FallbackReason.FETCH_FAILED, state.getFallbackReason());
        assertEquals(ErrorKind.FETCH_FAILURE, state.getErrorKind());
        assertTrue(state.canExportDiagnostics());
        assertTrue(state.canRetry());

        CornerQuad polygon = state.getPolygon();
        assertEquals(-1.001, polygon.longitude(CornerQuad.TOP_LEFT), 1e-9);
        assertEquals(52.001, polygon.latitude(CornerQuad.TOP_LEFT), 1e-9);
        assertEquals(1.001, polygon.longitude(CornerQuad.BOTTOM_RIGHT), 1e-9);
        assertEquals(49.999, polygon.latitude(CornerQuad.BOTTOM_RIGHT), 1e-9);

        DiagnosticReport report = controller.diagnosticReport();
        assertEquals(ErrorKind.FETCH_FAILURE, report.getErrorKind());
        assertEquals(HOST + "missing.tif", report.getOriginalUrl());
        assertEquals(1, report.getAttempts().size());
        assertTrue(report.getRecommendations().stream().anyMatch(r -> r.contains("404")));
        assertEquals(Instant.parse("2024-06-01T12:00:00Z"), report.getGeneratedAt());
    }

    @Test
    void fallbackWithoutKnownLocationsSurroundsTheViewCentre()
        throws Exception
    {
        controller.setViewCenter(10.0, 45.0);
        controller.trigger(ResourceReference.of(HOST + "missing.tif"));
        CornerQuad polygon = settle().getPolygon();
        assertEquals(9.99, polygon.longitude(CornerQuad.TOP_LEFT), 1e-9);
        assertEquals(45.01, polygon.latitude(CornerQuad.TOP_LEFT), 1e-9);
    }

    @Test
    void referenceWithoutUrlFails()
        throws Exception
    {
        assertTrue(controller.trigger(ResourceReference.of("")));
        OverlayState state = settle();
        assertEquals(OverlayPhase.FAILED, state.getPhase());
        assertEquals(ErrorKind.FETCH_FAILURE, state.getErrorKind());
        assertTrue(state.canExportDiagnostics());
        assertTrue(transport.requests().isEmpty());
    }

    @Test
    void malformedChunkGroupFails()
        throws Exception
    {
        ChunkGroup group = new ChunkGroup("ghost", List.of(ResourceReference.of(""), ResourceReference.of(null)),
                                          List.of(0, 1));
        assertTrue(controller.trigger(group));
        OverlayState state = settle();
        assertEquals(OverlayPhase.FAILED, state.getPhase());
        assertEquals(ErrorKind.REASSEMBLY_FAILURE, state.getErrorKind());
        assertTrue(controller.getLastFailure() instanceof ReassemblyFailedException);
    }

    @Test
    void chunkedUploadIsReassembledAndRendered()
        throws Exception
    {
        byte[] tiff = GeoTiffFixtures.builder(3, 2, 3).fill(40).build();
        int split = tiff.length / 2;
        transport.onGet(HOST + "survey_part0.tif",
                        ScriptedTransport.ok(Arrays.copyOfRange(tiff, 0, split), ContentTypes.BINARY))
                 .onGet(HOST + "survey_part1.tif",
                        ScriptedTransport.ok(Arrays.copyOfRange(tiff, split, tiff.length), ContentTypes.BINARY));

        ChunkGroup group = ChunkReassembler.identifyGroups(List.of(
            ResourceReference.of(HOST + "survey_part1.tif"),
            ResourceReference.of(HOST + "survey_part0.tif"))).get(0);
        assertTrue(controller.trigger(group));

        OverlayState state = settle();
        assertEquals(OverlayPhase.RENDERED, state.getPhase());
        assertEquals(3, state.getPixelBuffer().getWidth());
        assertEquals(2, state.getPixelBuffer().getHeight());
    }

    @Test
    void discardIgnoresTheLateResult()
        throws Exception
    {
        String url = HOST + "ortho.tif";
        transport.onGet(url, ScriptedTransport.tiff(GeoTiffFixtures.grey(2, 2, 1)));
        transport.hold();

        controller.trigger(ResourceReference.of(url));
        CompletableFuture<OverlayState> settled = controller.whenSettled();
        controller.discard();

        assertEquals(OverlayPhase.IDLE, settled.get(5, TimeUnit.SECONDS).getPhase());
        transport.release();
        Thread.sleep(200);

        assertEquals(OverlayPhase.IDLE, controller.state().getPhase());
        assertEquals(OverlayPhase.IDLE, phases.get(phases.size() - 1));
        assertNull(controller.getLastDescriptor());
    }

    @Test
    void downloadsTheUndecodedOriginal(@TempDir Path dir)
        throws Exception
    {
        byte[] twoBand = GeoTiffFixtures.builder(2, 2, 2).build();
        transport.onGet(REGIONAL, ScriptedTransport.tiff(twoBand));

        controller.trigger(ResourceReference.of(REGIONAL));
        assertEquals(OverlayPhase.FALLBACK, settle().getPhase());

        Path saved = controller.downloadOriginal(dir).get(5, TimeUnit.SECONDS);
        assertEquals(dir.resolve("Ortho(1).tif"), saved);
        assertArrayEquals(twoBand, Files.readAllBytes(saved));
        assertEquals(OverlayPhase.FALLBACK, controller.state().getPhase());
    }

    @Test
    void downloadWithoutResourceFails()
    {
        CompletableFuture<Path> none = controller.downloadOriginal(Path.of("unused"));
        assertTrue(none.isCompletedExceptionally());
    }

    @Test
    void unsafeFileNameCharactersAreReplaced()
    {
        assertEquals("a-b-c-.tif", OverlayPlacementController.sanitizeFileName("a/b\\c?.tif"));
        assertEquals("Ortho(1) final.tif", OverlayPlacementController.sanitizeFileName(" Ortho(1) final.tif "));
        assertEquals("raster.tif", OverlayPlacementController.sanitizeFileName("  "));
        assertEquals("raster.tif", OverlayPlacementController.sanitizeFileName(null));
    }

    @Test
    void failingListenerDoesNotStopTheRun()
        throws Exception
    {
        controller.setListener(state -> { throw new IllegalStateException("listener bug"); });
        transport.onGet(HOST + "ortho.tif", ScriptedTransport.tiff(GeoTiffFixtures.grey(1, 1, 3)));
        controller.trigger(ResourceReference.of(HOST + "ortho.tif"));
        assertEquals(OverlayPhase.RENDERED, settle().getPhase());
    }

    @Test
    void overflowingGeoreferencingSettlesInFallback()
        throws Exception
    {
        String url = HOST + "huge.tif";
        transport.onGet(url, ScriptedTransport.tiff(
            GeoTiffFixtures.builder(2, 2, 1).placement(-1, 52, Double.MAX_VALUE, 1.0).build()));

        controller.trigger(ResourceReference.of(url));
        OverlayState state = settle();
        assertEquals(OverlayPhase.FALLBACK, state.getPhase());
        assertEquals(ErrorKind.MISSING_GEOREFERENCING, state.getErrorKind());
        assertTrue(controller.retry());
    }

    @Test
    void unexpectedCompositorErrorStillSettles()
        throws Exception
    {
        RasterCompositor broken = new RasterCompositor() {
            @Override
            public PixelBuffer composite(DecodedRaster raster)
            {
                throw new IllegalStateException("compositor bug");
            }
        };
        OverlayPlacementController fragile = new OverlayPlacementController(
            engine, new ResourceLocator("eu-north-1"), new GeoTiffDecoder(), broken,
            new FallbackVisualizer(0.001, 0.01), Clock.systemUTC());
        String url = HOST + "ortho.tif";
        transport.onGet(url, ScriptedTransport.tiff(GeoTiffFixtures.grey(2, 2, 10)));

        assertTrue(fragile.trigger(ResourceReference.of(url)));
        OverlayState state = fragile.whenSettled().get(5, TimeUnit.SECONDS);

        assertEquals(OverlayPhase.FALLBACK, state.getPhase());
        assertEquals(FallbackReason.UNDECODABLE_FORMAT, state.getFallbackReason());
        assertEquals(ErrorKind.CORRUPT_PAYLOAD, state.getErrorKind());
        assertTrue(state.getDetail().contains("compositor bug"));
        assertTrue(fragile.getLastFailure().getCause() instanceof IllegalStateException);
        assertTrue(fragile.retry(), "a settled run can be retried");
        assertEquals(OverlayPhase.FALLBACK, fragile.whenSettled().get(5, TimeUnit.SECONDS).getPhase());
    }

    @Test
    void chunkedUploadReportsProgress()
        throws Exception
    {
        byte[] tiff = GeoTiffFixtures.grey(2, 2, 30);
        int split = tiff.length / 2;
        transport.onGet(HOST + "survey_part0.tif",
                        ScriptedTransport.ok(Arrays.copyOfRange(tiff, 0, split), ContentTypes.BINARY))
                 .onGet(HOST + "survey_part1.tif",
                        ScriptedTransport.ok(Arrays.copyOfRange(tiff, split, tiff.length), ContentTypes.BINARY));
        List<Integer> progress = Collections.synchronizedList(new ArrayList<>());
        controller.setProgressListener(progress::add);

        controller.trigger(ChunkReassembler.identifyGroups(List.of(
            ResourceReference.of(HOST + "survey_part0.tif"),
            ResourceReference.of(HOST + "survey_part1.tif"))).get(0));

        assertEquals(OverlayPhase.RENDERED, settle().getPhase());
        assertFalse(progress.isEmpty());
        assertEquals(100, progress.get(progress.size() - 1).intValue());
    }

} // OverlayPlacementControllerTest
