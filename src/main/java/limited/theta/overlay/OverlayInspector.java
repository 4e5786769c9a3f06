// OverlayInspector.java
// command line check of a GeoTIFF overlay: decode a local file, or run
// a URL through the whole pipeline and print where it would be placed
// run via:
// java -cp raster-overlay.jar limited.theta.overlay.OverlayInspector <url-or-file> [--probe] [--report <file>]

package limited.theta.overlay;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class OverlayInspector
{
    static final int EXIT_RENDERED = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_FALLBACK = 2;
    static final int EXIT_USAGE = 64;

    private static final long SETTLE_TIMEOUT_MINUTES = 10;

    private final PipelineConfig config;
    private final FetchEngine engine;

    public OverlayInspector(PipelineConfig config, FetchEngine engine)
    {
        this.config = config;
        this.engine = engine;
    }

    public static void main(String[] args)
    {
        PipelineConfig config = PipelineConfig.load();
        int code;
        try (FetchEngine engine = FetchEngine.create(config)) {
            code = new OverlayInspector(config, engine).run(args, System.out, System.err);
        }
        System.exit(code);
    }

    public int run(String[] args, PrintStream out, PrintStream err)
    {
        String source = null;
        boolean probe = false;
        Path report = null;
        for (int i = 0; i < args.length; i++) {
            if ("--probe".equals(args[i])) {
                probe = true;
            } else if ("--report".equals(args[i]) && i + 1 < args.length) {
                report = Paths.get(args[++i]);
            } else if (args[i].startsWith("--") || source != null) {
                return usage(err);
            } else {
                source = args[i];
            }
        }
        if (source == null) {
            return usage(err);
        }

        if (!source.contains("://") && Files.isRegularFile(Paths.get(source))) {
            return inspectFile(Paths.get(source), out, err);
        }
        return inspectUrl(source, probe, report, out, err);
    }

    private int inspectFile(Path file, PrintStream out, PrintStream err)
    {
        try {
            byte[] bytes = Files.readAllBytes(file);
            DecodedRaster raster = new GeoTiffDecoder().decode(bytes);
            PixelBuffer buffer = new RasterCompositor().composite(raster);
            printRaster(raster.getDescriptor(), buffer, out);
            return EXIT_RENDERED;
        }
        catch (IOException e) {
            err.println("Cannot read " + file + ": " + e.getMessage());
            return EXIT_FAILED;
        }
        catch (RasterFormatException e) {
            err.println("Cannot decode " + file + ": " + e.getKind() + ": " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private int inspectUrl(String url, boolean probe, Path report, PrintStream out, PrintStream err)
    {
        ResourceReference ref = ResourceReference.of(url);
        OverlayPlacementController controller = OverlayPlacementController.create(engine, config);

        if (probe) {
            CandidateUrlSet candidates = new ResourceLocator(config).generateCandidates(ref);
            out.println("Probing " + candidates.size() + " candidate URL(s)");
            List<ProbeResult> results = engine.probeBlocking(candidates);
            for (ProbeResult r : results) {
                out.println("  " + r);
            }
        }

        controller.trigger(ref);
        OverlayState state;
        try {
            state = controller.whenSettled().get(SETTLE_TIMEOUT_MINUTES, TimeUnit.MINUTES);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted");
            return EXIT_FAILED;
        }
        catch (ExecutionException | TimeoutException e) {
            controller.discard();
            err.println("Gave up waiting for " + SignedUrls.redact(url) + ": " + e);
            return EXIT_FAILED;
        }

        int code;
        switch (state.getPhase()) {
        case RENDERED:
            printRaster(controller.getLastDescriptor(), state.getPixelBuffer(), out);
            code = EXIT_RENDERED;
            break;
        case FALLBACK:
            out.println("Fallback: " + state.getReason());
            out.println("Detail: " + state.getDetail());
            out.println("Estimated coverage: " + state.getPolygon());
            code = EXIT_FALLBACK;
            break;
        default:
            out.println("Failed: " + state.getErrorKind() + ": " + state.getDetail());
            code = EXIT_FAILED;
            break;
        }

        if (report != null && code != EXIT_RENDERED) {
            try {
                Path written = controller.diagnosticReport().writeTo(report);
                out.println("Diagnostic report written to " + written);
            }
            catch (IOException e) {
                err.println("Could not write report " + report + ": " + e.getMessage());
            }
        }
        return code;
    }

    private static void printRaster(RasterDescriptor descriptor, PixelBuffer buffer, PrintStream out)
    {
        if (descriptor != null) {
            out.println("Raster: " + descriptor);
            if (descriptor.getCrsDescription() != null) {
                out.println("CRS: " + descriptor.getCrsDescription());
            }
        }
        out.println("Pixels: " + buffer.getWidth() + "x" + buffer.getHeight() + " RGBA");
        CornerQuad c = buffer.getCorners();
        out.println("Top left:     " + c.longitude(CornerQuad.TOP_LEFT) + ", " + c.latitude(CornerQuad.TOP_LEFT));
        out.println("Top right:    " + c.longitude(CornerQuad.TOP_RIGHT) + ", " + c.latitude(CornerQuad.TOP_RIGHT));
        out.println("Bottom right: " + c.longitude(CornerQuad.BOTTOM_RIGHT) + ", " + c.latitude(CornerQuad.BOTTOM_RIGHT));
        out.println("Bottom left:  " + c.longitude(CornerQuad.BOTTOM_LEFT) + ", " + c.latitude(CornerQuad.BOTTOM_LEFT));
    }

    private static int usage(PrintStream err)
    {
        err.println("Usage: OverlayInspector <url-or-file> [--probe] [--report <file>]");
        return EXIT_USAGE;
    }

} // OverlayInspector
