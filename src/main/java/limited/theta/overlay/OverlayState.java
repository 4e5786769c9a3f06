// OverlayState.java

package limited.theta.overlay;

/**
 * Snapshot of one raster overlay's progress. Rendered carries the pixel
 * buffer; Fallback carries the estimated coverage polygon and why it is
 * shown; Failed carries the error kind.
 */
public final class OverlayState
{
    private static final OverlayState IDLE = new OverlayState(OverlayPhase.IDLE, null, null, null, null, null);
    private static final OverlayState LOCATING = new OverlayState(OverlayPhase.LOCATING, null, null, null, null, null);
    private static final OverlayState FETCHING = new OverlayState(OverlayPhase.FETCHING, null, null, null, null, null);
    private static final OverlayState DECODING = new OverlayState(OverlayPhase.DECODING, null, null, null, null, null);

    private final OverlayPhase phase;
    private final PixelBuffer pixelBuffer;
    private final CornerQuad polygon;
    private final FallbackReason fallbackReason;
    private final ErrorKind errorKind;
    private final String detail;

    private OverlayState(OverlayPhase phase, PixelBuffer pixelBuffer, CornerQuad polygon,
                         FallbackReason fallbackReason, ErrorKind errorKind, String detail)
    {
        this.phase = phase;
        this.pixelBuffer = pixelBuffer;
        this.polygon = polygon;
        this.fallbackReason = fallbackReason;
        this.errorKind = errorKind;
        this.detail = detail;
    }

    public static OverlayState idle() { return IDLE; }
    public static OverlayState locating() { return LOCATING; }
    public static OverlayState fetching() { return FETCHING; }
    public static OverlayState decoding() { return DECODING; }

    public static OverlayState rendered(PixelBuffer buffer)
    {
        return new OverlayState(OverlayPhase.RENDERED, buffer, buffer.getCorners(), null, null, null);
    }

    public static OverlayState fallback(CornerQuad polygon, FallbackReason reason, ErrorKind kind, String detail)
    {
        return new OverlayState(OverlayPhase.FALLBACK, null, polygon, reason, kind, detail);
    }

    public static OverlayState failed(ErrorKind kind, String detail)
    {
        return new OverlayState(OverlayPhase.FAILED, null, null, null, kind, detail);
    }

    public OverlayPhase getPhase() { return phase; }
    public boolean isTerminal() { return phase.isTerminal(); }
    public boolean isInFlight() { return phase.isInFlight(); }

    /** Only in RENDERED. */
    public PixelBuffer getPixelBuffer() { return pixelBuffer; }

    /** Raster corners when rendered, the estimated coverage in FALLBACK. */
    public CornerQuad getPolygon() { return polygon; }

    public FallbackReason getFallbackReason() { return fallbackReason; }

    /** Human readable reason for FALLBACK, null otherwise. */
    public String getReason()
    {
        return fallbackReason == null ? null : fallbackReason.getMessage();
    }

    // underlying error kind for FALLBACK and FAILED
    public ErrorKind getErrorKind() { return errorKind; }
    public String getDetail() { return detail; }

    public boolean canRetry() { return phase == OverlayPhase.FALLBACK || phase == OverlayPhase.FAILED; }
    public boolean canDownloadOriginal() { return phase == OverlayPhase.FALLBACK; }

    public boolean canExportDiagnostics()
    {
        return phase == OverlayPhase.FAILED || fallbackReason == FallbackReason.FETCH_FAILED;
    }

    @Override
    public String toString()
    {
        switch (phase) {
        case RENDERED:
            return "Rendered(" + pixelBuffer + ")";
        case FALLBACK:
            return "Fallback(" + polygon + ", " + getReason() + (detail == null ? "" : ": " + detail) + ")";
        case FAILED:
            return "Failed(" + errorKind + (detail == null ? "" : ": " + detail) + ")";
        default:
            return phase.name().charAt(0) + phase.name().substring(1).toLowerCase();
        }
    }

} // OverlayState
