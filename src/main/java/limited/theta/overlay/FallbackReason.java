// FallbackReason.java
// why a coverage polygon is shown instead of the raster; the remedy
// differs, so callers branch on this rather than on the text

package limited.theta.overlay;

public enum FallbackReason
{
    FETCH_FAILED("Raster could not be fetched: network or storage error"),
    UNDECODABLE_FORMAT("Raster format could not be decoded in this environment");

    private final String message;

    FallbackReason(String message) {
        this.message = message;
    }

    public String getMessage() { return message; }

} // FallbackReason
