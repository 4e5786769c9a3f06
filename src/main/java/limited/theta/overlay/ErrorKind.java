// ErrorKind.java
// machine-readable failure categories for the raster pipeline

package limited.theta.overlay;

public enum ErrorKind
{
    INVALID_FORMAT("payload does not start with a TIFF signature"),
    UNSUPPORTED_FORMAT("recognized raster with an unsupported layout"),
    CORRUPT_PAYLOAD("declared and actual raster sizes disagree"),
    FETCH_FAILURE("every candidate URL failed"),
    MISSING_GEOREFERENCING("raster carries no bounding box tags"),
    REASSEMBLY_FAILURE("chunked resource could not be reassembled");

    private final String description;

    ErrorKind(String description) {
        this.description = description;
    }

    public String getDescription() { return description; }

    // decode-side kinds mean "we got bytes but could not use them"
    public boolean isFormatProblem()
    {
        return this == INVALID_FORMAT || this == UNSUPPORTED_FORMAT
            || this == CORRUPT_PAYLOAD || this == MISSING_GEOREFERENCING;
    }

} // ErrorKind
