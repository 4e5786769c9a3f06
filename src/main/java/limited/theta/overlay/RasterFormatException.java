// RasterFormatException.java

package limited.theta.overlay;

/**
 * Raised when a payload was received but cannot be turned into a
 * placed raster: bad signature, unsupported band layout, size mismatch,
 * or missing georeferencing.
 */
public class RasterFormatException extends RasterPipelineException
{
    public RasterFormatException(ErrorKind kind, String message)
    {
        super(kind, message);
        requireFormatKind(kind);
    }

    public RasterFormatException(ErrorKind kind, String message, Throwable cause)
    {
        super(kind, message, cause);
        requireFormatKind(kind);
    }

    private static void requireFormatKind(ErrorKind kind)
    {
        if (!kind.isFormatProblem()) {
            throw new IllegalArgumentException(kind + " is not a format error kind");
        }
    }

} // RasterFormatException
