// RasterPipelineException.java

package limited.theta.overlay;

/**
 * Base of every typed failure raised by the fetch engine, the chunk
 * reassembler and the GeoTIFF decoder.
 */
public class RasterPipelineException extends Exception
{
    private final ErrorKind kind;

    public RasterPipelineException(ErrorKind kind, String message)
    {
        super(message);
        this.kind = kind;
    }

    public RasterPipelineException(ErrorKind kind, String message, Throwable cause)
    {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() { return kind; }

} // RasterPipelineException
