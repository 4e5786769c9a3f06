// HttpTransport.java

package limited.theta.overlay;

import java.io.IOException;

/**
 * The network seam of the fetch engine. Implementations report any
 * HTTP status as a response and throw only for transport-level failures
 * (connection refused, timeout, reset).
 */
public interface HttpTransport
{
    /** Full GET, body streamed and assembled, progress reported as it arrives. */
    TransportResponse get(String url, String accept, ProgressListener progress) throws IOException;

    /** Metadata-only request. */
    TransportResponse head(String url) throws IOException;

    /** One-byte ranged GET, for stores that refuse HEAD but allow reads. */
    TransportResponse probeRange(String url) throws IOException;

} // HttpTransport
