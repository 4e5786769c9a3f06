// TransportResponse.java

package limited.theta.overlay;

/**
 * Status, declared type and length, and (for GET) the fully assembled
 * body of one HTTP exchange. HEAD responses carry an empty body.
 */
public final class TransportResponse
{
    private static final byte[] EMPTY = new byte[0];

    private final int status;
    private final String contentType;
    private final long contentLength;
    private final byte[] body;

    public TransportResponse(int status, String contentType, long contentLength, byte[] body)
    {
        this.status = status;
        this.contentType = contentType;
        this.contentLength = contentLength;
        this.body = body == null ? EMPTY : body;
    }

    public int getStatus() { return status; }
    public String getContentType() { return contentType; }
    public long getContentLength() { return contentLength; }

    // shared, not copied; callers treat it as read-only
    public byte[] getBody() { return body; }

    public boolean isSuccess() { return status >= 200 && status < 300; }

} // TransportResponse
