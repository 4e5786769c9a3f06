// ProbeResult.java

package limited.theta.overlay;

/**
 * Result of a metadata-only existence check on one candidate URL.
 */
public final class ProbeResult
{
    private final String url;
    private final boolean reachable;
    private final int statusCode;
    private final String contentType;
    private final long contentLength;
    private final boolean viaRangeRequest;
    private final String message;

    public ProbeResult(String url, boolean reachable, int statusCode, String contentType,
                       long contentLength, boolean viaRangeRequest, String message)
    {
        this.url = url;
        this.reachable = reachable;
        this.statusCode = statusCode;
        this.contentType = contentType;
        this.contentLength = contentLength;
        this.viaRangeRequest = viaRangeRequest;
        this.message = message;
    }

    public String getUrl() { return url; }
    public String getRedactedUrl() { return SignedUrls.redact(url); }
    public boolean isReachable() { return reachable; }
    public int getStatusCode() { return statusCode; }
    public String getContentType() { return contentType; }
    public long getContentLength() { return contentLength; }
    public boolean isViaRangeRequest() { return viaRangeRequest; }
    public String getMessage() { return message; }

    @Override
    public String toString()
    {
        return getRedactedUrl() + " -> " + (reachable ? "reachable" : "unreachable")
            + (statusCode == FetchAttempt.NO_STATUS ? "" : " (HTTP " + statusCode + ")")
            + (message == null ? "" : " " + message);
    }

} // ProbeResult
