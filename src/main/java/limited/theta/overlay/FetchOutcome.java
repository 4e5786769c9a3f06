// FetchOutcome.java

package limited.theta.overlay;

/**
 * The winning response for one resource (or one reassembled chunk
 * group): which URL worked, the bytes, and the declared content type.
 */
public final class FetchOutcome
{
    private final String succeededUrl;
    private final byte[] payload;
    private final String contentType;
    private final String fileName;

    public FetchOutcome(String succeededUrl, byte[] payload, String contentType)
    {
        this(succeededUrl, payload, contentType, null);
    }

    public FetchOutcome(String succeededUrl, byte[] payload, String contentType, String fileName)
    {
        this.succeededUrl = succeededUrl;
        this.payload = payload;
        this.contentType = contentType;
        this.fileName = fileName;
    }

    public String getSucceededUrl() { return succeededUrl; }
    public byte[] getPayload() { return payload; }
    public String getContentType() { return contentType; }

    // only set for reassembled groups; null for plain fetches
    public String getFileName() { return fileName; }

    @Override
    public String toString()
    {
        return "FetchOutcome(" + SignedUrls.redact(succeededUrl) + ", " + payload.length
            + " bytes, " + contentType + (fileName == null ? "" : ", " + fileName) + ")";
    }

} // FetchOutcome
