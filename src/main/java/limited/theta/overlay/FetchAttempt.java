// FetchAttempt.java
// one failed try against one candidate URL; URL is stored redacted

package limited.theta.overlay;

public final class FetchAttempt
{
    public static final int NO_STATUS = -1;

    private final String url;
    private final int attemptNumber;
    private final int statusCode;
    private final String message;

    public FetchAttempt(String url, int attemptNumber, int statusCode, String message)
    {
        this.url = SignedUrls.redact(url);
        this.attemptNumber = attemptNumber;
        this.statusCode = statusCode;
        this.message = message;
    }

    public String getUrl() { return url; }
    public int getAttemptNumber() { return attemptNumber; }
    public int getStatusCode() { return statusCode; }
    public String getMessage() { return message; }

    public boolean hasStatus() { return statusCode != NO_STATUS; }

    @Override
    public String toString()
    {
        return url + " #" + attemptNumber + ": "
            + (hasStatus() ? "HTTP " + statusCode + " " : "") + message;
    }

} // FetchAttempt
