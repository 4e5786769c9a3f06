// HttpUrlConnectionTransport.java
// blocking HttpURLConnection transport; the fetch engine runs it on its
// own worker threads so callers never block on it

package limited.theta.overlay;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class HttpUrlConnectionTransport implements HttpTransport
{
    private static final Logger log = LoggerFactory.getLogger(HttpUrlConnectionTransport.class);

    private static final int BUFFER_SIZE = 8192;

    private final int connectTimeoutMillis;
    private final int readTimeoutMillis;

    public HttpUrlConnectionTransport(int connectTimeoutMillis, int readTimeoutMillis)
    {
        this.connectTimeoutMillis = connectTimeoutMillis;
        this.readTimeoutMillis = readTimeoutMillis;
    }

    public HttpUrlConnectionTransport(PipelineConfig config)
    {
        this(config.getConnectTimeoutMillis(), config.getReadTimeoutMillis());
    }

    @Override
    public TransportResponse get(String url, String accept, ProgressListener progress) throws IOException
    {
        HttpURLConnection connection = open(url, "GET");
        try {
            connection.setRequestProperty("Accept", accept == null ? "*/*" : accept);
            connection.setRequestProperty("Cache-Control", "no-cache");

            int responseCode = connection.getResponseCode();
            String contentType = connection.getContentType();
            long contentLength = connection.getContentLengthLong();

            if (responseCode < 200 || responseCode >= 300) {
                drain(connection.getErrorStream());
                log.debug("GET {} returned {}", SignedUrls.redact(url), responseCode);
                return new TransportResponse(responseCode, contentType, contentLength, null);
            }

            ProgressTracker tracker = new ProgressTracker(contentLength, progress);
            ByteArrayOutputStream out = new ByteArrayOutputStream(
                contentLength > 0 && contentLength < Integer.MAX_VALUE ? (int) contentLength : BUFFER_SIZE);

            try (InputStream inputStream = connection.getInputStream()) {
                byte[] buffer = new byte[BUFFER_SIZE];
                int bytesRead;
                while ((bytesRead = inputStream.read(buffer)) != -1) {
                    out.write(buffer, 0, bytesRead);
                    tracker.advance(bytesRead);
                }
            }
            byte[] body = out.toByteArray();
            tracker.finish();

            log.debug("GET {} read {} bytes", SignedUrls.redact(url), body.length);
            return new TransportResponse(responseCode, contentType, contentLength, body);
        }
        finally {
            connection.disconnect();
        }
    }

    @Override
    public TransportResponse head(String url) throws IOException
    {
        HttpURLConnection connection = open(url, "HEAD");
        try {
            int responseCode = connection.getResponseCode();
            return new TransportResponse(responseCode, connection.getContentType(),
                                         connection.getContentLengthLong(), null);
        }
        finally {
            connection.disconnect();
        }
    }

    @Override
    public TransportResponse probeRange(String url) throws IOException
    {
        HttpURLConnection connection = open(url, "GET");
        try {
            connection.setRequestProperty("Range", "bytes=0-0");
            int responseCode = connection.getResponseCode();
            String contentType = connection.getContentType();
            long contentLength = connection.getContentLengthLong();
            drain(responseCode < 400 ? connection.getInputStream() : connection.getErrorStream());
            return new TransportResponse(responseCode, contentType, contentLength, null);
        }
        finally {
            connection.disconnect();
        }
    }

    private HttpURLConnection open(String url, String method) throws IOException
    {
        HttpURLConnection connection = (HttpURLConnection) new URL(toRequestUrl(url)).openConnection();
        connection.setRequestMethod(method);
        connection.setConnectTimeout(connectTimeoutMillis);
        connection.setReadTimeout(readTimeoutMillis);
        connection.setInstanceFollowRedirects(true);
        connection.setUseCaches(false);
        return connection;
    }

    // a decoded path may hold literal spaces, which cannot go on the request line
    static String toRequestUrl(String url)
    {
        return url.replace(" ", "%20");
    }

    private static void drain(InputStream in) throws IOException
    {
        if (in == null) {
            return;
        }
        try (InputStream stream = in) {
            byte[] buffer = new byte[BUFFER_SIZE];
            while (stream.read(buffer) != -1) {
                // discard
            }
        }
    }

} // HttpUrlConnectionTransport
