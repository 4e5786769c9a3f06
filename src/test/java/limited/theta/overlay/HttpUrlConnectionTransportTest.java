// HttpUrlConnectionTransportTest.java
// runs the real transport against an in-process HttpServer

package limited.theta.overlay;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpUrlConnectionTransportTest
{
    private static final byte[] BIG = new byte[64 * 1024];

    static {
        for (int i = 0; i < BIG.length; i++) {
            BIG[i] = (byte) i;
        }
    }

    private HttpServer server;
    private String base;
    private final List<String> seenPaths = Collections.synchronizedList(new ArrayList<>());
    private final HttpUrlConnectionTransport transport = new HttpUrlConnectionTransport(2_000, 5_000);

    @BeforeEach
    void startServer()
        throws IOException
    {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer()
    {
        server.stop(0);
    }

    private void handle(HttpExchange exchange)
        throws IOException
    {
        String path = exchange.getRequestURI().getPath();
        String method = exchange.getRequestMethod();
        seenPaths.add(method + " " + path);

        if (path.equals("/big.tif") || path.equals("/with space.tif")) {
            exchange.getResponseHeaders().set("Content-Type", "image/tiff");
            if ("HEAD".equals(method)) {
                exchange.sendResponseHeaders(200, -1);
            } else {
                send(exchange, 200, BIG);
            }
        } else if (path.equals("/signed-get-only.tif")) {
            if ("HEAD".equals(method)) {
                exchange.sendResponseHeaders(403, -1);
            } else if ("bytes=0-0".equals(exchange.getRequestHeaders().getFirst("Range"))) {
                exchange.getResponseHeaders().set("Content-Range", "bytes 0-0/" + BIG.length);
                send(exchange, 206, new byte[] {BIG[0]});
            } else {
                send(exchange, 200, BIG);
            }
        } else {
            exchange.getResponseHeaders().set("Content-Type", "text/html");
            send(exchange, 404, "<html>not here</html>".getBytes(StandardCharsets.UTF_8));
        }
        exchange.close();
    }

    private static void send(HttpExchange exchange, int status, byte[] body)
        throws IOException
    {
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    @Test
    void getAssemblesTheWholeBodyAndReportsProgress()
        throws Exception
    {
        List<Integer> progress = new ArrayList<>();
        TransportResponse response = transport.get(base + "/big.tif", ContentTypes.GEOTIFF_ACCEPT, progress::add);

        assertEquals(200, response.getStatus());
        assertEquals("image/tiff", response.getContentType());
        assertEquals(BIG.length, response.getContentLength());
        assertArrayEquals(BIG, response.getBody());

        assertFalse(progress.isEmpty());
        assertEquals(100, progress.get(progress.size() - 1).intValue());
        for (int i = 1; i < progress.size(); i++) {
            assertTrue(progress.get(i) > progress.get(i - 1), "progress went backwards: " + progress);
        }
        for (int i = 0; i < progress.size() - 1; i++) {
            assertTrue(progress.get(i) <= 99);
        }
    }

    @Test
    void errorStatusIsAResponseNotAnException()
        throws Exception
    {
        TransportResponse response = transport.get(base + "/nope.tif", ContentTypes.BINARY, ProgressListener.NONE);
        assertEquals(404, response.getStatus());
        assertFalse(response.isSuccess());
        assertEquals(0, response.getBody().length);
    }

    @Test
    void literalSpacesAreEscapedOnTheWire()
        throws Exception
    {
        TransportResponse response = transport.get(base + "/with space.tif", ContentTypes.BINARY, ProgressListener.NONE);
        assertEquals(200, response.getStatus());
        assertTrue(seenPaths.contains("GET /with space.tif"));
    }

    @Test
    void headAndRangedProbe()
        throws Exception
    {
        assertEquals(200, transport.head(base + "/big.tif").getStatus());
        assertEquals(403, transport.head(base + "/signed-get-only.tif").getStatus());
        assertEquals(206, transport.probeRange(base + "/signed-get-only.tif").getStatus());
        assertEquals(404, transport.probeRange(base + "/nope.tif").getStatus());
    }

    @Test
    void engineOverRealTransportFallsThroughToTheWorkingUrl()
        throws Exception
    {
        try (FetchEngine engine = new FetchEngine(transport, RetryPolicy.once(), new FailedUrlCache(8, 60_000L), 1)) {
            CandidateUrlSet candidates = CandidateUrlSet.of(base + "/gone.tif", List.of(base + "/big.tif"));
            FetchOutcome outcome = engine.fetchBlocking(candidates, ContentTypes.GEOTIFF_ACCEPT,
                                                        ProgressListener.NONE, () -> false);
            assertEquals(base + "/big.tif", outcome.getSucceededUrl());
            assertEquals(BIG.length, outcome.getPayload().length);
        }
    }

    @Test
    void refusedConnectionIsAnIOException()
        throws IOException
    {
        int port;
        try (ServerSocket unused = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = unused.getLocalPort();
        }
        assertThrows(IOException.class,
            () -> transport.get("http://127.0.0.1:" + port + "/big.tif", ContentTypes.BINARY, ProgressListener.NONE));
    }

    @Test
    void requestUrlEscaping()
    {
        assertEquals("https://h/a%20b.tif?x=1", HttpUrlConnectionTransport.toRequestUrl("https://h/a b.tif?x=1"));
    }

} // HttpUrlConnectionTransportTest
