// ContentTypes.java
// spotting error pages that arrive with a 2xx status when a binary
// payload was asked for

package limited.theta.overlay;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

final class ContentTypes
{
    static final String BINARY = "application/octet-stream";
    static final String GEOTIFF_ACCEPT = "image/tiff,application/octet-stream,*/*";

    private static final String[] TEXTUAL_TYPES = {
        "text/html", "text/xml", "application/xml", "application/json", "text/plain"
    };
    private static final String[] TEXTUAL_PREFIXES = {
        "<!doctype", "<html", "<?xml", "<error"
    };

    private ContentTypes() { }

    /**
     * @return why this response cannot be the requested payload, or null
     *         when it looks acceptable
     */
    static String rejectReason(String accept, String contentType, byte[] body)
    {
        if (body == null || body.length == 0) {
            return "empty response body";
        }
        if (expectsText(accept)) {
            return null;
        }
        if (contentType != null) {
            String lower = contentType.toLowerCase(Locale.ROOT);
            for (String t : TEXTUAL_TYPES) {
                if (lower.startsWith(t)) {
                    return "unexpected content type " + contentType + " for binary request";
                }
            }
        }
        String head = leadingText(body);
        for (String prefix : TEXTUAL_PREFIXES) {
            if (head.startsWith(prefix)) {
                return "response body looks like markup, not binary data";
            }
        }
        return null;
    }

    static boolean expectsText(String accept)
    {
        if (accept == null) {
            return false;
        }
        String lower = accept.toLowerCase(Locale.ROOT).trim();
        return lower.startsWith("text/") || lower.startsWith("application/json");
    }

    private static String leadingText(byte[] body)
    {
        int start = 0;
        while (start < body.length && start < 64 && Character.isWhitespace(body[start])) {
            start++;
        }
        int len = Math.min(16, body.length - start);
        return new String(body, start, len, StandardCharsets.ISO_8859_1).toLowerCase(Locale.ROOT);
    }

} // ContentTypes
