// UrlParts.java
// lenient split of a URL string into origin, path and query/fragment;
// deliberately avoids java.net.URI so mis-escaped input still parses

package limited.theta.overlay;

final class UrlParts
{
    final String origin;   // scheme://authority, or "" for relative input
    final String host;     // lower-cased, no port or user info
    final String path;     // starts with '/' when origin is present
    final String suffix;   // "?query#fragment" or ""

    private UrlParts(String origin, String host, String path, String suffix)
    {
        this.origin = origin;
        this.host = host;
        this.path = path;
        this.suffix = suffix;
    }

    static UrlParts parse(String url)
    {
        int q = indexOfAny(url, 0, '?', '#');
        String beforeSuffix = q < 0 ? url : url.substring(0, q);
        String suffix = q < 0 ? "" : url.substring(q);

        int schemeEnd = beforeSuffix.indexOf("://");
        if (schemeEnd < 0) {
            return new UrlParts("", "", beforeSuffix, suffix);
        }
        int pathStart = beforeSuffix.indexOf('/', schemeEnd + 3);
        String origin = pathStart < 0 ? beforeSuffix : beforeSuffix.substring(0, pathStart);
        String path = pathStart < 0 ? "" : beforeSuffix.substring(pathStart);

        String authority = origin.substring(schemeEnd + 3);
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }
        int colon = authority.indexOf(':');
        String host = (colon < 0 ? authority : authority.substring(0, colon)).toLowerCase(java.util.Locale.ROOT);
        return new UrlParts(origin, host, path, suffix);
    }

    String scheme()
    {
        int schemeEnd = origin.indexOf("://");
        return schemeEnd < 0 ? "" : origin.substring(0, schemeEnd);
    }

    boolean hasQuery()
    {
        return suffix.startsWith("?") && suffix.length() > 1;
    }

    String withoutQuery()
    {
        int hash = suffix.indexOf('#');
        return origin + path + (hash < 0 ? "" : suffix.substring(hash));
    }

    String withPath(String newPath)
    {
        return origin + newPath + suffix;
    }

    String withHostAndPath(String newHost, String newPath)
    {
        return scheme() + "://" + newHost + newPath + suffix;
    }

    String lastPathSegment()
    {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    private static int indexOfAny(String s, int from, char a, char b)
    {
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == a || c == b) {
                return i;
            }
        }
        return -1;
    }

} // UrlParts
