// ResourceLocator.java
// turns one raw resource URL into a canonical form plus an ordered
// list of alternative URLs worth trying against the object store

package limited.theta.overlay;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ResourceLocator
{
    private static final Logger log = LoggerFactory.getLogger(ResourceLocator.class);

    // bucket.s3.eu-north-1.amazonaws.com, s3-eu-north-1.amazonaws.com, ...
    private static final Pattern REGIONAL_HOST =
        Pattern.compile("^(.+\\.)?s3([.-])([a-z0-9-]+)\\.amazonaws\\.com$");
    // bucket.s3.amazonaws.com or s3.amazonaws.com
    private static final Pattern GLOBAL_HOST =
        Pattern.compile("^(.+\\.)?s3\\.amazonaws\\.com$");
    // s3.amazonaws.com/bucket/key, s3.eu-north-1.amazonaws.com/bucket/key
    private static final Pattern PATH_STYLE_HOST =
        Pattern.compile("^s3(?:[.-]([a-z0-9-]+))?\\.amazonaws\\.com$");

    // escape sequence -> literal, for characters that show up in
    // human-chosen file names and get mis-escaped upstream
    private static final String[][] PATH_ESCAPES = {
        {"%28", "("}, {"%29", ")"}, {"%20", " "}, {"%2B", "+"},
        {"%2C", ","}, {"%5B", "["}, {"%5D", "]"},
    };

    private final String defaultRegion;

    public ResourceLocator()
    {
        this(PipelineConfig.DEFAULT_REGION);
    }

    public ResourceLocator(String defaultRegion)
    {
        this.defaultRegion = defaultRegion;
    }

    public ResourceLocator(PipelineConfig config)
    {
        this(config.getDefaultRegion());
    }

    /**
     * Canonical form of a URL. Signed URLs come back untouched. For all
     * others the path (never the query) has its percent-escaped
     * parentheses, spaces, plus signs, commas and brackets decoded.
     * Applying this twice gives the same result as applying it once.
     */
    public String normalize(String url)
    {
        if (url == null) {
            return "";
        }
        if (SignedUrls.isSigned(url)) {
            return url;
        }
        UrlParts parts = UrlParts.parse(url);
        String path = parts.path;
        for (String[] esc : PATH_ESCAPES) {
            path = replaceIgnoreCase(path, esc[0], esc[1]);
        }
        return parts.withPath(path);
    }

    /**
     * Builds the candidate list in priority order: original, query
     * stripped, region swapped, virtual-host rewrite, normalized,
     * re-encoded. A signed URL yields just itself, since any rewrite
     * breaks its signature.
     */
    public CandidateUrlSet generateCandidates(String url)
    {
        if (url == null || url.isEmpty()) {
            return CandidateUrlSet.empty();
        }
        if (SignedUrls.isSigned(url)) {
            return CandidateUrlSet.single(url);
        }

        UrlParts parts = UrlParts.parse(url);
        List<String> alternates = new ArrayList<>();

        if (parts.hasQuery()) {
            alternates.add(parts.withoutQuery());
        }
        String swapped = swapRegion(parts);
        if (swapped != null) {
            alternates.add(swapped);
        }
        String virtualHost = toVirtualHost(parts);
        if (virtualHost != null) {
            alternates.add(virtualHost);
        }
        alternates.add(normalize(url));
        alternates.add(reEncode(url));

        CandidateUrlSet set = CandidateUrlSet.of(url, alternates);
        log.debug("Generated {} candidate URLs for {}", set.size(), SignedUrls.redact(url));
        return set;
    }

    /**
     * Candidates for a whole reference: those of its primary URL, then
     * one URL per alternate object key, each addressed in the primary
     * URL's bucket. Alternate keys that are already absolute URLs are
     * used as given.
     */
    public CandidateUrlSet generateCandidates(ResourceReference ref)
    {
        if (ref == null) {
            return CandidateUrlSet.empty();
        }
        CandidateUrlSet primary = generateCandidates(ref.getPrimaryUrl());
        // any other key would be unsigned and refused
        if (ref.getAlternateKeys().isEmpty() || SignedUrls.isSigned(ref.getPrimaryUrl())) {
            return primary;
        }
        List<String> alternates = new ArrayList<>(primary.asList());
        for (String key : ref.getAlternateKeys()) {
            String alt = urlForKey(ref.getPrimaryUrl(), key);
            if (alt != null) {
                alternates.add(alt);
            }
        }
        if (primary.isEmpty()) {
            return alternates.isEmpty() ? primary : CandidateUrlSet.of(alternates.get(0), alternates);
        }
        return CandidateUrlSet.of(primary.getOriginal(), alternates);
    }

    /**
     * Virtual-host URL for an object key in the same bucket as the
     * reference URL, or null when the bucket cannot be worked out.
     */
    public String urlForKey(String referenceUrl, String key)
    {
        if (key == null || key.isEmpty()) {
            return null;
        }
        if (key.contains("://")) {
            return key;
        }
        if (referenceUrl == null || referenceUrl.isEmpty()) {
            return null;
        }
        UrlParts parts = UrlParts.parse(referenceUrl);
        String bucket = null;
        String region = defaultRegion;

        Matcher pathStyle = PATH_STYLE_HOST.matcher(parts.host);
        Matcher regional = REGIONAL_HOST.matcher(parts.host);
        Matcher global = GLOBAL_HOST.matcher(parts.host);
        if (pathStyle.matches()) {
            int slash = parts.path.indexOf('/', 1);
            bucket = slash < 0 ? parts.path.substring(Math.min(1, parts.path.length())) : parts.path.substring(1, slash);
            if (pathStyle.group(1) != null) {
                region = pathStyle.group(1);
            }
        } else if (regional.matches() && regional.group(1) != null) {
            bucket = stripDot(regional.group(1));
            region = regional.group(3);
        } else if (global.matches() && global.group(1) != null) {
            bucket = stripDot(global.group(1));
        }
        if (bucket == null || bucket.isEmpty()) {
            return null;
        }
        String scheme = parts.scheme().isEmpty() ? "https" : parts.scheme();
        String path = key.startsWith("/") ? key : "/" + key;
        String endpoint = region == null || region.isEmpty() ? "s3.amazonaws.com" : "s3." + region + ".amazonaws.com";
        return scheme + "://" + bucket + "." + endpoint + path;
    }

    /**
     * Percent-encodes the same characters {@link #normalize} decodes, in
     * the path only. Some stores only match the escaped key.
     */
    public String reEncode(String url)
    {
        if (url == null || SignedUrls.isSigned(url)) {
            return url;
        }
        UrlParts parts = UrlParts.parse(url);
        StringBuilder sb = new StringBuilder(parts.path.length() + 16);
        for (int i = 0; i < parts.path.length(); i++) {
            char c = parts.path.charAt(i);
            String escaped = escapeFor(c);
            if (escaped != null) {
                sb.append(escaped);
            } else {
                sb.append(c);
            }
        }
        return parts.withPath(sb.toString());
    }

    /**
     * Rough check whether a URL names a GeoTIFF (or one uploaded part of
     * one). Query strings are ignored.
     */
    public static boolean looksLikeGeoTiff(String url)
    {
        if (url == null || url.isEmpty()) {
            return false;
        }
        String path = UrlParts.parse(url).path.toLowerCase(Locale.ROOT);
        return path.endsWith(".tif")
            || path.endsWith(".tiff")
            || path.endsWith(".geotiff")
            || path.contains(".tif.part")
            || path.contains("geotiff");
    }

    /**
     * File name of the object a URL points at, with escapes decoded.
     */
    public static String fileNameOf(String url)
    {
        if (url == null || url.isEmpty()) {
            return "";
        }
        String path = UrlParts.parse(url).lastPathSegment();
        for (String[] esc : PATH_ESCAPES) {
            path = replaceIgnoreCase(path, esc[0], esc[1]);
        }
        return path;
    }

    private String swapRegion(UrlParts parts)
    {
        Matcher regional = REGIONAL_HOST.matcher(parts.host);
        if (regional.matches()) {
            String prefix = regional.group(1) == null ? "" : regional.group(1);
            String separator = regional.group(2);
            String region = regional.group(3);
            if ("-".equals(separator)) {
                // legacy dash form -> dotted regional form
                return parts.withHostAndPath(prefix + "s3." + region + ".amazonaws.com", parts.path);
            }
            return parts.withHostAndPath(prefix + "s3.amazonaws.com", parts.path);
        }
        Matcher global = GLOBAL_HOST.matcher(parts.host);
        if (global.matches() && defaultRegion != null && !defaultRegion.isEmpty()) {
            String prefix = global.group(1) == null ? "" : global.group(1);
            return parts.withHostAndPath(prefix + "s3." + defaultRegion + ".amazonaws.com", parts.path);
        }
        return null;
    }

    private String toVirtualHost(UrlParts parts)
    {
        Matcher m = PATH_STYLE_HOST.matcher(parts.host);
        if (!m.matches() || parts.path.length() < 2) {
            return null;
        }
        int slash = parts.path.indexOf('/', 1);
        if (slash < 0 || slash == parts.path.length() - 1) {
            return null; // bucket only, no key
        }
        String bucket = parts.path.substring(1, slash);
        String key = parts.path.substring(slash);
        String endpoint = m.group(1) == null ? "s3.amazonaws.com" : "s3." + m.group(1) + ".amazonaws.com";
        return parts.withHostAndPath(bucket + "." + endpoint, key);
    }

    private static String stripDot(String prefix)
    {
        return prefix.endsWith(".") ? prefix.substring(0, prefix.length() - 1) : prefix;
    }

    private static String escapeFor(char c)
    {
        for (String[] esc : PATH_ESCAPES) {
            if (esc[1].charAt(0) == c) {
                return esc[0];
            }
        }
        return null;
    }

    private static String replaceIgnoreCase(String s, String target, String replacement)
    {
        String lower = s.toLowerCase(Locale.ROOT);
        String lowerTarget = target.toLowerCase(Locale.ROOT);
        int idx = lower.indexOf(lowerTarget);
        if (idx < 0) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s.length());
        int from = 0;
        while (idx >= 0) {
            sb.append(s, from, idx).append(replacement);
            from = idx + target.length();
            idx = lower.indexOf(lowerTarget, from);
        }
        return sb.append(s.substring(from)).toString();
    }

} // ResourceLocator
