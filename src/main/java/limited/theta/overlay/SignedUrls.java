// SignedUrls.java
// helpers for time-limited, credential-bearing object storage URLs
// handles SigV4 (X-Amz-*) and legacy query auth (Signature/Expires)

package limited.theta.overlay;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class SignedUrls
{
    public static final String REDACTED = "REDACTED";

    private static final Set<String> SIGNATURE_PARAMS = Set.of("x-amz-signature", "signature");
    private static final Set<String> EXPIRY_PARAMS = Set.of("x-amz-expires", "expires");
    private static final Set<String> SECRET_PARAMS = Set.of(
        "x-amz-signature", "x-amz-credential", "x-amz-security-token",
        "signature", "awsaccesskeyid");

    private static final DateTimeFormatter AMZ_DATE =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'");

    private SignedUrls() { }

    /**
     * A URL is signed when it carries both a signature parameter and an
     * expiry parameter. Such URLs must never be structurally altered.
     */
    public static boolean isSigned(String url)
    {
        if (url == null) {
            return false;
        }
        boolean hasSignature = false;
        boolean hasExpiry = false;
        for (String name : queryParameters(url).keySet()) {
            String lower = name.toLowerCase(Locale.ROOT);
            hasSignature |= SIGNATURE_PARAMS.contains(lower);
            hasExpiry |= EXPIRY_PARAMS.contains(lower);
        }
        return hasSignature && hasExpiry;
    }

    /**
     * Replaces the values of signature, credential and token parameters
     * with {@value #REDACTED}. Everything else is left as-is so the
     * result still identifies the object.
     */
    public static String redact(String url)
    {
        if (url == null) {
            return null;
        }
        int q = url.indexOf('?');
        if (q < 0) {
            return url;
        }
        int hash = url.indexOf('#', q);
        String query = hash < 0 ? url.substring(q + 1) : url.substring(q + 1, hash);
        String fragment = hash < 0 ? "" : url.substring(hash);

        StringBuilder sb = new StringBuilder(url.substring(0, q + 1));
        String[] pairs = query.split("&", -1);
        for (int i = 0; i < pairs.length; i++) {
            if (i > 0) {
                sb.append('&');
            }
            String pair = pairs[i];
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            if (eq >= 0 && SECRET_PARAMS.contains(name.toLowerCase(Locale.ROOT))) {
                sb.append(name).append('=').append(REDACTED);
            } else {
                sb.append(pair);
            }
        }
        return sb.append(fragment).toString();
    }

    /**
     * Computes when a signed URL stops working. SigV4 URLs expire at
     * X-Amz-Date + X-Amz-Expires seconds; legacy URLs carry an absolute
     * epoch-seconds Expires value.
     */
    public static Optional<Instant> expiresAt(String url)
    {
        if (!isSigned(url)) {
            return Optional.empty();
        }
        Map<String, String> params = lowerCaseKeys(queryParameters(url));
        try {
            String amzDate = params.get("x-amz-date");
            String amzExpires = params.get("x-amz-expires");
            if (amzDate != null && amzExpires != null) {
                Instant signedAt = LocalDateTime.parse(amzDate, AMZ_DATE).toInstant(ZoneOffset.UTC);
                return Optional.of(signedAt.plusSeconds(Long.parseLong(amzExpires)));
            }
            String legacy = params.get("expires");
            if (legacy != null) {
                return Optional.of(Instant.ofEpochSecond(Long.parseLong(legacy)));
            }
        }
        catch (DateTimeParseException | NumberFormatException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    public static boolean isExpired(String url, Instant now)
    {
        Optional<Instant> expiry = expiresAt(url);
        return expiry.isPresent() && !now.isBefore(expiry.get());
    }

    // raw (still percent-encoded) name -> value, first occurrence wins
    static Map<String, String> queryParameters(String url)
    {
        Map<String, String> params = new LinkedHashMap<>();
        int q = url.indexOf('?');
        if (q < 0 || q == url.length() - 1) {
            return params;
        }
        int hash = url.indexOf('#', q);
        String query = hash < 0 ? url.substring(q + 1) : url.substring(q + 1, hash);
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.putIfAbsent(name, value);
        }
        return params;
    }

    private static Map<String, String> lowerCaseKeys(Map<String, String> in)
    {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : in.entrySet()) {
            out.putIfAbsent(e.getKey().toLowerCase(Locale.ROOT), e.getValue());
        }
        return out;
    }

} // SignedUrls
