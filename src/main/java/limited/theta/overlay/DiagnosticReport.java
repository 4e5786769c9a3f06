// DiagnosticReport.java
// offline troubleshooting artifact for a raster that would not load;
// every URL in it is redacted

package limited.theta.overlay;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.json.JSONArray;
import org.json.JSONObject;

public final class DiagnosticReport
{
    private final Instant generatedAt;
    private final String originalUrl;
    private final List<String> candidateUrls;
    private final ErrorKind errorKind;
    private final String message;
    private final List<FetchAttempt> attempts;
    private final List<ProbeResult> probes;
    private final Instant signatureExpiresAt;
    private final List<String> recommendations;

    private DiagnosticReport(Instant generatedAt, String originalUrl, List<String> candidateUrls,
                             ErrorKind errorKind, String message, List<FetchAttempt> attempts,
                             List<ProbeResult> probes, Instant signatureExpiresAt,
                             List<String> recommendations)
    {
        this.generatedAt = generatedAt;
        this.originalUrl = originalUrl;
        this.candidateUrls = Collections.unmodifiableList(candidateUrls);
        this.errorKind = errorKind;
        this.message = message;
        this.attempts = Collections.unmodifiableList(attempts);
        this.probes = Collections.unmodifiableList(probes);
        this.signatureExpiresAt = signatureExpiresAt;
        this.recommendations = Collections.unmodifiableList(recommendations);
    }

    /**
     * @param failure  may be null when only probes are being reported
     * @param probes   may be null or empty
     */
    public static DiagnosticReport build(String originalUrl, CandidateUrlSet candidates,
                                         RasterPipelineException failure, List<ProbeResult> probes,
                                         Instant now)
    {
        List<String> redactedCandidates = new ArrayList<>();
        if (candidates != null) {
            for (String c : candidates) {
                redactedCandidates.add(SignedUrls.redact(c));
            }
        }
        List<FetchAttempt> attempts = attemptsOf(failure);
        List<ProbeResult> probeList = probes == null ? List.of() : new ArrayList<>(probes);
        Optional<Instant> expires = originalUrl == null ? Optional.empty() : SignedUrls.expiresAt(originalUrl);

        List<String> advice = recommend(failure, attempts, probeList, expires.orElse(null), now);
        return new DiagnosticReport(now, SignedUrls.redact(originalUrl == null ? "" : originalUrl),
                                    redactedCandidates,
                                    failure == null ? null : failure.getKind(),
                                    failure == null ? null : failure.getMessage(),
                                    attempts, probeList, expires.orElse(null), advice);
    }

    private static List<FetchAttempt> attemptsOf(Throwable failure)
    {
        Throwable t = failure;
        while (t != null) {
            if (t instanceof FetchFailedException) {
                return new ArrayList<>(((FetchFailedException) t).getAttempts());
            }
            t = t.getCause();
        }
        return new ArrayList<>();
    }

    private static List<String> recommend(RasterPipelineException failure, List<FetchAttempt> attempts,
                                          List<ProbeResult> probes, Instant expiresAt, Instant now)
    {
        List<String> advice = new ArrayList<>();
        if (expiresAt != null && now.isAfter(expiresAt)) {
            advice.add("The signed URL expired at " + expiresAt + "; request a fresh link from the resource store.");
        }
        if (sawStatus(attempts, probes, 403)) {
            advice.add("Access was denied (HTTP 403). The link may have expired or the object may not be readable "
                       + "anonymously; regenerate the signed URL or check the bucket policy.");
        }
        if (sawStatus(attempts, probes, 404)) {
            advice.add("The object was not found (HTTP 404). Check that the upload finished and that the key, "
                       + "including any special characters, matches the stored file name.");
        }
        boolean networkOnly = !attempts.isEmpty();
        for (FetchAttempt a : attempts) {
            networkOnly &= !a.hasStatus() && a.getAttemptNumber() > 0;
        }
        if (networkOnly) {
            advice.add("No server answered; check connectivity, proxies and CORS settings.");
        }
        if (failure != null && failure.getKind().isFormatProblem()) {
            advice.add("The file downloaded but could not be decoded (" + failure.getKind()
                       + "); download the original and inspect it with GIS tooling.");
        }
        if (failure instanceof ReassemblyFailedException) {
            ReassemblyFailedException r = (ReassemblyFailedException) failure;
            advice.add(r.isMalformedGroup()
                       ? "The chunked upload has no usable parts; upload the file again."
                       : "Part " + r.getFailedPartIndex() + " of the chunked upload is missing or unreadable; "
                         + "re-upload it or retry.");
        }
        if (advice.isEmpty()) {
            advice.add("Retry the request; if it keeps failing, share this report with support.");
        }
        return advice;
    }

    private static boolean sawStatus(List<FetchAttempt> attempts, List<ProbeResult> probes, int status)
    {
        for (FetchAttempt a : attempts) {
            if (a.getStatusCode() == status) {
                return true;
            }
        }
        for (ProbeResult p : probes) {
            if (p.getStatusCode() == status) {
                return true;
            }
        }
        return false;
    }

    public Instant getGeneratedAt() { return generatedAt; }
    public String getOriginalUrl() { return originalUrl; }
    public List<String> getCandidateUrls() { return candidateUrls; }
    public ErrorKind getErrorKind() { return errorKind; }
    public String getMessage() { return message; }
    public List<FetchAttempt> getAttempts() { return attempts; }
    public List<ProbeResult> getProbes() { return probes; }
    public List<String> getRecommendations() { return recommendations; }

    public JSONObject toJson()
    {
        JSONObject o = new JSONObject();
        o.put("generatedAt", generatedAt.toString());
        o.put("originalUrl", originalUrl);
        o.put("candidateUrls", new JSONArray(candidateUrls));
        if (errorKind != null) {
            o.put("errorKind", errorKind.name());
            o.put("errorDescription", errorKind.getDescription());
        }
        if (message != null) {
            o.put("message", message);
        }
        if (signatureExpiresAt != null) {
            o.put("signatureExpiresAt", signatureExpiresAt.toString());
        }

        JSONArray steps = new JSONArray();
        for (FetchAttempt a : attempts) {
            JSONObject step = new JSONObject();
            step.put("url", a.getUrl());
            step.put("attempt", a.getAttemptNumber());
            if (a.hasStatus()) {
                step.put("status", a.getStatusCode());
            }
            step.put("message", a.getMessage());
            steps.put(step);
        }
        o.put("attempts", steps);

        JSONArray probeArray = new JSONArray();
        for (ProbeResult p : probes) {
            JSONObject probe = new JSONObject();
            probe.put("url", p.getRedactedUrl());
            probe.put("reachable", p.isReachable());
            if (p.getStatusCode() != FetchAttempt.NO_STATUS) {
                probe.put("status", p.getStatusCode());
            }
            probe.put("rangeRequest", p.isViaRangeRequest());
            if (p.getContentType() != null) {
                probe.put("contentType", p.getContentType());
            }
            if (p.getContentLength() >= 0) {
                probe.put("contentLength", p.getContentLength());
            }
            if (p.getMessage() != null) {
                probe.put("message", p.getMessage());
            }
            probeArray.put(probe);
        }
        o.put("probes", probeArray);
        o.put("recommendations", new JSONArray(recommendations));
        return o;
    }

    public String toText()
    {
        StringBuilder sb = new StringBuilder();
        sb.append("Raster resource diagnostic report\n");
        sb.append("Generated: ").append(generatedAt).append('\n');
        sb.append("Original URL: ").append(originalUrl).append('\n');
        if (signatureExpiresAt != null) {
            sb.append("Signature expires: ").append(signatureExpiresAt).append('\n');
        }
        if (errorKind != null) {
            sb.append("Error: ").append(errorKind).append(" (").append(errorKind.getDescription()).append(")\n");
        }
        if (message != null) {
            sb.append("Message: ").append(message).append('\n');
        }
        sb.append("\nCandidate URLs:\n");
        for (int i = 0; i < candidateUrls.size(); i++) {
            sb.append(String.format(Locale.ROOT, "  %d. %s%n", i + 1, candidateUrls.get(i)));
        }
        if (!attempts.isEmpty()) {
            sb.append("\nAttempts:\n");
            for (FetchAttempt a : attempts) {
                sb.append("  ").append(a).append('\n');
            }
        }
        if (!probes.isEmpty()) {
            sb.append("\nProbes:\n");
            for (ProbeResult p : probes) {
                sb.append("  ").append(p).append('\n');
            }
        }
        sb.append("\nRecommendations:\n");
        for (String r : recommendations) {
            sb.append("  - ").append(r).append('\n');
        }
        return sb.toString();
    }

    /** Writes JSON when the file name ends in .json, plain text otherwise. */
    public Path writeTo(Path file) throws IOException
    {
        String name = file.getFileName() == null ? "" : file.getFileName().toString().toLowerCase(Locale.ROOT);
        String content = name.endsWith(".json") ? toJson().toString(2) : toText();
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }

} // DiagnosticReport
