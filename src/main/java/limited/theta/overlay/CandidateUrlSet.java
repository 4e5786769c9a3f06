// CandidateUrlSet.java

package limited.theta.overlay;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Ordered, duplicate-free list of URLs to try for one stored object.
 * The original URL is always first; later entries keep the order in
 * which they were offered.
 */
public final class CandidateUrlSet implements Iterable<String>
{
    private final List<String> urls;

    private CandidateUrlSet(List<String> urls)
    {
        this.urls = Collections.unmodifiableList(urls);
    }

    public static CandidateUrlSet of(String original, List<String> alternates)
    {
        LinkedHashSet<String> ordered = new LinkedHashSet<>();
        ordered.add(original);
        for (String alt : alternates) {
            if (alt != null && !alt.isEmpty()) {
                ordered.add(alt);
            }
        }
        return new CandidateUrlSet(new ArrayList<>(ordered));
    }

    public static CandidateUrlSet single(String original)
    {
        return new CandidateUrlSet(List.of(original));
    }

    public static CandidateUrlSet empty()
    {
        return new CandidateUrlSet(List.of());
    }

    public String getOriginal()
    {
        return urls.isEmpty() ? null : urls.get(0);
    }

    public List<String> asList() { return urls; }
    public int size() { return urls.size(); }
    public boolean isEmpty() { return urls.isEmpty(); }

    @Override
    public Iterator<String> iterator()
    {
        return urls.iterator();
    }

    @Override
    public String toString()
    {
        List<String> redacted = new ArrayList<>();
        for (String u : urls) {
            redacted.add(SignedUrls.redact(u));
        }
        return redacted.toString();
    }

} // CandidateUrlSet
