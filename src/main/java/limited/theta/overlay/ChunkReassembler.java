// ChunkReassembler.java
// finds resources that were uploaded as numbered parts and stitches them
// back into one payload; parts are fetched in parallel but always joined
// in part-index order

package limited.theta.overlay;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ChunkReassembler
{
    private static final Logger log = LoggerFactory.getLogger(ChunkReassembler.class);

    // resource_1744387026560_470a236d_part8_Orthophoto.tif, survey_part2.tif, survey_part3
    private static final Pattern UNDERSCORE_PART = Pattern.compile("_part(\\d+)(?=[_.]|$)", Pattern.CASE_INSENSITIVE);
    // survey.tif.part0, as the browser-side chunker names them
    private static final Pattern DOT_PART = Pattern.compile("\\.part(\\d+)$", Pattern.CASE_INSENSITIVE);

    private final FetchEngine engine;
    private final ResourceLocator locator;

    public ChunkReassembler(FetchEngine engine, ResourceLocator locator)
    {
        this.engine = engine;
        this.locator = locator;
    }

    /**
     * Groups references that share a base identifier once their part
     * marker is stripped. An explicit partGroupId/partIndex on a
     * reference wins over what its id or file name says. Groups with
     * fewer than two members are dropped. Groups come back in the order
     * their first member was seen; parts are sorted by index, ties kept
     * in discovery order.
     */
    public static List<ChunkGroup> identifyGroups(List<ResourceReference> resources)
    {
        Map<String, List<PartInfo>> byBase = new LinkedHashMap<>();
        int position = 0;
        for (ResourceReference ref : resources) {
            PartInfo info = partInfo(ref, position++);
            if (info != null) {
                byBase.computeIfAbsent(info.baseId, k -> new ArrayList<>()).add(info);
            }
        }

        List<ChunkGroup> groups = new ArrayList<>();
        for (Map.Entry<String, List<PartInfo>> e : byBase.entrySet()) {
            List<PartInfo> members = e.getValue();
            if (members.size() < 2) {
                continue;
            }
            // List.sort is stable, so equal indices keep discovery order
            members.sort(Comparator.comparingInt(p -> p.sortKey()));

            List<ResourceReference> parts = new ArrayList<>();
            List<Integer> indices = new ArrayList<>();
            for (PartInfo p : members) {
                parts.add(p.ref);
                indices.add(p.index < 0 ? p.position : p.index);
            }
            groups.add(new ChunkGroup(e.getKey(), parts, indices));
        }
        log.debug("Identified {} chunk groups among {} resources", groups.size(), resources.size());
        return groups;
    }

    /** Removes the part marker from a file name; names without one come back unchanged. */
    public static String stripPartMarker(String name)
    {
        if (name == null) {
            return null;
        }
        Matcher dot = DOT_PART.matcher(name);
        if (dot.find()) {
            return name.substring(0, dot.start());
        }
        Matcher underscore = UNDERSCORE_PART.matcher(name);
        if (underscore.find()) {
            return name.substring(0, underscore.start()) + name.substring(underscore.end());
        }
        return name;
    }

    static PartInfo partInfo(ResourceReference ref, int position)
    {
        Marker fromName = marker(ref.getResourceId());
        if (fromName == null) {
            fromName = marker(ref.getFileName());
        }

        String base = ref.getPartGroupId();
        if (base == null || base.isEmpty()) {
            if (fromName == null) {
                return null;
            }
            base = fromName.base;
        }
        int index = ref.hasPartIndex() ? ref.getPartIndex() : (fromName == null ? -1 : fromName.index);
        return new PartInfo(ref, base, index, position);
    }

    private static Marker marker(String name)
    {
        if (name == null || name.isEmpty()) {
            return null;
        }
        Matcher dot = DOT_PART.matcher(name);
        if (dot.find()) {
            return new Marker(name.substring(0, dot.start()), parseIndex(dot.group(1)));
        }
        Matcher underscore = UNDERSCORE_PART.matcher(name);
        if (underscore.find()) {
            return new Marker(name.substring(0, underscore.start()), parseIndex(underscore.group(1)));
        }
        return null;
    }

    private static int parseIndex(String digits)
    {
        try {
            return Integer.parseInt(digits);
        }
        catch (NumberFormatException e) {
            return Integer.MAX_VALUE; // absurdly long index, sorts last
        }
    }

    /**
     * Fetches every part and joins them in index order. Completes
     * exceptionally with {@link ReassemblyFailedException} when the group
     * is empty or any part cannot be fetched; no partial payload is ever
     * returned. Cancelling the returned future cancels the part fetches.
     */
    public CompletableFuture<FetchOutcome> reassemble(ChunkGroup group)
    {
        return reassemble(group, ProgressListener.NONE);
    }

    /**
     * As {@link #reassemble(ChunkGroup)}, reporting the mean progress of
     * the parts. 100 is reported once, after the payload is joined.
     */
    public CompletableFuture<FetchOutcome> reassemble(ChunkGroup group, ProgressListener progress)
    {
        CompletableFuture<FetchOutcome> result = new CompletableFuture<>();

        List<ResourceReference> parts = group.getParts();
        boolean anyResolvable = false;
        for (ResourceReference part : parts) {
            anyResolvable |= !part.getPrimaryUrl().isEmpty();
        }
        if (!anyResolvable) {
            result.completeExceptionally(new ReassemblyFailedException(group.getBaseId(),
                "Chunk group " + group.getBaseId() + " has no resolvable parts"));
            return result;
        }

        log.info("Reassembling {} from {} parts", group.getBaseId(), parts.size());
        GroupProgress groupProgress = new GroupProgress(parts.size(), progress);
        List<CompletableFuture<FetchOutcome>> fetches = new ArrayList<>();
        for (int i = 0; i < parts.size(); i++) {
            int part = i;
            fetches.add(engine.fetch(locator.generateCandidates(parts.get(i)), ContentTypes.BINARY,
                                     percent -> groupProgress.onPart(part, percent)));
        }
        // one bad part sinks the group, so stop the others early
        for (CompletableFuture<FetchOutcome> f : fetches) {
            f.whenComplete((outcome, error) -> {
                if (error != null) {
                    cancelAll(fetches);
                }
            });
        }

        result.whenComplete((outcome, error) -> {
            if (result.isCancelled()) {
                cancelAll(fetches);
            }
        });

        CompletableFuture.allOf(fetches.toArray(new CompletableFuture[0]))
            .whenComplete((ignored, error) -> {
                try {
                    FetchOutcome joined = join(group, fetches);
                    groupProgress.done();
                    result.complete(joined);
                }
                catch (ReassemblyFailedException e) {
                    result.completeExceptionally(e);
                }
            });
        return result;
    }

    private static void cancelAll(List<CompletableFuture<FetchOutcome>> fetches)
    {
        for (CompletableFuture<FetchOutcome> f : fetches) {
            f.cancel(true);
        }
    }

    // every fetch has finished here
    private static FetchOutcome join(ChunkGroup group, List<CompletableFuture<FetchOutcome>> fetches)
        throws ReassemblyFailedException
    {
        int failedAt = -1;
        Throwable failure = null;
        for (int i = 0; i < fetches.size(); i++) {
            CompletableFuture<FetchOutcome> f = fetches.get(i);
            if (!f.isCompletedExceptionally()) {
                continue;
            }
            Throwable cause = causeOf(f);
            // a part cancelled because a sibling failed is not the story
            if (failure == null || (failure instanceof CancellationException && !(cause instanceof CancellationException))) {
                failedAt = i;
                failure = cause;
            }
        }
        if (failure != null) {
            int partIndex = group.getPartIndices().get(failedAt);
            throw new ReassemblyFailedException(group.getBaseId(), partIndex,
                "Part " + partIndex + " of " + group.getBaseId() + " could not be fetched: " + failure.getMessage(),
                failure);
        }

        List<FetchOutcome> outcomes = new ArrayList<>();
        long total = 0;
        for (CompletableFuture<FetchOutcome> f : fetches) {
            FetchOutcome o = f.join();
            outcomes.add(o);
            total += o.getPayload().length;
        }
        if (total > Integer.MAX_VALUE - 8) {
            throw new ReassemblyFailedException(group.getBaseId(), ReassemblyFailedException.NO_PART,
                "Reassembled size " + total + " exceeds what one buffer can hold", null);
        }

        byte[] joined = new byte[(int) total];
        int offset = 0;
        for (FetchOutcome o : outcomes) {
            System.arraycopy(o.getPayload(), 0, joined, offset, o.getPayload().length);
            offset += o.getPayload().length;
        }

        FetchOutcome first = outcomes.get(0);
        String contentType = first.getContentType();
        if (contentType == null || contentType.isEmpty() || contentType.startsWith(ContentTypes.BINARY)) {
            String hint = group.getFirst().getContentTypeHint();
            if (hint != null && !hint.isEmpty()) {
                contentType = hint;
            }
        }
        log.info("Reassembled {} bytes for {}", joined.length, group.getBaseId());
        return new FetchOutcome(first.getSucceededUrl(), joined, contentType, group.displayFileName());
    }

    private static Throwable causeOf(CompletableFuture<FetchOutcome> f)
    {
        try {
            f.join();
            return null;
        }
        catch (CompletionException e) {
            return e.getCause() == null ? e : e.getCause();
        }
        catch (CancellationException e) {
            return e;
        }
    }

    private static final class Marker
    {
        final String base;
        final int index;

        Marker(String base, int index)
        {
            this.base = base;
            this.index = index;
        }
    }

    static final class PartInfo
    {
        final ResourceReference ref;
        final String baseId;
        final int index;     // -1 when neither the reference nor its name gives one
        final int position;  // discovery order

        PartInfo(ResourceReference ref, String baseId, int index, int position)
        {
            this.ref = ref;
            this.baseId = baseId;
            this.index = index;
            this.position = position;
        }

        int sortKey()
        {
            return index < 0 ? Integer.MAX_VALUE : index;
        }
    }

    // mean of the per-part percentages, held at 99 until the parts are joined
    private static final class GroupProgress
    {
        private final int[] parts;
        private final ProgressListener listener;
        private int last = -1;

        GroupProgress(int count, ProgressListener listener)
        {
            this.parts = new int[count];
            this.listener = listener == null ? ProgressListener.NONE : listener;
        }

        synchronized void onPart(int part, int percent)
        {
            parts[part] = Math.max(parts[part], percent);
            long sum = 0;
            for (int p : parts) {
                sum += p;
            }
            report((int) Math.min(99L, sum / parts.length));
        }

        synchronized void done()
        {
            report(100);
        }

        private void report(int percent)
        {
            if (percent > last) {
                last = percent;
                listener.onProgress(percent);
            }
        }
    }

} // ChunkReassembler
