// ChunkGroup.java

package limited.theta.overlay;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The uploaded parts of one logical file, in part-index order. Always
 * built by {@link ChunkReassembler#identifyGroups}, which never yields a
 * group of fewer than two parts; a group can be built directly (for
 * example from an explicit manifest) with any number of parts.
 */
public final class ChunkGroup
{
    private final String baseId;
    private final List<ResourceReference> parts;
    private final List<Integer> partIndices;

    public ChunkGroup(String baseId, List<ResourceReference> parts, List<Integer> partIndices)
    {
        if (parts.size() != partIndices.size()) {
            throw new IllegalArgumentException("parts and partIndices differ in length");
        }
        this.baseId = baseId;
        this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
        this.partIndices = Collections.unmodifiableList(new ArrayList<>(partIndices));
    }

    public String getBaseId() { return baseId; }
    public List<ResourceReference> getParts() { return parts; }
    public List<Integer> getPartIndices() { return partIndices; }
    public int size() { return parts.size(); }
    public boolean isEmpty() { return parts.isEmpty(); }

    public ResourceReference getFirst()
    {
        return parts.isEmpty() ? null : parts.get(0);
    }

    /** File name of the first part with its part marker removed. */
    public String displayFileName()
    {
        ResourceReference first = getFirst();
        return first == null ? baseId : ChunkReassembler.stripPartMarker(first.getFileName());
    }

    @Override
    public boolean equals(Object o)
    {
        if (!(o instanceof ChunkGroup)) {
            return false;
        }
        ChunkGroup other = (ChunkGroup) o;
        return baseId.equals(other.baseId) && parts.equals(other.parts) && partIndices.equals(other.partIndices);
    }

    @Override
    public int hashCode()
    {
        return baseId.hashCode() * 31 + parts.hashCode();
    }

    @Override
    public String toString()
    {
        return "ChunkGroup(" + baseId + ", parts " + partIndices + ")";
    }

} // ChunkGroup
