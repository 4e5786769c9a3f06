// ReassemblyFailedException.java

package limited.theta.overlay;

/**
 * A chunk group could not be turned into one payload. When a specific
 * part failed, its index is reported and the part's own failure is the
 * cause; a group with no resolvable parts reports index -1.
 */
public class ReassemblyFailedException extends RasterPipelineException
{
    public static final int NO_PART = -1;

    private final String groupId;
    private final int failedPartIndex;

    public ReassemblyFailedException(String groupId, int failedPartIndex, String message, Throwable cause)
    {
        super(ErrorKind.REASSEMBLY_FAILURE, message, cause);
        this.groupId = groupId;
        this.failedPartIndex = failedPartIndex;
    }

    public ReassemblyFailedException(String groupId, String message)
    {
        this(groupId, NO_PART, message, null);
    }

    public String getGroupId() { return groupId; }
    public int getFailedPartIndex() { return failedPartIndex; }

    // true when nothing in the group was resolvable, so retrying cannot help
    public boolean isMalformedGroup() { return failedPartIndex == NO_PART; }

} // ReassemblyFailedException
