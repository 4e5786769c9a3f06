// ProgressListener.java

package limited.theta.overlay;

/**
 * Receives download progress as a percentage of the declared content
 * length. Values never decrease and stay at or below 99 until every
 * byte has been assembled, at which point exactly one 100 is delivered.
 */
@FunctionalInterface
public interface ProgressListener
{
    ProgressListener NONE = percent -> { };

    void onProgress(int percent);

} // ProgressListener
