// ProgressTracker.java

package limited.theta.overlay;

final class ProgressTracker
{
    private final long declaredLength;
    private final ProgressListener listener;
    private long received;
    private int lastReported = -1;
    private boolean finished;

    ProgressTracker(long declaredLength, ProgressListener listener)
    {
        this.declaredLength = declaredLength;
        this.listener = listener == null ? ProgressListener.NONE : listener;
    }

    void advance(long bytes)
    {
        received += bytes;
        if (declaredLength <= 0 || finished) {
            return; // no content-length: only the terminal 100 is reported
        }
        int percent = (int) Math.min(99L, received * 100L / declaredLength);
        if (percent > lastReported) {
            lastReported = percent;
            listener.onProgress(percent);
        }
    }

    void finish()
    {
        if (!finished) {
            finished = true;
            lastReported = 100;
            listener.onProgress(100);
        }
    }

    long getReceived() { return received; }

} // ProgressTracker
