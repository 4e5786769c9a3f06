// OverlayStateListener.java

package limited.theta.overlay;

/**
 * Told about every state change of an {@link OverlayPlacementController}.
 * Called from pipeline worker threads, never while the controller holds
 * its lock.
 */
@FunctionalInterface
public interface OverlayStateListener
{
    OverlayStateListener NONE = state -> { };

    void onStateChanged(OverlayState state);

} // OverlayStateListener
