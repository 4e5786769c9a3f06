// OverlayPhase.java

package limited.theta.overlay;

public enum OverlayPhase
{
    IDLE,
    LOCATING,
    FETCHING,
    DECODING,
    RENDERED,
    FALLBACK,
    FAILED;

    public boolean isTerminal()
    {
        return this == RENDERED || this == FALLBACK || this == FAILED;
    }

    public boolean isInFlight()
    {
        return this == LOCATING || this == FETCHING || this == DECODING;
    }

} // OverlayPhase
