// FallbackVisualizer.java
// estimate where a raster would have been when it cannot be shown

package limited.theta.overlay;

import java.util.Collection;

public class FallbackVisualizer
{
    private final double marginDegrees;
    private final double viewOffsetDegrees;

    public FallbackVisualizer(double marginDegrees, double viewOffsetDegrees)
    {
        this.marginDegrees = marginDegrees;
        this.viewOffsetDegrees = viewOffsetDegrees;
    }

    public FallbackVisualizer(PipelineConfig config)
    {
        this(config.getFallbackMarginDegrees(), config.getFallbackViewOffsetDegrees());
    }

    /**
     * Extent of the known image locations padded by the margin, or a
     * small square around the map view centre when there are none.
     */
    public CornerQuad polygon(Collection<GeoLocationRecord> knownLocations, double viewLon, double viewLat)
    {
        BoundingBox extent = BoundingBox.enclosing(knownLocations);
        if (extent != null) {
            return extent.padded(marginDegrees).corners();
        }
        return BoundingBox.around(viewLon, viewLat, viewOffsetDegrees).corners();
    }

} // FallbackVisualizer
