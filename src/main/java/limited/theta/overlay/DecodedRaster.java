// DecodedRaster.java

package limited.theta.overlay;

/**
 * A descriptor plus its sample planes: one double[] per band, each
 * row-major and widthPx * heightPx long.
 */
public final class DecodedRaster
{
    private final RasterDescriptor descriptor;
    private final double[][] planes;

    public DecodedRaster(RasterDescriptor descriptor, double[][] planes)
    {
        this.descriptor = descriptor;
        this.planes = planes;
    }

    public RasterDescriptor getDescriptor() { return descriptor; }

    // shared, not copied; the compositor only reads them
    public double[][] getPlanes() { return planes; }

} // DecodedRaster
