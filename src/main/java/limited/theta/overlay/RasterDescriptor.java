// RasterDescriptor.java

package limited.theta.overlay;

import java.util.Arrays;

/**
 * What the decoder learned from a raster's first image directory: pixel
 * grid size, sample layout and where the grid sits on the ground.
 */
public final class RasterDescriptor
{
    private final int widthPx;
    private final int heightPx;
    private final int samplesPerPixel;
    private final int[] bitsPerSample;
    private final BoundingBox boundingBox;
    private final double xResolution;
    private final double yResolution;
    private final String crsCode;
    private final String crsDescription;

    public RasterDescriptor(int widthPx, int heightPx, int samplesPerPixel, int[] bitsPerSample,
                            BoundingBox boundingBox, double xResolution, double yResolution,
                            String crsCode, String crsDescription)
    {
        this.widthPx = widthPx;
        this.heightPx = heightPx;
        this.samplesPerPixel = samplesPerPixel;
        this.bitsPerSample = bitsPerSample == null ? new int[0] : bitsPerSample.clone();
        this.boundingBox = boundingBox;
        this.xResolution = xResolution;
        this.yResolution = yResolution;
        this.crsCode = crsCode;
        this.crsDescription = crsDescription;
    }

    public RasterDescriptor(int widthPx, int heightPx, int samplesPerPixel, BoundingBox boundingBox)
    {
        this(widthPx, heightPx, samplesPerPixel, null, boundingBox, Double.NaN, Double.NaN, null, null);
    }

    public int getWidthPx() { return widthPx; }
    public int getHeightPx() { return heightPx; }
    public int getSamplesPerPixel() { return samplesPerPixel; }
    public int[] getBitsPerSample() { return bitsPerSample.clone(); }
    public BoundingBox getBoundingBox() { return boundingBox; }

    public boolean hasResolution() { return !Double.isNaN(xResolution) && !Double.isNaN(yResolution); }

    // degrees per pixel; y is negative for a north-up grid
    public double getXResolution() { return xResolution; }
    public double getYResolution() { return yResolution; }

    /** e.g. "EPSG:4326", or null when the raster carries no GeoKey directory. */
    public String getCrsCode() { return crsCode; }
    public String getCrsDescription() { return crsDescription; }

    public long pixelCount()
    {
        return (long) widthPx * heightPx;
    }

    @Override
    public String toString()
    {
        return widthPx + "x" + heightPx + " px, " + samplesPerPixel + " band(s)"
            + (bitsPerSample.length == 0 ? "" : " " + Arrays.toString(bitsPerSample) + " bits")
            + ", bbox " + boundingBox
            + (hasResolution() ? ", res (" + xResolution + ", " + yResolution + ")" : "")
            + (crsCode == null ? "" : ", " + crsCode);
    }

} // RasterDescriptor
