// RasterCompositor.java
// sample planes to an 8-bit RGBA buffer pinned to the raster's corners

package limited.theta.overlay;

public class RasterCompositor
{
    private static final int OPAQUE = 255;

    public PixelBuffer composite(DecodedRaster raster) throws RasterFormatException
    {
        return composite(raster.getDescriptor(), raster.getPlanes());
    }

    /**
     * One band is grey (copied to R, G and B); three bands are RGB; four
     * are RGBA with the last plane as alpha. Samples are rounded and
     * clamped to 0..255.
     *
     * @throws RasterFormatException CORRUPT_PAYLOAD when the plane count
     *         or any plane length disagrees with the descriptor,
     *         UNSUPPORTED_FORMAT for other band counts
     */
    public PixelBuffer composite(RasterDescriptor descriptor, double[][] planes) throws RasterFormatException
    {
        int bands = descriptor.getSamplesPerPixel();
        if (bands != 1 && bands != 3 && bands != 4) {
            throw new RasterFormatException(ErrorKind.UNSUPPORTED_FORMAT, bands + "-band rasters cannot be composited");
        }
        if (planes == null || planes.length != bands) {
            throw new RasterFormatException(ErrorKind.CORRUPT_PAYLOAD, "expected " + bands + " sample planes, got "
                                            + (planes == null ? 0 : planes.length));
        }

        long pixels = descriptor.pixelCount();
        if (pixels * 4 > Integer.MAX_VALUE) {
            throw new RasterFormatException(ErrorKind.CORRUPT_PAYLOAD,
                descriptor.getWidthPx() + "x" + descriptor.getHeightPx() + " is too large for one buffer");
        }
        for (int b = 0; b < bands; b++) {
            if (planes[b] == null || planes[b].length != pixels) {
                throw new RasterFormatException(ErrorKind.CORRUPT_PAYLOAD,
                    "plane " + b + " holds " + (planes[b] == null ? 0 : planes[b].length) + " samples, expected "
                    + pixels + " (" + descriptor.getWidthPx() + "x" + descriptor.getHeightPx() + ")");
            }
        }

        int n = (int) pixels;
        byte[] rgba = new byte[n * 4];
        for (int i = 0; i < n; i++) {
            int o = i * 4;
            if (bands == 1) {
                byte grey = toByte(planes[0][i]);
                rgba[o] = grey;
                rgba[o + 1] = grey;
                rgba[o + 2] = grey;
                rgba[o + 3] = (byte) OPAQUE;
            } else {
                rgba[o] = toByte(planes[0][i]);
                rgba[o + 1] = toByte(planes[1][i]);
                rgba[o + 2] = toByte(planes[2][i]);
                rgba[o + 3] = bands == 4 ? toByte(planes[3][i]) : (byte) OPAQUE;
            }
        }
        return new PixelBuffer(descriptor.getWidthPx(), descriptor.getHeightPx(), rgba,
                               descriptor.getBoundingBox().corners());
    }

    static byte toByte(double sample)
    {
        if (Double.isNaN(sample)) {
            return 0;
        }
        long v = Math.round(sample);
        if (v < 0) {
            v = 0;
        } else if (v > 255) {
            v = 255;
        }
        return (byte) v;
    }

} // RasterCompositor
