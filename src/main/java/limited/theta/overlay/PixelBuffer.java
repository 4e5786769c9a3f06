// PixelBuffer.java

package limited.theta.overlay;

/**
 * Immutable RGBA raster ready for a map host: width * height * 4 bytes,
 * row-major, plus the corners it should be pinned to.
 */
public final class PixelBuffer
{
    private final int width;
    private final int height;
    private final byte[] rgba;
    private final CornerQuad corners;

    public PixelBuffer(int width, int height, byte[] rgba, CornerQuad corners)
    {
        if ((long) width * height * 4 != rgba.length) {
            throw new IllegalArgumentException("RGBA buffer of " + rgba.length + " bytes does not match "
                                               + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.rgba = rgba.clone();
        this.corners = corners;
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public CornerQuad getCorners() { return corners; }

    /** Copy of the RGBA bytes. */
    public byte[] getRgba()
    {
        return rgba.clone();
    }

    public int byteLength()
    {
        return rgba.length;
    }

    /** {r, g, b, a}, each 0..255. */
    public int[] pixel(int x, int y)
    {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("(" + x + "," + y + ") outside " + width + "x" + height);
        }
        int i = (y * width + x) * 4;
        return new int[] {rgba[i] & 0xFF, rgba[i + 1] & 0xFF, rgba[i + 2] & 0xFF, rgba[i + 3] & 0xFF};
    }

    @Override
    public String toString()
    {
        return "PixelBuffer(" + width + "x" + height + ", corners " + corners + ")";
    }

} // PixelBuffer
