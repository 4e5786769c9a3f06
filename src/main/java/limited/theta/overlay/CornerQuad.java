// CornerQuad.java

package limited.theta.overlay;

import java.util.Arrays;

/**
 * Four ground-control corners as (longitude, latitude) pairs, ordered
 * top-left, top-right, bottom-right, bottom-left for a north-up raster.
 */
public final class CornerQuad
{
    public static final int TOP_LEFT = 0;
    public static final int TOP_RIGHT = 1;
    public static final int BOTTOM_RIGHT = 2;
    public static final int BOTTOM_LEFT = 3;

    private final double[][] corners;

    public CornerQuad(double[] topLeft, double[] topRight, double[] bottomRight, double[] bottomLeft)
    {
        this.corners = new double[][] {
            pair(topLeft), pair(topRight), pair(bottomRight), pair(bottomLeft)
        };
    }

    private static double[] pair(double[] lonLat)
    {
        if (lonLat == null || lonLat.length != 2) {
            throw new IllegalArgumentException("corner must be a (lon, lat) pair");
        }
        return lonLat.clone();
    }

    public double[] get(int corner)
    {
        return corners[corner].clone();
    }

    public double longitude(int corner) { return corners[corner][0]; }
    public double latitude(int corner) { return corners[corner][1]; }

    /** Fresh [4][2] copy, in corner order. */
    public double[][] toArray()
    {
        double[][] out = new double[4][];
        for (int i = 0; i < 4; i++) {
            out[i] = corners[i].clone();
        }
        return out;
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof CornerQuad && Arrays.deepEquals(corners, ((CornerQuad) o).corners);
    }

    @Override
    public int hashCode()
    {
        return Arrays.deepHashCode(corners);
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < 4; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append('(').append(corners[i][0]).append(',').append(corners[i][1]).append(')');
        }
        return sb.append(']').toString();
    }

} // CornerQuad
