// BoundingBox.java
// geographic rectangle in degrees, longitude first

package limited.theta.overlay;

import java.util.Collection;
import java.util.Objects;

public final class BoundingBox
{
    private final double minLon;
    private final double minLat;
    private final double maxLon;
    private final double maxLat;

    public BoundingBox(double minLon, double minLat, double maxLon, double maxLat)
    {
        if (!(Double.isFinite(minLon) && Double.isFinite(minLat)
              && Double.isFinite(maxLon) && Double.isFinite(maxLat))) {
            throw new IllegalArgumentException("bounding box values must be finite");
        }
        if (minLon > maxLon || minLat > maxLat) {
            throw new IllegalArgumentException("inverted bounding box: " + minLon + "," + minLat
                                               + " .. " + maxLon + "," + maxLat);
        }
        this.minLon = minLon;
        this.minLat = minLat;
        this.maxLon = maxLon;
        this.maxLat = maxLat;
    }

    /** Square of half-size {@code offset} around a point. */
    public static BoundingBox around(double lon, double lat, double offset)
    {
        return new BoundingBox(lon - offset, lat - offset, lon + offset, lat + offset);
    }

    /** Smallest box holding every record's position, or null for none. */
    public static BoundingBox enclosing(Collection<GeoLocationRecord> records)
    {
        if (records == null || records.isEmpty()) {
            return null;
        }
        double minLon = Double.POSITIVE_INFINITY;
        double minLat = Double.POSITIVE_INFINITY;
        double maxLon = Double.NEGATIVE_INFINITY;
        double maxLat = Double.NEGATIVE_INFINITY;
        for (GeoLocationRecord r : records) {
            minLon = Math.min(minLon, r.getLongitude());
            maxLon = Math.max(maxLon, r.getLongitude());
            minLat = Math.min(minLat, r.getLatitude());
            maxLat = Math.max(maxLat, r.getLatitude());
        }
        return new BoundingBox(minLon, minLat, maxLon, maxLat);
    }

    public double getMinLon() { return minLon; }
    public double getMinLat() { return minLat; }
    public double getMaxLon() { return maxLon; }
    public double getMaxLat() { return maxLat; }

    public double width() { return maxLon - minLon; }
    public double height() { return maxLat - minLat; }

    public BoundingBox padded(double margin)
    {
        return new BoundingBox(minLon - margin, minLat - margin, maxLon + margin, maxLat + margin);
    }

    public boolean isGeographic()
    {
        return minLon >= -180.0 && maxLon <= 180.0 && minLat >= -90.0 && maxLat <= 90.0;
    }

    /** (minLon,maxLat), (maxLon,maxLat), (maxLon,minLat), (minLon,minLat). */
    public CornerQuad corners()
    {
        return new CornerQuad(
            new double[] {minLon, maxLat},
            new double[] {maxLon, maxLat},
            new double[] {maxLon, minLat},
            new double[] {minLon, minLat});
    }

    @Override
    public boolean equals(Object o)
    {
        if (!(o instanceof BoundingBox)) {
            return false;
        }
        BoundingBox b = (BoundingBox) o;
        return Double.compare(minLon, b.minLon) == 0 && Double.compare(minLat, b.minLat) == 0
            && Double.compare(maxLon, b.maxLon) == 0 && Double.compare(maxLat, b.maxLat) == 0;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(minLon, minLat, maxLon, maxLat);
    }

    @Override
    public String toString()
    {
        return "(" + minLon + ", " + minLat + ", " + maxLon + ", " + maxLat + ")";
    }

} // BoundingBox
