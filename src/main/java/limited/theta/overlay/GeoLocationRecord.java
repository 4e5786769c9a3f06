// GeoLocationRecord.java

package limited.theta.overlay;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Canonical location of one geotagged image, ready to become a map
 * marker. Latitude and longitude are always present and finite; every
 * other field is optional.
 */
public final class GeoLocationRecord
{
    private final String url;
    private final String name;
    private final double latitude;
    private final double longitude;
    private final OptionalDouble heading;
    private final OptionalDouble altitude;
    private final Optional<String> timestampText;
    private final Optional<String> cameraModel;
    private final Optional<String> droneModel;

    public GeoLocationRecord(String url, String name, double latitude, double longitude,
                             OptionalDouble heading, OptionalDouble altitude,
                             Optional<String> timestampText, Optional<String> cameraModel,
                             Optional<String> droneModel)
    {
        if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) {
            throw new IllegalArgumentException("latitude and longitude must be finite");
        }
        this.url = url == null ? "" : url;
        this.name = name == null ? "" : name;
        this.latitude = latitude;
        this.longitude = longitude;
        this.heading = heading;
        this.altitude = altitude;
        this.timestampText = timestampText;
        this.cameraModel = cameraModel;
        this.droneModel = droneModel;
    }

    public static GeoLocationRecord at(String url, String name, double latitude, double longitude)
    {
        return new GeoLocationRecord(url, name, latitude, longitude, OptionalDouble.empty(),
                                     OptionalDouble.empty(), Optional.empty(), Optional.empty(),
                                     Optional.empty());
    }

    public String getUrl() { return url; }
    public String getName() { return name; }
    public double getLatitude() { return latitude; }
    public double getLongitude() { return longitude; }
    public OptionalDouble getHeading() { return heading; }
    public OptionalDouble getAltitude() { return altitude; }
    public Optional<String> getTimestampText() { return timestampText; }
    public Optional<String> getCameraModel() { return cameraModel; }
    public Optional<String> getDroneModel() { return droneModel; }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GeoLocationRecord)) {
            return false;
        }
        GeoLocationRecord r = (GeoLocationRecord) o;
        return Double.compare(latitude, r.latitude) == 0
            && Double.compare(longitude, r.longitude) == 0
            && url.equals(r.url) && name.equals(r.name)
            && heading.equals(r.heading) && altitude.equals(r.altitude)
            && timestampText.equals(r.timestampText)
            && cameraModel.equals(r.cameraModel) && droneModel.equals(r.droneModel);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(url, name, latitude, longitude, heading, altitude,
                            timestampText, cameraModel, droneModel);
    }

    @Override
    public String toString()
    {
        return "GeoLocationRecord(" + name + " @ " + latitude + "," + longitude
            + (heading.isPresent() ? " hdg " + heading.getAsDouble() : "")
            + (altitude.isPresent() ? " alt " + altitude.getAsDouble() : "") + ")";
    }

} // GeoLocationRecord
