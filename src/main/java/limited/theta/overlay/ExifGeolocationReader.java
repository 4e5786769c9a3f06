// ExifGeolocationReader.java
// pull position, heading and camera details out of a geotagged drone
// image when the store has no metadata record for it

package limited.theta.overlay;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.GeoLocation;
import com.drew.lang.Rational;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import com.drew.metadata.xmp.XmpDirectory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ExifGeolocationReader
{
    private static final Logger log = LoggerFactory.getLogger(ExifGeolocationReader.class);

    private static final String[] XMP_HEADING = {"drone-dji:GimbalYawDegree", "drone-dji:FlightYawDegree"};
    private static final String[] XMP_DRONE_MODEL = {"drone-dji:Model", "drone:Model", "tiff:Model"};

    /**
     * @return the image's location, or null when the bytes are not a
     *         readable image or carry no usable GPS position
     */
    public GeoLocationRecord read(byte[] imageBytes, String url, String name)
    {
        if (imageBytes == null || imageBytes.length == 0) {
            return null;
        }
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(new ByteArrayInputStream(imageBytes), imageBytes.length);
        }
        catch (ImageProcessingException | IOException e) {
            log.debug("No readable metadata in {}: {}", name, e.getMessage());
            return null;
        }

        GpsDirectory gps = metadata.getFirstDirectoryOfType(GpsDirectory.class);
        GeoLocation location = gps == null ? null : gps.getGeoLocation();
        if (location == null || location.isZero()
            || !Double.isFinite(location.getLatitude()) || !Double.isFinite(location.getLongitude())) {
            log.debug("No GPS position in {}", name);
            return null;
        }

        Map<String, String> xmp = xmpProperties(metadata);

        OptionalDouble heading = rational(gps, GpsDirectory.TAG_IMG_DIRECTION);
        if (!heading.isPresent()) {
            heading = xmpNumber(xmp, XMP_HEADING);
        }

        OptionalDouble altitude = rational(gps, GpsDirectory.TAG_ALTITUDE);
        if (altitude.isPresent()) {
            Integer ref = gps.getInteger(GpsDirectory.TAG_ALTITUDE_REF);
            if (ref != null && ref == 1) {
                altitude = OptionalDouble.of(-altitude.getAsDouble()); // below sea level
            }
        }

        ExifSubIFDDirectory exif = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
        ExifIFD0Directory ifd0 = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);

        Optional<String> timestamp = exif == null ? Optional.empty()
            : nonEmpty(exif.getString(ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL));
        Optional<String> camera = Optional.empty();
        if (ifd0 != null) {
            String make = ifd0.getString(ExifIFD0Directory.TAG_MAKE);
            String model = ifd0.getString(ExifIFD0Directory.TAG_MODEL);
            camera = nonEmpty(make == null ? model : model == null ? make : make.trim() + " " + model.trim());
        }
        Optional<String> drone = Optional.empty();
        for (String key : XMP_DRONE_MODEL) {
            drone = nonEmpty(xmp.get(key));
            if (drone.isPresent()) {
                break;
            }
        }

        return new GeoLocationRecord(url, name, location.getLatitude(), location.getLongitude(),
                                     heading, altitude, timestamp, camera, drone);
    }

    private static Map<String, String> xmpProperties(Metadata metadata)
    {
        XmpDirectory xmp = metadata.getFirstDirectoryOfType(XmpDirectory.class);
        return xmp == null ? Map.of() : xmp.getXmpProperties();
    }

    private static OptionalDouble rational(GpsDirectory gps, int tag)
    {
        Rational r = gps.getRational(tag);
        if (r == null || r.getDenominator() == 0) {
            return OptionalDouble.empty();
        }
        double d = r.doubleValue();
        return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
    }

    private static OptionalDouble xmpNumber(Map<String, String> xmp, String[] keys)
    {
        for (String key : keys) {
            OptionalDouble v = GeolocationNormalizer.toNumber(xmp.get(key), 0);
            if (v.isPresent()) {
                return v;
            }
        }
        return OptionalDouble.empty();
    }

    private static Optional<String> nonEmpty(String s)
    {
        return s == null || s.trim().isEmpty() ? Optional.empty() : Optional.of(s.trim());
    }

} // ExifGeolocationReader
