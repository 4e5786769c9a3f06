// GeolocationNormalizer.java
// reduces image metadata records written by several upstream producers,
// each with its own nesting convention, to GeoLocationRecord

package limited.theta.overlay;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Stateless normalizer. Each field is looked up with the same ordered
 * list of record shapes:
 * <ol>
 * <li>direct: {@code {latitude: 51.4}} or {@code {latitude: "51.4"}}</li>
 * <li>nested under a container: {@code {geolocation: {latitude: "51.4"}}}</li>
 * <li>typed attribute: {@code {M: {latitude: {N: "51.4"}}}}, possibly
 * under a container and possibly wrapped several levels deep</li>
 * </ol>
 * Latitude and longitude must come from the same shape; the optional
 * fields are resolved independently of each other.
 */
public class GeolocationNormalizer
{
    static final String[] LATITUDE = {"latitude", "lat", "Latitude", "GPSLatitude"};
    static final String[] LONGITUDE = {"longitude", "lng", "lon", "Longitude", "GPSLongitude"};
    static final String[] HEADING = {"heading", "imageDirection", "direction", "Heading", "GPSImgDirection"};
    static final String[] ALTITUDE = {"altitude", "Altitude", "GPSAltitude", "RelativeAltitude", "AbsoluteAltitude"};
    static final String[] TIMESTAMP = {"timestamp", "timestampText", "DateTimeOriginal", "dateTimeOriginal", "capturedAt"};
    static final String[] CAMERA_MODEL = {"cameraModel", "CameraModel", "Model", "model"};
    static final String[] DRONE_MODEL = {"droneModel", "DroneModel", "drone"};
    static final String[] URL = {"url", "presignedUrl", "ResourceUrl", "s3Url", "imageUrl"};
    static final String[] NAME = {"name", "FileName", "fileName"};

    // where producers tuck location data; nested paths are dot separated
    private static final String[] CONTAINERS = {
        "geolocation", "metadata", "metadata.geolocation", "metadata.coordinates", "coordinates"
    };

    private static final int MAX_WRAPPING = 8;

    // plain decimal or exponent notation; no hex floats or d/f type suffixes
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    /** Marker label for records that carry no file name. */
    public static final String UNNAMED = "Unnamed Image";

    /** One way of finding a raw field value inside a record. */
    interface Shape
    {
        Object locate(JSONObject record, String field);
    }

    static final Shape DIRECT = (record, field) -> plainValue(record.opt(field));

    static final Shape NESTED = (record, field) -> {
        for (String path : CONTAINERS) {
            JSONObject container = container(record, path);
            if (container != null) {
                Object v = plainValue(container.opt(field));
                if (v != null) {
                    return v;
                }
            }
        }
        return null;
    };

    static final Shape TYPED_ATTRIBUTE = (record, field) -> {
        Object v = typedValue(record, field);
        if (v != null) {
            return v;
        }
        for (String path : CONTAINERS) {
            JSONObject container = container(record, path);
            if (container != null) {
                v = typedValue(container, field);
                if (v != null) {
                    return v;
                }
            }
        }
        return null;
    };

    private static final List<Shape> SHAPES = List.of(DIRECT, NESTED, TYPED_ATTRIBUTE);

    /**
     * @param record a {@link JSONObject}, a {@link Map}, or a JSON string
     * @return the canonical record, or null when no shape yields both a
     *         latitude and a longitude
     */
    public GeoLocationRecord normalize(Object record)
    {
        JSONObject json = asJson(record);
        if (json == null) {
            return null;
        }

        Double latitude = null;
        Double longitude = null;
        for (Shape shape : SHAPES) {
            OptionalDouble lat = number(shape, json, LATITUDE);
            OptionalDouble lon = number(shape, json, LONGITUDE);
            if (lat.isPresent() && lon.isPresent()
                && Math.abs(lat.getAsDouble()) <= 90.0 && Math.abs(lon.getAsDouble()) <= 180.0) {
                latitude = lat.getAsDouble();
                longitude = lon.getAsDouble();
                break;
            }
        }
        if (latitude == null) {
            return null;
        }

        return new GeoLocationRecord(
            text(json, URL).orElse(""),
            text(json, NAME).orElse(UNNAMED),
            latitude,
            longitude,
            number(json, HEADING),
            number(json, ALTITUDE),
            text(json, TIMESTAMP),
            text(json, CAMERA_MODEL),
            text(json, DRONE_MODEL));
    }

    /** Normalizes every record, dropping the ones without a usable position. */
    public List<GeoLocationRecord> normalizeAll(Collection<?> records)
    {
        List<GeoLocationRecord> out = new ArrayList<>();
        if (records == null) {
            return out;
        }
        for (Object r : records) {
            GeoLocationRecord n = normalize(r);
            if (n != null) {
                out.add(n);
            }
        }
        return out;
    }

    public List<GeoLocationRecord> normalizeAll(JSONArray records)
    {
        List<Object> items = new ArrayList<>();
        if (records != null) {
            for (int i = 0; i < records.length(); i++) {
                items.add(records.opt(i));
            }
        }
        return normalizeAll(items);
    }

    // first shape that yields a finite number for any alias
    static OptionalDouble number(JSONObject record, String[] aliases)
    {
        for (Shape shape : SHAPES) {
            OptionalDouble v = number(shape, record, aliases);
            if (v.isPresent()) {
                return v;
            }
        }
        return OptionalDouble.empty();
    }

    static OptionalDouble number(Shape shape, JSONObject record, String[] aliases)
    {
        for (String field : aliases) {
            OptionalDouble v = toNumber(shape.locate(record, field), 0);
            if (v.isPresent()) {
                return v;
            }
        }
        return OptionalDouble.empty();
    }

    static Optional<String> text(JSONObject record, String[] aliases)
    {
        for (Shape shape : SHAPES) {
            for (String field : aliases) {
                Optional<String> v = toText(shape.locate(record, field), 0);
                if (v.isPresent()) {
                    return v;
                }
            }
        }
        return Optional.empty();
    }

    static OptionalDouble toNumber(Object raw, int depth)
    {
        if (raw == null || depth > MAX_WRAPPING) {
            return OptionalDouble.empty();
        }
        if (raw instanceof Number) {
            double d = ((Number) raw).doubleValue();
            return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
        }
        if (raw instanceof String) {
            String s = ((String) raw).trim();
            if (!DECIMAL.matcher(s).matches()) {
                return OptionalDouble.empty();
            }
            try {
                double d = Double.parseDouble(s);
                return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
            }
            catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        if (raw instanceof JSONObject) {
            return toNumber(unwrap((JSONObject) raw), depth + 1);
        }
        return OptionalDouble.empty();
    }

    static Optional<String> toText(Object raw, int depth)
    {
        if (raw == null || depth > MAX_WRAPPING) {
            return Optional.empty();
        }
        if (raw instanceof String) {
            String s = ((String) raw).trim();
            return s.isEmpty() ? Optional.empty() : Optional.of(s);
        }
        if (raw instanceof Number) {
            return Optional.of(raw.toString());
        }
        if (raw instanceof JSONObject) {
            return toText(unwrap((JSONObject) raw), depth + 1);
        }
        return Optional.empty();
    }

    // one layer of {N: ...}, {S: ...} or {M: ...} type tagging
    private static Object unwrap(JSONObject wrapper)
    {
        for (String tag : new String[] {"N", "S", "M"}) {
            Object inner = wrapper.opt(tag);
            if (inner != null && inner != JSONObject.NULL) {
                return inner;
            }
        }
        return null;
    }

    private static Object plainValue(Object v)
    {
        return v instanceof Number || v instanceof String ? v : null;
    }

    private static Object typedValue(JSONObject container, String field)
    {
        JSONObject map = container.optJSONObject("M");
        if (map != null) {
            Object v = map.opt(field);
            if (v instanceof JSONObject) {
                return v;
            }
        }
        Object v = container.opt(field);
        if (v instanceof JSONObject && isTypeTagged((JSONObject) v)) {
            return v;
        }
        return null;
    }

    private static boolean isTypeTagged(JSONObject o)
    {
        return o.has("N") || o.has("S") || o.has("M");
    }

    private static JSONObject container(JSONObject record, String path)
    {
        JSONObject current = record;
        for (String part : path.split("\\.")) {
            current = current.optJSONObject(part);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private static JSONObject asJson(Object record)
    {
        if (record instanceof JSONObject) {
            return (JSONObject) record;
        }
        if (record instanceof Map) {
            try {
                return new JSONObject((Map<?, ?>) record);
            }
            catch (JSONException | IllegalArgumentException e) {
                return null;
            }
        }
        if (record instanceof String) {
            try {
                return new JSONObject((String) record);
            }
            catch (JSONException e) {
                return null;
            }
        }
        return null;
    }

} // GeolocationNormalizer
