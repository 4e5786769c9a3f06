// GeoTiffDecoder.java
// read a GeoTIFF payload held in memory: check the container signature,
// pull grid size, sample layout and georeferencing out of the first
// image directory, then read the sample planes

package limited.theta.overlay;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import mil.nga.tiff.util.TiffException;

import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.proj.LongLatProjection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GeoTiffDecoder
{
    private static final Logger log = LoggerFactory.getLogger(GeoTiffDecoder.class);

    static final int TAG_STRIP_OFFSETS = 273;
    static final int TAG_STRIP_BYTE_COUNTS = 279;
    static final int TAG_TILE_OFFSETS = 324;
    static final int TAG_TILE_BYTE_COUNTS = 325;
    static final int TAG_MODEL_PIXEL_SCALE = 33550;
    static final int TAG_MODEL_TIEPOINT = 33922;
    static final int TAG_MODEL_TRANSFORMATION = 34264;
    static final int TAG_GEOKEY_DIRECTORY = 34735;

    static final int GEOKEY_RASTER_TYPE = 1025;
    static final int GEOKEY_GEOGRAPHIC_CRS = 2048;
    static final int GEOKEY_PROJECTED_CRS = 3072;
    static final int RASTER_PIXEL_IS_POINT = 2;

    private static final int TIFF_MAGIC = 42;
    private static final int HEADER_LENGTH = 8;

    private final CRSFactory crsFactory = new CRSFactory();

    /**
     * Reads the descriptor and every sample plane.
     *
     * @throws RasterFormatException INVALID_FORMAT for a bad signature,
     *         UNSUPPORTED_FORMAT for a band count other than 1, 3 or 4 or a
     *         non-geographic extent, MISSING_GEOREFERENCING when no
     *         placement tags exist, CORRUPT_PAYLOAD when the declared
     *         layout runs past the end of the bytes
     */
    public DecodedRaster decode(byte[] bytes) throws RasterFormatException
    {
        try {
            FileDirectory directory = firstDirectory(bytes);
            RasterDescriptor descriptor = describe(directory);
            checkDataWithinPayload(directory, bytes.length);

            double[][] planes = readPlanes(directory, descriptor);
            log.info("Decoded GeoTIFF {}", descriptor);
            return new DecodedRaster(descriptor, planes);
        }
        catch (RuntimeException e) {
            throw corrupt(e);
        }
    }

    /** Descriptor only; sample data is not read. */
    public RasterDescriptor describe(byte[] bytes) throws RasterFormatException
    {
        try {
            return describe(firstDirectory(bytes));
        }
        catch (RuntimeException e) {
            throw corrupt(e);
        }
    }

    private static RasterFormatException corrupt(RuntimeException e)
    {
        log.debug("Unexpected failure reading GeoTIFF", e);
        return new RasterFormatException(ErrorKind.CORRUPT_PAYLOAD, "unreadable raster: " + e, e);
    }

    /**
     * True when the bytes start with one of the two TIFF byte-order
     * markers, the magic number, and a first-directory offset that
     * lands inside the payload.
     */
    public static boolean hasTiffSignature(byte[] bytes)
    {
        return signatureProblem(bytes) == null;
    }

    private static String signatureProblem(byte[] bytes)
    {
        if (bytes == null || bytes.length < HEADER_LENGTH) {
            return "payload too short for a TIFF header";
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        if (bytes[0] == 'I' && bytes[1] == 'I') {
            buf.order(ByteOrder.LITTLE_ENDIAN);
        } else if (bytes[0] == 'M' && bytes[1] == 'M') {
            buf.order(ByteOrder.BIG_ENDIAN);
        } else {
            return "no TIFF byte-order marker";
        }
        int magic = buf.getShort(2) & 0xFFFF;
        if (magic != TIFF_MAGIC) {
            return "TIFF magic number is " + magic + ", expected 42";
        }
        long ifdOffset = buf.getInt(4) & 0xFFFFFFFFL;
        if (ifdOffset < HEADER_LENGTH || ifdOffset + 2 > bytes.length) {
            return "first directory offset " + ifdOffset + " is outside the " + bytes.length + " byte payload";
        }
        return null;
    }

    private FileDirectory firstDirectory(byte[] bytes) throws RasterFormatException
    {
        String problem = signatureProblem(bytes);
        if (problem != null) {
            throw new RasterFormatException(ErrorKind.INVALID_FORMAT, problem);
        }
        try {
            TIFFImage tiffImage = TiffReader.readTiff(bytes);
            List<FileDirectory> directories = tiffImage.getFileDirectories();
            if (directories == null || directories.isEmpty()) {
                throw new RasterFormatException(ErrorKind.CORRUPT_PAYLOAD, "TIFF has no image directory");
            }
            return directories.get(0);
        }
        catch (TiffException e) {
            throw new RasterFormatException(ErrorKind.UNSUPPORTED_FORMAT, "TIFF structure not readable: " + e.getMessage(), e);
        }
        catch (RasterFormatException e) {
            throw e;
        }
        catch (Exception e) {
            throw new RasterFormatException(ErrorKind.CORRUPT_PAYLOAD, "TIFF directory could not be read: " + e, e);
        }
    }

    RasterDescriptor describe(FileDirectory directory) throws RasterFormatException
    {
        int width;
        int height;
        int samplesPerPixel;
        int[] bits;
        try {
            width = directory.getImageWidth().intValue();
            height = directory.getImageHeight().intValue();
            samplesPerPixel = directory.getSamplesPerPixel();
            List<Integer> bitsList = directory.getBitsPerSample();
            bits = new int[bitsList == null ? 0 : bitsList.size()];
            for (int i = 0; i < bits.length; i++) {
                bits[i] = bitsList.get(i);
            }
        }
        catch (RuntimeException e) {
            throw new RasterFormatException(ErrorKind.CORRUPT_PAYLOAD, "image directory lacks basic tags: " + e, e);
        }
        if (width <= 0 || height <= 0) {
            throw new RasterFormatException(ErrorKind.CORRUPT_PAYLOAD,
                                            "declared size " + width + "x" + height + " is empty");
        }
        if (samplesPerPixel != 1 && samplesPerPixel != 3 && samplesPerPixel != 4) {
            throw new RasterFormatException(ErrorKind.UNSUPPORTED_FORMAT,
                samplesPerPixel + "-band rasters are not supported (1, 3 or 4 bands only)");
        }

        double[] grid = georeference(directory, width, height);
        BoundingBox box = new BoundingBox(grid[0], grid[1], grid[2], grid[3]);

        List<Number> geoKeys = numbers(directory, TAG_GEOKEY_DIRECTORY);
        String crsCode = horizontalCrs(geoKeys);
        String crsDescription = crsCode == null ? null : describeCrs(crsCode);

        if (!box.isGeographic()) {
            throw new RasterFormatException(ErrorKind.UNSUPPORTED_FORMAT,
                "bounding box " + box + " is not in longitude/latitude"
                + (crsCode == null ? "" : " (" + crsCode + ")") + "; reprojection is not supported");
        }
        return new RasterDescriptor(width, height, samplesPerPixel, bits, box, grid[4], grid[5],
                                    crsCode, crsDescription);
    }

    // {minLon, minLat, maxLon, maxLat, xRes, yRes}
    private double[] georeference(FileDirectory directory, int width, int height) throws RasterFormatException
    {
        List<Number> scale = numbers(directory, TAG_MODEL_PIXEL_SCALE);
        List<Number> tiepoint = numbers(directory, TAG_MODEL_TIEPOINT);
        List<Number> transform = numbers(directory, TAG_MODEL_TRANSFORMATION);

        double originX;
        double originY;
        double sx;
        double sy;
        if (scale != null && scale.size() >= 2 && tiepoint != null && tiepoint.size() >= 6) {
            sx = scale.get(0).doubleValue();
            sy = scale.get(1).doubleValue();
            double i = tiepoint.get(0).doubleValue();
            double j = tiepoint.get(1).doubleValue();
            originX = tiepoint.get(3).doubleValue() - i * sx;
            originY = tiepoint.get(4).doubleValue() + j * sy;
        } else if (transform != null && transform.size() >= 16) {
            // row-major 4x4; only the 2D affine part matters
            double a1 = transform.get(0).doubleValue();
            double a2 = transform.get(1).doubleValue();
            double b1 = transform.get(4).doubleValue();
            double b2 = transform.get(5).doubleValue();
            if (a2 != 0.0 || b1 != 0.0) {
                throw new RasterFormatException(ErrorKind.UNSUPPORTED_FORMAT,
                                                "rotated ModelTransformation rasters are not supported");
            }
            sx = a1;
            sy = -b2;
            originX = transform.get(3).doubleValue();
            originY = transform.get(7).doubleValue();
        } else {
            throw new RasterFormatException(ErrorKind.MISSING_GEOREFERENCING,
                "no ModelPixelScale/ModelTiepoint or ModelTransformation tags");
        }

        if (!(sx > 0.0) || !(sy > 0.0) || !Double.isFinite(originX) || !Double.isFinite(originY)) {
            throw new RasterFormatException(ErrorKind.MISSING_GEOREFERENCING,
                "georeferencing gives pixel size (" + sx + ", " + sy + "), which cannot place the raster");
        }

        // PixelIsPoint tiepoints name the pixel centre; shift to its corner
        if (rasterType(numbers(directory, TAG_GEOKEY_DIRECTORY)) == RASTER_PIXEL_IS_POINT) {
            originX -= 0.5 * sx;
            originY += 0.5 * sy;
        }

        double minLon = originX;
        double maxLat = originY;
        double maxLon = minLon + width * sx;
        double minLat = maxLat - height * sy;
        if (!Double.isFinite(maxLon) || !Double.isFinite(minLat)) {
            throw new RasterFormatException(ErrorKind.MISSING_GEOREFERENCING,
                "georeferencing overflows: extent (" + minLon + ", " + minLat + ", " + maxLon + ", " + maxLat + ")");
        }
        return new double[] {minLon, minLat, maxLon, maxLat, sx, -sy};
    }

    private void checkDataWithinPayload(FileDirectory directory, int length) throws RasterFormatException
    {
        List<Number> offsets = numbers(directory, TAG_STRIP_OFFSETS);
        List<Number> counts = numbers(directory, TAG_STRIP_BYTE_COUNTS);
        if (offsets == null || counts == null) {
            offsets = numbers(directory, TAG_TILE_OFFSETS);
            counts = numbers(directory, TAG_TILE_BYTE_COUNTS);
        }
        if (offsets == null || counts == null) {
            throw new RasterFormatException(ErrorKind.CORRUPT_PAYLOAD, "no strip or tile offsets declared");
        }
        if (offsets.size() != counts.size()) {
            throw new RasterFormatException(ErrorKind.CORRUPT_PAYLOAD,
                offsets.size() + " data offsets but " + counts.size() + " byte counts");
        }
        for (int i = 0; i < offsets.size(); i++) {
            long end = offsets.get(i).longValue() + counts.get(i).longValue();
            if (end > length) {
                throw new RasterFormatException(ErrorKind.CORRUPT_PAYLOAD,
                    "image data block " + i + " ends at byte " + end + " of a " + length + " byte payload");
            }
        }
    }

    private double[][] readPlanes(FileDirectory directory, RasterDescriptor descriptor) throws RasterFormatException
    {
        Rasters rasters;
        try {
            rasters = directory.readRasters();
        }
        catch (TiffException e) {
            throw new RasterFormatException(ErrorKind.UNSUPPORTED_FORMAT, "pixel data not readable: " + e.getMessage(), e);
        }
        catch (RuntimeException e) {
            throw new RasterFormatException(ErrorKind.CORRUPT_PAYLOAD, "pixel data truncated or inconsistent: " + e, e);
        }
        if (rasters == null) {
            throw new RasterFormatException(ErrorKind.CORRUPT_PAYLOAD, "no raster data in first directory");
        }

        int width = rasters.getWidth();
        int height = rasters.getHeight();
        int bands = rasters.getSamplesPerPixel();
        if (width != descriptor.getWidthPx() || height != descriptor.getHeightPx()
            || bands != descriptor.getSamplesPerPixel()) {
            throw new RasterFormatException(ErrorKind.CORRUPT_PAYLOAD,
                "pixel data is " + width + "x" + height + "x" + bands + " but the directory declares "
                + descriptor.getWidthPx() + "x" + descriptor.getHeightPx() + "x" + descriptor.getSamplesPerPixel());
        }

        double[][] planes = new double[bands][width * height];
        try {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    for (int b = 0; b < bands; b++) {
                        planes[b][y * width + x] = rasters.getPixelSample(b, x, y).doubleValue();
                    }
                }
            }
        }
        catch (RuntimeException e) {
            throw new RasterFormatException(ErrorKind.CORRUPT_PAYLOAD, "sample read failed: " + e, e);
        }
        return planes;
    }

    static String horizontalCrs(List<Number> geoKeys)
    {
        int code = geoKeyValue(geoKeys, GEOKEY_GEOGRAPHIC_CRS);
        if (code <= 0) {
            code = geoKeyValue(geoKeys, GEOKEY_PROJECTED_CRS);
        }
        // 32767 is "user defined"; nothing proj4j can look up
        return code <= 0 || code == 32767 ? null : "EPSG:" + code;
    }

    private static int rasterType(List<Number> geoKeys)
    {
        return geoKeyValue(geoKeys, GEOKEY_RASTER_TYPE);
    }

    // GeoKey directory: 4-short header, then (keyId, location, count, value) per key
    private static int geoKeyValue(List<Number> geoKeys, int keyId)
    {
        if (geoKeys == null) {
            return -1;
        }
        for (int i = 4; i + 3 < geoKeys.size(); i += 4) {
            if (geoKeys.get(i).intValue() == keyId && geoKeys.get(i + 1).intValue() == 0) {
                return geoKeys.get(i + 3).intValue();
            }
        }
        return -1;
    }

    private String describeCrs(String epsgCode)
    {
        try {
            CoordinateReferenceSystem crs = crsFactory.createFromName(epsgCode);
            String kind = crs.getProjection() instanceof LongLatProjection ? "geographic" : "projected";
            return crs.getName() + " (" + kind + ", " + crs.getProjection().getName() + ")";
        }
        catch (RuntimeException e) {
            log.debug("Could not describe {}: {}", epsgCode, e.getMessage());
            return epsgCode + " (unknown to proj4j)";
        }
    }

    /** Tag values as numbers, whether the entry holds a list or a single value. */
    static List<Number> numbers(FileDirectory directory, int tag)
    {
        FieldTagType type = FieldTagType.getById(tag);
        if (type == null) {
            return null;
        }
        for (FileDirectoryEntry entry : directory.getEntries()) {
            if (entry.getFieldTag() != type) {
                continue;
            }
            Object values = entry.getValues();
            List<Number> out = new ArrayList<>();
            if (values instanceof List<?>) {
                for (Object v : (List<?>) values) {
                    if (v instanceof Number) {
                        out.add((Number) v);
                    }
                }
            } else if (values instanceof Number) {
                out.add((Number) values);
            }
            return out;
        }
        return null;
    }

} // GeoTiffDecoder
