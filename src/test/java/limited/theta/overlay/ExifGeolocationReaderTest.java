// ExifGeolocationReaderTest.java

package limited.theta.overlay;

import static org.junit.jupiter.api.Assertions.*;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.Test;

class ExifGeolocationReaderTest
{
    private static final double EPS = 1e-6;

    private final ExifGeolocationReader reader = new ExifGeolocationReader();

    @Test
    void readsGpsBlockOfADroneImage()
    {
        byte[] jpeg = jpegWithExif(true);
        GeoLocationRecord r = reader.read(jpeg, "https://h/DJI_0001.JPG", "DJI_0001.JPG");

        assertNotNull(r);
        assertEquals(51.4555, r.getLatitude(), EPS);
        assertEquals(-2.59, r.getLongitude(), EPS);
        assertEquals(271.5, r.getHeading().getAsDouble(), EPS);
        assertEquals(-12.5, r.getAltitude().getAsDouble(), EPS);
        assertEquals("DJI FC3582", r.getCameraModel().get());
        assertEquals("DJI_0001.JPG", r.getName());
        assertEquals("https://h/DJI_0001.JPG", r.getUrl());
        assertFalse(r.getDroneModel().isPresent());
    }

    @Test
    void imageWithoutGpsGivesNull()
        throws Exception
    {
        BufferedImage image = new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        assertTrue(ImageIO.write(image, "jpg", out));
        assertNull(reader.read(out.toByteArray(), "u", "plain.jpg"));
        assertNull(reader.read(jpegWithExif(false), "u", "no-gps.jpg"));
    }

    @Test
    void unreadableBytesGiveNull()
    {
        assertNull(reader.read("definitely not an image".getBytes(StandardCharsets.US_ASCII), "u", "x"));
        assertNull(reader.read(new byte[0], "u", "x"));
        assertNull(reader.read(null, "u", "x"));
    }

    // SOI, one APP1 Exif segment, EOI; big-endian TIFF block inside
    private static byte[] jpegWithExif(boolean withGps)
    {
        List<Tag> ifd0 = new ArrayList<>();
        ifd0.add(Tag.ascii(0x010F, "DJI"));
        ifd0.add(Tag.ascii(0x0110, "FC3582"));
        List<Tag> gps = new ArrayList<>();
        if (withGps) {
            int gpsOffset = 8 + length(ifd0) + 12; // ifd0 gains one more entry below
            ifd0.add(Tag.longValue(0x8825, gpsOffset));
            gps.add(Tag.ascii(0x0001, "N"));
            gps.add(Tag.rational(0x0002, 51, 1, 27, 1, 198, 10));
            gps.add(Tag.ascii(0x0003, "W"));
            gps.add(Tag.rational(0x0004, 2, 1, 35, 1, 24, 1));
            gps.add(Tag.byteValue(0x0005, 1));
            gps.add(Tag.rational(0x0006, 125, 10));
            gps.add(Tag.rational(0x0011, 2715, 10));
        }

        int gpsStart = 8 + length(ifd0);
        int total = gpsStart + (gps.isEmpty() ? 0 : length(gps));
        ByteBuffer tiff = ByteBuffer.allocate(total);
        tiff.put((byte) 'M').put((byte) 'M').putShort((short) 42).putInt(8);
        writeIfd(tiff, 8, ifd0);
        if (!gps.isEmpty()) {
            writeIfd(tiff, gpsStart, gps);
        }

        byte[] exifHeader = "Exif\0\0".getBytes(StandardCharsets.US_ASCII);
        int segmentLength = 2 + exifHeader.length + total;
        ByteBuffer jpeg = ByteBuffer.allocate(2 + 2 + segmentLength + 2);
        jpeg.put((byte) 0xFF).put((byte) 0xD8);
        jpeg.put((byte) 0xFF).put((byte) 0xE1).putShort((short) segmentLength);
        jpeg.put(exifHeader).put(tiff.array());
        jpeg.put((byte) 0xFF).put((byte) 0xD9);
        return jpeg.array();
    }

    private static int length(List<Tag> tags)
    {
        int n = 2 + tags.size() * 12 + 4;
        for (Tag t : tags) {
            if (t.value.length > 4) {
                n += t.value.length + (t.value.length % 2);
            }
        }
        return n;
    }

    private static void writeIfd(ByteBuffer buf, int offset, List<Tag> tags)
    {
        int extra = offset + 2 + tags.size() * 12 + 4;
        buf.position(offset);
        buf.putShort((short) tags.size());
        for (Tag t : tags) {
            buf.putShort((short) t.id).putShort((short) t.type).putInt(t.count);
            if (t.value.length <= 4) {
                buf.put(t.value);
                for (int i = t.value.length; i < 4; i++) {
                    buf.put((byte) 0);
                }
            } else {
                buf.putInt(extra);
                for (int i = 0; i < t.value.length; i++) {
                    buf.put(extra + i, t.value[i]);
                }
                extra += t.value.length + (t.value.length % 2);
            }
        }
        buf.putInt(0);
    }

    private static final class Tag
    {
        final int id;
        final int type;
        final int count;
        final byte[] value;

        Tag(int id, int type, int count, byte[] value)
        {
            this.id = id;
            this.type = type;
            this.count = count;
            this.value = value;
        }

        static Tag ascii(int id, String s)
        {
            byte[] v = (s + "\0").getBytes(StandardCharsets.US_ASCII);
            return new Tag(id, 2, v.length, v);
        }

        static Tag byteValue(int id, int v)
        {
            return new Tag(id, 1, 1, new byte[] {(byte) v});
        }

        static Tag longValue(int id, int v)
        {
            return new Tag(id, 4, 1, ByteBuffer.allocate(4).putInt(v).array());
        }

        static Tag rational(int id, int... numeratorsAndDenominators)
        {
            ByteBuffer b = ByteBuffer.allocate(numeratorsAndDenominators.length * 4);
            for (int n : numeratorsAndDenominators) {
                b.putInt(n);
            }
            return new Tag(id, 5, numeratorsAndDenominators.length / 2, b.array());
        }
    }

} // ExifGeolocationReaderTest
