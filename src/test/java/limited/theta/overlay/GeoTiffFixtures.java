// GeoTiffFixtures.java
// writes small uncompressed, single-strip, 8-bit GeoTIFFs in memory

package limited.theta.overlay;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

final class GeoTiffFixtures
{
    private static final int SHORT = 3;
    private static final int LONG = 4;
    private static final int DOUBLE = 12;

    private GeoTiffFixtures() { }

    static Builder builder(int width, int height, int bands)
    {
        return new Builder(width, height, bands);
    }

    /** Single band, every sample {@code value}, placed at (-1, 50)..(1, 52). */
    static byte[] grey(int width, int height, int value)
    {
        return builder(width, height, 1).fill(value).build();
    }

    static final class Builder
    {
        private final int width;
        private final int height;
        private final int bands;
        private byte[] samples;
        private ByteOrder order = ByteOrder.LITTLE_ENDIAN;
        private double[] pixelScale;
        private double[] tiepoint;
        private double[] transformation;
        private int epsg = -1;
        private int rasterType = -1;
        private long stripByteCountOverride = -1;

        Builder(int width, int height, int bands)
        {
            this.width = width;
            this.height = height;
            this.bands = bands;
            this.samples = new byte[width * height * bands];
            // two degrees wide, two tall, top-left at (-1, 52)
            this.pixelScale = new double[] {2.0 / width, 2.0 / height, 0.0};
            this.tiepoint = new double[] {0, 0, 0, -1.0, 52.0, 0};
        }

        Builder bigEndian()
        {
            order = ByteOrder.BIG_ENDIAN;
            return this;
        }

        Builder fill(int value)
        {
            for (int i = 0; i < samples.length; i++) {
                samples[i] = (byte) value;
            }
            return this;
        }

        /** Interleaved samples, pixel by pixel, band by band. */
        Builder samples(int... values)
        {
            if (values.length != samples.length) {
                throw new IllegalArgumentException("need " + samples.length + " samples");
            }
            for (int i = 0; i < values.length; i++) {
                samples[i] = (byte) values[i];
            }
            return this;
        }

        Builder placement(double minLon, double maxLat, double pixelWidth, double pixelHeight)
        {
            pixelScale = new double[] {pixelWidth, pixelHeight, 0.0};
            tiepoint = new double[] {0, 0, 0, minLon, maxLat, 0};
            transformation = null;
            return this;
        }

        Builder modelTransformation(double minLon, double maxLat, double pixelWidth, double pixelHeight)
        {
            pixelScale = null;
            tiepoint = null;
            transformation = new double[] {
                pixelWidth, 0, 0, minLon,
                0, -pixelHeight, 0, maxLat,
                0, 0, 0, 0,
                0, 0, 0, 1
            };
            return this;
        }

        Builder noGeoreferencing()
        {
            pixelScale = null;
            tiepoint = null;
            transformation = null;
            return this;
        }

        Builder epsg(int code)
        {
            epsg = code;
            return this;
        }

        Builder pixelIsPoint()
        {
            rasterType = 2;
            return this;
        }

        Builder declareStripByteCount(long count)
        {
            stripByteCountOverride = count;
            return this;
        }

        byte[] build()
        {
            List<Entry> entries = new ArrayList<>();
            int dataOffset = 8;
            int dataLength = samples.length;

            entries.add(Entry.longs(256, width));
            entries.add(Entry.longs(257, height));
            entries.add(Entry.shorts(258, repeat(8, bands)));
            entries.add(Entry.shorts(259, 1));
            entries.add(Entry.shorts(262, bands >= 3 ? 2 : 1));
            entries.add(Entry.longs(273, dataOffset));
            entries.add(Entry.shorts(277, bands));
            entries.add(Entry.longs(278, height));
            entries.add(Entry.longs(279, stripByteCountOverride >= 0 ? stripByteCountOverride : dataLength));
            entries.add(Entry.shorts(284, 1));
            int colourBands = bands >= 3 ? 3 : 1;
            if (bands > colourBands) {
                entries.add(Entry.shorts(338, repeat(bands == 4 ? 2 : 0, bands - colourBands)));
            }
            entries.add(Entry.shorts(339, repeat(1, bands)));
            if (pixelScale != null) {
                entries.add(Entry.doubles(33550, pixelScale));
            }
            if (tiepoint != null) {
                entries.add(Entry.doubles(33922, tiepoint));
            }
            if (transformation != null) {
                entries.add(Entry.doubles(34264, transformation));
            }
            List<Integer> keys = new ArrayList<>();
            if (rasterType > 0) {
                keys.add(1025);
                keys.add(rasterType);
            }
            if (epsg > 0) {
                keys.add(2048);
                keys.add(epsg);
            }
            if (!keys.isEmpty()) {
                long[] dir = new long[4 + keys.size() * 2];
                dir[0] = 1;
                dir[1] = 1;
                dir[2] = 0;
                dir[3] = keys.size() / 2;
                for (int k = 0; k < keys.size(); k += 2) {
                    int at = 4 + k * 2;
                    dir[at] = keys.get(k);
                    dir[at + 1] = 0;
                    dir[at + 2] = 1;
                    dir[at + 3] = keys.get(k + 1);
                }
                entries.add(Entry.shorts(34735, dir));
            }
            entries.sort(Comparator.comparingInt(e -> e.tag));

            int ifdOffset = dataOffset + dataLength;
            ifdOffset += ifdOffset % 2;
            int ifdSize = 2 + entries.size() * 12 + 4;
            int extraOffset = ifdOffset + ifdSize;
            int extraSize = 0;
            for (Entry e : entries) {
                if (e.byteLength() > 4) {
                    extraSize += e.byteLength() + (e.byteLength() % 2);
                }
            }

            ByteBuffer buf = ByteBuffer.allocate(extraOffset + extraSize).order(order);
            if (order == ByteOrder.LITTLE_ENDIAN) {
                buf.put((byte) 'I').put((byte) 'I');
            } else {
                buf.put((byte) 'M').put((byte) 'M');
            }
            buf.putShort((short) 42);
            buf.putInt(ifdOffset);
            buf.put(samples);

            buf.position(ifdOffset);
            buf.putShort((short) entries.size());
            int nextExtra = extraOffset;
            for (Entry e : entries) {
                buf.putShort((short) e.tag);
                buf.putShort((short) e.type);
                buf.putInt(e.values.length);
                if (e.byteLength() <= 4) {
                    int start = buf.position();
                    e.writeValues(buf);
                    buf.position(start + 4);
                } else {
                    buf.putInt(nextExtra);
                    int resume = buf.position();
                    buf.position(nextExtra);
                    e.writeValues(buf);
                    nextExtra += e.byteLength() + (e.byteLength() % 2);
                    buf.position(resume);
                }
            }
            buf.putInt(0); // no further directories
            return buf.array();
        }

        private static long[] repeat(long value, int count)
        {
            long[] out = new long[count];
            for (int i = 0; i < count; i++) {
                out[i] = value;
            }
            return out;
        }
    }

    private static final class Entry
    {
        final int tag;
        final int type;
        final long[] values;
        final double[] doubles;

        private Entry(int tag, int type, long[] values, double[] doubles)
        {
            this.tag = tag;
            this.type = type;
            this.values = values;
            this.doubles = doubles;
        }

        static Entry shorts(int tag, long... values)
        {
            return new Entry(tag, SHORT, values, null);
        }

        static Entry longs(int tag, long... values)
        {
            return new Entry(tag, LONG, values, null);
        }

        static Entry doubles(int tag, double... values)
        {
            return new Entry(tag, DOUBLE, new long[values.length], values);
        }

        int byteLength()
        {
            int size = type == SHORT ? 2 : type == LONG ? 4 : 8;
            return size * values.length;
        }

        void writeValues(ByteBuffer buf)
        {
            for (int i = 0; i < values.length; i++) {
                if (type == SHORT) {
                    buf.putShort((short) values[i]);
                } else if (type == LONG) {
                    buf.putInt((int) values[i]);
                } else {
                    buf.putDouble(doubles[i]);
                }
            }
        }
    }

} // GeoTiffFixtures
