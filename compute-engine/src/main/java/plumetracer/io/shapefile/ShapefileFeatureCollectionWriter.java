package plumetracer.io.shapefile;

import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Polygon;
import plumetracer.domain.exception.WriteFailedException;
import plumetracer.domain.feature.FeatureCollection;
import plumetracer.domain.feature.FeatureSchema;
import plumetracer.domain.feature.PolygonFeature;
import plumetracer.io.AtomicFileTransaction;
import plumetracer.io.FeatureCollectionWriter;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import static plumetracer.io.shapefile.ShapefileConstants.*;

/**
 * Escribe la colección como ESRI Shapefile: .shp (geometrías), .shx (índice), .dbf (atributo)
 * y .prj (WGS84).
 * <p>
 * Cada feature es un registro Polygon con el anillo exterior en sentido horario (requisito del
 * formato) y los huecos, si los hay, en antihorario. El atributo es un campo numérico dBase
 * {@code N(24,15)}. Los cuatro ficheros se preparan como temporales y el .shp se mueve el último.
 */
@Slf4j
public class ShapefileFeatureCollectionWriter implements FeatureCollectionWriter {

    private static final double SCIENTIFIC_BELOW = 1e-3;

    private final Clock clock;

    public ShapefileFeatureCollectionWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "ESRI Shapefile";
    }

    @Override
    public boolean supports(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".shp");
    }

    @Override
    public void write(FeatureCollection collection, Path path) {
        FeatureSchema schema = collection.schema();
        String fieldName = schema.attributeName();
        if (fieldName.length() > DBF_FIELD_NAME_MAX || !StandardCharsets.US_ASCII.newEncoder().canEncode(fieldName)) {
            throw new WriteFailedException(path.toString(), "El atributo '" + fieldName
                    + "' no cabe en un campo dBase (máximo " + DBF_FIELD_NAME_MAX + " caracteres ASCII)");
        }

        List<byte[]> records = new ArrayList<>();
        Envelope bounds = new Envelope();
        for (PolygonFeature feature : collection.features()) {
            records.add(encodePolygon(feature.polygon()));
            bounds.expandToInclude(feature.polygon().getEnvelopeInternal());
        }

        String fileName = path.getFileName().toString();
        try (AtomicFileTransaction tx = new AtomicFileTransaction()) {
            Files.write(tx.stage(path.resolveSibling(sibling(fileName, ".dbf"))), encodeDbf(collection, fieldName));
            Files.write(tx.stage(path.resolveSibling(sibling(fileName, ".shx"))), encodeShx(records, bounds));
            Files.write(tx.stage(path.resolveSibling(sibling(fileName, ".prj"))), WGS84_PRJ.getBytes(StandardCharsets.US_ASCII));
            // El .shp va el último: su presencia indica un shapefile completo
            Files.write(tx.stage(path), encodeShp(records, bounds));
            tx.commit();
        } catch (IOException e) {
            throw new WriteFailedException(path.toString(), "Error escribiendo el shapefile: " + e.getMessage(), e);
        }
        log.info("Shapefile escrito en {} ({} feature(s))", path, collection.size());
    }

    private static byte[] encodePolygon(Polygon polygon) {
        List<Coordinate[]> parts = new ArrayList<>();
        parts.add(oriented(polygon.getExteriorRing().getCoordinates(), false));
        for (int k = 0; k < polygon.getNumInteriorRing(); k++) {
            parts.add(oriented(polygon.getInteriorRingN(k).getCoordinates(), true));
        }
        int numPoints = parts.stream().mapToInt(p -> p.length).sum();
        int size = 4 + 32 + 4 + 4 + 4 * parts.size() + 16 * numPoints;

        Envelope env = polygon.getEnvelopeInternal();
        ByteBuffer buf = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(SHAPE_POLYGON);
        buf.putDouble(env.getMinX()).putDouble(env.getMinY()).putDouble(env.getMaxX()).putDouble(env.getMaxY());
        buf.putInt(parts.size());
        buf.putInt(numPoints);
        int index = 0;
        for (Coordinate[] part : parts) {
            buf.putInt(index);
            index += part.length;
        }
        for (Coordinate[] part : parts) {
            for (Coordinate c : part) {
                buf.putDouble(c.x).putDouble(c.y);
            }
        }
        return buf.array();
    }

    private static Coordinate[] oriented(Coordinate[] ring, boolean counterClockwise) {
        if (Orientation.isCCW(ring) == counterClockwise) {
            return ring;
        }
        Coordinate[] reversed = Arrays.copyOf(ring, ring.length);
        for (int a = 0, b = reversed.length - 1; a < b; a++, b--) {
            Coordinate tmp = reversed[a];
            reversed[a] = reversed[b];
            reversed[b] = tmp;
        }
        return reversed;
    }

    private static byte[] encodeShp(List<byte[]> records, Envelope bounds) {
        int length = HEADER_BYTES + records.stream().mapToInt(r -> RECORD_HEADER_BYTES + r.length).sum();
        ByteBuffer buf = ByteBuffer.allocate(length);
        writeHeader(buf, length, bounds);
        int number = 1;
        for (byte[] record : records) {
            buf.order(ByteOrder.BIG_ENDIAN);
            buf.putInt(number++);
            buf.putInt(record.length / 2);
            buf.put(record);
        }
        return buf.array();
    }

    private static byte[] encodeShx(List<byte[]> records, Envelope bounds) {
        int length = HEADER_BYTES + 8 * records.size();
        ByteBuffer buf = ByteBuffer.allocate(length);
        writeHeader(buf, length, bounds);
        buf.order(ByteOrder.BIG_ENDIAN);
        int offset = HEADER_BYTES;
        for (byte[] record : records) {
            buf.putInt(offset / 2);
            buf.putInt(record.length / 2);
            offset += RECORD_HEADER_BYTES + record.length;
        }
        return buf.array();
    }

    /**
     * Cabecera común de .shp y .shx. La longitud va en palabras de 16 bits.
     */
    private static void writeHeader(ByteBuffer buf, int lengthBytes, Envelope bounds) {
        buf.order(ByteOrder.BIG_ENDIAN);
        buf.putInt(FILE_CODE);
        for (int k = 0; k < 5; k++) {
            buf.putInt(0);
        }
        buf.putInt(lengthBytes / 2);
        buf.order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(VERSION);
        buf.putInt(SHAPE_POLYGON);
        if (bounds.isNull()) {
            buf.putDouble(0).putDouble(0).putDouble(0).putDouble(0);
        } else {
            buf.putDouble(bounds.getMinX()).putDouble(bounds.getMinY())
                    .putDouble(bounds.getMaxX()).putDouble(bounds.getMaxY());
        }
        // Z y M no se usan
        buf.putDouble(0).putDouble(0).putDouble(0).putDouble(0);
    }

    private byte[] encodeDbf(FeatureCollection collection, String fieldName) {
        int recordLength = 1 + DBF_NUMERIC_LENGTH;
        int headerLength = DBF_HEADER_BYTES + DBF_FIELD_DESCRIPTOR_BYTES + 1;
        int n = collection.size();
        ByteBuffer buf = ByteBuffer.allocate(headerLength + n * recordLength + 1).order(ByteOrder.LITTLE_ENDIAN);

        LocalDate today = LocalDate.now(clock);
        buf.put(DBF_VERSION);
        buf.put((byte) (today.getYear() - 1900));
        buf.put((byte) today.getMonthValue());
        buf.put((byte) today.getDayOfMonth());
        buf.putInt(n);
        buf.putShort((short) headerLength);
        buf.putShort((short) recordLength);
        buf.put(new byte[20]);

        byte[] name = new byte[11];
        byte[] ascii = fieldName.getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(ascii, 0, name, 0, ascii.length);
        buf.put(name);
        buf.put((byte) DBF_NUMERIC);
        buf.put(new byte[4]);
        buf.put((byte) DBF_NUMERIC_LENGTH);
        buf.put((byte) DBF_NUMERIC_DECIMALS);
        buf.put(new byte[14]);
        buf.put(DBF_HEADER_TERMINATOR);

        for (PolygonFeature feature : collection.features()) {
            buf.put((byte) ' ');
            buf.put(formatNumeric(feature.level()).getBytes(StandardCharsets.US_ASCII));
        }
        buf.put(DBF_EOF);
        return buf.array();
    }

    /**
     * Texto alineado a la derecha en 24 caracteres. Si la parte entera no deja sitio a 15 decimales
     * se reducen los decimales. Los valores por debajo de 1e-3 se escriben en notación científica
     * para no perder cifras significativas (p. ej. razones de mezcla en mol/mol).
     */
    static String formatNumeric(double value) {
        if (value != 0.0 && Math.abs(value) < SCIENTIFIC_BELOW) {
            return String.format(Locale.ROOT, "%" + DBF_NUMERIC_LENGTH + "." + DBF_NUMERIC_DECIMALS + "e", value);
        }
        for (int decimals = DBF_NUMERIC_DECIMALS; decimals >= 0; decimals--) {
            String text = String.format(Locale.ROOT, "%" + DBF_NUMERIC_LENGTH + "." + decimals + "f", value);
            if (text.length() <= DBF_NUMERIC_LENGTH) {
                return text;
            }
        }
        throw new IllegalArgumentException("Valor demasiado grande para un campo N(24): " + value);
    }
}
