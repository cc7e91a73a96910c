package plumetracer.io.shapefile;

import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import plumetracer.domain.feature.FeatureCollection;
import plumetracer.domain.feature.FeatureSchema;
import plumetracer.domain.feature.PolygonFeature;
import plumetracer.geometry.PolygonBuilder;
import plumetracer.io.FeatureCollectionReader;

import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static plumetracer.io.shapefile.ShapefileConstants.*;

/**
 * Lee un shapefile de polígonos con un único atributo numérico, como los que produce
 * {@link ShapefileFeatureCollectionWriter}.
 * <p>
 * Los registros con varias partes se interpretan como un anillo exterior (horario) seguido de sus
 * huecos. Los registros nulos se ignoran.
 */
public class ShapefileFeatureCollectionReader implements FeatureCollectionReader {

    private final GeometryFactory geometryFactory = new GeometryFactory(new PrecisionModel(), PolygonBuilder.WGS84_SRID);

    @Override
    public String getName() {
        return "ESRI Shapefile";
    }

    @Override
    public boolean supports(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".shp");
    }

    @Override
    public FeatureCollection read(Path path) throws IOException {
        Path dbfPath = path.resolveSibling(sibling(path.getFileName().toString(), ".dbf"));
        if (!Files.exists(path) || !Files.exists(dbfPath)) {
            throw new NoSuchFileException(path.toString(), dbfPath.toString(), "Shapefile incompleto");
        }
        try {
            List<Polygon> polygons = readShp(ByteBuffer.wrap(Files.readAllBytes(path)), path);
            DbfTable table = readDbf(ByteBuffer.wrap(Files.readAllBytes(dbfPath)), dbfPath);
            if (table.values().size() != polygons.size()) {
                throw new IOException(String.format("%s tiene %d geometrías y %s %d registros",
                        path, polygons.size(), dbfPath, table.values().size()));
            }
            List<PolygonFeature> features = new ArrayList<>(polygons.size());
            for (int k = 0; k < polygons.size(); k++) {
                features.add(new PolygonFeature(polygons.get(k), table.fieldName(), table.values().get(k)));
            }
            return new FeatureCollection(FeatureSchema.polygonWithLevel(table.fieldName()), features);
        } catch (BufferUnderflowException e) {
            throw new IOException("Shapefile truncado: " + path, e);
        }
    }

    private List<Polygon> readShp(ByteBuffer buf, Path path) throws IOException {
        buf.order(ByteOrder.BIG_ENDIAN);
        if (buf.getInt(0) != FILE_CODE) {
            throw new IOException(path + " no es un fichero .shp");
        }
        int fileLength = buf.getInt(24) * 2;
        buf.order(ByteOrder.LITTLE_ENDIAN);
        int shapeType = buf.getInt(32);
        if (shapeType != SHAPE_POLYGON) {
            throw new IOException(path + " contiene geometrías de tipo " + shapeType + ", se esperaba Polygon");
        }

        List<Polygon> polygons = new ArrayList<>();
        int position = HEADER_BYTES;
        int end = Math.min(fileLength, buf.limit());
        while (position < end) {
            buf.order(ByteOrder.BIG_ENDIAN);
            int contentBytes = buf.getInt(position + 4) * 2;
            int content = position + RECORD_HEADER_BYTES;
            buf.order(ByteOrder.LITTLE_ENDIAN);
            int recordType = buf.getInt(content);
            if (recordType == SHAPE_POLYGON) {
                polygons.add(readPolygon(buf, content, path));
            } else if (recordType != SHAPE_NULL) {
                throw new IOException("Registro de tipo " + recordType + " en " + path);
            }
            position = content + contentBytes;
        }
        return polygons;
    }

    private Polygon readPolygon(ByteBuffer buf, int content, Path path) throws IOException {
        int numParts = buf.getInt(content + 36);
        int numPoints = buf.getInt(content + 40);
        int partsOffset = content + 44;
        int pointsOffset = partsOffset + 4 * numParts;

        List<LinearRing> rings = new ArrayList<>(numParts);
        for (int p = 0; p < numParts; p++) {
            int from = buf.getInt(partsOffset + 4 * p);
            int to = p + 1 < numParts ? buf.getInt(partsOffset + 4 * (p + 1)) : numPoints;
            if (from < 0 || to > numPoints || to - from < 4) {
                throw new IOException("Parte " + p + " mal formada en " + path);
            }
            Coordinate[] coords = new Coordinate[to - from];
            for (int k = from; k < to; k++) {
                int at = pointsOffset + 16 * k;
                coords[k - from] = new Coordinate(buf.getDouble(at), buf.getDouble(at + 8));
            }
            rings.add(geometryFactory.createLinearRing(coords));
        }
        if (rings.isEmpty()) {
            throw new IOException("Polígono sin partes en " + path);
        }
        LinearRing shell = rings.get(0);
        if (Orientation.isCCW(shell.getCoordinates())) {
            throw new IOException("El anillo exterior no es horario en " + path);
        }
        return geometryFactory.createPolygon(shell, rings.subList(1, rings.size()).toArray(new LinearRing[0]));
    }

    private record DbfTable(String fieldName, List<Double> values) {
    }

    private static DbfTable readDbf(ByteBuffer buf, Path path) throws IOException {
        buf.order(ByteOrder.LITTLE_ENDIAN);
        int records = buf.getInt(4);
        int headerLength = Short.toUnsignedInt(buf.getShort(8));
        int recordLength = Short.toUnsignedInt(buf.getShort(10));
        int fieldCount = (headerLength - DBF_HEADER_BYTES - 1) / DBF_FIELD_DESCRIPTOR_BYTES;
        if (fieldCount != 1) {
            throw new IOException(path + " declara " + fieldCount + " campos, se esperaba 1");
        }

        int descriptor = DBF_HEADER_BYTES;
        byte[] rawName = new byte[11];
        buf.get(descriptor, rawName);
        int nameLength = 0;
        while (nameLength < rawName.length && rawName[nameLength] != 0) {
            nameLength++;
        }
        String fieldName = new String(rawName, 0, nameLength, StandardCharsets.US_ASCII);
        char type = (char) buf.get(descriptor + 11);
        int fieldLength = Byte.toUnsignedInt(buf.get(descriptor + 16));
        if (type != DBF_NUMERIC && type != 'F') {
            throw new IOException("El campo '" + fieldName + "' de " + path + " no es numérico (" + type + ")");
        }

        List<Double> values = new ArrayList<>(records);
        for (int r = 0; r < records; r++) {
            int start = headerLength + r * recordLength;
            if (buf.get(start) == '*') {
                continue;
            }
            byte[] raw = new byte[fieldLength];
            buf.get(start + 1, raw);
            String text = new String(raw, StandardCharsets.US_ASCII).trim();
            try {
                values.add(Double.parseDouble(text));
            } catch (NumberFormatException e) {
                throw new IOException("Valor no numérico '" + text + "' en el registro " + r + " de " + path, e);
            }
        }
        return new DbfTable(fieldName, values);
    }
}
