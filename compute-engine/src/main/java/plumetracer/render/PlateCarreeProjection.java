package plumetracer.render;

import lombok.Getter;
import org.locationtech.jts.awt.PointTransformation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Proyección equirectangular (Plate Carrée) centrada en una longitud arbitraria.
 * <p>
 * Las coordenadas proyectadas son grados: {@code x = lon - central}, normalizada a [-180, 180).
 * Los anillos se "desenrollan" para que dos vértices consecutivos nunca salten más de 180°; quien
 * dibuja replica la geometría desplazada ±360° y deja que el recorte haga el resto.
 */
@Getter
public class PlateCarreeProjection {

    private final double centralLongitude;
    private final double minX;
    private final double maxX;
    private final double minY;
    private final double maxY;
    private final int width;
    private final int height;

    /**
     * @param extent [minlon, maxlon, minlat, maxlat] en grados geográficos.
     */
    public PlateCarreeProjection(double centralLongitude, double[] extent, int width, int height) {
        if (extent == null || extent.length != 4) {
            throw new IllegalArgumentException("La extensión debe tener 4 valores: minlon, maxlon, minlat, maxlat");
        }
        if (!(extent[0] < extent[1]) || !(extent[2] < extent[3])) {
            throw new IllegalArgumentException("Extensión vacía o invertida: " + Arrays.toString(extent));
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Tamaño de imagen no válido: " + width + "x" + height);
        }
        this.centralLongitude = centralLongitude;
        this.minX = extent[0] - centralLongitude;
        this.maxX = extent[1] - centralLongitude;
        this.minY = extent[2];
        this.maxY = extent[3];
        this.width = width;
        this.height = height;
    }

    public double projectLongitude(double longitude) {
        return normalize(longitude - centralLongitude);
    }

    static double normalize(double degrees) {
        double wrapped = ((degrees + 180.0) % 360.0 + 360.0) % 360.0;
        return wrapped - 180.0;
    }

    /**
     * Proyecta una geometría geográfica. Polígonos y líneas se desenrollan anillo a anillo.
     */
    public Geometry project(Geometry geometry) {
        GeometryFactory factory = geometry.getFactory();
        if (geometry instanceof Polygon polygon) {
            LinearRing shell = factory.createLinearRing(unwrapRing(polygon.getExteriorRing().getCoordinates()));
            LinearRing[] holes = new LinearRing[polygon.getNumInteriorRing()];
            for (int k = 0; k < holes.length; k++) {
                holes[k] = factory.createLinearRing(unwrapRing(polygon.getInteriorRingN(k).getCoordinates()));
            }
            return factory.createPolygon(shell, holes);
        }
        if (geometry instanceof LineString line) {
            return factory.createLineString(unwrap(line.getCoordinates()));
        }
        if (geometry instanceof GeometryCollection collection) {
            List<Geometry> parts = new ArrayList<>(collection.getNumGeometries());
            for (int k = 0; k < collection.getNumGeometries(); k++) {
                parts.add(project(collection.getGeometryN(k)));
            }
            return factory.buildGeometry(parts);
        }
        Geometry copy = geometry.copy();
        for (Coordinate c : copy.getCoordinates()) {
            c.x = projectLongitude(c.x);
        }
        copy.geometryChanged();
        return copy;
    }

    Coordinate[] unwrap(Coordinate[] coordinates) {
        Coordinate[] out = new Coordinate[coordinates.length];
        for (int k = 0; k < coordinates.length; k++) {
            double x = k == 0
                    ? projectLongitude(coordinates[0].x)
                    : out[k - 1].x + normalize(coordinates[k].x - coordinates[k - 1].x);
            out[k] = new Coordinate(x, coordinates[k].y);
        }
        return out;
    }

    /**
     * Un anillo que rodea un polo no vuelve a su longitud inicial al desenrollarlo: se cierra
     * por el borde del polo más cercano a su latitud media.
     */
    Coordinate[] unwrapRing(Coordinate[] ring) {
        Coordinate[] unwrapped = unwrap(ring);
        int last = unwrapped.length - 1;
        if (last < 1 || unwrapped[0].x == unwrapped[last].x) {
            return unwrapped;
        }
        double meanLat = Arrays.stream(ring).mapToDouble(c -> c.y).average().orElse(0.0);
        double pole = meanLat >= 0 ? 90.0 : -90.0;
        Coordinate[] closed = Arrays.copyOf(unwrapped, unwrapped.length + 3);
        closed[last + 1] = new Coordinate(unwrapped[last].x, pole);
        closed[last + 2] = new Coordinate(unwrapped[0].x, pole);
        closed[last + 3] = new Coordinate(unwrapped[0]);
        return closed;
    }

    /**
     * Transformación de grados proyectados a píxeles, desplazando {@code offset} grados en x.
     */
    public PointTransformation toPixels(double offset) {
        double sx = width / (maxX - minX);
        double sy = height / (maxY - minY);
        return (src, dest) -> dest.setLocation((src.x + offset - minX) * sx, (maxY - src.y) * sy);
    }
}
