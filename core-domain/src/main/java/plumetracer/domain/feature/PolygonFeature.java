package plumetracer.domain.feature;

import org.locationtech.jts.geom.Polygon;

import java.util.Map;
import java.util.Objects;

/**
 * Un polígono de pluma más su atributo de nivel.
 *
 * @param polygon       Geometría en espacio (lon, lat).
 * @param attributeName Clave del atributo.
 * @param level         Valor del nivel que originó el polígono.
 */
public record PolygonFeature(Polygon polygon, String attributeName, double level) {

    public PolygonFeature {
        Objects.requireNonNull(polygon, "polygon");
        Objects.requireNonNull(attributeName, "attributeName");
    }

    public Map<String, Double> attributes() {
        return Map.of(attributeName, level);
    }
}
