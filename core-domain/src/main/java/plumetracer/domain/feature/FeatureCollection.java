package plumetracer.domain.feature;

import plumetracer.domain.contour.ContourLevel;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Colección de polígonos bajo un único esquema. Inmutable.
 * <p>
 * Invariante: el conjunto de claves de atributo de cada feature coincide exactamente
 * con el declarado en el esquema.
 */
public record FeatureCollection(FeatureSchema schema, List<PolygonFeature> features) {

    public FeatureCollection {
        Objects.requireNonNull(schema, "schema");
        features = List.copyOf(features);
        Set<String> expected = Set.of(schema.attributeName());
        for (int k = 0; k < features.size(); k++) {
            Set<String> actual = features.get(k).attributes().keySet();
            if (!actual.equals(expected)) {
                throw new IllegalArgumentException(String.format(
                        "La feature %d tiene atributos %s, el esquema declara %s.", k, actual, expected));
            }
        }
    }

    public static FeatureCollection empty(FeatureSchema schema) {
        return new FeatureCollection(schema, List.of());
    }

    public List<PolygonFeature> featuresAt(ContourLevel level) {
        return features.stream().filter(f -> level.matches(f.level())).toList();
    }

    public int size() {
        return features.size();
    }
}
