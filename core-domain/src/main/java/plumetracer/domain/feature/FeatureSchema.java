package plumetracer.domain.feature;

import java.util.Map;
import java.util.Objects;

/**
 * Esquema fijo de la colección: una geometría Polygon y un único atributo numérico.
 *
 * @param geometryType  Tipo de geometría declarado (siempre "Polygon").
 * @param attributeName Nombre del atributo que guarda el nivel (ej: "pm25").
 * @param attributeType Tipo del atributo (siempre "float").
 */
public record FeatureSchema(String geometryType, String attributeName, String attributeType) {

    public static final String POLYGON = "Polygon";
    public static final String FLOAT = "float";

    public FeatureSchema {
        Objects.requireNonNull(attributeName, "attributeName");
        if (attributeName.isBlank()) {
            throw new IllegalArgumentException("El nombre del atributo no puede estar vacío.");
        }
        if (!POLYGON.equals(geometryType)) {
            throw new IllegalArgumentException("Tipo de geometría no soportado: " + geometryType);
        }
        if (!FLOAT.equals(attributeType)) {
            throw new IllegalArgumentException("Tipo de atributo no soportado: " + attributeType);
        }
    }

    public static FeatureSchema polygonWithLevel(String attributeName) {
        return new FeatureSchema(POLYGON, attributeName, FLOAT);
    }

    /**
     * Vista tipo fiona: {geometry: Polygon, properties: {name: float}}.
     */
    public Map<String, Object> asMap() {
        return Map.of("geometry", geometryType, "properties", Map.of(attributeName, attributeType));
    }
}
