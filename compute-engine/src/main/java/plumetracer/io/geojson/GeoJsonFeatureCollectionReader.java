package plumetracer.io.geojson;

import com.fasterxml.jackson.databind.JsonNode;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import plumetracer.domain.feature.FeatureCollection;
import plumetracer.domain.feature.FeatureSchema;
import plumetracer.domain.feature.PolygonFeature;
import plumetracer.geometry.PolygonBuilder;
import plumetracer.io.FeatureCollectionReader;
import plumetracer.io.JsonFileHandler;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Lee una FeatureCollection GeoJSON escrita por {@link GeoJsonFeatureCollectionWriter}.
 * Si falta el miembro {@code schema}, el atributo se toma de la primera feature.
 */
public class GeoJsonFeatureCollectionReader implements FeatureCollectionReader {

    private final JsonFileHandler jsonFileHandler;
    private final GeometryFactory geometryFactory = new GeometryFactory(new PrecisionModel(), PolygonBuilder.WGS84_SRID);

    public GeoJsonFeatureCollectionReader(JsonFileHandler jsonFileHandler) {
        this.jsonFileHandler = jsonFileHandler;
    }

    @Override
    public String getName() {
        return "GeoJSON";
    }

    @Override
    public boolean supports(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".geojson") || name.endsWith(".json");
    }

    @Override
    public FeatureCollection read(Path path) throws IOException {
        JsonNode root = jsonFileHandler.readTree(path);
        if (!"FeatureCollection".equals(root.path("type").asText())) {
            throw new IOException(path + " no es una FeatureCollection GeoJSON");
        }
        JsonNode featuresNode = root.path("features");
        String attributeName = attributeName(root, featuresNode, path);
        FeatureSchema schema = FeatureSchema.polygonWithLevel(attributeName);

        GeoJsonReader geometryReader = new GeoJsonReader(geometryFactory);
        List<PolygonFeature> features = new ArrayList<>();
        for (JsonNode node : featuresNode) {
            Geometry geometry;
            try {
                geometry = geometryReader.read(node.path("geometry").toString());
            } catch (ParseException e) {
                throw new IOException("Geometría ilegible en " + path + ": " + e.getMessage(), e);
            }
            if (!(geometry instanceof Polygon polygon)) {
                throw new IOException("Se esperaba Polygon en " + path + " y se encontró " + geometry.getGeometryType());
            }
            JsonNode value = node.path("properties").path(attributeName);
            if (!value.isNumber()) {
                throw new IOException("Feature sin atributo numérico '" + attributeName + "' en " + path);
            }
            features.add(new PolygonFeature(polygon, attributeName, value.asDouble()));
        }
        return new FeatureCollection(schema, features);
    }

    private static String attributeName(JsonNode root, JsonNode features, Path path) throws IOException {
        Iterator<String> names = root.path("schema").path("properties").fieldNames();
        if (names.hasNext()) {
            return names.next();
        }
        if (features.size() > 0) {
            Iterator<String> props = features.get(0).path("properties").fieldNames();
            if (props.hasNext()) {
                return props.next();
            }
        }
        throw new IOException("No se puede determinar el esquema de " + path);
    }
}
