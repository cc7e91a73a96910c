package plumetracer.io.geojson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.io.geojson.GeoJsonWriter;
import plumetracer.domain.exception.WriteFailedException;
import plumetracer.domain.feature.FeatureCollection;
import plumetracer.domain.feature.FeatureSchema;
import plumetracer.domain.feature.PolygonFeature;
import plumetracer.io.AtomicFileTransaction;
import plumetracer.io.FeatureCollectionWriter;
import plumetracer.io.JsonFileHandler;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Escribe la colección como GeoJSON FeatureCollection.
 * <p>
 * El esquema se declara en el miembro {@code schema}, antes de las features. Las geometrías se
 * codifican con el GeoJsonWriter de JTS conservando el orden de vértices.
 */
@Slf4j
public class GeoJsonFeatureCollectionWriter implements FeatureCollectionWriter {

    static final int COORDINATE_DECIMALS = 15;

    private final JsonFileHandler jsonFileHandler;

    public GeoJsonFeatureCollectionWriter(JsonFileHandler jsonFileHandler) {
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
    public void write(FeatureCollection collection, Path path) {
        ObjectNode root = toJson(collection);
        try (AtomicFileTransaction tx = new AtomicFileTransaction()) {
            Path temp = tx.stage(path);
            try (OutputStream out = Files.newOutputStream(temp)) {
                jsonFileHandler.write(root, out);
            }
            tx.commit();
        } catch (IOException e) {
            throw new WriteFailedException(path.toString(), "Error escribiendo GeoJSON: " + e.getMessage(), e);
        }
        log.info("GeoJSON escrito en {} ({} feature(s))", path, collection.size());
    }

    ObjectNode toJson(FeatureCollection collection) {
        ObjectMapper mapper = jsonFileHandler.getObjectMapper();
        FeatureSchema schema = collection.schema();
        GeoJsonWriter geometryWriter = new GeoJsonWriter(COORDINATE_DECIMALS);
        geometryWriter.setEncodeCRS(false);

        ObjectNode root = mapper.createObjectNode();
        root.put("type", "FeatureCollection");
        ObjectNode schemaNode = root.putObject("schema");
        schemaNode.put("geometry", schema.geometryType());
        schemaNode.putObject("properties").put(schema.attributeName(), schema.attributeType());

        ArrayNode features = root.putArray("features");
        for (PolygonFeature feature : collection.features()) {
            ObjectNode node = features.addObject();
            node.put("type", "Feature");
            node.set("geometry", parseGeometry(mapper, geometryWriter.write(feature.polygon())));
            node.putObject("properties").put(feature.attributeName(), feature.level());
        }
        return root;
    }

    private static JsonNode parseGeometry(ObjectMapper mapper, String geoJson) {
        try {
            return mapper.readTree(geoJson);
        } catch (IOException e) {
            throw new IllegalStateException("GeoJsonWriter produjo JSON no válido", e);
        }
    }
}
