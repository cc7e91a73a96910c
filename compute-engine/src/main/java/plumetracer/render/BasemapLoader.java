package plumetracer.render;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import plumetracer.io.JsonFileHandler;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Carga los polígonos de tierra firme de un GeoJSON (FeatureCollection, Feature o geometría suelta).
 * Se ignoran las geometrías que no son poligonales. El resultado se cachea por ubicación.
 * <p>
 * La ubicación es una ruta de fichero o un recurso con prefijo {@code classpath:}
 * (p. ej. el contorno de continentes que se distribuye con la aplicación).
 */
@Slf4j
public class BasemapLoader {

    public static final String CLASSPATH_PREFIX = "classpath:";

    private final JsonFileHandler jsonFileHandler;
    private final Map<String, List<Geometry>> cache = new ConcurrentHashMap<>();

    public BasemapLoader(JsonFileHandler jsonFileHandler) {
        this.jsonFileHandler = jsonFileHandler;
    }

    public List<Geometry> load(String location) throws IOException {
        String key = location.startsWith(CLASSPATH_PREFIX)
                ? location
                : Path.of(location).toAbsolutePath().normalize().toString();
        List<Geometry> cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        JsonNode root = readRoot(location);
        List<Geometry> land = new ArrayList<>();
        GeoJsonReader reader = new GeoJsonReader();
        collect(root, reader, land, location);
        log.info("Mapa base {}: {} polígono(s) de tierra", location, land.size());
        List<Geometry> result = List.copyOf(land);
        cache.put(key, result);
        return result;
    }

    private JsonNode readRoot(String location) throws IOException {
        if (!location.startsWith(CLASSPATH_PREFIX)) {
            return jsonFileHandler.readTree(Path.of(location));
        }
        String name = location.substring(CLASSPATH_PREFIX.length());
        if (name.startsWith("/")) {
            name = name.substring(1);
        }
        try (InputStream in = BasemapLoader.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                throw new IOException("Mapa base no encontrado en el classpath: " + name);
            }
            return jsonFileHandler.readTree(in);
        }
    }

    private static void collect(JsonNode node, GeoJsonReader reader, List<Geometry> land, String location) throws IOException {
        String type = node.path("type").asText();
        switch (type) {
            case "FeatureCollection" -> {
                for (JsonNode feature : node.path("features")) {
                    collect(feature, reader, land, location);
                }
            }
            case "Feature" -> collect(node.path("geometry"), reader, land, location);
            default -> {
                if (node.isMissingNode() || node.isNull()) {
                    return;
                }
                try {
                    Geometry geometry = reader.read(node.toString());
                    if (geometry instanceof Polygonal) {
                        land.add(geometry);
                    }
                } catch (ParseException e) {
                    throw new IOException("Geometría ilegible en el mapa base " + location + ": " + e.getMessage(), e);
                }
            }
        }
    }
}
