package plumetracer.io;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Gestiona la lectura y escritura de documentos JSON (conjuntos de datos de entrada,
 * colecciones GeoJSON de salida y mapas base).
 * <p>
 * Comparte un único ObjectMapper configurado: es costoso de crear y es thread-safe.
 */
@Slf4j
public class JsonFileHandler {

    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        // Fechas de java.time en los documentos de entrada
        mapper.findAndRegisterModules();
        return mapper;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Serializa un objeto (o un árbol JsonNode) en el stream indicado. No cierra el stream.
     */
    public <T> void write(T data, OutputStream out) throws IOException {
        objectMapper.writer()
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValue(out, data);
    }

    /**
     * Deserializa un fichero JSON al tipo indicado.
     *
     * @throws IOException Si el fichero no existe o su contenido no es válido.
     */
    public <T> T readFromFile(Path path, Class<T> objectType) throws IOException {
        log.debug("Deserializando archivo {} a un objeto de tipo {}", path.toAbsolutePath(), objectType.getSimpleName());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(path)) {
            return objectMapper.readValue(in, objectType);
        } catch (IOException e) {
            log.error("Error al leer o parsear el archivo JSON {}", path.toAbsolutePath());
            throw e;
        }
    }

    /**
     * Deserializa un documento remoto (http/https) al tipo indicado.
     */
    public <T> T readFromUrl(URL url, Class<T> objectType) throws IOException {
        log.debug("Descargando {} como {}", url, objectType.getSimpleName());
        try (InputStream in = url.openStream()) {
            return objectMapper.readValue(in, objectType);
        }
    }

    /**
     * Lee un árbol JSON de un stream (p. ej. un recurso del classpath). No cierra el stream.
     */
    public JsonNode readTree(InputStream in) throws IOException {
        return objectMapper.readTree(in);
    }

    public JsonNode readTree(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(path)) {
            return objectMapper.readTree(in);
        }
    }
}
