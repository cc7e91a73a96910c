package plumetracer.field;

import lombok.extern.slf4j.Slf4j;
import plumetracer.domain.exception.DataUnavailableException;
import plumetracer.domain.field.DatasetVariable;
import plumetracer.domain.field.GriddedDataset;
import plumetracer.io.JsonFileHandler;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fuente de datos en formato JSON ({@link JsonDatasetDocument}).
 * <p>
 * Admite un fichero local, un patrón con comodines (varios ficheros concatenados en el eje
 * temporal, en orden alfabético) o una URL http/https.
 */
@Slf4j
public class JsonFieldSource implements FieldSource {

    private final JsonFileHandler jsonFileHandler;

    public JsonFieldSource(JsonFileHandler jsonFileHandler) {
        this.jsonFileHandler = jsonFileHandler;
    }

    public JsonFieldSource() {
        this(new JsonFileHandler());
    }

    @Override
    public String getName() {
        return "JSON";
    }

    @Override
    public String getDescription() {
        return "Conjunto de datos JSON (time, lat, lon, lev opcional y variables aplanadas).";
    }

    @Override
    public boolean supports(String location) {
        String path = location.toLowerCase(Locale.ROOT);
        int query = path.indexOf('?', path.indexOf("://") + 1);
        if (isRemote(location) && query > 0) {
            path = path.substring(0, query);
        }
        return path.endsWith(".json");
    }

    @Override
    public GriddedDataset read(String location) {
        if (isRemote(location)) {
            return decode(readRemote(location), location);
        }
        if (hasWildcard(location)) {
            List<Path> files = expand(location);
            log.info("Patrón {}: {} fichero(s) a concatenar", location, files.size());
            List<GriddedDataset> parts = new ArrayList<>();
            for (Path file : files) {
                parts.add(decode(readLocal(file), file.toString()));
            }
            return concatenate(parts, location);
        }
        return decode(readLocal(Paths.get(location)), location);
    }

    private JsonDatasetDocument readLocal(Path file) {
        try {
            return jsonFileHandler.readFromFile(file, JsonDatasetDocument.class);
        } catch (IOException e) {
            throw new DataUnavailableException(file.toString(), "No se puede leer " + file + ": " + e.getMessage(), e);
        }
    }

    private JsonDatasetDocument readRemote(String location) {
        try {
            return jsonFileHandler.readFromUrl(new URL(location), JsonDatasetDocument.class);
        } catch (MalformedURLException e) {
            throw new DataUnavailableException(location, "URL mal formada: " + location, e);
        } catch (IOException e) {
            throw new DataUnavailableException(location, "Fuente remota inaccesible: " + e.getMessage(), e);
        }
    }

    private List<Path> expand(String pattern) {
        Path patternPath = Paths.get(pattern);
        Path dir = patternPath.getParent() == null ? Paths.get(".") : patternPath.getParent();
        if (hasWildcard(dir.toString())) {
            throw new DataUnavailableException(pattern, "Solo se admiten comodines en el nombre del fichero: " + pattern);
        }
        List<Path> matches = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, patternPath.getFileName().toString())) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) {
                    matches.add(p);
                }
            }
        } catch (IOException e) {
            throw new DataUnavailableException(pattern, "No se puede listar " + dir + ": " + e.getMessage(), e);
        }
        if (matches.isEmpty()) {
            throw new DataUnavailableException(pattern, "Ningún fichero coincide con " + pattern);
        }
        matches.sort(null);
        return matches;
    }

    GriddedDataset decode(JsonDatasetDocument doc, String location) {
        if (doc == null || doc.lat() == null || doc.lon() == null) {
            throw new DataUnavailableException(location, "El documento " + location + " no tiene ejes lat/lon");
        }
        LocalDateTime[] times;
        try {
            times = doc.time() == null ? new LocalDateTime[0]
                    : doc.time().stream().map(LocalDateTime::parse).toArray(LocalDateTime[]::new);
        } catch (DateTimeParseException e) {
            throw new DataUnavailableException(location, "Eje temporal ilegible en " + location + ": " + e.getMessage(), e);
        }
        double[] lat = toArray(doc.lat());
        double[] lon = toArray(doc.lon());
        double[] lev = doc.lev() == null ? null : toArray(doc.lev());

        Map<String, Integer> axisSizes = new LinkedHashMap<>();
        axisSizes.put(DatasetVariable.TIME, times.length);
        axisSizes.put(DatasetVariable.LATITUDE, lat.length);
        axisSizes.put(DatasetVariable.LONGITUDE, lon.length);
        if (lev != null) {
            axisSizes.put(DatasetVariable.LEVEL, lev.length);
        }

        Map<String, DatasetVariable> variables = new LinkedHashMap<>();
        if (doc.variables() != null) {
            doc.variables().forEach((name, v) -> variables.put(name, toVariable(name, v, axisSizes, location)));
        }
        return new GriddedDataset(times, lat, lon, lev, variables);
    }

    private DatasetVariable toVariable(String name, JsonDatasetDocument.Variable v,
                                       Map<String, Integer> axisSizes, String location) {
        if (v.dimensions() == null || v.values() == null) {
            throw new DataUnavailableException(location, "La variable " + name + " no declara dimensiones o valores");
        }
        double[] values = toArray(v.values());
        int[] shape;
        if (v.shape() != null) {
            shape = v.shape().stream().mapToInt(Integer::intValue).toArray();
        } else {
            shape = new int[v.dimensions().size()];
            int unknown = -1;
            long known = 1;
            for (int k = 0; k < shape.length; k++) {
                Integer size = axisSizes.get(v.dimensions().get(k));
                if (size == null) {
                    if (unknown >= 0) {
                        throw new DataUnavailableException(location, "No se puede deducir la forma de " + name
                                + ": declare 'shape' para las dimensiones " + v.dimensions());
                    }
                    unknown = k;
                } else {
                    shape[k] = size;
                    known *= size;
                }
            }
            if (unknown >= 0) {
                shape[unknown] = known == 0 ? 0 : (int) (values.length / known);
            }
        }
        try {
            return new DatasetVariable(name, v.dimensions(), shape, values);
        } catch (IllegalArgumentException e) {
            throw new DataUnavailableException(location, e.getMessage(), e);
        }
    }

    /**
     * Concatena varios conjuntos en el eje temporal. Las variables con dimensión time deben tenerla en primer lugar.
     */
    GriddedDataset concatenate(List<GriddedDataset> parts, String location) {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        GriddedDataset first = parts.get(0);
        List<LocalDateTime> times = new ArrayList<>();
        for (GriddedDataset part : parts) {
            if (!Arrays.equals(part.latitudes(), first.latitudes()) || !Arrays.equals(part.longitudes(), first.longitudes())) {
                throw new DataUnavailableException(location, "Los ficheros de " + location + " no comparten la misma malla");
            }
            times.addAll(Arrays.asList(part.times()));
        }

        Map<String, DatasetVariable> merged = new LinkedHashMap<>();
        for (DatasetVariable v : first.variables().values()) {
            if (v.indexOf(DatasetVariable.TIME) != 0) {
                merged.put(v.name(), v);
                continue;
            }
            List<double[]> chunks = new ArrayList<>();
            int totalTimes = 0;
            for (GriddedDataset part : parts) {
                DatasetVariable pv = part.findVariable(v.name()).orElseThrow(() ->
                        new DataUnavailableException(location, "La variable " + v.name() + " falta en parte de " + location));
                chunks.add(pv.values());
                totalTimes += pv.shape()[0];
            }
            double[] values = new double[chunks.stream().mapToInt(c -> c.length).sum()];
            int offset = 0;
            for (double[] chunk : chunks) {
                System.arraycopy(chunk, 0, values, offset, chunk.length);
                offset += chunk.length;
            }
            int[] shape = v.shape().clone();
            shape[0] = totalTimes;
            merged.put(v.name(), new DatasetVariable(v.name(), v.dimensions(), shape, values));
        }
        return new GriddedDataset(times.toArray(LocalDateTime[]::new), first.latitudes(), first.longitudes(),
                first.levels(), merged);
    }

    private static double[] toArray(List<Double> values) {
        double[] out = new double[values.size()];
        for (int k = 0; k < out.length; k++) {
            Double v = values.get(k);
            out[k] = v == null ? Double.NaN : v;
        }
        return out;
    }

    private static boolean isRemote(String location) {
        String lower = location.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private static boolean hasWildcard(String location) {
        return location.indexOf('*') >= 0 || location.indexOf('?') >= 0;
    }
}
