package plumetracer.field;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * Forma en disco de un conjunto de datos JSON.
 * <pre>
 * {
 *   "time": ["2020-01-01T00:00:00", ...],
 *   "lat": [...], "lon": [...], "lev": [...],
 *   "variables": { "pm25": { "dimensions": ["time", "lat", "lon"], "values": [...] } }
 * }
 * </pre>
 * Los valores van aplanados en orden row-major; {@code null} marca una celda sin dato.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonDatasetDocument(
        List<String> time,
        List<Double> lat,
        List<Double> lon,
        List<Double> lev,
        Map<String, Variable> variables
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Variable(List<String> dimensions, List<Integer> shape, List<Double> values) {}
}
