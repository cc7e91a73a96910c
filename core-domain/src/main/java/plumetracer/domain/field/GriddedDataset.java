package plumetracer.domain.field;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Conjunto de datos en malla leído de una fuente: ejes compartidos más las variables.
 * <p>
 * Es el equivalente en memoria de un fichero netCDF sencillo (time, lev, lat, lon).
 */
public record GriddedDataset(
        LocalDateTime[] times,
        double[] latitudes,
        double[] longitudes,
        double[] levels,
        Map<String, DatasetVariable> variables
) {

    public GriddedDataset {
        variables = new LinkedHashMap<>(variables);
    }

    public Optional<DatasetVariable> findVariable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public int getTimeCount() {
        return times == null ? 0 : times.length;
    }
}
