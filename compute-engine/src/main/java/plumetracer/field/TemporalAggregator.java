package plumetracer.field;

import lombok.extern.slf4j.Slf4j;
import plumetracer.domain.exception.DataUnavailableException;
import plumetracer.domain.exception.UnsupportedDimensionException;
import plumetracer.domain.exception.VariableNotFoundException;
import plumetracer.domain.field.DatasetVariable;
import plumetracer.domain.field.GriddedDataset;
import plumetracer.domain.field.GriddedField;
import plumetracer.domain.field.Reducer;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Selecciona la ventana temporal [start, end] de un conjunto de datos y la reduce a un único campo 2D.
 * <p>
 * Orden de operaciones: suma de variables, reducción temporal, factor de escala.
 */
@Slf4j
public class TemporalAggregator {

    /**
     * @param dataset     Conjunto de datos completo leído de la fuente.
     * @param variables   Variables a sumar celda a celda.
     * @param start       Inicio de la ventana (incluido).
     * @param end         Fin de la ventana (incluido).
     * @param scaleFactor Factor lineal aplicado tras la reducción.
     * @param reducer     Función de agregación temporal.
     * @param sourceName  Nombre de la fuente, para los mensajes de error.
     * @return El campo reducido con su fecha representativa (media de las fechas seleccionadas).
     */
    public GriddedField aggregate(GriddedDataset dataset, List<String> variables, LocalDateTime start,
                                  LocalDateTime end, double scaleFactor, Reducer reducer, String sourceName) {
        if (variables == null || variables.isEmpty()) {
            throw new IllegalArgumentException("Se necesita al menos una variable.");
        }

        List<Integer> selected = selectTimes(dataset, start, end, sourceName);
        int nLat = dataset.latitudes().length;
        int nLon = dataset.longitudes().length;

        List<GridAccessor> accessors = new ArrayList<>();
        for (String name : variables) {
            DatasetVariable variable = dataset.findVariable(name)
                    .orElseThrow(() -> new VariableNotFoundException(name, sourceName));
            accessors.add(GridAccessor.of(variable, dataset.getTimeCount(), nLat, nLon));
        }

        double[][] reduced = new double[nLat][nLon];
        double[] samples = new double[selected.size()];
        for (int j = 0; j < nLat; j++) {
            for (int i = 0; i < nLon; i++) {
                for (int s = 0; s < samples.length; s++) {
                    samples[s] = sumAt(accessors, selected.get(s), j, i);
                }
                double value = samples.length == 1 ? samples[0] : reducer.reduce(samples);
                reduced[j][i] = scaleFactor != 1.0 ? value * scaleFactor : value;
            }
        }

        LocalDateTime meanTime = meanTime(dataset.times(), selected);
        log.info("Agregadas {} muestra(s) de {} con '{}' (escala {}), fecha representativa {}",
                selected.size(), variables, reducer.name().toLowerCase(Locale.ROOT), scaleFactor, meanTime);
        return new GriddedField(dataset.longitudes().clone(), dataset.latitudes().clone(), reduced, meanTime);
    }

    private List<Integer> selectTimes(GriddedDataset dataset, LocalDateTime start, LocalDateTime end, String sourceName) {
        int count = dataset.getTimeCount();
        if (count == 0) {
            throw new DataUnavailableException(sourceName, "La fuente " + sourceName + " no tiene eje temporal");
        }
        List<Integer> selected = new ArrayList<>();
        if (count == 1) {
            // Una sola muestra: no se recorta la ventana
            selected.add(0);
            return selected;
        }
        for (int t = 0; t < count; t++) {
            LocalDateTime time = dataset.times()[t];
            if (!time.isBefore(start) && !time.isAfter(end)) {
                selected.add(t);
            }
        }
        if (selected.isEmpty()) {
            throw new DataUnavailableException(sourceName, String.format(
                    "Ninguna muestra de %s cae en la ventana [%s, %s]", sourceName, start, end));
        }
        return selected;
    }

    private static double sumAt(List<GridAccessor> accessors, int t, int j, int i) {
        double sum = 0.0;
        for (GridAccessor accessor : accessors) {
            double v = accessor.get(t, j, i);
            if (Double.isNaN(v)) {
                return Double.NaN;
            }
            sum += v;
        }
        return sum;
    }

    static LocalDateTime meanTime(LocalDateTime[] times, List<Integer> selected) {
        LocalDateTime min = selected.stream().map(t -> times[t]).min(LocalDateTime::compareTo).orElseThrow();
        long totalMillis = 0;
        for (int t : selected) {
            totalMillis += Duration.between(min, times[t]).toMillis();
        }
        return min.plus(Duration.ofMillis(Math.round((double) totalMillis / selected.size())));
    }

    /**
     * Acceso (t, lat, lon) a los valores aplanados de una variable, ignorando las dimensiones degeneradas.
     */
    private record GridAccessor(double[] values, int timeStride, int latStride, int lonStride) {

        static GridAccessor of(DatasetVariable variable, int nTime, int nLat, int nLon) {
            List<String> dims = variable.dimensions();
            int[] shape = variable.shape();
            int[] strides = new int[shape.length];
            int stride = 1;
            for (int k = shape.length - 1; k >= 0; k--) {
                strides[k] = stride;
                stride *= shape[k];
            }

            int timeStride = 0;
            int latStride = -1;
            int lonStride = -1;
            for (int k = 0; k < dims.size(); k++) {
                String dim = dims.get(k);
                switch (dim) {
                    case DatasetVariable.TIME -> {
                        checkAxis(variable, dim, shape[k], nTime);
                        timeStride = strides[k];
                    }
                    case DatasetVariable.LATITUDE -> {
                        checkAxis(variable, dim, shape[k], nLat);
                        latStride = strides[k];
                    }
                    case DatasetVariable.LONGITUDE -> {
                        checkAxis(variable, dim, shape[k], nLon);
                        lonStride = strides[k];
                    }
                    default -> {
                        // lev (u otra dimensión) de longitud 1 se descarta
                        if (shape[k] != 1) {
                            throw new UnsupportedDimensionException(variable.name(), dim, shape[k]);
                        }
                    }
                }
            }
            if (latStride < 0 || lonStride < 0) {
                throw new UnsupportedDimensionException(variable.name(),
                        "La variable '" + variable.name() + "' no tiene dimensiones lat y lon: " + dims);
            }
            return new GridAccessor(variable.values(), timeStride, latStride, lonStride);
        }

        private static void checkAxis(DatasetVariable variable, String dim, int size, int expected) {
            if (size != expected) {
                throw new UnsupportedDimensionException(variable.name(), String.format(
                        "La dimensión '%s' de '%s' mide %d pero el eje tiene %d muestras",
                        dim, variable.name(), size, expected));
            }
        }

        double get(int t, int j, int i) {
            return values[t * timeStride + j * latStride + i * lonStride];
        }
    }
}
