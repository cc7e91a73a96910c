package plumetracer.domain.field;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Campo escalar 2D muestreado sobre una malla regular lon/lat.
 * <p>
 * Los valores se indexan como {@code values[lat][lon]}. Las celdas sin dato
 * se representan con {@link Double#NaN}.
 *
 * @param longitudes Muestras de longitud (eje X), en grados.
 * @param latitudes  Muestras de latitud (eje Y), en grados.
 * @param values     Matriz de valores con dimensiones (len(lat), len(lon)).
 * @param timestamp  Instante representativo (media de la ventana temporal seleccionada).
 */
public record GriddedField(
        double[] longitudes,
        double[] latitudes,
        double[][] values,
        LocalDateTime timestamp
) {

    public GriddedField {
        Objects.requireNonNull(longitudes, "longitudes");
        Objects.requireNonNull(latitudes, "latitudes");
        Objects.requireNonNull(values, "values");
        if (values.length != latitudes.length) {
            throw new IllegalArgumentException(String.format(
                    "El número de filas (%d) no coincide con el número de latitudes (%d).",
                    values.length, latitudes.length));
        }
        for (int j = 0; j < values.length; j++) {
            if (values[j].length != longitudes.length) {
                throw new IllegalArgumentException(String.format(
                        "La fila %d tiene %d columnas, se esperaban %d (longitudes).",
                        j, values[j].length, longitudes.length));
            }
        }
    }

    public int getLongitudeCount() {
        return longitudes.length;
    }

    public int getLatitudeCount() {
        return latitudes.length;
    }

    /**
     * Valor en la celda (j = índice de latitud, i = índice de longitud).
     */
    public double getValue(int j, int i) {
        return values[j][i];
    }

    public boolean isMissing(int j, int i) {
        return Double.isNaN(values[j][i]);
    }

    /**
     * Rango [min, max] de los valores válidos. Devuelve {NaN, NaN} si no hay ninguno.
     */
    public double[] getValueRange() {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double[] row : values) {
            for (double v : row) {
                if (Double.isNaN(v)) continue;
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
        }
        if (min > max) {
            return new double[]{Double.NaN, Double.NaN};
        }
        return new double[]{min, max};
    }
}
