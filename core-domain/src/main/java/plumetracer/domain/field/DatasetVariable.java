package plumetracer.domain.field;

import java.util.List;
import java.util.Objects;

/**
 * Variable n-dimensional tal y como llega de la fuente de datos, antes de
 * cualquier selección temporal.
 *
 * @param name       Identificador de la variable (ej: "pm25_rh35_gcc").
 * @param dimensions Nombres de las dimensiones, de la más lenta a la más rápida (ej: time, lev, lat, lon).
 * @param shape      Longitud de cada dimensión.
 * @param values     Valores aplanados en orden row-major. NaN = sin dato.
 */
public record DatasetVariable(
        String name,
        List<String> dimensions,
        int[] shape,
        double[] values
) {

    public static final String TIME = "time";
    public static final String LEVEL = "lev";
    public static final String LATITUDE = "lat";
    public static final String LONGITUDE = "lon";

    public DatasetVariable {
        Objects.requireNonNull(name, "name");
        dimensions = List.copyOf(dimensions);
        if (dimensions.size() != shape.length) {
            throw new IllegalArgumentException("La variable " + name + " declara "
                    + dimensions.size() + " dimensiones pero su forma tiene " + shape.length);
        }
        long expected = 1;
        for (int n : shape) {
            expected *= n;
        }
        if (expected != values.length) {
            throw new IllegalArgumentException("La variable " + name + " tiene " + values.length
                    + " valores, se esperaban " + expected);
        }
    }

    public int indexOf(String dimension) {
        return dimensions.indexOf(dimension);
    }

    public int sizeOf(String dimension) {
        int idx = indexOf(dimension);
        return idx < 0 ? -1 : shape[idx];
    }
}
