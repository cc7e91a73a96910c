package plumetracer.domain.field;

import java.util.Locale;

/**
 * Función de agregación temporal que colapsa varias muestras en una.
 * Las muestras sin dato (NaN) se ignoran; si no queda ninguna el resultado es NaN.
 */
public enum Reducer {

    MEAN {
        @Override
        public double reduce(double[] samples) {
            double sum = 0.0;
            int count = 0;
            for (double s : samples) {
                if (Double.isNaN(s)) continue;
                sum += s;
                count++;
            }
            return count == 0 ? Double.NaN : sum / count;
        }
    },

    MIN {
        @Override
        public double reduce(double[] samples) {
            double result = Double.NaN;
            for (double s : samples) {
                if (Double.isNaN(s)) continue;
                result = Double.isNaN(result) ? s : Math.min(result, s);
            }
            return result;
        }
    },

    MAX {
        @Override
        public double reduce(double[] samples) {
            double result = Double.NaN;
            for (double s : samples) {
                if (Double.isNaN(s)) continue;
                result = Double.isNaN(result) ? s : Math.max(result, s);
            }
            return result;
        }
    };

    public abstract double reduce(double[] samples);

    /**
     * Acepta los nombres en minúsculas de la línea de comandos ("mean", "min", "max").
     */
    public static Reducer fromName(String name) {
        try {
            return Reducer.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Función de agregación desconocida: '" + name
                    + "'. Valores admitidos: mean, min, max.", e);
        }
    }
}
