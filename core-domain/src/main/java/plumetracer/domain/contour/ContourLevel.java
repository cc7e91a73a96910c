package plumetracer.domain.contour;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Umbral escalar de una isolínea.
 */
public record ContourLevel(double value) implements Comparable<ContourLevel> {

    private static final double RELATIVE_TOLERANCE = 1e-9;

    public ContourLevel {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Nivel de contorno no finito: " + value);
        }
        // -0.0 y 0.0 son el mismo nivel
        value = value + 0.0;
    }

    public static ContourLevel of(double value) {
        return new ContourLevel(value);
    }

    /**
     * Convierte la lista del usuario en niveles distintos, conservando el orden
     * de la primera aparición.
     */
    public static List<ContourLevel> distinct(Collection<? extends Number> values) {
        LinkedHashSet<ContourLevel> unique = new LinkedHashSet<>();
        for (Number v : values) {
            unique.add(new ContourLevel(v.doubleValue()));
        }
        return new ArrayList<>(unique);
    }

    /**
     * Comparación tolerante para valores que han pasado por texto (ej: campos dBase).
     * La tolerancia es relativa (1e-9), así que niveles muy pequeños como 1e-9 y 2e-9 no se confunden.
     */
    public boolean matches(double other) {
        if (value == other) {
            return true;
        }
        double scale = Math.max(Math.abs(value), Math.abs(other));
        return Math.abs(value - other) <= RELATIVE_TOLERANCE * scale;
    }

    @Override
    public int compareTo(ContourLevel o) {
        return Double.compare(value, o.value);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
