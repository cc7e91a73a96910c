package plumetracer.domain.contour;

import org.locationtech.jts.geom.Coordinate;

import java.util.Arrays;
import java.util.Objects;

/**
 * Secuencia ordenada de vértices (lon, lat) que traza un nivel de contorno.
 * <p>
 * El anillo se guarda siempre cerrado: el último vértice repite el primero.
 *
 * @param level    Nivel al que pertenece el anillo.
 * @param vertices Vértices en coordenadas geográficas, x = longitud, y = latitud.
 */
public record ContourRing(ContourLevel level, Coordinate[] vertices) {

    public ContourRing {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(vertices, "vertices");
        vertices = close(vertices);
    }

    /**
     * Número de vértices distintos (sin contar el de cierre).
     */
    public int distinctVertexCount() {
        return (int) Arrays.stream(vertices, 0, Math.max(0, vertices.length - 1))
                .map(c -> c.x + "," + c.y)
                .distinct()
                .count();
    }

    /**
     * Área con signo por la fórmula del polígono (shoelace). Positiva si el anillo es antihorario.
     */
    public double signedArea() {
        double sum = 0.0;
        for (int k = 0; k < vertices.length - 1; k++) {
            Coordinate a = vertices[k];
            Coordinate b = vertices[k + 1];
            sum += a.x * b.y - b.x * a.y;
        }
        return sum / 2.0;
    }

    /**
     * Un anillo degenerado no puede formar un polígono: menos de 3 vértices distintos o área nula.
     */
    public boolean isDegenerate() {
        return distinctVertexCount() < 3 || signedArea() == 0.0;
    }

    private static Coordinate[] close(Coordinate[] vertices) {
        if (vertices.length == 0 || vertices[0].equals2D(vertices[vertices.length - 1])) {
            return vertices;
        }
        Coordinate[] closed = Arrays.copyOf(vertices, vertices.length + 1);
        closed[vertices.length] = new Coordinate(vertices[0]);
        return closed;
    }
}
