package plumetracer.contour;

import org.locationtech.jts.geom.Coordinate;
import plumetracer.pipeline.PipelineComponent;

import java.util.List;

/**
 * Capacidad numérica de trazado de isolíneas (tipo marching squares).
 * <p>
 * Dado un array 2D, sus coordenadas de muestreo y un umbral, devuelve los anillos de vértices
 * que separan las celdas con valor {@code >= level} del resto. Cada implementación decide cómo
 * resolver las ambigüedades; el contrato solo exige anillos cerrados en coordenadas (x, y).
 */
public interface ContourTracer extends PipelineComponent {

    /**
     * @param x      Coordenadas de las columnas (longitudes), longitud nx.
     * @param y      Coordenadas de las filas (latitudes), longitud ny.
     * @param values Valores indexados [fila][columna]; NaN = sin dato.
     * @param level  Umbral a trazar.
     * @return Anillos cerrados (primer vértice = último). Lista vacía si el nivel no corta el campo.
     */
    List<Coordinate[]> trace(double[] x, double[] y, double[][] values, double level);
}
