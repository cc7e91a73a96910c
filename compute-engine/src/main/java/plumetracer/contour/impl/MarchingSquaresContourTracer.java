package plumetracer.contour.impl;

import org.locationtech.jts.geom.Coordinate;
import plumetracer.contour.ContourTracer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trazado de isolíneas por marching squares con ensamblado de anillos cerrados.
 * <p>
 * La malla se rodea de un borde de celdas sin dato, de forma que las isolíneas que tocan el
 * límite del dominio se cierran siguiendo ese límite. Las celdas sin dato cuentan como "fuera";
 * los cruces con ellas se colocan en el vértice válido.
 * <p>
 * Los segmentos se orientan dejando las celdas {@code >= level} a la izquierda: con ejes
 * crecientes, una meseta sale en sentido antihorario. Las sillas (casos 5 y 10) se resuelven con
 * la media de las cuatro esquinas.
 * <p>
 * Un anillo que pasa dos veces por el mismo punto (valores iguales al nivel) se parte en lazos
 * simples, para que cada uno forme un polígono válido.
 */
public class MarchingSquaresContourTracer implements ContourTracer {

    private static final int BOTTOM = 0;
    private static final int RIGHT = 1;
    private static final int TOP = 2;
    private static final int LEFT = 3;

    /**
     * Segmentos dirigidos por caso (bits: 1 = BL, 2 = BR, 4 = TR, 8 = TL). Cada par es {desde, hasta}.
     * Las sillas se tratan aparte.
     */
    private static final int[][][] SEGMENTS = new int[16][][];

    static {
        SEGMENTS[0] = new int[0][];
        SEGMENTS[1] = new int[][]{{BOTTOM, LEFT}};
        SEGMENTS[2] = new int[][]{{RIGHT, BOTTOM}};
        SEGMENTS[3] = new int[][]{{RIGHT, LEFT}};
        SEGMENTS[4] = new int[][]{{TOP, RIGHT}};
        SEGMENTS[6] = new int[][]{{TOP, BOTTOM}};
        SEGMENTS[7] = new int[][]{{TOP, LEFT}};
        SEGMENTS[8] = new int[][]{{LEFT, TOP}};
        SEGMENTS[9] = new int[][]{{BOTTOM, TOP}};
        SEGMENTS[11] = new int[][]{{RIGHT, TOP}};
        SEGMENTS[12] = new int[][]{{LEFT, RIGHT}};
        SEGMENTS[13] = new int[][]{{BOTTOM, RIGHT}};
        SEGMENTS[14] = new int[][]{{LEFT, BOTTOM}};
        SEGMENTS[15] = new int[0][];
    }

    // Sillas: centro dentro (las dos esquinas "fuera" quedan aisladas) o centro fuera
    private static final int[][] SADDLE_5_CENTER_IN = {{BOTTOM, RIGHT}, {TOP, LEFT}};
    private static final int[][] SADDLE_5_CENTER_OUT = {{BOTTOM, LEFT}, {TOP, RIGHT}};
    private static final int[][] SADDLE_10_CENTER_IN = {{LEFT, BOTTOM}, {RIGHT, TOP}};
    private static final int[][] SADDLE_10_CENTER_OUT = {{RIGHT, BOTTOM}, {LEFT, TOP}};

    @Override
    public String getName() {
        return "MarchingSquares";
    }

    @Override
    public String getDescription() {
        return "Marching squares con interpolación lineal en aristas, sillas por media central y cierre por el borde.";
    }

    @Override
    public List<Coordinate[]> trace(double[] x, double[] y, double[][] values, double level) {
        PaddedGrid grid = new PaddedGrid(x, y, values);
        Map<Long, Long> next = new LinkedHashMap<>();

        for (int j = 0; j < grid.rows - 1; j++) {
            for (int i = 0; i < grid.cols - 1; i++) {
                int code = 0;
                if (grid.inside(i, j, level)) code |= 1;
                if (grid.inside(i + 1, j, level)) code |= 2;
                if (grid.inside(i + 1, j + 1, level)) code |= 4;
                if (grid.inside(i, j + 1, level)) code |= 8;
                for (int[] segment : segmentsFor(code, grid, i, j, level)) {
                    next.put(edgeKey(grid, i, j, segment[0]), edgeKey(grid, i, j, segment[1]));
                }
            }
        }
        return assembleRings(next, grid, level);
    }

    private static int[][] segmentsFor(int code, PaddedGrid grid, int i, int j, double level) {
        if (code != 5 && code != 10) {
            return SEGMENTS[code];
        }
        boolean centerInside = grid.centerMean(i, j) >= level;
        if (code == 5) {
            return centerInside ? SADDLE_5_CENTER_IN : SADDLE_5_CENTER_OUT;
        }
        return centerInside ? SADDLE_10_CENTER_IN : SADDLE_10_CENTER_OUT;
    }

    /**
     * Identificador de arista. Las horizontales (i,j)-(i+1,j) son pares; las verticales (i,j)-(i,j+1) impares.
     */
    private static long edgeKey(PaddedGrid grid, int i, int j, int side) {
        return switch (side) {
            case BOTTOM -> horizontal(grid, i, j);
            case TOP -> horizontal(grid, i, j + 1);
            case LEFT -> vertical(grid, i, j);
            case RIGHT -> vertical(grid, i + 1, j);
            default -> throw new IllegalArgumentException("Lado desconocido: " + side);
        };
    }

    private static long horizontal(PaddedGrid grid, int i, int j) {
        return ((long) j * grid.cols + i) * 2;
    }

    private static long vertical(PaddedGrid grid, int i, int j) {
        return ((long) j * grid.cols + i) * 2 + 1;
    }

    private static List<Coordinate[]> assembleRings(Map<Long, Long> next, PaddedGrid grid, double level) {
        List<Coordinate[]> rings = new ArrayList<>();
        Map<Long, Coordinate> points = new HashMap<>();
        Map<Long, Boolean> visited = new HashMap<>();

        for (Long start : next.keySet()) {
            if (visited.containsKey(start)) continue;

            List<Coordinate> ring = new ArrayList<>();
            Long key = start;
            boolean closed = false;
            while (key != null && !visited.containsKey(key)) {
                visited.put(key, Boolean.TRUE);
                Coordinate c = points.computeIfAbsent(key, k -> grid.crossing(k, level));
                if (ring.isEmpty() || !ring.get(ring.size() - 1).equals2D(c)) {
                    ring.add(c);
                }
                key = next.get(key);
                closed = start.equals(key);
            }
            if (!closed || ring.isEmpty()) {
                // Con el borde de relleno todas las isolíneas cierran; una cadena abierta se ignora.
                continue;
            }
            if (ring.size() > 1 && ring.get(0).equals2D(ring.get(ring.size() - 1))) {
                ring.remove(ring.size() - 1);
            }
            for (List<Coordinate> loop : splitAtPinches(ring)) {
                rings.add(toClosedArray(loop));
            }
        }
        return rings;
    }

    /**
     * Parte un recorrido cerrado en lazos simples allí donde repite un vértice.
     * <p>
     * Pasa cuando un nodo de la malla vale exactamente el nivel (o linda con una celda sin dato):
     * varios cruces caen sobre el nodo y el anillo se toca a sí mismo. Cada lazo conserva el
     * sentido del recorrido original; los que quedan degenerados se descartan más adelante.
     */
    static List<List<Coordinate>> splitAtPinches(List<Coordinate> ring) {
        List<List<Coordinate>> loops = new ArrayList<>();
        List<Coordinate> stack = new ArrayList<>();
        Map<Coordinate, Integer> position = new HashMap<>();

        for (Coordinate c : ring) {
            Integer k = position.get(c);
            if (k == null) {
                position.put(c, stack.size());
                stack.add(c);
                continue;
            }
            List<Coordinate> tail = stack.subList(k, stack.size());
            loops.add(new ArrayList<>(tail));
            for (Coordinate removed : tail.subList(1, tail.size())) {
                position.remove(removed);
            }
            tail.subList(1, tail.size()).clear();
        }
        loops.add(stack);
        return loops;
    }

    private static Coordinate[] toClosedArray(List<Coordinate> loop) {
        Coordinate[] coords = new Coordinate[loop.size() + 1];
        for (int k = 0; k < loop.size(); k++) {
            coords[k] = new Coordinate(loop.get(k));
        }
        coords[loop.size()] = new Coordinate(loop.get(0));
        return coords;
    }

    /**
     * Malla original rodeada de una fila/columna sin dato. Las coordenadas del relleno repiten las del borde.
     */
    private static final class PaddedGrid {
        final double[] x;
        final double[] y;
        final double[][] values;
        final int cols;
        final int rows;

        PaddedGrid(double[] x, double[] y, double[][] values) {
            this.x = x;
            this.y = y;
            this.values = values;
            this.cols = x.length + 2;
            this.rows = y.length + 2;
        }

        double value(int i, int j) {
            if (i == 0 || j == 0 || i == cols - 1 || j == rows - 1) {
                return Double.NaN;
            }
            return values[j - 1][i - 1];
        }

        boolean inside(int i, int j, double level) {
            double v = value(i, j);
            return !Double.isNaN(v) && v >= level;
        }

        double xAt(int i) {
            return x[Math.min(Math.max(i - 1, 0), x.length - 1)];
        }

        double yAt(int j) {
            return y[Math.min(Math.max(j - 1, 0), y.length - 1)];
        }

        double centerMean(int i, int j) {
            double sum = value(i, j) + value(i + 1, j) + value(i + 1, j + 1) + value(i, j + 1);
            // Con alguna esquina sin dato el centro queda fuera (NaN >= level es falso)
            return sum / 4.0;
        }

        Coordinate crossing(long key, double level) {
            long cell = key / 2;
            int i0 = (int) (cell % cols);
            int j0 = (int) (cell / cols);
            int i1 = (key % 2 == 0) ? i0 + 1 : i0;
            int j1 = (key % 2 == 0) ? j0 : j0 + 1;

            double v0 = value(i0, j0);
            double v1 = value(i1, j1);
            double t;
            if (Double.isNaN(v0)) {
                t = 1.0;
            } else if (Double.isNaN(v1)) {
                t = 0.0;
            } else if (v1 == v0) {
                t = 0.5;
            } else {
                t = Math.min(1.0, Math.max(0.0, (level - v0) / (v1 - v0)));
            }
            double px = xAt(i0) + t * (xAt(i1) - xAt(i0));
            double py = yAt(j0) + t * (yAt(j1) - yAt(j0));
            return new Coordinate(px, py);
        }
    }
}
