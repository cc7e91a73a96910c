package plumetracer.contour;

import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import plumetracer.domain.contour.ContourLevel;
import plumetracer.domain.contour.ContourRing;
import plumetracer.domain.contour.ContourSet;
import plumetracer.domain.field.GriddedField;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Contabilidad de niveles alrededor del trazador: cada nivel se extrae por separado y sus
 * anillos quedan asociados exactamente a ese nivel.
 * <p>
 * Los anillos degenerados (menos de 3 vértices distintos o área nula) se descartan aquí.
 */
@Slf4j
public class ContourExtractor {

    private final ContourTracer tracer;
    private final boolean useParallelExecution;

    public ContourExtractor(ContourTracer tracer) {
        this(tracer, false);
    }

    /**
     * @param tracer               Capacidad de trazado de isolíneas.
     * @param useParallelExecution Si es true, los niveles se trazan en paralelo (ForkJoinPool común).
     */
    public ContourExtractor(ContourTracer tracer, boolean useParallelExecution) {
        this.tracer = tracer;
        this.useParallelExecution = useParallelExecution;
    }

    public ContourSet extract(GriddedField field, List<ContourLevel> levels) {
        int n = levels.size();
        List<ContourRing>[] ringsPerLevel = newResultArray(n);
        int[] discarded = new int[n];

        log.info("Trazando {} nivel(es) con {} sobre una malla {}x{}",
                n, tracer.getName(), field.getLatitudeCount(), field.getLongitudeCount());

        if (useParallelExecution && n > 1) {
            IntStream.range(0, n).parallel().forEach(k -> extractLevel(field, levels.get(k), k, ringsPerLevel, discarded));
        } else {
            for (int k = 0; k < n; k++) {
                extractLevel(field, levels.get(k), k, ringsPerLevel, discarded);
            }
        }

        // El orden de salida es siempre el del usuario, sin importar el orden de finalización
        Map<ContourLevel, List<ContourRing>> rings = new LinkedHashMap<>();
        Map<ContourLevel, Integer> discardedByLevel = new LinkedHashMap<>();
        for (int k = 0; k < n; k++) {
            ContourLevel level = levels.get(k);
            rings.put(level, ringsPerLevel[k]);
            discardedByLevel.put(level, discarded[k]);
            log.info("Nivel {}: {} anillo(s), {} degenerado(s) descartado(s)", level, ringsPerLevel[k].size(), discarded[k]);
        }
        return new ContourSet(rings, discardedByLevel);
    }

    private void extractLevel(GriddedField field, ContourLevel level, int index,
                              List<ContourRing>[] ringsPerLevel, int[] discarded) {
        List<Coordinate[]> traced = tracer.trace(field.longitudes(), field.latitudes(), field.values(), level.value());
        List<ContourRing> kept = new ArrayList<>(traced.size());
        int dropped = 0;
        for (Coordinate[] vertices : traced) {
            ContourRing ring = new ContourRing(level, vertices);
            if (ring.isDegenerate()) {
                dropped++;
                continue;
            }
            kept.add(ring);
        }
        if (traced.isEmpty()) {
            log.debug("El nivel {} no corta el campo", level);
        }
        ringsPerLevel[index] = kept;
        discarded[index] = dropped;
    }

    @SuppressWarnings("unchecked")
    private static List<ContourRing>[] newResultArray(int n) {
        return (List<ContourRing>[]) new List[n];
    }
}
