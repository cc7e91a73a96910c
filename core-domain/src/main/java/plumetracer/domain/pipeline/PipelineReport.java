package plumetracer.domain.pipeline;

import plumetracer.domain.exception.PipelineException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Registro de avisos no fatales de una ejecución (anillos descartados, figuras que fallaron).
 * <p>
 * Se crea por ejecución y se pasa a los componentes, en vez de depender de estado global.
 */
public class PipelineReport {

    private final List<PipelineException> warnings = new ArrayList<>();

    public synchronized void warn(PipelineException warning) {
        warnings.add(warning);
    }

    public synchronized List<PipelineException> getWarnings() {
        return Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public synchronized boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
