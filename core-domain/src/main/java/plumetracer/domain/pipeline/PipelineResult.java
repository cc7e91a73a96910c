package plumetracer.domain.pipeline;

import plumetracer.domain.contour.ContourLevel;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * Resumen de una ejecución completada.
 *
 * @param timestamp        Fecha representativa del campo agregado.
 * @param outputFile       Fichero de geometrías escrito.
 * @param featuresPerLevel Número de polígonos escritos por nivel, en el orden pedido.
 * @param fillFigure       Figura de diagnóstico, si se generó.
 * @param report           Avisos no fatales.
 */
public record PipelineResult(
        LocalDateTime timestamp,
        Path outputFile,
        Map<ContourLevel, Integer> featuresPerLevel,
        Optional<Path> fillFigure,
        PipelineReport report
) {

    public int totalFeatures() {
        return featuresPerLevel.values().stream().mapToInt(Integer::intValue).sum();
    }
}
