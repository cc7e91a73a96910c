package plumetracer.compute.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import plumetracer.config.PipelineConfig;
import plumetracer.config.RenderConfig;
import plumetracer.contour.ContourExtractor;
import plumetracer.contour.ContourTracer;
import plumetracer.domain.contour.ContourLevel;
import plumetracer.domain.contour.ContourSet;
import plumetracer.domain.exception.RenderFailedException;
import plumetracer.domain.feature.FeatureCollection;
import plumetracer.domain.feature.FeatureSchema;
import plumetracer.domain.feature.PolygonFeature;
import plumetracer.domain.field.GriddedDataset;
import plumetracer.domain.field.GriddedField;
import plumetracer.domain.pipeline.PipelineReport;
import plumetracer.domain.pipeline.PipelineResult;
import plumetracer.field.FieldSourceResolver;
import plumetracer.field.TemporalAggregator;
import plumetracer.geometry.PolygonBuilder;
import plumetracer.io.FeatureCollectionFormats;
import plumetracer.render.ContourPreviewRenderer;
import plumetracer.render.DiagnosticRenderer;
import plumetracer.utils.StrftimeFormatter;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Orquesta una ejecución completa: lectura y agregación, extracción de contornos, construcción de
 * polígonos, escritura del fichero de geometrías y figuras de diagnóstico.
 * <p>
 * Los errores de lectura y escritura se propagan y abortan la ejecución. Los anillos inválidos y los
 * fallos de render quedan como avisos en el {@link PipelineReport} del resultado.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ContourPipelineService {

    private final FieldSourceResolver fieldSourceResolver;
    private final TemporalAggregator temporalAggregator;
    private final ContourTracer contourTracer;
    private final FeatureCollectionFormats formats;
    private final DiagnosticRenderer diagnosticRenderer;
    private final ContourPreviewRenderer contourPreviewRenderer;

    public PipelineResult run(PipelineConfig config) {
        PipelineReport report = new PipelineReport();
        log.info("Ventana de análisis: {} -> {} ({} {})",
                config.getStart(), config.getEnd(), config.getReducer(), config.getVariables());

        // 1. Lectura y agregación temporal
        String sourceName = StrftimeFormatter.format(config.getSource(), config.getStart());
        GriddedDataset dataset = fieldSourceResolver.read(config.getSource(), config.getStart());
        GriddedField field = temporalAggregator.aggregate(dataset, config.getVariables(), config.getStart(),
                config.getEnd(), config.getScaleFactor(), config.getReducer(), sourceName);
        LocalDateTime timestamp = field.timestamp();

        // 2. Contornos
        List<ContourLevel> levels = ContourLevel.distinct(config.getLevels());
        ContourSet contours = new ContourExtractor(contourTracer, config.isParallelLevels()).extract(field, levels);

        RenderConfig render = config.getRender();
        if (render.getContourFigureTemplate() != null) {
            Path preview = Path.of(StrftimeFormatter.format(render.getContourFigureTemplate(), timestamp));
            try {
                contourPreviewRenderer.render(contours, preview, StrftimeFormatter.format(render.getTitleTemplate(), timestamp), render);
            } catch (RenderFailedException e) {
                log.warn("No se generó la vista previa {}: {}", preview, e.getMessage());
                report.warn(e);
            }
        }

        // 3. Polígonos
        PolygonBuilder builder = new PolygonBuilder(config.getInvalidRingPolicy());
        List<PolygonFeature> features = builder.buildAll(contours, config.getAttributeName(), report);

        // 4. Escritura
        Path output = Path.of(StrftimeFormatter.format(config.getOutputTemplate(), timestamp));
        FeatureCollection collection = new FeatureCollection(
                FeatureSchema.polygonWithLevel(config.getAttributeName()), features);
        formats.writerFor(output).write(collection, output);

        Map<ContourLevel, Integer> perLevel = new LinkedHashMap<>();
        for (ContourLevel level : levels) {
            int count = collection.featuresAt(level).size();
            perLevel.put(level, count);
            log.info("Nivel {}: {} polígono(s)", level, count);
        }

        // 5. Figura de relleno, a partir del fichero ya escrito
        Optional<Path> fillFigure = Optional.empty();
        if (render.getFillFigureTemplate() != null) {
            double fillLevel = render.getFillLevel() != null ? render.getFillLevel() : levels.get(0).value();
            Path image = Path.of(StrftimeFormatter.format(render.getFillFigureTemplate(), timestamp));
            try {
                fillFigure = Optional.of(diagnosticRenderer.render(output, fillLevel, image,
                        StrftimeFormatter.format(render.getTitleTemplate(), timestamp), render));
            } catch (RenderFailedException e) {
                log.warn("No se generó la figura {}: {}", image, e.getMessage());
                report.warn(e);
            }
        }

        log.info("Ejecución completada: {} polígono(s) en {}", collection.size(), output);
        return new PipelineResult(timestamp, output, perLevel, fillFigure, report);
    }
}
