package plumetracer.render;

import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.GeometryFactory;
import plumetracer.config.RenderConfig;
import plumetracer.domain.contour.ContourLevel;
import plumetracer.domain.contour.ContourRing;
import plumetracer.domain.contour.ContourSet;
import plumetracer.domain.exception.PipelineException;
import plumetracer.domain.exception.RenderFailedException;
import plumetracer.pipeline.PipelineComponent;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Vista previa de las isolíneas extraídas, antes de construir polígonos. Un color por nivel.
 */
@Slf4j
public class ContourPreviewRenderer implements PipelineComponent {

    private static final List<Color> PALETTE = List.of(
            new Color(0x1F77B4), new Color(0xFF7F0E), new Color(0x2CA02C), new Color(0xD62728),
            new Color(0x9467BD), new Color(0x8C564B), new Color(0xE377C2), new Color(0x17BECF));

    private final GeometryFactory geometryFactory = new GeometryFactory();

    @Override
    public String getName() {
        return "ContourPreview";
    }

    public Path render(ContourSet contours, Path imagePath, String title, RenderConfig config) {
        try {
            PlateCarreeProjection projection = new PlateCarreeProjection(
                    config.getCentralLongitude(), config.getExtent(), config.getWidth(), config.getHeight());
            try (MapCanvas canvas = new MapCanvas(projection)) {
                canvas.fillBackground(Color.WHITE);
                canvas.drawGraticule(DiagnosticRenderer.GRATICULE_STEP);
                List<ContourLevel> levels = contours.getLevels();
                for (int k = 0; k < levels.size(); k++) {
                    Color color = colorFor(k);
                    for (ContourRing ring : contours.getRings(levels.get(k))) {
                        canvas.stroke(geometryFactory.createLineString(ring.vertices()), color, 1.2f);
                    }
                }
                canvas.drawTitle(title);
                canvas.write(imagePath);
            }
            log.info("Vista previa de {} anillo(s) escrita en {}", contours.getTotalRingCount(), imagePath);
            return imagePath;
        } catch (PipelineException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new RenderFailedException(imagePath.toString(), "No se pudo generar la vista previa: " + e.getMessage(), e);
        }
    }

    static Color colorFor(int levelIndex) {
        return PALETTE.get(levelIndex % PALETTE.size());
    }
}
