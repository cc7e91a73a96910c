package plumetracer.render;

import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import plumetracer.config.RenderConfig;
import plumetracer.domain.contour.ContourLevel;
import plumetracer.domain.exception.PipelineException;
import plumetracer.domain.exception.RenderFailedException;
import plumetracer.domain.feature.FeatureCollection;
import plumetracer.domain.feature.PolygonFeature;
import plumetracer.io.FeatureCollectionFormats;
import plumetracer.pipeline.PipelineComponent;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Figura de diagnóstico de un nivel: relee el fichero de geometrías ya escrito y rellena en rojo
 * los polígonos de ese nivel sobre un mapa Plate Carrée.
 * <p>
 * Solo depende del fichero persistido, no del estado en memoria de la ejecución.
 */
@Slf4j
public class DiagnosticRenderer implements PipelineComponent {

    static final Color PLUME = new Color(0xD7, 0x19, 0x1C);
    static final double GRATICULE_STEP = 30.0;

    private final FeatureCollectionFormats formats;
    private final BasemapLoader basemapLoader;

    public DiagnosticRenderer(FeatureCollectionFormats formats, BasemapLoader basemapLoader) {
        this.formats = formats;
        this.basemapLoader = basemapLoader;
    }

    @Override
    public String getName() {
        return "DiagnosticRenderer";
    }

    @Override
    public String getDescription() {
        return "Relleno de los polígonos de un nivel sobre un mapa Plate Carrée.";
    }

    /**
     * @return la ruta de la imagen escrita.
     * @throws RenderFailedException si no se puede leer el fichero, la extensión no es válida o
     *                               falla la escritura de la imagen.
     */
    public Path render(Path featureFile, double level, Path imagePath, String title, RenderConfig config) {
        try {
            FeatureCollection collection = formats.readerFor(featureFile).read(featureFile);
            List<PolygonFeature> selected = collection.featuresAt(ContourLevel.of(level));
            log.info("Renderizando {} polígono(s) del nivel {} en {}", selected.size(), level, imagePath);

            PlateCarreeProjection projection = new PlateCarreeProjection(
                    config.getCentralLongitude(), config.getExtent(), config.getWidth(), config.getHeight());
            try (MapCanvas canvas = new MapCanvas(projection)) {
                canvas.fillBackground(MapCanvas.OCEAN);
                if (config.getBasemap() != null && !config.getBasemap().isBlank()) {
                    for (Geometry land : basemapLoader.load(config.getBasemap())) {
                        canvas.fill(land, MapCanvas.LAND);
                        canvas.stroke(land, MapCanvas.COASTLINE, 0.6f);
                    }
                }
                canvas.drawGraticule(GRATICULE_STEP);
                for (PolygonFeature feature : selected) {
                    canvas.fill(feature.polygon(), PLUME);
                }
                canvas.drawTitle(title);
                canvas.write(imagePath);
            }
            return imagePath;
        } catch (PipelineException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new RenderFailedException(imagePath.toString(), "No se pudo generar la figura: " + e.getMessage(), e);
        }
    }
}
