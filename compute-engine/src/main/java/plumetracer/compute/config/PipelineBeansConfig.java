package plumetracer.compute.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import plumetracer.contour.ContourTracer;
import plumetracer.contour.impl.MarchingSquaresContourTracer;
import plumetracer.field.FieldSource;
import plumetracer.field.FieldSourceResolver;
import plumetracer.field.JsonFieldSource;
import plumetracer.field.TemporalAggregator;
import plumetracer.io.FeatureCollectionFormats;
import plumetracer.io.JsonFileHandler;
import plumetracer.io.geojson.GeoJsonFeatureCollectionReader;
import plumetracer.io.geojson.GeoJsonFeatureCollectionWriter;
import plumetracer.io.shapefile.ShapefileFeatureCollectionReader;
import plumetracer.io.shapefile.ShapefileFeatureCollectionWriter;
import plumetracer.render.BasemapLoader;
import plumetracer.render.ContourPreviewRenderer;
import plumetracer.render.DiagnosticRenderer;

import java.time.Clock;
import java.util.List;

/**
 * Componentes del pipeline. Las clases del motor no dependen de Spring; aquí se ensamblan.
 */
@Configuration
@EnableConfigurationProperties(PlumeProperties.class)
public class PipelineBeansConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public JsonFileHandler jsonFileHandler() {
        return new JsonFileHandler();
    }

    @Bean
    public JsonFieldSource jsonFieldSource(JsonFileHandler jsonFileHandler) {
        return new JsonFieldSource(jsonFileHandler);
    }

    @Bean
    public FieldSourceResolver fieldSourceResolver(List<FieldSource> sources) {
        return new FieldSourceResolver(sources);
    }

    @Bean
    public TemporalAggregator temporalAggregator() {
        return new TemporalAggregator();
    }

    @Bean
    public ContourTracer contourTracer() {
        return new MarchingSquaresContourTracer();
    }

    @Bean
    public FeatureCollectionFormats featureCollectionFormats(JsonFileHandler jsonFileHandler, Clock clock) {
        return new FeatureCollectionFormats(
                List.of(new ShapefileFeatureCollectionWriter(clock), new GeoJsonFeatureCollectionWriter(jsonFileHandler)),
                List.of(new ShapefileFeatureCollectionReader(), new GeoJsonFeatureCollectionReader(jsonFileHandler)));
    }

    @Bean
    public DiagnosticRenderer diagnosticRenderer(FeatureCollectionFormats formats, JsonFileHandler jsonFileHandler) {
        return new DiagnosticRenderer(formats, new BasemapLoader(jsonFileHandler));
    }

    @Bean
    public ContourPreviewRenderer contourPreviewRenderer() {
        return new ContourPreviewRenderer();
    }
}
