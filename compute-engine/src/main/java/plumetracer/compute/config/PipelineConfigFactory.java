package plumetracer.compute.config;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import plumetracer.compute.service.AnalysisWindow;
import plumetracer.config.PipelineConfig;
import plumetracer.config.RenderConfig;
import plumetracer.domain.field.Reducer;

import java.time.Clock;
import java.util.List;

/**
 * Traduce {@link PlumeProperties} a la configuración inmutable de una ejecución.
 */
@Component
@RequiredArgsConstructor
public class PipelineConfigFactory {

    private final Clock clock;

    public PipelineConfig create(PlumeProperties properties) {
        AnalysisWindow window = AnalysisWindow.resolve(
                properties.getYear(), properties.getMonth(), properties.getDay(), properties.getTimeWindow(), clock);
        if (properties.getLevels() == null || properties.getLevels().isEmpty()) {
            throw new IllegalArgumentException("Se necesita al menos un nivel de contorno (plume.levels)");
        }

        return PipelineConfig.builder()
                .source(properties.getSource())
                .start(window.start())
                .end(window.end())
                .variables(List.copyOf(properties.getVariables()))
                .scaleFactor(properties.getScale())
                .reducer(Reducer.fromName(properties.getReducer()))
                .levels(List.copyOf(properties.getLevels()))
                .outputTemplate(properties.getOutput())
                .attributeName(properties.getAttributeName())
                .invalidRingPolicy(properties.getInvalidRingPolicy())
                .parallelLevels(properties.isParallelLevels())
                .render(toRenderConfig(properties.getRender()))
                .build();
    }

    private static RenderConfig toRenderConfig(PlumeProperties.Render render) {
        List<Double> extent = render.getExtent();
        if (extent == null || extent.size() != 4) {
            throw new IllegalArgumentException("plume.render.extent necesita 4 valores: minlon, maxlon, minlat, maxlat");
        }
        return RenderConfig.builder()
                .contourFigureTemplate(blankToNull(render.getContourFigure()))
                .fillFigureTemplate(blankToNull(render.getFillFigure()))
                .fillLevel(render.getFillLevel())
                .titleTemplate(render.getTitle())
                .centralLongitude(render.getCentralLongitude())
                .extent(extent.stream().mapToDouble(Double::doubleValue).toArray())
                .basemap(blankToNull(render.getBasemap()))
                .width(render.getWidth())
                .height(render.getHeight())
                .build();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
