package plumetracer.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Parámetros de las figuras de diagnóstico. Una plantilla nula desactiva la figura correspondiente.
 */
@Value
@Builder
@With
public class RenderConfig {

    /**
     * Figura con las isolíneas originales, antes de construir polígonos.
     */
    String contourFigureTemplate;

    /**
     * Figura con los polígonos de un nivel, leídos del fichero escrito.
     */
    String fillFigureTemplate;

    /**
     * Nivel a rellenar. Si es nulo se usa el primer nivel pedido.
     */
    Double fillLevel;

    String titleTemplate;

    double centralLongitude;

    /**
     * [minlon, maxlon, minlat, maxlat] en grados geográficos.
     */
    @Builder.Default
    double[] extent = {-180, 180, -90, 90};

    /**
     * GeoJSON opcional con los polígonos de tierra firme para el fondo (ruta o {@code classpath:}).
     */
    String basemap;

    @Builder.Default
    int width = 1200;

    @Builder.Default
    int height = 700;

    public static RenderConfig disabled() {
        return RenderConfig.builder().build();
    }
}
