package plumetracer.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import plumetracer.domain.field.Reducer;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Contenedor inmutable con todos los parámetros de una ejecución del pipeline.
 * Los textos con tokens strftime se resuelven más tarde contra la fecha representativa.
 */
@Value
@Builder
@With
public class PipelineConfig {

    /**
     * Plantilla de la fuente (ruta, patrón con comodines o URL). Se resuelve contra {@link #start}.
     */
    String source;

    /**
     * Inicio de la ventana temporal (incluido).
     */
    LocalDateTime start;

    /**
     * Fin de la ventana temporal (incluido).
     */
    LocalDateTime end;

    /**
     * Variables a leer; si hay varias se suman celda a celda.
     */
    List<String> variables;

    @Builder.Default
    double scaleFactor = 1.0;

    @Builder.Default
    Reducer reducer = Reducer.MEAN;

    /**
     * Niveles de contorno en el orden del usuario.
     */
    List<Double> levels;

    /**
     * Plantilla del fichero de salida (.shp o .geojson).
     */
    String outputTemplate;

    @Builder.Default
    String attributeName = "pm25";

    @Builder.Default
    InvalidRingPolicy invalidRingPolicy = InvalidRingPolicy.REJECT;

    /**
     * Extrae los niveles en paralelo. El orden final no cambia.
     */
    boolean parallelLevels;

    @Builder.Default
    RenderConfig render = RenderConfig.disabled();
}
