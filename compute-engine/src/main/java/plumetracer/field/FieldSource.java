package plumetracer.field;

import plumetracer.domain.exception.DataUnavailableException;
import plumetracer.domain.field.GriddedDataset;
import plumetracer.pipeline.PipelineComponent;

/**
 * Capacidad externa de adquisición de datos en malla.
 * <p>
 * Una implementación sabe leer un tipo de ubicación (fichero, patrón con comodines o URL)
 * y devolver el conjunto de datos completo; la selección temporal se hace después.
 */
public interface FieldSource extends PipelineComponent {

    /**
     * Indica si esta fuente sabe leer la ubicación (ya resuelta, sin tokens strftime).
     */
    boolean supports(String location);

    /**
     * Lee el conjunto de datos. Si la ubicación tiene comodines, concatena los ficheros en el eje temporal.
     *
     * @throws DataUnavailableException si la fuente no existe, no es accesible o no se puede decodificar.
     */
    GriddedDataset read(String location);
}
