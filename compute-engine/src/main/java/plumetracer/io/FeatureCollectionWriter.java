package plumetracer.io;

import plumetracer.domain.exception.WriteFailedException;
import plumetracer.domain.feature.FeatureCollection;
import plumetracer.pipeline.PipelineComponent;

import java.nio.file.Path;

/**
 * Serializa una colección de polígonos en un fichero de geometrías.
 * <p>
 * La escritura es atómica: tras un retorno correcto el fichero está completo; si falla no queda
 * ningún fichero anunciado como completo.
 */
public interface FeatureCollectionWriter extends PipelineComponent {

    /**
     * Indica si este escritor produce el formato que corresponde a la extensión de la ruta.
     */
    boolean supports(Path path);

    /**
     * @throws WriteFailedException ante cualquier error de E/S o un esquema que el formato no admite.
     */
    void write(FeatureCollection collection, Path path);
}
