package plumetracer.io;

import plumetracer.domain.feature.FeatureCollection;
import plumetracer.pipeline.PipelineComponent;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Lee de vuelta un fichero escrito por el {@link FeatureCollectionWriter} equivalente.
 */
public interface FeatureCollectionReader extends PipelineComponent {

    boolean supports(Path path);

    FeatureCollection read(Path path) throws IOException;
}
