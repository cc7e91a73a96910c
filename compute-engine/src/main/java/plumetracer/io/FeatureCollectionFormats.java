package plumetracer.io;

import plumetracer.domain.exception.WriteFailedException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Registro de escritores y lectores disponibles. El formato se elige por la extensión del fichero.
 */
public class FeatureCollectionFormats {

    private final List<FeatureCollectionWriter> writers;
    private final List<FeatureCollectionReader> readers;

    public FeatureCollectionFormats(List<FeatureCollectionWriter> writers, List<FeatureCollectionReader> readers) {
        this.writers = List.copyOf(writers);
        this.readers = List.copyOf(readers);
    }

    public FeatureCollectionWriter writerFor(Path path) {
        return writers.stream()
                .filter(w -> w.supports(path))
                .findFirst()
                .orElseThrow(() -> new WriteFailedException(path.toString(),
                        "Extensión de salida no soportada: " + path.getFileName()
                                + " (use .shp, .geojson o .json)"));
    }

    public FeatureCollectionReader readerFor(Path path) throws IOException {
        return readers.stream()
                .filter(r -> r.supports(path))
                .findFirst()
                .orElseThrow(() -> new IOException("No hay lector para " + path.getFileName()));
    }
}
