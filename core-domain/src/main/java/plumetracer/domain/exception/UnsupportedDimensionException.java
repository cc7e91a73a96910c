package plumetracer.domain.exception;

/**
 * La variable tiene una dimensión extra no degenerada (distinta de time/lat/lon y de lev=1).
 */
public class UnsupportedDimensionException extends PipelineException {

    public UnsupportedDimensionException(String variable, String dimension, int size) {
        super(PipelineStage.READ, variable, String.format(
                "La variable '%s' tiene la dimensión '%s' de longitud %d; solo se admiten time, lat, lon y lev de longitud 1.",
                variable, dimension, size));
    }

    public UnsupportedDimensionException(String variable, String message) {
        super(PipelineStage.READ, variable, message);
    }
}
