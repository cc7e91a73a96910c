package plumetracer.domain.exception;

/**
 * Un anillo no forma un polígono utilizable. No aborta la ejecución: el anillo se descarta.
 */
public class InvalidGeometryException extends PipelineException {

    public InvalidGeometryException(double level, String message) {
        super(PipelineStage.BUILD, "nivel " + level, message);
    }

    @Override
    public boolean isFatal() {
        return false;
    }
}
