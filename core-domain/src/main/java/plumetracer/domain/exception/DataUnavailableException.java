package plumetracer.domain.exception;

/**
 * La fuente no es accesible o la ventana temporal no contiene ninguna muestra.
 */
public class DataUnavailableException extends PipelineException {

    public DataUnavailableException(String source, String message) {
        super(PipelineStage.READ, source, message);
    }

    public DataUnavailableException(String source, String message, Throwable cause) {
        super(PipelineStage.READ, source, message, cause);
    }
}
