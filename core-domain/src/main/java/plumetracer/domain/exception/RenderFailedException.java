package plumetracer.domain.exception;

/**
 * Fallo al generar una imagen de diagnóstico. Se registra pero no cambia el resultado de la ejecución.
 */
public class RenderFailedException extends PipelineException {

    public RenderFailedException(String path, String message, Throwable cause) {
        super(PipelineStage.RENDER, path, message, cause);
    }

    @Override
    public boolean isFatal() {
        return false;
    }
}
