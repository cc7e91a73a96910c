package plumetracer.domain.exception;

import lombok.Getter;

/**
 * Excepción base del pipeline de contornos.
 * <p>
 * Lleva la etapa que falló y el identificador implicado (variable, nivel o ruta)
 * para que el mensaje final sea legible sin la traza.
 */
@Getter
public class PipelineException extends RuntimeException {

    private final PipelineStage stage;
    private final String identifier;

    public PipelineException(PipelineStage stage, String identifier, String message) {
        super(message);
        this.stage = stage;
        this.identifier = identifier;
    }

    public PipelineException(PipelineStage stage, String identifier, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.identifier = identifier;
    }

    /**
     * Los errores fatales abortan la ejecución. Solo la geometría inválida y el render no lo son.
     */
    public boolean isFatal() {
        return true;
    }
}
