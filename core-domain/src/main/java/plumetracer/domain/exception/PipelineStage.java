package plumetracer.domain.exception;

/**
 * Etapa del pipeline en la que se produjo un error.
 */
public enum PipelineStage {
    READ,
    EXTRACT,
    BUILD,
    WRITE,
    RENDER
}
