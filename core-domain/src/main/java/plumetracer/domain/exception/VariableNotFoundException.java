package plumetracer.domain.exception;

public class VariableNotFoundException extends PipelineException {

    public VariableNotFoundException(String variable, String source) {
        super(PipelineStage.READ, variable, "La variable '" + variable + "' no existe en " + source);
    }
}
