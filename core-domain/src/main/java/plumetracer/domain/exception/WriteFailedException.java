package plumetracer.domain.exception;

public class WriteFailedException extends PipelineException {

    public WriteFailedException(String path, String message) {
        super(PipelineStage.WRITE, path, message);
    }

    public WriteFailedException(String path, String message, Throwable cause) {
        super(PipelineStage.WRITE, path, message, cause);
    }
}
