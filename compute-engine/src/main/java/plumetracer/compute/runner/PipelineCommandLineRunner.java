package plumetracer.compute.runner;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import plumetracer.compute.config.PipelineConfigFactory;
import plumetracer.compute.config.PlumeProperties;
import plumetracer.compute.service.ContourPipelineService;
import plumetracer.config.PipelineConfig;
import plumetracer.domain.exception.PipelineException;
import plumetracer.domain.pipeline.PipelineResult;

/**
 * Ejecuta el pipeline una vez al arrancar y fija el código de salida del proceso:
 * 0 si termina, 1 ante cualquier error fatal.
 * <p>
 * Se desactiva con {@code plume.runner.enabled=false} (por ejemplo en los tests de contexto).
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "plume.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PipelineCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {

    private final PlumeProperties properties;
    private final PipelineConfigFactory configFactory;
    private final ContourPipelineService pipelineService;

    private int exitCode;

    @Override
    public void run(String... args) {
        try {
            PipelineConfig config = configFactory.create(properties);
            PipelineResult result = pipelineService.run(config);
            if (result.report().hasWarnings()) {
                log.warn("La ejecución terminó con {} aviso(s)", result.report().getWarnings().size());
            }
            exitCode = 0;
        } catch (PipelineException e) {
            log.error("Fallo en la etapa {} ({}): {}", e.getStage(), e.getIdentifier(), e.getMessage());
            log.debug("Traza del fallo", e);
            exitCode = 1;
        } catch (RuntimeException e) {
            log.error("Error inesperado: {}", e.getMessage(), e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
