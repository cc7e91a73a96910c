package plumetracer.compute.runner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import plumetracer.compute.config.PipelineConfigFactory;
import plumetracer.compute.config.PlumeProperties;
import plumetracer.compute.service.ContourPipelineService;
import plumetracer.config.PipelineConfig;
import plumetracer.domain.contour.ContourLevel;
import plumetracer.domain.exception.DataUnavailableException;
import plumetracer.domain.exception.RenderFailedException;
import plumetracer.domain.pipeline.PipelineReport;
import plumetracer.domain.pipeline.PipelineResult;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineCommandLineRunnerTest {

    @Mock
    private PipelineConfigFactory configFactory;
    @Mock
    private ContourPipelineService pipelineService;

    private final PlumeProperties properties = new PlumeProperties();
    private final PipelineConfig config = PipelineConfig.builder()
            .source("pm25.json")
            .variables(List.of("pm25"))
            .levels(List.of(25.0))
            .outputTemplate("out.shp")
            .build();

    private PipelineCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        runner = new PipelineCommandLineRunner(properties, configFactory, pipelineService);
        when(configFactory.create(properties)).thenReturn(config);
    }

    private PipelineResult result(PipelineReport report) {
        return new PipelineResult(LocalDateTime.of(2020, 1, 1, 12, 0), Path.of("out.shp"),
                Map.of(ContourLevel.of(25.0), 1), Optional.empty(), report);
    }

    @Test
    @DisplayName("Una ejecución completa termina con código 0")
    void run_success_exitsZero() {
        when(pipelineService.run(config)).thenReturn(result(new PipelineReport()));

        runner.run();

        assertThat(runner.getExitCode()).isZero();
        verify(pipelineService).run(config);
    }

    @Test
    @DisplayName("Los avisos no fatales no cambian el código de salida")
    void run_withWarnings_exitsZero() {
        PipelineReport report = new PipelineReport();
        report.warn(new RenderFailedException("fig.png", "sin fuente", null));
        when(pipelineService.run(config)).thenReturn(result(report));

        runner.run();

        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("Un fallo del pipeline termina con código 1")
    void run_pipelineFailure_exitsOne() {
        when(pipelineService.run(config)).thenThrow(new DataUnavailableException("pm25.json", "no existe"));

        runner.run();

        assertThat(runner.getExitCode()).isEqualTo(1);
    }

    @Test
    @DisplayName("Un error de configuración también termina con código 1")
    void run_badConfiguration_exitsOne() {
        reset(configFactory);
        when(configFactory.create(properties)).thenThrow(new IllegalArgumentException("sin niveles"));

        runner.run();

        assertThat(runner.getExitCode()).isEqualTo(1);
        verifyNoInteractions(pipelineService);
    }
}
