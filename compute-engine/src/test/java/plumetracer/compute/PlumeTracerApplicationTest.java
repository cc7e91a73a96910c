package plumetracer.compute;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import plumetracer.compute.config.PipelineConfigFactory;
import plumetracer.compute.config.PlumeProperties;
import plumetracer.compute.runner.PipelineCommandLineRunner;
import plumetracer.compute.service.ContourPipelineService;
import plumetracer.config.InvalidRingPolicy;
import plumetracer.config.PipelineConfig;
import plumetracer.io.FeatureCollectionFormats;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "plume.runner.enabled=false",
                "plume.year=2021",
                "plume.month=7",
                "plume.day=15",
                "plume.levels=5,25,50",
                "plume.render.fill-level=50"
        })
class PlumeTracerApplicationTest {

    @Autowired
    private ApplicationContext context;
    @Autowired
    private PlumeProperties properties;
    @Autowired
    private PipelineConfigFactory configFactory;

    @Test
    @DisplayName("El contexto arranca con el pipeline ensamblado y sin ejecutar el runner")
    void contextLoads() {
        assertThat(context.getBean(ContourPipelineService.class)).isNotNull();
        assertThat(context.getBean(FeatureCollectionFormats.class).writerFor(Path.of("a.geojson"))).isNotNull();
        assertThat(context.getBeansOfType(PipelineCommandLineRunner.class)).isEmpty();
    }

    @Test
    @DisplayName("Las propiedades plume.* se enlazan y se traducen a la configuración de ejecución")
    void propertiesBindToPipelineConfig() {
        PipelineConfig config = configFactory.create(properties);

        assertThat(config.getLevels()).containsExactly(5.0, 25.0, 50.0);
        assertThat(config.getStart()).isEqualTo("2021-07-15T00:00");
        assertThat(config.getEnd()).isEqualTo("2021-07-16T00:00");
        assertThat(config.getInvalidRingPolicy()).isEqualTo(InvalidRingPolicy.REJECT);
        assertThat(config.getRender().getFillLevel()).isEqualTo(50.0);
        assertThat(config.getRender().getExtent()).containsExactly(-180, 180, -90, 90);
        assertThat(config.getRender().getBasemap()).isEqualTo("classpath:basemap/land.geojson");
    }
}
