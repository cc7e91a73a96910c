package plumetracer.compute.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import plumetracer.config.InvalidRingPolicy;
import plumetracer.config.PipelineConfig;
import plumetracer.domain.field.Reducer;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineConfigFactoryTest {

    private final PipelineConfigFactory factory =
            new PipelineConfigFactory(Clock.fixed(Instant.parse("2021-07-01T00:00:00Z"), ZoneOffset.UTC));

    @Test
    @DisplayName("Los valores por defecto reproducen la herramienta original")
    void create_defaults() {
        PipelineConfig config = factory.create(new PlumeProperties());

        assertThat(config.getStart()).isEqualTo(LocalDateTime.of(2021, 6, 30, 0, 0));
        assertThat(config.getEnd()).isEqualTo(LocalDateTime.of(2021, 7, 1, 0, 0));
        assertThat(config.getVariables()).containsExactly("pm25_rh35_gcc");
        assertThat(config.getReducer()).isEqualTo(Reducer.MEAN);
        assertThat(config.getLevels()).containsExactly(10.0, 25.0);
        assertThat(config.getOutputTemplate()).isEqualTo("pm25_%Y%m%d.shp");
        assertThat(config.getAttributeName()).isEqualTo("pm25");
        assertThat(config.getInvalidRingPolicy()).isEqualTo(InvalidRingPolicy.REJECT);
        assertThat(config.getRender().getFillFigureTemplate()).isEqualTo("pm25_%Y%m%d.png");
        assertThat(config.getRender().getContourFigureTemplate()).isNull();
        assertThat(config.getRender().getExtent()).containsExactly(-180, 180, -90, 90);
        assertThat(config.getRender().getBasemap()).isEqualTo("classpath:basemap/land.geojson");
    }

    @Test
    @DisplayName("Una figura vacía queda desactivada y el reductor se lee en minúsculas")
    void create_overrides() {
        PlumeProperties properties = new PlumeProperties();
        properties.setReducer("max");
        properties.getRender().setFillFigure("");
        properties.getRender().setBasemap("");
        properties.setLevels(List.of(50.0));

        PipelineConfig config = factory.create(properties);

        assertThat(config.getReducer()).isEqualTo(Reducer.MAX);
        assertThat(config.getRender().getFillFigureTemplate()).isNull();
        assertThat(config.getRender().getBasemap()).isNull();
        assertThat(config.getLevels()).containsExactly(50.0);
    }

    @Test
    @DisplayName("Sin niveles o con una extensión incompleta la configuración no es válida")
    void create_invalid() {
        PlumeProperties noLevels = new PlumeProperties();
        noLevels.setLevels(List.of());
        PlumeProperties badExtent = new PlumeProperties();
        badExtent.getRender().setExtent(List.of(0.0, 10.0));

        assertThatThrownBy(() -> factory.create(noLevels)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> factory.create(badExtent)).isInstanceOf(IllegalArgumentException.class);
    }
}
