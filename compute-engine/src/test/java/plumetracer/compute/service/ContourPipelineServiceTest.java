package plumetracer.compute.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import plumetracer.compute.config.PipelineBeansConfig;
import plumetracer.config.PipelineConfig;
import plumetracer.config.RenderConfig;
import plumetracer.domain.contour.ContourLevel;
import plumetracer.domain.exception.DataUnavailableException;
import plumetracer.domain.exception.RenderFailedException;
import plumetracer.domain.feature.FeatureCollection;
import plumetracer.domain.feature.PolygonFeature;
import plumetracer.domain.pipeline.PipelineResult;
import plumetracer.contour.impl.MarchingSquaresContourTracer;
import plumetracer.field.FieldSourceResolver;
import plumetracer.field.JsonFieldSource;
import plumetracer.field.TemporalAggregator;
import plumetracer.io.FeatureCollectionFormats;
import plumetracer.io.JsonFileHandler;
import plumetracer.render.ContourPreviewRenderer;
import plumetracer.render.DiagnosticRenderer;
import plumetracer.support.GridFixtures;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Ejecuciones completas del pipeline sobre ficheros reales en un directorio temporal.
 */
class ContourPipelineServiceTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2020, 1, 1, 0, 0);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2020-01-02T06:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private ContourPipelineService service;
    private FeatureCollectionFormats formats;
    private Path source;

    @BeforeEach
    void setUp() throws IOException {
        PipelineBeansConfig beans = new PipelineBeansConfig();
        JsonFileHandler json = beans.jsonFileHandler();
        JsonFieldSource jsonSource = beans.jsonFieldSource(json);
        formats = beans.featureCollectionFormats(json, CLOCK);
        service = new ContourPipelineService(
                new FieldSourceResolver(List.of(jsonSource)),
                new TemporalAggregator(),
                new MarchingSquaresContourTracer(),
                formats,
                beans.diagnosticRenderer(formats, json),
                new ContourPreviewRenderer());

        // Meseta de 30 en una caja 10x10 sobre una malla unitaria 20x20, dos muestras horarias iguales
        double[] axis = GridFixtures.axis(0, 1, 20);
        double[][] plateau = GridFixtures.plateau(20, 5, 14, 30.0);
        source = GridFixtures.writeDataset(tempDir.resolve("in/pm25_20200101.json"),
                List.of(T0, T0.plusHours(1)), axis, axis, GridFixtures.single("pm25", plateau, plateau));
    }

    private PipelineConfig.PipelineConfigBuilder baseConfig(String output) {
        return PipelineConfig.builder()
                .source(tempDir.resolve("in/pm25_%Y%m%d.json").toString())
                .start(T0)
                .end(T0.plusHours(24))
                .variables(List.of("pm25"))
                .levels(List.of(25.0))
                .outputTemplate(tempDir.resolve(output).toString());
    }

    @Test
    @DisplayName("Escenario meseta: un anillo, un polígono con atributo 25")
    void run_plateauScenario() throws IOException {
        PipelineResult result = service.run(baseConfig("out/pm25_%Y%m%d.shp").build());

        assertThat(result.outputFile()).isEqualTo(tempDir.resolve("out/pm25_20200101.shp"));
        assertThat(result.timestamp()).isEqualTo(T0.plusMinutes(30));
        assertThat(result.featuresPerLevel()).containsExactly(Map.entry(ContourLevel.of(25.0), 1));
        assertThat(result.report().hasWarnings()).isFalse();

        FeatureCollection written = formats.readerFor(result.outputFile()).read(result.outputFile());
        assertThat(written.features()).singleElement().satisfies(feature -> {
            assertThat(feature.level()).isEqualTo(25.0);
            // Lado 9 + 2/6 con las cuatro esquinas recortadas por la interpolación
            double side = 9.0 + 2.0 * (5.0 / 30.0);
            assertThat(feature.polygon().getArea()).isCloseTo(side * side - 4 * 0.5 * Math.pow(5.0 / 30.0, 2), within(1e-9));
        });
    }

    @Test
    @DisplayName("Contabilidad de niveles: cada feature lleva uno de los niveles pedidos; un nivel fuera de rango da cero")
    void run_levelBookkeepingAndEmptyIntersection() throws IOException {
        PipelineResult result = service.run(baseConfig("out/levels.geojson")
                .levels(List.of(25.0, 10.0, 100.0, 25.0))
                .build());

        assertThat(result.featuresPerLevel().keySet())
                .containsExactly(ContourLevel.of(25.0), ContourLevel.of(10.0), ContourLevel.of(100.0));
        assertThat(result.featuresPerLevel().get(ContourLevel.of(100.0))).isZero();
        assertThat(result.totalFeatures()).isEqualTo(2);

        FeatureCollection written = formats.readerFor(result.outputFile()).read(result.outputFile());
        assertThat(written.features()).extracting(PolygonFeature::level).containsExactly(25.0, 10.0);
    }

    @Test
    @DisplayName("Niveles muy pequeños (mol/mol) se cuentan por separado")
    void run_smallLevelsAreCountedSeparately() throws IOException {
        double[] axis = GridFixtures.axis(0, 1, 20);
        double[][] plateau = GridFixtures.plateau(20, 5, 14, 3e-9);
        GridFixtures.writeDataset(tempDir.resolve("in/no2_20200101.json"),
                List.of(T0), axis, axis, GridFixtures.single("no2", plateau));

        PipelineResult result = service.run(baseConfig("out/no2.geojson")
                .source(tempDir.resolve("in/no2_%Y%m%d.json").toString())
                .variables(List.of("no2"))
                .levels(List.of(1e-9, 2e-9))
                .attributeName("no2")
                .build());

        assertThat(result.featuresPerLevel()).containsExactly(
                Map.entry(ContourLevel.of(1e-9), 1), Map.entry(ContourLevel.of(2e-9), 1));
        assertThat(result.totalFeatures()).isEqualTo(2);
    }

    @Test
    @DisplayName("Un campo que no alcanza ningún nivel produce un fichero válido sin features")
    void run_noFeatures() throws IOException {
        PipelineResult result = service.run(baseConfig("out/empty.shp").levels(List.of(500.0)).build());

        assertThat(result.totalFeatures()).isZero();
        assertThat(formats.readerFor(result.outputFile()).read(result.outputFile()).size()).isZero();
    }

    @Test
    @DisplayName("Idempotencia: dos ejecuciones iguales producen ficheros idénticos byte a byte")
    void run_isIdempotent() throws IOException {
        PipelineResult first = service.run(baseConfig("a/out.shp").levels(List.of(10.0, 25.0)).build());
        PipelineResult second = service.run(baseConfig("b/out.shp").levels(List.of(10.0, 25.0)).build());

        for (String ext : List.of(".shp", ".shx", ".dbf", ".prj")) {
            Path a = tempDir.resolve("a/out" + ext);
            Path b = tempDir.resolve("b/out" + ext);
            assertThat(Files.readAllBytes(b)).as(ext).isEqualTo(Files.readAllBytes(a));
        }
        assertThat(second.featuresPerLevel()).isEqualTo(first.featuresPerLevel());
    }

    @Test
    @DisplayName("La figura de relleno se genera leyendo el fichero escrito")
    void run_writesFillFigure() {
        RenderConfig render = RenderConfig.builder()
                .fillFigureTemplate(tempDir.resolve("fig/pm25_%Y%m%d.png").toString())
                .contourFigureTemplate(tempDir.resolve("fig/contours_%Y%m%d.png").toString())
                .width(200).height(100)
                .build();

        PipelineResult result = service.run(baseConfig("out/fig.shp").render(render).build());

        assertThat(result.fillFigure()).contains(tempDir.resolve("fig/pm25_20200101.png"));
        assertThat(tempDir.resolve("fig/pm25_20200101.png")).exists();
        assertThat(tempDir.resolve("fig/contours_20200101.png")).exists();
    }

    @Test
    @DisplayName("Un fallo de render queda como aviso y la ejecución termina")
    void run_renderFailureIsNotFatal() {
        RenderConfig render = RenderConfig.builder()
                .fillFigureTemplate(tempDir.resolve("fig/pm25.unknownformat").toString())
                .build();

        PipelineResult result = service.run(baseConfig("out/render.shp").render(render).build());

        assertThat(result.outputFile()).exists();
        assertThat(result.fillFigure()).isEmpty();
        assertThat(result.report().getWarnings()).singleElement().isInstanceOf(RenderFailedException.class);
    }

    @Test
    @DisplayName("Una fuente inexistente aborta la ejecución sin dejar fichero de salida")
    void run_missingSourceAborts() throws IOException {
        Files.delete(source);

        assertThatThrownBy(() -> service.run(baseConfig("out/none.shp").build()))
                .isInstanceOf(DataUnavailableException.class);
        assertThat(tempDir.resolve("out")).doesNotExist();
    }
}
