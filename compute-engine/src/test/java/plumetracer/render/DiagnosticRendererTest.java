package plumetracer.render;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Coordinate;
import plumetracer.config.InvalidRingPolicy;
import plumetracer.config.RenderConfig;
import plumetracer.domain.contour.ContourLevel;
import plumetracer.domain.contour.ContourRing;
import plumetracer.domain.exception.PipelineStage;
import plumetracer.domain.exception.RenderFailedException;
import plumetracer.domain.feature.FeatureCollection;
import plumetracer.domain.feature.FeatureSchema;
import plumetracer.geometry.PolygonBuilder;
import plumetracer.io.FeatureCollectionFormats;
import plumetracer.io.JsonFileHandler;
import plumetracer.io.geojson.GeoJsonFeatureCollectionReader;
import plumetracer.io.geojson.GeoJsonFeatureCollectionWriter;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiagnosticRendererTest {

    @TempDir
    Path tempDir;

    private DiagnosticRenderer renderer;
    private Path featureFile;
    private RenderConfig config;

    @BeforeEach
    void setUp() throws IOException {
        JsonFileHandler json = new JsonFileHandler();
        FeatureCollectionFormats formats = new FeatureCollectionFormats(
                List.of(new GeoJsonFeatureCollectionWriter(json)), List.of(new GeoJsonFeatureCollectionReader(json)));
        renderer = new DiagnosticRenderer(formats, new BasemapLoader(json));

        // Cuadrado de 40° en [0, 40] x [0, 40] al nivel 25
        ContourRing ring = new ContourRing(ContourLevel.of(25.0), new Coordinate[]{
                new Coordinate(0, 0), new Coordinate(40, 0), new Coordinate(40, 40), new Coordinate(0, 40)});
        featureFile = tempDir.resolve("plumes.geojson");
        new GeoJsonFeatureCollectionWriter(json).write(new FeatureCollection(FeatureSchema.polygonWithLevel("pm25"),
                List.of(new PolygonBuilder(InvalidRingPolicy.REJECT).build(ring, "pm25"))), featureFile);

        config = RenderConfig.builder().width(360).height(180).build();
    }

    @Test
    @DisplayName("Rellena de rojo los polígonos del nivel sobre el fondo de océano")
    void render_fillsSelectedLevel() throws IOException {
        Path image = tempDir.resolve("fill.png");

        renderer.render(featureFile, 25.0, image, null, config);

        BufferedImage png = ImageIO.read(image.toFile());
        assertThat(png.getWidth()).isEqualTo(360);
        // (20°E, 20°N) -> píxel (200, 70): dentro del polígono
        assertThat(png.getRGB(200, 70) & 0xFFFFFF).isEqualTo(DiagnosticRenderer.PLUME.getRGB() & 0xFFFFFF);
        // (-100°, -45°) -> píxel (80, 135): océano
        assertThat(png.getRGB(80, 135) & 0xFFFFFF).isEqualTo(MapCanvas.OCEAN.getRGB() & 0xFFFFFF);
    }

    @Test
    @DisplayName("Otro nivel no rellena nada")
    void render_otherLevelIsEmpty() throws IOException {
        Path image = tempDir.resolve("fill10.png");

        renderer.render(featureFile, 10.0, image, null, config);

        BufferedImage png = ImageIO.read(image.toFile());
        assertThat(png.getRGB(200, 70) & 0xFFFFFF).isEqualTo(MapCanvas.OCEAN.getRGB() & 0xFFFFFF);
    }

    @Test
    @DisplayName("El mapa base pinta la tierra bajo la pluma")
    void render_withBasemap() throws IOException {
        Path basemap = tempDir.resolve("land.geojson");
        Files.writeString(basemap, """
                {"type": "FeatureCollection", "features": [
                  {"type": "Feature", "properties": {}, "geometry": {"type": "Polygon",
                   "coordinates": [[[-120, -60], [-60, -60], [-60, -30], [-120, -30], [-120, -60]]]}}]}
                """);
        Path image = tempDir.resolve("land.png");

        renderer.render(featureFile, 25.0, image, null, config.withBasemap(basemap.toString()));

        BufferedImage png = ImageIO.read(image.toFile());
        assertThat(png.getRGB(85, 135) & 0xFFFFFF).isEqualTo(MapCanvas.LAND.getRGB() & 0xFFFFFF);
    }

    @Test
    @DisplayName("El contorno de continentes incluido en el classpath pinta tierra y deja el océano")
    void render_withBundledBasemap() throws IOException {
        Path image = tempDir.resolve("bundled.png");

        renderer.render(featureFile, 25.0, image, null, config.withBasemap("classpath:basemap/land.geojson"));

        BufferedImage png = ImageIO.read(image.toFile());
        int land = MapCanvas.LAND.getRGB() & 0xFFFFFF;
        // (-100°, 40°) -> píxel (80, 50): Norteamérica
        assertThat(png.getRGB(80, 50) & 0xFFFFFF).isEqualTo(land);
        // (-55°, -10°) -> píxel (125, 100): Brasil
        assertThat(png.getRGB(125, 100) & 0xFFFFFF).isEqualTo(land);
        // (-140°, -40°) -> píxel (40, 130): Pacífico sur
        assertThat(png.getRGB(40, 130) & 0xFFFFFF).isEqualTo(MapCanvas.OCEAN.getRGB() & 0xFFFFFF);
    }

    @Test
    @DisplayName("Un recurso de mapa base inexistente es un fallo de renderizado")
    void render_missingBundledBasemap_fails() {
        Path image = tempDir.resolve("missing.png");

        assertThatThrownBy(() -> renderer.render(featureFile, 25.0, image, null,
                config.withBasemap("classpath:basemap/nothing.geojson")))
                .isInstanceOf(RenderFailedException.class)
                .hasMessageContaining("nothing.geojson");
    }

    @Test
    @DisplayName("Un fichero de geometrías inexistente es RenderFailed")
    void render_missingInput() {
        Path image = tempDir.resolve("fill.png");

        assertThatThrownBy(() -> renderer.render(tempDir.resolve("nope.geojson"), 25.0, image, null, config))
                .isInstanceOfSatisfying(RenderFailedException.class, e -> {
                    assertThat(e.getStage()).isEqualTo(PipelineStage.RENDER);
                    assertThat(e.isFatal()).isFalse();
                });
        assertThat(image).doesNotExist();
    }

    @Test
    @DisplayName("Un formato de imagen desconocido es RenderFailed y no deja temporales")
    void render_unknownFormat() {
        assertThatThrownBy(() -> renderer.render(featureFile, 25.0, tempDir.resolve("fill.xyz"), null, config))
                .isInstanceOf(RenderFailedException.class);
        assertThat(tempDir.resolve("fill.xyz")).doesNotExist();
    }
}
