package plumetracer.render;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.awt.geom.Point2D;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PlateCarreeProjectionTest {

    private static final double[] GLOBE = {-180, 180, -90, 90};

    @Test
    @DisplayName("La longitud se desplaza por la central y se normaliza a [-180, 180)")
    void projectLongitude_wrapsAroundCentralLongitude() {
        PlateCarreeProjection projection = new PlateCarreeProjection(150, GLOBE, 360, 180);

        assertThat(projection.projectLongitude(150)).isEqualTo(0.0);
        assertThat(projection.projectLongitude(-170)).isEqualTo(40.0);
        assertThat(projection.projectLongitude(-30)).isEqualTo(-180.0);
    }

    @Test
    @DisplayName("Un anillo que cruza el antimeridiano se desenrolla sin saltos de 360°")
    void unwrap_crossingAntimeridian() {
        PlateCarreeProjection projection = new PlateCarreeProjection(0, GLOBE, 360, 180);
        Coordinate[] ring = {new Coordinate(170, 0), new Coordinate(-170, 0), new Coordinate(-170, 10),
                new Coordinate(170, 10), new Coordinate(170, 0)};

        Coordinate[] unwrapped = projection.unwrapRing(ring);

        assertThat(unwrapped).extracting(c -> c.x).containsExactly(170.0, 190.0, 190.0, 170.0, 170.0);
    }

    @Test
    @DisplayName("Un anillo alrededor del polo se cierra por el borde polar")
    void unwrapRing_aroundPole() {
        PlateCarreeProjection projection = new PlateCarreeProjection(0, GLOBE, 360, 180);
        Coordinate[] ring = {new Coordinate(0, 80), new Coordinate(120, 80), new Coordinate(-120, 80), new Coordinate(0, 80)};

        Coordinate[] closed = projection.unwrapRing(ring);

        assertThat(closed[0]).isEqualTo(closed[closed.length - 1]);
        assertThat(closed).extracting(c -> c.y).contains(90.0);
    }

    @Test
    @DisplayName("Los grados proyectados se llevan a píxeles con el norte arriba")
    void toPixels_mapsExtentToImage() {
        PlateCarreeProjection projection = new PlateCarreeProjection(0, new double[]{-20, 20, 30, 50}, 400, 200);
        Point2D p = new Point2D.Double();

        projection.toPixels(0).transform(new Coordinate(-20, 50), p);
        assertThat(p.getX()).isCloseTo(0, within(1e-9));
        assertThat(p.getY()).isCloseTo(0, within(1e-9));

        projection.toPixels(0).transform(new Coordinate(0, 40), p);
        assertThat(p.getX()).isCloseTo(200, within(1e-9));
        assertThat(p.getY()).isCloseTo(100, within(1e-9));
    }

    @Test
    @DisplayName("Una extensión invertida se rechaza")
    void constructor_rejectsInvertedExtent() {
        assertThatThrownBy(() -> new PlateCarreeProjection(0, new double[]{10, -10, -90, 90}, 100, 100))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
