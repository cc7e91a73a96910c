package plumetracer.compute.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import plumetracer.config.InvalidRingPolicy;

import java.util.ArrayList;
import java.util.List;

/**
 * Parámetros de la línea de comandos y de application.yml bajo el prefijo {@code plume}.
 * <p>
 * Ejemplo: {@code --plume.source=data/pm25_*.json --plume.levels=10,25,50 --plume.output=out/pm25_%Y%m%d.geojson}
 */
@Data
@ConfigurationProperties(prefix = "plume")
public class PlumeProperties {

    private String source = "pm25_%Y%m%d.json";

    /**
     * Fecha de inicio. Los campos nulos se toman de ayer.
     */
    private Integer year;
    private Integer month;
    private Integer day;

    /**
     * Horas de la ventana temporal.
     */
    private int timeWindow = 24;

    private List<String> variables = new ArrayList<>(List.of("pm25_rh35_gcc"));

    private double scale = 1.0;

    /**
     * mean, min o max.
     */
    private String reducer = "mean";

    private List<Double> levels = new ArrayList<>(List.of(10.0, 25.0));

    private String output = "pm25_%Y%m%d.shp";

    private String attributeName = "pm25";

    private InvalidRingPolicy invalidRingPolicy = InvalidRingPolicy.REJECT;

    private boolean parallelLevels;

    private Render render = new Render();

    @Data
    public static class Render {

        private String contourFigure;

        /**
         * Vacío desactiva la figura.
         */
        private String fillFigure = "pm25_%Y%m%d.png";

        private Double fillLevel;

        private String title = "Surface PM2.5 >= 25 ug/m3 (%Y-%m-%d)";

        private double centralLongitude;

        private List<Double> extent = new ArrayList<>(List.of(-180.0, 180.0, -90.0, 90.0));

        /**
         * GeoJSON de tierra firme: ruta de fichero o {@code classpath:}. Vacío para no dibujarla.
         */
        private String basemap = "classpath:basemap/land.geojson";

        private int width = 1200;

        private int height = 700;
    }
}
