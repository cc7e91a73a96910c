package plumetracer.compute;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Punto de entrada de la herramienta de línea de comandos.
 * <p>
 * Los parámetros llegan como propiedades de Spring: {@code --plume.levels=10,25 --plume.output=out.shp}.
 * El proceso termina con el código que fija {@link plumetracer.compute.runner.PipelineCommandLineRunner}.
 */
@SpringBootApplication(scanBasePackages = "plumetracer")
public class PlumeTracerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PlumeTracerApplication.class, args)));
    }
}
