package plumetracer.pipeline;

/**
 * Contrato base para los componentes intercambiables del pipeline (fuentes, trazadores, escritores).
 * Permite identificarlos en los logs sin conocer su implementación.
 */
public interface PipelineComponent {
    /**
     * Nombre corto de la implementación (ej: "MarchingSquares", "ESRI Shapefile").
     */
    String getName();

    /**
     * Descripción técnica detallada.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
