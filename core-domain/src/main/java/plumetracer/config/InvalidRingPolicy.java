package plumetracer.config;

/**
 * Qué hacer con un anillo que no forma un polígono simple válido.
 */
public enum InvalidRingPolicy {
    /**
     * Se rechaza con InvalidGeometryException y el anillo se descarta (por defecto).
     */
    REJECT,

    /**
     * Se repara con GeometryFixer de JTS y se conserva la mayor parte poligonal.
     */
    REPAIR
}
