package plumetracer.geometry;

import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.geom.util.GeometryFixer;
import org.locationtech.jts.operation.valid.IsValidOp;
import org.locationtech.jts.operation.valid.TopologyValidationError;
import plumetracer.config.InvalidRingPolicy;
import plumetracer.domain.contour.ContourLevel;
import plumetracer.domain.contour.ContourRing;
import plumetracer.domain.contour.ContourSet;
import plumetracer.domain.exception.InvalidGeometryException;
import plumetracer.domain.feature.PolygonFeature;
import plumetracer.domain.pipeline.PipelineReport;

import java.util.ArrayList;
import java.util.List;

/**
 * Convierte anillos de contorno en polígonos JTS en espacio (lon, lat), un polígono por anillo.
 * <p>
 * El orden de los vértices se conserva tal y como sale de la extracción. Lo que pasa con un
 * anillo no simple lo decide {@link InvalidRingPolicy}.
 */
@Slf4j
public class PolygonBuilder {

    public static final int WGS84_SRID = 4326;

    private final GeometryFactory geometryFactory;
    private final InvalidRingPolicy policy;

    public PolygonBuilder(InvalidRingPolicy policy) {
        this(new GeometryFactory(new PrecisionModel(), WGS84_SRID), policy);
    }

    public PolygonBuilder(GeometryFactory geometryFactory, InvalidRingPolicy policy) {
        this.geometryFactory = geometryFactory;
        this.policy = policy;
    }

    /**
     * Construye el polígono de un anillo.
     *
     * @throws InvalidGeometryException si el anillo no forma un polígono y la política no lo repara.
     */
    public PolygonFeature build(ContourRing ring, String attributeName) {
        double level = ring.level().value();
        if (ring.distinctVertexCount() < 3) {
            throw new InvalidGeometryException(level, "El anillo tiene menos de 3 vértices distintos");
        }

        Polygon polygon;
        try {
            polygon = geometryFactory.createPolygon(ring.vertices());
        } catch (IllegalArgumentException e) {
            throw new InvalidGeometryException(level, "No se puede formar un anillo lineal: " + e.getMessage());
        }

        IsValidOp validOp = new IsValidOp(polygon);
        if (!validOp.isValid()) {
            TopologyValidationError error = validOp.getValidationError();
            if (policy == InvalidRingPolicy.REJECT) {
                throw new InvalidGeometryException(level, "Polígono no válido: " + error);
            }
            polygon = repair(polygon, level);
            log.debug("Anillo del nivel {} reparado ({})", level, error.getMessage());
        }
        return new PolygonFeature(polygon, attributeName, level);
    }

    /**
     * Construye todos los polígonos del conjunto, en orden de nivel. Los anillos inválidos se descartan
     * con un aviso en el registro de la ejecución.
     */
    public List<PolygonFeature> buildAll(ContourSet contours, String attributeName, PipelineReport report) {
        List<PolygonFeature> features = new ArrayList<>();
        for (ContourLevel level : contours.getLevels()) {
            int built = 0;
            for (ContourRing ring : contours.getRings(level)) {
                try {
                    features.add(build(ring, attributeName));
                    built++;
                } catch (InvalidGeometryException e) {
                    log.warn("Anillo descartado en el nivel {}: {}", level, e.getMessage());
                    report.warn(e);
                }
            }
            log.debug("Nivel {}: {} polígono(s)", level, built);
        }
        return features;
    }

    private Polygon repair(Polygon polygon, double level) {
        Geometry fixed = GeometryFixer.fix(polygon);
        Polygon largest = null;
        for (int k = 0; k < fixed.getNumGeometries(); k++) {
            Geometry part = fixed.getGeometryN(k);
            if (part instanceof Polygon p && !p.isEmpty()
                    && (largest == null || p.getArea() > largest.getArea())) {
                largest = p;
            }
        }
        if (largest == null) {
            throw new InvalidGeometryException(level, "La reparación no produjo ningún polígono");
        }
        largest.setSRID(polygon.getSRID());
        return largest;
    }
}
