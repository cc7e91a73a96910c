package plumetracer.field;

import lombok.extern.slf4j.Slf4j;
import plumetracer.domain.exception.DataUnavailableException;
import plumetracer.domain.field.GriddedDataset;
import plumetracer.utils.StrftimeFormatter;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Elige la fuente adecuada para una ubicación y resuelve su plantilla strftime contra el inicio de la ventana.
 */
@Slf4j
public class FieldSourceResolver {

    private final List<FieldSource> sources;

    public FieldSourceResolver(List<FieldSource> sources) {
        this.sources = List.copyOf(sources);
    }

    public GriddedDataset read(String locationTemplate, LocalDateTime start) {
        String location = StrftimeFormatter.format(locationTemplate, start);
        FieldSource source = sources.stream()
                .filter(s -> s.supports(location))
                .findFirst()
                .orElseThrow(() -> new DataUnavailableException(location,
                        "Ninguna fuente registrada sabe leer '" + location + "'"));
        log.info("Leyendo {} con la fuente {}", location, source.getName());
        return source.read(location);
    }
}
