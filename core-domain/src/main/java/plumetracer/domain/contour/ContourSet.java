package plumetracer.domain.contour;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resultado de la extracción: anillos por nivel, en el mismo orden en que el usuario pidió los niveles.
 * <p>
 * También registra cuántos anillos degenerados se descartaron por nivel.
 */
public final class ContourSet {

    private final Map<ContourLevel, List<ContourRing>> ringsByLevel;
    private final Map<ContourLevel, Integer> discardedByLevel;

    public ContourSet(Map<ContourLevel, List<ContourRing>> ringsByLevel, Map<ContourLevel, Integer> discardedByLevel) {
        LinkedHashMap<ContourLevel, List<ContourRing>> copy = new LinkedHashMap<>();
        ringsByLevel.forEach((level, rings) -> {
            for (ContourRing ring : rings) {
                if (!ring.level().equals(level)) {
                    throw new IllegalArgumentException("Anillo del nivel " + ring.level()
                            + " asociado al nivel " + level);
                }
            }
            copy.put(level, List.copyOf(rings));
        });
        this.ringsByLevel = Collections.unmodifiableMap(copy);
        this.discardedByLevel = Map.copyOf(discardedByLevel);
    }

    public List<ContourLevel> getLevels() {
        return List.copyOf(ringsByLevel.keySet());
    }

    public List<ContourRing> getRings(ContourLevel level) {
        return ringsByLevel.getOrDefault(level, List.of());
    }

    public int getDiscardedCount(ContourLevel level) {
        return discardedByLevel.getOrDefault(level, 0);
    }

    public int getTotalRingCount() {
        return ringsByLevel.values().stream().mapToInt(List::size).sum();
    }

    public Map<ContourLevel, List<ContourRing>> asMap() {
        return ringsByLevel;
    }
}
