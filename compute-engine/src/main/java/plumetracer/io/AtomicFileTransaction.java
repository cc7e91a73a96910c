package plumetracer.io;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Escritura en dos fases de uno o varios ficheros: primero a temporales hermanos, después
 * se mueven a su sitio en el orden en que se registraron.
 * <p>
 * Si la transacción se cierra sin {@link #commit()}, los temporales se borran.
 */
@Slf4j
public class AtomicFileTransaction implements Closeable {

    private final Map<Path, Path> staged = new LinkedHashMap<>();
    private final List<Path> committed = new ArrayList<>();
    private boolean done;

    /**
     * Reserva un temporal en el mismo directorio que el destino (mismo sistema de ficheros).
     */
    public Path stage(Path target) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path temp = absolute.resolveSibling("." + absolute.getFileName() + "." + UUID.randomUUID() + ".tmp");
        staged.put(absolute, temp);
        return temp;
    }

    public void commit() throws IOException {
        for (Map.Entry<Path, Path> entry : staged.entrySet()) {
            move(entry.getValue(), entry.getKey());
            committed.add(entry.getKey());
        }
        done = true;
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public void close() {
        if (done) {
            return;
        }
        for (Path temp : staged.values()) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                log.warn("No se pudo borrar el temporal {}", temp, e);
            }
        }
        // Un commit a medias deja ficheros auxiliares sin el principal: se retiran también
        for (Path target : committed) {
            try {
                Files.deleteIfExists(target);
            } catch (IOException e) {
                log.warn("No se pudo retirar {}", target, e);
            }
        }
    }
}
