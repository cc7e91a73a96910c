package plumetracer.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class AtomicFileTransactionTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("commit mueve los temporales a su destino y reemplaza lo que hubiera")
    void commit_movesIntoPlace() throws IOException {
        Path target = tempDir.resolve("sub/out.txt");
        Files.createDirectories(target.getParent());
        Files.writeString(target, "viejo");

        try (AtomicFileTransaction tx = new AtomicFileTransaction()) {
            Path temp = tx.stage(target);
            Files.writeString(temp, "nuevo");
            assertThat(target).hasContent("viejo");
            tx.commit();
        }

        assertThat(target).hasContent("nuevo");
        try (Stream<Path> listing = Files.list(target.getParent())) {
            assertThat(listing.count()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Cerrar sin commit borra los temporales y no toca el destino")
    void close_withoutCommit_discardsTemporaries() throws IOException {
        Path target = tempDir.resolve("out.txt");

        try (AtomicFileTransaction tx = new AtomicFileTransaction()) {
            Files.writeString(tx.stage(target), "a medias");
            Files.writeString(tx.stage(tempDir.resolve("aux.txt")), "a medias");
        }

        assertThat(tempDir).isEmptyDirectory();
    }
}
