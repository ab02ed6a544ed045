package kinet.newsfeed.profile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * One {@code <key>.json} file per domain. Writes go to a temp file in the same
 * directory and are moved over the target.
 */
public final class FileProfileStore implements ProfileStore {
    private static final Logger log = LoggerFactory.getLogger(FileProfileStore.class);
    private static final String EXT = ".json";

    private final Path dir;

    public FileProfileStore(Path dir) throws IOException {
        this.dir = dir;
        Files.createDirectories(dir);
    }

    @Override
    public Optional<byte[]> get(String key) throws IOException {
        try {
            return Optional.of(Files.readAllBytes(file(key)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, byte[] value) throws IOException {
        Path target = file(key);
        Path tmp = Files.createTempFile(dir, key + "-", ".tmp");
        try {
            Files.write(tmp, value);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, replacing {}", dir, target.getFileName());
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    @Override
    public boolean delete(String key) throws IOException {
        return Files.deleteIfExists(file(key));
    }

    @Override
    public List<String> keys() throws IOException {
        List<String> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.map(p -> p.getFileName().toString())
                    .filter(n -> n.endsWith(EXT))
                    .sorted()
                    .forEach(n -> out.add(n.substring(0, n.length() - EXT.length())));
        }
        return out;
    }

    private Path file(String key) {
        return dir.resolve(key + EXT);
    }
}
