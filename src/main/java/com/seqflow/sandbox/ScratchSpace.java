package com.seqflow.sandbox;

import com.seqflow.core.target.PathNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Scratch directory owned by one task invocation, named
 * {@code <sanitized-task-name>-<8 hex chars>} under the scratch root.
 * Closing deletes it recursively.
 */
public final class ScratchSpace implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(ScratchSpace.class);

    public static final String INPUTS = "inputs";
    public static final String OUTPUTS = "outputs";
    public static final String WORK = "work";

    private final String id;
    private final Path root;
    private boolean retain;

    private ScratchSpace(String id, Path root) {
        this.id = id;
        this.root = root;
    }

    public static ScratchSpace create(Path scratchRoot, String taskName) throws IOException {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        String id = PathNormalizer.sanitizeName(taskName) + "-" + suffix;
        Path root = scratchRoot.toAbsolutePath().normalize().resolve(id);
        Files.createDirectories(root.resolve(INPUTS));
        Files.createDirectories(root.resolve(OUTPUTS));
        Files.createDirectories(root.resolve(WORK));
        log.debug("Created scratch space {}", root);
        return new ScratchSpace(id, root);
    }

    public String id() {
        return id;
    }

    public Path root() {
        return root;
    }

    public Path inputs() {
        return root.resolve(INPUTS);
    }

    public Path outputs() {
        return root.resolve(OUTPUTS);
    }

    public Path work() {
        return root.resolve(WORK);
    }

    /** Keeps the directory on close, for post-mortem inspection. */
    public void retain() {
        this.retain = true;
    }

    @Override
    public void close() {
        if (retain) {
            log.info("Keeping scratch space {}", root);
            return;
        }
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.reverseOrder()).forEach(ScratchSpace::deleteQuietly);
        } catch (IOException e) {
            log.warn("Could not clean up scratch space {}: {}", root, e.getMessage());
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete {}: {}", path, e.getMessage());
        }
    }
}
