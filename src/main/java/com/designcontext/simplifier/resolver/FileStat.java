package com.designcontext.simplifier.resolver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * Modification-time lookup for mapping files; replaced in tests.
 */
@FunctionalInterface
public interface FileStat {

    /**
     * @return the file's modification time, or empty when it does not exist or cannot be read
     */
    Optional<Instant> lastModified(Path path);

    static FileStat system() {
        return path -> {
            if (!Files.isRegularFile(path)) {
                return Optional.empty();
            }
            try {
                return Optional.of(Files.getLastModifiedTime(path).toInstant());
            } catch (IOException e) {
                return Optional.empty();
            }
        };
    }
}
