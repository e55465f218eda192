package com.designcontext.simplifier.resolver;

import lombok.Builder;
import lombok.Value;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Where the variable resolver looks for mappings and how often it refreshes them.
 */
@Value
@Builder(toBuilder = true)
public class ResolverConfig {
    private static final Logger log = LoggerFactory.getLogger(ResolverConfig.class);

    public static final String DEFAULT_FILE_NAME = ".figma-variables.json";

    @Builder.Default
    String mappingFileName = DEFAULT_FILE_NAME;

    /** Directories searched for the mapping file, in priority order. */
    @Builder.Default
    List<Path> searchDirectories = defaultSearchDirectories();

    /** Remote mapping endpoint; null disables the remote source. */
    String remoteUrl;

    /** Design-token export; null disables the token source. */
    Path tokenFile;

    @Builder.Default
    Duration localCheckInterval = Duration.ofSeconds(10);

    @Builder.Default
    Duration remoteTtl = Duration.ofMinutes(5);

    @Builder.Default
    Duration httpTimeout = Duration.ofSeconds(10);

    public static ResolverConfig defaults() {
        return ResolverConfig.builder().build();
    }

    public List<Path> localCandidates() {
        List<Path> candidates = new ArrayList<>();
        for (Path directory : searchDirectories) {
            candidates.add(directory.resolve(mappingFileName).toAbsolutePath().normalize());
        }
        return candidates;
    }

    /**
     * Working directory, home directory, then the directory the tool is installed in.
     */
    public static List<Path> defaultSearchDirectories() {
        List<Path> directories = new ArrayList<>();
        directories.add(Path.of("").toAbsolutePath());
        String home = System.getProperty("user.home");
        if (home != null && !home.isBlank()) {
            directories.add(Path.of(home));
        }
        Path install = installDirectory();
        if (install != null && !directories.contains(install)) {
            directories.add(install);
        }
        return directories;
    }

    private static Path installDirectory() {
        try {
            var source = ResolverConfig.class.getProtectionDomain().getCodeSource();
            if (source == null) {
                return null;
            }
            Path location = Path.of(source.getLocation().toURI());
            return location.getParent();
        } catch (URISyntaxException | RuntimeException e) {
            log.debug("Install directory not available: {}", e.getMessage());
            return null;
        }
    }
}
