package com.designcontext.simplifier.resolver.source;

import com.designcontext.simplifier.mapping.MappingDocument;
import com.designcontext.simplifier.mapping.MappingParseException;
import com.designcontext.simplifier.resolver.FileStat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A source backed by one or more candidate files, first existing readable candidate wins.
 *
 * Each file is parsed once per modification time; a file that failed to parse is
 * remembered as failed until it changes, and the next candidate is tried.
 */
public abstract class FileBackedMappingSource implements MappingSource {
    private static final Logger log = LoggerFactory.getLogger(FileBackedMappingSource.class);

    private final List<Path> candidates;
    private final FileStat fileStat;
    private final Map<Path, Snapshot> snapshots = new ConcurrentHashMap<>();

    protected FileBackedMappingSource(List<Path> candidates, FileStat fileStat) {
        this.candidates = List.copyOf(candidates);
        this.fileStat = fileStat;
    }

    protected abstract MappingDocument parse(Path file) throws IOException;

    public List<Path> getCandidates() {
        return candidates;
    }

    @Override
    public MappingDocument load() {
        for (Path candidate : candidates) {
            Optional<Instant> modified = fileStat.lastModified(candidate);
            if (modified.isEmpty()) {
                continue;
            }
            Snapshot snapshot = snapshots.get(candidate);
            if (snapshot == null || !snapshot.modified.equals(modified.get())) {
                if (snapshot != null) {
                    log.info("Mapping file modified, reloading: {}", candidate);
                }
                snapshot = read(candidate, modified.get());
                snapshots.put(candidate, snapshot);
            }
            if (snapshot.document != null) {
                return snapshot.document;
            }
        }
        return MappingDocument.empty();
    }

    private Snapshot read(Path file, Instant modified) {
        try {
            MappingDocument document = parse(file);
            log.info("Loaded {} mappings from: {}", document.size(), file);
            if (document.hasErrors()) {
                log.warn("{} entries skipped in {}", document.getErrors().size(), file);
            }
            return new Snapshot(modified, document);
        } catch (MappingParseException e) {
            log.warn("Ignoring malformed mapping file {}: {}", file, e.getMessage());
        } catch (IOException e) {
            log.warn("Could not read mapping file {}: {}", file, e.getMessage());
        }
        return new Snapshot(modified, null);
    }

    @Override
    public String describe() {
        return candidates.size() == 1 ? candidates.get(0).toString() : candidates.toString();
    }

    private static final class Snapshot {
        private final Instant modified;
        private final MappingDocument document;

        private Snapshot(Instant modified, MappingDocument document) {
            this.modified = modified;
            this.document = document;
        }
    }
}
