package com.designcontext.simplifier.resolver;

import com.designcontext.simplifier.mapping.MappingDocument;
import com.designcontext.simplifier.resolver.source.DesignTokenMappingSource;
import com.designcontext.simplifier.resolver.source.LocalFileMappingSource;
import com.designcontext.simplifier.resolver.source.MappingSource;
import com.designcontext.simplifier.resolver.source.RemoteMappingSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide cache of external variable mappings.
 *
 * Refresh policy:
 * - local file and token document are looked at when more than {@code localCheckInterval}
 *   has passed since the last look; the sources themselves re-parse only on a changed
 *   modification time
 * - the remote source is refetched once {@code remoteTtl} has passed
 * - a source that fails contributes nothing until its next refresh
 *
 * Priority of the merged set: local file, then remote, then token document.
 * State lives in volatile fields without locking; two callers refreshing at once do the
 * same work twice and publish equivalent sets.
 */
public class MappingCache {
    private static final Logger log = LoggerFactory.getLogger(MappingCache.class);

    private static final Map<ResolverConfig, MappingCache> SHARED = new ConcurrentHashMap<>();

    private final MappingSource localSource;
    private final MappingSource remoteSource;
    private final MappingSource tokenSource;
    private final Duration localCheckInterval;
    private final Duration remoteTtl;
    private final Clock clock;

    private volatile MappingDocument localDocument = MappingDocument.empty();
    private volatile MappingDocument remoteDocument = MappingDocument.empty();
    private volatile MappingDocument tokenDocument = MappingDocument.empty();
    private volatile Instant localCheckedAt;
    private volatile Instant remoteFetchedAt;
    private volatile MappingSet current;

    public MappingCache(MappingSource localSource, MappingSource remoteSource, MappingSource tokenSource,
                        Duration localCheckInterval, Duration remoteTtl, Clock clock) {
        this.localSource = localSource;
        this.remoteSource = remoteSource;
        this.tokenSource = tokenSource;
        this.localCheckInterval = localCheckInterval;
        this.remoteTtl = remoteTtl;
        this.clock = clock;
    }

    public static MappingCache fromConfig(ResolverConfig config) {
        return fromConfig(config, FileStat.system(), Clock.systemUTC());
    }

    public static MappingCache fromConfig(ResolverConfig config, FileStat fileStat, Clock clock) {
        MappingSource local = new LocalFileMappingSource(config.localCandidates(), fileStat);
        MappingSource remote = config.getRemoteUrl() == null || config.getRemoteUrl().isBlank()
                ? null
                : new RemoteMappingSource(config.getRemoteUrl(), config.getHttpTimeout());
        MappingSource tokens = config.getTokenFile() == null
                ? null
                : new DesignTokenMappingSource(config.getTokenFile(), fileStat);
        return new MappingCache(local, remote, tokens, config.getLocalCheckInterval(), config.getRemoteTtl(), clock);
    }

    /**
     * The process-wide cache for {@code config}. Runs with an equal configuration share one
     * instance and with it the refresh timestamps and fetched documents.
     */
    public static MappingCache shared(ResolverConfig config) {
        return SHARED.computeIfAbsent(config, MappingCache::fromConfig);
    }

    /**
     * Returns the merged mappings, refreshing the sources that are due.
     */
    public MappingSet current() {
        Instant now = clock.instant();
        boolean changed = current == null;

        if (isDue(localCheckedAt, localCheckInterval, now)) {
            localCheckedAt = now;
            MappingDocument local = load(localSource);
            MappingDocument tokens = load(tokenSource);
            if (!unchanged(local, localDocument) || !unchanged(tokens, tokenDocument)) {
                localDocument = local;
                tokenDocument = tokens;
                changed = true;
            }
        }

        if (remoteSource != null && isDue(remoteFetchedAt, remoteTtl, now)) {
            remoteFetchedAt = now;
            remoteDocument = load(remoteSource);
            changed = true;
        }

        MappingSet set = current;
        if (changed || set == null) {
            set = MappingSet.of(localDocument, remoteDocument, tokenDocument);
            current = set;
            log.debug("Mappings updated: {} variables, {} text styles", set.variableCount(), set.getTextStyles().size());
        }
        return set;
    }

    /**
     * Forces every source to be consulted on the next {@link #current()} call.
     */
    public void invalidate() {
        localCheckedAt = null;
        remoteFetchedAt = null;
        current = null;
    }

    /**
     * Sources hand back the same document while their file is unchanged; empty documents
     * are always equivalent.
     */
    private static boolean unchanged(MappingDocument loaded, MappingDocument previous) {
        return loaded == previous || (loaded.isEmpty() && previous.isEmpty());
    }

    private static boolean isDue(Instant last, Duration interval, Instant now) {
        return last == null || Duration.between(last, now).compareTo(interval) > 0;
    }

    private static MappingDocument load(MappingSource source) {
        if (source == null) {
            return MappingDocument.empty();
        }
        try {
            return source.load();
        } catch (RuntimeException e) {
            log.warn("Mapping source {} unavailable: {}", source.describe(), e.getMessage());
            return MappingDocument.empty();
        }
    }
}
