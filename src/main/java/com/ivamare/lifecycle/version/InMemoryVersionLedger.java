package com.ivamare.lifecycle.version;

import com.ivamare.lifecycle.exception.DraftRequiredException;
import com.ivamare.lifecycle.exception.RetentionExceededException;
import com.ivamare.lifecycle.exception.VersionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory version ledger.
 *
 * <p>Every read-modify-write runs under the write lock, so finding the current
 * published version and flipping statuses is atomic with respect to other
 * writers. Reads take the read lock. Snapshots are deep-copied on the way in
 * and on the way out.
 */
public class InMemoryVersionLedger implements VersionLedger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVersionLedger.class);

    private final LedgerSettings settings;
    private final SnapshotCodec snapshots;
    private final Clock clock;

    private final Map<UUID, History> histories = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public InMemoryVersionLedger(LedgerSettings settings, SnapshotCodec snapshots, Clock clock) {
        this.settings = settings;
        this.snapshots = snapshots;
        this.clock = clock;
    }

    @Override
    public EntityFamily family() {
        return settings.family();
    }

    @Override
    public LedgerSettings settings() {
        return settings;
    }

    @Override
    public VersionRecord createDraft(CreateDraftRequest request) {
        requireEntityId(request.entityId());
        Map<String, Object> snapshot = snapshots.copy(request.snapshot());

        lock.writeLock().lock();
        try {
            return detach(appendDraft(request.entityId(), snapshot, request.createdBy(), request.baseVersion()));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public VersionRecord publishDraft(PublishDraftRequest request) {
        requireEntityId(request.entityId());
        requireVersion(request.version());

        lock.writeLock().lock();
        try {
            History history = histories.get(request.entityId());
            VersionRecord target = history != null ? history.versions.get(request.version()) : null;
            if (target == null) {
                throw new VersionNotFoundException(request.entityId(), request.version());
            }
            if (!target.isDraft()) {
                throw new DraftRequiredException(request.entityId(), request.version(), target.status());
            }

            for (VersionRecord candidate : history.versions.values()) {
                if (candidate.isPublished()) {
                    history.versions.put(candidate.version(), candidate.archived());
                    log.debug("Archived {} {} v{}", family().key(), request.entityId(), candidate.version());
                }
            }

            Instant publishedAt = request.publishedAt() != null ? request.publishedAt() : clock.instant();
            VersionRecord published = target.published(request.publishedBy(), publishedAt);
            history.versions.put(published.version(), published);
            log.info("Published {} {} v{} (publishedBy={})",
                family().key(), request.entityId(), published.version(), request.publishedBy());
            return detach(published);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<VersionRecord> listVersions(UUID entityId) {
        requireEntityId(entityId);
        lock.readLock().lock();
        try {
            History history = histories.get(entityId);
            if (history == null) {
                return List.of();
            }
            List<VersionRecord> result = new ArrayList<>(history.versions.size());
            for (VersionRecord record : history.versions.values()) {
                result.add(detach(record));
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public VersionRecord restoreVersion(RestoreVersionRequest request) {
        requireEntityId(request.entityId());
        requireVersion(request.version());

        lock.writeLock().lock();
        try {
            History history = histories.get(request.entityId());
            VersionRecord source = history != null ? history.versions.get(request.version()) : null;
            if (source == null) {
                throw new VersionNotFoundException(request.entityId(), request.version());
            }
            Map<String, Object> snapshot = snapshots.copy(source.snapshot());
            VersionRecord restored = appendDraft(request.entityId(), snapshot, request.restoredBy(), source.version());
            log.info("Restored {} {} v{} as draft v{} (restoredBy={})",
                family().key(), request.entityId(), source.version(), restored.version(), request.restoredBy());
            return detach(restored);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<VersionRecord> archivePublished(UUID entityId) {
        requireEntityId(entityId);
        lock.writeLock().lock();
        try {
            History history = histories.get(entityId);
            if (history == null) {
                return Optional.empty();
            }
            for (VersionRecord candidate : history.versions.values()) {
                if (candidate.isPublished()) {
                    VersionRecord archived = candidate.archived();
                    history.versions.put(archived.version(), archived);
                    log.info("Archived published {} {} v{}", family().key(), entityId, archived.version());
                    return Optional.of(detach(archived));
                }
            }
            return Optional.empty();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<VersionRecord> findVersion(UUID entityId, int version) {
        requireEntityId(entityId);
        lock.readLock().lock();
        try {
            History history = histories.get(entityId);
            if (history == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(history.versions.get(version)).map(this::detach);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public VersionRecord getVersion(UUID entityId, int version) {
        return findVersion(entityId, version)
            .orElseThrow(() -> new VersionNotFoundException(entityId, version));
    }

    @Override
    public Optional<VersionRecord> findPublished(UUID entityId) {
        requireEntityId(entityId);
        lock.readLock().lock();
        try {
            History history = histories.get(entityId);
            if (history == null) {
                return Optional.empty();
            }
            return history.versions.values().stream()
                .filter(VersionRecord::isPublished)
                .findFirst()
                .map(this::detach);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int latestVersion(UUID entityId) {
        requireEntityId(entityId);
        lock.readLock().lock();
        try {
            History history = histories.get(entityId);
            return history != null ? history.lastAllocated : 0;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Caller must hold the write lock.
     */
    private VersionRecord appendDraft(UUID entityId, Map<String, Object> snapshot, UUID createdBy, Integer baseVersion) {
        History history = histories.computeIfAbsent(entityId, id -> new History());
        makeRoom(entityId, history);

        int next = history.lastAllocated + 1;
        VersionRecord draft = VersionRecord.draft(entityId, next, snapshot, createdBy, baseVersion, clock.instant());
        history.versions.put(next, draft);
        history.lastAllocated = next;
        log.debug("Created {} {} draft v{} (baseVersion={})", family().key(), entityId, next, baseVersion);
        return draft;
    }

    /**
     * Enforce the retention limit before a new version is added. Caller must hold the write lock.
     */
    private void makeRoom(UUID entityId, History history) {
        if (!settings.isBounded()) {
            return;
        }
        int limit = settings.retentionLimit();
        while (history.versions.size() >= limit) {
            if (settings.retentionPolicy() == RetentionPolicy.REJECT) {
                throw new RetentionExceededException(entityId, limit);
            }
            int latest = history.versions.lastKey();
            Integer victim = null;
            for (VersionRecord candidate : history.versions.values()) {
                if (!candidate.isPublished() && candidate.version() != latest) {
                    victim = candidate.version();
                    break;
                }
            }
            if (victim == null) {
                throw new RetentionExceededException(entityId, limit);
            }
            history.versions.remove(victim);
            log.info("Evicted {} {} v{} (retention limit {})", family().key(), entityId, victim, limit);
        }
    }

    private VersionRecord detach(VersionRecord record) {
        return record.withSnapshot(snapshots.copy(record.snapshot()));
    }

    private static void requireEntityId(UUID entityId) {
        if (entityId == null) {
            throw new IllegalArgumentException("Entity id is required");
        }
    }

    private static void requireVersion(int version) {
        if (version <= 0) {
            throw new IllegalArgumentException("Version must be positive: " + version);
        }
    }

    /**
     * Versions of one entity keyed by number, plus the allocation watermark
     * (which survives eviction so numbers are never reused).
     */
    private static final class History {
        private final TreeMap<Integer, VersionRecord> versions = new TreeMap<>();
        private int lastAllocated;
    }
}
