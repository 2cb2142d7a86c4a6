package com.ivamare.lifecycle.coordinator;

import com.ivamare.lifecycle.audit.LifecycleAuditAction;
import com.ivamare.lifecycle.audit.LifecycleAuditEvent;
import com.ivamare.lifecycle.audit.LifecycleAuditRecorder;
import com.ivamare.lifecycle.exception.DraftRequiredException;
import com.ivamare.lifecycle.exception.EntityNotFoundException;
import com.ivamare.lifecycle.exception.VersionConflictException;
import com.ivamare.lifecycle.exception.VersionNotFoundException;
import com.ivamare.lifecycle.version.CreateDraftRequest;
import com.ivamare.lifecycle.version.EntityFamily;
import com.ivamare.lifecycle.version.PublishDraftRequest;
import com.ivamare.lifecycle.version.RestoreVersionRequest;
import com.ivamare.lifecycle.version.VersionLedger;
import com.ivamare.lifecycle.version.VersionRecord;
import com.ivamare.lifecycle.workflow.TransitionInput;
import com.ivamare.lifecycle.workflow.TransitionQuery;
import com.ivamare.lifecycle.workflow.TransitionResult;
import com.ivamare.lifecycle.workflow.WorkflowDefinition;
import com.ivamare.lifecycle.workflow.WorkflowEngine;
import com.ivamare.lifecycle.workflow.WorkflowEvent;
import com.ivamare.lifecycle.workflow.WorkflowIdentifiers;
import com.ivamare.lifecycle.workflow.WorkflowNotification;
import com.ivamare.lifecycle.workflow.WorkflowStates;
import com.ivamare.lifecycle.workflow.WorkflowTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Drives the lifecycle of one entity family.
 *
 * <p>Each operation checks the workflow first, then changes the version ledger,
 * and only then writes the entity pointers back. A failure before the ledger
 * call leaves both the ledger and the entity untouched. Operations on the same
 * entity are serialized.
 *
 * <p>Events, notifications and metadata produced by transition actions are
 * carried into the audit details of the operation.
 */
public class PublishCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PublishCoordinator.class);

    private final EntityFamily family;
    private final VersionLedger ledger;
    private final EntityStore entityStore;
    private final WorkflowEngine workflowEngine;
    private final LifecycleAuditRecorder auditRecorder;
    private final Clock clock;
    private final CoordinatorSettings settings;
    private final String workflowEntityType;

    private final Map<UUID, EntityLock> entityLocks = new ConcurrentHashMap<>();

    /**
     * @param family Entity family, must match the ledger's family
     * @param ledger Version ledger of the family
     * @param entityStore Entity persistence
     * @param workflowEngine Workflow engine (nullable; workflow checks are then skipped)
     * @param auditRecorder Audit sink
     * @param clock Clock
     * @param settings Coordinator switches
     */
    public PublishCoordinator(EntityFamily family,
                              VersionLedger ledger,
                              EntityStore entityStore,
                              WorkflowEngine workflowEngine,
                              LifecycleAuditRecorder auditRecorder,
                              Clock clock,
                              CoordinatorSettings settings) {
        if (ledger.family() != family) {
            throw new IllegalArgumentException(
                "Ledger serves " + ledger.family().key() + ", not " + family.key());
        }
        this.family = family;
        this.ledger = ledger;
        this.entityStore = entityStore;
        this.workflowEngine = workflowEngine;
        this.auditRecorder = auditRecorder;
        this.clock = clock;
        this.settings = settings != null ? settings : CoordinatorSettings.defaults();
        this.workflowEntityType = WorkflowIdentifiers.isBlank(this.settings.workflowEntityType())
            ? family.key()
            : WorkflowIdentifiers.normalize(this.settings.workflowEntityType());
    }

    public EntityFamily family() {
        return family;
    }

    /**
     * Register an entity in the workflow's initial state. Returns the existing
     * entity if the ID is already registered.
     *
     * @param entityId Entity ID
     * @param createdBy Creating actor (nullable)
     * @return The registered entity
     */
    public LifecycleEntity registerEntity(UUID entityId, UUID createdBy) {
        requireEntityId(entityId);
        return withEntityLock(entityId, () -> {
            Optional<LifecycleEntity> existing = entityStore.findById(family, entityId);
            if (existing.isPresent()) {
                return existing.get();
            }
            LifecycleEntity entity = LifecycleEntity.create(
                entityId, family, initialState(), createdBy, clock.instant());
            entityStore.save(entity);
            log.debug("Registered {} {} in state {}", family.key(), entityId, entity.status());
            return entity;
        });
    }

    /**
     * Create a draft version.
     *
     * @param request Draft request
     * @return The new draft
     * @throws EntityNotFoundException if the entity is not registered
     * @throws VersionConflictException if the draft is based on a version other than the
     *         latest one and stale bases are rejected
     */
    public VersionRecord createDraft(CreateDraftRequest request) {
        requireEntityId(request.entityId());
        return withEntityLock(request.entityId(), () -> {
            LifecycleEntity entity = requireEntity(request.entityId());

            Integer base = request.baseVersion();
            if (base != null) {
                int latest = ledger.latestVersion(entity.id());
                if (base != latest) {
                    if (settings.rejectStaleBaseVersion()) {
                        throw new VersionConflictException(entity.id(), base, latest);
                    }
                    log.warn("Draft for {} {} is based on v{} but latest is v{}",
                        family.key(), entity.id(), base, latest);
                }
            }

            VersionRecord draft = ledger.createDraft(request);
            entityStore.save(entity
                .withCurrentVersion(draft.version())
                .touchedBy(request.createdBy(), draft.createdAt()));
            return draft;
        });
    }

    /**
     * Publish a draft version.
     *
     * <p>Publishing a version that is already published returns it unchanged, so a
     * scheduler may retry freely.
     *
     * @param request Publish request
     * @return The published version
     * @throws EntityNotFoundException if the entity is not registered
     * @throws VersionNotFoundException if the version does not exist
     * @throws DraftRequiredException if the version is not a draft
     */
    public VersionRecord publishDraft(PublishDraftRequest request) {
        requireEntityId(request.entityId());
        return withEntityLock(request.entityId(), () -> {
            LifecycleEntity entity = requireEntity(request.entityId());

            VersionRecord existing = ledger.findVersion(entity.id(), request.version())
                .orElseThrow(() -> new VersionNotFoundException(entity.id(), request.version()));
            if (existing.isPublished()) {
                log.debug("{} {} v{} is already published", family.key(), entity.id(), request.version());
                return existing;
            }
            if (!existing.isDraft()) {
                throw new DraftRequiredException(entity.id(), request.version(), existing.status());
            }

            WorkflowStep step = checkTransition(entity,
                TransitionInput.toState(entity.id(), workflowEntityType, entity.status(),
                        WorkflowStates.PUBLISHED, request.publishedBy())
                    .withMetadata(Map.of("version", request.version())),
                WorkflowStates.PUBLISHED);

            Integer previous = entity.publishedVersion();
            VersionRecord published = ledger.publishDraft(request);

            entityStore.save(entity
                .withStatus(step.status())
                .withPublished(published.version(), published.publishedAt(), published.publishedBy())
                .withCurrentVersion(Math.max(entity.currentVersion(), published.version()))
                .touchedBy(request.publishedBy(), published.publishedAt()));

            Map<String, Object> details = step.auditDetails();
            if (previous != null) {
                details.put("previousVersion", previous);
            }
            audit(entity.id(), published.version(), LifecycleAuditAction.PUBLISHED,
                request.publishedBy(), published.publishedAt(), details);
            return published;
        });
    }

    /**
     * Copy a historical version into a new draft. An archived entity is brought back
     * through the workflow's {@code restore} transition.
     *
     * @param request Restore request
     * @return The new draft
     * @throws EntityNotFoundException if the entity is not registered
     * @throws VersionNotFoundException if the source version does not exist
     */
    public VersionRecord restoreVersion(RestoreVersionRequest request) {
        requireEntityId(request.entityId());
        return withEntityLock(request.entityId(), () -> {
            LifecycleEntity entity = requireEntity(request.entityId());

            if (ledger.findVersion(entity.id(), request.version()).isEmpty()) {
                throw new VersionNotFoundException(entity.id(), request.version());
            }

            WorkflowStep step = WorkflowStep.unchanged(entity.status());
            if (WorkflowStates.ARCHIVED.equals(entity.status())) {
                step = checkTransition(entity,
                    TransitionInput.named(entity.id(), workflowEntityType, entity.status(), "restore",
                        request.restoredBy()),
                    WorkflowStates.DRAFT);
            }

            VersionRecord restored = ledger.restoreVersion(request);
            entityStore.save(entity
                .withStatus(step.status())
                .withCurrentVersion(restored.version())
                .touchedBy(request.restoredBy(), restored.createdAt()));

            Map<String, Object> details = step.auditDetails();
            details.put("restoredFrom", request.version());
            audit(entity.id(), restored.version(), LifecycleAuditAction.RESTORED,
                request.restoredBy(), restored.createdAt(), details);
            return restored;
        });
    }

    /**
     * Take the published version offline. No-op when nothing is published.
     *
     * @param entityId Entity ID
     * @param actorId Acting user (nullable)
     * @return The archived version, or empty if nothing was published
     * @throws EntityNotFoundException if the entity is not registered
     */
    public Optional<VersionRecord> unpublish(UUID entityId, UUID actorId) {
        requireEntityId(entityId);
        return withEntityLock(entityId, () -> {
            LifecycleEntity entity = requireEntity(entityId);
            if (ledger.findPublished(entityId).isEmpty()) {
                log.debug("{} {} has no published version", family.key(), entityId);
                return Optional.<VersionRecord>empty();
            }

            WorkflowStep step = checkTransition(entity,
                TransitionInput.named(entityId, workflowEntityType, entity.status(), "unpublish", actorId),
                WorkflowStates.DRAFT);

            Optional<VersionRecord> archived = ledger.archivePublished(entityId);
            Instant now = clock.instant();
            entityStore.save(entity
                .withStatus(step.status())
                .withoutPublished()
                .touchedBy(actorId, now));

            archived.ifPresent(record ->
                audit(entityId, record.version(), LifecycleAuditAction.UNPUBLISHED, actorId, now,
                    step.auditDetails()));
            return archived;
        });
    }

    /**
     * Archive the entity. Its published version, if any, is archived with it.
     * Archiving an archived entity returns it unchanged.
     *
     * @param entityId Entity ID
     * @param actorId Acting user (nullable)
     * @return The updated entity
     * @throws EntityNotFoundException if the entity is not registered
     */
    public LifecycleEntity archive(UUID entityId, UUID actorId) {
        requireEntityId(entityId);
        return withEntityLock(entityId, () -> {
            LifecycleEntity entity = requireEntity(entityId);
            if (WorkflowStates.ARCHIVED.equals(entity.status())) {
                return entity;
            }

            WorkflowStep step = checkTransition(entity,
                TransitionInput.named(entityId, workflowEntityType, entity.status(), "archive", actorId),
                WorkflowStates.ARCHIVED);

            Optional<VersionRecord> archived = ledger.archivePublished(entityId);
            Instant now = clock.instant();
            LifecycleEntity updated = entity
                .withStatus(step.status())
                .withoutPublished()
                .touchedBy(actorId, now);
            entityStore.save(updated);

            int version = archived.map(VersionRecord::version).orElse(entity.currentVersion());
            Map<String, Object> details = step.auditDetails();
            details.put("fromStatus", entity.status());
            audit(entityId, version, LifecycleAuditAction.ARCHIVED, actorId, now, details);
            return updated;
        });
    }

    /**
     * Versions of an entity, ascending.
     *
     * @throws EntityNotFoundException if the entity is not registered
     */
    public List<VersionRecord> listVersions(UUID entityId) {
        requireEntityId(entityId);
        requireEntity(entityId);
        return ledger.listVersions(entityId);
    }

    public Optional<LifecycleEntity> findEntity(UUID entityId) {
        return entityStore.findById(family, entityId);
    }

    public List<LifecycleEntity> listEntities() {
        return entityStore.findAll(family);
    }

    /**
     * Transitions the workflow offers from the entity's current state.
     */
    public List<WorkflowTransition> availableTransitions(UUID entityId) {
        LifecycleEntity entity = requireEntity(entityId);
        if (workflowEngine == null) {
            return List.of();
        }
        return workflowEngine.availableTransitions(TransitionQuery.of(workflowEntityType, entity.status()));
    }

    /**
     * Run the workflow check and return the entity's next status with the
     * output of any transition action.
     */
    private WorkflowStep checkTransition(LifecycleEntity entity, TransitionInput input, String fallbackState) {
        if (!settings.workflowCheck() || workflowEngine == null) {
            return WorkflowStep.unchanged(fallbackState);
        }
        TransitionResult result = workflowEngine.transition(input);
        if (!result.isNoOp()) {
            log.debug("{} {} {} -> {} via {}", family.key(), entity.id(),
                result.fromState(), result.toState(), result.transitionName());
        }
        return new WorkflowStep(result.toState(), result);
    }

    private String initialState() {
        if (workflowEngine == null) {
            return WorkflowStates.DRAFT;
        }
        return workflowEngine.findDefinition(workflowEntityType)
            .map(WorkflowDefinition::initialState)
            .orElse(WorkflowStates.DRAFT);
    }

    private void audit(UUID entityId, int version, LifecycleAuditAction action, UUID actorId,
                       Instant at, Map<String, Object> details) {
        try {
            auditRecorder.record(new LifecycleAuditEvent(
                family, entityId, version, action, actorId, at != null ? at : clock.instant(), details));
        } catch (RuntimeException e) {
            log.warn("Failed to record {} audit for {} {} v{}: {}",
                action, family.key(), entityId, version, e.getMessage(), e);
        }
    }

    private LifecycleEntity requireEntity(UUID entityId) {
        return entityStore.findById(family, entityId)
            .orElseThrow(() -> new EntityNotFoundException(family.key(), entityId));
    }

    private <T> T withEntityLock(UUID entityId, Supplier<T> operation) {
        EntityLock entityLock = entityLocks.compute(entityId, (id, current) -> {
            EntityLock held = current != null ? current : new EntityLock();
            held.users++;
            return held;
        });
        entityLock.lock.lock();
        try {
            return operation.get();
        } finally {
            entityLock.lock.unlock();
            entityLocks.computeIfPresent(entityId, (id, current) -> --current.users == 0 ? null : current);
        }
    }

    /**
     * Number of entities with an operation in progress or waiting.
     */
    int activeEntityLocks() {
        return entityLocks.size();
    }

    private static void requireEntityId(UUID entityId) {
        if (entityId == null) {
            throw new IllegalArgumentException("Entity id is required");
        }
    }

    /**
     * Lock of one entity. {@code users} counts holders and waiters and is only
     * touched inside the map's compute functions.
     */
    private static final class EntityLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    /**
     * Next status of an entity and the transition that produced it (null when
     * no workflow ran).
     */
    private record WorkflowStep(String status, TransitionResult result) {

        static WorkflowStep unchanged(String status) {
            return new WorkflowStep(status, null);
        }

        /**
         * Mutable audit details holding the action output, if any.
         */
        Map<String, Object> auditDetails() {
            Map<String, Object> details = new HashMap<>();
            if (result == null) {
                return details;
            }
            if (!result.events().isEmpty()) {
                details.put("events", result.events().stream().map(WorkflowStep::eventDetails).toList());
            }
            if (!result.notifications().isEmpty()) {
                details.put("notifications",
                    result.notifications().stream().map(WorkflowStep::notificationDetails).toList());
            }
            if (!result.metadata().isEmpty()) {
                details.put("transitionMetadata", result.metadata());
            }
            return details;
        }

        private static Map<String, Object> eventDetails(WorkflowEvent event) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("name", event.name());
            details.put("timestamp", event.timestamp() != null ? event.timestamp().toString() : null);
            details.put("payload", event.payload());
            return details;
        }

        private static Map<String, Object> notificationDetails(WorkflowNotification notification) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("channel", notification.channel());
            details.put("message", notification.message());
            details.put("data", notification.data());
            return details;
        }
    }
}
