package com.ivamare.lifecycle.coordinator;

import com.ivamare.lifecycle.version.EntityFamily;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port for lifecycle entities.
 */
public interface EntityStore {

    Optional<LifecycleEntity> findById(EntityFamily family, UUID id);

    /**
     * Insert or replace an entity.
     */
    void save(LifecycleEntity entity);

    /**
     * All entities of a family, ordered by ID.
     */
    List<LifecycleEntity> findAll(EntityFamily family);
}
