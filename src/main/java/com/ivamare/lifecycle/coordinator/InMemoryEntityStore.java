package com.ivamare.lifecycle.coordinator;

import com.ivamare.lifecycle.version.EntityFamily;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * EntityStore backed by a concurrent map per family.
 */
public class InMemoryEntityStore implements EntityStore {

    private final Map<EntityFamily, Map<UUID, LifecycleEntity>> entities = new ConcurrentHashMap<>();

    @Override
    public Optional<LifecycleEntity> findById(EntityFamily family, UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(familyMap(family).get(id));
    }

    @Override
    public void save(LifecycleEntity entity) {
        if (entity == null || entity.id() == null || entity.family() == null) {
            throw new IllegalArgumentException("Entity id and family are required");
        }
        familyMap(entity.family()).put(entity.id(), entity);
    }

    @Override
    public List<LifecycleEntity> findAll(EntityFamily family) {
        return familyMap(family).values().stream()
            .sorted(Comparator.comparing(LifecycleEntity::id))
            .toList();
    }

    private Map<UUID, LifecycleEntity> familyMap(EntityFamily family) {
        return entities.computeIfAbsent(family, f -> new ConcurrentHashMap<>());
    }
}
