package com.devgate.gateway.domain;

import java.util.List;
import java.util.Optional;

/**
 * Registry of executable entities.
 */
public interface EntityCatalog {

    List<EntityInfo> list();

    Optional<EntityInfo> get(String entityId);

    /**
     * Registers an entity, replacing any entity with the same id.
     */
    EntityInfo register(EntityInfo entity);

    /**
     * @return true if an entity was removed
     */
    boolean remove(String entityId);

    default int count() {
        return list().size();
    }
}
