package com.devgate.gateway.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe in-memory {@link EntityCatalog}, listing entities in registration order.
 */
public class InMemoryEntityCatalog implements EntityCatalog {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEntityCatalog.class);

    private final Map<String, Registered> entities = new ConcurrentHashMap<>();
    private long nextOrdinal;

    public InMemoryEntityCatalog(List<EntityInfo> initial) {
        initial.forEach(this::register);
    }

    @Override
    public List<EntityInfo> list() {
        List<Registered> snapshot = new ArrayList<>(entities.values());
        snapshot.sort((a, b) -> Long.compare(a.ordinal(), b.ordinal()));
        return snapshot.stream().map(Registered::info).toList();
    }

    @Override
    public Optional<EntityInfo> get(String entityId) {
        if (entityId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entities.get(entityId)).map(Registered::info);
    }

    @Override
    public synchronized EntityInfo register(EntityInfo entity) {
        Registered previous = entities.get(entity.id());
        long ordinal = previous != null ? previous.ordinal() : nextOrdinal++;
        entities.put(entity.id(), new Registered(entity, ordinal));
        log.info("Registered {} '{}' ({})", entity.type(), entity.id(), entity.source());
        return entity;
    }

    @Override
    public boolean remove(String entityId) {
        boolean removed = entityId != null && entities.remove(entityId) != null;
        if (removed) {
            log.info("Removed entity '{}'", entityId);
        }
        return removed;
    }

    private record Registered(EntityInfo info, long ordinal) {}
}
