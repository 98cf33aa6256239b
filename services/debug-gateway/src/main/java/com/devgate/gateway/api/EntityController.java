package com.devgate.gateway.api;

import com.devgate.gateway.domain.EntityCatalog;
import com.devgate.gateway.domain.EntityInfo;
import com.devgate.gateway.domain.EntityNotFoundException;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Entity discovery and registration.
 */
@RestController
@RequestMapping("/v1/entities")
public class EntityController {

    private static final Logger log = LoggerFactory.getLogger(EntityController.class);

    private final EntityCatalog catalog;

    public EntityController(EntityCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping
    public Map<String, Object> list() {
        return Map.of("entities", catalog.list());
    }

    @GetMapping("/{entityId}/info")
    public EntityInfo info(@PathVariable String entityId) {
        return catalog.get(entityId)
                .orElseThrow(() -> new EntityNotFoundException("Entity " + entityId + " not found"));
    }

    @PostMapping({"", "/add"})
    public Map<String, Object> register(@Valid @RequestBody EntityRegistration registration) {
        EntityInfo entity = catalog.register(new EntityInfo(
                registration.id(),
                registration.type(),
                registration.name(),
                registration.description(),
                null,
                registration.tools(),
                "registered",
                registration.metadata()));
        log.info("Successfully added entity: {}", entity.id());
        return Map.of("success", true, "entity", entity);
    }

    @DeleteMapping("/{entityId}")
    public Map<String, Object> remove(@PathVariable String entityId) {
        if (!catalog.remove(entityId)) {
            throw new EntityNotFoundException("Entity not found or cannot be removed");
        }
        return Map.of("success", true);
    }

    /** Body of an entity registration. */
    public record EntityRegistration(
            @JsonProperty("id") @NotBlank String id,
            @JsonProperty("type") String type,
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("tools") List<String> tools,
            @JsonProperty("metadata") Map<String, Object> metadata) {}
}
