package com.devgate.gateway.api;

import com.devgate.gateway.domain.EntityCatalog;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness for load balancers and the front end; declared anonymous in the route table.
 */
@RestController
public class HealthController {

    static final String FRAMEWORK = "devgate";

    private final EntityCatalog catalog;

    public HealthController(EntityCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("entities_count", catalog.count());
        body.put("framework", FRAMEWORK);
        return body;
    }
}
