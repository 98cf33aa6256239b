package com.devgate.gateway.api;

import com.devgate.gateway.domain.Conversation;
import com.devgate.gateway.domain.ConversationItem;
import com.devgate.gateway.domain.ConversationStore;
import com.devgate.gateway.domain.EntityNotFoundException;
import com.devgate.gateway.domain.ItemsPage;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * OpenAI-style conversations API.
 */
@RestController
@RequestMapping("/v1/conversations")
public class ConversationController {

    private final ConversationStore store;

    public ConversationController(ConversationStore store) {
        this.store = store;
    }

    @PostMapping
    public Conversation create(@RequestBody(required = false) ConversationBody body) {
        return store.create(body == null ? null : body.metadata());
    }

    @GetMapping
    public Map<String, Object> list(@RequestParam(name = "agent_id", required = false) String agentId) {
        Map<String, String> filter = agentId == null ? Map.of() : Map.of("agent_id", agentId);
        return page(store.listByMetadata(filter), false);
    }

    @GetMapping("/{conversationId}")
    public Conversation get(@PathVariable String conversationId) {
        return store.get(conversationId)
                .orElseThrow(() -> new EntityNotFoundException("Conversation not found"));
    }

    @PostMapping("/{conversationId}")
    public Conversation update(@PathVariable String conversationId, @RequestBody ConversationBody body) {
        return store.updateMetadata(conversationId, body.metadata() == null ? Map.of() : body.metadata());
    }

    @DeleteMapping("/{conversationId}")
    public Map<String, Object> delete(@PathVariable String conversationId) {
        store.delete(conversationId);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", conversationId);
        result.put("object", "conversation.deleted");
        result.put("deleted", true);
        return result;
    }

    @PostMapping("/{conversationId}/items")
    public Map<String, Object> addItems(@PathVariable String conversationId, @RequestBody ItemsBody body) {
        List<ConversationItem> added = store.addItems(conversationId, body.items());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("object", "list");
        result.put("data", added);
        return result;
    }

    @GetMapping("/{conversationId}/items")
    public Map<String, Object> listItems(
            @PathVariable String conversationId,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(required = false) String after,
            @RequestParam(defaultValue = "asc") String order) {
        ItemsPage items = store.listItems(conversationId, limit, after, order);
        return page(items.items(), items.hasMore());
    }

    @GetMapping("/{conversationId}/items/{itemId}")
    public ConversationItem getItem(@PathVariable String conversationId, @PathVariable String itemId) {
        return store.getItem(conversationId, itemId)
                .orElseThrow(() -> new EntityNotFoundException("Item not found"));
    }

    private static Map<String, Object> page(List<?> data, boolean hasMore) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("object", "list");
        result.put("data", data);
        result.put("has_more", hasMore);
        return result;
    }

    /** Body of create and update. */
    public record ConversationBody(Map<String, String> metadata) {}

    /** Body of item creation. */
    public record ItemsBody(List<Map<String, Object>> items) {}
}
