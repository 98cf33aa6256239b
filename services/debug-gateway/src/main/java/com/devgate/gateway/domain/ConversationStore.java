package com.devgate.gateway.domain;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage for conversations and their items.
 *
 * <p>Operations on an unknown conversation throw {@link EntityNotFoundException}, except
 * lookups that return {@link Optional}.
 */
public interface ConversationStore {

    int DEFAULT_PAGE_SIZE = 100;

    Conversation create(Map<String, String> metadata);

    Optional<Conversation> get(String conversationId);

    /**
     * Lists conversations whose metadata contains every given entry; an empty filter lists all.
     */
    List<Conversation> listByMetadata(Map<String, String> filter);

    Conversation updateMetadata(String conversationId, Map<String, String> metadata);

    void delete(String conversationId);

    /**
     * Appends items in order. Each raw item carries {@code role}, {@code content} (string or
     * list of parts) and optionally {@code type}.
     */
    List<ConversationItem> addItems(String conversationId, List<Map<String, Object>> items);

    /**
     * @param limit page size, at least 1
     * @param after id of the item to start after, or null
     * @param order {@code asc} or {@code desc}
     */
    ItemsPage listItems(String conversationId, int limit, String after, String order);

    Optional<ConversationItem> getItem(String conversationId, String itemId);
}
