package com.devgate.gateway.domain;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory {@link ConversationStore}. Each conversation's item list is guarded by
 * its own monitor.
 */
public class InMemoryConversationStore implements ConversationStore {

    private final Map<String, ConversationThread> threads = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryConversationStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Conversation create(Map<String, String> metadata) {
        String id = "conv_" + UUID.randomUUID().toString().replace("-", "");
        Conversation conversation = new Conversation(id, null, clock.instant().getEpochSecond(), metadata);
        threads.put(id, new ConversationThread(conversation));
        return conversation;
    }

    @Override
    public Optional<Conversation> get(String conversationId) {
        return Optional.ofNullable(threads.get(conversationId)).map(ConversationThread::conversation);
    }

    @Override
    public List<Conversation> listByMetadata(Map<String, String> filter) {
        Map<String, String> criteria = filter == null ? Map.of() : filter;
        return threads.values().stream()
                .map(ConversationThread::conversation)
                .filter(c -> c.metadata().entrySet().containsAll(criteria.entrySet()))
                .sorted((a, b) -> Long.compare(a.createdAt(), b.createdAt()))
                .toList();
    }

    @Override
    public Conversation updateMetadata(String conversationId, Map<String, String> metadata) {
        ConversationThread thread = require(conversationId);
        synchronized (thread) {
            thread.conversation = thread.conversation.withMetadata(metadata);
            return thread.conversation;
        }
    }

    @Override
    public void delete(String conversationId) {
        if (threads.remove(conversationId) == null) {
            throw notFound(conversationId);
        }
    }

    @Override
    public List<ConversationItem> addItems(String conversationId, List<Map<String, Object>> items) {
        ConversationThread thread = require(conversationId);
        long now = clock.instant().getEpochSecond();
        List<ConversationItem> added = new ArrayList<>();
        for (Map<String, Object> raw : items == null ? List.<Map<String, Object>>of() : items) {
            added.add(toItem(raw, now));
        }
        synchronized (thread) {
            thread.items.addAll(added);
        }
        return added;
    }

    @Override
    public ItemsPage listItems(String conversationId, int limit, String after, String order) {
        if (limit < 1) {
            throw new InvalidRequestException("limit must be at least 1");
        }
        if (!"asc".equals(order) && !"desc".equals(order)) {
            throw new InvalidRequestException("order must be 'asc' or 'desc'");
        }
        ConversationThread thread = require(conversationId);
        List<ConversationItem> ordered;
        synchronized (thread) {
            ordered = new ArrayList<>(thread.items);
        }
        if ("desc".equals(order)) {
            Collections.reverse(ordered);
        }
        int start = 0;
        if (after != null) {
            int index = indexOf(ordered, after);
            if (index < 0) {
                throw new EntityNotFoundException("Item not found: " + after);
            }
            start = index + 1;
        }
        int end = Math.min(ordered.size(), start + limit);
        return new ItemsPage(ordered.subList(start, end), end < ordered.size());
    }

    @Override
    public Optional<ConversationItem> getItem(String conversationId, String itemId) {
        ConversationThread thread = threads.get(conversationId);
        if (thread == null) {
            return Optional.empty();
        }
        synchronized (thread) {
            return thread.items.stream().filter(i -> i.id().equals(itemId)).findFirst();
        }
    }

    private ConversationThread require(String conversationId) {
        ConversationThread thread = threads.get(conversationId);
        if (thread == null) {
            throw notFound(conversationId);
        }
        return thread;
    }

    private static EntityNotFoundException notFound(String conversationId) {
        return new EntityNotFoundException("Conversation not found: " + conversationId);
    }

    private static int indexOf(List<ConversationItem> items, String itemId) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).id().equals(itemId)) {
                return i;
            }
        }
        return -1;
    }

    @SuppressWarnings("unchecked")
    private static ConversationItem toItem(Map<String, Object> raw, long createdAt) {
        Object role = raw.getOrDefault("role", "user");
        Object type = raw.getOrDefault("type", "message");
        Object content = raw.get("content");
        List<Map<String, Object>> parts = new ArrayList<>();
        if (content instanceof String text) {
            parts.add(textPart("user".equals(role) ? "input_text" : "output_text", text));
        } else if (content instanceof List<?> list) {
            for (Object part : list) {
                if (part instanceof Map<?, ?> map) {
                    parts.add(new LinkedHashMap<>((Map<String, Object>) map));
                } else if (part != null) {
                    parts.add(textPart("input_text", part.toString()));
                }
            }
        }
        String id = "item_" + UUID.randomUUID().toString().replace("-", "");
        return new ConversationItem(id, type.toString(), role.toString(), parts, null, createdAt);
    }

    private static Map<String, Object> textPart(String type, String text) {
        Map<String, Object> part = new LinkedHashMap<>();
        part.put("type", type);
        part.put("text", text);
        return part;
    }

    /** Mutable holder for one conversation and its items. */
    private static final class ConversationThread {
        private volatile Conversation conversation;
        private final List<ConversationItem> items = new ArrayList<>();

        ConversationThread(Conversation conversation) {
            this.conversation = conversation;
        }

        Conversation conversation() {
            return conversation;
        }
    }
}
