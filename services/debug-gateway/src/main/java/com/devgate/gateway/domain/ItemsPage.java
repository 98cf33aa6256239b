package com.devgate.gateway.domain;

import java.util.List;

/**
 * A page of conversation items and whether more follow.
 */
public record ItemsPage(List<ConversationItem> items, boolean hasMore) {

    public ItemsPage {
        items = List.copyOf(items);
    }
}
