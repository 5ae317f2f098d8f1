package com.infragraph.core.handler;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Handlers contributed by one provider, keyed by handler id.
 *
 * <pre>{@code
 * HandlerSet handlers = HandlerSet.of(new SharedServicesHandler(), new RandomStringHandler());
 * handlers.get("random-string").ifPresent(h -> h.apply(graph, rules));
 * }</pre>
 */
public final class HandlerSet {

    private static final HandlerSet EMPTY = new HandlerSet(List.of());

    private final Map<String, ResourceHandler> handlers;

    private HandlerSet(Collection<ResourceHandler> handlers) {
        Map<String, ResourceHandler> byId = new LinkedHashMap<>();
        for (ResourceHandler handler : handlers) {
            if (byId.putIfAbsent(handler.getId(), handler) != null) {
                throw new IllegalArgumentException("Duplicate handler id: " + handler.getId());
            }
        }
        this.handlers = Collections.unmodifiableMap(byId);
    }

    public static HandlerSet of(ResourceHandler... handlers) {
        return new HandlerSet(List.of(handlers));
    }

    public static HandlerSet of(Collection<ResourceHandler> handlers) {
        return new HandlerSet(handlers);
    }

    public static HandlerSet empty() {
        return EMPTY;
    }

    public Optional<ResourceHandler> get(String id) {
        return Optional.ofNullable(handlers.get(id));
    }

    public Set<String> ids() {
        return handlers.keySet();
    }

    public int size() {
        return handlers.size();
    }
}
