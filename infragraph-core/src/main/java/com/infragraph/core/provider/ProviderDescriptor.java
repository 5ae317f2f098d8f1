package com.infragraph.core.provider;

import com.infragraph.core.handler.HandlerSet;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Static description of a cloud provider.
 *
 * @param id provider id (e.g., "aws")
 * @param displayName human-readable name
 * @param resourcePrefixes resource type prefixes owned by the provider, e.g. {@code aws_}
 * @param sourceNames provider source names, the last segment of a provider field such as
 *                    {@code registry.terraform.io/hashicorp/aws}
 * @param rulesResource classpath resource holding the provider's rule tables
 * @param handlerSetFactory creates the provider's handler set on first use
 */
public record ProviderDescriptor(
    String id,
    String displayName,
    List<String> resourcePrefixes,
    List<String> sourceNames,
    String rulesResource,
    Supplier<HandlerSet> handlerSetFactory
) {
    /**
     * Compact constructor with validation.
     */
    public ProviderDescriptor {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(rulesResource, "rulesResource must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        displayName = displayName == null ? id : displayName;
        resourcePrefixes = resourcePrefixes == null ? List.of() : List.copyOf(resourcePrefixes);
        sourceNames = sourceNames == null ? List.of(id) : List.copyOf(sourceNames);
        handlerSetFactory = handlerSetFactory == null ? HandlerSet::empty : handlerSetFactory;
    }

    /**
     * Returns the longest owned prefix the resource type starts with.
     *
     * @param type resource type
     * @return matched prefix length, or -1 when the type is not owned
     */
    public int matchLength(String type) {
        int best = -1;
        for (String prefix : resourcePrefixes) {
            if (type.startsWith(prefix) && prefix.length() > best) {
                best = prefix.length();
            }
        }
        return best;
    }
}
