package com.infragraph.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * A single resource declaration from the upstream inventory.
 *
 * @param type resource type (e.g., "aws_subnet")
 * @param name instance name (e.g., "private")
 * @param sourceFile file the resource was declared in
 * @param attributes raw declared attributes
 */
public record ResourceRecord(
    String type,
    String name,
    String sourceFile,
    Map<String, Object> attributes
) {
    /**
     * Compact constructor with validation.
     */
    public ResourceRecord {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (sourceFile == null) {
            sourceFile = "";
        }
        if (attributes == null) {
            attributes = Map.of();
        }
    }

    /**
     * Returns the graph identifier of this resource.
     *
     * @return {@code type.name}
     */
    public String id() {
        return type + "." + name;
    }
}
