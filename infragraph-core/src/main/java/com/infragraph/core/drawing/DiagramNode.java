package com.infragraph.core.drawing;

import java.util.Objects;

/**
 * A leaf of the drawing.
 *
 * @param id resource id
 * @param label display label
 * @param resourceType resource type
 */
public record DiagramNode(
    String id,
    String label,
    String resourceType
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramNode {
        Objects.requireNonNull(id, "id must not be null");
        label = label == null ? id : label;
        resourceType = resourceType == null ? "" : resourceType;
    }
}
