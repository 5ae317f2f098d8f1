package com.infragraph.core.drawing;

import java.util.List;
import java.util.Objects;

/**
 * A container of the drawing.
 *
 * @param id resource id
 * @param label display label
 * @param resourceType resource type
 * @param members ids of the nodes and containers placed inside, in placement order
 */
public record DiagramGroup(
    String id,
    String label,
    String resourceType,
    List<String> members
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramGroup {
        Objects.requireNonNull(id, "id must not be null");
        label = label == null ? id : label;
        resourceType = resourceType == null ? "" : resourceType;
        members = members == null ? List.of() : List.copyOf(members);
    }
}
