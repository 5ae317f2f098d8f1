package com.infragraph.core.drawing;

import java.util.Objects;

/**
 * A connection of the drawing.
 *
 * @param origin origin id
 * @param destination destination id
 * @param style line style
 * @param label edge label, empty for none
 */
public record DiagramEdge(
    String origin,
    String destination,
    EdgeStyle style,
    String label
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramEdge {
        Objects.requireNonNull(origin, "origin must not be null");
        Objects.requireNonNull(destination, "destination must not be null");
        style = style == null ? EdgeStyle.SOLID : style;
        label = label == null ? "" : label;
    }
}
