package com.infragraph.core.drawing;

/**
 * How a connection is drawn.
 */
public enum EdgeStyle {
    /** Visible line. */
    SOLID,
    /** Present for layout ranking only. */
    INVISIBLE
}
