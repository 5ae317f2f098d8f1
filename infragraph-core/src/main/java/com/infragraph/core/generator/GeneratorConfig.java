package com.infragraph.core.generator;

/**
 * Configuration for diagram generation.
 *
 * @param title diagram title and output base name
 * @param direction layout direction hint ("TB", "LR", ...)
 * @param showEdgeLabels whether edge labels are emitted
 */
public record GeneratorConfig(
    String title,
    String direction,
    boolean showEdgeLabels
) {
    public static final String DEFAULT_TITLE = "architecture";
    public static final String DEFAULT_DIRECTION = "TB";

    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        if (title == null || title.isBlank()) {
            title = DEFAULT_TITLE;
        }
        if (direction == null || direction.isBlank()) {
            direction = DEFAULT_DIRECTION;
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(DEFAULT_TITLE, DEFAULT_DIRECTION, true);
    }

    /**
     * Returns a copy with a different title.
     *
     * @param newTitle title to use
     * @return new config
     */
    public GeneratorConfig withTitle(String newTitle) {
        return new GeneratorConfig(newTitle, direction, showEdgeLabels);
    }
}
