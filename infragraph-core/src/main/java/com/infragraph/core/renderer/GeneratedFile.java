package com.infragraph.core.renderer;

import java.util.Objects;

import com.infragraph.core.generator.GeneratedDiagram;

/**
 * A file produced by a run, ready to be rendered.
 *
 * @param relativePath path relative to the output directory (e.g., "architecture.md")
 * @param content file content
 * @param contentType media type of the content
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }

    /**
     * Wraps a generated diagram, deriving the media type from its extension.
     *
     * @param diagram generated diagram
     * @return file named after the diagram
     */
    public static GeneratedFile of(GeneratedDiagram diagram) {
        return new GeneratedFile(diagram.fileName(), diagram.content(), contentTypeFor(diagram.fileExtension()));
    }

    static String contentTypeFor(String extension) {
        return switch (extension) {
            case "md" -> "text/markdown";
            case "json" -> "application/json";
            default -> "text/plain";
        };
    }
}
