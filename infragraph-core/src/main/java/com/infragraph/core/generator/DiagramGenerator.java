package com.infragraph.core.generator;

import com.infragraph.core.drawing.DiagramStructure;

/**
 * Turns a drawn {@link DiagramStructure} into a text diagram format.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI). Register
 * implementations in
 * {@code META-INF/services/com.infragraph.core.generator.DiagramGenerator}.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class DotGenerator implements DiagramGenerator {
 *     @Override
 *     public String getId() {
 *         return "dot";
 *     }
 *
 *     @Override
 *     public GeneratedDiagram generate(DiagramStructure structure, GeneratorConfig config) {
 *         StringBuilder sb = new StringBuilder("digraph {\n");
 *         structure.edges().forEach(e -> sb.append(...));
 *         return new GeneratedDiagram(config.title(), sb.append("}\n").toString(), "dot");
 *     }
 * }
 * }</pre>
 *
 * @see GeneratorConfig
 * @see GeneratedDiagram
 */
public interface DiagramGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used in {@code output.formats} and on the command line. Should be lowercase
     * (e.g., "mermaid", "json").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated diagrams, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Generates a diagram from the drawing.
     *
     * <p>An empty structure still yields a valid document.
     *
     * @param structure the drawn groups, nodes and edges
     * @param config configuration settings for generation
     * @return generated diagram content
     */
    GeneratedDiagram generate(DiagramStructure structure, GeneratorConfig config);
}
