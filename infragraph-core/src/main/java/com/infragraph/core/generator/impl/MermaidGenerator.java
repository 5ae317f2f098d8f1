package com.infragraph.core.generator.impl;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.infragraph.core.drawing.DiagramEdge;
import com.infragraph.core.drawing.DiagramGroup;
import com.infragraph.core.drawing.DiagramNode;
import com.infragraph.core.drawing.DiagramStructure;
import com.infragraph.core.drawing.EdgeStyle;
import com.infragraph.core.generator.DiagramGenerator;
import com.infragraph.core.generator.GeneratedDiagram;
import com.infragraph.core.generator.GeneratorConfig;

/**
 * Generates a Mermaid flowchart embedded in Markdown.
 *
 * <p>Groups become nested {@code subgraph} blocks, nodes become labelled boxes and
 * edges become arrows. Invisible edges are emitted as {@code ~~~} links, which Mermaid
 * uses for layout without drawing a line.
 *
 * <p>Resource ids contain characters Mermaid does not accept in identifiers, so every
 * element gets a sanitized alias that stays unique within the document.
 *
 * @see <a href="https://mermaid.js.org/syntax/flowchart.html">Mermaid Flowchart Syntax</a>
 */
public class MermaidGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Diagram Generator";
    private static final String FILE_EXTENSION = "md";

    // Markdown formatting
    private static final String MARKDOWN_HEADER_PREFIX = "# ";
    private static final String MARKDOWN_NEWLINE = "\n";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";

    // Flowchart syntax
    private static final String FLOWCHART = "flowchart ";
    private static final String SOLID_ARROW = " --> ";
    private static final String INVISIBLE_LINK = " ~~~ ";
    private static final String INDENT = "  ";

    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";
    private static final String EMPTY_NODE = "  empty[No resources found]\n";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public GeneratedDiagram generate(DiagramStructure structure, GeneratorConfig config) {
        Objects.requireNonNull(structure, "structure must not be null");
        Objects.requireNonNull(config, "config must not be null");

        StringBuilder sb = new StringBuilder();
        sb.append(MARKDOWN_HEADER_PREFIX).append(config.title()).append(MARKDOWN_NEWLINE).append(MARKDOWN_NEWLINE);
        sb.append(CODE_BLOCK_START);
        sb.append(FLOWCHART).append(config.direction()).append(MARKDOWN_NEWLINE);

        if (structure.isEmpty()) {
            sb.append(EMPTY_NODE);
        } else {
            Aliases aliases = new Aliases();
            Set<String> written = new HashSet<>();
            for (String root : structure.rootIds()) {
                appendElement(sb, structure, root, aliases, written, 1);
            }
            for (DiagramEdge edge : structure.edges()) {
                appendEdge(sb, edge, aliases, config.showEdgeLabels());
            }
        }

        sb.append(CODE_BLOCK_END);
        log.debug("Generated Mermaid flowchart with {} groups, {} nodes and {} edges",
            structure.groups().size(), structure.nodes().size(), structure.edges().size());
        return new GeneratedDiagram(config.title(), sb.toString(), FILE_EXTENSION);
    }

    private void appendElement(StringBuilder sb, DiagramStructure structure, String id,
                               Aliases aliases, Set<String> written, int depth) {
        if (!written.add(id)) {
            return;
        }
        String indent = INDENT.repeat(depth);
        var group = structure.findGroup(id);
        if (group.isPresent()) {
            DiagramGroup g = group.get();
            sb.append(indent).append("subgraph ").append(aliases.of(id))
                .append("[\"").append(escape(g.label())).append("\"]").append(MARKDOWN_NEWLINE);
            for (String member : g.members()) {
                appendElement(sb, structure, member, aliases, written, depth + 1);
            }
            sb.append(indent).append("end").append(MARKDOWN_NEWLINE);
            return;
        }
        String label = structure.findNode(id).map(DiagramNode::label).orElse(id);
        sb.append(indent).append(aliases.of(id))
            .append("[\"").append(escape(label)).append("\"]").append(MARKDOWN_NEWLINE);
    }

    private void appendEdge(StringBuilder sb, DiagramEdge edge, Aliases aliases, boolean showLabels) {
        sb.append(INDENT).append(aliases.of(edge.origin()));
        if (edge.style() == EdgeStyle.INVISIBLE) {
            sb.append(INVISIBLE_LINK);
        } else if (showLabels && !edge.label().isEmpty()) {
            sb.append(" -->|\"").append(escape(edge.label())).append("\"| ");
        } else {
            sb.append(SOLID_ARROW);
        }
        sb.append(aliases.of(edge.destination())).append(MARKDOWN_NEWLINE);
    }

    /**
     * Escapes characters that break quoted Mermaid labels.
     *
     * @param text label text
     * @return escaped text
     */
    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "#quot;").replace("\n", " ");
    }

    /**
     * Maps resource ids to unique Mermaid identifiers.
     */
    static final class Aliases {
        private final Map<String, String> byId = new HashMap<>();
        private final Set<String> used = new HashSet<>();

        String of(String id) {
            return byId.computeIfAbsent(id, key -> {
                String base = key.replaceAll(ID_SANITIZATION_PATTERN, "_");
                String alias = base;
                int suffix = 2;
                while (!used.add(alias)) {
                    alias = base + "_" + suffix++;
                }
                return alias;
            });
        }
    }
}
