package com.infragraph.core.generator.impl;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.infragraph.core.drawing.DiagramStructure;
import com.infragraph.core.generator.DiagramGenerator;
import com.infragraph.core.generator.GeneratedDiagram;
import com.infragraph.core.generator.GeneratorConfig;

/**
 * Writes the drawing structure as pretty-printed JSON.
 *
 * <p>The document carries the title, the root ids and the groups, nodes and edges in
 * creation order, so external renderers can lay the diagram out themselves.
 */
public class JsonStructureGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(JsonStructureGenerator.class);

    private static final String GENERATOR_ID = "json";
    private static final String GENERATOR_DISPLAY_NAME = "JSON Structure Generator";
    private static final String FILE_EXTENSION = "json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

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

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("title", config.title());
        document.put("roots", structure.rootIds());
        document.put("groups", structure.groups());
        document.put("nodes", structure.nodes());
        document.put("edges", structure.edges());

        try {
            String content = MAPPER.writeValueAsString(document);
            log.debug("Serialized {} groups, {} nodes and {} edges",
                structure.groups().size(), structure.nodes().size(), structure.edges().size());
            return new GeneratedDiagram(config.title(), content, FILE_EXTENSION);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize diagram structure: " + e.getOriginalMessage(), e);
        }
    }
}
