package com.infragraph.core.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.infragraph.core.exception.GraphDocumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link GraphDocument} JSON.
 */
public final class GraphDocumentCodec {

    private static final Logger log = LoggerFactory.getLogger(GraphDocumentCodec.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private GraphDocumentCodec() {
        // utility
    }

    /**
     * Reads a document from disk.
     *
     * @param path JSON file
     * @return parsed document
     * @throws GraphDocumentException if the file is missing or not a valid document
     */
    public static GraphDocument read(Path path) {
        if (!Files.exists(path)) {
            throw new GraphDocumentException("Graph document not found", path.toString(), null);
        }
        try {
            GraphDocument document = JSON_MAPPER.readValue(path.toFile(), GraphDocument.class);
            if (document == null) {
                throw new GraphDocumentException("Graph document is empty", path.toString(), null);
            }
            log.debug("Loaded graph document from {}: {} nodes", path, document.graphdict().size());
            return document;
        } catch (IOException e) {
            throw new GraphDocumentException("Failed to parse graph document: " + e.getMessage(),
                path.toString(), e);
        }
    }

    /**
     * Parses a document from a JSON string.
     *
     * @param json document content
     * @return parsed document
     */
    public static GraphDocument fromJson(String json) {
        try {
            GraphDocument document = JSON_MAPPER.readValue(json, GraphDocument.class);
            if (document == null) {
                throw new GraphDocumentException("Graph document is empty", "<string>", null);
            }
            return document;
        } catch (JsonProcessingException e) {
            throw new GraphDocumentException("Failed to parse graph document: " + e.getOriginalMessage(),
                "<string>", e);
        }
    }

    public static String toJson(GraphDocument document) {
        try {
            return JSON_MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new GraphDocumentException("Failed to serialize graph document", "<string>", e);
        }
    }

    /**
     * Writes a document to disk, creating parent directories.
     *
     * @param document document to write
     * @param path target file
     */
    public static void write(GraphDocument document, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            JSON_MAPPER.writeValue(path.toFile(), document);
            log.info("Wrote graph document: {}", path);
        } catch (IOException e) {
            throw new GraphDocumentException("Failed to write graph document", path.toString(), e);
        }
    }
}
