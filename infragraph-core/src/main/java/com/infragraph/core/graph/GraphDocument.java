package com.infragraph.core.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.infragraph.core.model.ResourceInventory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Interchange document exchanged with the upstream parser and persisted after the pipeline.
 *
 * <p>Field names follow the established JSON shape ({@code graphdict}, {@code meta_data},
 * {@code original_metadata}, {@code node_list}, {@code hidden}, {@code all_resource}).
 *
 * @param graphdict adjacency map
 * @param metaData working metadata
 * @param originalMetadata raw attributes; defaults to a copy of {@code metaData}
 * @param nodeList resources of the source inventory; defaults to the {@code graphdict} keys
 * @param hidden hidden resource ids
 * @param allResource raw inventory, {@code {file: [{type: {name: attributes}}]}}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphDocument(
    @JsonProperty("graphdict") Map<String, List<String>> graphdict,
    @JsonProperty("meta_data") Map<String, Map<String, Object>> metaData,
    @JsonProperty("original_metadata") Map<String, Map<String, Object>> originalMetadata,
    @JsonProperty("node_list") List<String> nodeList,
    @JsonProperty("hidden") List<String> hidden,
    @JsonProperty("all_resource") Map<String, List<Map<String, Object>>> allResource
) {
    /**
     * Compact constructor applying defaults for optional sections.
     */
    public GraphDocument {
        if (graphdict == null) {
            graphdict = new LinkedHashMap<>();
        }
        if (metaData == null) {
            metaData = new LinkedHashMap<>();
        }
        if (originalMetadata == null) {
            originalMetadata = new LinkedHashMap<>(metaData);
        }
        if (nodeList == null) {
            nodeList = new ArrayList<>(graphdict.keySet());
        }
        if (hidden == null) {
            hidden = new ArrayList<>();
        }
        if (allResource == null) {
            allResource = new LinkedHashMap<>();
        }
    }

    /**
     * Builds a working graph from this document.
     *
     * @return mutable graph
     */
    public ResourceGraph toGraph() {
        return new ResourceGraph(graphdict, metaData, originalMetadata, hidden, nodeList);
    }

    /**
     * Parses the {@code all_resource} section.
     *
     * @return raw inventory
     */
    public ResourceInventory toInventory() {
        return ResourceInventory.fromAllResource(allResource);
    }

    /**
     * Captures a graph together with the inventory section of the source document.
     *
     * @param graph rewritten graph
     * @param allResource raw inventory to carry over
     * @return document snapshot
     */
    public static GraphDocument of(ResourceGraph graph, Map<String, List<Map<String, Object>>> allResource) {
        return new GraphDocument(
            graph.edgesSnapshot(),
            graph.metadataSnapshot(),
            graph.originalMetadataSnapshot(),
            new ArrayList<>(graph.nodeList()),
            new ArrayList<>(graph.hidden()),
            allResource
        );
    }
}
