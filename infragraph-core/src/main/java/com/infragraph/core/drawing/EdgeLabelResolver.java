package com.infragraph.core.drawing;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.rules.RuleConfiguration.ConsolidatedNode;
import com.infragraph.core.util.ResourceIds;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up edge labels in the origin's {@code edge_labels} metadata.
 *
 * <p>Entries are keyed by destination id. A key matches the destination directly, or through the
 * consolidated node the key belongs to. When the origin has no entry and its family is
 * consolidated, the consolidated node's labels are consulted.
 */
public class EdgeLabelResolver {

    private final RuleConfiguration rules;

    public EdgeLabelResolver(RuleConfiguration rules) {
        this.rules = rules;
    }

    /**
     * Resolves the label for an edge.
     *
     * @param graph graph being rendered
     * @param origin origin id
     * @param destination destination id
     * @return label, empty when none is declared
     */
    public String labelFor(ResourceGraph graph, String origin, String destination) {
        Optional<String> label = lookup(graph, origin, destination);
        if (label.isPresent()) {
            return label.get();
        }
        Optional<String> owner = rules.consolidatedNodeFor(origin).map(ConsolidatedNode::resourceName);
        if (owner.isPresent() && !owner.get().equals(origin)) {
            return lookup(graph, owner.get(), destination).orElse("");
        }
        return "";
    }

    private Optional<String> lookup(ResourceGraph graph, String origin, String destination) {
        if (!graph.hasMetadata(origin)) {
            return Optional.empty();
        }
        for (Map<?, ?> entries : labelMaps(graph.metadata(origin).get(EdgePolicy.EDGE_LABELS))) {
            for (Map.Entry<?, ?> entry : entries.entrySet()) {
                String key = String.valueOf(entry.getKey());
                if (matches(key, destination) && entry.getValue() != null) {
                    return Optional.of(String.valueOf(entry.getValue()));
                }
            }
        }
        return Optional.empty();
    }

    private boolean matches(String key, String destination) {
        if (key.equals(destination) || key.equals(ResourceIds.baseName(destination))) {
            return true;
        }
        return rules.consolidatedNameFor(key)
            .map(name -> name.equals(ResourceIds.baseName(destination)))
            .orElse(false);
    }

    private static List<Map<?, ?>> labelMaps(Object value) {
        List<Map<?, ?>> maps = new ArrayList<>();
        if (value instanceof Map<?, ?> map) {
            maps.add(map);
        } else if (value instanceof Collection<?> items) {
            for (Object item : items) {
                if (item instanceof Map<?, ?> map) {
                    maps.add(map);
                }
            }
        }
        return maps;
    }
}
