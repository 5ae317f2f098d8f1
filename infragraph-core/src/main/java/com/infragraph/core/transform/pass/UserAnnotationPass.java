package com.infragraph.core.transform.pass;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.transform.GraphPass;
import com.infragraph.core.transform.PipelineContext;
import com.infragraph.core.transform.UserAnnotations;
import com.infragraph.core.util.ResourceIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the hand-written {@link UserAnnotations} of the run.
 *
 * <p>Edits run in a fixed order: {@code add}, {@code connect}, {@code disconnect},
 * {@code remove}, {@code update}. A {@code connect} entry written as
 * {@code destination: label} becomes an edge label through the origin's
 * {@code edge_labels} metadata. Keys naming a node that does not exist are logged and skipped.
 */
public class UserAnnotationPass implements GraphPass {

    private static final Logger log = LoggerFactory.getLogger(UserAnnotationPass.class);
    private static final String WILDCARD = "*";
    // Read by the drawing layer's EdgeLabelResolver.
    private static final String EDGE_LABELS = "edge_labels";

    @Override
    public String name() {
        return "user-annotations";
    }

    @Override
    public void apply(ResourceGraph graph, PipelineContext context) {
        UserAnnotations annotations = context.options().annotations();
        if (annotations.title() != null) {
            log.info("Title: {}", annotations.title());
        }
        if (annotations.isEmpty()) {
            return;
        }
        add(graph, annotations.add());
        connect(graph, annotations.connect());
        disconnect(graph, annotations.disconnect());
        remove(graph, annotations.remove());
        update(graph, annotations.update());
    }

    private static void add(ResourceGraph graph, Map<String, Map<String, Object>> nodes) {
        nodes.forEach((node, attributes) -> {
            log.info("+ {}", node);
            graph.addNode(node);
            graph.setMetadata(node, attributes);
        });
    }

    private static void connect(ResourceGraph graph, Map<String, List<Object>> connections) {
        connections.forEach((key, entries) -> {
            List<String> origins = select(graph, key);
            List<Map<String, Object>> labels = new ArrayList<>();
            for (Object entry : entries) {
                String destination = destinationOf(entry);
                if (destination == null) {
                    log.warn("Ignoring connection entry of {}: {}", key, entry);
                    continue;
                }
                if (entry instanceof Map<?, ?> map) {
                    Map<String, Object> label = new LinkedHashMap<>();
                    label.put(destination, map.get(destination) == null ? "" : String.valueOf(map.get(destination)));
                    labels.add(label);
                }
                log.info("{} --> {}", key, destination);
                graph.addNode(destination);
                for (String origin : origins) {
                    if (!origin.equals(destination)) {
                        graph.connect(origin, destination);
                    }
                }
            }
            if (!labels.isEmpty()) {
                for (String origin : origins) {
                    graph.metadata(origin).put(EDGE_LABELS, new ArrayList<>(labels));
                }
            }
        });
    }

    private static void disconnect(ResourceGraph graph, Map<String, List<String>> connections) {
        connections.forEach((key, destinations) -> {
            List<String> origins = select(graph, key);
            for (String destination : destinations) {
                log.info("{} -/-> {}", key, destination);
                origins.forEach(origin -> graph.disconnect(origin, destination));
            }
        });
    }

    private static void remove(ResourceGraph graph, List<String> nodes) {
        for (String key : nodes) {
            for (String node : select(graph, key)) {
                log.info("~ {}", node);
                graph.removeNode(node);
            }
        }
    }

    private static void update(ResourceGraph graph, Map<String, Map<String, Object>> updates) {
        updates.forEach((key, attributes) -> {
            for (String node : select(graph, key)) {
                graph.metadata(node).putAll(attributes);
            }
        });
    }

    /**
     * Resolves an annotation key to the nodes it names.
     *
     * @param graph graph being edited
     * @param key node id, or a prefix followed by {@code *}
     * @return matching nodes, empty when none exist
     */
    static List<String> select(ResourceGraph graph, String key) {
        if (key.contains(WILDCARD)) {
            String prefix = key.substring(0, key.indexOf(WILDCARD));
            return graph.findNodes(id -> ResourceIds.stripModule(id).startsWith(prefix));
        }
        if (!graph.contains(key)) {
            log.warn("Annotation refers to unknown node {}", key);
            return List.of();
        }
        return List.of(key);
    }

    private static String destinationOf(Object entry) {
        if (entry instanceof String destination) {
            return destination.isBlank() ? null : destination;
        }
        if (entry instanceof Map<?, ?> map && map.size() == 1) {
            Object key = map.keySet().iterator().next();
            return key == null ? null : String.valueOf(key);
        }
        return null;
    }
}
