package com.infragraph.core.graph;

import com.infragraph.core.util.ResourceIds;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Mutable in-memory representation of infrastructure resources and their relationships.
 *
 * <p>The graph is an adjacency map from resource identifier to an ordered list of related
 * identifiers, plus two metadata maps:
 * <ul>
 *   <li><b>metadata</b> - working attributes written by rewrite passes (synthetic {@code count},
 *       edge-label overrides, derived flags)</li>
 *   <li><b>original metadata</b> - raw attributes from the source inventory, never mutated</li>
 * </ul>
 * and a set of hidden identifiers excluded from traversal and validation.
 *
 * <p>Direction of an adjacency entry depends on node classification: a group node lists the
 * nodes it contains, a plain node lists the nodes it connects to.
 *
 * <p>Instances are not thread-safe. One graph is owned by one pipeline run.
 *
 * <pre>{@code
 * ResourceGraph graph = new ResourceGraph();
 * graph.connect("aws_vpc.main", "aws_subnet.a");
 * graph.metadata("aws_subnet.a").put("count", 2);
 * graph.parentsOf("aws_subnet.a"); // [aws_vpc.main]
 * }</pre>
 */
public final class ResourceGraph {

    private final Map<String, List<String>> edges = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> metadata = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> originalMetadata = new LinkedHashMap<>();
    private final Set<String> hidden = new LinkedHashSet<>();
    private final List<String> nodeList = new ArrayList<>();

    public ResourceGraph() {
    }

    /**
     * Creates a graph from raw maps. Inputs are copied.
     *
     * @param edges adjacency map
     * @param metadata working metadata
     * @param originalMetadata raw inventory attributes
     * @param hidden hidden identifiers
     * @param nodeList identifiers of the resources found in the source inventory
     */
    public ResourceGraph(Map<String, List<String>> edges,
                         Map<String, Map<String, Object>> metadata,
                         Map<String, Map<String, Object>> originalMetadata,
                         Collection<String> hidden,
                         Collection<String> nodeList) {
        Objects.requireNonNull(edges, "edges must not be null");
        edges.forEach((k, v) -> this.edges.put(k, new ArrayList<>(v == null ? List.of() : v)));
        if (metadata != null) {
            metadata.forEach((k, v) -> this.metadata.put(k, deepCopy(v)));
        }
        if (originalMetadata != null) {
            originalMetadata.forEach((k, v) -> this.originalMetadata.put(k, deepCopy(v)));
        }
        if (hidden != null) {
            this.hidden.addAll(hidden);
        }
        this.nodeList.addAll(nodeList == null ? edges.keySet() : nodeList);
    }

    // ---------------------------------------------------------------- nodes

    /**
     * Returns a live, read-only view of the node identifiers in insertion order.
     *
     * @return node identifiers
     */
    public Set<String> nodes() {
        return Collections.unmodifiableSet(edges.keySet());
    }

    /**
     * Returns a copy of the node identifiers, safe to iterate while mutating the graph.
     *
     * @return snapshot of node identifiers
     */
    public List<String> nodeSnapshot() {
        return new ArrayList<>(edges.keySet());
    }

    /**
     * Returns a snapshot of nodes whose module-less identifier starts with the prefix.
     *
     * @param prefix identifier prefix, e.g. {@code aws_subnet}
     * @return matching node identifiers
     */
    public List<String> nodesStartingWith(String prefix) {
        return findNodes(id -> ResourceIds.stripModule(id).startsWith(prefix));
    }

    public List<String> findNodes(Predicate<String> filter) {
        List<String> result = new ArrayList<>();
        for (String id : edges.keySet()) {
            if (filter.test(id)) {
                result.add(id);
            }
        }
        return result;
    }

    public boolean contains(String id) {
        return edges.containsKey(id);
    }

    public int size() {
        return edges.size();
    }

    public void addNode(String id) {
        edges.computeIfAbsent(id, k -> new ArrayList<>());
    }

    /**
     * Removes a node and every reference to it.
     *
     * @param id node to remove
     */
    public void removeNode(String id) {
        edges.remove(id);
        for (List<String> targets : edges.values()) {
            targets.removeIf(id::equals);
        }
    }

    /**
     * Renames a node: merges its adjacency into the new identifier, moves its metadata
     * when the target has none, and rewrites every reference.
     *
     * @param from current identifier
     * @param to new identifier
     */
    public void renameNode(String from, String to) {
        if (from.equals(to) || !edges.containsKey(from)) {
            return;
        }
        List<String> moved = edges.remove(from);
        List<String> target = edges.computeIfAbsent(to, k -> new ArrayList<>());
        for (String c : moved) {
            if (!c.equals(to) && !target.contains(c)) {
                target.add(c);
            }
        }
        if (metadata.containsKey(from) && !metadata.containsKey(to)) {
            metadata.put(to, deepCopy(metadata.get(from)));
        }
        replaceReferences(from, to);
    }

    // ---------------------------------------------------------------- edges

    /**
     * Returns a read-only view of a node's adjacency list, empty for unknown nodes.
     *
     * @param id node identifier
     * @return adjacency list
     */
    public List<String> connections(String id) {
        List<String> list = edges.get(id);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    public boolean hasConnection(String from, String to) {
        List<String> list = edges.get(from);
        return list != null && list.contains(to);
    }

    /**
     * Adds {@code from -> to}, creating {@code from} when absent. Duplicates are ignored.
     *
     * @param from origin
     * @param to destination
     * @return true when the edge was added
     */
    public boolean connect(String from, String to) {
        List<String> list = edges.computeIfAbsent(from, k -> new ArrayList<>());
        if (list.contains(to)) {
            return false;
        }
        list.add(to);
        return true;
    }

    public boolean disconnect(String from, String to) {
        List<String> list = edges.get(from);
        return list != null && list.remove(to);
    }

    /**
     * Replaces a node's adjacency list. Duplicates are dropped, order is kept.
     *
     * @param id node identifier
     * @param targets new adjacency list
     */
    public void setConnections(String id, Collection<String> targets) {
        edges.put(id, new ArrayList<>(new LinkedHashSet<>(targets)));
    }

    /**
     * Rewrites every reference to {@code from} into {@code to}, dropping duplicates and
     * self references that the rewrite would create.
     *
     * @param from old identifier
     * @param to replacement identifier
     */
    public void replaceReferences(String from, String to) {
        for (Map.Entry<String, List<String>> entry : edges.entrySet()) {
            List<String> list = entry.getValue();
            int idx = list.indexOf(from);
            if (idx < 0) {
                continue;
            }
            if (list.contains(to) || entry.getKey().equals(to)) {
                list.removeIf(from::equals);
            } else {
                list.set(idx, to);
                list.subList(idx + 1, list.size()).removeIf(from::equals);
            }
        }
    }

    /**
     * Returns the nodes whose adjacency list contains {@code id}, in insertion order.
     *
     * @param id target identifier
     * @return parent identifiers
     */
    public List<String> parentsOf(String id) {
        List<String> parents = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : edges.entrySet()) {
            if (entry.getValue().contains(id)) {
                parents.add(entry.getKey());
            }
        }
        return parents;
    }

    // ---------------------------------------------------------------- metadata

    /**
     * Returns the mutable working metadata for a node, creating an empty map when absent.
     *
     * @param id node identifier
     * @return mutable metadata map
     */
    public Map<String, Object> metadata(String id) {
        return metadata.computeIfAbsent(id, k -> new LinkedHashMap<>());
    }

    /**
     * Gives a node an empty metadata entry unless it already has one.
     *
     * @param id node identifier
     */
    public void ensureMetadata(String id) {
        metadata.computeIfAbsent(id, k -> new LinkedHashMap<>());
    }

    public boolean hasMetadata(String id) {
        return metadata.containsKey(id);
    }

    public void setMetadata(String id, Map<String, Object> values) {
        metadata.put(id, deepCopy(values));
    }

    /**
     * Returns the raw inventory attributes of a node, empty when unknown.
     *
     * @param id node identifier
     * @return read-only attributes
     */
    public Map<String, Object> originalMetadata(String id) {
        Map<String, Object> values = originalMetadata.get(id);
        return values == null ? Map.of() : Collections.unmodifiableMap(values);
    }

    /**
     * Reads an attribute from the working metadata, falling back to the raw attributes.
     *
     * @param id node identifier
     * @param key attribute name
     * @return attribute value or null
     */
    public Object attribute(String id, String key) {
        Map<String, Object> working = metadata.get(id);
        if (working != null && working.get(key) != null) {
            return working.get(key);
        }
        return originalMetadata(id).get(key);
    }

    /**
     * Returns the synthetic or declared replication count of a node, or 0 when unset.
     *
     * @param id node identifier
     * @return count value
     */
    public int count(String id) {
        Map<String, Object> working = metadata.get(id);
        if (working == null) {
            return 0;
        }
        return toInt(working.get("count"));
    }

    public void setCount(String id, int count) {
        metadata(id).put("count", count);
    }

    // ---------------------------------------------------------------- hidden

    public Set<String> hidden() {
        return Collections.unmodifiableSet(hidden);
    }

    public boolean isHidden(String id) {
        return hidden.contains(id);
    }

    public void hide(String id) {
        hidden.add(id);
    }

    public List<String> nodeList() {
        return Collections.unmodifiableList(nodeList);
    }

    // ---------------------------------------------------------------- snapshots

    /**
     * Returns a deep copy of the adjacency map.
     *
     * @return adjacency snapshot
     */
    public Map<String, List<String>> edgesSnapshot() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        edges.forEach((k, v) -> copy.put(k, new ArrayList<>(v)));
        return copy;
    }

    public Map<String, Map<String, Object>> metadataSnapshot() {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        metadata.forEach((k, v) -> copy.put(k, deepCopy(v)));
        return copy;
    }

    public Map<String, Map<String, Object>> originalMetadataSnapshot() {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        originalMetadata.forEach((k, v) -> copy.put(k, deepCopy(v)));
        return copy;
    }

    /**
     * Returns an independent deep copy of this graph.
     *
     * @return copied graph
     */
    public ResourceGraph copy() {
        return new ResourceGraph(edges, metadata, originalMetadata, hidden, nodeList);
    }

    @Override
    public String toString() {
        return "ResourceGraph{nodes=" + edges.size() + ", hidden=" + hidden.size() + "}";
    }

    static int toInt(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source == null) {
            return copy;
        }
        source.forEach((k, v) -> {
            if (v instanceof Map<?, ?> map) {
                copy.put(k, deepCopy((Map<String, Object>) map));
            } else if (v instanceof List<?> list) {
                copy.put(k, new ArrayList<>(list));
            } else {
                copy.put(k, v);
            }
        });
        return copy;
    }
}
