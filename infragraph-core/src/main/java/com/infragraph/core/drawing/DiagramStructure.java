package com.infragraph.core.drawing;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The nested group/node/edge structure handed to diagram generators.
 *
 * @param groups containers in creation order
 * @param nodes leaves in creation order
 * @param edges connections in creation order
 */
public record DiagramStructure(
    List<DiagramGroup> groups,
    List<DiagramNode> nodes,
    List<DiagramEdge> edges
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramStructure {
        groups = groups == null ? List.of() : List.copyOf(groups);
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    /**
     * Creates an empty structure.
     *
     * @return structure without elements
     */
    public static DiagramStructure empty() {
        return new DiagramStructure(List.of(), List.of(), List.of());
    }

    public Optional<DiagramGroup> findGroup(String id) {
        return groups.stream().filter(g -> g.id().equals(id)).findFirst();
    }

    public Optional<DiagramNode> findNode(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    /**
     * Returns the ids of the groups and nodes not placed inside any group, groups first.
     *
     * @return top-level ids
     */
    public List<String> rootIds() {
        Set<String> members = new HashSet<>();
        groups.forEach(g -> members.addAll(g.members()));
        List<String> roots = new ArrayList<>();
        groups.stream().map(DiagramGroup::id).filter(id -> !members.contains(id)).forEach(roots::add);
        nodes.stream().map(DiagramNode::id).filter(id -> !members.contains(id)).forEach(roots::add);
        return roots;
    }

    public boolean isEmpty() {
        return groups.isEmpty() && nodes.isEmpty();
    }
}
