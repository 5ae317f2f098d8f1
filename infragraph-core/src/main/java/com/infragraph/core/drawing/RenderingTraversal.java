package com.infragraph.core.drawing;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.util.ResourceIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks the rewritten graph and emits drawing primitives to a {@link DrawingSink}.
 *
 * <p>Resources are visited in the provider's draw order: outer nodes, edge nodes, container
 * types, consolidated families, then everything else. Containers recurse into their members;
 * leaves recurse into the resources they connect to. Each resource becomes exactly one
 * primitive, and each origin/destination pair is connected at most once.
 *
 * <p>When the target of an edge also points back at the origin, the target is drawn as a leaf
 * without following its own edges, which keeps mutual references from recursing forever.
 *
 * <p>A traversal instance renders one graph; create a new one per rendering.
 */
public class RenderingTraversal {

    private static final Logger log = LoggerFactory.getLogger(RenderingTraversal.class);

    private final RuleConfiguration rules;
    private final DrawingSink sink;
    private final EdgePolicy edgePolicy;
    private final EdgeLabelResolver labelResolver;
    private final NodeLabels labels;

    private final Set<String> drawn = new HashSet<>();
    private final Map<String, Set<String>> connected = new HashMap<>();
    private ResourceGraph graph;

    public RenderingTraversal(RuleConfiguration rules, DrawingSink sink) {
        this.rules = rules;
        this.sink = sink;
        this.edgePolicy = new EdgePolicy(rules);
        this.labelResolver = new EdgeLabelResolver(rules);
        this.labels = new NodeLabels(rules);
    }

    /**
     * Renders a graph.
     *
     * @param graph rewritten graph; not modified
     * @throws IllegalStateException if this traversal already rendered a graph
     */
    public void render(ResourceGraph graph) {
        if (this.graph != null) {
            throw new IllegalStateException("RenderingTraversal instances render a single graph");
        }
        this.graph = graph;
        for (List<String> tier : rules.drawOrder()) {
            for (String prefix : tier) {
                for (String node : graph.nodeSnapshot()) {
                    if (isDrawable(node) && !drawn.contains(node)
                            && ResourceIds.stripModule(node).startsWith(prefix)) {
                        draw(node);
                    }
                }
            }
        }
        log.debug("Rendered {} primitives", drawn.size());
    }

    /**
     * Convenience for rendering into a fresh {@link RecordingDrawingSink}.
     *
     * @param graph rewritten graph
     * @param rules rules of the graph's providers
     * @return recorded structure
     */
    public static DiagramStructure record(ResourceGraph graph, RuleConfiguration rules) {
        RecordingDrawingSink sink = new RecordingDrawingSink();
        new RenderingTraversal(rules, sink).render(graph);
        return sink.toStructure();
    }

    private void draw(String node) {
        if (isGroup(node)) {
            drawGroup(node);
        } else {
            drawNode(node);
        }
    }

    private void drawGroup(String group) {
        if (!drawn.add(group)) {
            return;
        }
        sink.createGroup(group, labels.labelOf(group), ResourceIds.typeOf(group));
        for (String member : graph.connections(group)) {
            if (member.equals(group) || !isDrawable(member)) {
                continue;
            }
            draw(member);
            sink.addMember(group, member);
        }
    }

    private void drawNode(String node) {
        if (!drawn.add(node)) {
            return;
        }
        sink.createNode(node, labels.labelOf(node), ResourceIds.typeOf(node));
        for (String target : graph.connections(node)) {
            if (target.equals(node) || !isDrawable(target)) {
                continue;
            }
            if (isGroup(target)) {
                drawGroup(target);
                continue;
            }
            if (graph.hasConnection(target, node)) {
                drawLeaf(target);
            } else {
                drawNode(target);
            }
            connect(node, target);
        }
    }

    private void drawLeaf(String node) {
        if (drawn.add(node)) {
            sink.createNode(node, labels.labelOf(node), ResourceIds.typeOf(node));
        }
    }

    private void connect(String origin, String destination) {
        if (!edgePolicy.okToConnect(origin, destination)) {
            return;
        }
        Set<String> targets = connected.computeIfAbsent(origin, k -> new LinkedHashSet<>());
        if (!targets.add(destination)) {
            return;
        }
        sink.connect(origin, destination,
            edgePolicy.styleOf(graph, origin, destination),
            labelResolver.labelFor(graph, origin, destination));
    }

    private boolean isDrawable(String id) {
        return graph.contains(id) && !graph.isHidden(id);
    }

    private boolean isGroup(String id) {
        return rules.isGroupType(ResourceIds.typeOf(id));
    }
}
