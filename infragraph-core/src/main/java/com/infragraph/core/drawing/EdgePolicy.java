package com.infragraph.core.drawing;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.util.ResourceIds;

import java.util.Map;

/**
 * Decides whether an edge is drawn, and how.
 *
 * <p>An edge is suppressed when exactly one endpoint is a shared service and neither endpoint is
 * on the always-draw list, or when either endpoint is on the never-draw list. A drawn edge is
 * solid when an endpoint is on the always-draw list, is an edge or boundary type, carries edge
 * labels, or has an auto-annotation; otherwise it is invisible.
 */
public class EdgePolicy {

    /** Metadata key holding a node's edge labels, a map or list of maps keyed by destination. */
    public static final String EDGE_LABELS = "edge_labels";

    private final RuleConfiguration rules;

    public EdgePolicy(RuleConfiguration rules) {
        this.rules = rules;
    }

    /**
     * Checks whether an edge between two resources may exist at all.
     *
     * @param origin origin id
     * @param destination destination id
     * @return false when the edge is suppressed
     */
    public boolean okToConnect(String origin, String destination) {
        if (isNeverDrawn(origin) || isNeverDrawn(destination)) {
            return false;
        }
        boolean originShared = rules.isSharedService(origin);
        boolean destinationShared = rules.isSharedService(destination);
        if (originShared != destinationShared) {
            return isAlwaysDrawn(origin) || isAlwaysDrawn(destination);
        }
        return true;
    }

    /**
     * Picks the style of a permitted edge.
     *
     * @param graph graph being rendered
     * @param origin origin id
     * @param destination destination id
     * @return solid or invisible
     */
    public EdgeStyle styleOf(ResourceGraph graph, String origin, String destination) {
        return alwaysDrawEdge(graph, origin, destination) ? EdgeStyle.SOLID : EdgeStyle.INVISIBLE;
    }

    boolean alwaysDrawEdge(ResourceGraph graph, String origin, String destination) {
        return isSolidEndpoint(graph, origin) || isSolidEndpoint(graph, destination);
    }

    private boolean isSolidEndpoint(ResourceGraph graph, String id) {
        String type = ResourceIds.typeOf(id);
        return isAlwaysDrawn(id)
            || rules.isEdgeType(type)
            || ResourceIds.startsWithAny(id, rules.edgeNodes())
            || hasEdgeLabels(graph, id)
            || rules.hasAutoAnnotation(type);
    }

    private boolean isAlwaysDrawn(String id) {
        return ResourceIds.startsWithAny(id, rules.alwaysDrawLine());
    }

    private boolean isNeverDrawn(String id) {
        return ResourceIds.startsWithAny(id, rules.neverDrawLine());
    }

    private static boolean hasEdgeLabels(ResourceGraph graph, String id) {
        if (!graph.hasMetadata(id)) {
            return false;
        }
        Object labels = graph.metadata(id).get(EDGE_LABELS);
        return labels != null && !(labels instanceof Map<?, ?> map && map.isEmpty());
    }
}
