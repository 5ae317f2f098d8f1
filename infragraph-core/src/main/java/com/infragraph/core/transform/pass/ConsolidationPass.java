package com.infragraph.core.transform.pass;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.transform.GraphPass;
import com.infragraph.core.transform.PipelineContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Merges every member of a consolidated family (listeners, target groups and the load balancer
 * itself, say) into the family's canonical node.
 *
 * <p>The canonical node collects the members' edges and attributes, and every reference to a
 * member is rewritten to it. Running the pass on a consolidated graph changes nothing.
 */
public class ConsolidationPass implements GraphPass {

    private static final Logger log = LoggerFactory.getLogger(ConsolidationPass.class);

    @Override
    public String name() {
        return "consolidate";
    }

    @Override
    public void apply(ResourceGraph graph, PipelineContext context) {
        RuleConfiguration rules = context.rules();
        int merged = 0;
        for (String node : graph.nodeSnapshot()) {
            if (graph.isHidden(node) || !graph.contains(node)) {
                continue;
            }
            Optional<String> canonical = rules.consolidatedNameFor(node);
            if (canonical.isEmpty() || canonical.get().equals(node)) {
                continue;
            }
            mergeAttributes(graph, node, canonical.get());
            graph.renameNode(node, canonical.get());
            merged++;
            log.debug("Consolidated {} into {}", node, canonical.get());
        }
        if (merged > 0) {
            log.debug("Consolidated {} nodes", merged);
        }
    }

    private static void mergeAttributes(ResourceGraph graph, String member, String canonical) {
        Map<String, Object> target = graph.metadata(canonical);
        if (graph.hasMetadata(member)) {
            graph.metadata(member).forEach(target::putIfAbsent);
        }
        graph.originalMetadata(member).forEach(target::putIfAbsent);
    }
}
