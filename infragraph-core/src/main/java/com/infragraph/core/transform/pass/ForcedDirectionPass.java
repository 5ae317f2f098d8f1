package com.infragraph.core.transform.pass;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.transform.GraphPass;
import com.infragraph.core.transform.PipelineContext;
import com.infragraph.core.util.ResourceIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reverses edges that point the wrong way for types with a fixed role: databases and instances
 * only receive edges, DNS and event sources only emit them.
 *
 * <p>Edges into a forced origin are kept when they come from a type with an auto-annotation
 * (users in front of DNS), or from a container.
 */
public class ForcedDirectionPass implements GraphPass {

    private static final Logger log = LoggerFactory.getLogger(ForcedDirectionPass.class);

    @Override
    public String name() {
        return "force-direction";
    }

    @Override
    public void apply(ResourceGraph graph, PipelineContext context) {
        RuleConfiguration rules = context.rules();
        List<String[]> reversals = new ArrayList<>();

        for (String node : graph.nodeSnapshot()) {
            if (!ResourceIds.startsWithAny(node, rules.forcedDestination())) {
                continue;
            }
            for (String target : graph.connections(node)) {
                if (!ResourceIds.startsWithAny(target, rules.forcedDestination())
                        && !rules.isGroupType(ResourceIds.typeOf(target))) {
                    reversals.add(new String[] {node, target});
                }
            }
        }
        for (String node : graph.nodeSnapshot()) {
            if (!ResourceIds.startsWithAny(node, rules.forcedOrigin())) {
                continue;
            }
            for (String parent : graph.parentsOf(node)) {
                String parentType = ResourceIds.typeOf(parent);
                if (ResourceIds.startsWithAny(parent, rules.forcedOrigin())
                        || rules.hasAutoAnnotation(parentType)
                        || rules.isGroupType(parentType)) {
                    continue;
                }
                reversals.add(new String[] {parent, node});
            }
        }

        for (String[] edge : reversals) {
            if (graph.disconnect(edge[0], edge[1])) {
                graph.connect(edge[1], edge[0]);
                log.debug("Reversed {} -> {}", edge[0], edge[1]);
            }
        }
    }
}
