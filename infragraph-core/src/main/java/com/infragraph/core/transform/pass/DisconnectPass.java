package com.infragraph.core.transform.pass;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.transform.GraphPass;
import com.infragraph.core.transform.PipelineContext;
import com.infragraph.core.util.ResourceIds;

import java.util.List;

/**
 * Drops the outgoing edges of disconnected types and hides the types excluded from diagrams.
 */
public class DisconnectPass implements GraphPass {

    @Override
    public String name() {
        return "disconnect";
    }

    @Override
    public void apply(ResourceGraph graph, PipelineContext context) {
        RuleConfiguration rules = context.rules();
        for (String node : graph.nodeSnapshot()) {
            if (ResourceIds.startsWithAny(node, rules.disconnectList())) {
                graph.setConnections(node, List.of());
            }
            if (ResourceIds.startsWithAny(node, rules.hideNodes())) {
                graph.hide(node);
            }
        }
    }
}
