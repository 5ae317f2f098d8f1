package com.infragraph.core.transform.pass;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.transform.GraphPass;
import com.infragraph.core.transform.PipelineContext;

/**
 * Removes edges from a node to itself, which renames and merges can leave behind.
 */
public class SelfReferencePass implements GraphPass {

    @Override
    public String name() {
        return "self-references";
    }

    @Override
    public void apply(ResourceGraph graph, PipelineContext context) {
        for (String node : graph.nodeSnapshot()) {
            graph.disconnect(node, node);
        }
    }
}
