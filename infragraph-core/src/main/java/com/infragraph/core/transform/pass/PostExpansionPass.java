package com.infragraph.core.transform.pass;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.provider.ProviderContext;
import com.infragraph.core.transform.GraphPass;
import com.infragraph.core.transform.PipelineContext;

import java.util.HashSet;

/**
 * Runs each provider's {@code post_expansion_handlers}, which need numbered siblings to exist.
 */
public class PostExpansionPass implements GraphPass {

    @Override
    public String name() {
        return "post-expansion";
    }

    @Override
    public void apply(ResourceGraph graph, PipelineContext context) {
        for (ProviderContext provider : context.providers()) {
            SpecialResourcePass.run(graph, provider.getConfigOrEmpty(), provider.getHandlersOrEmpty(),
                provider.getConfigOrEmpty().postExpansionHandlers(), new HashSet<>(), provider.id());
        }
    }
}
