package com.infragraph.core.handler.common;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;

import java.util.List;

/**
 * Deletes generated random identifiers, which have no visual counterpart.
 */
public class RandomStringHandler extends AbstractResourceHandler {

    private static final String PREFIX = "random_string.";

    @Override
    public String getId() {
        return "random-string";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        List<String> randoms = graph.nodesStartingWith(PREFIX);
        randoms.forEach(graph::removeNode);
        if (!randoms.isEmpty()) {
            log.debug("Removed {} random_string nodes", randoms.size());
        }
    }
}
