package com.infragraph.core.handler;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.rules.RuleConfiguration;

/**
 * A provider-specific rewrite that repairs one category of relationship the raw inventory
 * does not state directly.
 *
 * <p>Handlers are referenced by id from the {@code special_resources} and
 * {@code post_expansion_handlers} tables of a provider's rules and run once per pipeline
 * when a node matching their prefix exists.
 *
 * <p>Implementations snapshot the nodes they iterate over before mutating the graph. A handler
 * that cannot find a structural anchor it requires throws
 * {@link com.infragraph.core.exception.MissingResourceException}; a handler that merely fails
 * on one candidate logs a warning and moves on.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class RandomStringHandler implements ResourceHandler {
 *     @Override
 *     public String getId() {
 *         return "random-string";
 *     }
 *
 *     @Override
 *     public void apply(ResourceGraph graph, RuleConfiguration rules) {
 *         graph.nodesStartingWith("random_string").forEach(graph::removeNode);
 *     }
 * }
 * }</pre>
 */
public interface ResourceHandler {

    /**
     * Returns the id this handler is referenced by in rule tables.
     *
     * @return handler id, lowercase with dashes
     */
    String getId();

    /**
     * Rewrites the graph in place.
     *
     * @param graph graph owned by the current pipeline run
     * @param rules rules of the provider that dispatched this handler
     * @throws com.infragraph.core.exception.MissingResourceException if a required anchor is absent or ambiguous
     */
    void apply(ResourceGraph graph, RuleConfiguration rules);
}
