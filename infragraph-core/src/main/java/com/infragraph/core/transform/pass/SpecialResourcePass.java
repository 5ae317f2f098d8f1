package com.infragraph.core.transform.pass;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.HandlerSet;
import com.infragraph.core.handler.ResourceHandler;
import com.infragraph.core.provider.ProviderContext;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.rules.RuleConfiguration.SpecialResource;
import com.infragraph.core.transform.GraphPass;
import com.infragraph.core.transform.PipelineContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Dispatches the provider handlers.
 *
 * <p>For each detected provider, its {@code special_resources} entries are walked in declared
 * order. An entry whose prefix matches at least one node runs its handlers, each handler at most
 * once per provider. Handlers receive their own provider's rules.
 */
public class SpecialResourcePass implements GraphPass {

    private static final Logger log = LoggerFactory.getLogger(SpecialResourcePass.class);

    @Override
    public String name() {
        return "special-resources";
    }

    @Override
    public void apply(ResourceGraph graph, PipelineContext context) {
        for (ProviderContext provider : context.providers()) {
            RuleConfiguration rules = provider.getConfigOrEmpty();
            HandlerSet handlers = provider.getHandlersOrEmpty();
            Set<String> ran = new HashSet<>();
            for (SpecialResource special : rules.specialResources()) {
                if (graph.nodesStartingWith(special.prefix()).isEmpty()) {
                    continue;
                }
                run(graph, rules, handlers, special.handlers(), ran, provider.id());
            }
        }
    }

    static void run(ResourceGraph graph, RuleConfiguration rules, HandlerSet handlers,
                    List<String> handlerIds, Set<String> ran, String providerId) {
        for (String handlerId : handlerIds) {
            if (!ran.add(handlerId)) {
                continue;
            }
            Optional<ResourceHandler> handler = handlers.get(handlerId);
            if (handler.isEmpty()) {
                log.warn("Provider '{}' declares unknown handler '{}'", providerId, handlerId);
                continue;
            }
            log.debug("Running handler {} for provider {}", handlerId, providerId);
            handler.get().apply(graph, rules);
        }
    }
}
