package com.infragraph.core.handler.common;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects shared services (key stores, log groups, registries) under one group node named by
 * the provider's {@code shared_services_group}.
 *
 * <p>Members belonging to a consolidated family are listed under their consolidated name,
 * except cluster resources. Running the handler again adds nothing new and never nests groups.
 */
public class SharedServicesHandler extends AbstractResourceHandler {

    @Override
    public String getId() {
        return "shared-services";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        String group = rules.sharedServicesGroup();
        if (group == null || group.isBlank() || rules.sharedServices().isEmpty()) {
            return;
        }

        List<String> members = new ArrayList<>();
        for (String node : sorted(graph.nodes())) {
            if (!node.equals(group) && rules.sharedServices().stream().anyMatch(node::contains)) {
                members.add(node);
            }
        }
        if (members.isEmpty() && !graph.contains(group)) {
            return;
        }

        Set<String> canonical = new LinkedHashSet<>(graph.connections(group));
        for (String member : members) {
            canonical.add(member);
        }
        List<String> result = new ArrayList<>();
        for (String member : canonical) {
            String name = member.contains("cluster")
                ? member
                : rules.consolidatedNameFor(member).orElse(member);
            if (!result.contains(name)) {
                result.add(name);
            }
        }
        graph.setConnections(group, result);
        graph.ensureMetadata(group);
        log.debug("Shared services group {} holds {} members", group, result.size());
    }
}
