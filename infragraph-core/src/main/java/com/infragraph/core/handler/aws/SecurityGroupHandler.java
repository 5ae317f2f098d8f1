package com.infragraph.core.handler.aws;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.util.ResourceIds;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns security groups into containers of the resources they protect.
 *
 * <p>The raw inventory has each resource pointing at its security groups. This handler
 * reverses those edges so the security group wraps the resource, then:
 * <ul>
 *   <li>gives each protected resource at most one wrapper per group: a numbered resource gets
 *       the same-numbered wrapper, and a second resource of an already populated group gets its
 *       own {@code <group>_<name>} wrapper;</li>
 *   <li>copies a resource protected by several groups, so no resource ends up under two
 *       wrappers;</li>
 *   <li>moves the wrapper into the containers (subnets, zones) that held the resource;</li>
 *   <li>drops wrappers from the VPC list once they sit in a subnet;</li>
 *   <li>deletes wrappers left without members.</li>
 * </ul>
 * Edges to security group rules are first replaced by the resource the rule points at.
 */
public class SecurityGroupHandler extends AbstractResourceHandler {

    private static final String SECURITY_GROUP_TYPE = "aws_security_group";
    private static final String RULE_TYPE = "aws_security_group_rule";
    private static final String VPC_TYPE = "aws_vpc";

    @Override
    public String getId() {
        return "aws-security-group";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        resolveRules(graph);
        Map<String, List<String>> bindings = collectBindings(graph, rules);
        bindings.forEach((member, groups) -> wrap(graph, rules, member, groups));
        detachFromVpcs(graph, rules);
        int removed = removeEmptyGroups(graph);
        log.debug("Wrapped {} resources in security groups, removed {} empty groups", bindings.size(), removed);
    }

    // ==================== Rules ====================

    private void resolveRules(ResourceGraph graph) {
        for (String group : securityGroups(graph)) {
            for (String connection : List.copyOf(graph.connections(group))) {
                if (!hasType(connection, RULE_TYPE)) {
                    continue;
                }
                graph.disconnect(group, connection);
                graph.connections(connection).stream()
                    .filter(target -> !target.equals(group))
                    .filter(target -> !hasType(target, RULE_TYPE) && !hasType(target, SECURITY_GROUP_TYPE))
                    .findFirst()
                    .ifPresent(target -> graph.connect(group, target));
            }
        }
        for (String rule : graph.findNodes(id -> hasType(id, RULE_TYPE))) {
            if (graph.connections(rule).isEmpty()) {
                graph.removeNode(rule);
            }
        }
    }

    // ==================== Wrapping ====================

    private static Map<String, List<String>> collectBindings(ResourceGraph graph, RuleConfiguration rules) {
        Map<String, List<String>> bindings = new LinkedHashMap<>();
        for (String node : sorted(graph.nodes())) {
            if (hasType(node, SECURITY_GROUP_TYPE) || hasType(node, RULE_TYPE) || isGroup(node, rules)) {
                continue;
            }
            List<String> groups = graph.connections(node).stream()
                .filter(c -> hasType(c, SECURITY_GROUP_TYPE) && graph.contains(c))
                .toList();
            if (!groups.isEmpty()) {
                bindings.put(node, groups);
            }
        }
        return bindings;
    }

    private void wrap(ResourceGraph graph, RuleConfiguration rules, String member, List<String> groups) {
        List<String> containers = graph.parentsOf(member).stream()
            .filter(p -> isGroup(p, rules))
            .filter(p -> !hasType(p, SECURITY_GROUP_TYPE) && !hasType(p, VPC_TYPE))
            .toList();
        groups.forEach(group -> graph.disconnect(member, group));

        for (int index = 0; index < groups.size(); index++) {
            String wrapped = index == 0 ? member : duplicate(graph, member, index + 1);
            String wrapper = wrapperFor(graph, groups.get(index), member);
            graph.connect(wrapper, wrapped);
            for (String container : containers) {
                graph.disconnect(container, member);
                graph.connect(container, wrapper);
            }
        }
    }

    private static String wrapperFor(ResourceGraph graph, String group, String member) {
        String wrapper;
        if (ResourceIds.isNumbered(member)) {
            wrapper = ResourceIds.numbered(group, ResourceIds.numberOf(member).orElseThrow());
        } else if (graph.connections(group).isEmpty()) {
            return group;
        } else {
            wrapper = group + "_" + ResourceIds.nameOf(member);
        }
        if (!graph.contains(wrapper)) {
            graph.addNode(wrapper);
            graph.setMetadata(wrapper, graph.metadata(group));
        }
        return wrapper;
    }

    private static String duplicate(ResourceGraph graph, String member, int index) {
        String copy = ResourceIds.baseName(member) + "_" + index
            + ResourceIds.numberOf(member).map(n -> ResourceIds.NUMBER_SEPARATOR + n).orElse("");
        copyNode(graph, member, copy);
        List<String> kept = new ArrayList<>(graph.connections(copy));
        kept.removeIf(c -> hasType(c, SECURITY_GROUP_TYPE));
        graph.setConnections(copy, kept);
        return copy;
    }

    // ==================== Cleanup ====================

    private static void detachFromVpcs(ResourceGraph graph, RuleConfiguration rules) {
        for (String vpc : graph.findNodes(id -> hasType(id, VPC_TYPE))) {
            for (String group : List.copyOf(graph.connections(vpc))) {
                if (!hasType(group, SECURITY_GROUP_TYPE)) {
                    continue;
                }
                boolean placedElsewhere = graph.parentsOf(group).stream()
                    .anyMatch(p -> !p.equals(vpc) && isGroup(p, rules));
                if (placedElsewhere) {
                    graph.disconnect(vpc, group);
                }
            }
        }
    }

    // Repeats until stable: removing a nested group can empty the group that held it.
    private static int removeEmptyGroups(ResourceGraph graph) {
        int removed = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String group : securityGroups(graph)) {
                boolean empty = graph.connections(group).stream().allMatch(graph::isHidden);
                if (empty) {
                    graph.removeNode(group);
                    removed++;
                    changed = true;
                }
            }
        }
        return removed;
    }

    private static List<String> securityGroups(ResourceGraph graph) {
        return graph.findNodes(id -> hasType(id, SECURITY_GROUP_TYPE));
    }
}
