package com.infragraph.core.handler.azure;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;

import java.util.List;
import java.util.Optional;

/**
 * Wraps subnets and network interfaces in the network security groups associated with them.
 *
 * <p>Associations are separate resources
 * ({@code azurerm_subnet_network_security_group_association},
 * {@code azurerm_network_interface_security_group_association}). The security group becomes
 * the parent of the associated resource and takes its place in the containers that held it.
 */
public class NetworkSecurityGroupHandler extends AbstractResourceHandler {

    private static final String NSG_TYPE = "azurerm_network_security_group";
    private static final String SUBNET_ASSOCIATION = "azurerm_subnet_network_security_group_association";
    private static final String NIC_ASSOCIATION = "azurerm_network_interface_security_group_association";
    private static final String SUBNET_TYPE = "azurerm_subnet";
    private static final String NIC_TYPE = "azurerm_network_interface";

    @Override
    public String getId() {
        return "azure-nsg";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        List<String> groups = graph.findNodes(id -> hasType(id, NSG_TYPE));
        if (groups.isEmpty()) {
            return;
        }
        associate(graph, rules, groups, SUBNET_ASSOCIATION, "subnet_id", SUBNET_TYPE);
        associate(graph, rules, groups, NIC_ASSOCIATION, "network_interface_id", NIC_TYPE);
    }

    private void associate(ResourceGraph graph, RuleConfiguration rules, List<String> groups,
                           String associationType, String targetKey, String targetType) {
        List<String> targets = graph.findNodes(id -> hasType(id, targetType));
        for (String association : graph.findNodes(id -> hasType(id, associationType))) {
            Optional<String> group = findReferenced(
                stringAttribute(graph, association, "network_security_group_id"), groups);
            Optional<String> target = findReferenced(stringAttribute(graph, association, targetKey), targets);
            if (group.isEmpty() || target.isEmpty()) {
                log.warn("Association {} does not resolve to a security group and a {}", association, targetType);
                continue;
            }
            wrap(graph, rules, group.get(), target.get());
        }
    }

    private void wrap(ResourceGraph graph, RuleConfiguration rules, String group, String target) {
        for (String container : graph.parentsOf(target)) {
            if (container.equals(group) || !isGroup(container, rules) || graph.hasConnection(target, container)) {
                continue;
            }
            graph.disconnect(container, target);
            if (!graph.hasConnection(group, container)) {
                graph.connect(container, group);
            }
        }
        graph.connect(group, target);
        graph.disconnect(target, group);
        log.debug("Wrapped {} in {}", target, group);
    }
}
