package com.infragraph.core.handler.azure;

import com.infragraph.core.exception.MissingResourceException;
import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.util.ResourceIds;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Places each subnet inside the virtual network named by its {@code virtual_network_name}.
 *
 * <p>Subnets without any virtual network in the inventory cannot be placed and raise a
 * {@link MissingResourceException}. A subnet whose reference matches no network is skipped.
 */
public class VnetSubnetHandler extends AbstractResourceHandler {

    private static final String SUBNET_TYPE = "azurerm_subnet";
    private static final String VNET_TYPE = "azurerm_virtual_network";

    @Override
    public String getId() {
        return "azure-vnet-subnets";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        List<String> subnets = graph.findNodes(id -> hasType(id, SUBNET_TYPE));
        if (subnets.isEmpty()) {
            return;
        }
        List<String> vnets = graph.findNodes(id -> hasType(id, VNET_TYPE));
        if (vnets.isEmpty()) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("handler", getId());
            context.put("resource_type", VNET_TYPE);
            context.put("subnet_count", subnets.size());
            throw new MissingResourceException("Subnets found but no virtual network to place them in", context);
        }

        for (String subnet : subnets) {
            String reference = stringAttribute(graph, subnet, "virtual_network_name");
            if (reference == null) {
                log.warn("Subnet {} has no virtual_network_name", subnet);
                continue;
            }
            Optional<String> vnet = findVnet(graph, reference, vnets);
            if (vnet.isEmpty()) {
                log.warn("No virtual network matches {} for subnet {}", reference, subnet);
                continue;
            }
            graph.connect(vnet.get(), subnet);
            graph.disconnect(subnet, vnet.get());
            graph.metadata(subnet).put("vnet", ResourceIds.stripModule(vnet.get()));
            log.debug("Placed {} in {}", subnet, vnet.get());
        }
    }

    private static Optional<String> findVnet(ResourceGraph graph, String reference, List<String> vnets) {
        Optional<String> byReference = findReferenced(reference, vnets);
        if (byReference.isPresent()) {
            return byReference;
        }
        return vnets.stream()
            .filter(vnet -> reference.equals(stringAttribute(graph, vnet, "name")))
            .findFirst();
    }
}
