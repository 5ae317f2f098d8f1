package com.infragraph.core.handler.gcp;

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
 * Places subnetworks inside the VPC network they name and records the network mode
 * ({@code auto} when the network creates its own subnetworks, {@code custom} otherwise).
 */
public class NetworkSubnetHandler extends AbstractResourceHandler {

    private static final String SUBNET_TYPE = "google_compute_subnetwork";
    private static final String NETWORK_TYPE = "google_compute_network";

    @Override
    public String getId() {
        return "gcp-network-subnets";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        List<String> subnets = graph.findNodes(id -> hasType(id, SUBNET_TYPE));
        if (subnets.isEmpty()) {
            return;
        }
        List<String> networks = graph.findNodes(id -> hasType(id, NETWORK_TYPE));
        if (networks.isEmpty()) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("handler", getId());
            context.put("resource_type", NETWORK_TYPE);
            context.put("subnet_count", subnets.size());
            throw new MissingResourceException("Subnetworks found but no VPC network to place them in", context);
        }

        for (String subnet : subnets) {
            Optional<String> network = findReferenced(stringAttribute(graph, subnet, "network"), networks);
            if (network.isEmpty()) {
                log.warn("Subnetwork {} does not reference a known network", subnet);
                continue;
            }
            graph.connect(network.get(), subnet);
            graph.disconnect(subnet, network.get());

            Map<String, Object> metadata = graph.metadata(subnet);
            metadata.put("network", ResourceIds.stripModule(network.get()));
            String region = stringAttribute(graph, subnet, "region");
            if (region != null) {
                metadata.put("region", region);
            }
            metadata.put("mode", isAutoMode(graph, network.get()) ? "auto" : "custom");
            log.debug("Placed {} in {}", subnet, network.get());
        }
    }

    private static boolean isAutoMode(ResourceGraph graph, String network) {
        return Boolean.parseBoolean(String.valueOf(graph.attribute(network, "auto_create_subnetworks")));
    }
}
