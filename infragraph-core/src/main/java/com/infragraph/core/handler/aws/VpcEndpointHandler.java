package com.infragraph.core.handler.aws;

import com.infragraph.core.exception.MissingResourceException;
import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens VPC endpoints directly under the single VPC of the inventory.
 *
 * <p>The endpoints lose their own connections and their previous parents. With zero VPCs or
 * more than one the target is ambiguous and a {@link MissingResourceException} is thrown.
 */
public class VpcEndpointHandler extends AbstractResourceHandler {

    private static final String ENDPOINT_TYPE = "aws_vpc_endpoint";
    private static final String VPC_TYPE = "aws_vpc";

    @Override
    public String getId() {
        return "aws-vpc-endpoints";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        List<String> endpoints = graph.findNodes(id -> hasType(id, ENDPOINT_TYPE));
        if (endpoints.isEmpty()) {
            return;
        }
        List<String> vpcs = graph.findNodes(id -> hasType(id, VPC_TYPE));
        if (vpcs.size() != 1) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("handler", getId());
            context.put("resource_type", VPC_TYPE);
            context.put("vpc_count", vpcs.size());
            context.put("endpoint_count", endpoints.size());
            throw new MissingResourceException(
                "VPC endpoints need exactly one VPC to attach to, found " + vpcs.size(), context);
        }

        String vpc = vpcs.get(0);
        for (String endpoint : endpoints) {
            for (String parent : graph.parentsOf(endpoint)) {
                if (!parent.equals(vpc)) {
                    graph.disconnect(parent, endpoint);
                }
            }
            graph.setConnections(endpoint, List.of());
            graph.connect(vpc, endpoint);
        }
        log.debug("Attached {} VPC endpoints to {}", endpoints.size(), vpc);
    }
}
