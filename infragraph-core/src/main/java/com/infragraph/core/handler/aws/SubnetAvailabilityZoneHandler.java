package com.infragraph.core.handler.aws;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.util.ResourceIds;

/**
 * Groups subnets by availability zone.
 *
 * <p>Each subnet is moved out of its VPC into a synthetic {@code aws_az} node, created once
 * per zone and placed in the VPC. Zone names ending in a letter get a matching instance
 * number ({@code us-east-1b} becomes {@code aws_az.availability_zone_us_east_1b~2}) so the
 * zone pairs up with numbered subnets after expansion.
 */
public class SubnetAvailabilityZoneHandler extends AbstractResourceHandler {

    private static final String SUBNET_TYPE = "aws_subnet";
    private static final String VPC_TYPE = "aws_vpc";
    private static final String ZONE_PREFIX = "aws_az.availability_zone_";

    @Override
    public String getId() {
        return "aws-subnet-az";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        for (String subnet : graph.findNodes(id -> hasType(id, SUBNET_TYPE))) {
            if (graph.isHidden(subnet)) {
                continue;
            }
            String zone = stringAttribute(graph, subnet, "availability_zone");
            if (zone == null) {
                log.warn("Subnet {} has no availability_zone, leaving it in place", subnet);
                continue;
            }
            renameWithZone(graph, subnet, zone);

            String zoneNode = zoneNodeId(zone);
            for (String parent : graph.parentsOf(subnet)) {
                if (!hasType(parent, VPC_TYPE)) {
                    continue;
                }
                graph.disconnect(parent, subnet);
                if (!graph.contains(zoneNode)) {
                    graph.addNode(zoneNode);
                    graph.metadata(zoneNode).put("availability_zone", zone);
                }
                if (graph.count(subnet) > 0) {
                    graph.setCount(zoneNode, graph.count(subnet));
                }
                graph.connect(zoneNode, subnet);
                graph.connect(parent, zoneNode);
                log.debug("Moved {} under {} in {}", subnet, zoneNode, parent);
            }
        }
    }

    /**
     * Builds the zone node identifier for a zone name.
     *
     * @param zone zone name, e.g. {@code eu-west-1a}
     * @return zone node identifier
     */
    static String zoneNodeId(String zone) {
        String id = ZONE_PREFIX + zone.replace('-', '_').replaceAll("[^A-Za-z0-9_]", "_");
        char last = Character.toLowerCase(zone.charAt(zone.length() - 1));
        if (last >= 'a' && last <= 'z') {
            return ResourceIds.numbered(id, last - 'a' + 1);
        }
        return id;
    }

    private static void renameWithZone(ResourceGraph graph, String subnet, String zone) {
        Object name = graph.attribute(subnet, "name");
        if (name == null) {
            return;
        }
        String suffix = "-" + zone;
        String text = String.valueOf(name);
        if (!text.endsWith(suffix)) {
            graph.metadata(subnet).put("name", text + suffix);
        }
    }
}
