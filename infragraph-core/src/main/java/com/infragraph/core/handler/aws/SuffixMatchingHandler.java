package com.infragraph.core.handler.aws;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.util.ResourceIds;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Re-pairs numbered siblings after multi-instance expansion.
 *
 * <p>Runs after expansion, in this order:
 * <ol>
 *   <li>numbered availability zones keep only the subnets with their own number;</li>
 *   <li>numbered subnets get the security group wrapper with their number;</li>
 *   <li>EC2 instances are linked to the IAM role behind their instance profile;</li>
 *   <li>a NAT gateway shared by numbered public subnets is split into one copy per subnet;</li>
 *   <li>VPCs stop listing subnets that already sit in an availability zone.</li>
 * </ol>
 */
public class SuffixMatchingHandler extends AbstractResourceHandler {

    private static final String ZONE_TYPE = "aws_az";
    private static final String SUBNET_TYPE = "aws_subnet";
    private static final String SECURITY_GROUP_TYPE = "aws_security_group";
    private static final String INSTANCE_TYPE = "aws_instance";
    private static final String PROFILE_TYPE = "aws_iam_instance_profile";
    private static final String ROLE_TYPE = "aws_iam_role";
    private static final String NAT_TYPE = "aws_nat_gateway";
    private static final String VPC_TYPE = "aws_vpc";

    @Override
    public String getId() {
        return "aws-suffix-matching";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        matchZonesToSubnets(graph);
        matchSecurityGroupsToSubnets(graph);
        linkInstancesToRoles(graph);
        splitNatGateways(graph);
        dropZonedSubnetsFromVpcs(graph);
    }

    void matchZonesToSubnets(ResourceGraph graph) {
        for (String zone : graph.findNodes(id -> hasType(id, ZONE_TYPE) && ResourceIds.isNumbered(id))) {
            for (String subnet : List.copyOf(graph.connections(zone))) {
                if (hasType(subnet, SUBNET_TYPE) && !ResourceIds.sameNumbering(zone, subnet)) {
                    graph.disconnect(zone, subnet);
                }
            }
        }
    }

    void matchSecurityGroupsToSubnets(ResourceGraph graph) {
        for (String subnet : graph.findNodes(id -> hasType(id, SUBNET_TYPE) && ResourceIds.isNumbered(id))) {
            String number = ResourceIds.numberOf(subnet).orElseThrow();
            Set<String> bases = new LinkedHashSet<>();
            for (String group : List.copyOf(graph.connections(subnet))) {
                if (!hasType(group, SECURITY_GROUP_TYPE)) {
                    continue;
                }
                bases.add(ResourceIds.baseName(group));
                if (!ResourceIds.sameNumbering(subnet, group)) {
                    graph.disconnect(subnet, group);
                }
            }
            for (String base : bases) {
                String sibling = ResourceIds.numbered(base, number);
                if (graph.contains(sibling)) {
                    graph.connect(subnet, sibling);
                    if (graph.hasConnection(subnet, base)) {
                        graph.disconnect(subnet, base);
                    }
                }
            }
        }
    }

    void linkInstancesToRoles(ResourceGraph graph) {
        for (String instance : graph.findNodes(id -> hasType(id, INSTANCE_TYPE))) {
            for (String profile : List.copyOf(graph.connections(instance))) {
                if (!hasType(profile, PROFILE_TYPE)) {
                    continue;
                }
                Set<String> roles = new LinkedHashSet<>(graph.connections(profile));
                roles.addAll(graph.parentsOf(profile));
                roles.stream()
                    .filter(role -> hasType(role, ROLE_TYPE) && !role.contains("policy"))
                    .forEach(role -> graph.connect(instance, role));
            }
        }
    }

    void splitNatGateways(ResourceGraph graph) {
        for (String nat : graph.findNodes(id -> hasType(id, NAT_TYPE) && !ResourceIds.isNumbered(id))) {
            List<String> publicSubnets = graph.parentsOf(nat).stream()
                .filter(p -> hasType(p, SUBNET_TYPE) && ResourceIds.isNumbered(p))
                .filter(p -> ResourceIds.nameOf(p).contains("public"))
                .toList();
            if (publicSubnets.isEmpty()) {
                continue;
            }
            List<String> copies = new ArrayList<>();
            for (String subnet : publicSubnets) {
                String copy = ResourceIds.numbered(nat, ResourceIds.numberOf(subnet).orElseThrow());
                if (!graph.contains(copy)) {
                    copyNode(graph, nat, copy);
                    graph.setCount(copy, 1);
                }
                graph.disconnect(subnet, nat);
                graph.connect(subnet, copy);
                copies.add(copy);
            }
            for (String parent : graph.parentsOf(nat)) {
                graph.disconnect(parent, nat);
                Optional<String> number = ResourceIds.numberOf(parent);
                for (String copy : copies) {
                    if (number.isEmpty() || ResourceIds.sameNumbering(parent, copy)) {
                        graph.connect(parent, copy);
                    }
                }
            }
            graph.removeNode(nat);
            log.debug("Split {} into {}", nat, copies);
        }
    }

    void dropZonedSubnetsFromVpcs(ResourceGraph graph) {
        for (String vpc : graph.findNodes(id -> hasType(id, VPC_TYPE))) {
            for (String subnet : List.copyOf(graph.connections(vpc))) {
                if (!hasType(subnet, SUBNET_TYPE) || ResourceIds.isNumbered(subnet)) {
                    continue;
                }
                boolean zoned = graph.parentsOf(subnet).stream().anyMatch(p -> hasType(p, ZONE_TYPE));
                if (zoned) {
                    graph.disconnect(vpc, subnet);
                }
            }
        }
    }
}
