package com.infragraph.core.handler.aws;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Attaches DB subnet groups to their VPC rather than to each subnet they span.
 *
 * <p>A subnet group listed under several subnets would otherwise have several group parents.
 * When a database in the group is wrapped by a security group, that security group takes the
 * subnet group's place in the VPC and contains it. The same moves apply to other subnet group
 * types through {@link #DbSubnetGroupHandler(String, String, List)}.
 */
public class DbSubnetGroupHandler extends AbstractResourceHandler {

    private static final String DB_SUBNET_TYPE = "aws_db_subnet_group";
    private static final String SUBNET_TYPE = "aws_subnet";
    private static final String ZONE_TYPE = "aws_az";
    private static final String VPC_TYPE = "aws_vpc";
    private static final String SECURITY_GROUP_TYPE = "aws_security_group";

    private final String id;
    private final String groupType;
    private final List<String> memberPrefixes;

    public DbSubnetGroupHandler() {
        this("aws-db-subnet-group", DB_SUBNET_TYPE, List.of("aws_rds", "aws_db_instance"));
    }

    /**
     * Creates a handler for another subnet group type.
     *
     * @param id handler id
     * @param groupType subnet group resource type
     * @param memberPrefixes prefixes of the members whose security group may wrap the subnet group
     */
    public DbSubnetGroupHandler(String id, String groupType, List<String> memberPrefixes) {
        this.id = id;
        this.groupType = groupType;
        this.memberPrefixes = List.copyOf(memberPrefixes);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        for (String group : graph.findNodes(node -> hasType(node, groupType))) {
            Set<String> vpcs = new LinkedHashSet<>();
            for (String subnet : graph.parentsOf(group)) {
                if (!hasType(subnet, SUBNET_TYPE)) {
                    continue;
                }
                graph.disconnect(subnet, group);
                vpcs.addAll(vpcsAbove(graph, subnet));
            }
            if (vpcs.isEmpty()) {
                continue;
            }
            Optional<String> guard = protectingSecurityGroup(graph, group);
            for (String vpc : vpcs) {
                if (guard.isPresent()) {
                    graph.disconnect(vpc, group);
                    graph.connect(vpc, guard.get());
                    graph.connect(guard.get(), group);
                } else {
                    graph.connect(vpc, group);
                }
            }
            log.debug("Attached {} to {}{}", group, vpcs, guard.map(g -> " through " + g).orElse(""));
        }
    }

    private static Set<String> vpcsAbove(ResourceGraph graph, String subnet) {
        Set<String> vpcs = new LinkedHashSet<>();
        for (String parent : graph.parentsOf(subnet)) {
            if (hasType(parent, VPC_TYPE)) {
                vpcs.add(parent);
            } else if (hasType(parent, ZONE_TYPE)) {
                graph.parentsOf(parent).stream().filter(p -> hasType(p, VPC_TYPE)).forEach(vpcs::add);
            }
        }
        return vpcs;
    }

    private Optional<String> protectingSecurityGroup(ResourceGraph graph, String group) {
        for (String member : List.copyOf(graph.connections(group))) {
            if (memberPrefixes.stream().noneMatch(prefix -> startsWith(member, prefix))) {
                continue;
            }
            Optional<String> guard = graph.parentsOf(member).stream()
                .filter(p -> hasType(p, SECURITY_GROUP_TYPE))
                .findFirst();
            if (guard.isPresent()) {
                return guard;
            }
        }
        return Optional.empty();
    }
}
