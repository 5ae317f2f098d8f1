package com.infragraph.core.handler.aws;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;

import java.util.List;

/**
 * Shows ElastiCache clusters and replication groups in every subnet of their subnet group.
 *
 * <p>Each cluster or replication group gets an empty numbered copy per subnet. The
 * {@code aws_elasticache_subnet_group} itself then moves from the subnets to the VPC, wrapped
 * by the security group of its cache when there is one.
 */
public class ElastiCacheHandler extends AbstractResourceHandler {

    private static final String SUBNET_KEY = "subnet_group_name";

    private final List<SubnetExpansionHandler> expansions = List.of(
        new SubnetExpansionHandler("aws-elasticache-replication-group", "aws_elasticache_replication_group",
            SUBNET_KEY, false),
        new SubnetExpansionHandler("aws-elasticache-cluster", "aws_elasticache_cluster", SUBNET_KEY, false));

    private final DbSubnetGroupHandler subnetGroups = new DbSubnetGroupHandler(
        "aws-elasticache-subnet-group", "aws_elasticache_subnet_group", List.of("aws_elasticache"));

    @Override
    public String getId() {
        return "aws-elasticache";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        for (SubnetExpansionHandler expansion : expansions) {
            expansion.apply(graph, rules);
        }
        subnetGroups.apply(graph, rules);
    }
}
