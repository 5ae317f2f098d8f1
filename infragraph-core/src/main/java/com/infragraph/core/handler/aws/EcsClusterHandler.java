package com.infragraph.core.handler.aws;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.util.ResourceIds;

import java.util.ArrayList;
import java.util.List;

/**
 * Draws the EC2 capacity behind ECS services.
 *
 * <p>An autoscaling group whose {@code vpc_zone_identifier} spans several subnets is replaced
 * by a numbered copy per subnet. Each copy holds its own numbered copies of the group's launch
 * templates and scaling policies. Once capacity has been expanded this way, the ECS cluster
 * nodes are dropped: the per-subnet groups stand for the cluster. Fargate-only services have
 * no autoscaling group and are left to the generic passes.
 */
public class EcsClusterHandler extends AbstractResourceHandler {

    private static final String CLUSTER_TYPE = "aws_ecs_cluster";
    private static final List<String> CAPACITY_PREFIXES = List.of("aws_launch_template", "aws_autoscaling_policy");

    private final SubnetExpansionHandler autoscalingGroups = SubnetExpansionHandler.autoscalingGroups();

    @Override
    public String getId() {
        return "aws-ecs";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        boolean expanded = false;
        for (String group : sorted(graph.findNodes(id -> hasType(id, "aws_autoscaling_group")))) {
            if (ResourceIds.isNumbered(group)) {
                continue;
            }
            List<String> subnets = autoscalingGroups.subnetsOf(graph, group);
            if (subnets.size() <= 1) {
                continue;
            }
            expandCapacity(graph, group, subnets);
            expanded = true;
        }
        if (expanded) {
            for (String cluster : graph.findNodes(id -> hasType(id, CLUSTER_TYPE))) {
                graph.removeNode(cluster);
                log.debug("Removed {}: capacity drawn per subnet", cluster);
            }
        }
    }

    private void expandCapacity(ResourceGraph graph, String group, List<String> subnets) {
        List<String> capacity = graph.connections(group).stream()
            .filter(child -> CAPACITY_PREFIXES.stream().anyMatch(prefix -> startsWith(child, prefix)))
            .toList();
        List<String> copies = new ArrayList<>();
        for (int i = 1; i <= subnets.size(); i++) {
            String copy = ResourceIds.numbered(group, i);
            graph.setConnections(copy, List.of());
            graph.setMetadata(copy, graph.metadata(group));
            for (String child : capacity) {
                String childCopy = ResourceIds.numbered(child, i);
                copyNode(graph, child, childCopy);
                graph.connect(copy, childCopy);
            }
            graph.connect(subnets.get(i - 1), copy);
            copies.add(copy);
        }
        graph.removeNode(group);
        capacity.forEach(graph::removeNode);
        log.debug("Expanded {} into {}", group, copies);
    }
}
