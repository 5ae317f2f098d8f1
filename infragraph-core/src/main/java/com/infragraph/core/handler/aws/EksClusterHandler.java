package com.infragraph.core.handler.aws;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.util.ResourceIds;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Separates EKS control planes from their worker nodes.
 *
 * <p>Each {@code aws_eks_cluster} moves into an {@code aws_account.eks_control_plane_<name>}
 * group and links to the node groups whose {@code cluster_name} refers to it. When the
 * cluster has managed workers (node groups or Fargate profiles), it leaves the VPC, zones and
 * subnets, where the workers are drawn instead. A cluster without managed workers that sits in
 * several subnets gets a numbered copy per subnet, the cluster node linking to each.
 */
public class EksClusterHandler extends AbstractResourceHandler {

    static final String CLUSTER_TYPE = "aws_eks_cluster";
    private static final String NODE_GROUP_TYPE = "aws_eks_node_group";
    private static final String FARGATE_TYPE = "aws_eks_fargate_profile";
    private static final String CONTROL_PLANE_PREFIX = "aws_account.eks_control_plane_";
    private static final List<String> NETWORK_TYPES = List.of("aws_vpc", "aws_az", "aws_subnet");

    @Override
    public String getId() {
        return "aws-eks";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        List<String> clusters = sorted(graph.findNodes(id -> hasType(id, CLUSTER_TYPE)));
        if (clusters.isEmpty()) {
            return;
        }
        boolean managedWorkers = !graph.findNodes(id -> hasType(id, NODE_GROUP_TYPE) || hasType(id, FARGATE_TYPE))
            .isEmpty();
        for (String cluster : clusters) {
            String controlPlane = controlPlane(graph, cluster);
            if (managedWorkers) {
                leaveNetwork(graph, cluster);
            } else {
                expandAcrossSubnets(graph, cluster);
            }
            graph.connect(controlPlane, cluster);
            linkNodeGroups(graph, cluster);
        }
    }

    private static String controlPlane(ResourceGraph graph, String cluster) {
        String name = ResourceIds.nameOf(cluster);
        String group = CONTROL_PLANE_PREFIX + name;
        if (!graph.contains(group)) {
            graph.addNode(group);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("type", "eks_service");
            metadata.put("name", "EKS Service - " + name);
            graph.setMetadata(group, metadata);
        }
        return group;
    }

    private void leaveNetwork(ResourceGraph graph, String cluster) {
        for (String parent : graph.parentsOf(cluster)) {
            if (NETWORK_TYPES.stream().anyMatch(type -> hasType(parent, type))) {
                graph.disconnect(parent, cluster);
                log.debug("Moved {} out of {}", cluster, parent);
            }
        }
    }

    private void expandAcrossSubnets(ResourceGraph graph, String cluster) {
        List<String> subnets = sorted(graph.parentsOf(cluster).stream()
            .filter(parent -> hasType(parent, SubnetExpansionHandler.SUBNET_TYPE))
            .toList());
        if (subnets.size() <= 1) {
            return;
        }
        for (int i = 0; i < subnets.size(); i++) {
            String copy = ResourceIds.numbered(cluster, i + 1);
            graph.setConnections(copy, List.of());
            graph.setMetadata(copy, graph.metadata(cluster));
            graph.disconnect(subnets.get(i), cluster);
            graph.connect(subnets.get(i), copy);
            graph.connect(cluster, copy);
        }
        log.debug("Expanded {} across {}", cluster, subnets);
    }

    private static void linkNodeGroups(ResourceGraph graph, String cluster) {
        String name = ResourceIds.nameOf(cluster);
        for (String nodeGroup : sorted(graph.findNodes(id -> hasType(id, NODE_GROUP_TYPE)))) {
            String reference = stringAttribute(graph, nodeGroup, "cluster_name");
            if (reference != null && (reference.contains(ResourceIds.baseName(cluster)) || reference.contains(name))) {
                graph.connect(cluster, nodeGroup);
            }
        }
    }
}
