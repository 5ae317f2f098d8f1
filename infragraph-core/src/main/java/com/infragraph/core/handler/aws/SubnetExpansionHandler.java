package com.infragraph.core.handler.aws;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.util.ResourceIds;

import java.util.ArrayList;
import java.util.List;

/**
 * Draws a resource once per subnet it is placed in.
 *
 * <p>The subnets are read from one attribute of the resource, either as subnet references or
 * as a reference to a subnet group whose {@code subnet_ids} list them. A resource placed in
 * several subnets is replaced by numbered copies {@code id~1 .. id~N}, the copy for the n-th
 * subnet in sorted order going into that subnet. Other parents of the resource point at every
 * copy. A resource placed in a single subnet is simply attached to it. Resources that are
 * already numbered are left alone.
 *
 * <p>Copies either take the resource's connections or start empty; the latter suits resources
 * whose copies only show presence in each zone.
 */
public class SubnetExpansionHandler extends AbstractResourceHandler {

    static final String SUBNET_TYPE = "aws_subnet";
    private static final String SUBNET_GROUP_SUFFIX = "_subnet_group";
    private static final String SUBNET_IDS = "subnet_ids";

    private final String id;
    private final String resourceType;
    private final String subnetKey;
    private final boolean inheritConnections;

    /**
     * Creates an expansion handler.
     *
     * @param id handler id
     * @param resourceType exact resource type to expand
     * @param subnetKey attribute listing the subnets
     * @param inheritConnections whether copies take the resource's connections
     */
    public SubnetExpansionHandler(String id, String resourceType, String subnetKey, boolean inheritConnections) {
        this.id = id;
        this.resourceType = resourceType;
        this.subnetKey = subnetKey;
        this.inheritConnections = inheritConnections;
    }

    public static SubnetExpansionHandler eksNodeGroups() {
        return new SubnetExpansionHandler("aws-eks-node-group", "aws_eks_node_group", SUBNET_IDS, true);
    }

    public static SubnetExpansionHandler eksFargateProfiles() {
        return new SubnetExpansionHandler("aws-eks-fargate-profile", "aws_eks_fargate_profile", SUBNET_IDS, true);
    }

    public static SubnetExpansionHandler autoscalingGroups() {
        return new SubnetExpansionHandler("aws-autoscaling-group", "aws_autoscaling_group", "vpc_zone_identifier", true);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        for (String resource : sorted(graph.findNodes(node -> hasType(node, resourceType)))) {
            if (ResourceIds.isNumbered(resource)) {
                continue;
            }
            expand(graph, resource, subnetsOf(graph, resource));
        }
    }

    /**
     * Replaces a resource by one copy per subnet, or attaches it to its only subnet.
     *
     * @param graph graph
     * @param resource resource to expand
     * @param subnets subnets in assignment order
     * @return the copies, or the resource itself when it was not expanded
     */
    List<String> expand(ResourceGraph graph, String resource, List<String> subnets) {
        if (subnets.size() == 1) {
            graph.connect(subnets.get(0), resource);
            return List.of(resource);
        }
        if (subnets.isEmpty()) {
            return List.of(resource);
        }
        List<String> copies = new ArrayList<>();
        for (int i = 0; i < subnets.size(); i++) {
            String copy = ResourceIds.numbered(resource, i + 1);
            graph.setConnections(copy, inheritConnections ? graph.connections(resource) : List.of());
            graph.setMetadata(copy, graph.metadata(resource));
            graph.connect(subnets.get(i), copy);
            copies.add(copy);
        }
        for (String parent : graph.parentsOf(resource)) {
            if (!hasType(parent, SUBNET_TYPE)) {
                copies.forEach(copy -> graph.connect(parent, copy));
            }
        }
        graph.removeNode(resource);
        log.debug("Expanded {} into {} across {}", resource, copies, subnets);
        return copies;
    }

    /**
     * Resolves the subnets a resource is placed in, sorted.
     *
     * @param graph graph
     * @param resource resource identifier
     * @return matching subnet nodes
     */
    List<String> subnetsOf(ResourceGraph graph, String resource) {
        List<String> references = new ArrayList<>();
        List<String> groups = graph.findNodes(node -> ResourceIds.typeOf(node).endsWith(SUBNET_GROUP_SUFFIX));
        for (String reference : stringListAttribute(graph, resource, subnetKey)) {
            List<String> viaGroup = groups.stream()
                .filter(group -> refersTo(reference, group))
                .flatMap(group -> stringListAttribute(graph, group, SUBNET_IDS).stream())
                .toList();
            references.addAll(viaGroup.isEmpty() ? List.of(reference) : viaGroup);
        }
        List<String> subnets = graph.findNodes(node -> hasType(node, SUBNET_TYPE)
            && references.stream().anyMatch(reference -> matchesSubnet(graph, reference, node)));
        return sorted(subnets);
    }

    private static boolean matchesSubnet(ResourceGraph graph, String reference, String subnet) {
        if (refersTo(reference, subnet)) {
            return true;
        }
        String subnetId = stringAttribute(graph, subnet, "id");
        return subnetId != null && reference.contains(subnetId);
    }
}
