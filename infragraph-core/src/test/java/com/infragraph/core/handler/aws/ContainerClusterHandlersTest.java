package com.infragraph.core.handler.aws;

import com.infragraph.core.handler.HandlerTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link EksClusterHandler} and {@link EcsClusterHandler}.
 */
class ContainerClusterHandlersTest extends HandlerTestBase {

    private static final String CLUSTER = "aws_eks_cluster.main";
    private static final String CONTROL_PLANE = "aws_account.eks_control_plane_main";

    // ==================== EKS ====================

    @Test
    void eks_apply_managedWorkers_clusterMovesToControlPlane() {
        // Given
        edges("aws_vpc.main", "aws_subnet.a");
        edges("aws_subnet.a", CLUSTER, "aws_eks_node_group.workers");
        meta("aws_eks_node_group.workers", Map.of("cluster_name", "${aws_eks_cluster.main.name}"));

        // When
        new EksClusterHandler().apply(graph, AWS);

        // Then
        assertThat(graph.connections("aws_subnet.a")).containsExactly("aws_eks_node_group.workers");
        assertThat(graph.connections(CONTROL_PLANE)).containsExactly(CLUSTER);
        assertThat(graph.connections(CLUSTER)).containsExactly("aws_eks_node_group.workers");
        assertThat(graph.metadata(CONTROL_PLANE)).containsEntry("name", "EKS Service - main");
    }

    @Test
    void eks_apply_nodeGroupOfOtherCluster_isNotLinked() {
        edges(CLUSTER);
        edges("aws_eks_node_group.batch");
        meta("aws_eks_node_group.batch", Map.of("cluster_name", "${aws_eks_cluster.batch.name}"));

        new EksClusterHandler().apply(graph, AWS);

        assertThat(graph.connections(CLUSTER)).isEmpty();
    }

    @Test
    void eks_apply_noManagedWorkers_clusterCopiedPerSubnet() {
        edges("aws_subnet.b", CLUSTER);
        edges("aws_subnet.a", CLUSTER);

        new EksClusterHandler().apply(graph, AWS);

        assertThat(graph.connections("aws_subnet.a")).containsExactly(CLUSTER + "~1");
        assertThat(graph.connections("aws_subnet.b")).containsExactly(CLUSTER + "~2");
        assertThat(graph.connections(CLUSTER)).containsExactly(CLUSTER + "~1", CLUSTER + "~2");
        assertThat(graph.connections(CONTROL_PLANE)).containsExactly(CLUSTER);
    }

    // ==================== ECS ====================

    @Test
    void ecs_apply_autoscalingGroupAcrossSubnets_capacityCopiedPerSubnet() {
        // Given
        edges("aws_subnet.a");
        edges("aws_subnet.b");
        edges("aws_autoscaling_group.ecs", "aws_launch_template.node", "aws_autoscaling_policy.scale");
        meta("aws_autoscaling_group.ecs",
            Map.of("vpc_zone_identifier", List.of("${aws_subnet.a.id}", "${aws_subnet.b.id}")));
        edges("aws_ecs_cluster.main", "aws_ecs_service.api");

        // When
        new EcsClusterHandler().apply(graph, AWS);

        // Then
        assertThat(graph.contains("aws_autoscaling_group.ecs")).isFalse();
        assertThat(graph.contains("aws_launch_template.node")).isFalse();
        assertThat(graph.connections("aws_subnet.a")).containsExactly("aws_autoscaling_group.ecs~1");
        assertThat(graph.connections("aws_autoscaling_group.ecs~2"))
            .containsExactly("aws_launch_template.node~2", "aws_autoscaling_policy.scale~2");
        assertThat(graph.contains("aws_ecs_cluster.main")).isFalse();
        assertThat(graph.contains("aws_ecs_service.api")).isTrue();
    }

    @Test
    void ecs_apply_singleSubnetGroup_keepsCluster() {
        edges("aws_subnet.a");
        edges("aws_autoscaling_group.ecs");
        meta("aws_autoscaling_group.ecs", Map.of("vpc_zone_identifier", List.of("${aws_subnet.a.id}")));
        edges("aws_ecs_cluster.main");

        new EcsClusterHandler().apply(graph, AWS);

        assertThat(graph.contains("aws_autoscaling_group.ecs")).isTrue();
        assertThat(graph.contains("aws_ecs_cluster.main")).isTrue();
    }
}
