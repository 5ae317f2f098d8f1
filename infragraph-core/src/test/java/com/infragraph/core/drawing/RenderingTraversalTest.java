package com.infragraph.core.drawing;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.rules.RuleConfigurationLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link RenderingTraversal} with a {@link RecordingDrawingSink}.
 */
class RenderingTraversalTest {

    private static final RuleConfiguration AWS = RuleConfigurationLoader.load("aws", "providers/aws.yaml");

    private ResourceGraph graph;

    @BeforeEach
    void setUp() {
        graph = new ResourceGraph();
    }

    @Test
    void record_nestedContainers_placesMembersAndRoots() {
        // Given
        graph.connect("aws_vpc.main", "aws_subnet.a");
        graph.connect("aws_subnet.a", "aws_instance.web");
        graph.connect("aws_instance.web", "aws_s3_bucket.assets");
        graph.addNode("aws_s3_bucket.assets");

        // When
        DiagramStructure structure = RenderingTraversal.record(graph, AWS);

        // Then
        assertThat(structure.findGroup("aws_vpc.main")).get()
            .extracting(DiagramGroup::members, DiagramGroup::label)
            .containsExactly(List.of("aws_subnet.a"), "Main (VPC)");
        assertThat(structure.findGroup("aws_subnet.a")).get()
            .extracting(DiagramGroup::members).isEqualTo(List.of("aws_instance.web"));
        assertThat(structure.rootIds()).containsExactly("aws_vpc.main", "aws_s3_bucket.assets");
        assertThat(structure.edges())
            .extracting(DiagramEdge::origin, DiagramEdge::destination, DiagramEdge::style)
            .containsExactly(tuple("aws_instance.web", "aws_s3_bucket.assets", EdgeStyle.INVISIBLE));
    }

    @Test
    void record_mutualReferences_drawEachNodeAndEdgeOnce() {
        graph.connect("aws_lambda_function.a", "aws_lambda_function.b");
        graph.connect("aws_lambda_function.b", "aws_lambda_function.a");

        DiagramStructure structure = RenderingTraversal.record(graph, AWS);

        assertThat(structure.nodes()).extracting(DiagramNode::id)
            .containsExactly("aws_lambda_function.a", "aws_lambda_function.b");
        assertThat(structure.edges()).singleElement()
            .satisfies(edge -> {
                assertThat(edge.origin()).isEqualTo("aws_lambda_function.a");
                assertThat(edge.style()).isEqualTo(EdgeStyle.SOLID);
            });
    }

    @Test
    void record_threeNodeCycle_terminatesAndDrawsEachOnce() {
        // Given
        graph.connect("aws_lambda_function.a", "aws_lambda_function.b");
        graph.connect("aws_lambda_function.b", "aws_lambda_function.c");
        graph.connect("aws_lambda_function.c", "aws_lambda_function.a");

        // When
        DiagramStructure structure = RenderingTraversal.record(graph, AWS);

        // Then
        assertThat(structure.nodes()).extracting(DiagramNode::id)
            .containsExactly("aws_lambda_function.a", "aws_lambda_function.b", "aws_lambda_function.c");
        assertThat(structure.edges())
            .extracting(DiagramEdge::origin, DiagramEdge::destination)
            .containsExactly(
                tuple("aws_lambda_function.c", "aws_lambda_function.a"),
                tuple("aws_lambda_function.b", "aws_lambda_function.c"),
                tuple("aws_lambda_function.a", "aws_lambda_function.b"));
    }

    @Test
    void record_cycleThroughFourNodes_drawsEveryEdgeOnce() {
        graph.connect("aws_lambda_function.a", "aws_lambda_function.b");
        graph.connect("aws_lambda_function.b", "aws_lambda_function.c");
        graph.connect("aws_lambda_function.c", "aws_lambda_function.d");
        graph.connect("aws_lambda_function.d", "aws_lambda_function.a");
        graph.connect("aws_lambda_function.d", "aws_lambda_function.b");

        DiagramStructure structure = RenderingTraversal.record(graph, AWS);

        assertThat(structure.nodes()).hasSize(4);
        assertThat(structure.edges()).hasSize(5)
            .extracting(DiagramEdge::origin, DiagramEdge::destination)
            .doesNotHaveDuplicates()
            .contains(tuple("aws_lambda_function.d", "aws_lambda_function.b"));
    }

    @Test
    void record_neverDrawnEndpoint_nodeKeptEdgeDropped() {
        graph.connect("aws_iam_role.app", "aws_iam_role_policy.logs");
        graph.addNode("aws_iam_role_policy.logs");

        DiagramStructure structure = RenderingTraversal.record(graph, AWS);

        assertThat(structure.findNode("aws_iam_role_policy.logs")).isPresent();
        assertThat(structure.edges()).isEmpty();
    }

    @Test
    void record_sharedServiceEdge_drawnOnlyFromAlwaysDrawnOrigin() {
        graph.connect("aws_lambda_function.f", "aws_kms_key.kms");
        graph.connect("aws_ecs_service.api", "aws_kms_key.kms");
        graph.addNode("aws_kms_key.kms");

        DiagramStructure structure = RenderingTraversal.record(graph, AWS);

        assertThat(structure.edges())
            .extracting(DiagramEdge::origin, DiagramEdge::destination, DiagramEdge::style)
            .containsExactly(tuple("aws_ecs_service.api", "aws_kms_key.kms", EdgeStyle.SOLID));
    }

    @Test
    void record_edgeLabels_attachedAndSolid() {
        graph.connect("aws_s3_bucket.uploads", "aws_sqs_queue.jobs");
        graph.addNode("aws_sqs_queue.jobs");
        graph.metadata("aws_s3_bucket.uploads").put(EdgePolicy.EDGE_LABELS, Map.of("aws_sqs_queue.jobs", "notify"));

        DiagramStructure structure = RenderingTraversal.record(graph, AWS);

        assertThat(structure.edges()).singleElement()
            .satisfies(edge -> {
                assertThat(edge.label()).isEqualTo("notify");
                assertThat(edge.style()).isEqualTo(EdgeStyle.SOLID);
            });
    }

    @Test
    void record_hiddenNodes_areNotDrawn() {
        graph.connect("aws_security_group.web", "aws_security_group_rule.https");
        graph.addNode("aws_security_group_rule.https");
        graph.hide("aws_security_group_rule.https");

        DiagramStructure structure = RenderingTraversal.record(graph, AWS);

        assertThat(structure.findNode("aws_security_group_rule.https")).isEmpty();
        assertThat(structure.findGroup("aws_security_group.web")).get()
            .extracting(DiagramGroup::members).isEqualTo(List.of());
    }

    @Test
    void render_secondGraph_isRejected() {
        RenderingTraversal traversal = new RenderingTraversal(AWS, new RecordingDrawingSink());
        traversal.render(graph);

        assertThatThrownBy(() -> traversal.render(new ResourceGraph()))
            .isInstanceOf(IllegalStateException.class);
    }
}
